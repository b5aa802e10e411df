package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.SubmissionResult;
import ch.uzh.ifi.scoring.model.dao.MaxScores;
import ch.uzh.ifi.scoring.model.dao.ScoreDetails;

/**
 * Turns the evaluations of a submission into its score. Instances are immutable and
 * safe to share between threads; {@link #computeScore} is a pure function of its input.
 */
public interface ScoreType {

    String getName();

    ScoreDetails computeScore(SubmissionResult submissionResult);

    MaxScores getMaxScores();
}
