package ch.uzh.ifi.scoring.model;

import ch.uzh.ifi.scoring.model.constants.FeedbackLevel;
import ch.uzh.ifi.scoring.model.constants.ScoreMode;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Task {
    public Long id;

    public String name;

    public String title;

    public ScoreMode scoreMode = ScoreMode.MAX;

    public Integer scorePrecision = 0;

    public FeedbackLevel feedbackLevel = FeedbackLevel.RESTRICTED;

    public Dataset activeDataset;
}
