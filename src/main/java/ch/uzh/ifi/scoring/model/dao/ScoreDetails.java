package ch.uzh.ifi.scoring.model.dao;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything a score type derives from one submission result: the score with its
 * per-subtask breakdown, the same pair restricted to what the contestant may see,
 * and one compact score string per subtask for ranking columns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreDetails {
    Double score;

    List<SubtaskDetails> subtasks;

    @JsonProperty("public_score")
    Double publicScore;

    @JsonProperty("public_subtasks")
    List<SubtaskDetails> publicSubtasks;

    @JsonProperty("ranking_details")
    List<String> rankingDetails;
}
