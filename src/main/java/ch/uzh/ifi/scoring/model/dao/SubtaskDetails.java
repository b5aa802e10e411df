package ch.uzh.ifi.scoring.model.dao;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Breakdown of one subtask. A reduced public view only has the index and the
 * testcase rows; score fields are then null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubtaskDetails {
    Integer idx;

    @JsonProperty("score_fraction")
    Double scoreFraction;

    @JsonProperty("max_score")
    Double maxScore;

    List<TestcaseDetails> testcases;

    @JsonProperty("alt_title")
    String altTitle;

    public static SubtaskDetails reduced(Integer idx, List<TestcaseDetails> testcases) {
        return new SubtaskDetails(idx, null, null, testcases, null);
    }

    @JsonIgnore
    public boolean isReduced() {
        return Objects.isNull(scoreFraction);
    }

    @JsonIgnore
    public Double getScore() {
        return isReduced() ? null : scoreFraction * maxScore;
    }
}
