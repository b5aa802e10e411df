package ch.uzh.ifi.scoring.model.dao;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One testcase row of a subtask breakdown. Rows of private testcases in a public
 * breakdown carry only the codename.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestcaseDetails {
    @JsonProperty("idx")
    String codename;

    String outcome;

    List<Object> text;

    Double time;

    Long memory;

    @JsonProperty("show_in_restricted_feedback")
    Boolean showInRestrictedFeedback;

    public static TestcaseDetails identifierOnly(String codename) {
        TestcaseDetails details = new TestcaseDetails();
        details.setCodename(codename);
        return details;
    }

    @JsonIgnore
    public boolean isIdentifierOnly() {
        return outcome == null && text == null && time == null && memory == null && showInRestrictedFeedback == null;
    }
}
