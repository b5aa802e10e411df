package ch.uzh.ifi.scoring.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

/**
 * Coarse public classification of a testcase outcome. The message is a translation key.
 */
@AllArgsConstructor
public enum OutcomeLabel {
    CORRECT("Correct"),
    PARTIALLY_CORRECT("Partially correct"),
    NOT_CORRECT("Not correct");

    private final String message;

    @JsonValue
    public String getMessage() {
        return message;
    }
}
