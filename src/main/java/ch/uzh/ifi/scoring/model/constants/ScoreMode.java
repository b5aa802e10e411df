package ch.uzh.ifi.scoring.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScoreMode {
    MAX, MAX_SUBTASK;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }
}
