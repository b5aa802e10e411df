package ch.uzh.ifi.scoring.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedbackLevel {
    FULL, RESTRICTED;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }

    public boolean isRestricted() {
        return this.equals(RESTRICTED);
    }
}
