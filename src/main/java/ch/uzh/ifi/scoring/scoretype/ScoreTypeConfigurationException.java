package ch.uzh.ifi.scoring.scoretype;

/**
 * Raised while building a score type whose configuration cannot be scored against.
 */
public class ScoreTypeConfigurationException extends RuntimeException {

    public ScoreTypeConfigurationException(String message) {
        super(message);
    }

    public ScoreTypeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
