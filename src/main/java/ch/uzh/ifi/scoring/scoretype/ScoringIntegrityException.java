package ch.uzh.ifi.scoring.scoretype;

/**
 * Raised when an evaluated submission result lacks data for a configured testcase.
 */
public class ScoringIntegrityException extends RuntimeException {

    public ScoringIntegrityException(String message) {
        super(message);
    }
}
