package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.constants.OutcomeLabel;

import java.util.List;

/**
 * Folds the outcomes of a subtask into a score fraction and labels single outcomes.
 * Implementations are stateless and registered under the score-type name they serve.
 */
public interface ReductionPolicy {

    String getName();

    /**
     * @param outcomes   the outcomes of the subtask's testcases, in subtask order, never empty
     * @param parameter  the subtask's parameter
     * @return the fraction of the subtask's weight awarded
     */
    double reduce(List<Double> outcomes, SubtaskParameter parameter);

    OutcomeLabel classify(double outcome, SubtaskParameter parameter);

    /**
     * Checks the policy-specific part of a subtask parameter; called once per subtask
     * when the score type is built.
     */
    default void validate(SubtaskParameter parameter) {
    }

    static OutcomeLabel classifyFraction(double outcome) {
        if (outcome <= 0.0)
            return OutcomeLabel.NOT_CORRECT;
        else if (outcome >= 1.0)
            return OutcomeLabel.CORRECT;
        return OutcomeLabel.PARTIALLY_CORRECT;
    }
}
