package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.constants.OutcomeLabel;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Outcomes are raw measurements (e.g. an error) that are acceptable when they lie in
 * {@code [0, threshold]}. The threshold is the first extra value of the subtask
 * parameter. A subtask is all or nothing.
 */
@Component
public class ThresholdPolicy implements ReductionPolicy {

    public static final String NAME = "GroupThreshold";

    @Override
    public String getName() {
        return NAME;
    }

    private boolean isAccepted(double outcome, SubtaskParameter parameter) {
        return 0.0 <= outcome && outcome <= parameter.getExtraNumber(0);
    }

    @Override
    public double reduce(List<Double> outcomes, SubtaskParameter parameter) {
        return outcomes.stream().allMatch(outcome -> isAccepted(outcome, parameter)) ? 1.0 : 0.0;
    }

    @Override
    public OutcomeLabel classify(double outcome, SubtaskParameter parameter) {
        return isAccepted(outcome, parameter) ? OutcomeLabel.CORRECT : OutcomeLabel.NOT_CORRECT;
    }

    @Override
    public void validate(SubtaskParameter parameter) {
        parameter.getExtraNumber(0);
    }
}
