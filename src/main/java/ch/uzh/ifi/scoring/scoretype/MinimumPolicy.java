package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.constants.OutcomeLabel;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * A subtask is worth its worst testcase: every testcase must pass for full credit.
 */
@Component
public class MinimumPolicy implements ReductionPolicy {

    public static final String NAME = "GroupMin";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double reduce(List<Double> outcomes, SubtaskParameter parameter) {
        return Collections.min(outcomes);
    }

    @Override
    public OutcomeLabel classify(double outcome, SubtaskParameter parameter) {
        return ReductionPolicy.classifyFraction(outcome);
    }
}
