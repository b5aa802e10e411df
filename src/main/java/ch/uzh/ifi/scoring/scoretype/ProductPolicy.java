package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.constants.OutcomeLabel;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ProductPolicy implements ReductionPolicy {

    public static final String NAME = "GroupMul";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double reduce(List<Double> outcomes, SubtaskParameter parameter) {
        return outcomes.stream().reduce(1.0, (product, outcome) -> product * outcome);
    }

    @Override
    public OutcomeLabel classify(double outcome, SubtaskParameter parameter) {
        return ReductionPolicy.classifyFraction(outcome);
    }
}
