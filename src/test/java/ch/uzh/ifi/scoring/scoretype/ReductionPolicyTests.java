package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.constants.OutcomeLabel;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReductionPolicyTests {

    private static SubtaskParameter parameter(String json) throws Exception {
        return SubtaskParameter.parse(0, JsonMapper.builder().build().readTree(json));
    }

    @Test
    void minimumPolicyTest() throws Exception {
        MinimumPolicy policy = new MinimumPolicy();
        SubtaskParameter parameter = parameter("[30, 3]");
        assertEquals(0.6, policy.reduce(List.of(1.0, 0.6, 1.0), parameter));
        assertEquals(1.0, policy.reduce(List.of(1.0), parameter));
        assertEquals(OutcomeLabel.NOT_CORRECT, policy.classify(0.0, parameter));
        assertEquals(OutcomeLabel.NOT_CORRECT, policy.classify(-0.5, parameter));
        assertEquals(OutcomeLabel.PARTIALLY_CORRECT, policy.classify(0.01, parameter));
        assertEquals(OutcomeLabel.CORRECT, policy.classify(1.0, parameter));
        assertEquals(OutcomeLabel.CORRECT, policy.classify(1.2, parameter));
    }

    @Test
    void productPolicyTest() throws Exception {
        ProductPolicy policy = new ProductPolicy();
        SubtaskParameter parameter = parameter("[30, 3]");
        assertEquals(0.25, policy.reduce(List.of(0.5, 1.0, 0.5), parameter));
        assertEquals(0.0, policy.reduce(List.of(1.0, 0.0), parameter));
        assertEquals(OutcomeLabel.PARTIALLY_CORRECT, policy.classify(0.5, parameter));
    }

    @Test
    void thresholdPolicyTest() throws Exception {
        ThresholdPolicy policy = new ThresholdPolicy();
        SubtaskParameter parameter = parameter("[30, 3, 0.5]");
        assertEquals(1.0, policy.reduce(List.of(0.0, 0.5, 0.2), parameter));
        assertEquals(0.0, policy.reduce(List.of(0.0, 0.51), parameter));
        assertEquals(0.0, policy.reduce(List.of(-0.1, 0.2), parameter));
        assertEquals(OutcomeLabel.CORRECT, policy.classify(0.5, parameter));
        assertEquals(OutcomeLabel.NOT_CORRECT, policy.classify(0.7, parameter));
    }

    @Test
    void thresholdPolicyRequiresThresholdTest() throws Exception {
        ThresholdPolicy policy = new ThresholdPolicy();
        SubtaskParameter withoutThreshold = parameter("[30, 3]");
        SubtaskParameter titleOnly = parameter("[30, 3, \"Subtask title\"]");
        assertThrows(ScoreTypeConfigurationException.class, () -> policy.validate(withoutThreshold));
        assertThrows(ScoreTypeConfigurationException.class, () -> policy.validate(titleOnly));
    }
}
