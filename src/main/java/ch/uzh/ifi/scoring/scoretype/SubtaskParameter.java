package ch.uzh.ifi.scoring.scoretype;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One parsed element of a score type's parameters, {@code [weight, selector, extra..., alt_title?]}.
 * The selector is either a testcase count or a codename regular expression.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubtaskParameter {

    private final double weight;

    private final Integer testcaseCount;

    private final String testcasePattern;

    private final List<JsonNode> extra;

    private final String altTitle;

    public static SubtaskParameter parse(int index, JsonNode node) {
        if (Objects.isNull(node) || !node.isArray() || node.size() < 2)
            throw new ScoreTypeConfigurationException(
                    "Subtask %d: expected an array [weight, testcases, ...] but got %s".formatted(index + 1, node));
        JsonNode weight = node.get(0);
        if (!weight.isNumber() || weight.asDouble() < 0)
            throw new ScoreTypeConfigurationException(
                    "Subtask %d: the weight must be a non-negative number, got %s".formatted(index + 1, weight));
        JsonNode selector = node.get(1);
        Integer testcaseCount = null;
        String testcasePattern = null;
        if (selector.isIntegralNumber())
            testcaseCount = selector.asInt();
        else if (selector.isTextual())
            testcasePattern = selector.asText();
        else
            throw new ScoreTypeConfigurationException(
                    "Subtask %d: testcases must be a count or a regular expression, got %s".formatted(index + 1, selector));
        List<JsonNode> extra = new ArrayList<>();
        node.forEach(extra::add);
        extra = extra.subList(2, extra.size());
        String altTitle = null;
        if (!extra.isEmpty() && extra.get(extra.size() - 1).isTextual()) {
            altTitle = extra.get(extra.size() - 1).asText();
            extra = extra.subList(0, extra.size() - 1);
        }
        return new SubtaskParameter(weight.asDouble(), testcaseCount, testcasePattern, ImmutableList.copyOf(extra), altTitle);
    }

    public boolean isCountSelector() {
        return Objects.nonNull(testcaseCount);
    }

    public double getExtraNumber(int position) {
        if (position >= extra.size() || !extra.get(position).isNumber())
            throw new ScoreTypeConfigurationException(
                    "Expected a number at extra parameter position %d, got %s".formatted(position, extra));
        return extra.get(position).asDouble();
    }
}
