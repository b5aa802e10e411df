package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.config.ScoringProperties;
import ch.uzh.ifi.scoring.model.Dataset;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.AllArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds score types from a dataset's configuration, picking the reduction policy
 * registered under the dataset's score-type name.
 */
@Component
@AllArgsConstructor
public class ScoreTypeRegistry {

    private List<ReductionPolicy> policies;

    private JsonMapper jsonMapper;

    private ScoringProperties scoringProperties;

    public List<String> getNames() {
        return policies.stream().map(ReductionPolicy::getName).sorted().toList();
    }

    public ReductionPolicy getPolicy(String name) {
        return policies.stream().filter(policy -> policy.getName().equals(name)).findFirst().orElseThrow(() ->
                new ScoreTypeConfigurationException("Unknown score type %s, expected one of %s".formatted(name, getNames())));
    }

    public List<SubtaskParameter> parseParameters(String parameters) {
        if (StringUtils.isBlank(parameters))
            throw new ScoreTypeConfigurationException("Missing score type parameters");
        JsonNode root;
        try {
            root = jsonMapper.readTree(parameters);
        } catch (JsonProcessingException exception) {
            throw new ScoreTypeConfigurationException("Score type parameters are not valid JSON: " + parameters, exception);
        }
        if (!root.isArray())
            throw new ScoreTypeConfigurationException("Score type parameters must be a list of subtasks: " + parameters);
        List<SubtaskParameter> subtasks = new ArrayList<>();
        for (int index = 0; index < root.size(); index++)
            subtasks.add(SubtaskParameter.parse(index, root.get(index)));
        return subtasks;
    }

    public ScoreType createScoreType(Dataset dataset) {
        ReductionPolicy policy = getPolicy(dataset.getScoreType());
        return new GroupScoreType(dataset.getScoreType(), policy, parseParameters(dataset.getScoreTypeParameters()),
                dataset.getPublicTestcases(), scoringProperties.getRankingPrecision());
    }
}
