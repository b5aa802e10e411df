package ch.uzh.ifi.scoring.scoretype;

import ch.uzh.ifi.scoring.model.Evaluation;
import ch.uzh.ifi.scoring.model.SubmissionResult;
import ch.uzh.ifi.scoring.model.dao.MaxScores;
import ch.uzh.ifi.scoring.model.dao.ScoreDetails;
import ch.uzh.ifi.scoring.model.dao.SubtaskDetails;
import ch.uzh.ifi.scoring.model.dao.TestcaseDetails;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Score type that splits the testcases into weighted subtasks and scores each
 * subtask by folding its outcomes with a {@link ReductionPolicy}.
 * <p>
 * The subtasks, their testcases and the maximum scores are resolved once, on
 * construction, so a misconfigured task fails before any submission is scored.
 */
@Slf4j
public class GroupScoreType implements ScoreType {

    @Getter
    private final String name;

    private final ReductionPolicy policy;

    private final List<SubtaskParameter> parameters;

    private final Map<String, Boolean> publicTestcases;

    private final List<List<String>> targets;

    private final int rankingPrecision;

    @Getter
    private final MaxScores maxScores;

    public GroupScoreType(String name, ReductionPolicy policy, List<SubtaskParameter> parameters,
                          Map<String, Boolean> publicTestcases, int rankingPrecision) {
        this.name = name;
        this.policy = policy;
        this.parameters = ImmutableList.copyOf(parameters);
        this.publicTestcases = ImmutableMap.copyOf(publicTestcases);
        this.rankingPrecision = rankingPrecision;
        this.parameters.forEach(policy::validate);
        this.targets = retrieveTargetTestcases(this.parameters, this.publicTestcases.keySet().stream().sorted().toList());
        this.maxScores = computeMaxScores();
        log.debug("Built score type {} with {} subtasks and max score {}", name, parameters.size(), maxScores.getMaxScore());
    }

    /**
     * Resolves the codenames of each subtask. Count selectors take consecutive runs of
     * the sorted codenames; pattern selectors take every codename the pattern matches
     * from its start.
     */
    static List<List<String>> retrieveTargetTestcases(List<SubtaskParameter> parameters, List<String> codenames) {
        ImmutableList.Builder<List<String>> targets = ImmutableList.builder();
        if (parameters.stream().allMatch(SubtaskParameter::isCountSelector)) {
            int current = 0;
            for (int index = 0; index < parameters.size(); index++) {
                SubtaskParameter parameter = parameters.get(index);
                int next = current + parameter.getTestcaseCount();
                if (parameter.getTestcaseCount() <= 0)
                    throw new ScoreTypeConfigurationException(
                            "Subtask %d must contain at least one testcase".formatted(index + 1));
                if (next > codenames.size())
                    throw new ScoreTypeConfigurationException("Subtasks require at least %d testcases but only %d are defined"
                            .formatted(next, codenames.size()));
                targets.add(ImmutableList.copyOf(codenames.subList(current, next)));
                current = next;
            }
            return targets.build();
        }
        if (parameters.stream().noneMatch(SubtaskParameter::isCountSelector)) {
            for (SubtaskParameter parameter : parameters) {
                Pattern pattern;
                try {
                    pattern = Pattern.compile(parameter.getTestcasePattern());
                } catch (PatternSyntaxException exception) {
                    throw new ScoreTypeConfigurationException(
                            "Invalid testcase pattern '%s'".formatted(parameter.getTestcasePattern()), exception);
                }
                List<String> target = codenames.stream().filter(codename -> pattern.matcher(codename).lookingAt()).toList();
                if (target.isEmpty())
                    throw new ScoreTypeConfigurationException(
                            "No testcase matches against the pattern '%s'".formatted(parameter.getTestcasePattern()));
                targets.add(target);
            }
            return targets.build();
        }
        throw new ScoreTypeConfigurationException(
                "The testcases of every subtask must be given the same way, either all counts or all patterns");
    }

    /**
     * Decides, for each testcase of a subtask in order, whether its detail may be shown
     * under restricted feedback. A testcase is shown while no earlier public testcase
     * has reached the subtask's worst outcome; private testcases never close the view,
     * otherwise their failures would be observable.
     */
    static List<Boolean> restrictedFeedbackVisibility(List<String> target, List<Double> outcomes,
                                                      Map<String, Boolean> publicTestcases) {
        double worstOutcome = outcomes.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        List<Boolean> visibility = new ArrayList<>(target.size());
        boolean previousAllCorrect = true;
        for (int position = 0; position < target.size(); position++) {
            visibility.add(previousAllCorrect);
            if (publicTestcases.get(target.get(position)) && outcomes.get(position) <= worstOutcome)
                previousAllCorrect = false;
        }
        return visibility;
    }

    private boolean isPublic(List<String> target) {
        return target.stream().allMatch(publicTestcases::get);
    }

    private MaxScores computeMaxScores() {
        double maxScore = 0.0;
        double maxPublicScore = 0.0;
        ImmutableList.Builder<String> headers = ImmutableList.builder();
        for (int index = 0; index < parameters.size(); index++) {
            SubtaskParameter parameter = parameters.get(index);
            maxScore += parameter.getWeight();
            if (isPublic(targets.get(index)))
                maxPublicScore += parameter.getWeight();
            String title = Objects.requireNonNullElse(parameter.getAltTitle(), "Subtask " + (index + 1));
            headers.add("%s (%s)".formatted(title, ScoreFormat.compact(parameter.getWeight())));
        }
        return new MaxScores(maxScore, maxPublicScore, headers.build());
    }

    private Evaluation getEvaluation(Map<String, Evaluation> evaluations, String codename) {
        Evaluation evaluation = evaluations.get(codename);
        if (Objects.isNull(evaluation) || Objects.isNull(evaluation.getOutcome()))
            throw new ScoringIntegrityException("No outcome for testcase %s in an evaluated submission".formatted(codename));
        return evaluation;
    }

    @Override
    public ScoreDetails computeScore(SubmissionResult submissionResult) {
        // Did not even compile
        if (!submissionResult.isEvaluated())
            return new ScoreDetails(0.0, List.of(), 0.0, List.of(),
                    parameters.stream().map(parameter -> ScoreFormat.compact(0.0)).toList());

        Map<String, Evaluation> evaluations = submissionResult.getEvaluationsByCodename();
        double score = 0.0;
        double publicScore = 0.0;
        ImmutableList.Builder<SubtaskDetails> subtasks = ImmutableList.builder();
        ImmutableList.Builder<SubtaskDetails> publicSubtasks = ImmutableList.builder();
        ImmutableList.Builder<String> rankingDetails = ImmutableList.builder();

        for (int index = 0; index < parameters.size(); index++) {
            SubtaskParameter parameter = parameters.get(index);
            List<String> target = targets.get(index);
            List<Evaluation> targetEvaluations = target.stream()
                    .map(codename -> getEvaluation(evaluations, codename)).toList();
            List<Double> outcomes = targetEvaluations.stream().map(Evaluation::getOutcome).toList();
            List<Boolean> visibility = restrictedFeedbackVisibility(target, outcomes, publicTestcases);

            ImmutableList.Builder<TestcaseDetails> testcases = ImmutableList.builder();
            ImmutableList.Builder<TestcaseDetails> publicTestcaseDetails = ImmutableList.builder();
            for (int position = 0; position < target.size(); position++) {
                Evaluation evaluation = targetEvaluations.get(position);
                TestcaseDetails details = new TestcaseDetails(evaluation.getCodename(),
                        policy.classify(evaluation.getOutcome(), parameter).getMessage(), evaluation.getText(),
                        evaluation.getExecutionTime(), evaluation.getExecutionMemory(), visibility.get(position));
                testcases.add(details);
                publicTestcaseDetails.add(publicTestcases.get(target.get(position)) ? details :
                        TestcaseDetails.identifierOnly(target.get(position)));
            }

            // The fraction is kept so that a zero-weight example subtask still renders as correct or not
            double scoreFraction = policy.reduce(outcomes, parameter);
            double subtaskScore = scoreFraction * parameter.getWeight();
            score += subtaskScore;
            SubtaskDetails subtask = new SubtaskDetails(index + 1, scoreFraction, parameter.getWeight(),
                    testcases.build(), parameter.getAltTitle());
            subtasks.add(subtask);
            if (isPublic(target)) {
                publicScore += subtaskScore;
                publicSubtasks.add(subtask);
            } else
                publicSubtasks.add(SubtaskDetails.reduced(index + 1, publicTestcaseDetails.build()));
            rankingDetails.add(ScoreFormat.compact(Precision.round(subtaskScore, rankingPrecision)));
        }
        return new ScoreDetails(score, subtasks.build(), publicScore, publicSubtasks.build(), rankingDetails.build());
    }
}
