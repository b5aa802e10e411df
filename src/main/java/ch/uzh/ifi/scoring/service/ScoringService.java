package ch.uzh.ifi.scoring.service;

import ch.uzh.ifi.scoring.model.Dataset;
import ch.uzh.ifi.scoring.model.Evaluation;
import ch.uzh.ifi.scoring.model.SubmissionResult;
import ch.uzh.ifi.scoring.model.Task;
import ch.uzh.ifi.scoring.model.dao.MaxScores;
import ch.uzh.ifi.scoring.model.dao.ScoreDetails;
import ch.uzh.ifi.scoring.model.dao.SubtaskDetails;
import ch.uzh.ifi.scoring.model.dao.TestcaseDetails;
import ch.uzh.ifi.scoring.scoretype.ScoreType;
import ch.uzh.ifi.scoring.scoretype.ScoreTypeConfigurationException;
import ch.uzh.ifi.scoring.scoretype.ScoreTypeRegistry;
import ch.uzh.ifi.scoring.translation.TranslationProvider;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ScoringService {

    private final ScoreTypeRegistry scoreTypeRegistry;

    private final StatusTextService statusTextService;

    private final TranslationProvider translationProvider;

    private final Map<Long, ScoreType> scoreTypes = new ConcurrentHashMap<>();

    public ScoringService(ScoreTypeRegistry scoreTypeRegistry, StatusTextService statusTextService,
                          TranslationProvider translationProvider) {
        this.scoreTypeRegistry = scoreTypeRegistry;
        this.statusTextService = statusTextService;
        this.translationProvider = translationProvider;
    }

    private ScoreType createScoreType(Dataset dataset) {
        try {
            return scoreTypeRegistry.createScoreType(dataset);
        } catch (ScoreTypeConfigurationException exception) {
            log.error("Invalid score type {} for dataset {}: {}", dataset.getScoreType(), dataset.getId(),
                    exception.getMessage());
            throw exception;
        }
    }

    public ScoreType getScoreType(Dataset dataset) {
        if (Objects.isNull(dataset.getId()))
            return createScoreType(dataset);
        return scoreTypes.computeIfAbsent(dataset.getId(), datasetId -> createScoreType(dataset));
    }

    public void evictScoreType(Long datasetId) {
        if (Objects.nonNull(scoreTypes.remove(datasetId)))
            log.debug("Evicted score type of dataset {}", datasetId);
    }

    public ScoreDetails computeScore(Dataset dataset, SubmissionResult submissionResult) {
        ScoreDetails details = getScoreType(dataset).computeScore(submissionResult);
        log.info("Submission {} scored {} ({} public) on dataset {}", submissionResult.getSubmissionId(),
                details.getScore(), details.getPublicScore(), dataset.getId());
        return details;
    }

    public ScoreDetails computeScore(SubmissionResult submissionResult) {
        return computeScore(submissionResult.getDataset(), submissionResult);
    }

    public MaxScores getMaxScores(Dataset dataset) {
        return getScoreType(dataset).getMaxScores();
    }

    /**
     * The public breakdown as the contestant sees it under the task's feedback level.
     * Restricted feedback keeps the detail of a testcase only when it is flagged as
     * showable; the other rows are reduced to their codename.
     */
    public List<SubtaskDetails> getFeedback(Task task, ScoreDetails details) {
        if (!task.getFeedbackLevel().isRestricted())
            return details.getPublicSubtasks();
        return details.getPublicSubtasks().stream().map(subtask -> new SubtaskDetails(subtask.getIdx(),
                subtask.getScoreFraction(), subtask.getMaxScore(), subtask.getTestcases().stream()
                .map(testcase -> Boolean.TRUE.equals(testcase.getShowInRestrictedFeedback()) ? testcase :
                        TestcaseDetails.identifierOnly(testcase.getCodename())).toList(),
                subtask.getAltTitle())).toList();
    }

    /**
     * Combines the scores of all submissions of a participant on a task according to
     * the task's score mode, rounded to the task's score precision.
     */
    public Double computeTaskScore(Task task, List<ScoreDetails> submissions) {
        double taskScore = switch (task.getScoreMode()) {
            case MAX -> submissions.stream().mapToDouble(ScoreDetails::getScore).max().orElse(0.0);
            case MAX_SUBTASK -> {
                Map<Integer, Double> bestSubtaskScores = new TreeMap<>();
                submissions.forEach(details -> details.getSubtasks().forEach(subtask ->
                        bestSubtaskScores.merge(subtask.getIdx(), subtask.getScore(), Math::max)));
                yield bestSubtaskScores.values().stream().mapToDouble(Double::doubleValue).sum();
            }
        };
        return Precision.round(taskScore, task.getScorePrecision());
    }

    public String formatEvaluationText(Evaluation evaluation, @Nullable Locale locale) {
        return statusTextService.formatStatusText(evaluation.getText(), translationProvider.getTranslation(locale));
    }
}
