package ch.uzh.ifi.scoring.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Getter
@Setter
public class SubmissionResult {
    public Long submissionId;

    public Dataset dataset;

    public String compilationOutcome;

    public String evaluationOutcome;

    public List<Evaluation> evaluations = new ArrayList<>();

    public boolean isCompiled() {
        return Objects.nonNull(compilationOutcome);
    }

    public boolean isEvaluated() {
        return Objects.nonNull(evaluationOutcome);
    }

    public Evaluation addEvaluation(Evaluation newEvaluation) {
        evaluations.add(newEvaluation);
        return newEvaluation;
    }

    public Map<String, Evaluation> getEvaluationsByCodename() {
        Map<String, Evaluation> byCodename = new LinkedHashMap<>();
        evaluations.forEach(evaluation -> byCodename.put(evaluation.getCodename(), evaluation));
        return byCodename;
    }
}
