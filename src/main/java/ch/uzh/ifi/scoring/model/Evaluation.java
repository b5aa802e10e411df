package ch.uzh.ifi.scoring.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * The judged outcome of one submission on one testcase. {@code text} is a status
 * template followed by its substitution arguments.
 */
@Getter
@Setter
@NoArgsConstructor
public class Evaluation {
    public String codename;

    public Double outcome;

    public List<Object> text = new ArrayList<>();

    public Double executionTime;

    public Long executionMemory;

    public Evaluation(String codename, Double outcome, List<Object> text) {
        this.codename = codename;
        this.outcome = outcome;
        this.text = text;
    }
}
