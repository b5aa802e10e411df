package ch.uzh.ifi.scoring.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The static judging configuration of a task: its testcases and the score type
 * (name plus JSON parameters) that turns their outcomes into a score.
 */
@Getter
@Setter
public class Dataset {
    public Long id;

    public String description;

    public String scoreType = "GroupMin";

    public String scoreTypeParameters;

    public List<Testcase> testcases = new ArrayList<>();

    public Testcase createTestcase(String codename, boolean isPublic) {
        Testcase newTestcase = new Testcase(codename, isPublic);
        testcases.add(newTestcase);
        return newTestcase;
    }

    /**
     * Visibility of each testcase, keyed and ordered by codename.
     */
    public Map<String, Boolean> getPublicTestcases() {
        Map<String, Boolean> publicTestcases = new TreeMap<>();
        testcases.forEach(testcase -> publicTestcases.put(testcase.getCodename(), testcase.isPublic()));
        return publicTestcases;
    }
}
