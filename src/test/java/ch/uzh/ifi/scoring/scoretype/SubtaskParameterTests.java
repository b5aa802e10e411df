package ch.uzh.ifi.scoring.scoretype;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubtaskParameterTests {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    private SubtaskParameter parse(String json) throws Exception {
        return SubtaskParameter.parse(0, jsonMapper.readTree(json));
    }

    @Test
    void countSelectorWithTitleTest() throws Exception {
        SubtaskParameter parameter = parse("[12.5, 4, \"Small inputs\"]");
        assertEquals(12.5, parameter.getWeight());
        assertTrue(parameter.isCountSelector());
        assertEquals(4, parameter.getTestcaseCount());
        assertEquals("Small inputs", parameter.getAltTitle());
        assertTrue(parameter.getExtra().isEmpty());
    }

    @Test
    void patternSelectorWithExtraTest() throws Exception {
        SubtaskParameter parameter = parse("[20, \"big_.*\", 0.25]");
        assertFalse(parameter.isCountSelector());
        assertEquals("big_.*", parameter.getTestcasePattern());
        assertNull(parameter.getAltTitle());
        assertEquals(0.25, parameter.getExtraNumber(0));
    }

    @Test
    void malformedParametersTest() {
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("[20]"));
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("{\"weight\": 20}"));
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("[\"20\", 3]"));
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("[-5, 3]"));
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("[20, 1.5]"));
        assertThrows(ScoreTypeConfigurationException.class, () -> parse("[20, [1, 2]]"));
    }
}
