package ch.uzh.ifi.scoring.service;

import ch.uzh.ifi.scoring.translation.Translation;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders status texts, lists whose first element is a printf-like template and whose
 * remaining elements fill its placeholders, in the language of a {@link Translation}.
 */
@Slf4j
@Service
public class StatusTextService {

    public static final String NOT_AVAILABLE = "N/A";

    // Checked in order, the first matching prefix wins
    private static final Map<String, String> SIMPLE_STATUS_TEXTS = ImmutableMap.of(
            "Evaluation didn't produce file", "Output file was not produced. Check you are creating the output file "
                    + "with name given in the problem statement. You may wish to use or consult the templates for this problem.",
            "Execution timed out", "Time limit exceeded before your program finished. "
                    + "This may be due to an infinite loop/recursion, or your algorithm may be too slow for this subtask",
            "Execution killed", "Program crashed. Possibly due to accessing or requesting invalid memory "
                    + "(e.g. out-of-bounds array access)",
            "Execution failed because the return code was nonzero", "Your program did not finish successfully "
                    + "(return code nonzero). Possibly due to an Exception or Error being thrown.");

    private static final Pattern FORMAT_SPECIFIER = Pattern.compile("%(\\d+\\$)?[-#+ 0,(<]*\\d*(\\.\\d+)?[tT]?([a-zA-Z%])");

    /**
     * Replaces known sandbox failure messages with guidance for the contestant.
     */
    public static Optional<String> getSimpleStatusText(String template) {
        return SIMPLE_STATUS_TEXTS.entrySet().stream().filter(entry -> StringUtils.startsWith(template, entry.getKey()))
                .map(Map.Entry::getValue).findFirst();
    }

    private static void checkArguments(String text, int argumentCount) {
        Matcher matcher = FORMAT_SPECIFIER.matcher(text);
        int placeholders = 0;
        while (matcher.find())
            if (!StringUtils.equalsAny(matcher.group(3), "%", "n"))
                placeholders++;
        if (placeholders != argumentCount)
            throw new IllegalArgumentException("Template '%s' takes %d arguments but %d were given"
                    .formatted(text, placeholders, argumentCount));
    }

    /**
     * Formats a status text, never failing: a malformed status is logged and rendered
     * as the translation of {@value #NOT_AVAILABLE}. Templates replaced by guidance
     * drop their arguments.
     */
    public String formatStatusText(Object status, Translation translation) {
        try {
            if (!(status instanceof List<?> parts) || parts.isEmpty())
                throw new IllegalArgumentException("Status text must be a non-empty list");
            if (!(parts.get(0) instanceof String template))
                throw new IllegalArgumentException("Status text must start with a template");
            Optional<String> guidance = getSimpleStatusText(template);
            if (guidance.isPresent())
                return translation.gettext(guidance.get());
            // The empty message is reserved by the catalogues
            String text = template.isEmpty() ? "" : translation.gettext(template);
            List<?> arguments = parts.subList(1, parts.size());
            checkArguments(text, arguments.size());
            return String.format(translation.getLocale(), text, arguments.toArray());
        } catch (IllegalArgumentException exception) {
            log.error("Unexpected error when formatting status text: {}", status, exception);
            return translation.gettext(NOT_AVAILABLE);
        }
    }
}
