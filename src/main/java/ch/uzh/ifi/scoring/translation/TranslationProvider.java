package ch.uzh.ifi.scoring.translation;

import ch.uzh.ifi.scoring.config.ScoringProperties;
import lombok.AllArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
@AllArgsConstructor
public class TranslationProvider {

    private MessageSource messageSource;

    private ScoringProperties scoringProperties;

    public Translation getTranslation(@Nullable Locale locale) {
        return new MessageSourceTranslation(messageSource,
                Optional.ofNullable(locale).orElseGet(scoringProperties::getDefaultLocale));
    }

    public Translation getDefaultTranslation() {
        return getTranslation(null);
    }
}
