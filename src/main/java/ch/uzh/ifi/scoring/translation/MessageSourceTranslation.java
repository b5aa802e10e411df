package ch.uzh.ifi.scoring.translation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.context.MessageSource;

import java.util.Locale;

@AllArgsConstructor
public class MessageSourceTranslation implements Translation {

    private final MessageSource messageSource;

    @Getter
    private final Locale locale;

    @Override
    public String gettext(String message) {
        return messageSource.getMessage(message, null, message, locale);
    }
}
