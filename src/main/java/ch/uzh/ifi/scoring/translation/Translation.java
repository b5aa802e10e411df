package ch.uzh.ifi.scoring.translation;

import java.util.Locale;

/**
 * Message lookup for one locale. Unknown messages translate to themselves.
 */
public interface Translation {

    Translation IDENTITY = new Translation() {
        @Override
        public Locale getLocale() {
            return Locale.ROOT;
        }

        @Override
        public String gettext(String message) {
            return message;
        }
    };

    Locale getLocale();

    String gettext(String message);
}
