package ch.uzh.ifi.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {
    private Locale defaultLocale = Locale.ENGLISH;
    private String messagesBasename = "messages";
    private Integer rankingPrecision = 2;
}
