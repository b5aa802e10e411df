package ch.uzh.ifi.scoring.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.nio.charset.StandardCharsets;

@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringConfigurer {

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Bean
    public MessageSource messageSource(ScoringProperties properties) {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename(properties.getMessagesBasename());
        messageSource.setDefaultEncoding(StandardCharsets.UTF_8.name());
        // Unknown locales fall back to the base catalogue, never to the JVM locale
        messageSource.setFallbackToSystemLocale(false);
        return messageSource;
    }
}
