package com.phillippitts.dictation.config.stt;

import com.phillippitts.dictation.service.stt.streaming.ConfiguredTokenRefresher;
import com.phillippitts.dictation.service.stt.streaming.TokenRefresher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the streaming session's credential source. A host application that issues short-lived
 * tokens registers its own {@link TokenRefresher} bean and replaces the configured one.
 */
@Configuration
public class StreamingConfig {

    @Bean
    @ConditionalOnMissingBean(TokenRefresher.class)
    public TokenRefresher tokenRefresher(StreamingProperties properties) {
        return new ConfiguredTokenRefresher(properties);
    }
}
