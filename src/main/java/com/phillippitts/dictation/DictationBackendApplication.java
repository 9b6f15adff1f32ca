package com.phillippitts.dictation;

import com.phillippitts.dictation.config.ThreadPoolProperties;
import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.config.stt.ParakeetServerConfig;
import com.phillippitts.dictation.config.stt.StreamingProperties;
import com.phillippitts.dictation.config.stt.WhisperServerConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StreamingProperties.class,
        WhisperServerConfig.class,
        ParakeetServerConfig.class,
        ProvisioningProperties.class,
        ThreadPoolProperties.class
})
public class DictationBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(DictationBackendApplication.class, args);
    }

}
