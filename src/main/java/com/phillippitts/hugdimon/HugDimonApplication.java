package com.phillippitts.hugdimon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.hugdimon.config.properties.SessionProperties.class,
        com.phillippitts.hugdimon.config.properties.CompletionProperties.class,
        com.phillippitts.hugdimon.config.properties.PromptProperties.class,
        com.phillippitts.hugdimon.config.properties.RetrievalProperties.class,
        com.phillippitts.hugdimon.config.properties.LanguageProperties.class,
        com.phillippitts.hugdimon.config.properties.TranslationProperties.class,
        com.phillippitts.hugdimon.config.properties.TranscriptionProperties.class,
        com.phillippitts.hugdimon.config.properties.DialogProperties.class,
        com.phillippitts.hugdimon.config.properties.InputProperties.class,
        com.phillippitts.hugdimon.config.properties.ProverbProperties.class
})
@EnableScheduling
public class HugDimonApplication {

    public static void main(String[] args) {
        SpringApplication.run(HugDimonApplication.class, args);
    }

}
