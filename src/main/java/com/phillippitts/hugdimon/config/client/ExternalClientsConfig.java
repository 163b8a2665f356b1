package com.phillippitts.hugdimon.config.client;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.config.properties.TranscriptionProperties;
import com.phillippitts.hugdimon.config.properties.TranslationProperties;
import com.phillippitts.hugdimon.service.completion.CompletionClient;
import com.phillippitts.hugdimon.service.completion.OpenAiCompletionClient;
import com.phillippitts.hugdimon.service.language.RemoteTranslator;
import com.phillippitts.hugdimon.service.language.Translator;
import com.phillippitts.hugdimon.service.transcription.RemoteTranscriptionClient;
import com.phillippitts.hugdimon.service.transcription.TranscriptionClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the completion, translation and transcription services.
 *
 * <p>Translation and transcription are only wired when their {@code base-url} is set; leave the
 * property out entirely (not empty) to run without them.
 */
@Configuration
public class ExternalClientsConfig {

    private final ObjectProvider<RestClient.Builder> restClientBuilder;

    public ExternalClientsConfig(ObjectProvider<RestClient.Builder> restClientBuilder) {
        this.restClientBuilder = restClientBuilder;
    }

    @Bean
    public CompletionClient completionClient(CompletionProperties properties) {
        return new OpenAiCompletionClient(builder(), properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hugdimon.translation", name = "base-url")
    public Translator translator(TranslationProperties properties) {
        return new RemoteTranslator(builder(), properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hugdimon.transcription", name = "base-url")
    public TranscriptionClient transcriptionClient(TranscriptionProperties properties) {
        return new RemoteTranscriptionClient(builder(), properties);
    }

    private RestClient.Builder builder() {
        // Boot's builder bean is prototype-scoped; each client gets its own
        return restClientBuilder.getIfAvailable(RestClient::builder);
    }
}
