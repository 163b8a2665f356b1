package com.phillippitts.hugdimon.service.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.hugdimon.util.HttpErrors;
import com.phillippitts.hugdimon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * {@link CompletionClient} for OpenAI-compatible {@code /chat/completions} endpoints.
 *
 * <p>The assembled prompt is sent as a single user message. HTTP failures are mapped onto
 * {@link ExternalServiceException.Kind}: 429 rate limited, 401/403 auth, 408/504 and socket
 * timeouts timeout, everything else unavailable.
 */
public class OpenAiCompletionClient implements CompletionClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompletionClient.class);
    private static final String SERVICE = "completion";

    private final RestClient restClient;

    public OpenAiCompletionClient(RestClient.Builder builder, CompletionProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getTimeout().toMillis());
        factory.setReadTimeout((int) properties.getTimeout().toMillis());
        RestClient.Builder configured = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(factory);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        this.restClient = configured.build();
    }

    @Override
    public String complete(String prompt, CompletionParams params) {
        ChatRequest request = new ChatRequest(params.model(),
                List.of(new ChatMessage("user", prompt)),
                params.maxOutputTokens(),
                params.temperature());
        long start = System.nanoTime();
        try {
            ChatResponse response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(ChatResponse.class);
            String content = response == null || response.choices() == null || response.choices().isEmpty()
                    || response.choices().get(0).message() == null
                    ? null
                    : response.choices().get(0).message().content();
            if (content == null || content.isBlank()) {
                throw ExternalServiceExceptionBuilder.create("Completion response had no content")
                        .service(SERVICE)
                        .kind(ExternalServiceException.Kind.UNAVAILABLE)
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .build();
            }
            LOG.debug("Completion returned {} chars in {} ms", content.length(), TimeUtils.elapsedMillis(start));
            return content.strip();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw ExternalServiceExceptionBuilder.create("Completion request rejected")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(status))
                    .httpStatus(status)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw ExternalServiceExceptionBuilder.create("Completion request failed")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(e))
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ExternalServiceExceptionBuilder.create("Completion request failed")
                    .service(SERVICE)
                    .kind(ExternalServiceException.Kind.UNAVAILABLE)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        }
    }

    record ChatRequest(String model,
                       List<ChatMessage> messages,
                       @JsonProperty("max_tokens") int maxTokens,
                       double temperature) {
    }

    record ChatMessage(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ChatMessage message) {
    }
}
