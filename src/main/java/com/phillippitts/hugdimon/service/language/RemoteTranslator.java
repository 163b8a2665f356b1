package com.phillippitts.hugdimon.service.language;

import com.phillippitts.hugdimon.config.properties.TranslationProperties;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.hugdimon.util.HttpErrors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Translator} for LibreTranslate-compatible services ({@code POST /translate}).
 */
public class RemoteTranslator implements Translator {

    private static final Logger LOG = LogManager.getLogger(RemoteTranslator.class);
    private static final String SERVICE = "translator";

    private final RestClient restClient;
    private final String apiKey;

    public RemoteTranslator(RestClient.Builder builder, TranslationProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getTimeout().toMillis());
        factory.setReadTimeout((int) properties.getTimeout().toMillis());
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(factory)
                .build();
        this.apiKey = properties.getApiKey();
    }

    @Override
    public String translate(String text, String source, String target) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", text);
        body.put("source", source == null ? "auto" : source);
        body.put("target", target);
        body.put("format", "text");
        if (apiKey != null && !apiKey.isBlank()) {
            body.put("api_key", apiKey);
        }
        long start = System.nanoTime();
        try {
            TranslateResponse response = restClient.post()
                    .uri("/translate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(TranslateResponse.class);
            if (response == null || response.translatedText() == null) {
                throw ExternalServiceExceptionBuilder.create("Empty translation response")
                        .service(SERVICE)
                        .kind(ExternalServiceException.Kind.UNAVAILABLE)
                        .build();
            }
            return response.translatedText();
        } catch (RestClientResponseException e) {
            throw ExternalServiceExceptionBuilder.create("Translation request rejected")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(e.getStatusCode().value()))
                    .httpStatus(e.getStatusCode().value())
                    .durationMs((System.nanoTime() - start) / 1_000_000L)
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            LOG.debug("Translator I/O failure: {}", e.getMessage());
            throw ExternalServiceExceptionBuilder.create("Translation request failed")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(e))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ExternalServiceExceptionBuilder.create("Translation request failed")
                    .service(SERVICE)
                    .kind(ExternalServiceException.Kind.UNAVAILABLE)
                    .cause(e)
                    .build();
        }
    }

    record TranslateResponse(String translatedText) {
    }
}
