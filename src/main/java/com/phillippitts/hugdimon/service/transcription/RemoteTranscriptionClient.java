package com.phillippitts.hugdimon.service.transcription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phillippitts.hugdimon.config.properties.TranscriptionProperties;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.hugdimon.util.HttpErrors;
import com.phillippitts.hugdimon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link TranscriptionClient} posting raw audio to {@code POST /transcribe} and reading
 * {@code {"text": "...", "language": "en"}}.
 */
public class RemoteTranscriptionClient implements TranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(RemoteTranscriptionClient.class);
    private static final String SERVICE = "transcription";

    private final RestClient restClient;

    public RemoteTranscriptionClient(RestClient.Builder builder, TranscriptionProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getTimeout().toMillis());
        factory.setReadTimeout((int) properties.getTimeout().toMillis());
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(factory)
                .build();
    }

    @Override
    public Transcript transcribe(byte[] audio) {
        long start = System.nanoTime();
        try {
            TranscribeResponse response = restClient.post()
                    .uri("/transcribe")
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .body(audio)
                    .retrieve()
                    .body(TranscribeResponse.class);
            if (response == null || response.text() == null) {
                throw ExternalServiceExceptionBuilder.create("Empty transcription response")
                        .service(SERVICE)
                        .kind(ExternalServiceException.Kind.UNAVAILABLE)
                        .build();
            }
            LOG.info("Transcribed {} bytes in {} ms (language {})", audio.length,
                    TimeUtils.elapsedMillis(start), response.language());
            return new Transcript(response.text().strip(), response.language());
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw ExternalServiceExceptionBuilder.create("Transcription request rejected")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(status))
                    .httpStatus(status)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw ExternalServiceExceptionBuilder.create("Transcription request failed")
                    .service(SERVICE)
                    .kind(HttpErrors.kindOf(e))
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ExternalServiceExceptionBuilder.create("Transcription request failed")
                    .service(SERVICE)
                    .kind(ExternalServiceException.Kind.UNAVAILABLE)
                    .cause(e)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscribeResponse(String text, String language) {
    }
}
