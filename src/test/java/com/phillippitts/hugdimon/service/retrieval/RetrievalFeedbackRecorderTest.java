package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.service.metrics.ConversationMetrics;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import com.phillippitts.hugdimon.service.session.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RetrievalFeedbackRecorderTest {

    @Test
    void verdictsAreCountedByHelpfulness() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RetrievalFeedbackRecorder recorder = new RetrievalFeedbackRecorder(
                new ConversationMetricsPublisher(new ConversationMetrics(registry, mock(SessionStore.class))));

        recorder.record("q-1", true, List.of("restaurants/casa-nun"));
        recorder.record("q-2", true, null);
        recorder.record("q-3", false, List.of());

        assertThat(registry.get("hugdimon.conversation.retrieval.feedback").tag("helpful", "true")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("hugdimon.conversation.retrieval.feedback").tag("helpful", "false")
                .counter().count()).isEqualTo(1.0);
    }
}
