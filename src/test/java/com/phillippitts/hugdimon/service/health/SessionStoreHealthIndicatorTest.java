package com.phillippitts.hugdimon.service.health;

import com.phillippitts.hugdimon.config.properties.SessionProperties;
import com.phillippitts.hugdimon.service.retrieval.KnowledgeIndex;
import com.phillippitts.hugdimon.service.session.SessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionStoreHealthIndicatorTest {

    @Test
    void shouldReportUpWhenKnowledgeIsIndexed() {
        SessionStore store = mock(SessionStore.class);
        KnowledgeIndex index = mock(KnowledgeIndex.class);
        when(store.size()).thenReturn(3);
        when(index.size()).thenReturn(8);

        Health health = new SessionStoreHealthIndicator(store, index, new SessionProperties()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("activeSessions", 3);
        assertThat(health.getDetails()).containsEntry("indexedChunks", 8);
        assertThat(health.getDetails()).containsEntry("ttl", "PT30M");
    }

    @Test
    void shouldReportDegradedWhenKnowledgeIndexIsEmpty() {
        SessionStore store = mock(SessionStore.class);
        KnowledgeIndex index = mock(KnowledgeIndex.class);
        when(index.size()).thenReturn(0);

        Health health = new SessionStoreHealthIndicator(store, index, new SessionProperties()).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Knowledge index is empty");
    }

    @Test
    void shouldReportDownWhenStoreFails() {
        SessionStore store = mock(SessionStore.class);
        when(store.size()).thenThrow(new IllegalStateException("broken"));

        Health health = new SessionStoreHealthIndicator(store, mock(KnowledgeIndex.class), new SessionProperties())
                .health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
