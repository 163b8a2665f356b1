package com.phillippitts.hugdimon.service.health;

import com.phillippitts.hugdimon.config.properties.SessionProperties;
import com.phillippitts.hugdimon.service.retrieval.KnowledgeIndex;
import com.phillippitts.hugdimon.service.session.SessionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for conversation state and the knowledge index.
 *
 * <ul>
 *   <li>UP: store answering, knowledge indexed</li>
 *   <li>DEGRADED: store answering, knowledge index empty (replies lack context)</li>
 *   <li>DOWN: store failing</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionStoreHealthIndicator implements HealthIndicator {

    private final SessionStore sessionStore;
    private final KnowledgeIndex knowledgeIndex;
    private final SessionProperties sessionProperties;

    public SessionStoreHealthIndicator(SessionStore sessionStore,
                                       KnowledgeIndex knowledgeIndex,
                                       SessionProperties sessionProperties) {
        this.sessionStore = sessionStore;
        this.knowledgeIndex = knowledgeIndex;
        this.sessionProperties = sessionProperties;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        int sessions;
        try {
            sessions = sessionStore.size();
        } catch (RuntimeException e) {
            return builder.down(e).withDetail("status", "Session store unavailable").build();
        }
        int chunks = knowledgeIndex.size();

        if (chunks > 0) {
            builder.up().withDetail("status", "Sessions and knowledge available");
        } else {
            builder.status("DEGRADED").withDetail("status", "Knowledge index is empty");
        }
        return builder
                .withDetail("activeSessions", sessions)
                .withDetail("indexedChunks", chunks)
                .withDetail("ttl", sessionProperties.getTtl().toString())
                .build();
    }
}
