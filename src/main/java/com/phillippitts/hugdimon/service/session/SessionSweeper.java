package com.phillippitts.hugdimon.service.session;

import com.phillippitts.hugdimon.config.properties.SessionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically expires idle conversations. The period comes from
 * {@code hugdimon.session.sweep-interval}.
 */
@Component
public class SessionSweeper implements SchedulingConfigurer {

    private static final Logger LOG = LogManager.getLogger(SessionSweeper.class);

    private final SessionStore store;
    private final SessionProperties properties;
    private final Clock clock;

    public SessionSweeper(SessionStore store, SessionProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::sweepNow, properties.getSweepInterval());
    }

    /**
     * Runs one sweep against the current clock.
     *
     * @return number of conversations removed
     */
    public int sweepNow() {
        try {
            return store.sweep(clock.instant());
        } catch (RuntimeException e) {
            // Keep the scheduled task alive; the next run retries.
            LOG.error("Session sweep failed", e);
            return 0;
        }
    }
}
