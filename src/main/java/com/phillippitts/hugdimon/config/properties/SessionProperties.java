package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the in-memory session store.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.session")
public class SessionProperties {

    /** Idle time after which a conversation is removed by the sweep. */
    @NotNull
    private Duration ttl = Duration.ofMinutes(30);

    /** How long a turn waits for the per-conversation lock before failing as busy. */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(45);

    /** Period of the expiry sweep. */
    @NotNull
    private Duration sweepInterval = Duration.ofSeconds(60);

    /** Create state for unknown client-supplied conversation ids instead of rejecting them. */
    private boolean allowImplicitCreate = true;

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public boolean isAllowImplicitCreate() {
        return allowImplicitCreate;
    }

    public void setAllowImplicitCreate(boolean allowImplicitCreate) {
        this.allowImplicitCreate = allowImplicitCreate;
    }
}
