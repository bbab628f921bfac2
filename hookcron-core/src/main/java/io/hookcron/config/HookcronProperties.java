package io.hookcron.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the webhook scheduler.
 */
@ConfigurationProperties(prefix = "hookcron")
public class HookcronProperties {
    private boolean enabled = true;
    private int maxConcurrency = 5; // in-flight HTTP dispatches
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration maxTimerDelay = Duration.ofMillis(Integer.MAX_VALUE); // longest single wait before re-arming
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getMaxTimerDelay() {
        return maxTimerDelay;
    }

    public void setMaxTimerDelay(Duration maxTimerDelay) {
        this.maxTimerDelay = maxTimerDelay;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
