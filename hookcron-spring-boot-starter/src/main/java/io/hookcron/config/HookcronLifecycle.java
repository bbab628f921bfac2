package io.hookcron.config;

import io.hookcron.WebhookScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>Start recovers and arms every persisted job; stop disarms everything.
 */
public class HookcronLifecycle implements SmartLifecycle {
    private final WebhookScheduler scheduler;
    private volatile boolean running = false;

    public HookcronLifecycle(WebhookScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
