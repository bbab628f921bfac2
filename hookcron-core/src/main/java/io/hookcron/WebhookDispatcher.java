package io.hookcron;

import io.hookcron.core.DispatchResult;
import io.hookcron.core.Job;

/**
 * Performs the HTTP call of a job.
 *
 * <p>Implementations must not throw: transport problems are reported through
 * {@link DispatchResult#transportError(String)}.
 */
@FunctionalInterface
public interface WebhookDispatcher {

    DispatchResult dispatch(Job job);
}
