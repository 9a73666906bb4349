package org.carball.futureyou.ai;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;

/**
 * Builds the retry envelope wrapped around every model call: bounded attempts with
 * capped exponential backoff, retrying only {@link AgentException}s.
 */
@Slf4j
public final class AgentRetryPolicy {

    private AgentRetryPolicy() {
    }

    public static Retry create(String agentName, ModelSettings settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff(),
                        settings.getBackoffMultiplier(),
                        settings.getMaxBackoff()))
                .retryOnException(AgentRetryPolicy::isRetryable)
                .build();

        Retry retry = Retry.of(agentName, config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("{} attempt {} failed: {}. Retrying in {} ms",
                        agentName,
                        event.getNumberOfRetryAttempts(),
                        messageOf(event.getLastThrowable()),
                        event.getWaitInterval().toMillis()))
                .onError(event -> log.error("{} giving up after {} attempts: {}",
                        agentName,
                        event.getNumberOfRetryAttempts(),
                        messageOf(event.getLastThrowable())));
        return retry;
    }

    /**
     * Caller input errors and programming errors fail on the first attempt.
     */
    public static boolean isRetryable(Throwable throwable) {
        return throwable instanceof AgentException;
    }

    private static String messageOf(Throwable throwable) {
        return throwable == null ? "unknown error" : throwable.getMessage();
    }
}
