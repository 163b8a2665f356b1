package com.phillippitts.hugdimon.service.completion;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.hugdimon.exception.TurnCancelledException;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs completion calls on the completion executor with a per-attempt timeout and retries
 * transient failures.
 *
 * <p>Only {@link ExternalServiceException.Kind#TIMEOUT} and
 * {@link ExternalServiceException.Kind#RATE_LIMITED} are retried, with exponential backoff, up
 * to {@code max-attempts} total attempts. Other kinds fail immediately. An interrupted caller
 * cancels the in-flight call and gets a {@link TurnCancelledException}.
 */
public class CompletionInvoker {

    private static final Logger LOG = LogManager.getLogger(CompletionInvoker.class);

    private final CompletionClient client;
    private final ExecutorService executor;
    private final CompletionProperties properties;
    private final ConversationMetricsPublisher metrics;
    private final RetryTemplate retryTemplate;
    private final CompletionParams params;

    public CompletionInvoker(CompletionClient client,
                             ExecutorService executor,
                             CompletionProperties properties,
                             ConversationMetricsPublisher metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics != null ? metrics : ConversationMetricsPublisher.NOOP;
        this.retryTemplate = buildRetryTemplate(properties);
        this.params = CompletionParams.from(properties);
    }

    /**
     * @return generated text
     * @throws ExternalServiceException when retries are exhausted or the failure is not transient
     * @throws TurnCancelledException when the calling thread is interrupted
     */
    public String complete(String prompt) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    metrics.recordCompletionRetry();
                    LOG.info("Retrying completion (attempt {} of {}) after: {}", context.getRetryCount() + 1,
                            properties.getMaxAttempts(),
                            context.getLastThrowable() == null ? "-" : context.getLastThrowable().getMessage());
                }
                return attempt(prompt);
            });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Turn cancelled during completion backoff", e);
        }
    }

    private String attempt(String prompt) {
        Duration timeout = properties.getTimeout();
        Future<String> future = executor.submit(() -> client.complete(prompt, params));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ExternalServiceExceptionBuilder.create("Completion timed out after " + timeout.toMillis() + " ms")
                    .service("completion")
                    .kind(ExternalServiceException.Kind.TIMEOUT)
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Turn cancelled while waiting for completion", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException ese) {
                throw ese;
            }
            throw ExternalServiceExceptionBuilder.create("Completion client failed: " + cause)
                    .service("completion")
                    .kind(ExternalServiceException.Kind.UNAVAILABLE)
                    .cause(cause)
                    .build();
        }
    }

    static RetryTemplate buildRetryTemplate(CompletionProperties properties) {
        int attempts = Math.max(1, properties.getMaxAttempts());
        long initial = Math.max(1L, properties.getInitialBackoff().toMillis());
        double multiplier = properties.getBackoffMultiplier();
        RetryTemplateBuilder builder = RetryTemplate.builder().customPolicy(new TransientFailurePolicy(attempts));
        if (multiplier > 1.0) {
            long max = Math.max(initial + 1, properties.getMaxBackoff().toMillis());
            builder = builder.exponentialBackoff(initial, multiplier, max);
        } else {
            builder = builder.fixedBackoff(initial);
        }
        return builder.build();
    }

    static boolean isTransient(Throwable t) {
        return t instanceof ExternalServiceException e && e.getKind().isTransient();
    }

    /** Retries only transient completion failures, up to the attempt limit. */
    static final class TransientFailurePolicy extends SimpleRetryPolicy {

        TransientFailurePolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            return (last == null || isTransient(last)) && context.getRetryCount() < getMaxAttempts();
        }
    }
}
