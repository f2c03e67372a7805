package com.tdnet.insight.summarize;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link SummarizationClient} with exponential backoff on rate-limit failures. The wait before
 * retry {@code n} (zero based) is {@code initialBackoff * 2^n} plus up to one second of jitter.
 */
public class RetryingSummarizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingSummarizer.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final SummarizationClient client;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public RetryingSummarizer(SummarizationClient client, int maxAttempts, Duration initialBackoff) {
        this(client, maxAttempts, initialBackoff, TimeUnit.MILLISECONDS::sleep,
            () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryingSummarizer(
        SummarizationClient client,
        int maxAttempts,
        Duration initialBackoff,
        Sleeper sleeper,
        DoubleSupplier jitter
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        this.client = client;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    public String summarize(String systemPrompt, String userPrompt) {
        return summarize(systemPrompt, userPrompt, "");
    }

    public String summarize(String systemPrompt, String userPrompt, String content) {
        for (int attempt = 0; ; attempt++) {
            try {
                return client.summarize(systemPrompt, userPrompt, content);
            } catch (SummarizationException ex) {
                if (!ex.isRateLimited() || attempt + 1 >= maxAttempts) {
                    throw ex;
                }
                long waitMillis = backoffMillis(attempt);
                LOGGER.warn("Rate limited (attempt {}/{}), retrying in {} ms", attempt + 1, maxAttempts, waitMillis);
                pause(waitMillis, ex);
            }
        }
    }

    long backoffMillis(int attempt) {
        long base = initialBackoff.toMillis() << attempt;
        return base + (long) (jitter.getAsDouble() * 1000);
    }

    private void pause(long millis, SummarizationException cause) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SummarizationException(SummarizationException.Kind.FATAL, "Interrupted during backoff", cause);
        }
    }
}
