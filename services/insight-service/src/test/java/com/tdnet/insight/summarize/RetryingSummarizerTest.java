package com.tdnet.insight.summarize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryingSummarizerTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    @Test
    void rateLimitedCallsBackOffExponentially() {
        SummarizationClient client = (system, user, content) -> {
            if (calls.incrementAndGet() < 3) {
                throw rateLimited();
            }
            return "ok";
        };

        String result = summarizer(client, 5).summarize("sys", "user", "body");

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(2500L, 4500L);
    }

    /**
     * After the last attempt the rate-limit failure is rethrown without one more sleep.
     */
    @Test
    void exhaustionRethrowsLastFailure() {
        SummarizationClient client = (system, user, content) -> {
            calls.incrementAndGet();
            throw rateLimited();
        };

        assertThatThrownBy(() -> summarizer(client, 3).summarize("sys", "user", "body"))
            .isInstanceOf(SummarizationException.class)
            .satisfies(ex -> assertThat(((SummarizationException) ex).kind())
                .isEqualTo(SummarizationException.Kind.RATE_LIMITED));
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(2500L, 4500L);
    }

    @Test
    void fatalFailureIsNotRetried() {
        SummarizationClient client = (system, user, content) -> {
            calls.incrementAndGet();
            throw new SummarizationException(SummarizationException.Kind.FATAL, "bad request", null);
        };

        assertThatThrownBy(() -> summarizer(client, 5).summarize("sys", "user"))
            .isInstanceOf(SummarizationException.class)
            .hasMessage("bad request");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void singleAttemptNeverSleeps() {
        SummarizationClient client = (system, user, content) -> {
            calls.incrementAndGet();
            throw rateLimited();
        };

        assertThatThrownBy(() -> summarizer(client, 1).summarize("sys", "user", "body"))
            .isInstanceOf(SummarizationException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void contentIsPassedThrough() {
        List<String> seen = new ArrayList<>();
        SummarizationClient client = (system, user, content) -> {
            seen.add(system + "|" + user + "|" + content);
            return "done";
        };

        summarizer(client, 2).summarize("s", "u", "c");
        summarizer(client, 2).summarize("s", "u");

        assertThat(seen).containsExactly("s|u|c", "s|u|");
    }

    private RetryingSummarizer summarizer(SummarizationClient client, int maxAttempts) {
        return new RetryingSummarizer(client, maxAttempts, Duration.ofSeconds(2), sleeps::add, () -> 0.5);
    }

    private static SummarizationException rateLimited() {
        return new SummarizationException(SummarizationException.Kind.RATE_LIMITED, "429 Too Many Requests", null);
    }
}
