package work.lcod.dispatch.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for a {@code CommandQueue}: worker poll interval, execution pool size,
 * pipe delimiter and worker thread name.
 */
public record DispatchConfiguration(
    Duration pollInterval,
    int workerThreads,
    char pipeDelimiter,
    String threadName
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final char DEFAULT_PIPE_DELIMITER = '|';
    public static final String DEFAULT_THREAD_NAME = "command-queue";

    public DispatchConfiguration {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(threadName, "threadName");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
        }
        if (Character.isWhitespace(pipeDelimiter) || Character.isLetterOrDigit(pipeDelimiter)) {
            throw new IllegalArgumentException("Unsupported pipe delimiter: '" + pipeDelimiter + "'");
        }
        if (threadName.isBlank()) {
            throw new IllegalArgumentException("threadName must not be blank");
        }
    }

    public static DispatchConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .pollInterval(pollInterval)
            .workerThreads(workerThreads)
            .pipeDelimiter(pipeDelimiter)
            .threadName(threadName);
    }

    public static final class Builder {
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private char pipeDelimiter = DEFAULT_PIPE_DELIMITER;
        private String threadName = DEFAULT_THREAD_NAME;

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder pipeDelimiter(char pipeDelimiter) {
            this.pipeDelimiter = pipeDelimiter;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public DispatchConfiguration build() {
            return new DispatchConfiguration(pollInterval, workerThreads, pipeDelimiter, threadName);
        }
    }
}
