package ai.longdoc.translator.translate;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a generation service with exponential backoff on provider rate limiting.
 *
 * <p>Only rate limit failures (429 / RESOURCE_EXHAUSTED) are retried; every other failure, and a
 * rate limit that outlasts {@code maxRetryAttempts}, propagates unchanged.
 */
public class RetryingGenerationService implements GenerationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingGenerationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final GenerationService delegate;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;
    private final Sleeper sleeper;

    public RetryingGenerationService(GenerationService delegate) {
        this(delegate, 6, 2, 60, 0.3);
    }

    public RetryingGenerationService(GenerationService delegate, int maxRetryAttempts, int initialBackoffSeconds,
                                     int maxBackoffSeconds, double jitterFactor) {
        this(delegate, maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds, jitterFactor, Thread::sleep);
    }

    RetryingGenerationService(GenerationService delegate, int maxRetryAttempts, int initialBackoffSeconds,
                              int maxBackoffSeconds, double jitterFactor, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public String generate(String prompt, double temperature) {
        GenerationException lastFailure = null;
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return delegate.generate(prompt, temperature);
            } catch (GenerationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Generation rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Generation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, maxRetryAttempts);
                try {
                    sleeper.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Generation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new GenerationException("Unknown generation failure", null) : lastFailure;
    }

    Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }

        // initialBackoff * 2^attempt, capped, then spread by +/- jitterFactor
        long baseDelaySeconds = initialBackoffSeconds * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
