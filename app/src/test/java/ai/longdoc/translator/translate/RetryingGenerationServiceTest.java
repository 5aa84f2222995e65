package ai.longdoc.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryingGenerationServiceTest {

    private final List<Long> sleeps = new ArrayList<>();

    @Test
    void retriesRateLimitedCallsUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationService flaky = (prompt, temperature) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new GenerationException("Too many requests", new RateLimitException("429"));
            }
            return "translated";
        };
        RetryingGenerationService service = new RetryingGenerationService(flaky, 5, 1, 4, 0.0, sleeps::add);

        assertThat(service.generate("prompt", 1.0)).isEqualTo("translated");
        assertThat(attempts).hasValue(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    @DisplayName("Provider retry-after hint wins over the computed backoff")
    void honoursProviderRetryDelay() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationService hinted = (prompt, temperature) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new GenerationException("RESOURCE_EXHAUSTED, retry in 2.5s", null);
            }
            return "ok";
        };
        RetryingGenerationService service = new RetryingGenerationService(hinted, 3, 10, 60, 0.0, sleeps::add);

        assertThat(service.generate("prompt", 0.5)).isEqualTo("ok");
        assertThat(sleeps).containsExactly(2500L);
    }

    @Test
    void doesNotRetryOtherFailures() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationService broken = (prompt, temperature) -> {
            attempts.incrementAndGet();
            throw new GenerationException("model exploded", null);
        };
        RetryingGenerationService service = new RetryingGenerationService(broken, 5, 1, 4, 0.0, sleeps::add);

        assertThatThrownBy(() -> service.generate("prompt", 1.0)).hasMessage("model exploded");
        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationService limited = (prompt, temperature) -> {
            attempts.incrementAndGet();
            throw new GenerationException("quota", new RateLimitException("429"));
        };
        RetryingGenerationService service = new RetryingGenerationService(limited, 3, 1, 2, 0.0, sleeps::add);

        assertThatThrownBy(() -> service.generate("prompt", 1.0)).isInstanceOf(GenerationException.class);
        assertThat(attempts).hasValue(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    void capsBackoffAtMaximum() {
        RetryingGenerationService service = new RetryingGenerationService((p, t) -> "x", 6, 2, 10, 0.0, sleeps::add);
        GenerationException rateLimited = new GenerationException("429", null);

        assertThat(service.calculateRetryDelay(rateLimited, 0)).contains(Duration.ofSeconds(2));
        assertThat(service.calculateRetryDelay(rateLimited, 5)).contains(Duration.ofSeconds(10));
        assertThat(service.calculateRetryDelay(new GenerationException("boom", null), 0)).isEmpty();
    }

    @Test
    void validatesSettings() {
        assertThatThrownBy(() -> new RetryingGenerationService((p, t) -> "x", 0, 1, 1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryingGenerationService((p, t) -> "x", 1, 5, 1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryingGenerationService((p, t) -> "x", 1, 1, 1, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
