package io.clawdos.core.loop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffTest {

    @Test
    void shouldDoubleUpToCeilingAndResetOnSuccess() {
        Backoff backoff = new Backoff(Duration.ofSeconds(60), Duration.ofSeconds(600));

        assertThat(backoff.current()).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.recordFailure()).isEqualTo(Duration.ofSeconds(120));
        assertThat(backoff.recordFailure()).isEqualTo(Duration.ofSeconds(240));
        assertThat(backoff.recordFailure()).isEqualTo(Duration.ofSeconds(480));
        assertThat(backoff.recordFailure()).isEqualTo(Duration.ofSeconds(600));
        assertThat(backoff.recordFailure()).isEqualTo(Duration.ofSeconds(600));

        assertThat(backoff.recordSuccess()).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.current()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new Backoff(Duration.ZERO, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(Duration.ofSeconds(10), Duration.ofSeconds(5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
