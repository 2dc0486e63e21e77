package xyz.vvrf.reactor.agent.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffPolicyTest {

    @Test
    void nominalDelay_doublesUntilCapped() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.0);

        assertEquals(Duration.ofMillis(100), policy.nominalDelay(1));
        assertEquals(Duration.ofMillis(200), policy.nominalDelay(2));
        assertEquals(Duration.ofMillis(400), policy.nominalDelay(3));
        assertEquals(Duration.ofMillis(800), policy.nominalDelay(4));
        assertEquals(Duration.ofSeconds(1), policy.nominalDelay(5));
        assertEquals(Duration.ofSeconds(1), policy.nominalDelay(70));
    }

    @Test
    void delayFor_jitterOnlyShortensDelay() {
        BackoffPolicy maxJitter = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.2, () -> 1.0);
        BackoffPolicy noJitter = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.2, () -> 0.0);

        assertEquals(Duration.ofMillis(80), maxJitter.delayFor(1));
        assertEquals(Duration.ofMillis(800), maxJitter.delayFor(5));
        assertEquals(Duration.ofMillis(100), noJitter.delayFor(1));
    }

    @Test
    void delayFor_staysWithinBoundsAndNonDecreasingUpToJitter() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.2,
                () -> ThreadLocalRandom.current().nextDouble());

        for (int round = 0; round < 200; round++) {
            Duration previousNominal = Duration.ZERO;
            for (int retry = 1; retry <= 6; retry++) {
                Duration nominal = policy.nominalDelay(retry);
                Duration delay = policy.delayFor(retry);
                assertTrue(nominal.compareTo(previousNominal) >= 0);
                assertTrue(delay.compareTo(Duration.ofSeconds(1)) <= 0, "延迟超过上限: " + delay);
                assertTrue(delay.toMillis() >= (long) (nominal.toMillis() * 0.8), "抖动超过 20%: " + delay);
                previousNominal = nominal;
            }
        }
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.3));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.1).nominalDelay(0));
    }
}
