package xyz.vvrf.reactor.agent.tutor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DifficultyLevelTest {

    @Test
    void adapt_promotesOnHighScore() {
        assertEquals(DifficultyLevel.INTERMEDIATE, DifficultyLevel.BEGINNER.adapt(0.9));
        assertEquals(DifficultyLevel.ADVANCED, DifficultyLevel.INTERMEDIATE.adapt(1.0));
        assertEquals(DifficultyLevel.ADVANCED, DifficultyLevel.ADVANCED.adapt(0.95));
    }

    @Test
    void adapt_demotesOnLowScore() {
        assertEquals(DifficultyLevel.INTERMEDIATE, DifficultyLevel.ADVANCED.adapt(0.49));
        assertEquals(DifficultyLevel.BEGINNER, DifficultyLevel.BEGINNER.adapt(0.0));
    }

    @Test
    void adapt_keepsLevelInBetween() {
        assertEquals(DifficultyLevel.INTERMEDIATE, DifficultyLevel.INTERMEDIATE.adapt(0.5));
        assertEquals(DifficultyLevel.INTERMEDIATE, DifficultyLevel.INTERMEDIATE.adapt(0.89));
    }

    @Test
    void adapt_rejectsScoresOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> DifficultyLevel.BEGINNER.adapt(-0.1));
        assertThrows(IllegalArgumentException.class, () -> DifficultyLevel.BEGINNER.adapt(1.01));
        assertThrows(IllegalArgumentException.class, () -> DifficultyLevel.BEGINNER.adapt(Double.NaN));
    }
}
