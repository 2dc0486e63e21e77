package xyz.vvrf.reactor.agent.tutor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentTest {

    @Test
    void fromLabel_normalizesModelOutput() {
        assertEquals(Intent.EXPLAIN, Intent.fromLabel("EXPLAIN"));
        assertEquals(Intent.STUDY_PLAN, Intent.fromLabel("  study plan "));
        assertEquals(Intent.EXPLAIN_AND_PRACTICE, Intent.fromLabel("explain-and-practice."));
        assertEquals(Intent.PRACTICE, Intent.fromLabel("PRACTICE\nThe student asked for exercises."));
        assertEquals(Intent.STUDY_PLAN, Intent.fromLabel("\"STUDY_PLAN\""));
    }

    @Test
    void fromLabel_fallsBackToGeneral() {
        assertEquals(Intent.GENERAL, Intent.fromLabel(null));
        assertEquals(Intent.GENERAL, Intent.fromLabel(""));
        assertEquals(Intent.GENERAL, Intent.fromLabel("I think the student wants help"));
    }

    @Test
    void practiceAndContentFlags() {
        assertTrue(Intent.EXPLAIN_AND_PRACTICE.wantsPractice());
        assertTrue(Intent.PRACTICE.wantsPractice());
        assertFalse(Intent.EXPLAIN.wantsPractice());

        assertTrue(Intent.EXPLAIN.usesContent());
        assertFalse(Intent.STUDY_PLAN.usesContent());
        assertFalse(Intent.GENERAL.usesContent());
    }
}
