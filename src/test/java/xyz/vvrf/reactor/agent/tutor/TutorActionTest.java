package xyz.vvrf.reactor.agent.tutor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TutorActionTest {

    @Test
    void fromWire_mapsKnownActions() {
        assertEquals(TutorAction.EXPLAIN_CONCEPT, TutorAction.fromWire("explain_concept"));
        assertEquals(TutorAction.CHECK_UNDERSTANDING, TutorAction.fromWire("CHECK_UNDERSTANDING"));
        assertEquals(TutorAction.CHECK_UNDERSTANDING, TutorAction.fromWire("practice"));
        assertEquals(TutorAction.CREATE_PLAN, TutorAction.fromWire(" create_plan "));
    }

    @Test
    void fromWire_blankMeansGeneral() {
        assertEquals(TutorAction.GENERAL, TutorAction.fromWire(null));
        assertEquals(TutorAction.GENERAL, TutorAction.fromWire("  "));
    }

    @Test
    void fromWire_rejectsUnknownAction() {
        assertThrows(IllegalArgumentException.class, () -> TutorAction.fromWire("summarize"));
    }

    @Test
    void toIntent_followsActionMeaning() {
        assertEquals(Intent.EXPLAIN, TutorAction.EXPLAIN_CONCEPT.toIntent());
        assertEquals(Intent.PRACTICE, TutorAction.CHECK_UNDERSTANDING.toIntent());
        assertEquals(Intent.STUDY_PLAN, TutorAction.CREATE_PLAN.toIntent());
        assertEquals("create_plan", TutorAction.CREATE_PLAN.getWireName());
    }
}
