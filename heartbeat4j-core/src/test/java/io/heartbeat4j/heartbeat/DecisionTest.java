package io.heartbeat4j.heartbeat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionTest {

    @Test
    void parseShouldRecognizeSentinelsCaseInsensitively() {
        assertEquals(Decision.Kind.EXECUTE, Decision.parse("execute|run cleanup").kind());
        assertEquals(Decision.Kind.SELF_TEST, Decision.parse("SELF_TEST").kind());
        assertEquals(Decision.Kind.NOTIFY, Decision.parse(" Notify: disk almost full ").kind());
        assertEquals(Decision.Kind.NO_OP, Decision.parse("IDLE").kind());
        assertEquals(Decision.Kind.NO_OP, Decision.parse("noop").kind());
    }

    @Test
    void parseShouldSplitAtFirstSeparator() {
        Decision decision = Decision.parse("NOTIFY: meeting at 10:30 | room B");

        assertEquals(Decision.Kind.NOTIFY, decision.kind());
        assertEquals("meeting at 10:30 | room B", decision.reason());
    }

    @Test
    void parseShouldTreatUnknownInputAsNoOp() {
        Decision decision = Decision.parse("I think we should wait");

        assertTrue(decision.isNoOp());
        assertEquals("I think we should wait", decision.reason());
        assertTrue(Decision.parse(null).isNoOp());
        assertTrue(Decision.parse("").isNoOp());
    }

    @Test
    void toWireShouldBeReadableByParse() {
        Decision decision = Decision.notify("backup failed");

        assertEquals("NOTIFY|backup failed", decision.toWire());
        assertEquals(decision, Decision.parse(decision.toWire()));
        assertEquals("NO_OP", Decision.noOp().toWire());
    }
}
