package cfweb;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import cfweb.JudgeState.Phase;

public class JudgeStateTest {

    @Test
    public void queued() {
        assertEquals(Phase.QUEUED, JudgeState.fromStatusText("In queue").phase);
        assertEquals(Phase.QUEUED, JudgeState.fromStatusText("  ").phase);
        assertEquals("In queue", JudgeState.fromStatusText("").status);
    }

    @Test
    public void running() {
        JudgeState state = JudgeState.fromStatusText("Running on test 5");
        assertEquals(Phase.RUNNING, state.phase);
        assertEquals("Running", state.status);
        assertEquals("", state.verdict);
        assertFalse(state.isTerminal());
        assertEquals(Phase.RUNNING, JudgeState.fromStatusText("Judging").phase);
    }

    @Test
    public void terminal() {
        JudgeState state = JudgeState.fromStatusText("Wrong answer on test 5");
        assertTrue(state.isTerminal());
        assertEquals("WRONG_ANSWER", state.verdict);
        assertEquals("Wrong answer on test 5", state.status);
        assertEquals("TERMINAL(WRONG_ANSWER)", state.toString());
    }

    @Test
    public void unknownTextIsTerminalAndPassesThrough() {
        JudgeState state = JudgeState.fromStatusText("Denial of judgement");
        assertTrue(state.isTerminal());
        assertEquals("Denial of judgement", state.verdict);
    }
}
