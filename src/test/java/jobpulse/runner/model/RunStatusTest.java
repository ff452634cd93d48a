package jobpulse.runner.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @Test
    void successSet() {
        assertTrue(RunStatus.SUCCESS.countsAsSuccess());
        assertTrue(RunStatus.ISSUES_FOUND.countsAsSuccess());
        assertFalse(RunStatus.FAILED.countsAsSuccess());
        assertFalse(RunStatus.TIMEOUT.countsAsSuccess());
        assertFalse(RunStatus.ERROR.countsAsSuccess());
        assertFalse(RunStatus.RUNNING.countsAsSuccess());
    }

    @Test
    void onlyRunningIsNonTerminal() {
        for (RunStatus s : RunStatus.values()) {
            assertEquals(s != RunStatus.RUNNING, s.isTerminal(), s.name());
        }
    }

    @Test
    void fromDbIsLenient() {
        assertEquals(RunStatus.RUNNING, RunStatus.fromDb("running"));
        assertEquals(RunStatus.ISSUES_FOUND, RunStatus.fromDb(" issues_found "));
        assertNull(RunStatus.fromDb(null));
        assertNull(RunStatus.fromDb(""));
        assertNull(RunStatus.fromDb("exploded"));
    }

    @Test
    void executionTypeDefaultsToSubprocess() {
        assertEquals(ExecutionType.AGENT, ExecutionType.fromDb("Agent"));
        assertEquals(ExecutionType.SUBPROCESS, ExecutionType.fromDb("subprocess"));
        assertEquals(ExecutionType.SUBPROCESS, ExecutionType.fromDb(null));
        assertEquals(ExecutionType.SUBPROCESS, ExecutionType.fromDb("docker"));
        assertEquals("agent", ExecutionType.AGENT.dbValue());
    }

    @Test
    void completionRejectsRunningStatus() {
        assertThrows(IllegalArgumentException.class, () -> new RunCompletion("r", "j",
                java.time.Instant.now(), RunStatus.RUNNING, null, null, null));
    }
}
