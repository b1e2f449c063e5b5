package cfweb;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class SubmissionResult {

    public final long submissionId;
    public final int contestId;
    public final String problemIndex;
    public final JudgeState state;
    public final Duration time;
    public final long memoryBytes;
    public final int passedTests;
    /** Null when the page does not show it. */
    public final Instant submittedAt;

    public SubmissionResult(long submissionId, int contestId, String problemIndex, JudgeState state, Duration time,
            long memoryBytes, int passedTests, Instant submittedAt) {
        this.submissionId = submissionId;
        this.contestId = contestId;
        this.problemIndex = problemIndex;
        this.state = state;
        this.time = time;
        this.memoryBytes = memoryBytes;
        this.passedTests = passedTests;
        this.submittedAt = submittedAt;
    }

    /** Normalized verdict code such as {@code OK}, empty while judging. */
    public String getVerdict() {
        return state.verdict;
    }

    public String getStatus() {
        return state.status;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isAccepted() {
        return Verdict.OK.name().equals(state.verdict);
    }

    public Optional<Instant> getSubmittedAt() {
        return Optional.ofNullable(submittedAt);
    }

    @Override
    public String toString() {
        return String.format("Submission #%d %d%s: %s", submissionId, contestId, problemIndex, state.status);
    }
}
