package cfweb;

import java.util.Locale;

/**
 * Where a submission is in the judging pipeline, derived from the status cell of a listing row.
 *
 * Transitions only go forward: QUEUED, then RUNNING, then TERMINAL carrying the verdict.
 */
public final class JudgeState {

    public enum Phase {
        QUEUED, RUNNING, TERMINAL
    }

    public static final String QUEUED_STATUS = "In queue";
    public static final String RUNNING_STATUS = "Running";

    public final Phase phase;
    /** Normalized verdict code, empty unless terminal. */
    public final String verdict;
    /** Human readable status: "In queue", "Running" or the judge's final text. */
    public final String status;

    private JudgeState(Phase phase, String verdict, String status) {
        this.phase = phase;
        this.verdict = verdict;
        this.status = status;
    }

    public static JudgeState queued() {
        return new JudgeState(Phase.QUEUED, "", QUEUED_STATUS);
    }

    public static JudgeState running() {
        return new JudgeState(Phase.RUNNING, "", RUNNING_STATUS);
    }

    public static JudgeState terminal(String text) {
        String status = HtmlText.collapseWhitespace(text);
        return new JudgeState(Phase.TERMINAL, Verdict.normalize(status), status);
    }

    public static JudgeState fromStatusText(String text) {
        String status = HtmlText.collapseWhitespace(text);
        String lower = status.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || lower.startsWith("in queue") || lower.startsWith("pending")
                || lower.startsWith("waiting")) {
            return queued();
        }
        if (lower.startsWith("running") || lower.startsWith("judging") || lower.startsWith("testing")) {
            return running();
        }
        return terminal(status);
    }

    public boolean isTerminal() {
        return phase == Phase.TERMINAL;
    }

    @Override
    public String toString() {
        return isTerminal() ? String.format("%s(%s)", phase, verdict) : phase.toString();
    }
}
