package cfweb;

/**
 * Selectors matching the site markup as of {@value #VERSION}.
 */
public class DefaultSelectors implements Selectors {

    public static final String VERSION = "2024.1";

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public String title() {
        return ".problem-statement .header .title";
    }

    @Override
    public String timeLimit() {
        return ".problem-statement .header .time-limit";
    }

    @Override
    public String memoryLimit() {
        return ".problem-statement .header .memory-limit";
    }

    @Override
    public String statement() {
        return ".problem-statement > div:not([class])";
    }

    @Override
    public String inputSpec() {
        return ".problem-statement .input-specification";
    }

    @Override
    public String outputSpec() {
        return ".problem-statement .output-specification";
    }

    @Override
    public String note() {
        return ".problem-statement .note";
    }

    @Override
    public String sectionTitle() {
        return ".section-title, .property-title";
    }

    @Override
    public String sampleContainer() {
        return ".sample-tests";
    }

    @Override
    public String sampleBlock() {
        return ".sample-test";
    }

    @Override
    public String sampleInput() {
        return ".input pre";
    }

    @Override
    public String sampleOutput() {
        return ".output pre";
    }

    @Override
    public String tags() {
        return ".tag-box";
    }

    @Override
    public String contestProblemRow() {
        return "table.problems tr";
    }

    @Override
    public String contestProblemLink() {
        return "a[href*=/problem/]";
    }

    @Override
    public String submissionRow() {
        return "tr[data-submission-id]";
    }

    @Override
    public String submissionStatus() {
        return "td.status-cell, td.status-verdict-cell";
    }

    @Override
    public String submissionTime() {
        return "td.time-consumed-cell";
    }

    @Override
    public String submissionMemory() {
        return "td.memory-consumed-cell";
    }

    @Override
    public String submissionProblem() {
        return "a[href*=/problem/]";
    }

    @Override
    public String submissionCreated() {
        return "span.format-time";
    }

    @Override
    public String verdictBanner() {
        return "span.verdict-accepted, span.verdict-rejected, span.verdict-waiting, span.verdict-failed";
    }

    @Override
    public String resultsTable() {
        return "table.datatable, .datatable table";
    }

    @Override
    public String submitProblemIndex() {
        return "[name=submittedProblemIndex]";
    }

    @Override
    public String submitLanguage() {
        return "select[name=programTypeId]";
    }

    @Override
    public String submitSource() {
        return "textarea[name=source]";
    }
}
