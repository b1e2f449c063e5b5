package cfweb;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CSS selectors (Jsoup syntax) for every page region the library reads.
 *
 * When the site changes its markup, a new implementation with a new version is
 * all that should need to change.
 */
public interface Selectors {

    String version();

    // problem page
    String title();

    String timeLimit();

    String memoryLimit();

    String statement();

    String inputSpec();

    String outputSpec();

    String note();

    /** Element holding a section heading inside a statement part, removed before reading its text. */
    String sectionTitle();

    String sampleContainer();

    String sampleBlock();

    /** Relative to a sample block or the sample container. */
    String sampleInput();

    /** Relative to a sample block or the sample container. */
    String sampleOutput();

    String tags();

    // contest problem table
    String contestProblemRow();

    String contestProblemLink();

    // submission listing
    String submissionRow();

    String submissionStatus();

    String submissionTime();

    String submissionMemory();

    String submissionProblem();

    String submissionCreated();

    // single submission page
    String verdictBanner();

    String resultsTable();

    // submit form
    String submitProblemIndex();

    String submitLanguage();

    String submitSource();

    /**
     * Named groups a problem page must match for {@link PageParser#verifyPageStructure()} to pass.
     */
    default Map<String, String> requiredProblemGroups() {
        Map<String, String> groups = new LinkedHashMap<>();
        groups.put("title", title());
        groups.put("time limit", timeLimit());
        groups.put("memory limit", memoryLimit());
        groups.put("statement", statement());
        groups.put("input specification", inputSpec());
        groups.put("output specification", outputSpec());
        groups.put("sample tests", sampleContainer());
        groups.put("tags", tags());
        return groups;
    }
}
