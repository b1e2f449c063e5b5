package cfweb;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A problem as read from its HTML page. Fields the page did not carry are empty strings.
 */
public class ParsedProblem {

    public final int contestId;
    public final String index;
    public final String name;
    public final String timeLimit;
    public final String memoryLimit;
    public final String statement;
    public final String inputSpec;
    public final String outputSpec;
    public final String note;
    public final List<Sample> samples;
    public final Set<String> tags;
    /** Difficulty rating, null when the page shows none. */
    public final Integer rating;
    public final String url;

    public ParsedProblem(int contestId, String index, String name, String timeLimit, String memoryLimit,
            String statement, String inputSpec, String outputSpec, String note, List<Sample> samples,
            Set<String> tags, Integer rating, String url) {
        this.contestId = contestId;
        this.index = index;
        this.name = name;
        this.timeLimit = timeLimit;
        this.memoryLimit = memoryLimit;
        this.statement = statement;
        this.inputSpec = inputSpec;
        this.outputSpec = outputSpec;
        this.note = note;
        this.samples = List.copyOf(samples);
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.rating = rating;
        this.url = url;
    }

    static ParsedProblem stub(int contestId, String index, String name, String url) {
        return new ParsedProblem(contestId, index, name, "", "", "", "", "", "", List.of(), Set.of(), null, url);
    }

    public Optional<Integer> getRating() {
        return Optional.ofNullable(rating);
    }

    public String getProblemId() {
        return contestId + index;
    }

    @Override
    public String toString() {
        return String.format("%s. %s (%s)", getProblemId(), name, url);
    }
}
