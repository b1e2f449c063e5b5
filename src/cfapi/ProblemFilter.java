package cfapi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Criteria for {@link CFApi#filterProblems(ProblemFilter)}. All matching is done
 * in memory over an already fetched problem list.
 */
public class ProblemFilter {

    private Integer minRating;
    private Integer maxRating;
    private final Set<String> tags = new TreeSet<>();
    private String excludeSolvedBy;

    public ProblemFilter minRating(int minRating) {
        this.minRating = minRating;
        return this;
    }

    public ProblemFilter maxRating(int maxRating) {
        this.maxRating = maxRating;
        return this;
    }

    public ProblemFilter tags(Collection<String> tags) {
        this.tags.addAll(tags);
        return this;
    }

    public ProblemFilter tag(String tag) {
        this.tags.add(tag);
        return this;
    }

    /** Drop problems the given user already has an accepted submission for. */
    public ProblemFilter excludeSolvedBy(String handle) {
        this.excludeSolvedBy = handle == null || handle.isBlank() ? null : handle;
        return this;
    }

    public List<String> getTags() {
        return new ArrayList<>(tags);
    }

    public Optional<String> getExcludeSolvedBy() {
        return Optional.ofNullable(excludeSolvedBy);
    }

    /**
     * Problems that pass the rating range and tag criteria and whose id is not in {@code solvedIds}.
     * Unrated problems are never dropped by the rating range.
     */
    public List<Problem> apply(List<Problem> problems, Set<String> solvedIds) {
        List<Problem> filtered = new ArrayList<>();
        for (Problem p : problems) {
            if (matchesRating(p) && matchesTags(p) && !solvedIds.contains(p.getProblemId())) {
                filtered.add(p);
            }
        }
        return filtered;
    }

    boolean matchesRating(Problem p) {
        if (p.rating == null || p.rating <= 0) {
            return true;
        }
        if (minRating != null && p.rating < minRating) {
            return false;
        }
        return maxRating == null || p.rating <= maxRating;
    }

    boolean matchesTags(Problem p) {
        return tags.isEmpty() || (p.tags != null && p.tags.containsAll(tags));
    }
}
