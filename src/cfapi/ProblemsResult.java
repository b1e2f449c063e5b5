package cfapi;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * Result of {@code problemset.problems}.
 */
public class ProblemsResult {

    @SerializedName("problems")
    public List<Problem> problems = List.of();

    @SerializedName("problemStatistics")
    public List<ProblemStatistics> problemStatistics = List.of();
}
