package cfapi;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * Result of {@code contest.standings}.
 */
public class ContestStandings {

    public static class ProblemResult {

        @SerializedName("points")
        public double points;

        @SerializedName("penalty")
        public Integer penalty;

        @SerializedName("rejectedAttemptCount")
        public int rejectedAttemptCount;

        // PRELIMINARY or FINAL
        @SerializedName("type")
        public String type;

        @SerializedName("bestSubmissionTimeSeconds")
        public Long bestSubmissionTimeSeconds;
    }

    public static class RanklistRow {

        @SerializedName("party")
        public Party party;

        @SerializedName("rank")
        public int rank;

        @SerializedName("points")
        public double points;

        @SerializedName("penalty")
        public int penalty;

        @SerializedName("successfulHackCount")
        public int successfulHackCount;

        @SerializedName("unsuccessfulHackCount")
        public int unsuccessfulHackCount;

        @SerializedName("problemResults")
        public List<ProblemResult> problemResults = List.of();
    }

    @SerializedName("contest")
    public Contest contest;

    @SerializedName("problems")
    public List<Problem> problems = List.of();

    @SerializedName("rows")
    public List<RanklistRow> rows = List.of();
}
