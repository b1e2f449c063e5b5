package cfapi;

import java.util.List;

import com.google.gson.annotations.SerializedName;

public class Problem {

    @SerializedName("contestId")
    public Integer contestId;

    @SerializedName("problemsetName")
    public String problemsetName;

    @SerializedName("index")
    public String index;

    @SerializedName("name")
    public String name;

    @SerializedName("type")
    public String type;

    @SerializedName("points")
    public Double points;

    // absent for problems that were never rated
    @SerializedName("rating")
    public Integer rating;

    @SerializedName("tags")
    public List<String> tags = List.of();

    /** Contest id and index, e.g. {@code 1A}. */
    public String getProblemId() {
        return String.format("%s%s", contestId == null ? "" : contestId, index);
    }

    @Override
    public String toString() {
        return "Problem [" + getProblemId() + ", name=" + name + ", rating=" + rating + ", tags=" + tags + "]";
    }
}
