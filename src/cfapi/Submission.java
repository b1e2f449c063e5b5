package cfapi;

import com.google.gson.annotations.SerializedName;

public class Submission {

    public static final String VERDICT_OK = "OK";

    @SerializedName("id")
    public long id;

    @SerializedName("contestId")
    public Integer contestId;

    @SerializedName("creationTimeSeconds")
    public long creationTimeSeconds;

    @SerializedName("relativeTimeSeconds")
    public long relativeTimeSeconds;

    @SerializedName("problem")
    public Problem problem;

    @SerializedName("author")
    public Party author;

    @SerializedName("programmingLanguage")
    public String programmingLanguage;

    // missing while the submission is still being judged
    @SerializedName("verdict")
    public String verdict;

    @SerializedName("testset")
    public String testset;

    @SerializedName("passedTestCount")
    public int passedTestCount;

    @SerializedName("timeConsumedMillis")
    public long timeConsumedMillis;

    @SerializedName("memoryConsumedBytes")
    public long memoryConsumedBytes;

    public boolean isAccepted() {
        return VERDICT_OK.equals(verdict);
    }
}
