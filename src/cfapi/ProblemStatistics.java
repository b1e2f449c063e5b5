package cfapi;

import com.google.gson.annotations.SerializedName;

public class ProblemStatistics {

    @SerializedName("contestId")
    public Integer contestId;

    @SerializedName("index")
    public String index;

    @SerializedName("solvedCount")
    public int solvedCount;
}
