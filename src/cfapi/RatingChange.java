package cfapi;

import com.google.gson.annotations.SerializedName;

public class RatingChange {

    @SerializedName("contestId")
    public int contestId;

    @SerializedName("contestName")
    public String contestName;

    @SerializedName("handle")
    public String handle;

    @SerializedName("rank")
    public int rank;

    @SerializedName("ratingUpdateTimeSeconds")
    public long ratingUpdateTimeSeconds;

    @SerializedName("oldRating")
    public int oldRating;

    @SerializedName("newRating")
    public int newRating;
}
