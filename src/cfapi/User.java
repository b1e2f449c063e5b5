package cfapi;

import com.google.gson.annotations.SerializedName;

public class User {

    @SerializedName("handle")
    public String handle;

    @SerializedName("email")
    public String email;

    @SerializedName("firstName")
    public String firstName;

    @SerializedName("lastName")
    public String lastName;

    @SerializedName("country")
    public String country;

    @SerializedName("city")
    public String city;

    @SerializedName("organization")
    public String organization;

    @SerializedName("contribution")
    public int contribution;

    @SerializedName("rank")
    public String rank;

    @SerializedName("rating")
    public int rating;

    @SerializedName("maxRank")
    public String maxRank;

    @SerializedName("maxRating")
    public int maxRating;

    @SerializedName("lastOnlineTimeSeconds")
    public long lastOnlineTimeSeconds;

    @SerializedName("registrationTimeSeconds")
    public long registrationTimeSeconds;

    @SerializedName("friendOfCount")
    public int friendOfCount;

    @SerializedName("avatar")
    public String avatar;

    @SerializedName("titlePhoto")
    public String titlePhoto;
}
