package cfapi;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * The author of a submission or a row of the standings: a single member or a team.
 */
public class Party {

    public static class Member {

        @SerializedName("handle")
        public String handle;

        @SerializedName("name")
        public String name;
    }

    @SerializedName("contestId")
    public Integer contestId;

    @SerializedName("members")
    public List<Member> members = List.of();

    @SerializedName("participantType")
    public String participantType;

    @SerializedName("teamId")
    public Integer teamId;

    @SerializedName("teamName")
    public String teamName;

    @SerializedName("ghost")
    public boolean ghost;

    @SerializedName("room")
    public Integer room;

    @SerializedName("startTimeSeconds")
    public Long startTimeSeconds;
}
