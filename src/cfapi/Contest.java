package cfapi;

import com.google.gson.annotations.SerializedName;

public class Contest {

    @SerializedName("id")
    public int id;

    @SerializedName("name")
    public String name;

    @SerializedName("type")
    public String type;

    // BEFORE, CODING, PENDING_SYSTEM_TEST, SYSTEM_TEST or FINISHED
    @SerializedName("phase")
    public String phase;

    @SerializedName("frozen")
    public boolean frozen;

    @SerializedName("durationSeconds")
    public long durationSeconds;

    @SerializedName("startTimeSeconds")
    public Long startTimeSeconds;

    @SerializedName("relativeTimeSeconds")
    public Long relativeTimeSeconds;

    public boolean isFinished() {
        return "FINISHED".equals(phase);
    }
}
