package cfapi;

import com.google.gson.annotations.SerializedName;

import cf.CFApiException;

/**
 * The envelope every API method answers with: {@code {status, comment?, result?}}.
 */
public class CFApiResponse<T> {

    public static final String STATUS_OK = "OK";

    @SerializedName("status")
    public String status;

    @SerializedName("comment")
    public String comment;

    @SerializedName("result")
    public T result;

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    public T get() throws CFApiException {
        if (isOk()) {
            return result;
        }
        throw new CFApiException(comment == null ? "status " + status : comment);
    }
}
