package cf;

/**
 * Base of every failure raised by the Codeforces client.
 *
 * The category lets callers tell "unreachable" from "page shape changed" from
 * "please log in again" without inspecting message text.
 */
public class CFException extends Exception {

    public enum Category {
        TRANSPORT, HTTP_STATUS, API, PARSE, AUTH, SUBMISSION, TIMEOUT
    }

    private final Category category;

    public CFException(Category category, String message) {
        super(message);
        this.category = category;
    }

    public CFException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
