package cf;

public class CFSubmitException extends CFException {

    public enum Reason {
        DUPLICATE_SOURCE("duplicate submission: the same source was already submitted"),
        SOURCE_TOO_LONG("source code is too long"),
        NOT_PERMITTED("not allowed to submit to this contest"),
        CONTEST_OVER("contest is over"),
        FAILED("submission failed");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final int statusCode;
    private final String body;

    public CFSubmitException(Reason reason, int statusCode, String body) {
        super(Category.SUBMISSION, reason == Reason.FAILED
                ? String.format("%s (status %d): %s", reason.getDescription(), statusCode,
                        CFHttpStatusException.abbreviate(body))
                : reason.getDescription());
        this.reason = reason;
        this.statusCode = statusCode;
        this.body = body;
    }

    public Reason getReason() {
        return reason;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
