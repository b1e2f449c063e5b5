package cfweb;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import cf.CFSubmitException;
import cf.CFSubmitException.Reason;

/**
 * How the site answered a submit form post.
 */
public enum SubmitOutcome {
    /** 3xx pointing at the submission listing. */
    REDIRECTED,
    /** 200 without any known rejection message. */
    ACCEPTED_INLINE;

    private static final Map<String, Reason> REJECTIONS = new LinkedHashMap<>();
    static {
        REJECTIONS.put("you have submitted exactly the same code before", Reason.DUPLICATE_SOURCE);
        REJECTIONS.put("source code is too long", Reason.SOURCE_TOO_LONG);
        REJECTIONS.put("you are not allowed to submit", Reason.NOT_PERMITTED);
        REJECTIONS.put("contest is over", Reason.CONTEST_OVER);
    }

    public static SubmitOutcome classify(int statusCode, Optional<String> location, String body)
            throws CFSubmitException {
        if (statusCode >= 300 && statusCode < 400 && location.isPresent() && !location.get().isEmpty()) {
            return REDIRECTED;
        }
        if (statusCode == 200) {
            String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, Reason> rejection : REJECTIONS.entrySet()) {
                if (lower.contains(rejection.getKey())) {
                    throw new CFSubmitException(rejection.getValue(), statusCode, body);
                }
            }
            return ACCEPTED_INLINE;
        }
        throw new CFSubmitException(Reason.FAILED, statusCode, body);
    }
}
