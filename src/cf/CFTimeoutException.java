package cf;

import java.time.Duration;

public class CFTimeoutException extends CFException {

    public CFTimeoutException(long submissionId, Duration timeout) {
        super(Category.TIMEOUT, String.format("timed out after %d ms waiting for verdict of submission %d",
                timeout.toMillis(), submissionId));
    }
}
