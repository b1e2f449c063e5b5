package cf;

/**
 * Credentials are missing, expired or rejected. Retrying will not help; the
 * caller has to obtain fresh cookies (or a fresh bypass cookie) first.
 */
public class CFAuthException extends CFException {

    public CFAuthException(String message) {
        super(Category.AUTH, message);
    }
}
