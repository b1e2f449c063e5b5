package cf;

/**
 * The JSON API answered, but with {@code status: FAILED} (or without the entity asked for).
 */
public class CFApiException extends CFException {

    public CFApiException(String comment) {
        super(Category.API, "api error: " + comment);
    }
}
