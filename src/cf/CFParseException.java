package cf;

public class CFParseException extends CFException {

    public CFParseException(String message) {
        super(Category.PARSE, message);
    }

    public CFParseException(String message, Throwable cause) {
        super(Category.PARSE, message, cause);
    }
}
