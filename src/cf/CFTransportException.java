package cf;

import java.io.IOException;

public class CFTransportException extends CFException {

    public CFTransportException(String message, IOException cause) {
        super(Category.TRANSPORT, String.format("%s: %s", message, cause.getMessage()), cause);
    }
}
