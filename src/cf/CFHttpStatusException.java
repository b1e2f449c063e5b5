package cf;

public class CFHttpStatusException extends CFException {

    private final int statusCode;
    private final String body;

    public CFHttpStatusException(String what, int statusCode, String body) {
        super(Category.HTTP_STATUS, String.format("%s returned status %d: %s", what, statusCode, abbreviate(body)));
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
