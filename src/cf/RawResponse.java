package cf;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and (bounded) body of one HTTP exchange.
 */
public class RawResponse {

    public final int statusCode;
    public final byte[] body;
    public final boolean truncated;
    private final Map<String, List<String>> headers;

    public RawResponse(int statusCode, Map<String, List<String>> headers, byte[] body, boolean truncated) {
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body;
        this.truncated = truncated;
        // header names are case-insensitive
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            this.headers.putAll(headers);
        }
    }

    public RawResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
        this(statusCode, headers, body, false);
    }

    public List<String> headers(String name) {
        return headers.getOrDefault(name, List.of());
    }

    public Optional<String> header(String name) {
        return headers(name).stream().findFirst();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRedirect() {
        return statusCode >= 300 && statusCode < 400;
    }
}
