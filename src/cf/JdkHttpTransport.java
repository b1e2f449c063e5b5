package cf;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} on top of {@link HttpClient}. Cookies are not handled here,
 * the web session keeps its own jar and sends it as a header.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient redirectingClient;
    private final HttpClient nonRedirectingClient;

    public JdkHttpTransport(Duration connectTimeout) {
        this.redirectingClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2)
                .connectTimeout(connectTimeout).followRedirects(HttpClient.Redirect.NORMAL).build();
        this.nonRedirectingClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2)
                .connectTimeout(connectTimeout).followRedirects(HttpClient.Redirect.NEVER).build();
    }

    public JdkHttpTransport() {
        this(Duration.ofSeconds(30));
    }

    @Override
    public RawResponse send(HttpRequest request, boolean followRedirects, long maxBodyBytes)
            throws IOException, InterruptedException {
        HttpClient client = followRedirects ? redirectingClient : nonRedirectingClient;
        HttpResponse<InputStream> resp = client.send(request, HttpResponse.BodyHandlers.ofInputStream());

        int limit = (int) Math.min(maxBodyBytes, Integer.MAX_VALUE - 8);
        try (InputStream in = resp.body()) {
            byte[] body = in.readNBytes(limit);
            // one more byte tells us whether the body was cut off
            boolean truncated = body.length == limit && in.read() != -1;
            return new RawResponse(resp.statusCode(), resp.headers().map(), body, truncated);
        }
    }
}
