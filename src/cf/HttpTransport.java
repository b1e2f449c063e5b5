package cf;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * The single seam through which every request of the client leaves the process.
 */
public interface HttpTransport {

    /**
     * Sends the request and reads at most {@code maxBodyBytes} of the response body.
     *
     * @param followRedirects when false a 3xx response is returned as is
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    RawResponse send(HttpRequest request, boolean followRedirects, long maxBodyBytes)
            throws IOException, InterruptedException;
}
