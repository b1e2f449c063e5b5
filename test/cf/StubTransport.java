package cf;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

/**
 * Scripted transport: answers requests from a queue and remembers what was sent.
 */
public class StubTransport implements HttpTransport {

    private interface Reply {
        RawResponse get() throws IOException;
    }

    private final Deque<Reply> replies = new ArrayDeque<>();
    private RawResponse fallback;

    public final List<HttpRequest> requests = new ArrayList<>();
    public final List<Boolean> followRedirects = new ArrayList<>();

    public static RawResponse response(int status, String body) {
        return new RawResponse(status, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    public static RawResponse response(int status, Map<String, List<String>> headers, String body) {
        return new RawResponse(status, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    public static RawResponse redirect(String location) {
        return new RawResponse(302, Map.of("Location", List.of(location)), new byte[0]);
    }

    public StubTransport enqueue(RawResponse response) {
        replies.add(() -> response);
        return this;
    }

    public StubTransport enqueue(int status, String body) {
        return enqueue(response(status, body));
    }

    public StubTransport enqueueFailure(IOException e) {
        replies.add(() -> {
            throw e;
        });
        return this;
    }

    /** Answer used once the queue is drained. */
    public StubTransport always(int status, String body) {
        this.fallback = response(status, body);
        return this;
    }

    /** Body of a sent request, or an empty string for requests without one. */
    public static String bodyOf(HttpRequest request) {
        if (request.bodyPublisher().isEmpty()) {
            return "";
        }
        StringBuilder body = new StringBuilder();
        request.bodyPublisher().get().subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                body.append(new String(bytes, StandardCharsets.UTF_8));
            }

            @Override
            public void onError(Throwable throwable) {
                throw new IllegalStateException(throwable);
            }

            @Override
            public void onComplete() {
            }
        });
        return body.toString();
    }

    public int calls() {
        return requests.size();
    }

    public HttpRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public RawResponse send(HttpRequest request, boolean followRedirects, long maxBodyBytes)
            throws IOException, InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
        requests.add(request);
        this.followRedirects.add(followRedirects);

        RawResponse resp;
        if (!replies.isEmpty()) {
            resp = replies.poll().get();
        } else if (fallback != null) {
            resp = fallback;
        } else {
            throw new IOException("no scripted response for " + request.uri());
        }

        if (resp.body.length > maxBodyBytes) {
            return new RawResponse(resp.statusCode, Map.of(), Arrays.copyOf(resp.body, (int) maxBodyBytes), true);
        }
        return resp;
    }
}
