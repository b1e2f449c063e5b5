package cfapi;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import cf.CFApiException;
import cf.CFConfig;
import cf.CFException;
import cf.CFHttpStatusException;
import cf.CFParseException;
import cf.CFTransportException;
import cf.HttpTransport;
import cf.RawResponse;

/**
 * Client for the documented JSON API.
 *
 * Every call waits for the rate limiter, and successful results are cached for
 * the configured TTL under the method name plus its sorted parameters. When API
 * credentials are configured every call is signed. Nothing is retried.
 */
public class CFApi {

    private static final Logger log = LoggerFactory.getLogger(CFApi.class);

    private static final Type PROBLEMS = ProblemsResult.class;
    private static final Type USERS = new TypeToken<List<User>>() {}.getType();
    private static final Type SUBMISSIONS = new TypeToken<List<Submission>>() {}.getType();
    private static final Type RATING_CHANGES = new TypeToken<List<RatingChange>>() {}.getType();
    private static final Type CONTESTS = new TypeToken<List<Contest>>() {}.getType();
    private static final Type STANDINGS = ContestStandings.class;

    private final CFConfig config;
    private final HttpTransport transport;
    private final Gson gson;
    private final ResponseCache cache;
    private final RateLimiter limiter;
    private final SignedRequestBuilder signer;

    public CFApi(CFConfig config) {
        this.config = config;
        this.transport = config.getTransport();
        this.gson = new Gson();
        this.cache = new ResponseCache(config.getCacheTtl(), config.getCacheMaxEntries(), config.getClock());
        this.limiter = new RateLimiter(config.getRequestsPerSecond());
        this.signer = isSet(config.getApiKey()) && isSet(config.getApiSecret())
                ? new SignedRequestBuilder(config.getApiKey(), config.getApiSecret(), config.getClock())
                : null;
    }

    private static boolean isSet(String s) {
        return s != null && !s.isEmpty();
    }

    public boolean hasCredentials() {
        return signer != null;
    }

    public void clearCache() {
        cache.clear();
    }

    /*
     * Low level http api
     */

    private static String buildUri(String base, String path, Map<String, String> parameters) {
        // remove leading slash in path (our string formatting will add it back in)
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        return parameters.keySet().stream()
                .map(param -> String.format("%s=%s", param,
                        URLEncoder.encode(parameters.get(param), StandardCharsets.UTF_8)))
                .collect(Collectors.joining("&", String.format("%s/%s%s", base, path, parameters.isEmpty() ? "" : "?"),
                        ""));
    }

    static String cacheKey(String method, Map<String, String> parameters) {
        return new TreeMap<>(parameters).entrySet().stream()
                .map(e -> String.format("%s=%s", e.getKey(), e.getValue()))
                .collect(Collectors.joining("&", method + "?", ""));
    }

    private RawResponse simpleRawReq(String method, Map<String, String> parameters)
            throws CFException, InterruptedException {
        limiter.acquire();

        Map<String, String> query = signer != null ? signer.sign(method, parameters) : new TreeMap<>(parameters);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(buildUri(config.getApiBaseUrl(), method, query)))
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getApiUserAgent())
                .GET()
                .build();

        log.debug("api request {}", method);
        RawResponse resp;
        try {
            resp = transport.send(request, true, config.getMaxResponseBytes());
        } catch (IOException e) {
            throw new CFTransportException("http request " + method, e);
        }
        if (!resp.isSuccess()) {
            throw new CFHttpStatusException("api " + method, resp.statusCode, resp.bodyAsString());
        }
        return resp;
    }

    private <T> T parseResponse(String method, RawResponse resp, Type resultType) throws CFException {
        if (resp.truncated) {
            throw new CFParseException(String.format("parse response of %s: body exceeds %d bytes", method,
                    config.getMaxResponseBytes()));
        }
        return decode(method, resp.bodyAsString(), resultType);
    }

    private <T> T decode(String method, String body, Type resultType) throws CFException {
        CFApiResponse<T> envelope;
        try {
            envelope = gson.fromJson(body, TypeToken.getParameterized(CFApiResponse.class, resultType).getType());
        } catch (JsonParseException | IllegalStateException e) {
            throw new CFParseException("parse response of " + method + ": " + e.getMessage(), e);
        }
        if (envelope == null || envelope.status == null) {
            throw new CFParseException("parse response of " + method + ": invalid json response structure");
        }
        return envelope.get();
    }

    /**
     * Calls {@code method} without consulting or filling the cache.
     */
    public <T> T GET(String method, Map<String, String> parameters, Type resultType)
            throws CFException, InterruptedException {
        return parseResponse(method, simpleRawReq(method, parameters), resultType);
    }

    // the body is cached, not the decoded result, so every caller gets its own copy to modify
    private <T> T cachedGET(String method, Map<String, String> parameters, Type resultType)
            throws CFException, InterruptedException {
        String key = cacheKey(method, parameters);
        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("cache hit for {}", key);
            return decode(method, cached.get(), resultType);
        }
        RawResponse resp = simpleRawReq(method, parameters);
        T result = parseResponse(method, resp, resultType);
        cache.put(key, resp.bodyAsString());
        return result;
    }

    /*
     * High-level http api
     */

    /**
     * All problems of the problemset, optionally restricted server-side to problems carrying every tag.
     */
    public ProblemsResult getProblems(List<String> tags) throws CFException, InterruptedException {
        Map<String, String> parameters = new TreeMap<>();
        if (tags != null && !tags.isEmpty()) {
            parameters.put("tags", tags.stream().sorted().collect(Collectors.joining(";")));
        }
        return cachedGET("problemset.problems", parameters, PROBLEMS);
    }

    public Problem getProblem(int contestId, String index) throws CFException, InterruptedException {
        for (Problem p : getProblems(List.of()).problems) {
            if (p.contestId != null && p.contestId == contestId && index.equals(p.index)) {
                return p;
            }
        }
        throw new CFApiException(String.format("problem %d%s not found", contestId, index));
    }

    public List<User> getUserInfo(List<String> handles) throws CFException, InterruptedException {
        if (handles == null || handles.isEmpty()) {
            throw new IllegalArgumentException("no handles provided");
        }
        return cachedGET("user.info", Map.of("handles", String.join(";", handles)), USERS);
    }

    /**
     * @param from  1-based index of the first submission, or 0 for the default
     * @param count number of submissions, or 0 for all
     */
    public List<Submission> getUserSubmissions(String handle, int from, int count)
            throws CFException, InterruptedException {
        Map<String, String> parameters = new TreeMap<>();
        parameters.put("handle", handle);
        if (from > 0) {
            parameters.put("from", Integer.toString(from));
        }
        if (count > 0) {
            parameters.put("count", Integer.toString(count));
        }
        return cachedGET("user.status", parameters, SUBMISSIONS);
    }

    public List<RatingChange> getUserRating(String handle) throws CFException, InterruptedException {
        return cachedGET("user.rating", Map.of("handle", handle), RATING_CHANGES);
    }

    public List<Contest> getContests(boolean gym) throws CFException, InterruptedException {
        return cachedGET("contest.list", Map.of("gym", Boolean.toString(gym)), CONTESTS);
    }

    public Contest getContest(int contestId) throws CFException, InterruptedException {
        for (Contest c : getContests(false)) {
            if (c.id == contestId) {
                return c;
            }
        }
        throw new CFApiException(String.format("contest %d not found", contestId));
    }

    public ContestStandings getContestStandings(int contestId, int from, int count, List<String> handles,
            boolean showUnofficial) throws CFException, InterruptedException {
        Map<String, String> parameters = new TreeMap<>();
        parameters.put("contestId", Integer.toString(contestId));
        if (from > 0) {
            parameters.put("from", Integer.toString(from));
        }
        if (count > 0) {
            parameters.put("count", Integer.toString(count));
        }
        if (handles != null && !handles.isEmpty()) {
            parameters.put("handles", String.join(";", handles));
        }
        parameters.put("showUnofficial", Boolean.toString(showUnofficial));
        return cachedGET("contest.standings", parameters, STANDINGS);
    }

    /**
     * Distinct problems the user has at least one accepted submission for, most recent first.
     */
    public List<Problem> getSolvedProblems(String handle) throws CFException, InterruptedException {
        Map<String, Problem> solved = new LinkedHashMap<>();
        for (Submission s : getUserSubmissions(handle, 1, 10000)) {
            if (s.isAccepted() && s.problem != null) {
                solved.putIfAbsent(s.problem.getProblemId(), s.problem);
            }
        }
        return new ArrayList<>(solved.values());
    }

    public List<Problem> filterProblems(ProblemFilter filter) throws CFException, InterruptedException {
        ProblemsResult problems = getProblems(filter.getTags());

        Set<String> solvedIds = new HashSet<>();
        Optional<String> handle = filter.getExcludeSolvedBy();
        if (handle.isPresent()) {
            for (Problem p : getSolvedProblems(handle.get())) {
                solvedIds.add(p.getProblemId());
            }
        }
        return filter.apply(problems.problems, solvedIds);
    }

    /**
     * Checks that the API answers. Always goes to the network and leaves the cache untouched.
     */
    public void ping() throws CFException, InterruptedException {
        SortedMap<String, String> parameters = new TreeMap<>(Map.of("gym", "false"));
        GET("contest.list", parameters, CONTESTS);
    }
}
