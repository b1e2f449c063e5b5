package cf;

import java.time.Clock;
import java.time.Duration;

/**
 * Settings shared by the API client, the web session and everything built on them.
 *
 * Every client owns the cache, rate limiter and signer it builds from this
 * object; two clients built from two configs share nothing.
 */
public class CFConfig {

    public static final String DEFAULT_API_BASE_URL = "https://codeforces.com/api";
    public static final String DEFAULT_WEB_BASE_URL = "https://codeforces.com";
    public static final String DEFAULT_API_USER_AGENT = "cf/1.0";
    public static final String DEFAULT_BROWSER_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String apiBaseUrl = DEFAULT_API_BASE_URL;
    private String webBaseUrl = DEFAULT_WEB_BASE_URL;
    private String apiUserAgent = DEFAULT_API_USER_AGENT;
    private String browserUserAgent = DEFAULT_BROWSER_USER_AGENT;
    private String apiKey;
    private String apiSecret;

    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration cacheTtl = Duration.ofMinutes(5);
    private int cacheMaxEntries = 1000;
    private double requestsPerSecond = 5;
    private long maxResponseBytes = 10L * 1024 * 1024;
    private long maxPageBytes = 5L * 1024 * 1024;
    private Duration pollInterval = Duration.ofSeconds(2);
    private Clock clock = Clock.systemUTC();

    // built lazily so that tests can swap it before first use
    private HttpTransport transport;

    /**
     * Config with defaults plus the API key and secret of the given provider, if it has both.
     */
    public static CFConfig from(CredentialProvider credentials) {
        CFConfig config = new CFConfig();
        if (credentials.getApiKey().isPresent() && credentials.getApiSecret().isPresent()) {
            config.setApiCredentials(credentials.getApiKey().get(), credentials.getApiSecret().get());
        }
        return config;
    }

    public HttpTransport getTransport() {
        if (transport == null) {
            transport = new JdkHttpTransport(requestTimeout);
        }
        return transport;
    }

    public CFConfig setTransport(HttpTransport transport) {
        this.transport = transport;
        return this;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public CFConfig setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        return this;
    }

    public String getWebBaseUrl() {
        return webBaseUrl;
    }

    public CFConfig setWebBaseUrl(String webBaseUrl) {
        this.webBaseUrl = stripTrailingSlash(webBaseUrl);
        return this;
    }

    public String getApiUserAgent() {
        return apiUserAgent;
    }

    public CFConfig setApiUserAgent(String apiUserAgent) {
        this.apiUserAgent = apiUserAgent;
        return this;
    }

    public String getBrowserUserAgent() {
        return browserUserAgent;
    }

    public CFConfig setBrowserUserAgent(String browserUserAgent) {
        this.browserUserAgent = browserUserAgent;
        return this;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getApiSecret() {
        return apiSecret;
    }

    public CFConfig setApiCredentials(String apiKey, String apiSecret) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        return this;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public CFConfig setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public CFConfig setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
        return this;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public CFConfig setCacheMaxEntries(int cacheMaxEntries) {
        if (cacheMaxEntries <= 0) {
            throw new IllegalArgumentException("cacheMaxEntries must be positive");
        }
        this.cacheMaxEntries = cacheMaxEntries;
        return this;
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public CFConfig setRequestsPerSecond(double requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive");
        }
        this.requestsPerSecond = requestsPerSecond;
        return this;
    }

    public long getMaxResponseBytes() {
        return maxResponseBytes;
    }

    public CFConfig setMaxResponseBytes(long maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
        return this;
    }

    public long getMaxPageBytes() {
        return maxPageBytes;
    }

    public CFConfig setMaxPageBytes(long maxPageBytes) {
        this.maxPageBytes = maxPageBytes;
        return this;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public CFConfig setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public Clock getClock() {
        return clock;
    }

    public CFConfig setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
