package cfweb;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cf.CFAuthException;
import cf.CFConfig;
import cf.CFException;
import cf.CFHttpStatusException;
import cf.CFTransportException;
import cf.CredentialProvider;
import cf.HttpTransport;
import cf.RawResponse;

/**
 * Browser-like session against the HTML site: cookie jar, handle, CSRF token
 * and the bot-mitigation bypass cookie.
 *
 * <p>The bypass cookie only works together with the user agent it was issued
 * to. While one is set, every request carries that user agent; a bypass cookie
 * that is set but expired (or lacks its user agent) fails the request up front
 * instead of earning a challenge page.
 *
 * <p>Not thread safe. One session serves one caller at a time.
 */
public class AuthSession {

    private static final Logger log = LoggerFactory.getLogger(AuthSession.class);

    public static final String BYPASS_COOKIE = "cf_clearance";
    private static final Set<String> SESSION_COOKIES = Set.of("JSESSIONID", "X-User");

    private static final Pattern SCRIPT_HANDLE = Pattern.compile("var\\s+handle\\s*=\\s*\"([^\"]*)\"");
    private static final List<String> CHALLENGE_MARKERS = List.of(
            "<title>Just a moment...</title>", "challenge-platform", "cf-chl-", "cf-browser-verification");

    private final CFConfig config;
    private final HttpTransport transport;
    private final Clock clock;

    private final Map<String, String> cookies = new LinkedHashMap<>();
    private String handle = "";
    private String csrfToken = "";

    private String bypassCookie = "";
    private String bypassUserAgent;
    private Instant bypassExpiry;

    public AuthSession(CFConfig config) {
        this.config = config;
        this.transport = config.getTransport();
        this.clock = config.getClock();
    }

    public static AuthSession fromCredentials(CredentialProvider credentials, CFConfig config) {
        AuthSession session = new AuthSession(config);
        session.setHandle(credentials.getHandle());
        credentials.getCookies().ifPresent(session::setCookie);
        Optional<String> bypass = credentials.getBypassCookie();
        if (bypass.isPresent() && !bypass.get().isEmpty()) {
            session.setBypassCookie(bypass.get(), credentials.getBypassUserAgent().orElse(null),
                    credentials.getBypassExpiry().orElse(null));
        }
        return session;
    }

    public CFConfig getConfig() {
        return config;
    }

    public String getBaseUrl() {
        return config.getWebBaseUrl();
    }

    /*
     * Credential state
     */

    /**
     * Parses a browser cookie string such as {@code "JSESSIONID=xxx; 39ce7=yyy"} into the jar.
     * Malformed pairs are skipped. A {@code cf_clearance} pair replaces the bypass cookie value.
     */
    public void setCookie(String raw) {
        if (raw == null) {
            return;
        }
        for (String pair : raw.split(";")) {
            pair = pair.trim();
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            putCookie(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
    }

    private void putCookie(String name, String value) {
        if (name.equals(BYPASS_COOKIE)) {
            this.bypassCookie = value;
        } else if (value.isEmpty()) {
            this.cookies.remove(name);
        } else {
            this.cookies.put(name, value);
        }
    }

    public Map<String, String> getCookies() {
        return Map.copyOf(cookies);
    }

    public void setHandle(String handle) {
        this.handle = handle == null ? "" : handle.trim();
    }

    public String getHandle() {
        return handle;
    }

    public String getCsrfToken() {
        return csrfToken;
    }

    /**
     * @param userAgent the exact user agent of the browser the cookie was issued to
     * @param expiresAt when the cookie stops being honoured
     */
    public void setBypassCookie(String value, String userAgent, Instant expiresAt) {
        this.bypassCookie = value == null ? "" : value;
        this.bypassUserAgent = userAgent;
        this.bypassExpiry = expiresAt;
    }

    public void clearBypassCookie() {
        setBypassCookie("", null, null);
    }

    public boolean hasBypassCookie() {
        return !bypassCookie.isEmpty();
    }

    public boolean isBypassCookieValid() {
        return !bypassCookie.isEmpty()
                && bypassUserAgent != null && !bypassUserAgent.isBlank()
                && bypassExpiry != null && bypassExpiry.isAfter(clock.instant());
    }

    public Optional<Instant> getBypassExpiry() {
        return Optional.ofNullable(bypassExpiry);
    }

    public boolean hasCookies() {
        return !cookies.isEmpty() || hasBypassCookie();
    }

    /**
     * Heuristic: a session cookie is present. The server may still have revoked it, see {@link #validate()}.
     */
    public boolean isAuthenticated() {
        return cookies.keySet().stream().anyMatch(SESSION_COOKIES::contains);
    }

    public boolean isReadyForSubmission() {
        return isAuthenticated() && !handle.isEmpty();
    }

    /*
     * Low level http
     */

    private String userAgent() throws CFAuthException {
        if (!hasBypassCookie()) {
            return config.getBrowserUserAgent();
        }
        if (bypassUserAgent == null || bypassUserAgent.isBlank()) {
            throw new CFAuthException("bypass cookie is set without the user agent it was issued to");
        }
        if (bypassExpiry == null || !bypassExpiry.isAfter(clock.instant())) {
            throw new CFAuthException("bypass cookie has expired" + (bypassExpiry == null ? "" : " at " + bypassExpiry)
                    + "; copy a fresh " + BYPASS_COOKIE + " from the browser");
        }
        return bypassUserAgent;
    }

    private String cookieHeader() {
        StringJoiner sjCookies = new StringJoiner("; ");
        for (Map.Entry<String, String> cookie : this.cookies.entrySet()) {
            sjCookies.add(String.format("%s=%s", cookie.getKey(), cookie.getValue()));
        }
        if (hasBypassCookie()) {
            sjCookies.add(String.format("%s=%s", BYPASS_COOKIE, bypassCookie));
        }
        return sjCookies.toString();
    }

    private RawResponse simpleRawReq(HttpRequest.Builder builder, boolean followRedirects, String what)
            throws CFException, InterruptedException {
        builder = builder.timeout(config.getRequestTimeout())
                .header("User-Agent", userAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.5");
        String cookieHeader = cookieHeader();
        if (!cookieHeader.isEmpty()) {
            builder = builder.header("Cookie", cookieHeader);
        }

        RawResponse resp;
        try {
            resp = transport.send(builder.build(), followRedirects, config.getMaxPageBytes());
        } catch (IOException e) {
            throw new CFTransportException(what, e);
        }

        // parse Set-Cookie headers
        for (String cookieString : resp.headers("Set-Cookie")) {
            String nameValue = cookieString.split(";")[0];
            int eq = nameValue.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = nameValue.substring(0, eq).trim();
            boolean expired = isExpired(cookieString);
            putCookie(name, expired ? "" : nameValue.substring(eq + 1).trim());
            log.debug("new cookie: {}", name);
        }

        if (looksLikeChallenge(resp)) {
            throw new CFAuthException(String.format("%s: got a bot-mitigation challenge page (status %d); "
                    + "set a valid %s together with the user agent it was issued to", what, resp.statusCode,
                    BYPASS_COOKIE));
        }
        return resp;
    }

    // Max-Age wins over Expires; a non-positive Max-Age or an Expires date not after now deletes the cookie
    private boolean isExpired(String setCookie) {
        Boolean byExpires = null;
        for (String attr : setCookie.split(";")) {
            attr = attr.trim();
            int eq = attr.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = attr.substring(0, eq).trim();
            String value = attr.substring(eq + 1).trim();
            if (name.equalsIgnoreCase("Max-Age")) {
                try {
                    return Long.parseLong(value) <= 0;
                } catch (NumberFormatException e) {
                    log.debug("ignoring Max-Age '{}'", value);
                }
            } else if (name.equalsIgnoreCase("Expires")) {
                try {
                    Instant expires = ZonedDateTime.parse(value.replace('-', ' '),
                            DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                    byExpires = !expires.isAfter(clock.instant());
                } catch (DateTimeParseException e) {
                    log.debug("ignoring Expires '{}'", value);
                }
            }
        }
        return byExpires != null && byExpires;
    }

    private static boolean looksLikeChallenge(RawResponse resp) {
        if (resp.statusCode != 403 && resp.statusCode != 503 && !resp.isSuccess()) {
            return false;
        }
        String body = resp.bodyAsString();
        return CHALLENGE_MARKERS.stream().anyMatch(body::contains);
    }

    public RawResponse get(String url) throws CFException, InterruptedException {
        return simpleRawReq(HttpRequest.newBuilder().uri(URI.create(url)).GET(), true, "get " + url);
    }

    public RawResponse postForm(String url, Map<String, String> form, boolean followRedirects)
            throws CFException, InterruptedException {
        String body = form.entrySet().stream()
                .map(e -> String.format("%s=%s", URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8),
                        URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8)))
                .collect(Collectors.joining("&"));
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Referer", url)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        return simpleRawReq(builder, followRedirects, "post " + url);
    }

    /*
     * Session operations
     */

    /**
     * Fetches the site root and stores the CSRF token found there.
     *
     * @return the new token
     * @throws CFAuthException if the page carries no token in any known form
     */
    public String refreshCsrfToken() throws CFException, InterruptedException {
        RawResponse resp = get(getBaseUrl() + "/");
        if (!resp.isSuccess()) {
            throw new CFHttpStatusException("csrf page", resp.statusCode, resp.bodyAsString());
        }
        Optional<String> token = CsrfExtractor.extract(Jsoup.parse(resp.bodyAsString(), getBaseUrl()));
        if (token.isEmpty()) {
            throw new CFAuthException("csrf token not found");
        }
        this.csrfToken = token.get();
        return this.csrfToken;
    }

    /**
     * Checks that the server still honours the cookies, by looking for the configured handle on a
     * logged-in page. Does not touch the stored CSRF token.
     */
    public void validate() throws CFException, InterruptedException {
        if (!hasCookies()) {
            throw new CFAuthException("no cookies set");
        }
        if (handle.isEmpty()) {
            throw new CFAuthException("handle not set");
        }

        RawResponse resp = get(getBaseUrl() + "/");
        if (!resp.isSuccess()) {
            throw new CFHttpStatusException("validation page", resp.statusCode, resp.bodyAsString());
        }
        String html = resp.bodyAsString();

        Matcher m = SCRIPT_HANDLE.matcher(html);
        if (m.find() && !m.group(1).isEmpty() && !m.group(1).equalsIgnoreCase(handle)) {
            throw new CFAuthException(String.format("session belongs to %s, not %s", m.group(1), handle));
        }
        if (m.find(0) && m.group(1).equalsIgnoreCase(handle)) {
            return;
        }

        Document doc = Jsoup.parse(html, getBaseUrl());
        for (Element link : doc.select("a[href]")) {
            if (link.attr("href").endsWith("/profile/" + handle) && link.text().trim().equalsIgnoreCase(handle)) {
                return;
            }
        }
        throw new CFAuthException("session invalid - not logged in as " + handle);
    }
}
