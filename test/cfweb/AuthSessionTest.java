package cfweb;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import cf.CFAuthException;
import cf.CFConfig;
import cf.CFException;
import cf.CFHttpStatusException;
import cf.CFTransportException;
import cf.CredentialProvider;
import cf.MutableClock;
import cf.StubTransport;

public class AuthSessionTest {

    private static final String BYPASS_UA = "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0";

    private StubTransport transport;
    private MutableClock clock;
    private CFConfig config;
    private AuthSession session;

    @BeforeEach
    public void setUp() {
        transport = new StubTransport();
        clock = new MutableClock(Instant.parse("2024-01-05T12:00:00Z"));
        config = new CFConfig().setTransport(transport).setClock(clock).setWebBaseUrl("http://cf.test");
        session = new AuthSession(config);
    }

    private String sentHeader(String name) {
        return transport.lastRequest().headers().firstValue(name).orElse(null);
    }

    @Test
    public void parsesBrowserCookieString() {
        session.setCookie("JSESSIONID=ABC123; 39ce7=CFh4x; cf_clearance=clear-me");
        assertEquals(Map.of("JSESSIONID", "ABC123", "39ce7", "CFh4x"), session.getCookies());
        assertTrue(session.hasBypassCookie());
        assertTrue(session.isAuthenticated());
        assertTrue(session.hasCookies());
    }

    @Test
    public void skipsMalformedPairs() {
        session.setCookie("garbage; =nameless;  a=1 ;b=x=y");
        assertEquals(Map.of("a", "1", "b", "x=y"), session.getCookies());
        assertFalse(session.isAuthenticated());
    }

    @Test
    public void userCookieAloneAuthenticates() {
        session.setCookie("X-User=someone");
        assertTrue(session.isAuthenticated());
        assertFalse(session.isReadyForSubmission());
        session.setHandle("tourist");
        assertTrue(session.isReadyForSubmission());
    }

    @Test
    public void bypassCookieValidity() {
        assertFalse(session.isBypassCookieValid());
        session.setBypassCookie("clear-me", BYPASS_UA, clock.instant().plus(Duration.ofHours(1)));
        assertTrue(session.isBypassCookieValid());

        clock.advance(Duration.ofHours(1));
        assertFalse(session.isBypassCookieValid());

        session.setBypassCookie("clear-me", null, clock.instant().plus(Duration.ofHours(1)));
        assertFalse(session.isBypassCookieValid());

        session.setBypassCookie("", BYPASS_UA, clock.instant().plus(Duration.ofHours(1)));
        assertFalse(session.isBypassCookieValid());
    }

    @Test
    public void sendsBrowserUserAgentAndCookies() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=ABC123; 39ce7=CFh4x");
        transport.enqueue(200, "<html></html>");
        session.get("http://cf.test/");
        assertEquals(CFConfig.DEFAULT_BROWSER_USER_AGENT, sentHeader("User-Agent"));
        assertEquals("JSESSIONID=ABC123; 39ce7=CFh4x", sentHeader("Cookie"));
    }

    @Test
    public void bypassCookieTravelsWithItsUserAgent() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=ABC123");
        session.setBypassCookie("clear-me", BYPASS_UA, clock.instant().plus(Duration.ofMinutes(30)));
        transport.enqueue(200, "<html></html>");
        session.get("http://cf.test/");
        assertEquals(BYPASS_UA, sentHeader("User-Agent"));
        assertEquals("JSESSIONID=ABC123; cf_clearance=clear-me", sentHeader("Cookie"));
    }

    @Test
    public void expiredBypassCookieFailsBeforeSending() {
        session.setBypassCookie("clear-me", BYPASS_UA, clock.instant().minusSeconds(1));
        CFAuthException e = assertThrows(CFAuthException.class, () -> session.get("http://cf.test/"));
        assertTrue(e.getMessage().contains("expired"), e.getMessage());
        assertEquals(0, transport.calls());
    }

    @Test
    public void bypassCookieWithoutUserAgentFailsBeforeSending() {
        session.setCookie("cf_clearance=from-browser");
        assertThrows(CFAuthException.class, () -> session.get("http://cf.test/"));
        assertEquals(0, transport.calls());
    }

    @Test
    public void setCookieHeadersUpdateTheJar() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=OLD; 39ce7=keep");
        transport.enqueue(StubTransport.response(200,
                Map.of("Set-Cookie", List.of("JSESSIONID=NEW; Path=/; HttpOnly", "39ce7=; Max-Age=0; Path=/")),
                "<html></html>"));
        session.get("http://cf.test/");
        assertEquals(Map.of("JSESSIONID", "NEW"), session.getCookies());
    }

    @Test
    public void pastExpiresDeletesTheCookie() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=OLD; 39ce7=keep; X-User=me");
        transport.enqueue(StubTransport.response(200,
                Map.of("Set-Cookie", List.of("39ce7=gone; Expires=Thu, 01-Jan-1970 00:00:00 GMT; Path=/",
                        "X-User=still; Expires=Wed, 01 Jan 2025 00:00:00 GMT; Path=/",
                        "JSESSIONID=kept; Expires=Thu, 01-Jan-1970 00:00:00 GMT; Max-Age=3600")),
                "<html></html>"));
        session.get("http://cf.test/");
        assertEquals(Map.of("JSESSIONID", "kept", "X-User", "still"), session.getCookies());
    }

    @Test
    public void challengePageIsAnAuthError() {
        transport.enqueue(403, "<html><head><title>Just a moment...</title></head>"
                + "<body><script src=\"/cdn-cgi/challenge-platform/h/b/orchestrate/chl_page/v1\"></script></body></html>");
        CFAuthException e = assertThrows(CFAuthException.class, () -> session.get("http://cf.test/problemset"));
        assertTrue(e.getMessage().contains("challenge"), e.getMessage());
    }

    @Test
    public void transportFailureIsWrapped() {
        transport.enqueueFailure(new IOException("connect timed out"));
        assertThrows(CFTransportException.class, () -> session.get("http://cf.test/"));
    }

    @Test
    public void postEncodesTheForm() throws CFException, InterruptedException {
        transport.enqueue(StubTransport.redirect("/contest/1/my"));
        session.postForm("http://cf.test/contest/1/submit", Map.of("source", "a+b & c"), false);
        assertEquals("POST", transport.lastRequest().method());
        assertEquals("application/x-www-form-urlencoded", sentHeader("Content-Type"));
        assertFalse(transport.followRedirects.get(0));
        assertEquals(Optional.of((long) "source=a%2Bb+%26+c".length()),
                transport.lastRequest().bodyPublisher().map(p -> p.contentLength()));
    }

    @Test
    public void refreshCsrfToken() throws CFException, InterruptedException {
        transport.enqueue(200, Pages.load("home-tourist.html"));
        assertEquals("feedfacecafebeef0011223344556677", session.refreshCsrfToken());
        assertEquals("feedfacecafebeef0011223344556677", session.getCsrfToken());
        assertEquals("http://cf.test/", transport.lastRequest().uri().toString());
    }

    @Test
    public void refreshCsrfTokenWithoutToken() {
        transport.enqueue(200, "<html><body>maintenance</body></html>");
        CFAuthException e = assertThrows(CFAuthException.class, () -> session.refreshCsrfToken());
        assertEquals("csrf token not found", e.getMessage());
        assertEquals("", session.getCsrfToken());
    }

    @Test
    public void refreshCsrfTokenOnErrorStatus() {
        transport.enqueue(502, "Bad Gateway");
        assertThrows(CFHttpStatusException.class, () -> session.refreshCsrfToken());
    }

    @Test
    public void validateAcceptsMatchingHandle() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=ABC123");
        session.setHandle("tourist");
        transport.enqueue(200, Pages.load("home-tourist.html"));
        session.validate();
        assertEquals("", session.getCsrfToken());
    }

    @Test
    public void validateFindsProfileLinkWithoutScript() throws CFException, InterruptedException {
        session.setCookie("JSESSIONID=ABC123");
        session.setHandle("tourist");
        transport.enqueue(200, "<html><body><a href=\"/profile/tourist\">tourist</a></body></html>");
        session.validate();
    }

    @Test
    public void validateRejectsOtherHandle() {
        session.setCookie("JSESSIONID=ABC123");
        session.setHandle("differentuser");
        transport.enqueue(200, Pages.load("home-tourist.html"));
        CFAuthException e = assertThrows(CFAuthException.class, () -> session.validate());
        assertTrue(e.getMessage().contains("tourist"), e.getMessage());
    }

    @Test
    public void validateRejectsLoggedOutPage() {
        session.setCookie("JSESSIONID=ABC123");
        session.setHandle("tourist");
        transport.enqueue(200, "<html><body><a href=\"/enter\">Enter</a></body></html>");
        assertThrows(CFAuthException.class, () -> session.validate());
    }

    @Test
    public void validateNeedsCookiesAndHandle() {
        assertThrows(CFAuthException.class, () -> session.validate());
        session.setCookie("JSESSIONID=ABC123");
        assertThrows(CFAuthException.class, () -> session.validate());
        assertEquals(0, transport.calls());
    }

    @Test
    public void fromCredentials() {
        CredentialProvider credentials = new CredentialProvider() {
            @Override
            public String getHandle() {
                return "tourist";
            }

            @Override
            public Optional<String> getApiKey() {
                return Optional.empty();
            }

            @Override
            public Optional<String> getApiSecret() {
                return Optional.empty();
            }

            @Override
            public Optional<String> getCookies() {
                return Optional.of("JSESSIONID=ABC123; 39ce7=CFh4x");
            }

            @Override
            public Optional<String> getBypassCookie() {
                return Optional.of("clear-me");
            }

            @Override
            public Optional<String> getBypassUserAgent() {
                return Optional.of(BYPASS_UA);
            }

            @Override
            public Optional<Instant> getBypassExpiry() {
                return Optional.of(Instant.parse("2024-01-06T00:00:00Z"));
            }
        };
        AuthSession restored = AuthSession.fromCredentials(credentials, config);
        assertEquals("tourist", restored.getHandle());
        assertTrue(restored.isReadyForSubmission());
        assertTrue(restored.isBypassCookieValid());
    }
}
