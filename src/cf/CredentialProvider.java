package cf;

import java.time.Instant;
import java.util.Optional;

/**
 * Supplies stored credentials. Where they live (a dotfile, the environment, a
 * keychain) is the provider's business; the client never reads them itself.
 */
public interface CredentialProvider {

    String getHandle();

    Optional<String> getApiKey();

    Optional<String> getApiSecret();

    /** Browser cookie string, e.g. {@code "JSESSIONID=...; 39ce7=..."}. */
    Optional<String> getCookies();

    Optional<String> getBypassCookie();

    Optional<String> getBypassUserAgent();

    Optional<Instant> getBypassExpiry();
}
