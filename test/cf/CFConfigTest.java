package cf;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class CFConfigTest {

    @Test
    public void defaults() {
        CFConfig config = new CFConfig();
        assertEquals("https://codeforces.com/api", config.getApiBaseUrl());
        assertEquals("https://codeforces.com", config.getWebBaseUrl());
        assertEquals("cf/1.0", config.getApiUserAgent());
        assertEquals(Duration.ofMinutes(5), config.getCacheTtl());
        assertEquals(1000, config.getCacheMaxEntries());
        assertEquals(5.0, config.getRequestsPerSecond());
        assertEquals(10L * 1024 * 1024, config.getMaxResponseBytes());
        assertEquals(5L * 1024 * 1024, config.getMaxPageBytes());
    }

    @Test
    public void trailingSlashIsStripped() {
        CFConfig config = new CFConfig().setWebBaseUrl("http://localhost:8080/").setApiBaseUrl("http://localhost/api/");
        assertEquals("http://localhost:8080", config.getWebBaseUrl());
        assertEquals("http://localhost/api", config.getApiBaseUrl());
    }

    @Test
    public void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new CFConfig().setRequestsPerSecond(0));
    }

    @Test
    public void fromCredentialsCopiesApiKey() {
        CFConfig config = CFConfig.from(new CredentialProvider() {
            @Override
            public String getHandle() {
                return "tourist";
            }

            @Override
            public Optional<String> getApiKey() {
                return Optional.of("key");
            }

            @Override
            public Optional<String> getApiSecret() {
                return Optional.of("secret");
            }

            @Override
            public Optional<String> getCookies() {
                return Optional.empty();
            }

            @Override
            public Optional<String> getBypassCookie() {
                return Optional.empty();
            }

            @Override
            public Optional<String> getBypassUserAgent() {
                return Optional.empty();
            }

            @Override
            public Optional<Instant> getBypassExpiry() {
                return Optional.empty();
            }
        });
        assertEquals("key", config.getApiKey());
        assertEquals("secret", config.getApiSecret());
    }
}
