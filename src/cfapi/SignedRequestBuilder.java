package cfapi;

import java.time.Clock;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Adds {@code apiKey}, {@code time} and {@code apiSig} to the parameters of an
 * authenticated API call.
 *
 * <p>The signature is {@code rand + sha512hex(rand + "/" + method + "?" + sortedParams + "#" + secret)}
 * where {@code rand} is six decimal digits and {@code sortedParams} are the
 * {@code k=v} pairs (apiKey and time included) sorted by key and joined by {@code &}.
 */
public class SignedRequestBuilder {

    private final String apiKey;
    private final String apiSecret;
    private final Clock clock;
    private final Supplier<String> randomSource;

    public SignedRequestBuilder(String apiKey, String apiSecret, Clock clock) {
        this(apiKey, apiSecret, clock,
                () -> String.format("%06d", ThreadLocalRandom.current().nextInt(1_000_000)));
    }

    public SignedRequestBuilder(String apiKey, String apiSecret, Clock clock, Supplier<String> randomSource) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.clock = clock;
        this.randomSource = randomSource;
    }

    /**
     * @return a new sorted map holding the given parameters plus the three signing parameters
     */
    public SortedMap<String, String> sign(String method, Map<String, String> parameters) {
        SortedMap<String, String> signed = new TreeMap<>(parameters);
        signed.put("apiKey", apiKey);
        signed.put("time", Long.toString(clock.instant().getEpochSecond()));
        signed.put("apiSig", signature(randomSource.get(), method, signed, apiSecret));
        return signed;
    }

    static String signature(String rand, String method, SortedMap<String, String> parameters, String secret) {
        String query = parameters.entrySet().stream()
                .filter(e -> !e.getKey().equals("apiSig"))
                .map(e -> String.format("%s=%s", e.getKey(), e.getValue()))
                .collect(Collectors.joining("&"));
        String toHash = String.format("%s/%s?%s#%s", rand, method, query, secret);
        return rand + DigestUtils.sha512Hex(toHash);
    }
}
