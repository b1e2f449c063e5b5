package cfweb;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Units {

    private static final Pattern MILLIS = Pattern.compile("(\\d+)\\s*ms", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEMORY = Pattern.compile("(\\d+)\\s*(KB|MB)", Pattern.CASE_INSENSITIVE);

    private Units() {
    }

    /** {@code "46 ms"} is 46 milliseconds. Anything else, seconds included, is zero. */
    public static Duration parseTime(String text) {
        if (text == null) {
            return Duration.ZERO;
        }
        Matcher m = MILLIS.matcher(text);
        if (!m.find()) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofMillis(Long.parseLong(m.group(1)));
        } catch (NumberFormatException e) {
            return Duration.ZERO;
        }
    }

    /** Bytes for {@code "256 KB"} or {@code "1 MB"} (binary multiples). Other units are zero. */
    public static long parseMemory(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = MEMORY.matcher(text);
        if (!m.find()) {
            return 0;
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
        return m.group(2).equalsIgnoreCase("MB") ? value * 1024 * 1024 : value * 1024;
    }
}
