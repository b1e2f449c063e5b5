package cfweb;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Finds the anti-forgery token a page expects to be echoed back on form posts.
 */
public final class CsrfExtractor {

    private static final List<Pattern> SCRIPT_PATTERNS = List.of(
            Pattern.compile("Codeforces\\.getCsrfToken[^\"]*\"([^\"]+)\""),
            Pattern.compile("csrf_token\\s*[=:]\\s*[\"']([^\"']+)[\"']"));

    private CsrfExtractor() {
    }

    /**
     * Tries the meta tag, then the hidden form input, then inline scripts.
     */
    public static Optional<String> extract(Document doc) {
        Element meta = doc.selectFirst("meta[name=X-Csrf-Token]");
        if (meta != null && !meta.attr("content").isEmpty()) {
            return Optional.of(meta.attr("content"));
        }

        Optional<String> input = hiddenInput(doc, "csrf_token");
        if (input.isPresent()) {
            return input;
        }

        for (Element script : doc.select("script")) {
            for (Pattern pattern : SCRIPT_PATTERNS) {
                Matcher m = pattern.matcher(script.data());
                if (m.find()) {
                    return Optional.of(m.group(1));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Value of the first {@code <input name=...>} below {@code root}, if it is non-empty.
     */
    public static Optional<String> hiddenInput(Element root, String name) {
        Element input = root.selectFirst(String.format("input[name=%s]", name));
        if (input == null || input.attr("value").isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(input.attr("value"));
    }
}
