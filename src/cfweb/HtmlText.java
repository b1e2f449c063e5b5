package cfweb;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

public final class HtmlText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TITLE_PREFIX = Pattern.compile("^[A-Z]\\d*\\.\\s*");
    private static final Pattern TRAILING_BLANKS = Pattern.compile("[ \\t]+$");

    private HtmlText() {
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /** {@code "A. Theatre Square"} becomes {@code "Theatre Square"}. */
    public static String cleanTitle(String title) {
        return TITLE_PREFIX.matcher(collapseWhitespace(title)).replaceFirst("");
    }

    /**
     * Text of a {@code <pre>} block as the judge sees it. Line breaks written as {@code <br>} or as
     * one {@code div} per line become newlines; indentation survives.
     */
    public static String preText(Element pre) {
        Element copy = pre.clone();
        for (Element br : copy.select("br")) {
            br.replaceWith(new TextNode("\n"));
        }
        for (Element line : copy.select("div")) {
            if (!line.wholeText().endsWith("\n")) {
                line.after(new TextNode("\n"));
            }
        }
        return normalizeLines(copy.wholeText());
    }

    /**
     * Trims trailing spaces and tabs on each line and drops leading and trailing blank lines.
     */
    public static String normalizeLines(String text) {
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            out.add(TRAILING_BLANKS.matcher(line).replaceAll(""));
        }
        while (!out.isEmpty() && out.get(0).isEmpty()) {
            out.remove(0);
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        return String.join("\n", out);
    }
}
