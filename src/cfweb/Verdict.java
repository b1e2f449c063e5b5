package cfweb;

import java.util.List;
import java.util.Locale;

public enum Verdict {
    OK("accepted", "pretests passed", "perfect result"),
    WRONG_ANSWER("wrong answer"),
    TIME_LIMIT_EXCEEDED("time limit exceeded"),
    MEMORY_LIMIT_EXCEEDED("memory limit exceeded"),
    RUNTIME_ERROR("runtime error"),
    COMPILATION_ERROR("compilation error"),
    PRESENTATION_ERROR("presentation error"),
    IDLENESS_LIMIT_EXCEEDED("idleness limit exceeded"),
    CHALLENGED("hacked", "challenged");

    private final List<String> prefixes;

    Verdict(String... prefixes) {
        this.prefixes = List.of(prefixes);
    }

    private boolean matches(String lower) {
        return prefixes.stream().anyMatch(lower::startsWith);
    }

    /**
     * Maps judge text such as {@code "Wrong answer on test 5"} to its code. Text that already is a
     * code is kept, and unknown text is returned trimmed but otherwise unchanged.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = HtmlText.collapseWhitespace(text);
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (Verdict v : values()) {
            if (v.name().equals(trimmed) || v.matches(lower)) {
                return v.name();
            }
        }
        return trimmed;
    }
}
