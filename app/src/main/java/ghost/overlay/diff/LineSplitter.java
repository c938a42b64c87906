package ghost.overlay.diff;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits raw text into lines using one rule for both documents. {@code \r\n} ends a line, as does any single
 * {@code \n}, {@code \r}, vertical tab, form feed, NEL (U+0085), line separator (U+2028) or paragraph separator
 * (U+2029). Trailing empty lines are kept.
 */
public final class LineSplitter {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|[\\n\\x0B\\f\\r\\u0085\\u2028\\u2029]");

    private LineSplitter() {
    }

    public static List<String> split(String text) {
        Objects.requireNonNull(text, "text");
        return List.of(LINE_BREAK.split(text, -1));
    }
}
