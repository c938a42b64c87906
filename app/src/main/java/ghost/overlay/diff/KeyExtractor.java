package ghost.overlay.diff;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristically extracts the structural key of a JSON- or YAML-shaped line.
 *
 * <p>This is a classification hint, not a parser. The quoted pattern is always tried before the bare one, and a
 * colon inside a value or a list-item prefix can produce a spurious key.
 */
public final class KeyExtractor {

    private static final Pattern QUOTED_KEY = Pattern.compile("^\\s*\"([^\"]+)\"\\s*:", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern BARE_KEY = Pattern.compile("^\\s*([^:]+):", Pattern.UNICODE_CHARACTER_CLASS);

    private KeyExtractor() {
    }

    public static Optional<String> extract(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = LineText.trim(line);

        Matcher quoted = QUOTED_KEY.matcher(trimmed);
        if (quoted.find()) {
            return Optional.of(LineText.trim(quoted.group().replace("\"", "").replace(":", "")));
        }

        Matcher bare = BARE_KEY.matcher(trimmed);
        if (bare.find()) {
            return Optional.of(LineText.trim(bare.group().replace(":", "")));
        }
        return Optional.empty();
    }
}
