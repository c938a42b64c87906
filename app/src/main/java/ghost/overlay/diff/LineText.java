package ghost.overlay.diff;

/**
 * Normalizes line content before comparison.
 */
public final class LineText {

    private LineText() {
    }

    /**
     * Removes leading and trailing horizontal whitespace: tab and every Unicode space separator, including the
     * no-break space. Control characters such as vertical tab are kept.
     */
    public static String trim(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isHorizontalWhitespace(line.charAt(start))) {
            start++;
        }
        while (end > start && isHorizontalWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    static boolean isHorizontalWhitespace(char ch) {
        return ch == '\t' || Character.getType(ch) == Character.SPACE_SEPARATOR;
    }
}
