package ghost.overlay.source;

import java.util.Objects;

/**
 * Raw text of one compared document together with a label for display.
 */
public record Document(String displayName, String content) {

    public Document {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(content, "content");
    }
}
