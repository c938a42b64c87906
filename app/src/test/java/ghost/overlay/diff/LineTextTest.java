package ghost.overlay.diff;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineTextTest {

    @Test
    void trimsSpacesTabsAndSpaceSeparators() {
        assertThat(LineText.trim(" \t\u00A0\u2003value: 1 \u3000")).isEqualTo("value: 1");
    }

    @Test
    void keepsControlCharacters() {
        assertThat(LineText.trim("\u000Bx\u001C")).isEqualTo("\u000Bx\u001C");
    }

    @Test
    void blankLineTrimsToEmpty() {
        assertThat(LineText.trim("  \t ")).isEmpty();
        assertThat(LineText.trim("")).isEmpty();
    }
}
