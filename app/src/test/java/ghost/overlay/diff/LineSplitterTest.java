package ghost.overlay.diff;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineSplitterTest {

    @Test
    void emptyTextIsOneEmptyLine() {
        assertThat(LineSplitter.split("")).containsExactly("");
    }

    @Test
    void keepsTrailingEmptyLine() {
        assertThat(LineSplitter.split("a\n")).containsExactly("a", "");
        assertThat(LineSplitter.split("a\n\n")).containsExactly("a", "", "");
    }

    @Test
    void treatsEveryNewlineConventionAsOneBoundary() {
        assertThat(LineSplitter.split("a\r\nb\rc\nd")).containsExactly("a", "b", "c", "d");
    }

    @Test
    void splitsOnUnicodeAndControlLineBreaks() {
        assertThat(LineSplitter.split("a\u0085b\u2028c\u2029d\u000Be\ff"))
                .containsExactly("a", "b", "c", "d", "e", "f");
    }
}
