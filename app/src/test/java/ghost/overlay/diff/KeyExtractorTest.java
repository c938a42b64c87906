package ghost.overlay.diff;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeyExtractorTest {

    @Test
    void extractsQuotedJsonKey() {
        assertThat(KeyExtractor.extract("\"name\": \"Alice\"")).contains("name");
        assertThat(KeyExtractor.extract("    \"name\" : 42,")).contains("name");
    }

    @Test
    void extractsBareYamlKey() {
        assertThat(KeyExtractor.extract("name: value")).contains("name");
        assertThat(KeyExtractor.extract("  retries : 3")).contains("retries");
        assertThat(KeyExtractor.extract("url: http://example.com")).contains("url");
    }

    @Test
    void triesQuotedPatternBeforeBarePattern() {
        // the bare pattern alone would stop at the first colon and yield "\"a"
        assertThat(KeyExtractor.extract("\"a:b\": 1")).contains("ab");
    }

    @Test
    void keepsListItemPrefixAsPartOfKey() {
        assertThat(KeyExtractor.extract("- name: first")).contains("- name");
    }

    @Test
    void returnsEmptyForLinesWithoutKey() {
        assertThat(KeyExtractor.extract("")).isEmpty();
        assertThat(KeyExtractor.extract("{")).isEmpty();
        assertThat(KeyExtractor.extract("],")).isEmpty();
        assertThat(KeyExtractor.extract("- plain item")).isEmpty();
        assertThat(KeyExtractor.extract(": orphan value")).isEmpty();
        assertThat(KeyExtractor.extract(null)).isEmpty();
    }
}
