package eu.virtualparadox.patentsearch.ingest.cleaner;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LineTextCleaner}.
 *
 * These tests cover punctuation spacing left by extraction, control and zero-width
 * characters, non-breaking spaces, soft hyphens and whitespace normalization.
 */
class LineTextCleanerTest {

    private LineTextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new LineTextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        assertThat(cleaner.cleanText("a method of aerial survey")).isEqualTo("a method of aerial survey");
    }

    @Test
    void testSpaceBeforePunctuationIsClosed() {
        assertThat(cleaner.cleanText("drones , cameras")).isEqualTo("drones, cameras");
        assertThat(cleaner.cleanText("input /output")).isEqualTo("input/output");
        assertThat(cleaner.cleanText("operator ' s console")).isEqualTo("operator's console");
        assertThat(cleaner.cleanText("non -volatile")).isEqualTo("non-volatile");
        assertThat(cleaner.cleanText("FIG . 3")).isEqualTo("FIG.3");
    }

    @Test
    void testLineIsTrimmed() {
        assertThat(cleaner.cleanText("   which store images  ")).isEqualTo("which store images");
    }

    @Test
    void testControlCharactersAreRemoved() {
        assertThat(cleaner.cleanText("valid\u0007text")).isEqualTo("validtext");
    }

    @Test
    void testTabsAndLineBreaksBecomeSpaces() {
        assertThat(cleaner.cleanText("first\tsecond\r\nthird")).isEqualTo("first second third");
    }

    @Test
    void testNonBreakingSpaceIsNormalized() {
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testZeroWidthAndSoftHyphenAreRemoved() {
        assertThat(cleaner.cleanText("recon\u00ADnais\u200Bsance")).isEqualTo("reconnaissance");
    }

    @Test
    void testNullAndEmpty() {
        assertThat(cleaner.cleanText(null)).isEmpty();
        assertThat(cleaner.cleanText("")).isEmpty();
    }

    @Test
    void testCleanLinesKeepsGeometry() {
        final AnchoredLine line = new AnchoredLine(2, 72f, 700f, 100f, "  drones , cameras ", 3, 7);

        final List<AnchoredLine> cleaned = cleaner.cleanLines(List.of(line));

        assertThat(cleaned).containsExactly(new AnchoredLine(2, 72f, 700f, 100f, "drones, cameras", 3, 7));
    }
}
