package eu.virtualparadox.patentsearch.layout.anchor;

import eu.virtualparadox.patentsearch.PatentLayoutFixture;
import eu.virtualparadox.patentsearch.error.AnchorNotFoundException;
import eu.virtualparadox.patentsearch.ingest.combiner.FragmentCombiner;
import eu.virtualparadox.patentsearch.ingest.model.Line;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeaderAnchorFinderTest {

    private final HeaderAnchorFinder finder = new HeaderAnchorFinder("1");

    @Test
    @DisplayName("Anchors on the document number followed by the column marker")
    void testFindsHeaderOnFirstBodyPage() {
        final List<Line> lines = new FragmentCombiner().combineFragments(PatentLayoutFixture.fragments());

        assertThat(finder.findAnchor(lines, PatentLayoutFixture.DOCUMENT_ID))
                .isEqualTo(PatentLayoutFixture.ANCHOR_INDEX);
    }

    @Test
    @DisplayName("Whitespace in the identifier and in the header is ignored")
    void testWhitespaceInsensitive() {
        final List<Line> lines = List.of(
                new Line(1, 10f, 700f, 10f, "US 9,740,988"),
                new Line(1, 10f, 600f, 10f, "abstract"),
                new Line(2, 10f, 740f, 10f, "US  9,740, 988"),
                new Line(2, 10f, 725f, 10f, " 1 ")
        );

        assertThat(finder.findAnchor(lines, " US 9,740,988 ")).isEqualTo(2);
    }

    @Test
    @DisplayName("A header not followed by the marker is not an anchor")
    void testHeaderWithoutMarker() {
        final List<Line> lines = List.of(
                new Line(1, 10f, 700f, 10f, "US9740988"),
                new Line(1, 10f, 600f, 10f, "12")
        );

        assertThatThrownBy(() -> finder.findAnchor(lines, "US9740988"))
                .isInstanceOf(AnchorNotFoundException.class)
                .hasMessageContaining("US9740988");
    }

    @Test
    @DisplayName("A header on the last line has no marker to check")
    void testHeaderOnLastLine() {
        final List<Line> lines = List.of(new Line(1, 10f, 700f, 10f, "US9740988"));

        assertThatThrownBy(() -> finder.findAnchor(lines, "US9740988"))
                .isInstanceOf(AnchorNotFoundException.class);
    }
}
