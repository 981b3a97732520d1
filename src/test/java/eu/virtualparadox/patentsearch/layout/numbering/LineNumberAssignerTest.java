package eu.virtualparadox.patentsearch.layout.numbering;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LineNumberAssignerTest {

    private final LineNumberAssigner assigner = new LineNumberAssigner(710f, 12);

    @Test
    @DisplayName("Adjacent lines count by one, a wide gap counts as a skipped line")
    void testIncrements() {
        final List<AnchoredLine> numbered = assigner.assignLineNumbers(List.of(
                line(1, 700f),
                line(1, 688f),
                line(1, 676.4f),
                line(1, 652f),
                line(1, 640f)
        ));

        assertEquals(List.of(1, 2, 3, 5, 6), lineNumbers(numbered));
    }

    @Test
    @DisplayName("The gap is measured on truncated baselines")
    void testTruncatedGap() {
        // 700.9 - 687.5 = 13.4 but 700 - 687 = 13 > 12; 687.5 - 675.1 = 12.4 but 687 - 675 = 12
        final List<AnchoredLine> numbered = assigner.assignLineNumbers(List.of(
                line(1, 700.9f),
                line(1, 687.5f),
                line(1, 675.1f)
        ));

        assertEquals(List.of(1, 3, 4), lineNumbers(numbered));
    }

    @Test
    @DisplayName("Numbering restarts in every column and after unassigned lines")
    void testResets() {
        final List<AnchoredLine> numbered = assigner.assignLineNumbers(List.of(
                line(1, 700f),
                line(1, 688f),
                line(2, 700f),
                line(2, 688f),
                line(0, 670f),
                line(2, 600f)
        ));

        assertEquals(List.of(1, 2, 1, 2, 0, 1), lineNumbers(numbered));
    }

    @Test
    @DisplayName("Page header lines lose their column and get no number")
    void testHeaderSkipped() {
        final List<AnchoredLine> numbered = assigner.assignLineNumbers(List.of(
                line(3, 740f),
                line(3, 711f),
                line(3, 710f),
                line(3, 698f)
        ));

        assertEquals(List.of(0, 0, 3, 3), numbered.stream().map(AnchoredLine::column).toList());
        assertEquals(List.of(0, 0, 1, 2), lineNumbers(numbered));
    }

    @Test
    @DisplayName("Within a column numbers never decrease and a gap over the threshold always advances")
    void testMonotonicProperty() {
        final Random random = new Random(42);
        for (int run = 0; run < 50; run++) {
            final List<AnchoredLine> lines = new ArrayList<>();
            float y = 700f;
            for (int i = 0; i < 40; i++) {
                lines.add(line(1, y));
                y -= 1 + random.nextInt(30);
            }

            final List<AnchoredLine> numbered = assigner.assignLineNumbers(lines);
            for (int i = 1; i < numbered.size(); i++) {
                final AnchoredLine previous = numbered.get(i - 1);
                final AnchoredLine current = numbered.get(i);
                assertTrue(current.lineNumber() > previous.lineNumber(), "line numbers must increase");
                if ((int) previous.y() - (int) current.y() > 12) {
                    assertEquals(previous.lineNumber() + 2, current.lineNumber());
                }
            }
        }
    }

    private static AnchoredLine line(final int column, final float y) {
        return new AnchoredLine(1, 72f, y, 100f, "text", column, 0);
    }

    private static List<Integer> lineNumbers(final List<AnchoredLine> lines) {
        return lines.stream().map(AnchoredLine::lineNumber).toList();
    }
}
