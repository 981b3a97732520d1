package eu.virtualparadox.patentsearch.application.config;

import eu.virtualparadox.patentsearch.layout.anchor.EAnchorStrategy;
import eu.virtualparadox.patentsearch.layout.column.EColumnStrategy;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.apache.lucene.util.automaton.LevenshteinAutomata;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Every layout and search threshold, bound from {@code patentsearch.*} properties.
 * <p>The defaults are tuned for US patent specifications rendered on a 612x792 page.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "patentsearch")
@Getter @Setter
public class PatentSearchConfig {

    private Anchor anchor = new Anchor();
    private Columns columns = new Columns();
    private Margin margin = new Margin();
    private Lines lines = new Lines();
    private Search search = new Search();
    private Extraction extraction = new Extraction();
    private Text text = new Text();

    @PostConstruct
    public void validate() {
        if (search.maxEdits < 0 || search.maxEdits > LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE) {
            throw new IllegalArgumentException("patentsearch.search.max-edits must be between 0 and "
                    + LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE + " but was " + search.maxEdits);
        }
        if (columns.leftMaxX > columns.rightMinX) {
            throw new IllegalArgumentException("patentsearch.columns.left-max-x (" + columns.leftMaxX
                    + ") cannot exceed right-min-x (" + columns.rightMinX + ")");
        }
        if (anchor.densityThreshold < 0) {
            throw new IllegalArgumentException("patentsearch.anchor.density-threshold must be non-negative");
        }
        if (lines.gapThreshold <= 0) {
            throw new IllegalArgumentException("patentsearch.lines.gap-threshold must be positive");
        }
        if (margin.numbers == null || margin.numbers.isEmpty()) {
            throw new IllegalArgumentException("patentsearch.margin.numbers must not be empty");
        }
        if (extraction.startPage < 1) {
            throw new IllegalArgumentException("patentsearch.extraction.start-page must be at least 1");
        }
    }

    @Getter @Setter
    public static class Anchor {
        private EAnchorStrategy strategy = EAnchorStrategy.HEADER;
        /** Text of the line that follows the document number header on the first body page. */
        private String columnMarker = "1";
        /** A page becomes the anchor once it holds more margin-numbered lines than this. */
        private int densityThreshold = 4;
    }

    @Getter @Setter
    public static class Columns {
        private EColumnStrategy strategy = EColumnStrategy.EXTRACTION_ORDER;
        private float leftMaxX = 298f;
        private float rightMinX = 311f;
    }

    @Getter @Setter
    public static class Margin {
        private List<Integer> numbers = defaultMarginNumbers();
        /** Estimated x a margin number must exceed to count as a gutter number rather than prose. */
        private float minX = 263f;
        private boolean splitEnabled = true;

        private static List<Integer> defaultMarginNumbers() {
            final List<Integer> numbers = new ArrayList<>();
            for (int n = 5; n <= 65; n += 5) {
                numbers.add(n);
            }
            return numbers;
        }
    }

    @Getter @Setter
    public static class Lines {
        /** Lines with a baseline above this belong to the page header. */
        private float bodyTopY = 710f;
        private int gapThreshold = 12;
    }

    @Getter @Setter
    public static class Search {
        private int maxEdits = 2;
    }

    @Getter @Setter
    public static class Extraction {
        /** Directory holding {@code <documentId>.pdf} files. */
        private Path documents;
        private int startPage = 1;
    }

    @Getter @Setter
    public static class Text {
        private boolean normalize = true;
    }
}
