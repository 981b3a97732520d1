package eu.virtualparadox.patentsearch.application.config;

import eu.virtualparadox.patentsearch.layout.anchor.AnchorFinder;
import eu.virtualparadox.patentsearch.layout.anchor.DensityAnchorFinder;
import eu.virtualparadox.patentsearch.layout.anchor.HeaderAnchorFinder;
import eu.virtualparadox.patentsearch.layout.anchor.SheetMarkerAnchorFinder;
import eu.virtualparadox.patentsearch.layout.column.ColumnAssigner;
import eu.virtualparadox.patentsearch.layout.column.ExtractionOrderColumnAssigner;
import eu.virtualparadox.patentsearch.layout.column.GeometryColumnAssigner;
import eu.virtualparadox.patentsearch.layout.margin.MarginNumberLocator;
import eu.virtualparadox.patentsearch.layout.margin.MarginNumberSplitter;
import eu.virtualparadox.patentsearch.layout.numbering.LineNumberAssigner;
import eu.virtualparadox.patentsearch.search.match.FuzzyPhraseMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the layout heuristics with the thresholds from {@link PatentSearchConfig}.
 * <p>The anchor and column strategies are exclusive; exactly one of each is active.</p>
 */
@Configuration
@Slf4j
public class LayoutConfig {

    @Bean
    public MarginNumberLocator marginNumberLocator(final PatentSearchConfig config) {
        return new MarginNumberLocator(config.getMargin().getNumbers(), config.getMargin().getMinX());
    }

    @Bean
    public AnchorFinder anchorFinder(final PatentSearchConfig config, final MarginNumberLocator locator) {
        log.info("Anchor strategy: {}", config.getAnchor().getStrategy());
        return switch (config.getAnchor().getStrategy()) {
            case HEADER -> new HeaderAnchorFinder(config.getAnchor().getColumnMarker());
            case DENSITY -> new DensityAnchorFinder(locator, config.getAnchor().getDensityThreshold());
            case SHEET_MARKER -> new SheetMarkerAnchorFinder();
        };
    }

    @Bean
    public ColumnAssigner columnAssigner(final PatentSearchConfig config) {
        log.info("Column strategy: {}", config.getColumns().getStrategy());
        return switch (config.getColumns().getStrategy()) {
            case EXTRACTION_ORDER -> new ExtractionOrderColumnAssigner();
            case GEOMETRY -> new GeometryColumnAssigner(config.getColumns().getLeftMaxX(), config.getColumns().getRightMinX());
        };
    }

    @Bean
    public MarginNumberSplitter marginNumberSplitter(final PatentSearchConfig config, final MarginNumberLocator locator) {
        return new MarginNumberSplitter(locator, config.getColumns().getLeftMaxX());
    }

    @Bean
    public LineNumberAssigner lineNumberAssigner(final PatentSearchConfig config) {
        return new LineNumberAssigner(config.getLines().getBodyTopY(), config.getLines().getGapThreshold());
    }

    @Bean
    public FuzzyPhraseMatcher fuzzyPhraseMatcher(final PatentSearchConfig config) {
        return new FuzzyPhraseMatcher(config.getSearch().getMaxEdits());
    }
}
