package eu.virtualparadox.patentsearch.search.index;

import eu.virtualparadox.patentsearch.ingest.model.AnchoredLine;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flattens reconstructed lines into the token sequence searched by the phrase matcher.
 * <p>
 * Lines are first put into reading order ({@link AnchoredLine#READING_ORDER}), since adjacency
 * in the token sequence is what phrase and hyphenation matching rely on. Lines without a column
 * are front matter or page furniture and are left out.
 * </p>
 */
@Component
public class SearchIndexBuilder {

    public List<SearchToken> buildIndex(final List<AnchoredLine> lines) {
        final List<AnchoredLine> ordered = new ArrayList<>(lines);
        ordered.sort(AnchoredLine.READING_ORDER);

        final List<SearchToken> tokens = new ArrayList<>();
        for (final AnchoredLine line : ordered) {
            if (!line.isBody()) {
                continue;
            }
            for (final String word : StringUtils.split(line.text())) {
                tokens.add(new SearchToken(line.column(), line.lineNumber(), word.trim().toLowerCase(Locale.ROOT)));
            }
        }
        return tokens;
    }
}
