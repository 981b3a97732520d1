package eu.virtualparadox.patentsearch.search.match;

import eu.virtualparadox.patentsearch.search.index.SearchToken;

import java.util.List;

/**
 * A phrase occurrence.
 *
 * @param startIndex position of the first matched token in the searched sequence
 * @param tokens     matched tokens in order; a hyphenation merge contributes only its first token
 */
public record MatchResult(int startIndex, List<SearchToken> tokens) {

    public MatchResult {
        tokens = List.copyOf(tokens);
    }

    public SearchToken anchor() {
        return tokens.get(0);
    }

    public int column() {
        return anchor().column();
    }

    public int line() {
        return anchor().line();
    }
}
