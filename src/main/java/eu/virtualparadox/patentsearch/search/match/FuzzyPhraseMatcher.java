package eu.virtualparadox.patentsearch.search.match;

import eu.virtualparadox.patentsearch.error.InvalidQueryException;
import eu.virtualparadox.patentsearch.search.index.SearchToken;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.util.automaton.CharacterRunAutomaton;
import org.apache.lucene.util.automaton.LevenshteinAutomata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Approximate phrase search over a reading-ordered token sequence.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>The query is lower-cased and split on whitespace. Each query word is compiled once into a
 *       Lucene Levenshtein automaton accepting every string within {@code maxEdits} unit-cost
 *       insertions, deletions or substitutions (no transpositions).</li>
 *   <li>A window is opened at every index where the whole phrase still fits. Query word {@code j}
 *       is compared with the next unconsumed token:
 *     <ul>
 *       <li>accepted if the automaton accepts the token;</li>
 *       <li>otherwise, if the token ends its line, the token glued to the following one is tried,
 *           which recovers words hyphenated over a line break. On success both tokens are consumed
 *           and only the first is reported;</li>
 *       <li>anything else closes the window without a match.</li>
 *     </ul>
 *   </li>
 * </ol>
 * <p>Word order is strict. Worst case is {@code O(N * M)} automaton runs for {@code N} tokens and
 * {@code M} query words, each linear in the token length.</p>
 *
 * <p>Stateless after construction and thus thread-safe.</p>
 */
public final class FuzzyPhraseMatcher {

    private final int maxEdits;

    /**
     * @param maxEdits edit distance tolerance per word, between 0 and
     *                 {@link LevenshteinAutomata#MAXIMUM_SUPPORTED_DISTANCE}
     */
    public FuzzyPhraseMatcher(final int maxEdits) {
        if (maxEdits < 0 || maxEdits > LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE) {
            throw new IllegalArgumentException("maxEdits must be between 0 and "
                    + LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE + " but was " + maxEdits);
        }
        this.maxEdits = maxEdits;
    }

    /**
     * Finds every approximate occurrence of {@code query} in {@code index}.
     *
     * @param index reading-ordered token sequence
     * @param query raw query phrase
     * @return matches ordered by start position, never {@code null}
     * @throws InvalidQueryException if {@code query} is null or blank
     */
    public List<MatchResult> search(final List<SearchToken> index, final String query) {
        Objects.requireNonNull(index, "index must not be null");
        if (StringUtils.isBlank(query)) {
            throw new InvalidQueryException("Query must contain at least one word");
        }

        final String[] words = StringUtils.split(query.trim().toLowerCase(Locale.ROOT));
        final List<CharacterRunAutomaton> automata = new ArrayList<>(words.length);
        for (final String word : words) {
            automata.add(compile(word));
        }

        final List<MatchResult> results = new ArrayList<>();
        for (int start = 0; start + words.length <= index.size(); start++) {
            final List<SearchToken> matched = matchWindow(index, start, automata);
            if (matched != null) {
                results.add(new MatchResult(start, matched));
            }
        }
        return results;
    }

    /**
     * @return matched tokens, or {@code null} if the window starting at {@code start} does not match
     */
    private List<SearchToken> matchWindow(final List<SearchToken> index,
                                          final int start,
                                          final List<CharacterRunAutomaton> automata) {
        final List<SearchToken> matched = new ArrayList<>(automata.size());
        int position = start;

        for (final CharacterRunAutomaton automaton : automata) {
            if (position >= index.size()) {
                return null;
            }

            final SearchToken token = index.get(position);
            if (automaton.run(token.text())) {
                matched.add(token);
                position++;
                continue;
            }

            if (endsLine(index, position) && automaton.run(token.text() + index.get(position + 1).text())) {
                matched.add(token);
                position += 2;
                continue;
            }

            return null;
        }
        return matched;
    }

    private static boolean endsLine(final List<SearchToken> index, final int position) {
        return position + 1 < index.size()
                && index.get(position).isOnOtherLineThan(index.get(position + 1));
    }

    private CharacterRunAutomaton compile(final String word) {
        return new CharacterRunAutomaton(new LevenshteinAutomata(word, false).toAutomaton(maxEdits));
    }
}
