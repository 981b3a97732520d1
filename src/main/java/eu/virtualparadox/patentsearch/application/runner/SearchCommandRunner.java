package eu.virtualparadox.patentsearch.application.runner;

import eu.virtualparadox.patentsearch.pipeline.ReconstructedDocument;
import eu.virtualparadox.patentsearch.pipeline.report.LineReportFormatter;
import eu.virtualparadox.patentsearch.search.PatentSearchService;
import eu.virtualparadox.patentsearch.search.match.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   --document=US9740988 [--query="aerial reconnaissance"] [--report]
 * </pre>
 * {@code --report} logs the reconstructed line report, {@code --query} logs every match with its
 * column and line number.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchCommandRunner implements ApplicationRunner {

    static final String DOCUMENT = "document";
    static final String QUERY = "query";
    static final String REPORT = "report";

    private final PatentSearchService searchService;
    private final LineReportFormatter formatter;

    @Override
    public void run(final ApplicationArguments args) {
        final String documentId = firstValue(args, DOCUMENT);
        if (documentId == null) {
            log.info("No --{} given, nothing to do", DOCUMENT);
            return;
        }

        if (args.containsOption(REPORT)) {
            final ReconstructedDocument document = searchService.reconstruct(documentId);
            log.info("Reading order of {}:\n{}", documentId, formatter.format(document.lines()));
        }

        final String query = firstValue(args, QUERY);
        if (query != null) {
            final List<MatchResult> matches = searchService.search(documentId, query);
            for (final MatchResult match : matches) {
                log.info("Match for [{}] in column {} line {}", query, match.column(), match.line());
            }
        }
    }

    private static String firstValue(final ApplicationArguments args, final String option) {
        final List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
