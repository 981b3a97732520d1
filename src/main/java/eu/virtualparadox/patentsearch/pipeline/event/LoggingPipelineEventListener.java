package eu.virtualparadox.patentsearch.pipeline.event;

import eu.virtualparadox.patentsearch.pipeline.report.LineReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs stage counts at DEBUG and, for line-producing stages, the full line report at TRACE.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoggingPipelineEventListener implements PipelineEventListener {

    private final LineReportFormatter formatter;

    @Override
    public void onEvent(final PipelineEvent event) {
        log.debug("[{}] {}: {} in, {} out",
                event.documentId(), event.stage(), event.inputCount(), event.outputCount());

        // the report is large, only build it when asked for
        if (log.isTraceEnabled() && !event.lines().isEmpty()) {
            log.trace("[{}] {} lines:\n{}", event.documentId(), event.stage(), formatter.format(event.lines()));
        }
    }
}
