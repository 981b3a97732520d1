package eu.virtualparadox.patentsearch.ingest.extractor;

import eu.virtualparadox.patentsearch.application.config.PatentSearchConfig;
import eu.virtualparadox.patentsearch.ingest.model.TextFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads fragments from {@code <documents>/<documentId>.pdf} with Apache PDFBox.
 * <p>
 * Each run of text that PDFBox reports is turned into one {@link TextFragment}. Coordinates are
 * converted to PDF user space (origin bottom-left), so baselines decrease down the page.
 * Text is kept in content stream order; no position sorting is applied.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class PdfBoxFragmentSource implements FragmentSource {

    private final PatentSearchConfig config;

    @Override
    public List<TextFragment> fetchFragments(final String documentId) {
        final Path documents = config.getExtraction().getDocuments();
        if (documents == null) {
            throw new IllegalStateException("patentsearch.extraction.documents is not configured");
        }

        final Path root = documents.toAbsolutePath().normalize();
        final Path path = root.resolve(documentId + ".pdf").normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Document id resolves outside of the documents directory: " + documentId);
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Document not found: " + documentId + " (" + path + ")");
        }
        return extractFragments(path);
    }

    /**
     * Extracts all fragments of {@code path}, starting at the configured start page.
     *
     * @param path PDF file
     * @return fragments in content stream order
     */
    public List<TextFragment> extractFragments(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final FragmentStripper stripper = new FragmentStripper();
            stripper.setStartPage(config.getExtraction().getStartPage());
            stripper.setEndPage(pdf.getNumberOfPages());
            stripper.writeText(pdf, Writer.nullWriter());

            log.info("Extracted {} fragments from {} ({} pages)",
                    stripper.fragments.size(), path.getFileName(), pdf.getNumberOfPages());
            return stripper.fragments;
        }
        catch (IOException e) {
            throw new IllegalStateException("Failed to extract text fragments from PDF " + path, e);
        }
    }

    private static final class FragmentStripper extends PDFTextStripper {

        private final List<TextFragment> fragments = new ArrayList<>();

        // PDFBox reports words separately when it infers the space itself
        private boolean pendingSpace;

        FragmentStripper() throws IOException {
            super();
        }

        @Override
        protected void writeString(final String text, final List<TextPosition> positions) {
            if (positions.isEmpty()) {
                return;
            }

            final TextPosition first = positions.get(0);
            final TextPosition last = positions.get(positions.size() - 1);
            final float pageHeight = getCurrentPage().getMediaBox().getHeight();

            final float x = first.getXDirAdj();
            final float y = pageHeight - first.getYDirAdj();
            final float width = last.getXDirAdj() + last.getWidthDirAdj() - x;
            final String fragmentText = pendingSpace ? " " + text : text;

            fragments.add(new TextFragment(getCurrentPageNo(), x, y, width, fragmentText));
            pendingSpace = false;
        }

        @Override
        protected void writeWordSeparator() {
            pendingSpace = true;
        }

        @Override
        protected void writeLineSeparator() {
            pendingSpace = false;
        }
    }
}
