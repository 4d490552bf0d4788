package im.arun.planindex.token;

import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.PageGeometry;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Vector text from the source PDF using Apache PDFBox. This is the preferred source:
 * the text is exact, so every token carries confidence 1.0.
 *
 * <p>Word boxes are collected in PDF points and scaled to the target raster independently
 * per axis ({@code scale = targetPx / pagePoints}). The page size in points comes from
 * {@link PageStorage#pdfPageGeometry}.
 */
public class VectorPdfTokenProvider implements TokenProvider {
    private static final Logger logger = LoggerFactory.getLogger(VectorPdfTokenProvider.class);

    private final PageStorage storage;
    private final int defaultDpi;

    public VectorPdfTokenProvider() {
        this(new FileSystemPageStorage(), PageRasterSpec.DEFAULT_DPI);
    }

    public VectorPdfTokenProvider(PageStorage storage, int defaultDpi) {
        this.storage = storage;
        this.defaultDpi = defaultDpi;
    }

    @Override
    public List<TextToken> getTokens(PageRef page, PageRasterSpec raster) {
        Path pdfPath = page.getPdfPath();
        if (pdfPath == null) {
            logger.debug("No PDF for page {}, skipping vector text", page.getPageId());
            return List.of();
        }

        try {
            return extract(page, pdfPath, raster);
        } catch (SourceUnavailableException e) {
            logger.warn("Vector text unavailable for page {}: {}", page.getPageId(), e.getMessage());
            return List.of();
        }
    }

    private List<TextToken> extract(PageRef page, Path pdfPath, PageRasterSpec raster)
            throws SourceUnavailableException {
        int pageNumber = page.getPageNumber();
        PageGeometry geometry = storage.pdfPageGeometry(pdfPath, pageNumber);

        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            PageRasterSpec target = raster != null ? raster : PageRasterSpec.forPage(geometry, defaultDpi);
            double scaleX = target.getWidthPx() / geometry.getWidthPt();
            double scaleY = target.getHeightPx() / geometry.getHeightPt();

            WordCollector collector = new WordCollector();
            collector.setSortByPosition(true);
            collector.setStartPage(pageNumber + 1);
            collector.setEndPage(pageNumber + 1);
            collector.getText(document);

            List<TextToken> tokens = new ArrayList<>();
            for (Word word : collector.words) {
                String text = word.text.toString().strip();
                if (text.isEmpty()) {
                    continue;
                }
                int x = (int) (word.minX * scaleX);
                int y = (int) (word.minY * scaleY);
                int w = Math.max((int) ((word.maxX - word.minX) * scaleX), 1);
                int h = Math.max((int) ((word.maxY - word.minY) * scaleY), 1);
                tokens.add(TextToken.builder()
                        .text(text)
                        .bbox(BoundingBox.of(x, y, w, h))
                        .confidence(1.0)
                        .source(TokenSource.VECTOR)
                        .pageId(page.getPageId())
                        .build());
            }

            logger.info("Extracted {} vector tokens from {} page {}", tokens.size(), pdfPath.getFileName(), pageNumber);
            return tokens;
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot read PDF " + pdfPath, e);
        }
    }

    /**
     * Splits glyph runs into words on whitespace and on horizontal gaps wider than half a glyph.
     */
    private static final class WordCollector extends PDFTextStripper {
        private final List<Word> words = new ArrayList<>();
        private Word current;
        private TextPosition previous;

        WordCollector() throws IOException {
            super();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) {
            for (TextPosition position : textPositions) {
                String unicode = position.getUnicode();
                if (unicode == null || unicode.isEmpty()) {
                    continue;
                }
                if (Character.isWhitespace(unicode.charAt(0))) {
                    flush();
                    continue;
                }
                if (current == null || needsBreak(position)) {
                    flush();
                    current = new Word();
                }
                current.append(position);
                previous = position;
            }
            // Each run ends a line, never a word continuation
            flush();
        }

        private boolean needsBreak(TextPosition position) {
            if (previous == null) {
                return true;
            }
            float previousEnd = previous.getXDirAdj() + previous.getWidthDirAdj();
            float gap = position.getXDirAdj() - previousEnd;
            return gap > position.getWidthDirAdj() * 0.5f;
        }

        private void flush() {
            if (current != null && current.text.length() > 0) {
                words.add(current);
            }
            current = null;
            previous = null;
        }
    }

    private static final class Word {
        private final StringBuilder text = new StringBuilder();
        private double minX;
        private double minY;
        private double maxX;
        private double maxY;
        private boolean empty = true;

        void append(TextPosition position) {
            text.append(position.getUnicode());
            double x = position.getXDirAdj();
            double baseline = position.getYDirAdj();
            double top = baseline - position.getHeightDir();
            double right = x + position.getWidthDirAdj();

            if (empty) {
                minX = x;
                minY = top;
                maxX = right;
                maxY = baseline;
                empty = false;
            } else {
                minX = Math.min(minX, x);
                minY = Math.min(minY, top);
                maxX = Math.max(maxX, right);
                maxY = Math.max(maxY, baseline);
            }
        }
    }
}
