package im.arun.planindex.token;

import im.arun.planindex.model.PageGeometry;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link PageStorage} over plain files: the page raster at {@link PageRef#getImagePath()} and
 * the source PDF on disk.
 *
 * <p>A page without a stored image is rendered from its PDF at {@code renderDpi}, which gives
 * the same pixel space as {@link PageRasterSpec#forPage} at that resolution.
 */
public class FileSystemPageStorage implements PageStorage {

    private final int renderDpi;

    public FileSystemPageStorage() {
        this(PageRasterSpec.DEFAULT_DPI);
    }

    public FileSystemPageStorage(int renderDpi) {
        if (renderDpi <= 0) {
            throw new IllegalArgumentException("Render DPI must be positive: " + renderDpi);
        }
        this.renderDpi = renderDpi;
    }

    @Override
    public byte[] readPageBytes(PageRef page) throws SourceUnavailableException {
        Path imagePath = page.getImagePath();
        if (imagePath != null) {
            if (!Files.isRegularFile(imagePath)) {
                throw new SourceUnavailableException("Page image not found: " + imagePath);
            }
            try {
                return Files.readAllBytes(imagePath);
            } catch (IOException e) {
                throw new SourceUnavailableException("Cannot read page image " + imagePath, e);
            }
        }
        if (page.getPdfPath() == null) {
            throw new SourceUnavailableException("No page image or PDF for page " + page.getPageId());
        }
        return renderPage(page.getPdfPath(), page.getPageNumber());
    }

    @Override
    public PageGeometry pdfPageGeometry(Path pdf, int pageNumber) throws SourceUnavailableException {
        try (PDDocument document = open(pdf)) {
            return geometryOf(pageOf(document, pageNumber));
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot read PDF " + pdf, e);
        }
    }

    private byte[] renderPage(Path pdf, int pageNumber) throws SourceUnavailableException {
        try (PDDocument document = open(pdf)) {
            pageOf(document, pageNumber);
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(pageNumber, renderDpi, ImageType.RGB);
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            ImageIO.write(image, "png", png);
            return png.toByteArray();
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot render page " + pageNumber + " of " + pdf, e);
        }
    }

    private static PDDocument open(Path pdf) throws SourceUnavailableException, IOException {
        if (pdf == null || !Files.isRegularFile(pdf)) {
            throw new SourceUnavailableException("PDF not found: " + pdf);
        }
        return Loader.loadPDF(pdf.toFile());
    }

    private static PDPage pageOf(PDDocument document, int pageNumber) throws SourceUnavailableException {
        if (pageNumber < 0 || pageNumber >= document.getNumberOfPages()) {
            throw new SourceUnavailableException("Page " + pageNumber + " out of range, PDF has "
                    + document.getNumberOfPages() + " pages");
        }
        return document.getPage(pageNumber);
    }

    /**
     * Displayed size of a page: the crop box, with width and height swapped for quarter turns.
     */
    static PageGeometry geometryOf(PDPage page) {
        PDRectangle box = page.getCropBox();
        int rotation = Math.floorMod(page.getRotation(), 360);
        if (rotation == 90 || rotation == 270) {
            return new PageGeometry(box.getHeight(), box.getWidth());
        }
        return new PageGeometry(box.getWidth(), box.getHeight());
    }
}
