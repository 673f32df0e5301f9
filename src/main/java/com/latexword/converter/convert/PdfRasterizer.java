package com.latexword.converter.convert;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Renders the first page of a PDF figure to PNG so it can be embedded in
 * a Word document.
 */
public class PdfRasterizer {
    private static final Logger log = LoggerFactory.getLogger(PdfRasterizer.class);

    static final float SCALE = 3f;

    /**
     * @return PNG bytes, or empty when the file cannot be rendered
     */
    public Optional<byte[]> rasterize(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            if (document.getNumberOfPages() == 0) {
                log.warn("PDF image {} has no pages", pdf);
                return Optional.empty();
            }
            BufferedImage image = new PDFRenderer(document).renderImage(0, SCALE, ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            log.debug("Rasterized {} to {}x{} PNG", pdf.getFileName(), image.getWidth(), image.getHeight());
            return Optional.of(out.toByteArray());
        } catch (IOException e) {
            log.warn("Failed to rasterize PDF image {}: {}", pdf, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return the width of the first page in PostScript points, or empty
     *         when the file cannot be read
     */
    public Optional<Float> firstPageWidth(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            if (document.getNumberOfPages() == 0) {
                return Optional.empty();
            }
            return Optional.of(document.getPage(0).getMediaBox().getWidth());
        } catch (IOException e) {
            log.warn("Failed to read PDF page size of {}: {}", pdf, e.getMessage());
            return Optional.empty();
        }
    }
}
