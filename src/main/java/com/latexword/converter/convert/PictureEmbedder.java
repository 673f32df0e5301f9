package com.latexword.converter.convert;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Embeds an image file into a paragraph at a given width, keeping its
 * aspect ratio. PDF images are rendered to PNG first.
 */
public class PictureEmbedder {

    private final PdfRasterizer pdfRasterizer;

    public PictureEmbedder() {
        this(new PdfRasterizer());
    }

    public PictureEmbedder(PdfRasterizer pdfRasterizer) {
        this.pdfRasterizer = pdfRasterizer;
    }

    public PdfRasterizer getPdfRasterizer() {
        return pdfRasterizer;
    }

    /**
     * @throws IOException when the file cannot be read or is not a supported bitmap
     */
    public void embed(XWPFParagraph paragraph, Path file, double widthCm)
        throws IOException, InvalidFormatException {
        byte[] bytes;
        int pictureType;
        if (ImageResolver.isPdf(file)) {
            Optional<byte[]> png = pdfRasterizer.rasterize(file);
            if (png.isEmpty()) {
                throw new IOException("PDF could not be rendered");
            }
            bytes = png.get();
            pictureType = Document.PICTURE_TYPE_PNG;
        } else {
            bytes = Files.readAllBytes(file);
            pictureType = pictureType(file);
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null || pictureType < 0) {
            throw new IOException("unsupported image format");
        }
        double widthPt = widthCm / 2.54 * 72;
        double heightPt = widthPt * image.getHeight() / image.getWidth();
        String name = file.getFileName().toString();
        paragraph.createRun().addPicture(new ByteArrayInputStream(bytes), pictureType, name,
            Units.toEMU(widthPt), Units.toEMU(heightPt));
    }

    static int pictureType(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return Document.PICTURE_TYPE_PNG;
        }
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return Document.PICTURE_TYPE_JPEG;
        }
        if (name.endsWith(".gif")) {
            return Document.PICTURE_TYPE_GIF;
        }
        if (name.endsWith(".bmp")) {
            return Document.PICTURE_TYPE_BMP;
        }
        return -1;
    }
}
