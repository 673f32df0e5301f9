package com.latexword.converter.math;

import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlOptions;
import org.openxmlformats.schemas.officeDocument.x2006.math.CTOMathPara;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import javax.xml.XMLConstants;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Inserts LaTeX math into Word paragraphs as native equations.
 *
 * <p>The fragment is translated to MathML, then transformed to Office Math
 * with the bundled {@code mml2omml.xsl}. When either step fails the math
 * is written as italic Cambria Math text instead; this handler never
 * throws for bad input.</p>
 */
public class MathHandler {

    private static final Logger log = LoggerFactory.getLogger(MathHandler.class);

    static final String STYLESHEET = "/xsl/mml2omml.xsl";
    static final String FALLBACK_FONT = "Cambria Math";

    private final LatexMathTranslator translator = new LatexMathTranslator();

    /**
     * Adds the math to the end of the paragraph.
     *
     * @return true when native equation markup was written, false for the text fallback
     */
    public boolean addMath(XWPFParagraph paragraph, String latex, boolean display) {
        Optional<CTOMathPara> omml = toOmml(latex);
        if (omml.isPresent() && omml.get().sizeOfOMathArray() > 0) {
            if (display) {
                paragraph.getCTP().addNewOMathPara().set(omml.get());
            } else {
                paragraph.getCTP().addNewOMath().set(omml.get().getOMathArray(0));
            }
            return true;
        }

        XWPFRun run = paragraph.createRun();
        run.setText(MathText.toPlainText(latex));
        OoxmlUtil.setFonts(run, FALLBACK_FONT, null);
        run.setItalic(true);
        run.setFontSize(display ? 12 : 11);
        return false;
    }

    /**
     * Converts a fragment to Office Math, or empty when it cannot be converted.
     */
    public Optional<CTOMathPara> toOmml(String latex) {
        Templates templates = StylesheetHolder.TEMPLATES;
        if (templates == null) {
            return Optional.empty();
        }
        try {
            Document mathml = translator.translate(latex);
            Transformer transformer = templates.newTransformer();
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(mathml), new StreamResult(out));
            // Bind the oMathPara element itself, not the document around it
            XmlOptions options = new XmlOptions().setLoadReplaceDocumentElement(null);
            return Optional.of(CTOMathPara.Factory.parse(out.toString(), options));
        } catch (MathTranslationException e) {
            log.debug("Math fallback for '{}': {}", latex, e.getMessage());
        } catch (TransformerException | XmlException e) {
            log.warn("Math transformation failed for '{}': {}", latex, e.getMessage());
        }
        return Optional.empty();
    }

    /** Compiles the stylesheet once per class loader. */
    private static final class StylesheetHolder {
        static final Templates TEMPLATES = load();

        private static Templates load() {
            try (InputStream xsl = MathHandler.class.getResourceAsStream(STYLESHEET)) {
                if (xsl == null) {
                    log.warn("Stylesheet {} not found; math is rendered as text", STYLESHEET);
                    return null;
                }
                TransformerFactory factory = TransformerFactory.newInstance();
                factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
                return factory.newTemplates(new StreamSource(xsl));
            } catch (IOException | TransformerException e) {
                log.warn("Cannot load stylesheet {}: {}", STYLESHEET, e.getMessage());
                return null;
            }
        }
    }
}
