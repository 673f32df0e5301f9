package com.latexword.converter.pkg;

import com.latexword.converter.convert.DocxStyles;
import com.latexword.converter.convert.FootnoteEntry;
import com.latexword.converter.util.FileWriteUtil;
import com.latexword.converter.util.OoxmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Patches a saved package after serialization: adds the footnotes part for
 * collected footnotes and optionally removes the numbering part.
 *
 * <p>Each patch rewrites the part itself plus the matching entries of
 * {@code word/_rels/document.xml.rels} and {@code [Content_Types].xml}.</p>
 */
public class DocxPackagePostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocxPackagePostProcessor.class);

    public static final String FOOTNOTES_PART = "word/footnotes.xml";
    public static final String NUMBERING_PART = "word/numbering.xml";
    static final String FOOTNOTES_REL_TYPE =
        "http://schemas.openxmlformats.org/officeDocument/2006/relationships/footnotes";
    static final String NUMBERING_REL_TYPE =
        "http://schemas.openxmlformats.org/officeDocument/2006/relationships/numbering";
    static final String FOOTNOTES_CONTENT_TYPE =
        "application/vnd.openxmlformats-officedocument.wordprocessingml.footnotes+xml";
    static final String RELS_NS = "http://schemas.openxmlformats.org/package/2006/relationships";
    static final String CONTENT_TYPES_NS = "http://schemas.openxmlformats.org/package/2006/content-types";
    private static final String XML_NS = "http://www.w3.org/XML/1998/namespace";
    private static final Pattern REL_ID = Pattern.compile("rId(\\d+)");

    private final List<FootnoteEntry> footnotes;
    private final boolean stripNumbering;

    public DocxPackagePostProcessor(List<FootnoteEntry> footnotes, boolean stripNumbering) {
        this.footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
        this.stripNumbering = stripNumbering;
    }

    /** Patches the package file in place; the file is replaced only when every patch succeeded. */
    public void process(Path docx) throws IOException {
        DocxPackage pkg = DocxPackage.read(docx);
        process(pkg);
        FileWriteUtil.writeAtomically(docx, pkg::write);
    }

    public void process(DocxPackage pkg) throws IOException {
        if (!footnotes.isEmpty()) {
            injectFootnotes(pkg);
        }
        if (stripNumbering) {
            stripNumbering(pkg);
        }
    }

    // ------------------------------------------------------------------
    // footnotes

    void injectFootnotes(DocxPackage pkg) throws IOException {
        Document part = pkg.get(FOOTNOTES_PART).isPresent()
            ? parse(pkg, FOOTNOTES_PART)
            : newFootnotesPart();
        Element root = part.getDocumentElement();
        List<String> ids = new ArrayList<>();
        for (FootnoteEntry entry : footnotes) {
            ids.add(String.valueOf(entry.getId()));
        }
        removeFootnotes(root, ids);
        for (FootnoteEntry entry : footnotes) {
            root.appendChild(footnote(part, entry));
        }
        pkg.put(FOOTNOTES_PART, serialize(part));

        Document rels = parse(pkg, DocxPackage.DOCUMENT_RELS);
        if (findRelationships(rels, FOOTNOTES_REL_TYPE, null).isEmpty()) {
            Element relationship = rels.createElementNS(RELS_NS, "Relationship");
            relationship.setAttribute("Id", nextRelationshipId(rels));
            relationship.setAttribute("Type", FOOTNOTES_REL_TYPE);
            relationship.setAttribute("Target", "footnotes.xml");
            rels.getDocumentElement().appendChild(relationship);
            pkg.put(DocxPackage.DOCUMENT_RELS, serialize(rels));
        }

        Document types = parse(pkg, DocxPackage.CONTENT_TYPES);
        if (findOverrides(types, "/" + FOOTNOTES_PART).isEmpty()) {
            Element override = types.createElementNS(CONTENT_TYPES_NS, "Override");
            override.setAttribute("PartName", "/" + FOOTNOTES_PART);
            override.setAttribute("ContentType", FOOTNOTES_CONTENT_TYPE);
            types.getDocumentElement().appendChild(override);
            pkg.put(DocxPackage.CONTENT_TYPES, serialize(types));
        }
        log.debug("Injected {} footnotes", footnotes.size());
    }

    /** An empty footnotes part holding the separator (-1) and continuation separator (0) notes. */
    private static Document newFootnotesPart() throws IOException {
        Document part = newDocumentBuilder().newDocument();
        part.setXmlStandalone(true);
        Element root = part.createElementNS(OoxmlUtil.W_NS, "w:footnotes");
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:w", OoxmlUtil.W_NS);
        part.appendChild(root);
        root.appendChild(separator(part, "separator", "-1"));
        root.appendChild(separator(part, "continuationSeparator", "0"));
        return part;
    }

    private static Element separator(Document part, String type, String id) {
        Element note = w(part, "footnote");
        note.setAttributeNS(OoxmlUtil.W_NS, "w:type", type);
        note.setAttributeNS(OoxmlUtil.W_NS, "w:id", id);
        Element paragraph = (Element) note.appendChild(w(part, "p"));
        Element spacing = (Element) paragraph.appendChild(w(part, "pPr")).appendChild(w(part, "spacing"));
        spacing.setAttributeNS(OoxmlUtil.W_NS, "w:after", "0");
        spacing.setAttributeNS(OoxmlUtil.W_NS, "w:line", "240");
        spacing.setAttributeNS(OoxmlUtil.W_NS, "w:lineRule", "auto");
        paragraph.appendChild(w(part, "r")).appendChild(w(part, type));
        return note;
    }

    private static Element footnote(Document part, FootnoteEntry entry) {
        Element note = w(part, "footnote");
        note.setAttributeNS(OoxmlUtil.W_NS, "w:id", String.valueOf(entry.getId()));
        Element paragraph = (Element) note.appendChild(w(part, "p"));
        Element style = (Element) paragraph.appendChild(w(part, "pPr")).appendChild(w(part, "pStyle"));
        style.setAttributeNS(OoxmlUtil.W_NS, "w:val", DocxStyles.FOOTNOTE_TEXT);

        Element marker = (Element) paragraph.appendChild(w(part, "r"));
        Element markerStyle = (Element) marker.appendChild(w(part, "rPr")).appendChild(w(part, "rStyle"));
        markerStyle.setAttributeNS(OoxmlUtil.W_NS, "w:val", DocxStyles.FOOTNOTE_REFERENCE);
        marker.appendChild(w(part, "footnoteRef"));

        Element text = (Element) paragraph.appendChild(w(part, "r")).appendChild(w(part, "t"));
        text.setAttributeNS(XML_NS, "xml:space", "preserve");
        text.setTextContent(" " + entry.getText());
        return note;
    }

    private static void removeFootnotes(Element root, List<String> ids) {
        NodeList notes = root.getElementsByTagNameNS(OoxmlUtil.W_NS, "footnote");
        List<Element> stale = new ArrayList<>();
        for (int i = 0; i < notes.getLength(); i++) {
            Element note = (Element) notes.item(i);
            if (ids.contains(note.getAttributeNS(OoxmlUtil.W_NS, "id"))
                && note.getAttributeNS(OoxmlUtil.W_NS, "type").isEmpty()) {
                stale.add(note);
            }
        }
        for (Element note : stale) {
            root.removeChild(note);
        }
    }

    private static Element w(Document part, String localName) {
        return part.createElementNS(OoxmlUtil.W_NS, "w:" + localName);
    }

    // ------------------------------------------------------------------
    // numbering

    void stripNumbering(DocxPackage pkg) throws IOException {
        boolean removedPart = pkg.remove(NUMBERING_PART);

        Document rels = parse(pkg, DocxPackage.DOCUMENT_RELS);
        List<Element> relationships = findRelationships(rels, NUMBERING_REL_TYPE, "numbering.xml");
        for (Element relationship : relationships) {
            relationship.getParentNode().removeChild(relationship);
        }
        if (!relationships.isEmpty()) {
            pkg.put(DocxPackage.DOCUMENT_RELS, serialize(rels));
        }

        Document types = parse(pkg, DocxPackage.CONTENT_TYPES);
        List<Element> overrides = findOverrides(types, "/" + NUMBERING_PART);
        for (Element override : overrides) {
            override.getParentNode().removeChild(override);
        }
        if (!overrides.isEmpty()) {
            pkg.put(DocxPackage.CONTENT_TYPES, serialize(types));
        }
        log.debug("Numbering part {}", removedPart ? "removed" : "not present");
    }

    // ------------------------------------------------------------------
    // XML plumbing

    /** Relationships with the given type, or pointing at the given target when it is not null. */
    private static List<Element> findRelationships(Document rels, String type, String target) {
        List<Element> found = new ArrayList<>();
        NodeList nodes = rels.getElementsByTagNameNS(RELS_NS, "Relationship");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element relationship = (Element) nodes.item(i);
            if (type.equals(relationship.getAttribute("Type"))
                || (target != null && target.equals(relationship.getAttribute("Target")))) {
                found.add(relationship);
            }
        }
        return found;
    }

    private static List<Element> findOverrides(Document types, String partName) {
        List<Element> found = new ArrayList<>();
        NodeList nodes = types.getElementsByTagNameNS(CONTENT_TYPES_NS, "Override");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element override = (Element) nodes.item(i);
            if (partName.equals(override.getAttribute("PartName"))) {
                found.add(override);
            }
        }
        return found;
    }

    static String nextRelationshipId(Document rels) {
        int max = 0;
        NodeList nodes = rels.getElementsByTagNameNS(RELS_NS, "Relationship");
        for (int i = 0; i < nodes.getLength(); i++) {
            Matcher m = REL_ID.matcher(((Element) nodes.item(i)).getAttribute("Id"));
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return "rId" + (max + 1);
    }

    private static Document parse(DocxPackage pkg, String partName) throws IOException {
        byte[] data = pkg.get(partName)
            .orElseThrow(() -> new IOException("Package has no part " + partName));
        try {
            return newDocumentBuilder().parse(new ByteArrayInputStream(data));
        } catch (SAXException e) {
            throw new IOException("Malformed package part " + partName + ": " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser unavailable", e);
        }
    }

    private static byte[] serialize(Document document) throws IOException {
        try {
            document.setXmlStandalone(true);
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new IOException("Cannot serialize package part: " + e.getMessage(), e);
        }
    }
}
