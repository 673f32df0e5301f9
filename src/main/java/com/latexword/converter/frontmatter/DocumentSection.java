package com.latexword.converter.frontmatter;

import lombok.Value;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One page section of a document: its body elements in order and the
 * section properties that close it.
 */
@Value
public class DocumentSection {
    List<IBodyElement> elements;
    CTSectPr sectPr;

    public List<XWPFParagraph> getParagraphs() {
        return elements.stream()
            .filter(XWPFParagraph.class::isInstance)
            .map(XWPFParagraph.class::cast)
            .collect(Collectors.toList());
    }

    /** Concatenated paragraph text, one paragraph per line. */
    public String getText() {
        return getParagraphs().stream().map(XWPFParagraph::getText).collect(Collectors.joining("\n"));
    }
}
