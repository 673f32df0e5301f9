package com.latexword.converter.frontmatter;

import com.latexword.converter.metadata.ExportMetadata;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

/**
 * Adds front matter (cover, declarations, table of contents) to a converted
 * document and arranges its page sections.
 */
public interface FrontmatterBuilder {

    /**
     * Inserts front matter at the start of {@code doc}. The document body is
     * expected to be complete and finished.
     */
    void build(XWPFDocument doc, ExportMetadata metadata);
}
