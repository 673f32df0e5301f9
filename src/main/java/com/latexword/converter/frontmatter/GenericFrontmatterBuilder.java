package com.latexword.converter.frontmatter;

import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.FontsConfig;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A plain centered title page (title, author, institute, date) followed by
 * a page break, for profiles without front-matter recipes.
 */
public class GenericFrontmatterBuilder implements FrontmatterBuilder {

    private static final Logger log = LoggerFactory.getLogger(GenericFrontmatterBuilder.class);

    static final int LEADING_BLANK_LINES = 3;
    static final double TITLE_PT = 22;
    static final double AUTHOR_PT = 16;
    static final double DETAIL_PT = 14;

    private final DocxProfile profile;

    public GenericFrontmatterBuilder(DocxProfile profile) {
        this.profile = profile;
    }

    @Override
    public void build(XWPFDocument doc, ExportMetadata metadata) {
        if (metadata.getTitle().isBlank()) {
            log.debug("No title in metadata, skipping title page");
            return;
        }
        FontsConfig fonts = profile.getFonts();
        BodyInserter inserter = BodyInserter.atStart(doc);

        for (int i = 0; i < LEADING_BLANK_LINES; i++) {
            inserter.paragraph().setIndentationFirstLine(0);
        }
        FrontmatterParagraphs.text(inserter.paragraph(), metadata.getTitle(), fonts.getHeadingEastAsian(),
            TITLE_PT, true, ParagraphAlignment.CENTER);
        inserter.paragraph().setIndentationFirstLine(0);
        line(inserter, metadata.getAuthor(), fonts.getBodyEastAsian(), AUTHOR_PT);
        line(inserter, metadata.getInstitute(), fonts.getBodyEastAsian(), DETAIL_PT);
        line(inserter, metadata.getDisplayDate(), fonts.getBodyEastAsian(), DETAIL_PT);
        inserter.paragraph().createRun().addBreak(BreakType.PAGE);
        log.info("Added title page for '{}'", metadata.getTitle());
    }

    private static void line(BodyInserter inserter, String text, String font, double sizePt) {
        if (!text.isBlank()) {
            FrontmatterParagraphs.text(inserter.paragraph(), text, font, sizePt, false, ParagraphAlignment.CENTER);
        }
    }
}
