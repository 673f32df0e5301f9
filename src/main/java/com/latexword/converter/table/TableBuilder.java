package com.latexword.converter.table;

import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.profile.model.FontsConfig;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.xwpf.usermodel.TableRowAlign;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTbl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblGrid;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblLook;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblWidth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a LaTeX tabular as a Word table: column widths from the column
 * spec, {@code \multicolumn} merges, border style detected from the rules,
 * a bold header row and black cell text.
 */
public class TableBuilder {

    private static final Logger log = LoggerFactory.getLogger(TableBuilder.class);

    /** Text width used for the table grid, in twips (about 16.8 cm). */
    static final int GRID_WIDTH_TWIPS = 9520;
    /** Full width in fiftieths of a percent. */
    static final int FULL_WIDTH_PCT = 5000;
    static final double CELL_FONT_SIZE_PT = 10.5;

    private static final int THICK_RULE = 12;
    private static final int HEADER_RULE = 6;
    private static final int THIN_RULE = 4;

    private final FontsConfig fonts;
    private final TableRowParser rowParser = new TableRowParser();

    public TableBuilder(FontsConfig fonts) {
        this.fonts = fonts;
    }

    /**
     * Appends a table to the document body.
     *
     * @return the new table, or null when the body holds no rows
     */
    public XWPFTable build(XWPFDocument doc, String columnSpec, List<LatexToken> tokens) {
        List<ColumnDef> columns = new ArrayList<>(ColumnSpecParser.parse(columnSpec));
        BorderStyle borderStyle = BorderStyle.detect(tokens, columnSpec);
        List<List<CellData>> rows = rowParser.parseRows(tokens);

        if (rows.isEmpty()) {
            log.debug("Skipping tabular without rows (spec '{}')", columnSpec);
            return null;
        }

        int usedColumns = rows.stream()
            .mapToInt(row -> row.stream().mapToInt(CellData::getColspan).sum())
            .max()
            .orElse(1);
        while (columns.size() < usedColumns) {
            columns.add(ColumnDef.auto(CellAlignment.LEFT));
        }

        int numCols = columns.size();
        double[] widths = columnWidthsCm(columns);

        XWPFTable table = doc.createTable(rows.size(), numCols);
        table.setTableAlignment(TableRowAlign.CENTER);
        table.setStyleID("TableNormal");
        table.setCellMargins(28, 57, 28, 57);

        CTTblPr tblPr = tblPr(table.getCTTbl());
        disableConditionalFormatting(tblPr);
        applyTableWidth(tblPr);
        applyGrid(table.getCTTbl(), widths);
        applyBorders(tblPr, borderStyle);

        for (int r = 0; r < rows.size(); r++) {
            fillRow(table.getRow(r), rows.get(r), columns, widths, r == 0);
        }

        if (borderStyle == BorderStyle.THREE_LINE) {
            for (XWPFTableCell cell : table.getRow(0).getTableCells()) {
                OoxmlUtil.setBorder(tcPr(cell).addNewTcBorders().addNewBottom(), STBorder.SINGLE, HEADER_RULE);
            }
        }

        log.debug("Built {}x{} table with {} borders", rows.size(), numCols, borderStyle);
        return table;
    }

    /**
     * Fixed widths are kept; the rest of the page width is shared evenly,
     * never less than 1 cm per column.
     */
    static double[] columnWidthsCm(List<ColumnDef> columns) {
        double fixed = columns.stream()
            .filter(ColumnDef::hasFixedWidth)
            .mapToDouble(ColumnDef::getWidthCm)
            .sum();
        long autoCount = columns.stream().filter(c -> !c.hasFixedWidth()).count();
        double autoWidth = autoCount == 0
            ? 0
            : Math.max((ColumnSpecParser.PAGE_WIDTH_CM - fixed) / autoCount, 1.0);

        double[] widths = new double[columns.size()];
        for (int i = 0; i < widths.length; i++) {
            ColumnDef column = columns.get(i);
            widths[i] = column.hasFixedWidth() ? column.getWidthCm() : autoWidth;
        }
        return widths;
    }

    private void fillRow(XWPFTableRow row, List<CellData> cells, List<ColumnDef> columns,
                         double[] widths, boolean header) {
        double total = sum(widths, 0, widths.length);
        int gridCol = 0;
        int pos = 0;

        for (CellData data : cells) {
            if (gridCol >= columns.size()) {
                break;
            }
            int last = Math.min(gridCol + data.getColspan() - 1, columns.size() - 1);
            XWPFTableCell cell = row.getCell(pos);
            if (last > gridCol) {
                for (int k = gridCol + 1; k <= last; k++) {
                    row.removeCell(pos + 1);
                }
                tcPr(cell).addNewGridSpan().setVal(BigInteger.valueOf(last - gridCol + 1L));
            }

            setCellWidth(cell, sum(widths, gridCol, last + 1), total);
            CellAlignment align = data.getAlign() != null ? data.getAlign() : columns.get(gridCol).getAlign();
            fillCell(cell, CellTextExtractor.extract(data.getTokens()), align, header);

            gridCol = last + 1;
            pos++;
        }

        // columns the row left empty
        while (pos < row.getTableCells().size() && gridCol < columns.size()) {
            XWPFTableCell cell = row.getCell(pos);
            setCellWidth(cell, widths[gridCol], total);
            fillCell(cell, "", columns.get(gridCol).getAlign(), header);
            gridCol++;
            pos++;
        }
    }

    private void fillCell(XWPFTableCell cell, String text, CellAlignment align, boolean bold) {
        XWPFParagraph paragraph = cell.getParagraphs().isEmpty() ? cell.addParagraph() : cell.getParagraphs().get(0);
        paragraph.setAlignment(align.toParagraphAlignment());
        paragraph.setSpacingBefore(0);
        paragraph.setSpacingAfter(0);
        paragraph.setIndentationFirstLine(0);
        paragraph.setSpacingBetween(1.0);
        cell.setVerticalAlignment(XWPFTableCell.XWPFVertAlign.CENTER);

        String content = text.strip();
        if (content.isEmpty()) {
            return;
        }

        XWPFRun run = paragraph.createRun();
        run.setFontSize(CELL_FONT_SIZE_PT);
        OoxmlUtil.setFonts(run, fonts.getBodyLatin(), fonts.getBodyEastAsian());
        if (bold) {
            run.setBold(true);
        }
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i].strip(), i);
        }
        OoxmlUtil.forceBlack(run);
    }

    private static void setCellWidth(XWPFTableCell cell, double widthCm, double totalCm) {
        CTTcPr tcPr = tcPr(cell);
        CTTblWidth tcW = tcPr.isSetTcW() ? tcPr.getTcW() : tcPr.addNewTcW();
        tcW.setW(BigInteger.valueOf((long) (FULL_WIDTH_PCT * widthCm / totalCm)));
        tcW.setType(STTblWidth.PCT);
    }

    private static void disableConditionalFormatting(CTTblPr tblPr) {
        CTTblLook look = tblPr.isSetTblLook() ? tblPr.getTblLook() : tblPr.addNewTblLook();
        OoxmlUtil.setWAttribute(look, "firstRow", "0");
        OoxmlUtil.setWAttribute(look, "lastRow", "0");
        OoxmlUtil.setWAttribute(look, "firstColumn", "0");
        OoxmlUtil.setWAttribute(look, "noHBand", "1");
        OoxmlUtil.setWAttribute(look, "val", "0000");
    }

    private static void applyTableWidth(CTTblPr tblPr) {
        CTTblWidth tblW = tblPr.isSetTblW() ? tblPr.getTblW() : tblPr.addNewTblW();
        tblW.setW(BigInteger.valueOf(FULL_WIDTH_PCT));
        tblW.setType(STTblWidth.PCT);
    }

    private static void applyGrid(CTTbl ctTbl, double[] widths) {
        CTTblGrid grid = ctTbl.getTblGrid() != null ? ctTbl.getTblGrid() : ctTbl.addNewTblGrid();
        while (grid.sizeOfGridColArray() > 0) {
            grid.removeGridCol(0);
        }
        double total = sum(widths, 0, widths.length);
        for (double w : widths) {
            grid.addNewGridCol().setW(BigInteger.valueOf((long) (GRID_WIDTH_TWIPS * w / total)));
        }
    }

    private static void applyBorders(CTTblPr tblPr, BorderStyle style) {
        if (tblPr.isSetTblBorders()) {
            tblPr.unsetTblBorders();
        }
        CTTblBorders b = tblPr.addNewTblBorders();
        switch (style) {
            case THREE_LINE -> {
                OoxmlUtil.setBorder(b.addNewTop(), STBorder.SINGLE, THICK_RULE);
                OoxmlUtil.setBorder(b.addNewLeft(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewBottom(), STBorder.SINGLE, THICK_RULE);
                OoxmlUtil.setBorder(b.addNewRight(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewInsideH(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewInsideV(), STBorder.NONE, 0);
            }
            case HLINE_ONLY -> {
                OoxmlUtil.setBorder(b.addNewTop(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewLeft(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewBottom(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewRight(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewInsideH(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewInsideV(), STBorder.NONE, 0);
            }
            case GRID -> {
                OoxmlUtil.setBorder(b.addNewTop(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewLeft(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewBottom(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewRight(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewInsideH(), STBorder.SINGLE, THIN_RULE);
                OoxmlUtil.setBorder(b.addNewInsideV(), STBorder.SINGLE, THIN_RULE);
            }
            default -> {
                OoxmlUtil.setBorder(b.addNewTop(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewLeft(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewBottom(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewRight(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewInsideH(), STBorder.NONE, 0);
                OoxmlUtil.setBorder(b.addNewInsideV(), STBorder.NONE, 0);
            }
        }
    }

    private static CTTblPr tblPr(CTTbl ctTbl) {
        return ctTbl.getTblPr() != null ? ctTbl.getTblPr() : ctTbl.addNewTblPr();
    }

    private static CTTcPr tcPr(XWPFTableCell cell) {
        return cell.getCTTc().isSetTcPr() ? cell.getCTTc().getTcPr() : cell.getCTTc().addNewTcPr();
    }

    private static double sum(double[] values, int from, int to) {
        double total = 0;
        for (int i = from; i < to; i++) {
            total += values[i];
        }
        return total;
    }
}
