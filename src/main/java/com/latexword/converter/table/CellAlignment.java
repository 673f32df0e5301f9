package com.latexword.converter.table;

import org.apache.poi.xwpf.usermodel.ParagraphAlignment;

public enum CellAlignment {
    LEFT(ParagraphAlignment.LEFT),
    CENTER(ParagraphAlignment.CENTER),
    RIGHT(ParagraphAlignment.RIGHT);

    private final ParagraphAlignment paragraphAlignment;

    CellAlignment(ParagraphAlignment paragraphAlignment) {
        this.paragraphAlignment = paragraphAlignment;
    }

    public ParagraphAlignment toParagraphAlignment() {
        return paragraphAlignment;
    }

    /** Maps a column letter {@code l}, {@code c} or {@code r}; null otherwise. */
    public static CellAlignment fromLetter(char letter) {
        return switch (letter) {
            case 'l' -> LEFT;
            case 'c' -> CENTER;
            case 'r' -> RIGHT;
            default -> null;
        };
    }
}
