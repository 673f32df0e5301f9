package com.latexword.converter.table;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One column of a tabular column specification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDef {
    @Builder.Default
    private CellAlignment align = CellAlignment.LEFT;
    /** Fixed width in centimetres; null means the column shares the free width. */
    private Double widthCm;
    private boolean leftBorder;
    private boolean rightBorder;

    public static ColumnDef auto(CellAlignment align) {
        return ColumnDef.builder().align(align).build();
    }

    public boolean hasFixedWidth() {
        return widthCm != null;
    }
}
