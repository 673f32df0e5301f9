package com.latexword.converter.table;

import com.latexword.converter.parser.LatexToken;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CellData {
    private List<LatexToken> tokens = new ArrayList<>();
    private int colspan = 1;
    /** Alignment from a {@code \multicolumn} spec; null to use the column's. */
    private CellAlignment align;

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /** Whether the cell holds anything besides whitespace. */
    public boolean hasContent() {
        return tokens.stream().anyMatch(t -> !t.is(LatexToken.TokenType.WHITESPACE));
    }
}
