package com.latexword.converter.table;

import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.parser.LatexToken.TokenType;

import java.util.List;

/**
 * Table border treatment derived from the rules used in the LaTeX source.
 */
public enum BorderStyle {
    /** Thick top and bottom rules plus a thin rule under the header row. */
    THREE_LINE,
    /** Outer and inner horizontal rules, no vertical rules. */
    HLINE_ONLY,
    GRID,
    NONE;

    /**
     * Booktabs rules give {@link #THREE_LINE} regardless of the column spec.
     * Otherwise {@code \hline} gives {@link #GRID} when the spec contains a
     * pipe and {@link #HLINE_ONLY} when it does not.
     */
    public static BorderStyle detect(List<LatexToken> tokens, String columnSpec) {
        boolean booktabs = tokens.stream().anyMatch(LatexToken::isBooktabsRule);
        boolean hline = tokens.stream().anyMatch(t -> t.is(TokenType.HLINE));
        boolean vertical = columnSpec != null && columnSpec.indexOf('|') >= 0;

        if (booktabs) {
            return THREE_LINE;
        }
        if (hline) {
            return vertical ? GRID : HLINE_ONLY;
        }
        return NONE;
    }
}
