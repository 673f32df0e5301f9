package com.latexword.converter.convert;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Character formatting in effect for the next run. Brace groups and
 * formatting commands push a modified copy; closing the group pops it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FormatState {
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean superscript;
    private boolean subscript;
    /** Overrides both the Latin and the East Asian font when set. */
    private String fontName;
    /** Half-points. */
    private Integer fontSize;
    /** RGB hex, e.g. {@code 000000}. */
    private String color;
    private String hyperlink;

    public FormatState copy() {
        return toBuilder().build();
    }
}
