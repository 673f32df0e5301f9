package com.latexword.converter.aux;

import lombok.Value;

/**
 * A table-of-contents line recorded by TeX, e.g. level "section", number "1.1".
 */
@Value
public class TocEntry {
    String level;
    String number;
    String title;
    int page;

    /** Number and title as they appear in the compiled document. */
    public String getFullTitle() {
        if (number == null || number.isEmpty()) {
            return title;
        }
        return number + " " + title;
    }
}
