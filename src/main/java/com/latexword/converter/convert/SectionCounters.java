package com.latexword.converter.convert;

import lombok.Getter;

/**
 * Chapter, section, subsection and subsubsection counters. Incrementing a
 * level resets every deeper level.
 */
@Getter
public class SectionCounters {
    private int chapter;
    private int section;
    private int subsection;
    private int subsubsection;

    /**
     * Increments the counter for a heading level (1 = chapter .. 4 =
     * subsubsection).
     *
     * @return the dotted number for levels 2 to 4, null for level 1 and
     *         levels outside the range
     */
    public String increment(int level) {
        switch (level) {
            case 1 -> {
                chapter++;
                section = 0;
                subsection = 0;
                subsubsection = 0;
                return null;
            }
            case 2 -> {
                section++;
                subsection = 0;
                subsubsection = 0;
                return chapter + "." + section;
            }
            case 3 -> {
                subsection++;
                subsubsection = 0;
                return chapter + "." + section + "." + subsection;
            }
            case 4 -> {
                subsubsection++;
                return chapter + "." + section + "." + subsection + "." + subsubsection;
            }
            default -> {
                return null;
            }
        }
    }
}
