package com.latexword.converter.math;

import com.latexword.converter.text.SymbolTable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Readable Unicode rendering of a LaTeX math fragment, used where native
 * equation markup is unavailable or unwanted (table cells, fallback runs).
 */
public final class MathText {

    private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+)");

    private MathText() {
        // Utility class
    }

    public static String toPlainText(String latex) {
        if (latex == null) {
            return "";
        }
        Matcher m = COMMAND.matcher(latex);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement = SymbolTable.lookup(m.group(1)).orElse(m.group(0));
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);

        return sb.toString()
            .replace("\\", "")
            .replace("{", "")
            .replace("}", "")
            .replace("^", "")
            .replace("_", "")
            .strip();
    }
}
