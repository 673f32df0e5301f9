package com.latexword.converter.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typographic normalization and markup stripping for LaTeX text fragments.
 */
public final class TextNormalizer {

    private static final Pattern SPACE_COMMAND = Pattern.compile("\\\\[hv]space\\s*\\*?\\s*\\{[^}]*\\}");
    private static final Pattern PENALTY = Pattern.compile("\\\\penalty[^{}\\s]*");
    private static final Pattern MAX_PENALTY = Pattern.compile("\\\\@M\\b");
    private static final Pattern INLINE_MATH = Pattern.compile("\\$([^$]*)\\$");
    private static final Pattern SHORT_SPACE = Pattern.compile("\\\\[,;!>:]");
    private static final Pattern ANY_COMMAND = Pattern.compile("\\\\[a-zA-Z@]+\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Converts dash ligatures and double quotes to their Unicode forms.
     * Single quotes are left alone so apostrophes survive.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return text.replace("---", "—")
            .replace("--", "–")
            .replace("``", "“")
            .replace("''", "”");
    }

    /**
     * Strips LaTeX commands from a fragment, keeping its readable content.
     */
    public static String cleanLatexText(String text) {
        if (text == null) {
            return "";
        }
        String result = text.replace("\\ignorespaces", "")
            .replace("\\nobreakspace{}", " ")
            .replace("\\protected@file@percent", "")
            .replace("\\protect", "")
            .replace("\\relax", "")
            .replace("~", " ");
        result = SPACE_COMMAND.matcher(result).replaceAll(" ");
        result = PENALTY.matcher(result).replaceAll("");
        result = MAX_PENALTY.matcher(result).replaceAll("");
        result = INLINE_MATH.matcher(result).replaceAll("$1");
        result = SHORT_SPACE.matcher(result).replaceAll(" ");
        result = ANY_COMMAND.matcher(result).replaceAll("");
        result = result.replace("{", "").replace("}", "");
        return result.strip();
    }

    /**
     * Reduces a title to a comparison key: markup removed, all whitespace
     * dropped, lower-cased.
     */
    public static String normalizeForMatch(String text) {
        String cleaned = cleanLatexText(text);
        return WHITESPACE.matcher(cleaned).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /** Collapses whitespace runs to one space and trims. */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
