package com.latexword.converter.table;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses LaTeX column specifications such as {@code |l|c|r|p{4cm}|} or
 * {@code *{3}{c}X}.
 */
public final class ColumnSpecParser {

    /** Approximate text width of an A4 page with thesis margins, in cm. */
    public static final double PAGE_WIDTH_CM = 15.0;

    private static final Pattern CM = Pattern.compile("^([\\d.]+)\\s*cm");
    private static final Pattern MM = Pattern.compile("^([\\d.]+)\\s*mm");
    private static final Pattern IN = Pattern.compile("^([\\d.]+)\\s*in");
    private static final Pattern PT = Pattern.compile("^([\\d.]+)\\s*(?:pt|bp)");
    private static final Pattern RELATIVE = Pattern.compile("^([\\d.]*)\\s*\\\\(?:textwidth|linewidth|columnwidth)");

    private ColumnSpecParser() {
        // Utility class
    }

    public static List<ColumnDef> parse(String spec) {
        List<ColumnDef> columns = new ArrayList<>();
        if (spec == null) {
            return columns;
        }
        int i = 0;
        boolean pendingLeftBorder = false;

        while (i < spec.length()) {
            char ch = spec.charAt(i);

            if (ch == '|') {
                if (columns.isEmpty()) {
                    pendingLeftBorder = true;
                } else {
                    columns.get(columns.size() - 1).setRightBorder(true);
                }
                i++;
                continue;
            }

            CellAlignment letter = CellAlignment.fromLetter(ch);
            if (letter != null || ch == 'X') {
                ColumnDef column = ColumnDef.auto(letter != null ? letter : CellAlignment.LEFT);
                column.setLeftBorder(pendingLeftBorder);
                pendingLeftBorder = false;
                columns.add(column);
                i++;
                continue;
            }

            if (ch == 'p' || ch == 'm' || ch == 'b') {
                int open = spec.indexOf('{', i);
                if (open < 0) {
                    break;
                }
                Group width = readGroup(spec, open);
                ColumnDef column = ColumnDef.builder()
                    .align(CellAlignment.LEFT)
                    .widthCm(parseWidth(width.content))
                    .leftBorder(pendingLeftBorder)
                    .build();
                pendingLeftBorder = false;
                columns.add(column);
                i = width.end;
                continue;
            }

            if (ch == '@' || ch == '!' || ch == '>' || ch == '<') {
                // Inter-column material and array-package decorations
                i++;
                if (i < spec.length() && spec.charAt(i) == '{') {
                    i = readGroup(spec, i).end;
                }
                continue;
            }

            if (ch == '*') {
                i++;
                if (i < spec.length() && spec.charAt(i) == '{') {
                    Group count = readGroup(spec, i);
                    i = count.end;
                    if (i < spec.length() && spec.charAt(i) == '{') {
                        Group repeated = readGroup(spec, i);
                        i = repeated.end;
                        int times = parseCount(count.content);
                        for (int k = 0; k < times; k++) {
                            columns.addAll(parse(repeated.content));
                        }
                    }
                }
                continue;
            }

            i++;
        }
        return columns;
    }

    /**
     * Converts a LaTeX length to centimetres. Fractions of the text width
     * use {@link #PAGE_WIDTH_CM}. Returns null for unsupported units.
     */
    public static Double parseWidth(String width) {
        if (width == null) {
            return null;
        }
        String w = width.strip();

        Matcher m = CM.matcher(w);
        if (m.find()) {
            return number(m.group(1));
        }
        m = MM.matcher(w);
        if (m.find()) {
            return scaled(m.group(1), 0.1);
        }
        m = IN.matcher(w);
        if (m.find()) {
            return scaled(m.group(1), 2.54);
        }
        m = PT.matcher(w);
        if (m.find()) {
            return scaled(m.group(1), 2.54 / 72);
        }
        m = RELATIVE.matcher(w);
        if (m.find()) {
            String factor = m.group(1).isEmpty() ? "1" : m.group(1);
            return scaled(factor, PAGE_WIDTH_CM);
        }
        return null;
    }

    private static Double scaled(String value, double factor) {
        Double n = number(value);
        return n == null ? null : n * factor;
    }

    private static Double number(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static final class Group {
        final String content;
        final int end;

        Group(String content, int end) {
            this.content = content;
            this.end = end;
        }
    }

    private static Group readGroup(String spec, int open) {
        int depth = 0;
        int i = open;
        while (i < spec.length()) {
            char c = spec.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return new Group(spec.substring(open + 1, i), i + 1);
                }
            }
            i++;
        }
        return new Group(spec.substring(Math.min(open + 1, spec.length())), spec.length());
    }
}
