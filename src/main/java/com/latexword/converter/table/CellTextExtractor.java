package com.latexword.converter.table;

import com.latexword.converter.math.MathText;
import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.parser.LatexToken.TokenType;
import com.latexword.converter.text.SymbolTable;
import com.latexword.converter.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Flattens the tokens of one table cell to plain text. Formatting commands
 * keep their argument text, line breaks (also inside {@code \makecell})
 * become {@code \n} and inline math is rendered as Unicode text.
 */
public final class CellTextExtractor {

    private static final Set<String> TEXT_WRAPPERS = Set.of(
        "textbf", "textit", "emph", "underline", "heiti", "songti", "kaiti", "fangsong",
        "text", "textrm", "texttt", "textsf", "makecell", "mbox");

    private CellTextExtractor() {
        // Utility class
    }

    public static String extract(List<LatexToken> tokens) {
        String[] lines = TextNormalizer.normalize(flatten(tokens)).split("\n", -1);
        StringJoiner joined = new StringJoiner("\n");
        for (String line : lines) {
            joined.add(line.strip());
        }
        return joined.toString();
    }

    private static String flatten(List<LatexToken> tokens) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < tokens.size()) {
            LatexToken token = tokens.get(i);
            switch (token.getType()) {
                case TEXT -> sb.append(token.getValue());
                case WHITESPACE, PAR_BREAK -> sb.append(' ');
                case NEWLINE_CMD -> sb.append('\n');
                case MATH_INLINE, MATH_DISPLAY -> sb.append(MathText.toPlainText(token.getContent()));
                case COMMAND -> {
                    String name = token.getName();
                    if (SymbolTable.isSymbol(name)) {
                        sb.append(SymbolTable.lookup(name).orElse(""));
                    } else if (TEXT_WRAPPERS.contains(name)) {
                        int j = skipWhitespace(tokens, i + 1);
                        if (j < tokens.size() && tokens.get(j).is(TokenType.BRACE_OPEN)) {
                            List<LatexToken> inner = new ArrayList<>();
                            i = readGroup(tokens, j, inner);
                            sb.append(flatten(inner));
                            continue;
                        }
                    }
                }
                default -> {
                    // braces, brackets and declarations such as \centering carry no text
                }
            }
            i++;
        }
        return sb.toString();
    }

    private static int skipWhitespace(List<LatexToken> tokens, int pos) {
        int j = pos;
        while (j < tokens.size() && tokens.get(j).is(TokenType.WHITESPACE)) {
            j++;
        }
        return j;
    }

    /** Collects the group opened at {@code open} into {@code inner}; returns the index after it. */
    private static int readGroup(List<LatexToken> tokens, int open, List<LatexToken> inner) {
        int depth = 1;
        int j = open + 1;
        while (j < tokens.size()) {
            LatexToken t = tokens.get(j);
            if (t.is(TokenType.BRACE_OPEN)) {
                depth++;
            } else if (t.is(TokenType.BRACE_CLOSE)) {
                depth--;
                if (depth == 0) {
                    return j + 1;
                }
            }
            inner.add(t);
            j++;
        }
        return j;
    }
}
