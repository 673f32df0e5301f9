package com.latexword.converter.table;

import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.parser.LatexToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the token stream of a tabular body into rows and cells.
 *
 * Row and column separators only count at brace depth zero, so a line
 * break inside {@code \makecell{a \\ b}} stays within its cell.
 */
public class TableRowParser {

    public List<List<CellData>> parseRows(List<LatexToken> tokens) {
        List<List<CellData>> rows = new ArrayList<>();
        List<CellData> currentRow = newRow();
        int depth = 0;
        int i = 0;

        while (i < tokens.size()) {
            LatexToken token = tokens.get(i);

            if (depth == 0) {
                if (token.isTableRule() || token.is(TokenType.COMMENT)) {
                    i++;
                    continue;
                }
                if (token.is(TokenType.AMPERSAND)) {
                    currentRow.add(new CellData());
                    i++;
                    continue;
                }
                if (token.is(TokenType.NEWLINE_CMD)) {
                    if (currentRow.stream().anyMatch(c -> !c.isEmpty())) {
                        rows.add(currentRow);
                    }
                    currentRow = newRow();
                    i++;
                    continue;
                }
                if (token.isCommand("multicolumn")) {
                    i = readMulticolumn(tokens, i + 1, currentRow);
                    continue;
                }
            }

            if (token.is(TokenType.BRACE_OPEN)) {
                depth++;
            } else if (token.is(TokenType.BRACE_CLOSE) && depth > 0) {
                depth--;
            }
            last(currentRow).getTokens().add(token);
            i++;
        }

        if (currentRow.stream().anyMatch(c -> !c.isEmpty())) {
            rows.add(currentRow);
        }

        rows.removeIf(row -> row.stream().noneMatch(CellData::hasContent));
        return rows;
    }

    private int readMulticolumn(List<LatexToken> tokens, int pos, List<CellData> row) {
        Group span = readGroup(tokens, pos);
        Group spec = readGroup(tokens, span.end);
        Group content = readGroup(tokens, spec.end);

        int colspan;
        try {
            colspan = Math.max(1, Integer.parseInt(rawText(span.tokens).strip()));
        } catch (NumberFormatException e) {
            colspan = 1;
        }

        CellAlignment align = null;
        for (char c : rawText(spec.tokens).toCharArray()) {
            align = CellAlignment.fromLetter(c);
            if (align != null) {
                break;
            }
        }

        CellData cell = new CellData(new ArrayList<>(content.tokens), colspan, align);
        row.set(row.size() - 1, cell);
        return content.end;
    }

    private static String rawText(List<LatexToken> tokens) {
        StringBuilder sb = new StringBuilder();
        tokens.forEach(t -> sb.append(t.getValue()));
        return sb.toString();
    }

    private static final class Group {
        final List<LatexToken> tokens;
        final int end;

        Group(List<LatexToken> tokens, int end) {
            this.tokens = tokens;
            this.end = end;
        }
    }

    /** Reads a brace group after optional whitespace, without its outer braces. */
    private static Group readGroup(List<LatexToken> tokens, int pos) {
        int i = pos;
        while (i < tokens.size() && tokens.get(i).is(TokenType.WHITESPACE)) {
            i++;
        }
        if (i >= tokens.size() || !tokens.get(i).is(TokenType.BRACE_OPEN)) {
            return new Group(List.of(), i);
        }
        i++;
        int depth = 1;
        List<LatexToken> inner = new ArrayList<>();
        while (i < tokens.size()) {
            LatexToken token = tokens.get(i);
            if (token.is(TokenType.BRACE_OPEN)) {
                depth++;
            } else if (token.is(TokenType.BRACE_CLOSE)) {
                depth--;
                if (depth == 0) {
                    i++;
                    break;
                }
            }
            inner.add(token);
            i++;
        }
        return new Group(inner, i);
    }

    private static List<CellData> newRow() {
        List<CellData> row = new ArrayList<>();
        row.add(new CellData());
        return row;
    }

    private static CellData last(List<CellData> row) {
        return row.get(row.size() - 1);
    }
}
