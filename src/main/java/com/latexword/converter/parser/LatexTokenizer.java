package com.latexword.converter.parser;

import com.latexword.converter.parser.LatexToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tokenizer for LaTeX source text.
 *
 * The token stream is lossless: every character of the input belongs to
 * exactly one token, including comments and whitespace. Brace and bracket
 * nesting is left to the consumer.
 */
public class LatexTokenizer {
    private static final Logger log = LoggerFactory.getLogger(LatexTokenizer.class);

    private static final Map<String, TokenType> RULE_COMMANDS = Map.ofEntries(
        Map.entry("toprule", TokenType.TOPRULE),
        Map.entry("midrule", TokenType.MIDRULE),
        Map.entry("bottomrule", TokenType.BOTTOMRULE),
        Map.entry("hline", TokenType.HLINE),
        Map.entry("cmidrule", TokenType.CMIDRULE),
        Map.entry("cline", TokenType.CMIDRULE)
    );

    /** Environments whose body is not tokenized. */
    private static final Set<String> VERBATIM_ENVIRONMENTS = Set.of(
        "verbatim", "verbatim*", "lstlisting", "minted", "comment"
    );

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public LatexTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenize the entire source. The last token is always {@code EOF}.
     */
    public List<LatexToken> tokenize() {
        List<LatexToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            nextToken(tokens);
        }

        tokens.add(new LatexToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private void nextToken(List<LatexToken> tokens) {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '\\' -> readEscape(tokens, startLine, startCol);
            case '%' -> tokens.add(readComment(startLine, startCol));
            case '{' -> tokens.add(single(TokenType.BRACE_OPEN, startLine, startCol));
            case '}' -> tokens.add(single(TokenType.BRACE_CLOSE, startLine, startCol));
            case '[' -> tokens.add(single(TokenType.BRACKET_OPEN, startLine, startCol));
            case ']' -> tokens.add(single(TokenType.BRACKET_CLOSE, startLine, startCol));
            case '&' -> tokens.add(single(TokenType.AMPERSAND, startLine, startCol));
            case '$' -> tokens.add(readDollarMath(startLine, startCol));
            default -> {
                if (Character.isWhitespace(c)) {
                    tokens.add(readWhitespace(startLine, startCol));
                } else {
                    tokens.add(readText(startLine, startCol));
                }
            }
        }
    }

    private LatexToken single(TokenType type, int startLine, int startCol) {
        String value = String.valueOf(source.charAt(pos));
        consume(1);
        return new LatexToken(type, value, startLine, startCol);
    }

    private LatexToken readComment(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != '\n') {
            consume(1);
        }
        return new LatexToken(TokenType.COMMENT, source.substring(start, pos), startLine, startCol);
    }

    private LatexToken readWhitespace(int startLine, int startCol) {
        int start = pos;
        int newlines = 0;
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            if (source.charAt(pos) == '\n') {
                newlines++;
            }
            consume(1);
        }
        TokenType type = newlines >= 2 ? TokenType.PAR_BREAK : TokenType.WHITESPACE;
        return new LatexToken(type, source.substring(start, pos), startLine, startCol);
    }

    private LatexToken readText(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' || c == '%' || c == '{' || c == '}' || c == '[' || c == ']'
                    || c == '&' || c == '$' || Character.isWhitespace(c)) {
                break;
            }
            consume(1);
        }
        return new LatexToken(TokenType.TEXT, source.substring(start, pos), startLine, startCol);
    }

    private LatexToken readDollarMath(int startLine, int startCol) {
        int start = pos;
        boolean display = source.startsWith("$$", pos);
        String delimiter = display ? "$$" : "$";
        consume(delimiter.length());
        int bodyStart = pos;
        int bodyEnd = -1;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                consume(2);
                continue;
            }
            if (source.startsWith(delimiter, pos)) {
                bodyEnd = pos;
                consume(delimiter.length());
                break;
            }
            consume(1);
        }

        if (bodyEnd < 0) {
            // Unterminated math runs to the end of input
            bodyEnd = pos;
        }
        TokenType type = display ? TokenType.MATH_DISPLAY : TokenType.MATH_INLINE;
        return new LatexToken(type, source.substring(start, pos), startLine, startCol,
                null, source.substring(bodyStart, bodyEnd));
    }

    private void readEscape(List<LatexToken> tokens, int startLine, int startCol) {
        int start = pos;
        consume(1);

        if (pos >= source.length()) {
            tokens.add(new LatexToken(TokenType.COMMAND, "\\", startLine, startCol, "", null));
            return;
        }

        char next = source.charAt(pos);

        if (next == '\\') {
            consume(1);
            if (pos < source.length() && source.charAt(pos) == '*') {
                consume(1);
            }
            skipOptionalBracket();
            tokens.add(new LatexToken(TokenType.NEWLINE_CMD, source.substring(start, pos),
                    startLine, startCol, "\\", null));
            return;
        }

        if (next == '(' || next == '[') {
            tokens.add(readDelimitedMath(start, next == '(' ? "\\)" : "\\]",
                    next == '(' ? TokenType.MATH_INLINE : TokenType.MATH_DISPLAY, startLine, startCol));
            return;
        }

        if (!Character.isLetter(next)) {
            consume(1);
            tokens.add(new LatexToken(TokenType.COMMAND, source.substring(start, pos),
                    startLine, startCol, String.valueOf(next), null));
            return;
        }

        int nameStart = pos;
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            consume(1);
        }
        String letters = source.substring(nameStart, pos);

        switch (letters) {
            case "begin", "end" -> {
                if (readEnvironment(tokens, start, letters.equals("begin"), startLine, startCol)) {
                    return;
                }
            }
            case "item" -> {
                tokens.add(readItem(start, startLine, startCol));
                return;
            }
            case "tabularnewline" -> {
                tokens.add(new LatexToken(TokenType.NEWLINE_CMD, source.substring(start, pos),
                        startLine, startCol, letters, null));
                return;
            }
            default -> {
                // plain command
            }
        }

        TokenType ruleType = RULE_COMMANDS.get(letters);
        if (ruleType != null) {
            if (ruleType == TokenType.CMIDRULE) {
                skipRuleArguments();
            }
            tokens.add(new LatexToken(ruleType, source.substring(start, pos), startLine, startCol, letters, null));
            return;
        }

        String name = letters;
        if (pos < source.length() && source.charAt(pos) == '*') {
            consume(1);
            name = letters + "*";
        }
        tokens.add(new LatexToken(TokenType.COMMAND, source.substring(start, pos), startLine, startCol, name, null));
    }

    /**
     * Reads {@code \begin{name}} or {@code \end{name}}. Returns false when no
     * name group follows, in which case the caller emits a plain command.
     */
    private boolean readEnvironment(List<LatexToken> tokens, int start, boolean begin, int startLine, int startCol) {
        int mark = pos;
        int markLine = line;
        int markCol = column;

        skipInlineSpaces();
        if (pos >= source.length() || source.charAt(pos) != '{') {
            restore(mark, markLine, markCol);
            return false;
        }
        int close = source.indexOf('}', pos);
        if (close < 0) {
            restore(mark, markLine, markCol);
            return false;
        }
        String name = source.substring(pos + 1, close).trim();
        consume(close + 1 - pos);

        if (!begin) {
            tokens.add(new LatexToken(TokenType.ENV_END, source.substring(start, pos), startLine, startCol, name, null));
            return true;
        }

        if (!VERBATIM_ENVIRONMENTS.contains(name)) {
            tokens.add(new LatexToken(TokenType.ENV_BEGIN, source.substring(start, pos), startLine, startCol, name, null));
            return true;
        }

        // Arguments of verbatim-like environments stay on the begin token
        int argsStart = pos;
        if (name.equals("lstlisting")) {
            skipOptionalBracket();
        } else if (name.equals("minted")) {
            skipOptionalBracket();
            skipBraceGroup();
        }
        String args = source.substring(argsStart, pos);
        tokens.add(new LatexToken(TokenType.ENV_BEGIN, source.substring(start, pos), startLine, startCol, name, args));

        String endMarker = "\\end{" + name + "}";
        int endIndex = source.indexOf(endMarker, pos);
        int bodyEnd = endIndex < 0 ? source.length() : endIndex;
        if (bodyEnd > pos) {
            int bodyLine = line;
            int bodyCol = column;
            int bodyStart = pos;
            consume(bodyEnd - pos);
            tokens.add(new LatexToken(TokenType.TEXT, source.substring(bodyStart, bodyEnd), bodyLine, bodyCol));
        }
        if (endIndex >= 0) {
            int endLine = line;
            int endCol = column;
            consume(endMarker.length());
            tokens.add(new LatexToken(TokenType.ENV_END, endMarker, endLine, endCol, name, null));
        }
        return true;
    }

    private LatexToken readItem(int start, int startLine, int startCol) {
        int mark = pos;
        int markLine = line;
        int markCol = column;
        skipInlineSpaces();

        String label = null;
        if (pos < source.length() && source.charAt(pos) == '[') {
            int labelStart = pos + 1;
            int depth = 0;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        label = source.substring(labelStart, pos);
                        consume(1);
                        break;
                    }
                }
                consume(1);
            }
        } else {
            restore(mark, markLine, markCol);
        }
        return new LatexToken(TokenType.ITEM, source.substring(start, pos), startLine, startCol, "item", label);
    }

    private LatexToken readDelimitedMath(int start, String closing, TokenType type, int startLine, int startCol) {
        consume(1);
        int bodyStart = pos;
        int end = source.indexOf(closing, pos);
        int bodyEnd = end < 0 ? source.length() : end;
        consume(bodyEnd - pos);
        if (end >= 0) {
            consume(closing.length());
        }
        return new LatexToken(type, source.substring(start, pos), startLine, startCol,
                null, source.substring(bodyStart, bodyEnd));
    }

    private void skipRuleArguments() {
        // \cmidrule(lr){2-3} or \cline{2-3}
        int mark = pos;
        int markLine = line;
        int markCol = column;
        skipInlineSpaces();
        if (pos < source.length() && source.charAt(pos) == '(') {
            int close = source.indexOf(')', pos);
            if (close < 0) {
                restore(mark, markLine, markCol);
                return;
            }
            consume(close + 1 - pos);
            mark = pos;
            markLine = line;
            markCol = column;
        }
        skipInlineSpaces();
        if (pos < source.length() && source.charAt(pos) == '{') {
            skipBraceGroup();
        } else {
            restore(mark, markLine, markCol);
        }
    }

    private void skipOptionalBracket() {
        if (pos < source.length() && source.charAt(pos) == '[') {
            int close = source.indexOf(']', pos);
            if (close >= 0) {
                consume(close + 1 - pos);
            }
        }
    }

    private void skipBraceGroup() {
        if (pos >= source.length() || source.charAt(pos) != '{') {
            return;
        }
        int depth = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            consume(1);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return;
                }
            }
        }
    }

    private void skipInlineSpaces() {
        while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            consume(1);
        }
    }

    private void restore(int mark, int markLine, int markCol) {
        pos = mark;
        line = markLine;
        column = markCol;
    }

    private void consume(int count) {
        for (int i = 0; i < count && pos < source.length(); i++) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }
}
