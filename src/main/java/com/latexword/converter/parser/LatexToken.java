package com.latexword.converter.parser;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A lexical token of LaTeX source. Concatenating the {@code value} of every
 * token of a stream reproduces the source text exactly.
 */
@Value
@AllArgsConstructor
public class LatexToken {
    TokenType type;
    /** Raw source text covered by this token. */
    String value;
    int line;
    int column;
    /** Command or environment name, without the escape character. */
    String name;
    /** Math body, item label or raw environment arguments. */
    String content;

    public LatexToken(TokenType type, String value, int line, int column) {
        this(type, value, line, column, null, null);
    }

    public enum TokenType {
        TEXT,
        WHITESPACE,
        COMMAND,
        ENV_BEGIN,
        ENV_END,
        BRACE_OPEN,
        BRACE_CLOSE,
        BRACKET_OPEN,
        BRACKET_CLOSE,
        MATH_INLINE,
        MATH_DISPLAY,
        NEWLINE_CMD,
        PAR_BREAK,
        COMMENT,
        ITEM,
        AMPERSAND,
        TOPRULE,
        MIDRULE,
        BOTTOMRULE,
        HLINE,
        CMIDRULE,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isCommand(String commandName) {
        return type == TokenType.COMMAND && commandName.equals(name);
    }

    public boolean isTableRule() {
        return type == TokenType.TOPRULE || type == TokenType.MIDRULE
                || type == TokenType.BOTTOMRULE || type == TokenType.HLINE
                || type == TokenType.CMIDRULE;
    }

    public boolean isBooktabsRule() {
        return type == TokenType.TOPRULE || type == TokenType.MIDRULE
                || type == TokenType.BOTTOMRULE;
    }

    /** Whether the token carries no visible content (whitespace or comment). */
    public boolean isBlank() {
        return type == TokenType.WHITESPACE || type == TokenType.COMMENT;
    }
}
