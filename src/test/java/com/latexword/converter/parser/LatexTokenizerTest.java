package com.latexword.converter.parser;

import com.latexword.converter.parser.LatexToken.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LatexTokenizer.
 */
class LatexTokenizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "plain text only",
        "\\section{Intro} % trailing comment\nbody",
        "a $x^2$ and $$\\frac{a}{b}$$ and \\(y\\) \\[z\\]",
        "\\begin{tabular}{|l|c|}\\hline A & B \\\\ \\hline\\end{tabular}",
        "\\begin{verbatim}\n  \\raw {text}\n\\end{verbatim}",
        "\\item[(a)] first\n\n\\item second",
        "unterminated $math to the end",
        "\\toprule x \\cmidrule(lr){2-3} y \\bottomrule",
        "trailing backslash \\",
        "中文 段落~引用\\cite[p.~12]{foo}"
    })
    void testTokenizationIsLossless(String source) {
        List<LatexToken> tokens = new LatexTokenizer(source).tokenize();

        String rebuilt = tokens.stream().map(LatexToken::getValue).collect(Collectors.joining());

        assertThat(rebuilt).isEqualTo(source);
        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void testCommandsAndGroups() {
        List<LatexToken> tokens = tokenize("\\textbf{bold} \\section*{Star}");

        assertThat(tokens.get(0).isCommand("textbf")).isTrue();
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.BRACE_OPEN);
        assertThat(tokens.get(2).getValue()).isEqualTo("bold");
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.BRACE_CLOSE);
        assertThat(tokens.get(5).getName()).isEqualTo("section*");
    }

    @Test
    void testSingleCharacterCommands() {
        List<LatexToken> tokens = tokenize("50\\% off \\&");

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.COMMAND);
        assertThat(tokens.get(1).getName()).isEqualTo("%");
        assertThat(tokens.get(5).getName()).isEqualTo("&");
    }

    @Test
    void testEnvironmentTokens() {
        List<LatexToken> tokens = tokenize("\\begin{figure}[h]x\\end{figure}");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.ENV_BEGIN);
        assertThat(tokens.get(0).getName()).isEqualTo("figure");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.BRACKET_OPEN);
        assertThat(tokens.get(tokens.size() - 2).getType()).isEqualTo(TokenType.ENV_END);
    }

    @Test
    void testVerbatimBodyIsRaw() {
        List<LatexToken> tokens = tokenize("\\begin{lstlisting}[language=Java]\nint x = 1; // \\ignored\n\\end{lstlisting}");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(0).getContent()).isEqualTo("[language=Java]");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.TEXT);
        assertThat(tokens.get(1).getValue()).contains("\\ignored");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.ENV_END);
    }

    @Test
    void testMathTokens() {
        List<LatexToken> tokens = tokenize("$a+b$ $$c$$ \\[d\\]");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.MATH_INLINE);
        assertThat(tokens.get(0).getContent()).isEqualTo("a+b");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.MATH_DISPLAY);
        assertThat(tokens.get(2).getContent()).isEqualTo("c");
        assertThat(tokens.get(4).getType()).isEqualTo(TokenType.MATH_DISPLAY);
        assertThat(tokens.get(4).getContent()).isEqualTo("d");
    }

    @Test
    void testParagraphBreakVersusWhitespace() {
        List<LatexToken> tokens = tokenize("a\nb\n\n c");

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.WHITESPACE);
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.PAR_BREAK);
    }

    @Test
    void testItemWithLabel() {
        List<LatexToken> tokens = tokenize("\\item[(i)] one \\item two");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.ITEM);
        assertThat(tokens.get(0).getContent()).isEqualTo("(i)");
        LatexToken second = tokens.stream().filter(t -> t.is(TokenType.ITEM)).skip(1).findFirst().orElseThrow();
        assertThat(second.getContent()).isNull();
    }

    @Test
    void testTableSeparatorsAndRules() {
        List<LatexToken> tokens = tokenize("\\toprule A & B \\\\ \\midrule \\hline \\cline{1-2} C \\tabularnewline \\bottomrule");

        assertThat(tokens).extracting(LatexToken::getType)
            .contains(TokenType.TOPRULE, TokenType.AMPERSAND, TokenType.NEWLINE_CMD,
                      TokenType.MIDRULE, TokenType.HLINE, TokenType.CMIDRULE, TokenType.BOTTOMRULE);
        assertThat(tokens.stream().filter(t -> t.is(TokenType.NEWLINE_CMD)).count()).isEqualTo(2);
    }

    @Test
    void testLineBreakWithSpacingArgument() {
        List<LatexToken> tokens = tokenize("a\\\\[2pt]b");

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.NEWLINE_CMD);
        assertThat(tokens.get(1).getValue()).isEqualTo("\\\\[2pt]");
        assertThat(tokens.get(2).getValue()).isEqualTo("b");
    }

    @Test
    void testCommentRunsToEndOfLine() {
        List<LatexToken> tokens = tokenize("x % note {\ny");

        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(2).getValue()).isEqualTo("% note {");
        assertThat(tokens.get(4).getValue()).isEqualTo("y");
        assertThat(tokens.get(4).getLine()).isEqualTo(2);
    }

    private List<LatexToken> tokenize(String source) {
        return new LatexTokenizer(source).tokenize();
    }
}
