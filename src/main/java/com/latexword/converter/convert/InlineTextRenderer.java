package com.latexword.converter.convert;

import com.latexword.converter.aux.TexStructure;
import com.latexword.converter.math.MathText;
import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.parser.LatexToken.TokenType;
import com.latexword.converter.text.SymbolTable;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a token slice as plain text, for heading titles and footnotes.
 * References and citations are resolved through the aux data when present.
 */
class InlineTextRenderer {

    static final Set<String> TEXT_WRAPPERS = Set.of("textbf", "textit", "emph", "underline", "text", "textrm", "texttt");
    static final Set<String> REF_COMMANDS = Set.of("ref", "autoref", "cref", "Cref", "pageref", "eqref");
    static final Set<String> CITE_COMMANDS = Set.of(
        "cite", "citep", "citet", "citealt", "citealp", "citenum", "parencite", "textcite");
    /** Citation commands that print the numbers without brackets. */
    static final Set<String> BARE_CITE_COMMANDS = Set.of("citenum", "citealt", "citealp");

    private final TexStructure texStructure;

    InlineTextRenderer(TexStructure texStructure) {
        this.texStructure = texStructure;
    }

    String render(List<LatexToken> tokens) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < tokens.size()) {
            LatexToken tok = tokens.get(i);
            switch (tok.getType()) {
                case TEXT -> sb.append(tok.getValue());
                case WHITESPACE -> sb.append(' ');
                case MATH_INLINE, MATH_DISPLAY -> sb.append(MathText.toPlainText(tok.getContent()));
                case COMMAND -> {
                    int next = renderCommand(tokens, i, sb);
                    if (next > i) {
                        i = next;
                        continue;
                    }
                }
                default -> {
                    // grouping and structure tokens carry no text
                }
            }
            i++;
        }
        return sb.toString().strip();
    }

    /**
     * Renders the command at {@code index}.
     *
     * @return the index after the consumed arguments, or {@code index} when
     *         nothing beyond the command itself was consumed
     */
    private int renderCommand(List<LatexToken> tokens, int index, StringBuilder sb) {
        String name = tokens.get(index).getName();

        if (SymbolTable.isSymbol(name)) {
            sb.append(SymbolTable.lookup(name).orElse(""));
            return index;
        }
        if (TEXT_WRAPPERS.contains(name)) {
            TokenGroup group = TokenGroup.read(tokens, index + 1, TokenType.BRACE_OPEN, TokenType.BRACE_CLOSE);
            if (group != null) {
                sb.append(render(group.getInner()));
                return group.getNext();
            }
            return index;
        }
        if (REF_COMMANDS.contains(name)) {
            TokenGroup group = TokenGroup.read(tokens, index + 1, TokenType.BRACE_OPEN, TokenType.BRACE_CLOSE);
            if (group != null) {
                String key = render(group.getInner());
                String display = resolveReference(name, key);
                sb.append("eqref".equals(name) ? "(" + display + ")" : display);
                return group.getNext();
            }
            return index;
        }
        if (CITE_COMMANDS.contains(name)) {
            int j = index + 1;
            TokenGroup optional = TokenGroup.read(tokens, j, TokenType.BRACKET_OPEN, TokenType.BRACKET_CLOSE);
            while (optional != null) {
                j = optional.getNext();
                optional = TokenGroup.read(tokens, j, TokenType.BRACKET_OPEN, TokenType.BRACKET_CLOSE);
            }
            TokenGroup keys = TokenGroup.read(tokens, j, TokenType.BRACE_OPEN, TokenType.BRACE_CLOSE);
            if (keys != null) {
                sb.append(formatCitation(name, splitKeys(render(keys.getInner()))));
                return keys.getNext();
            }
            return index;
        }
        if ("quad".equals(name) || "enspace".equals(name) || "thinspace".equals(name)) {
            sb.append(' ');
        } else if ("qquad".equals(name)) {
            sb.append("  ");
        }
        return index;
    }

    String resolveReference(String command, String key) {
        if (texStructure == null) {
            return key;
        }
        if ("pageref".equals(command)) {
            return texStructure.getLabel(key).map(label -> String.valueOf(label.getPage())).orElse(key);
        }
        return texStructure.resolveRef(key).orElse(key);
    }

    String formatCitation(String command, List<String> keys) {
        List<String> resolved = texStructure == null ? keys : texStructure.resolveCitationKeys(keys);
        String joined = String.join(", ", resolved);
        return BARE_CITE_COMMANDS.contains(command) ? joined : "[" + joined + "]";
    }

    static List<String> splitKeys(String keys) {
        return Arrays.stream(keys.split(","))
            .map(String::strip)
            .filter(k -> !k.isEmpty())
            .collect(Collectors.toList());
    }

    static String rawText(List<LatexToken> tokens) {
        return tokens.stream().map(LatexToken::getValue).collect(Collectors.joining());
    }

    /** The inner tokens of a delimited group and the index after it. */
    @Value
    static class TokenGroup {
        List<LatexToken> inner;
        int next;

        /**
         * Reads a group opening at {@code from}, after blank tokens.
         *
         * @return null when no group opens there
         */
        static TokenGroup read(List<LatexToken> tokens, int from, TokenType open, TokenType close) {
            int j = from;
            while (j < tokens.size() && tokens.get(j).isBlank()) {
                j++;
            }
            if (j >= tokens.size() || tokens.get(j).getType() != open) {
                return null;
            }
            j++;
            int depth = 1;
            List<LatexToken> inner = new ArrayList<>();
            while (j < tokens.size() && depth > 0) {
                LatexToken t = tokens.get(j);
                if (t.getType() == open) {
                    depth++;
                } else if (t.getType() == close) {
                    depth--;
                }
                if (depth > 0) {
                    inner.add(t);
                }
                j++;
            }
            return new TokenGroup(inner, j);
        }
    }
}
