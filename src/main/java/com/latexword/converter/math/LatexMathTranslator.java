package com.latexword.converter.math;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a LaTeX math fragment into a presentation MathML document.
 *
 * <p>Covers the constructs found in typical theses: fractions, roots,
 * scripts, big operators with limits, fences, accents, font variants,
 * text and matrix-like environments. Anything else raises
 * {@link MathTranslationException} so the caller can fall back to text.</p>
 */
public class LatexMathTranslator {

    public static final String MATH_NS = "http://www.w3.org/1998/Math/MathML";

    private static final String OPERATOR_CHARS = "+-=<>()[]|,;:!/*.?'";

    private static final Set<String> IGNORED = Set.of(
        "displaystyle", "textstyle", "scriptstyle", "limits", "nolimits", "nonumber", "notag",
        "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr", "biggl", "biggr", "middle",
        "!", "relax", "centering", "hfill");

    private static final Set<String> SKIP_WITH_ARGUMENT = Set.of("label", "tag", "hspace", "vspace", "phantom");

    private static final Map<String, String> SPACES = Map.of(
        ",", " ", ":", " ", ";", " ", " ", " ", "quad", " ", "qquad", "  ");

    private static final Map<String, String> VARIANTS = Map.of(
        "mathbf", "bold",
        "boldsymbol", "bold-italic",
        "bm", "bold-italic",
        "mathit", "italic",
        "mathrm", "normal",
        "mathbb", "double-struck",
        "mathcal", "script",
        "mathsf", "sans-serif",
        "mathtt", "monospace",
        "mathfrak", "fraktur");

    private static final Set<String> TEXT_COMMANDS = Set.of("text", "textrm", "mbox", "textnormal", "textup", "hbox");

    private static final Set<String> MATRIX_ENVIRONMENTS = Set.of(
        "matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix", "smallmatrix",
        "cases", "aligned", "alignedat", "gathered", "split", "array", "subarray");

    private final DocumentBuilderFactory factory;

    public LatexMathTranslator() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
    }

    public Document translate(String latex) throws MathTranslationException {
        if (latex == null || latex.isBlank()) {
            throw new MathTranslationException("Empty math fragment");
        }
        Document doc;
        try {
            doc = factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new MathTranslationException("Cannot create MathML document", e);
        }
        Element math = doc.createElementNS(MATH_NS, "math");
        doc.appendChild(math);

        Parser parser = new Parser(doc, lex(latex));
        Element row = parser.element("mrow");
        parser.parseSequence(row, Stop.END);
        math.appendChild(row);
        return doc;
    }

    // ---- lexing ----

    private enum Kind { COMMAND, CHAR, SPACE }

    private static final class Tok {
        final Kind kind;
        final String text;

        Tok(Kind kind, String text) {
            this.kind = kind;
            this.text = text;
        }

        boolean isChar(char c) {
            return kind == Kind.CHAR && text.length() == 1 && text.charAt(0) == c;
        }

        boolean isCommand(String name) {
            return kind == Kind.COMMAND && text.equals(name);
        }
    }

    private static List<Tok> lex(String latex) {
        List<Tok> tokens = new ArrayList<>();
        int i = 0;
        while (i < latex.length()) {
            char c = latex.charAt(i);
            if (c == '\\') {
                int j = i + 1;
                if (j < latex.length() && Character.isLetter(latex.charAt(j))) {
                    while (j < latex.length() && Character.isLetter(latex.charAt(j))) {
                        j++;
                    }
                    tokens.add(new Tok(Kind.COMMAND, latex.substring(i + 1, j)));
                    i = j;
                } else if (j < latex.length()) {
                    tokens.add(new Tok(Kind.COMMAND, String.valueOf(latex.charAt(j))));
                    i = j + 1;
                } else {
                    i = j;
                }
            } else if (c == '%') {
                while (i < latex.length() && latex.charAt(i) != '\n') {
                    i++;
                }
            } else if (Character.isWhitespace(c)) {
                while (i < latex.length() && Character.isWhitespace(latex.charAt(i))) {
                    i++;
                }
                tokens.add(new Tok(Kind.SPACE, " "));
            } else {
                int cp = latex.codePointAt(i);
                tokens.add(new Tok(Kind.CHAR, new String(Character.toChars(cp))));
                i += Character.charCount(cp);
            }
        }
        return tokens;
    }

    // ---- parsing ----

    private enum Stop { END, GROUP, RIGHT, CELL }

    private static final class Parser {
        private final Document doc;
        private final List<Tok> tokens;
        private int pos;

        Parser(Document doc, List<Tok> tokens) {
            this.doc = doc;
            this.tokens = tokens;
        }

        Element element(String name) {
            return doc.createElementNS(MATH_NS, name);
        }

        Element token(String name, String text) {
            Element e = element(name);
            e.setTextContent(text);
            return e;
        }

        /** Next significant token; spaces only matter inside text groups. */
        private Tok peek() {
            while (pos < tokens.size() && tokens.get(pos).kind == Kind.SPACE) {
                pos++;
            }
            return pos < tokens.size() ? tokens.get(pos) : null;
        }

        private boolean atStop(Stop stop) {
            Tok t = peek();
            if (t == null) {
                return true;
            }
            return switch (stop) {
                case END -> false;
                case GROUP -> t.isChar('}');
                case RIGHT -> t.isCommand("right");
                case CELL -> t.isChar('&') || t.isCommand("\\") || t.isCommand("end");
            };
        }

        void parseSequence(Element parent, Stop stop) throws MathTranslationException {
            while (!atStop(stop)) {
                Tok t = peek();
                if (stop == Stop.END && (t.isChar('&') || t.isCommand("\\"))) {
                    // alignment points and row breaks of an already split equation row
                    pos++;
                    continue;
                }
                if (t.isChar('}')) {
                    throw new MathTranslationException("Unbalanced closing brace");
                }
                Element atom = parseScripted(null);
                if (atom != null) {
                    parent.appendChild(atom);
                }
            }
        }

        /** Parses one atom plus any following sub/superscripts. */
        private Element parseScripted(String variant) throws MathTranslationException {
            Tok first = peek();
            boolean limits = first != null && first.kind == Kind.COMMAND
                && MathSymbols.LIMIT_OPERATORS.contains(first.text);
            Element base = parseAtom(variant);
            if (base == null) {
                return null;
            }

            Element sub = null;
            Element sup = null;
            while (peek() != null) {
                Tok t = peek();
                if (t.isChar('_') && sub == null) {
                    pos++;
                    sub = requireAtom();
                } else if (t.isChar('^') && sup == null) {
                    pos++;
                    sup = requireAtom();
                } else if (t.isChar('\'') && sup == null) {
                    StringBuilder primes = new StringBuilder();
                    while (peek() != null && peek().isChar('\'')) {
                        primes.append('′');
                        pos++;
                    }
                    sup = token("mo", primes.toString());
                } else {
                    break;
                }
            }

            if (sub == null && sup == null) {
                return base;
            }
            Element scripted;
            if (sub != null && sup != null) {
                scripted = element(limits ? "munderover" : "msubsup");
                scripted.appendChild(base);
                scripted.appendChild(sub);
                scripted.appendChild(sup);
            } else if (sub != null) {
                scripted = element(limits ? "munder" : "msub");
                scripted.appendChild(base);
                scripted.appendChild(sub);
            } else {
                scripted = element(limits ? "mover" : "msup");
                scripted.appendChild(base);
                scripted.appendChild(sup);
            }
            return scripted;
        }

        private Element requireAtom() throws MathTranslationException {
            Element atom = parseAtom(null);
            if (atom == null) {
                throw new MathTranslationException("Missing script argument");
            }
            return atom;
        }

        private Element parseAtom(String variant) throws MathTranslationException {
            Tok t = peek();
            if (t == null) {
                return null;
            }
            pos++;

            if (t.kind == Kind.CHAR) {
                return parseChar(t.text, variant);
            }
            return parseCommand(t.text, variant);
        }

        private Element parseChar(String c, String variant) throws MathTranslationException {
            char ch = c.charAt(0);
            if (ch == '{') {
                Element row = element("mrow");
                while (!atStop(Stop.GROUP)) {
                    Element atom = parseScripted(variant);
                    if (atom != null) {
                        row.appendChild(atom);
                    }
                }
                expectChar('}');
                return row;
            }
            if (Character.isDigit(ch)) {
                StringBuilder number = new StringBuilder(c);
                while (peek() != null && peek().kind == Kind.CHAR
                        && (Character.isDigit(peek().text.charAt(0))
                            || (peek().isChar('.') && pos + 1 < tokens.size()
                                && tokens.get(pos + 1).kind == Kind.CHAR
                                && Character.isDigit(tokens.get(pos + 1).text.charAt(0))))) {
                    number.append(peek().text);
                    pos++;
                }
                return withVariant(token("mn", number.toString()), variant);
            }
            if (Character.isLetter(ch)) {
                return withVariant(token("mi", c), variant);
            }
            if (ch == '~') {
                return token("mtext", " ");
            }
            if (ch == '^' || ch == '_') {
                throw new MathTranslationException("Script without base");
            }
            if (ch == '-') {
                return token("mo", "−");
            }
            if (ch == '*') {
                return token("mo", "∗");
            }
            if (OPERATOR_CHARS.indexOf(ch) >= 0) {
                return token("mo", c);
            }
            return token("mi", c);
        }

        private Element parseCommand(String name, String variant) throws MathTranslationException {
            if (IGNORED.contains(name)) {
                return null;
            }
            if (SKIP_WITH_ARGUMENT.contains(name)) {
                readRawGroup();
                return null;
            }
            if (SPACES.containsKey(name)) {
                return token("mtext", SPACES.get(name));
            }
            if (name.length() == 1 && "{}|%$#&_".contains(name)) {
                return token(name.equals("|") ? "mo" : "mi", name.equals("|") ? "‖" : name);
            }

            switch (name) {
                case "frac", "dfrac", "tfrac", "cfrac" -> {
                    Element frac = element("mfrac");
                    frac.appendChild(requireAtom());
                    frac.appendChild(requireAtom());
                    return frac;
                }
                case "binom", "dbinom", "tbinom" -> {
                    Element frac = element("mfrac");
                    frac.setAttribute("linethickness", "0");
                    frac.appendChild(requireAtom());
                    frac.appendChild(requireAtom());
                    return fenced("(", frac, ")");
                }
                case "sqrt" -> {
                    if (peek() != null && peek().isChar('[')) {
                        pos++;
                        Element index = element("mrow");
                        while (peek() != null && !peek().isChar(']')) {
                            Element atom = parseScripted(null);
                            if (atom != null) {
                                index.appendChild(atom);
                            }
                        }
                        expectChar(']');
                        Element root = element("mroot");
                        root.appendChild(requireAtom());
                        root.appendChild(index);
                        return root;
                    }
                    Element sqrt = element("msqrt");
                    sqrt.appendChild(requireAtom());
                    return sqrt;
                }
                case "left" -> {
                    String open = readDelimiter();
                    Element inner = element("mrow");
                    parseSequence(inner, Stop.RIGHT);
                    if (peek() == null) {
                        throw new MathTranslationException("\\left without \\right");
                    }
                    pos++;
                    String close = readDelimiter();
                    return fenced(open, inner, close);
                }
                case "right" -> throw new MathTranslationException("\\right without \\left");
                case "begin" -> {
                    return parseEnvironment(readRawGroup());
                }
                case "end" -> throw new MathTranslationException("Unexpected \\end");
                case "operatorname" -> {
                    return token("mi", readRawGroup().strip());
                }
                case "underline" -> {
                    Element under = element("munder");
                    under.setAttribute("accentunder", "true");
                    under.appendChild(requireAtom());
                    under.appendChild(token("mo", "_"));
                    return under;
                }
                default -> {
                    // fall through to table lookups
                }
            }

            if (TEXT_COMMANDS.contains(name)) {
                return token("mtext", readRawGroup());
            }
            if (VARIANTS.containsKey(name)) {
                return requireVariantAtom(VARIANTS.get(name));
            }
            if (MathSymbols.ACCENTS.containsKey(name)) {
                Element over = element("mover");
                over.setAttribute("accent", "true");
                over.appendChild(requireAtom());
                over.appendChild(token("mo", MathSymbols.ACCENTS.get(name)));
                return over;
            }
            if (MathSymbols.FUNCTIONS.contains(name)) {
                Element fn = token("mi", name);
                fn.setAttribute("mathvariant", "normal");
                return fn;
            }
            if (MathSymbols.IDENTIFIERS.containsKey(name)) {
                return withVariant(token("mi", MathSymbols.IDENTIFIERS.get(name)), variant);
            }
            if (MathSymbols.OPERATORS.containsKey(name)) {
                return token("mo", MathSymbols.OPERATORS.get(name));
            }
            throw new MathTranslationException("Unsupported math command \\" + name);
        }

        private Element requireVariantAtom(String variant) throws MathTranslationException {
            Element atom = parseAtom(variant);
            if (atom == null) {
                throw new MathTranslationException("Missing argument for font command");
            }
            return atom;
        }

        private Element parseEnvironment(String env) throws MathTranslationException {
            String name = env.strip();
            if (!MATRIX_ENVIRONMENTS.contains(name)) {
                throw new MathTranslationException("Unsupported math environment " + name);
            }
            if (name.equals("array") || name.equals("alignedat") || name.equals("subarray")) {
                readRawGroup();
            }

            Element table = element("mtable");
            Element row = element("mtr");
            Element cell = element("mtd");
            while (true) {
                Element cellRow = element("mrow");
                parseSequence(cellRow, Stop.CELL);
                cell.appendChild(cellRow);
                Tok t = peek();
                if (t == null) {
                    throw new MathTranslationException("Unterminated environment " + name);
                }
                pos++;
                if (t.isChar('&')) {
                    row.appendChild(cell);
                    cell = element("mtd");
                } else if (t.isCommand("\\")) {
                    row.appendChild(cell);
                    table.appendChild(row);
                    row = element("mtr");
                    cell = element("mtd");
                } else {
                    readRawGroup();
                    row.appendChild(cell);
                    if (row.getTextContent().isBlank() && table.hasChildNodes()) {
                        break;
                    }
                    table.appendChild(row);
                    break;
                }
            }

            return switch (name) {
                case "pmatrix" -> fenced("(", table, ")");
                case "bmatrix" -> fenced("[", table, "]");
                case "Bmatrix", "cases" -> fenced("{", table, name.equals("cases") ? "" : "}");
                case "vmatrix" -> fenced("|", table, "|");
                case "Vmatrix" -> fenced("‖", table, "‖");
                default -> table;
            };
        }

        private Element fenced(String open, Element content, String close) {
            Element row = element("mrow");
            Element left = token("mo", open);
            left.setAttribute("fence", "true");
            Element right = token("mo", close);
            right.setAttribute("fence", "true");
            row.appendChild(left);
            row.appendChild(content);
            row.appendChild(right);
            return row;
        }

        private String readDelimiter() throws MathTranslationException {
            Tok t = peek();
            if (t == null) {
                throw new MathTranslationException("Missing delimiter");
            }
            pos++;
            if (t.kind == Kind.CHAR) {
                return t.isChar('.') ? "" : t.text;
            }
            if (t.text.equals("{") || t.text.equals("}")) {
                return t.text;
            }
            if (t.text.equals("|")) {
                return "‖";
            }
            String symbol = MathSymbols.OPERATORS.get(t.text);
            if (symbol == null) {
                throw new MathTranslationException("Unknown delimiter \\" + t.text);
            }
            return symbol;
        }

        /** Reads a brace group verbatim, re-joining its tokens. */
        private String readRawGroup() throws MathTranslationException {
            if (peek() == null || !peek().isChar('{')) {
                throw new MathTranslationException("Expected '{'");
            }
            pos++;
            int depth = 1;
            StringBuilder sb = new StringBuilder();
            while (pos < tokens.size()) {
                Tok t = tokens.get(pos);
                pos++;
                if (t.isChar('{')) {
                    depth++;
                } else if (t.isChar('}')) {
                    depth--;
                    if (depth == 0) {
                        return sb.toString();
                    }
                }
                if (t.kind == Kind.COMMAND) {
                    sb.append(MathSymbols.IDENTIFIERS.getOrDefault(t.text,
                        MathSymbols.OPERATORS.getOrDefault(t.text, SPACES.getOrDefault(t.text, ""))));
                } else if (!t.isChar('{') && !t.isChar('}')) {
                    sb.append(t.text);
                }
            }
            throw new MathTranslationException("Unterminated group");
        }

        private void expectChar(char c) throws MathTranslationException {
            if (peek() == null || !peek().isChar(c)) {
                throw new MathTranslationException("Expected '" + c + "'");
            }
            pos++;
        }

        private static Element withVariant(Element e, String variant) {
            if (variant != null) {
                e.setAttribute("mathvariant", variant);
            }
            return e;
        }
    }
}
