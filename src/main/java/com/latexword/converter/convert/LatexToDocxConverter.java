package com.latexword.converter.convert;

import com.latexword.converter.aux.FloatEntry;
import com.latexword.converter.aux.TexStructure;
import com.latexword.converter.aux.TocEntry;
import com.latexword.converter.convert.InlineTextRenderer.TokenGroup;
import com.latexword.converter.math.MathHandler;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.parser.LatexToken;
import com.latexword.converter.parser.LatexToken.TokenType;
import com.latexword.converter.parser.LatexTokenizer;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.model.FontsConfig;
import com.latexword.converter.profile.model.HeadingStyleConfig;
import com.latexword.converter.profile.model.LabelsConfig;
import com.latexword.converter.table.TableBuilder;
import com.latexword.converter.text.SymbolTable;
import com.latexword.converter.text.TextNormalizer;
import com.latexword.converter.util.OoxmlUtil;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a LaTeX document body into a Word document.
 *
 * <p>The source is tokenized and walked once. Every token either opens,
 * extends or closes the current paragraph; commands and environments are
 * looked up in dispatch tables and anything unknown degrades to its plain
 * text. Aux data, when present, supplies the numbers TeX computed for
 * headings, floats, references and citations.</p>
 *
 * <p>A converter holds the state of one conversion and is not thread-safe.
 * Create a new instance for every document.</p>
 */
public class LatexToDocxConverter {

    private static final Logger log = LoggerFactory.getLogger(LatexToDocxConverter.class);

    static final double DEFAULT_IMAGE_WIDTH_CM = 12.0;
    static final double LIST_INDENT_CM = 0.55;
    static final double TEXT_WIDTH_CM = 15.0;
    static final int EQUATION_CENTER_TAB = 4536;
    static final int RIGHT_TAB = 9072;
    public static final String HINT_COLOR = "808080";
    public static final String TOC_FIELD = "TOC \\o \"1-4\" \\h \\z \\u";

    /** Commands that take no argument and produce nothing. */
    private static final Set<String> SKIP_COMMANDS = Set.of(
        "centering", "raggedright", "raggedleft", "normalfont", "selectfont", "upshape", "mdseries",
        "rmfamily", "sffamily", "normalsize", "small", "footnotesize", "scriptsize", "tiny",
        "large", "Large", "LARGE", "huge", "Huge", "frontmatter", "mainmatter", "backmatter",
        "onehalfspacing", "doublespacing", "singlespacing", "protect", "relax", "indent",
        "bigskip", "medskip", "smallskip", "vfill", "hfill", "dotfill", "hrulefill", "strut",
        "null", "phantom", "maketitle", "MAKETITLE", "makedeclaration", "appendix", "today");

    /** Preamble-like commands whose arguments are consumed silently. */
    private static final Set<String> SKIP_WITH_ARG = Set.of(
        "pagestyle", "thispagestyle", "pagenumbering", "setlength", "addtolength", "setcounter",
        "addtocounter", "linespread", "bibliographystyle", "hypersetup", "captionsetup",
        "renewcommand", "newcommand", "providecommand", "DeclareCaptionFont", "newgeometry",
        "restoregeometry", "fancyhead", "fancyfoot", "fancyhf", "titleformat", "titlespacing",
        "titlecontents", "intobmk");

    private static final Set<String> TWO_GROUP_COMMANDS = Set.of(
        "setlength", "addtolength", "renewcommand", "newcommand", "providecommand",
        "setcounter", "addtocounter", "DeclareCaptionFont");

    private static final Set<String> FLOAT_ENVIRONMENTS = Set.of("table", "table*", "figure", "figure*");
    private static final Set<String> LIST_ENVIRONMENTS = Set.of("itemize", "enumerate", "description");
    private static final Set<String> TABLE_ENVIRONMENTS = Set.of("tabular", "tabular*", "tabularx", "longtable");
    private static final Set<String> MATH_ENVIRONMENTS = Set.of(
        "equation", "equation*", "align", "align*", "gather", "gather*", "multline", "multline*");
    private static final Set<String> VERBATIM_ENVIRONMENTS = Set.of("verbatim", "verbatim*", "lstlisting", "minted");

    private static final Pattern IMAGE_WIDTH = Pattern.compile(
        "width\\s*=\\s*([\\d.]+)\\s*(cm|mm|in|\\\\textwidth|\\\\linewidth|\\\\columnwidth)");
    private static final Pattern EQUATION_LABEL = Pattern.compile("\\\\label\\s*\\{[^}]*}");
    private static final Pattern NO_NUMBER = Pattern.compile("\\\\(nonumber|notag)\\b");
    private static final Pattern ROW_BREAK = Pattern.compile("\\\\\\\\");

    private final DocxProfile profile;
    private final TexStructure texStructure;
    private final ExportMetadata metadata;
    private final double defaultImageWidthCm;
    private final ImageResolver imageResolver;
    private final PictureEmbedder pictureEmbedder = new PictureEmbedder();
    private final MathHandler mathHandler = new MathHandler();
    private final TableBuilder tableBuilder;
    private final InlineTextRenderer textRenderer;

    private final Map<String, Consumer<String>> commandHandlers = new HashMap<>();
    private final Map<String, Consumer<String>> environmentHandlers = new HashMap<>();

    private XWPFDocument doc;
    private List<LatexToken> tokens;
    private int pos;
    private SectionCounters counters;
    private Deque<FormatState> formatStack;
    private List<String> envStack;
    private XWPFParagraph currentParagraph;
    private boolean inDocument;
    private boolean afterFloat;
    private boolean suppressIndent;
    private int figureCount;
    private int tableCount;
    private int equationCount;
    private int footnoteCount;
    private List<FootnoteEntry> footnotes;
    private List<String> listTypes;
    private List<Integer> listCounters;

    public LatexToDocxConverter(DocxProfile profile, TexStructure texStructure, Path imageBaseDir,
                                ExportMetadata metadata) {
        this(profile, texStructure, imageBaseDir, metadata, DEFAULT_IMAGE_WIDTH_CM);
    }

    public LatexToDocxConverter(DocxProfile profile, TexStructure texStructure, Path imageBaseDir,
                                ExportMetadata metadata, double defaultImageWidthCm) {
        this.profile = profile == null ? DocxProfile.defaults() : profile;
        this.texStructure = texStructure;
        this.metadata = metadata == null ? new ExportMetadata() : metadata;
        this.defaultImageWidthCm = defaultImageWidthCm > 0 ? defaultImageWidthCm : DEFAULT_IMAGE_WIDTH_CM;
        this.imageResolver = new ImageResolver(imageBaseDir == null ? Path.of(".") : imageBaseDir);
        this.tableBuilder = new TableBuilder(this.profile.getFonts());
        this.textRenderer = new InlineTextRenderer(texStructure);
        registerCommands();
        registerEnvironments();
        resetState();
    }

    /**
     * Converts the LaTeX source into a new document.
     */
    public XWPFDocument convert(String latex) {
        return convert(latex, new XWPFDocument());
    }

    /**
     * Converts the LaTeX source, appending the body to {@code target}. The
     * target may carry styles and settings of a reference document.
     */
    public XWPFDocument convert(String latex, XWPFDocument target) {
        resetState();
        doc = target;
        tokens = new LatexTokenizer(latex).tokenize();
        pos = 0;
        inDocument = tokens.stream().noneMatch(t -> t.is(TokenType.ENV_BEGIN) && "document".equals(t.getName()));

        while (!peek().is(TokenType.EOF)) {
            processToken(next());
        }
        finishParagraph();

        new DocumentFinalizer(profile, metadata).finish(doc);
        log.info("Converted {} tokens: {} chapters, {} figures, {} tables, {} footnotes",
            tokens.size(), counters.getChapter(), figureCount, tableCount, footnotes.size());
        return doc;
    }

    /** Footnotes collected by the last conversion, in reference order. */
    public List<FootnoteEntry> getFootnotes() {
        return Collections.unmodifiableList(footnotes);
    }

    public SectionCounters getCounters() {
        return counters;
    }

    private void resetState() {
        counters = new SectionCounters();
        formatStack = new ArrayDeque<>();
        formatStack.push(new FormatState());
        envStack = new ArrayList<>();
        currentParagraph = null;
        afterFloat = false;
        suppressIndent = false;
        figureCount = 0;
        tableCount = 0;
        equationCount = 0;
        footnoteCount = 0;
        footnotes = new ArrayList<>();
        listTypes = new ArrayList<>();
        listCounters = new ArrayList<>();
    }

    // ------------------------------------------------------------------
    // token stream

    private LatexToken peek() {
        return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
    }

    private LatexToken next() {
        LatexToken tok = peek();
        if (pos < tokens.size()) {
            pos++;
        }
        return tok;
    }

    private void skipBlank() {
        while (peek().isBlank()) {
            pos++;
        }
    }

    /** Reads a brace group after optional blanks, or null when none follows. */
    private List<LatexToken> readGroupTokens() {
        TokenGroup group = TokenGroup.read(tokens, pos, TokenType.BRACE_OPEN, TokenType.BRACE_CLOSE);
        if (group == null) {
            return null;
        }
        pos = group.getNext();
        return group.getInner();
    }

    private String readGroup() {
        List<LatexToken> inner = readGroupTokens();
        return inner == null ? "" : InlineTextRenderer.rawText(inner);
    }

    private String readOptionalArg() {
        TokenGroup group = TokenGroup.read(tokens, pos, TokenType.BRACKET_OPEN, TokenType.BRACKET_CLOSE);
        if (group == null) {
            return null;
        }
        pos = group.getNext();
        return InlineTextRenderer.rawText(group.getInner());
    }

    private boolean groupFollows() {
        int j = pos;
        while (j < tokens.size() && tokens.get(j).isBlank()) {
            j++;
        }
        return j < tokens.size() && tokens.get(j).is(TokenType.BRACE_OPEN);
    }

    /** Collects the tokens up to the {@code \end} matching the open environment. */
    private List<LatexToken> collectEnvironmentBody(String name) {
        List<LatexToken> body = new ArrayList<>();
        int depth = 1;
        while (!peek().is(TokenType.EOF)) {
            LatexToken tok = next();
            if (tok.is(TokenType.ENV_BEGIN) && name.equals(tok.getName())) {
                depth++;
            } else if (tok.is(TokenType.ENV_END) && name.equals(tok.getName()) && --depth == 0) {
                popEnvironment(name);
                return body;
            }
            body.add(tok);
        }
        log.warn("Environment {} is not closed", name);
        popEnvironment(name);
        return body;
    }

    // ------------------------------------------------------------------
    // dispatch

    private void processToken(LatexToken tok) {
        if (tok.is(TokenType.COMMENT)) {
            return;
        }
        if (!inDocument) {
            if (tok.is(TokenType.ENV_BEGIN) && "document".equals(tok.getName())) {
                inDocument = true;
                envStack.add("document");
            }
            return;
        }
        switch (tok.getType()) {
            case ENV_BEGIN -> guarded(tok, () -> handleEnvBegin(tok.getName()));
            case ENV_END -> handleEnvEnd(tok.getName());
            case COMMAND -> guarded(tok, () -> handleCommand(tok.getName()));
            case PAR_BREAK -> finishParagraph();
            case WHITESPACE -> {
                if (currentParagraph != null) {
                    addRun(" ");
                }
            }
            case TEXT -> addRun(tok.getValue());
            case BRACKET_OPEN, BRACKET_CLOSE -> addRun(tok.getValue());
            case MATH_INLINE, MATH_DISPLAY -> guarded(tok, () -> handleMath(tok));
            case BRACE_OPEN -> formatStack.push(formatStack.peek().copy());
            case BRACE_CLOSE -> popFormat();
            case NEWLINE_CMD -> {
                if (!insideAny(TABLE_ENVIRONMENTS)) {
                    finishParagraph();
                }
            }
            case ITEM -> handleItem(tok.getContent());
            default -> {
                // alignment tabs and table rules outside tables
            }
        }
    }

    /** Runs a handler; a failing construct is logged and skipped. */
    private void guarded(LatexToken tok, Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.warn("Skipping '{}' at line {}: {}", tok.getValue().strip(), tok.getLine(), e.getMessage());
            log.debug("Conversion failure", e);
        }
    }

    /** Processes a token slice in place of the main stream, then restores it. */
    private void processInlineTokens(List<LatexToken> slice) {
        if (slice == null || slice.isEmpty()) {
            return;
        }
        List<LatexToken> savedTokens = tokens;
        int savedPos = pos;
        int savedDepth = formatStack.size();

        List<LatexToken> inline = new ArrayList<>(slice);
        inline.add(new LatexToken(TokenType.EOF, "", 0, 0));
        tokens = inline;
        pos = 0;
        try {
            while (!peek().is(TokenType.EOF)) {
                LatexToken tok = next();
                switch (tok.getType()) {
                    case TEXT, BRACKET_OPEN, BRACKET_CLOSE -> addRun(tok.getValue());
                    case WHITESPACE -> addRun(" ");
                    case COMMAND -> guarded(tok, () -> handleCommand(tok.getName()));
                    case BRACE_OPEN -> formatStack.push(formatStack.peek().copy());
                    case BRACE_CLOSE -> popFormat();
                    case MATH_INLINE, MATH_DISPLAY -> guarded(tok, () -> handleMath(tok));
                    default -> {
                        // structure is not allowed inside inline arguments
                    }
                }
            }
        } finally {
            tokens = savedTokens;
            pos = savedPos;
            while (formatStack.size() > savedDepth) {
                formatStack.pop();
            }
        }
    }

    private void popFormat() {
        if (formatStack.size() > 1) {
            formatStack.pop();
        }
    }

    private void withFormat(Consumer<FormatState> change, List<LatexToken> content) {
        FormatState format = formatStack.peek().copy();
        change.accept(format);
        formatStack.push(format);
        try {
            processInlineTokens(content);
        } finally {
            popFormat();
        }
    }

    // ------------------------------------------------------------------
    // paragraphs and runs

    private XWPFParagraph ensureParagraph() {
        if (currentParagraph != null) {
            return currentParagraph;
        }
        currentParagraph = doc.createParagraph();
        ParagraphAlignment alignment = currentAlignment();
        if (alignment != null) {
            currentParagraph.setAlignment(alignment);
        }
        if (!listTypes.isEmpty()) {
            currentParagraph.setIndentationLeft(0);
            currentParagraph.setIndentationFirstLine(OoxmlUtil.cmToTwips(LIST_INDENT_CM * listTypes.size()));
        } else if (alignment != null || suppressIndent) {
            currentParagraph.setIndentationFirstLine(0);
        } else {
            currentParagraph.setIndentationFirstLine(
                OoxmlUtil.ptToTwips(profile.getStyles().getNormal().getFirstLineIndentPt()));
        }
        if (afterFloat) {
            currentParagraph.setSpacingBefore(OoxmlUtil.ptToTwips(12));
            afterFloat = false;
        }
        suppressIndent = false;
        return currentParagraph;
    }

    private void finishParagraph() {
        currentParagraph = null;
    }

    /** Alignment of the innermost alignment environment, or null. */
    private ParagraphAlignment currentAlignment() {
        for (int i = envStack.size() - 1; i >= 0; i--) {
            switch (envStack.get(i)) {
                case "center" -> {
                    return ParagraphAlignment.CENTER;
                }
                case "flushleft" -> {
                    return ParagraphAlignment.LEFT;
                }
                case "flushright" -> {
                    return ParagraphAlignment.RIGHT;
                }
                default -> {
                    // keep looking outward
                }
            }
        }
        return null;
    }

    private XWPFRun addRun(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        XWPFParagraph paragraph = ensureParagraph();
        FormatState format = formatStack.peek();
        XWPFRun run = format.getHyperlink() != null
            ? paragraph.createHyperlinkRun(format.getHyperlink())
            : paragraph.createRun();
        run.setText(TextNormalizer.normalize(text.replace('~', ' ')));
        applyFormat(run, format);
        return run;
    }

    private void applyFormat(XWPFRun run, FormatState format) {
        if (format.isBold()) {
            run.setBold(true);
        }
        if (format.isItalic()) {
            run.setItalic(true);
        }
        if (format.isUnderline()) {
            run.setUnderline(UnderlinePatterns.SINGLE);
        }
        if (format.isSuperscript()) {
            run.setVerticalAlignment("superscript");
        } else if (format.isSubscript()) {
            run.setVerticalAlignment("subscript");
        }
        FontsConfig fonts = profile.getFonts();
        if (format.getFontName() != null) {
            OoxmlUtil.setFonts(run, format.getFontName(), format.getFontName());
        } else {
            OoxmlUtil.setFonts(run, fonts.getBodyLatin(), null);
        }
        if (format.getFontSize() != null) {
            run.setFontSize(format.getFontSize() / 2.0);
        }
        if (format.getHyperlink() != null) {
            run.setStyle(DocxStyles.HYPERLINK);
            run.setColor(DocxStyles.HYPERLINK_COLOR);
            run.setUnderline(UnderlinePatterns.SINGLE);
        } else if (format.getColor() != null) {
            run.setColor(format.getColor());
        }
    }

    private XWPFRun styledRun(XWPFParagraph paragraph, String text, double sizePt, boolean bold) {
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        return styleRun(run, sizePt, bold);
    }

    /** A run that starts with a tab, for page numbers and equation numbers. */
    private XWPFRun tabbedRun(XWPFParagraph paragraph, String text, double sizePt) {
        XWPFRun run = paragraph.createRun();
        run.addTab();
        run.setText(text);
        return styleRun(run, sizePt, false);
    }

    private static XWPFRun styleRun(XWPFRun run, double sizePt, boolean bold) {
        run.setFontSize(sizePt);
        if (bold) {
            run.setBold(true);
        }
        OoxmlUtil.forceBlack(run);
        return run;
    }

    /** A paragraph outside the running text flow, with no first-line indent. */
    private XWPFParagraph blockParagraph(ParagraphAlignment alignment) {
        finishParagraph();
        XWPFParagraph paragraph = doc.createParagraph();
        if (alignment != null) {
            paragraph.setAlignment(alignment);
        }
        paragraph.setIndentationFirstLine(0);
        return paragraph;
    }

    // ------------------------------------------------------------------
    // registration

    private void registerCommands() {
        register(commandHandlers, name -> heading(1, name.endsWith("*")), "chapter", "chapter*");
        register(commandHandlers, name -> heading(profile.isReport() ? 2 : 1, name.endsWith("*")),
            "section", "section*");
        register(commandHandlers, name -> heading(profile.isReport() ? 3 : 2, name.endsWith("*")),
            "subsection", "subsection*");
        register(commandHandlers, name -> heading(profile.isReport() ? 4 : 3, name.endsWith("*")),
            "subsubsection", "subsubsection*");

        register(commandHandlers, name -> withFormat(f -> f.setBold(true), readGroupTokens()), "textbf");
        register(commandHandlers, name -> withFormat(f -> f.setItalic(true), readGroupTokens()),
            "textit", "emph", "textsl");
        register(commandHandlers, name -> withFormat(f -> f.setUnderline(true), readGroupTokens()),
            "underline", "uline");
        register(commandHandlers, name -> withFormat(f -> f.setSuperscript(true), readGroupTokens()),
            "textsuperscript");
        register(commandHandlers, name -> withFormat(f -> f.setSubscript(true), readGroupTokens()),
            "textsubscript");
        register(commandHandlers, name -> withFormat(f -> f.setFontName(profile.getFonts().getMonospace()),
            readGroupTokens()), "texttt");
        register(commandHandlers, name -> withFormat(f -> { }, readGroupTokens()),
            "textrm", "text", "textnormal", "mbox");

        register(commandHandlers, name -> formatStack.peek().setBold(true), "bfseries");
        register(commandHandlers, name -> formatStack.peek().setItalic(true), "itshape");
        register(commandHandlers, name -> formatStack.peek().setFontName(profile.getFonts().getMonospace()),
            "ttfamily");

        register(commandHandlers, name -> addRun(" "), "quad", "enspace", "thinspace", ",", " ");
        register(commandHandlers, name -> addRun("  "), "qquad");
        register(commandHandlers, name -> suppressIndent = true, "noindent");
        register(commandHandlers, name -> finishParagraph(), "par");
        register(commandHandlers, name -> pageBreak(), "newpage", "clearpage", "cleardoublepage");

        register(commandHandlers, name -> caption(), "caption");
        register(commandHandlers, name -> readGroup(), "label", "input", "include", "bibliography");
        register(commandHandlers, this::reference, "ref", "eqref", "pageref", "autoref", "cref", "Cref");
        register(commandHandlers, this::citation, InlineTextRenderer.CITE_COMMANDS.toArray(new String[0]));
        register(commandHandlers, name -> keywords(profile.getLabels().getKeywordsZhPrefix()), "keywords");
        register(commandHandlers, name -> keywords(profile.getLabels().getKeywordsEnPrefix()), "KEYWORDS");
        register(commandHandlers, name -> footnote(), "footnote");
        register(commandHandlers, name -> {
            String url = readGroup().strip();
            withFormat(f -> f.setHyperlink(url), List.of(new LatexToken(TokenType.TEXT, url, 0, 0)));
        }, "url");
        register(commandHandlers, name -> {
            String url = readGroup().strip();
            withFormat(f -> f.setHyperlink(url), readGroupTokens());
        }, "href");
        register(commandHandlers, name -> includeGraphics(), "includegraphics");
        register(commandHandlers, name -> tableOfContents(), "tableofcontents");
        register(commandHandlers, name -> floatList(true), "listoffigures");
        register(commandHandlers, name -> floatList(false), "listoftables");
        register(commandHandlers, name -> bibItem(), "bibitem");

        register(commandHandlers, name -> {
            readGroup();
            readGroup();
            processInlineTokens(readGroupTokens());
        }, "multicolumn");
        register(commandHandlers, name -> {
            readOptionalArg();
            readGroup();
        }, "usepackage", "documentclass", "vspace", "vspace*");
        register(commandHandlers, name -> {
            readOptionalArg();
            readGroup();
            addRun(" ");
        }, "hspace", "hspace*");
        register(commandHandlers, name -> {
            readGroup();
            readGroup();
        }, "fontsize");
        for (String name : SKIP_WITH_ARG) {
            commandHandlers.put(name, this::skipWithArguments);
        }
    }

    private void registerEnvironments() {
        environmentHandlers.put("document", name -> inDocument = true);
        for (String name : FLOAT_ENVIRONMENTS) {
            environmentHandlers.put(name, this::beginFloat);
        }
        for (String name : LIST_ENVIRONMENTS) {
            environmentHandlers.put(name, env -> {
                finishParagraph();
                listTypes.add(env);
                listCounters.add(0);
            });
        }
        for (String name : TABLE_ENVIRONMENTS) {
            environmentHandlers.put(name, this::tabular);
        }
        for (String name : MATH_ENVIRONMENTS) {
            environmentHandlers.put(name, this::mathEnvironment);
        }
        for (String name : VERBATIM_ENVIRONMENTS) {
            environmentHandlers.put(name, this::verbatim);
        }
        environmentHandlers.put("comment", this::collectEnvironmentBody);
        environmentHandlers.put("abstract", name -> {
            finishParagraph();
            unlistedHeading(profile.getLabels().getAbstractLabel(), 1);
        });
        environmentHandlers.put("thebibliography", name -> {
            readGroup();
            finishParagraph();
            unlistedHeading(profile.getLabels().getReferences(), 1);
            listCounters.add(0);
        });
        environmentHandlers.put("center", name -> finishParagraph());
        environmentHandlers.put("flushleft", name -> finishParagraph());
        environmentHandlers.put("flushright", name -> finishParagraph());
        environmentHandlers.put("quote", name -> finishParagraph());
        environmentHandlers.put("quotation", name -> finishParagraph());
    }

    private static void register(Map<String, Consumer<String>> table, Consumer<String> handler, String... names) {
        for (String name : names) {
            table.put(name, handler);
        }
    }

    // ------------------------------------------------------------------
    // commands

    private void handleCommand(String name) {
        if (SymbolTable.isSymbol(name) && !commandHandlers.containsKey(name)) {
            SymbolTable.lookup(name).ifPresent(this::addRun);
            return;
        }
        Consumer<String> handler = commandHandlers.get(name);
        if (handler != null) {
            handler.accept(name);
            return;
        }
        if (SKIP_COMMANDS.contains(name)) {
            return;
        }
        Optional<String> cjkFont = profile.getCjkFont(name);
        if (cjkFont.isPresent()) {
            if (groupFollows()) {
                withFormat(f -> f.setFontName(cjkFont.get()), readGroupTokens());
            } else {
                formatStack.peek().setFontName(cjkFont.get());
            }
            return;
        }
        if (groupFollows()) {
            log.debug("Unknown command \\{}; keeping its argument text", name);
            processInlineTokens(readGroupTokens());
        } else {
            log.debug("Unknown command \\{} skipped", name);
        }
    }

    private void skipWithArguments(String name) {
        readOptionalArg();
        readGroup();
        if (TWO_GROUP_COMMANDS.contains(name)) {
            readGroup();
        }
        if ("newcommand".equals(name) || "providecommand".equals(name)) {
            readOptionalArg();
            readGroup();
        }
    }

    private void heading(int level, boolean starred) {
        readOptionalArg();
        List<LatexToken> titleTokens = readGroupTokens();
        String title = TextNormalizer.normalize(textRenderer.render(titleTokens == null ? List.of() : titleTokens));

        boolean unnumbered = starred || profile.isUnnumbered(title);
        String display;
        if (unnumbered) {
            display = title;
        } else {
            display = numberedTitle(level, title);
        }
        if (level == 1 && !starred) {
            equationCount = 0;
        }

        finishParagraph();
        XWPFParagraph paragraph = doc.createParagraph();
        int styleLevel = Math.min(level, DocxStyles.UNLISTED_HEADING_LEVELS);
        paragraph.setStyle(unnumbered
            ? DocxStyles.unlistedHeadingStyleId(styleLevel)
            : DocxStyles.headingStyleId(styleLevel));
        if (level == 1) {
            paragraph.setAlignment(ParagraphAlignment.CENTER);
        }
        headingRun(paragraph, display, level);
        finishParagraph();
        log.debug("Heading level {}: {}", level, display);
    }

    private String numberedTitle(int level, String title) {
        String levelName = auxLevelName(level);
        if (texStructure != null && levelName != null) {
            Optional<TocEntry> entry = texStructure.findHeading(title, levelName);
            if (entry.isPresent()) {
                counters.increment(level);
                return entry.get().getFullTitle();
            }
        }
        if (level == 1 && profile.isReport()) {
            counters.increment(1);
            return profile.formatChapter(counters.getChapter(), title);
        }
        String number = counters.increment(level);
        if (number == null) {
            return title;
        }
        return profile.formatSection(level, title, counters.getChapter(), counters.getSection(),
            counters.getSubsection(), counters.getSubsubsection());
    }

    private String auxLevelName(int level) {
        if (profile.isReport()) {
            return switch (level) {
                case 1 -> "chapter";
                case 2 -> "section";
                case 3 -> "subsection";
                case 4 -> "subsubsection";
                default -> null;
            };
        }
        return switch (level) {
            case 1 -> "section";
            case 2 -> "subsection";
            case 3 -> "subsubsection";
            default -> null;
        };
    }

    private void headingRun(XWPFParagraph paragraph, String text, int level) {
        Optional<HeadingStyleConfig> style = profile.getHeadingStyle(level);
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        run.setFontSize(style.map(HeadingStyleConfig::getFontSizePt).orElse(15.0));
        run.setBold(style.map(HeadingStyleConfig::isBold).orElse(true));
        OoxmlUtil.setFonts(run, profile.getFonts().getHeadingLatin(), profile.getFonts().getHeadingEastAsian());
        OoxmlUtil.forceBlack(run);
    }

    /** A heading that stays out of the table of contents. */
    private void unlistedHeading(String text, int level) {
        finishParagraph();
        XWPFParagraph paragraph = doc.createParagraph();
        paragraph.setStyle(DocxStyles.unlistedHeadingStyleId(level));
        if (level == 1) {
            paragraph.setAlignment(ParagraphAlignment.CENTER);
        }
        headingRun(paragraph, text, level);
        finishParagraph();
    }

    private void pageBreak() {
        XWPFParagraph paragraph = blockParagraph(null);
        paragraph.createRun().addBreak(BreakType.PAGE);
        finishParagraph();
    }

    private void caption() {
        readOptionalArg();
        List<LatexToken> content = readGroupTokens();
        String text = TextNormalizer.normalize(textRenderer.render(content == null ? List.of() : content));

        XWPFParagraph paragraph = blockParagraph(ParagraphAlignment.CENTER);
        paragraph.setStyle(DocxStyles.CAPTION);
        LabelsConfig labels = profile.getLabels();
        boolean inFigure = insideAny(Set.of("figure", "figure*"));
        boolean inTable = insideAny(Set.of("table", "table*"));

        if (inFigure || inTable) {
            String label = inFigure ? labels.getFigurePrefix() : labels.getTablePrefix();
            int count = inFigure ? figureCount : tableCount;
            if (texStructure != null) {
                Optional<FloatEntry> entry = inFigure ? texStructure.findFigure(count) : texStructure.findTable(count);
                String number = entry.map(FloatEntry::getNumber).orElse(String.valueOf(count));
                styledRun(paragraph, label + " " + number, 10.5, true);
            } else {
                styledRun(paragraph, label + " ", 10.5, true);
                CTR field = OoxmlUtil.appendField(paragraph, "SEQ " + label + " \\* ARABIC", String.valueOf(count));
                if (field != null) {
                    CTRPr rPr = field.isSetRPr() ? field.getRPr() : field.addNewRPr();
                    rPr.addNewB();
                    rPr.addNewSz().setVal(BigInteger.valueOf(21));
                }
            }
            styledRun(paragraph, "  " + text, 10.5, false);
        } else {
            styledRun(paragraph, text, 10.5, false);
        }
        finishParagraph();
    }

    private void reference(String command) {
        String key = readGroup().strip();
        Optional<String> resolved = texStructure == null ? Optional.empty()
            : "pageref".equals(command)
                ? texStructure.getLabel(key).map(label -> String.valueOf(label.getPage()))
                : texStructure.resolveRef(key);
        String text = switch (command) {
            case "eqref" -> "(" + resolved.orElse(key) + ")";
            case "ref", "pageref" -> resolved.orElse("[" + key + "]");
            default -> resolved.orElse(key);
        };
        addRun(text);
    }

    private void citation(String command) {
        while (readOptionalArg() != null) {
            // pre- and post-notes are dropped
        }
        String keys = readGroup();
        addRun(textRenderer.formatCitation(command, InlineTextRenderer.splitKeys(keys)));
    }

    private void keywords(String prefix) {
        List<LatexToken> content = readGroupTokens();
        FormatState bold = formatStack.peek().copy();
        bold.setBold(true);
        formatStack.push(bold);
        addRun(prefix);
        popFormat();
        processInlineTokens(content);
    }

    private void footnote() {
        readOptionalArg();
        List<LatexToken> content = readGroupTokens();
        String text = content == null ? "" : TextNormalizer.normalize(textRenderer.render(content)).strip();
        if (text.isEmpty()) {
            return;
        }
        int id = ++footnoteCount;
        footnotes.add(new FootnoteEntry(id, text));
        XWPFRun run = ensureParagraph().createRun();
        run.setStyle(DocxStyles.FOOTNOTE_REFERENCE);
        run.getCTR().addNewFootnoteReference().setId(BigInteger.valueOf(id));
    }

    private void bibItem() {
        readOptionalArg();
        String key = readGroup().strip();
        finishParagraph();
        int last = listCounters.size() - 1;
        int n = 1;
        if (last >= 0) {
            n = listCounters.get(last) + 1;
            listCounters.set(last, n);
        }
        String number = texStructure == null ? String.valueOf(n)
            : texStructure.resolveCitationKeys(List.of(key)).stream().findFirst().orElse(String.valueOf(n));
        suppressIndent = true;
        addRun("[" + number + "] ");
    }

    // ------------------------------------------------------------------
    // images

    private void includeGraphics() {
        String options = readOptionalArg();
        String path = readGroup().strip();
        double widthCm = parseImageWidth(options);

        Optional<Path> resolved = imageResolver.resolve(path);
        if (resolved.isEmpty()) {
            log.warn("Image not found: {}", path);
            addRun("[Image: " + path + "]");
            return;
        }

        XWPFParagraph paragraph = blockParagraph(ParagraphAlignment.CENTER);
        try {
            pictureEmbedder.embed(paragraph, resolved.get(), widthCm);
        } catch (IOException | InvalidFormatException e) {
            log.warn("Cannot embed image {}: {}", resolved.get(), e.getMessage());
            while (!paragraph.getRuns().isEmpty()) {
                paragraph.removeRun(0);
            }
            paragraph.createRun().setText("[Image: " + path + "]");
        }
        finishParagraph();
    }

    double parseImageWidth(String options) {
        if (options == null) {
            return defaultImageWidthCm;
        }
        Matcher m = IMAGE_WIDTH.matcher(options);
        if (!m.find()) {
            return defaultImageWidthCm;
        }
        double value = Double.parseDouble(m.group(1));
        return switch (m.group(2)) {
            case "cm" -> value;
            case "mm" -> value / 10;
            case "in" -> value * 2.54;
            default -> value * TEXT_WIDTH_CM;
        };
    }

    // ------------------------------------------------------------------
    // generated lists

    private void tableOfContents() {
        LabelsConfig labels = profile.getLabels();
        unlistedHeading(labels.getToc(), 1);
        if (texStructure != null && texStructure.hasToc()) {
            for (TocEntry entry : texStructure.getTocEntries()) {
                XWPFParagraph paragraph = blockParagraph(null);
                paragraph.setIndentationLeft(switch (entry.getLevel()) {
                    case "subsection" -> OoxmlUtil.cmToTwips(0.75);
                    case "subsubsection" -> OoxmlUtil.cmToTwips(1.5);
                    default -> 0;
                });
                OoxmlUtil.addDotLeaderTab(paragraph, RIGHT_TAB);
                double size = switch (entry.getLevel()) {
                    case "chapter", "section" -> 12;
                    case "subsection" -> 11;
                    case "subsubsection" -> 10.5;
                    default -> 11;
                };
                styledRun(paragraph, entry.getFullTitle(), size, "chapter".equals(entry.getLevel()));
                tabbedRun(paragraph, String.valueOf(entry.getPage()), size);
            }
        } else {
            XWPFParagraph paragraph = blockParagraph(null);
            hint(OoxmlUtil.appendField(paragraph, TOC_FIELD, labels.getTocUpdateHint()));
        }
        finishParagraph();
    }

    private void floatList(boolean figures) {
        LabelsConfig labels = profile.getLabels();
        String label = figures ? labels.getFigurePrefix() : labels.getTablePrefix();
        unlistedHeading(figures ? labels.getListOfFigures() : labels.getListOfTables(), 1);

        List<FloatEntry> entries = texStructure == null ? List.of()
            : figures ? texStructure.getLofEntries() : texStructure.getLotEntries();
        if (!entries.isEmpty()) {
            for (FloatEntry entry : entries) {
                XWPFParagraph paragraph = blockParagraph(null);
                OoxmlUtil.addDotLeaderTab(paragraph, RIGHT_TAB);
                styledRun(paragraph, label + " " + entry.getNumber(), 12, true);
                styledRun(paragraph, "  " + entry.getCaption(), 12, false);
                tabbedRun(paragraph, String.valueOf(entry.getPage()), 12);
            }
        } else {
            XWPFParagraph paragraph = blockParagraph(null);
            hint(OoxmlUtil.appendField(paragraph, "TOC \\h \\z \\c \"" + label + "\"", labels.getListUpdateHint()));
        }
        finishParagraph();
    }

    private static void hint(CTR placeholder) {
        if (placeholder != null) {
            CTRPr rPr = placeholder.isSetRPr() ? placeholder.getRPr() : placeholder.addNewRPr();
            rPr.addNewColor().setVal(HINT_COLOR);
        }
    }

    // ------------------------------------------------------------------
    // math

    private void handleMath(LatexToken tok) {
        String latex = tok.getContent() == null ? "" : tok.getContent();
        if (tok.is(TokenType.MATH_DISPLAY)) {
            XWPFParagraph paragraph = blockParagraph(ParagraphAlignment.CENTER);
            mathHandler.addMath(paragraph, latex, true);
            finishParagraph();
        } else {
            mathHandler.addMath(ensureParagraph(), latex, false);
        }
    }

    private void mathEnvironment(String name) {
        String raw = InlineTextRenderer.rawText(collectEnvironmentBody(name));
        raw = EQUATION_LABEL.matcher(raw).replaceAll("");
        boolean starred = name.endsWith("*");
        boolean splitRows = name.startsWith("align") || name.startsWith("gather");

        List<String> rows = splitRows ? List.of(ROW_BREAK.split(raw)) : List.of(raw);
        finishParagraph();
        for (String row : rows) {
            boolean numbered = !starred && !NO_NUMBER.matcher(row).find();
            String math = NO_NUMBER.matcher(row).replaceAll("").replace("&", " ").strip();
            if (math.isEmpty()) {
                continue;
            }
            if (numbered) {
                equationCount++;
                XWPFParagraph paragraph = blockParagraph(null);
                OoxmlUtil.addTab(paragraph, STTabJc.CENTER, EQUATION_CENTER_TAB, null);
                OoxmlUtil.addTab(paragraph, STTabJc.RIGHT, RIGHT_TAB, null);
                paragraph.createRun().addTab();
                mathHandler.addMath(paragraph, math, false);
                tabbedRun(paragraph, equationNumber(), 11);
            } else {
                XWPFParagraph paragraph = blockParagraph(ParagraphAlignment.CENTER);
                mathHandler.addMath(paragraph, math, true);
            }
            finishParagraph();
        }
    }

    private String equationNumber() {
        if (profile.isReport() && counters.getChapter() > 0) {
            return "(" + counters.getChapter() + "." + equationCount + ")";
        }
        return "(" + equationCount + ")";
    }

    // ------------------------------------------------------------------
    // environments

    private void handleEnvBegin(String name) {
        envStack.add(name);
        Consumer<String> handler = environmentHandlers.get(name);
        if (handler != null) {
            handler.accept(name);
        } else {
            log.debug("Environment {} rendered as its content", name);
        }
    }

    private void handleEnvEnd(String name) {
        if ("document".equals(name)) {
            finishParagraph();
            popEnvironment(name);
            inDocument = false;
            return;
        }
        if (LIST_ENVIRONMENTS.contains(name) && !listTypes.isEmpty()) {
            listTypes.remove(listTypes.size() - 1);
            listCounters.remove(listCounters.size() - 1);
        } else if ("thebibliography".equals(name) && !listCounters.isEmpty()) {
            listCounters.remove(listCounters.size() - 1);
        } else if (FLOAT_ENVIRONMENTS.contains(name)) {
            afterFloat = true;
        }
        popEnvironment(name);
        finishParagraph();
    }

    private void popEnvironment(String name) {
        if (!envStack.isEmpty() && envStack.get(envStack.size() - 1).equals(name)) {
            envStack.remove(envStack.size() - 1);
        }
    }

    private boolean insideAny(Set<String> names) {
        return envStack.stream().anyMatch(names::contains);
    }

    private void beginFloat(String name) {
        readOptionalArg();
        finishParagraph();
        if (name.startsWith("figure")) {
            figureCount++;
        } else {
            tableCount++;
        }
    }

    private void tabular(String name) {
        if ("tabular*".equals(name) || "tabularx".equals(name)) {
            readGroup();
        } else if ("longtable".equals(name)) {
            readOptionalArg();
        }
        readOptionalArg();
        String spec = readGroup();
        List<LatexToken> body = collectEnvironmentBody(name);
        finishParagraph();
        tableBuilder.build(doc, spec, body);
        finishParagraph();
    }

    private void verbatim(String name) {
        StringBuilder content = new StringBuilder();
        for (LatexToken tok : collectEnvironmentBody(name)) {
            if (tok.is(TokenType.TEXT)) {
                content.append(tok.getValue());
            }
        }
        finishParagraph();
        String text = content.toString().strip();
        if (text.isEmpty()) {
            return;
        }
        for (String line : text.split("\\R")) {
            XWPFParagraph paragraph = blockParagraph(null);
            XWPFRun run = paragraph.createRun();
            run.setText(line);
            OoxmlUtil.setFonts(run, profile.getFonts().getMonospace(), profile.getFonts().getMonospace());
            run.setFontSize(10);
        }
        finishParagraph();
    }

    private void handleItem(String label) {
        finishParagraph();
        String prefix;
        if (listTypes.isEmpty()) {
            prefix = label != null ? label : "● ";
        } else {
            int last = listTypes.size() - 1;
            if ("enumerate".equals(listTypes.get(last))) {
                int n = listCounters.get(last) + 1;
                listCounters.set(last, n);
                prefix = label != null ? label : n + ". ";
            } else if ("description".equals(listTypes.get(last))) {
                prefix = label != null ? label : "";
            } else {
                prefix = label != null ? label : "● ";
            }
        }
        ensureParagraph();
        if (!prefix.isEmpty()) {
            addRun(prefix.endsWith(" ") ? prefix : prefix + " ");
        }
        skipBlank();
    }
}
