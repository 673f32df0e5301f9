package com.latexword.converter.aux;

import com.latexword.converter.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses TeX {@code .aux} and bibliography {@code .bbl} files into a
 * {@link TexStructure}.
 */
public class AuxFileParser {
    private static final Logger log = LoggerFactory.getLogger(AuxFileParser.class);

    private static final Set<String> TOC_LEVELS = Set.of("chapter", "section", "subsection", "subsubsection");

    private static final Pattern WRITEFILE = Pattern.compile("^\\\\@writefile\\{(toc|lof|lot)\\}");
    private static final Pattern CONTENTSLINE = Pattern.compile("^\\\\contentsline\\s*\\{(\\w+)\\}");
    private static final Pattern NUMBERLINE = Pattern.compile("^\\\\numberline\\s*");
    private static final Pattern NEWLABEL = Pattern.compile("^\\\\newlabel\\{([^}]+)\\}");
    private static final Pattern BIBCITE = Pattern.compile("^\\\\bibcite\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern ABX_CITE = Pattern.compile("\\\\abx@aux@cite(?:\\{[^}]*\\})?\\{([^}]+)\\}");
    private static final Pattern CITATION = Pattern.compile("\\\\citation\\{([^}]+)\\}");
    private static final Pattern BBL_ENTRY = Pattern.compile("\\\\entry\\{([^}]+)\\}");
    private static final Pattern BBL_BIBITEM = Pattern.compile("\\\\bibitem\\s*(?:\\[[^\\]]*\\])?\\s*\\{([^}]+)\\}");

    /**
     * Reads and parses the aux file and the optional bbl file.
     * Returns empty when the aux file cannot be read.
     */
    public Optional<TexStructure> parse(Path auxPath, Path bblPath) {
        String auxContent;
        try {
            auxContent = Files.readString(auxPath, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read aux file {}: {}", auxPath, e.getMessage());
            return Optional.empty();
        }

        String bblContent = null;
        if (bblPath != null && Files.isRegularFile(bblPath)) {
            try {
                bblContent = Files.readString(bblPath, StandardCharsets.UTF_8);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to read bbl file {}: {}", bblPath, e.getMessage());
            }
        }
        return Optional.of(parse(auxContent, bblContent));
    }

    /**
     * Parses aux content and optional bbl content already in memory.
     */
    public TexStructure parse(String auxContent, String bblContent) {
        TexStructure structure = new TexStructure();
        Set<String> auxCitationOrder = new LinkedHashSet<>();

        for (String rawLine : auxContent.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            Matcher writefile = WRITEFILE.matcher(line);
            if (writefile.find()) {
                parseWritefile(structure, writefile.group(1), line.substring(writefile.end()));
                continue;
            }

            if (line.startsWith("\\newlabel{")) {
                parseLabel(line).ifPresent(info -> structure.getLabels().put(info.getKey(), info));
                continue;
            }

            Matcher bibcite = BIBCITE.matcher(line);
            if (bibcite.find()) {
                structure.assignCitation(bibcite.group(1), bibcite.group(2));
                continue;
            }

            collectAuxCitations(line, auxCitationOrder);
        }

        List<String> bblOrder = bblContent == null ? List.of() : parseBblOrder(bblContent);
        List<String> order = bblOrder.isEmpty() ? new ArrayList<>(auxCitationOrder) : bblOrder;
        for (int i = 0; i < order.size(); i++) {
            structure.assignCitation(order.get(i), String.valueOf(i + 1));
        }

        log.info("Parsed .aux: {} toc, {} figures, {} tables, {} labels, {} citations",
            structure.getTocEntries().size(),
            structure.getLofEntries().size(),
            structure.getLotEntries().size(),
            structure.getLabels().size(),
            structure.getCitationNumbers().size());
        return structure;
    }

    /**
     * Citation keys in the order the bibliography lists them.
     */
    List<String> parseBblOrder(String bblContent) {
        Set<String> keys = new LinkedHashSet<>();
        Matcher entry = BBL_ENTRY.matcher(bblContent);
        while (entry.find()) {
            keys.add(entry.group(1).strip());
        }
        if (keys.isEmpty()) {
            Matcher bibitem = BBL_BIBITEM.matcher(bblContent);
            while (bibitem.find()) {
                keys.add(bibitem.group(1).strip());
            }
        }
        return new ArrayList<>(keys);
    }

    private void collectAuxCitations(String line, Set<String> order) {
        Matcher abx = ABX_CITE.matcher(line);
        while (abx.find()) {
            order.add(abx.group(1).strip());
        }
        Matcher citation = CITATION.matcher(line);
        while (citation.find()) {
            for (String key : citation.group(1).split(",")) {
                if (!key.isBlank() && !key.strip().equals("*")) {
                    order.add(key.strip());
                }
            }
        }
    }

    private void parseWritefile(TexStructure structure, String target, String rest) {
        int open = rest.indexOf('{');
        if (open < 0) {
            return;
        }
        String content = BraceScanner.groupAt(rest, open).getContent();
        Matcher contentsline = CONTENTSLINE.matcher(content);
        if (content.isEmpty() || !contentsline.find()) {
            return;
        }
        String kind = contentsline.group(1);
        List<String> groups = BraceScanner.allGroups(content, contentsline.end());
        if (groups.size() < 2) {
            return;
        }
        String[] numberAndTitle = parseNumberline(groups.get(0));
        int page = parsePage(groups.get(1));

        switch (target) {
            case "toc" -> {
                if (TOC_LEVELS.contains(kind)) {
                    structure.getTocEntries().add(new TocEntry(kind, numberAndTitle[0], numberAndTitle[1], page));
                }
            }
            case "lof" -> {
                if (kind.equals("figure")) {
                    structure.getLofEntries().add(new FloatEntry(kind, numberAndTitle[0], numberAndTitle[1], page));
                }
            }
            case "lot" -> {
                if (kind.equals("table")) {
                    structure.getLotEntries().add(new FloatEntry(kind, numberAndTitle[0], numberAndTitle[1], page));
                }
            }
            default -> log.debug("Ignoring writefile target {}", target);
        }
    }

    private Optional<LabelInfo> parseLabel(String line) {
        Matcher m = NEWLABEL.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        String key = m.group(1);
        String rest = line.substring(m.end());
        int open = rest.indexOf('{');
        if (open < 0) {
            return Optional.empty();
        }
        String outer = BraceScanner.groupAt(rest, open).getContent();
        List<String> inner = BraceScanner.allGroups(outer, 0);
        if (inner.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new LabelInfo(key, TextNormalizer.cleanLatexText(inner.get(0)), parsePage(inner.get(1))));
    }

    /** Splits {@code \numberline{N}Title} into number and title. */
    private String[] parseNumberline(String text) {
        Matcher m = NUMBERLINE.matcher(text);
        if (!m.find()) {
            return new String[] {"", TextNormalizer.cleanLatexText(text)};
        }
        int pos = m.end();
        while (pos < text.length() && text.charAt(pos) == ' ') {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '{') {
            BraceScanner.Group number = BraceScanner.groupAt(text, pos);
            return new String[] {
                TextNormalizer.cleanLatexText(number.getContent()),
                TextNormalizer.cleanLatexText(text.substring(number.getEnd()))
            };
        }
        return new String[] {"", TextNormalizer.cleanLatexText(text.substring(pos))};
    }

    private int parsePage(String text) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            // Roman front-matter pages and the like
            return 0;
        }
    }
}
