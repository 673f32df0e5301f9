package com.latexword.converter.aux;

import com.latexword.converter.text.TextNormalizer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-reference data computed by a TeX compilation: numbered headings,
 * float lists, labels and citation numbers.
 *
 * Heading lookups are sequential. Each successful {@link #findHeading}
 * advances an internal cursor past the matched entry, so a later call
 * never returns the same or an earlier entry.
 */
@Getter
public class TexStructure {
    private final List<TocEntry> tocEntries = new ArrayList<>();
    private final List<FloatEntry> lofEntries = new ArrayList<>();
    private final List<FloatEntry> lotEntries = new ArrayList<>();
    private final Map<String, LabelInfo> labels = new LinkedHashMap<>();
    private final Map<String, String> citationNumbers = new LinkedHashMap<>();

    @Getter(lombok.AccessLevel.NONE)
    private int tocCursor = 0;

    /**
     * Finds the next TOC entry of the given level whose title matches.
     * Titles match when their normalized forms are equal or one contains
     * the other.
     */
    public Optional<TocEntry> findHeading(String title, String level) {
        String wanted = TextNormalizer.normalizeForMatch(title);
        for (int i = tocCursor; i < tocEntries.size(); i++) {
            TocEntry entry = tocEntries.get(i);
            if (!entry.getLevel().equals(level)) {
                continue;
            }
            if (titlesMatch(wanted, TextNormalizer.normalizeForMatch(entry.getTitle()))) {
                tocCursor = i + 1;
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /** The index-th figure entry, 1-based. */
    public Optional<FloatEntry> findFigure(int index) {
        return positional(lofEntries, index);
    }

    /** The index-th table entry, 1-based. */
    public Optional<FloatEntry> findTable(int index) {
        return positional(lotEntries, index);
    }

    /**
     * Resolves a label or citation key to its display string.
     */
    public Optional<String> resolveRef(String key) {
        LabelInfo label = labels.get(key);
        if (label != null) {
            return Optional.of(label.getDisplay());
        }
        return Optional.ofNullable(citationNumbers.get(key));
    }

    public Optional<LabelInfo> getLabel(String key) {
        return Optional.ofNullable(labels.get(key));
    }

    /**
     * Maps citation keys to their numbers, falling back to label displays.
     * Unknown keys are returned as-is.
     */
    public List<String> resolveCitationKeys(List<String> keys) {
        List<String> resolved = new ArrayList<>(keys.size());
        for (String key : keys) {
            String number = citationNumbers.get(key);
            resolved.add(number != null ? number : resolveRef(key).orElse(key));
        }
        return resolved;
    }

    /** Whether any heading entries are available. */
    public boolean hasToc() {
        return !tocEntries.isEmpty();
    }

    /**
     * Registers a citation number unless the key already has one.
     */
    void assignCitation(String key, String number) {
        citationNumbers.putIfAbsent(key, number);
    }

    private static boolean titlesMatch(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.equals(b) || a.contains(b) || b.contains(a);
    }

    private static Optional<FloatEntry> positional(List<FloatEntry> entries, int index) {
        if (index >= 1 && index <= entries.size()) {
            return Optional.of(entries.get(index - 1));
        }
        return Optional.empty();
    }
}
