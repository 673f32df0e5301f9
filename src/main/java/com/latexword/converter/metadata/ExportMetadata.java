package com.latexword.converter.metadata;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document metadata read from the LaTeX source before conversion: cover
 * fields, approval rows, revision history, page geometry and numbering.
 *
 * <p>Text fields are kept by name ({@code title}, {@code author},
 * {@code advisor_en}, ...) because profiles refer to them by name in
 * front-matter recipes and extraction rules.</p>
 */
@Data
public class ExportMetadata {

    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String INSTITUTE = "institute";
    public static final String DATE = "date";
    public static final String REPORT_DATE = "report_date";

    private final Map<String, String> fields = new LinkedHashMap<>();
    private String schoolLogo = "";
    private double schoolLogoScale;
    private List<RevisionRecord> revisionRecords = new ArrayList<>();
    /** Geometry key ({@code top}, {@code left}, ...) to a LaTeX length such as {@code 2.5cm}. */
    private Map<String, String> geometry = new LinkedHashMap<>();
    private boolean coverDetected;
    private String templateId = "";
    /** Null when the source does not say; the profile default applies. */
    private String frontmatterPageFormat;
    private String bodyPageFormat;
    private boolean twoside;

    public String get(String name) {
        return switch (name) {
            case "school_logo" -> schoolLogo;
            case "template_id" -> templateId;
            default -> fields.getOrDefault(name, "");
        };
    }

    public void set(String name, String value) {
        fields.put(name, value == null ? "" : value);
    }

    /**
     * Whether the named field holds a value. Besides text fields this knows
     * {@code has_cover}, {@code twoside}, {@code school_logo} and
     * {@code revision_records}.
     */
    public boolean isPresent(String name) {
        return switch (name) {
            case "has_cover" -> coverDetected;
            case "twoside" -> twoside;
            case "revision_records" -> !revisionRecords.isEmpty();
            default -> !get(name).isBlank();
        };
    }

    /** Text fields plus the logo and template id, for placeholder substitution. */
    public Map<String, String> asMap() {
        Map<String, String> values = new LinkedHashMap<>(fields);
        values.put("school_logo", schoolLogo);
        values.put("template_id", templateId);
        return values;
    }

    public String getTitle() {
        return get(TITLE);
    }

    public String getAuthor() {
        return get(AUTHOR);
    }

    public String getInstitute() {
        return get(INSTITUTE);
    }

    /** The thesis date, or the report date when no thesis date was found. */
    public String getDisplayDate() {
        String date = get(DATE);
        return date.isBlank() ? get(REPORT_DATE) : date;
    }
}
