package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header and page-number rules applied per document section.
 *
 * <p>{@code contentHeaders} maps a keyword or regex found in a section to the
 * header text shown for it. {@code evenPageContent} may contain
 * {@code {title}}, replaced with the document title.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageHeadersConfig {
    @Builder.Default
    private boolean enableStyleref = true;
    @Builder.Default
    private String headerFont = "STSong";
    @Builder.Default
    private double headerFontSizePt = 10.5;
    @Builder.Default
    private double headerRulePt = 0.8;
    @Builder.Default
    private String chapterPattern = "第\\s*\\d+\\s*章";
    @Builder.Default
    private Map<String, String> contentHeaders = new LinkedHashMap<>(Map.of(
        "摘要", "摘  要",
        "Abstract", "Abstract",
        "目.*录", "目  录"
    ));
    @Builder.Default
    private List<String> noHeaderMarkers = new ArrayList<>(List.of(
        "学位论文", "thesis submitted", "原创性声明", "授权使用声明"
    ));
    @Builder.Default
    private boolean oddEven = true;
    @Builder.Default
    private String evenPageContent = "{title}";
    @Builder.Default
    private String frontmatterPageFormat = "upperRoman";
    @Builder.Default
    private String bodyPageFormat = "decimal";
}
