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
 * Recognition rules for a hand-built cover block in the document body.
 * All patterns are Java regular expressions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverConfig {
    private boolean enabled;
    @Builder.Default
    private String blockStart = "\\\\begingroup";
    @Builder.Default
    private String blockEnd = "\\\\endgroup";
    @Builder.Default
    private List<String> detectionMarkers = new ArrayList<>();
    /** Metadata attribute to a regex whose first group holds the value. */
    @Builder.Default
    private Map<String, String> fieldPatterns = new LinkedHashMap<>();
    @Builder.Default
    private List<ApprovalFieldConfig> approvalFields = new ArrayList<>();
    @Builder.Default
    private String institutePattern = "\\\\fontsize\\{16[^}]*\\}\\{[^}]*\\}\\\\selectfont\\s*(.*?)\\\\par";
    @Builder.Default
    private String datePattern = "\\\\fontsize\\{[^}]*\\}\\{[^}]*\\}\\\\selectfont\\s*(.*?)\\\\par";
}
