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
 * Rules for reading document metadata out of the LaTeX source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreprocessorConfig {
    @Builder.Default
    private List<MetadataFieldRuleConfig> preambleMetadataFields = new ArrayList<>();
    @Builder.Default
    private Map<String, String> normalizeDocumentclassMap = new LinkedHashMap<>();
    private boolean titleImpliesCover;
    @Builder.Default
    private List<String> removePreambleCommandsWithArg = new ArrayList<>();
    @Builder.Default
    private List<String> stripBodyCommands = new ArrayList<>();
    @Builder.Default
    private CoverConfig cover = new CoverConfig();
    @Builder.Default
    private RevisionTableConfig revisionTable = new RevisionTableConfig();
}
