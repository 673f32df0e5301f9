package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrontmatterConfig {
    @Builder.Default
    private List<FrontmatterSectionConfig> sections = new ArrayList<>();
    @Builder.Default
    private List<BodySectionBreakConfig> bodySectionBreaks = new ArrayList<>();
    /** Null disables automatic TOC insertion. */
    private AutoTocConfig autoToc;
}
