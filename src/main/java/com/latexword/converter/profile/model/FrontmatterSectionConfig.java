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
public class FrontmatterSectionConfig {
    @Builder.Default
    private String id = "";
    @Builder.Default
    private List<FrontmatterElementConfig> elements = new ArrayList<>();
    /** oddPage, evenPage, nextPage, or empty for no break. */
    @Builder.Default
    private String breakAfter = "";
    @Builder.Default
    private String condition = "";
}
