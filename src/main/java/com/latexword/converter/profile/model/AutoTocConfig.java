package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoTocConfig {
    @Builder.Default
    private boolean insertBeforeFirstChapter = true;
    @Builder.Default
    private String headingText = "目  录";
    @Builder.Default
    private String headingFont = "Heiti SC";
}
