package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BodySectionBreakConfig {
    @Builder.Default
    private String beforeHeadingText = "";
    @Builder.Default
    private String beforeHeadingPattern = "";
    @Builder.Default
    private String breakType = "oddPage";
    private boolean firstOnly;
}
