package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalStyleConfig {
    @Builder.Default
    private double fontSizePt = 12;
    /** Two CJK characters at 12pt. */
    @Builder.Default
    private double firstLineIndentPt = 24;
}
