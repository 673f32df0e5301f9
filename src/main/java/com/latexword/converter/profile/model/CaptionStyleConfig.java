package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptionStyleConfig {
    @Builder.Default
    private double fontSizePt = 10.5;
}
