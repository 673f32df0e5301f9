package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeadingStyleConfig {
    /** Null until resolved; the loader assigns the list position. */
    private Integer level;
    @Builder.Default
    private double fontSizePt = 12;
    @Builder.Default
    private boolean bold = true;
}
