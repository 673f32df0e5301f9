package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Copies the argument of a preamble command such as {@code \ADVISOR{..}}
 * into a metadata attribute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetadataFieldRuleConfig {
    @Builder.Default
    private String attr = "";
    @Builder.Default
    private String command = "";
    @Builder.Default
    private String stripPrefixRegex = "";
}
