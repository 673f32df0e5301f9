package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FontsConfig {
    @Builder.Default
    private String bodyLatin = "Times New Roman";
    @Builder.Default
    private String bodyEastAsian = "STSong";
    @Builder.Default
    private String headingLatin = "Times New Roman";
    @Builder.Default
    private String headingEastAsian = "Heiti SC";
    @Builder.Default
    private String captionEastAsian = "Heiti SC";
    @Builder.Default
    private String monospace = "Courier New";
    /** Inline font switch commands, e.g. {@code \heiti}, mapped to real font names. */
    @Builder.Default
    private Map<String, String> cjkFontCommands = new LinkedHashMap<>(Map.of(
        "heiti", "Heiti SC",
        "songti", "STSong",
        "kaiti", "Kaiti SC",
        "fangsong", "STFangsong"
    ));
}
