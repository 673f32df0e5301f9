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
public class StylesConfig {
    @Builder.Default
    private NormalStyleConfig normal = new NormalStyleConfig();
    @Builder.Default
    private List<HeadingStyleConfig> headings = defaultHeadings();
    @Builder.Default
    private CaptionStyleConfig caption = new CaptionStyleConfig();

    public static List<HeadingStyleConfig> defaultHeadings() {
        return new ArrayList<>(List.of(
            new HeadingStyleConfig(1, 15, true),
            new HeadingStyleConfig(2, 15, true),
            new HeadingStyleConfig(3, 14, true),
            new HeadingStyleConfig(4, 12, true),
            new HeadingStyleConfig(5, 12, true),
            new HeadingStyleConfig(6, 12, false)
        ));
    }
}
