package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One element of a front-matter section.
 *
 * <p>{@code type} is one of {@code text}, {@code spacer}, {@code logo},
 * {@code info_table}, {@code boilerplate} or {@code signature_block}.
 * {@code condition} names a metadata field that must be non-empty.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrontmatterElementConfig {
    @Builder.Default
    private String type = "text";
    @Builder.Default
    private String content = "";
    @Builder.Default
    private String field = "";
    @Builder.Default
    private String source = "";
    @Builder.Default
    private String font = "STSong";
    @Builder.Default
    private double sizePt = 12;
    private boolean bold;
    @Builder.Default
    private String align = "left";
    @Builder.Default
    private int lines = 1;
    @Builder.Default
    private List<List<String>> rows = new ArrayList<>();
    private Double spaceBeforePt;
    @Builder.Default
    private String condition = "";
}
