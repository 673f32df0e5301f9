package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Heading number formats. Placeholders are written as {@code {name}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NumberingConfig {
    @Builder.Default
    private String chapterFormat = "第 {n} 章  {title}";
    @Builder.Default
    private String sectionFormat = "{chapter}.{section}  {title}";
    @Builder.Default
    private String subsectionFormat = "{chapter}.{section}.{subsection}  {title}";
    @Builder.Default
    private String subsubsectionFormat = "{chapter}.{section}.{subsection}.{subsubsection}  {title}";
    @Builder.Default
    private List<String> unnumberedHeadings = new ArrayList<>(List.of(
        "摘要", "abstract", "Abstract", "ABSTRACT", "致谢",
        "参考文献", "附录", "目录", "目  录", "References"
    ));
}
