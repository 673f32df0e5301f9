package com.latexword.converter.profile.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed strings used for generated headings, captions and hints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelsConfig {
    @Builder.Default
    @JsonProperty("abstract")
    private String abstractLabel = "摘要";
    @Builder.Default
    private String toc = "目  录";
    @Builder.Default
    private String figurePrefix = "图";
    @Builder.Default
    private String tablePrefix = "表";
    @Builder.Default
    private String references = "参考文献";
    @Builder.Default
    private String tocUpdateHint = "请右键点击此处，选择“更新域”以生成目录";
    @Builder.Default
    private String listOfFigures = "图形列表";
    @Builder.Default
    private String listOfTables = "表格列表";
    @Builder.Default
    private String listUpdateHint = "请更新域以生成列表";
    @Builder.Default
    private String keywordsZhPrefix = "关键词：";
    @Builder.Default
    private String keywordsEnPrefix = "Keywords: ";
}
