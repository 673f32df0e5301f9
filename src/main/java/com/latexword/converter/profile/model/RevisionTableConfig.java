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
public class RevisionTableConfig {
    @Builder.Default
    private String marker = "文档修改记录";
    @Builder.Default
    private String sectionTitle = "文档修改记录";
    @Builder.Default
    private List<String> columnHeaders = new ArrayList<>(List.of("版本", "日期", "修改摘要", "修改章节", "备注"));
}
