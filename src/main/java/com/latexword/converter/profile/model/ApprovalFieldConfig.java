package com.latexword.converter.profile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalFieldConfig {
    @Builder.Default
    private String label = "";
    @Builder.Default
    private String nameAttr = "";
    @Builder.Default
    private String dateAttr = "";
}
