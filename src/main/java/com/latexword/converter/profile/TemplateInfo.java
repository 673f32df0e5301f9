package com.latexword.converter.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of a template's {@code meta.json}.
 */
@Data
public class TemplateInfo {
    private String id = "";
    private String name = "";
    private String description = "";
    private String docClassType = "";
    private DocxProfile docxProfile;
    private List<String> supportDirs = new ArrayList<>();

    /** Directory holding the meta.json; null for bundled templates. */
    @JsonIgnore
    private Path directory;
    @JsonIgnore
    private boolean builtin;
}
