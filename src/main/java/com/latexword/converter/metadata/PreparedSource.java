package com.latexword.converter.metadata;

import lombok.Value;

/**
 * LaTeX source ready for conversion together with the metadata that was
 * lifted out of it.
 */
@Value
public class PreparedSource {
    String latex;
    ExportMetadata metadata;
}
