package com.latexword.converter.convert;

import lombok.Value;

/**
 * Footnote text collected during conversion. The id matches the
 * {@code w:footnoteReference} emitted in the body.
 */
@Value
public class FootnoteEntry {
    int id;
    String text;
}
