package com.latexword.converter.aux;

import lombok.Value;

/**
 * A list-of-figures or list-of-tables line recorded by TeX.
 */
@Value
public class FloatEntry {
    String kind;
    String number;
    String caption;
    int page;
}
