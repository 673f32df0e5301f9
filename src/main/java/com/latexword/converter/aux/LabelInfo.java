package com.latexword.converter.aux;

import lombok.Value;

@Value
public class LabelInfo {
    String key;
    String display;
    int page;
}
