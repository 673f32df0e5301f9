package com.latexword.converter.metadata;

import lombok.Value;

/**
 * One row of a document revision-history table.
 */
@Value
public class RevisionRecord {
    String version;
    String date;
    String changeSummary;
    String modifiedSections;
    String remarks;
}
