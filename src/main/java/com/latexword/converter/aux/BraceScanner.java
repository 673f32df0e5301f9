package com.latexword.converter.aux;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Balanced brace extraction over raw aux text.
 */
final class BraceScanner {

    private BraceScanner() {
        // Utility class
    }

    @Value
    static class Group {
        String content;
        /** Index just past the closing brace. */
        int end;
    }

    /**
     * The balanced group opening at {@code start}. An unclosed group runs to
     * the end of the text.
     */
    static Group groupAt(String text, int start) {
        if (start >= text.length() || text.charAt(start) != '{') {
            return new Group("", start);
        }
        int depth = 1;
        int i = start + 1;
        while (i < text.length() && depth > 0) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            i++;
        }
        int contentEnd = depth == 0 ? i - 1 : i;
        return new Group(text.substring(start + 1, contentEnd), i);
    }

    /** All top-level groups from {@code start} onwards. */
    static List<String> allGroups(String text, int start) {
        List<String> groups = new ArrayList<>();
        int i = start;
        while (i < text.length()) {
            if (text.charAt(i) == '{') {
                Group group = groupAt(text, i);
                groups.add(group.getContent());
                i = group.getEnd();
            } else {
                i++;
            }
        }
        return groups;
    }
}
