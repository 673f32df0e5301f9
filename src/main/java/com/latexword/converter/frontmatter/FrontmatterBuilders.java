package com.latexword.converter.frontmatter;

import com.latexword.converter.profile.DocxProfile;

/**
 * Picks the front-matter builder for a profile.
 */
public final class FrontmatterBuilders {

    private FrontmatterBuilders() {
        // Utility class
    }

    /**
     * Profiles that declare front-matter sections get the declarative
     * builder; all others get a plain title page.
     */
    public static FrontmatterBuilder forProfile(DocxProfile profile) {
        if (!profile.getFrontmatter().getSections().isEmpty()) {
            return new DeclarativeFrontmatterBuilder(profile);
        }
        return new GenericFrontmatterBuilder(profile);
    }
}
