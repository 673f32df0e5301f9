package com.latexword.converter.profile;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.latexword.converter.export.ConversionException;
import com.latexword.converter.fonts.FontRegistry;
import com.latexword.converter.profile.model.HeadingStyleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Builds the {@link DocxProfile} for a template id.
 *
 * Absent templates, absent {@code docx_profile} objects and absent fields all
 * fall back to the built-in defaults field by field.
 */
public class ProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    private final TemplateRegistry registry;
    private final FontRegistry fontRegistry;
    private final ObjectMapper mapper;

    public ProfileLoader(TemplateRegistry registry) {
        this(registry, null);
    }

    /**
     * @param fontRegistry platform font table applied to every loaded
     *                     profile, or null to keep the names as written
     */
    public ProfileLoader(TemplateRegistry registry, FontRegistry fontRegistry) {
        this.registry = registry;
        this.fontRegistry = fontRegistry;
        this.mapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // An explicit null keeps the default value
        mapper.setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP));
        return mapper;
    }

    public DocxProfile load(String templateId) {
        Optional<TemplateInfo> template = registry.find(templateId);
        if (template.isEmpty()) {
            if (templateId != null && !templateId.isBlank()) {
                log.warn("Template '{}' not found, using default profile", templateId);
            }
            return localize(DocxProfile.defaults());
        }

        TemplateInfo info = template.get();
        DocxProfile profile = info.getDocxProfile() != null ? info.getDocxProfile() : DocxProfile.defaults();
        profile.setDocClassType(mapDocClassType(info.getDocClassType()));
        profile.setTemplateDir(info.getDirectory());
        resolveHeadingLevels(profile);

        log.debug("Loaded profile for template '{}' ({})", info.getId(), profile.getDocClassType());
        return localize(profile);
    }

    private DocxProfile localize(DocxProfile profile) {
        if (fontRegistry != null) {
            fontRegistry.localize(profile.getFonts());
            profile.getPageHeaders().setHeaderFont(fontRegistry.resolve(profile.getPageHeaders().getHeaderFont()));
        }
        return profile;
    }

    /**
     * Parses the JSON value of a {@code docx_profile} object.
     */
    public DocxProfile fromJson(String json) {
        try {
            DocxProfile profile = mapper.readValue(json, DocxProfile.class);
            resolveHeadingLevels(profile);
            return profile;
        } catch (IOException e) {
            throw new ConversionException("Invalid docx_profile: " + e.getMessage(), e);
        }
    }

    static String mapDocClassType(String docClassType) {
        if ("article".equals(docClassType)) {
            return DocxProfile.ARTICLE;
        }
        return DocxProfile.REPORT;
    }

    /** Heading entries without an explicit level take their list position. */
    private static void resolveHeadingLevels(DocxProfile profile) {
        List<HeadingStyleConfig> headings = profile.getStyles().getHeadings();
        for (int i = 0; i < headings.size(); i++) {
            if (headings.get(i).getLevel() == null) {
                headings.get(i).setLevel(i + 1);
            }
        }
    }
}
