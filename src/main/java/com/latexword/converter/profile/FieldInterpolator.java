package com.latexword.converter.profile;

import com.latexword.converter.export.ConversionException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {name}} placeholders in profile strings, e.g.
 * {@code "第 {n} 章  {title}"}. Unknown placeholders render as empty text.
 */
public class FieldInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private final Configuration freemarkerConfig;
    private final Map<String, Template> templateCache = new ConcurrentHashMap<>();

    public FieldInterpolator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setInterpolationSyntax(Configuration.DOLLAR_INTERPOLATION_SYNTAX);
        cfg.setTagSyntax(Configuration.SQUARE_BRACKET_TAG_SYNTAX);
        return cfg;
    }

    /**
     * Substitutes every {@code {name}} in {@code format} with the string
     * form of {@code values.get(name)}.
     */
    public String interpolate(String format, Map<String, ?> values) {
        if (format == null || format.isEmpty()) {
            return "";
        }
        if (!PLACEHOLDER.matcher(format).find()) {
            return format;
        }

        Map<String, Object> model = new HashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                model.put(key, String.valueOf(value));
            }
        });

        try {
            Template template = templateCache.computeIfAbsent(format, this::compile);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            return writer.toString();
        } catch (TemplateException | IOException e) {
            throw new ConversionException("Failed to format '" + format + "': " + e.getMessage(), e);
        }
    }

    /** Convenience overload for alternating key/value pairs. */
    public String interpolate(String format, Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            values.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return interpolate(format, values);
    }

    private Template compile(String format) {
        String source = toFreemarkerSource(format);
        try {
            return new Template("format", new StringReader(source), freemarkerConfig);
        } catch (IOException e) {
            throw new ConversionException("Invalid format string '" + format + "'", e);
        }
    }

    /**
     * Turns each {@code {name}} into a null-safe interpolation and escapes
     * FreeMarker syntax in the text between them.
     */
    static String toFreemarkerSource(String format) {
        StringBuilder out = new StringBuilder();
        Matcher m = PLACEHOLDER.matcher(format);
        int last = 0;
        while (m.find()) {
            appendLiteral(out, format.substring(last, m.start()));
            out.append("${").append(m.group(1)).append("!}");
            last = m.end();
        }
        appendLiteral(out, format.substring(last));
        return out.toString();
    }

    private static void appendLiteral(StringBuilder out, String literal) {
        for (char c : literal.toCharArray()) {
            switch (c) {
                case '$' -> out.append("${'$'}");
                case '[' -> out.append("${'['}");
                default -> out.append(c);
            }
        }
    }
}
