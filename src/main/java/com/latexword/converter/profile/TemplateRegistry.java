package com.latexword.converter.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Discovers templates from a directory of {@code <id>/meta.json} files,
 * falling back to the templates bundled on the classpath.
 */
public class TemplateRegistry {
    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    static final String META_FILE = "meta.json";
    private static final List<String> BUNDLED_TEMPLATES = List.of("default");

    private final Path templatesDir;
    private final ObjectMapper mapper;

    public TemplateRegistry(Path templatesDir) {
        this(templatesDir, ProfileLoader.createObjectMapper());
    }

    TemplateRegistry(Path templatesDir, ObjectMapper mapper) {
        this.templatesDir = templatesDir;
        this.mapper = mapper;
    }

    /**
     * All templates, directory templates first, sorted by directory name.
     * Unreadable meta files are logged and skipped.
     */
    public List<TemplateInfo> discover() {
        List<TemplateInfo> templates = new ArrayList<>(scanDirectory());
        for (String bundled : BUNDLED_TEMPLATES) {
            boolean shadowed = templates.stream().anyMatch(t -> bundled.equals(t.getId()));
            if (!shadowed) {
                loadBundled(bundled).ifPresent(templates::add);
            }
        }
        return templates;
    }

    public Optional<TemplateInfo> find(String templateId) {
        if (templateId == null || templateId.isBlank()) {
            return Optional.empty();
        }
        return discover().stream()
            .filter(t -> templateId.equals(t.getId()))
            .findFirst();
    }

    /**
     * Existing support directories (Style/, Img/ ...) declared by a template.
     */
    public List<Path> getSupportDirs(String templateId) {
        List<Path> result = new ArrayList<>();
        find(templateId).ifPresent(t -> {
            if (t.getDirectory() == null) {
                return;
            }
            for (String name : t.getSupportDirs()) {
                Path dir = t.getDirectory().resolve(name);
                if (Files.isDirectory(dir)) {
                    result.add(dir);
                }
            }
        });
        return result;
    }

    private List<TemplateInfo> scanDirectory() {
        List<TemplateInfo> templates = new ArrayList<>();
        if (templatesDir == null || !Files.isDirectory(templatesDir)) {
            return templates;
        }

        try (Stream<Path> dirs = Files.list(templatesDir)) {
            List<Path> sorted = dirs.filter(Files::isDirectory).sorted().toList();
            for (Path dir : sorted) {
                Path meta = dir.resolve(META_FILE);
                if (!Files.isRegularFile(meta)) {
                    continue;
                }
                try {
                    TemplateInfo info = mapper.readValue(meta.toFile(), TemplateInfo.class);
                    info.setDirectory(dir);
                    if (info.getId() == null || info.getId().isBlank()) {
                        info.setId(dir.getFileName().toString());
                    }
                    templates.add(info);
                } catch (IOException e) {
                    log.warn("Skipping template {}: {}", dir.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan templates directory {}: {}", templatesDir, e.getMessage());
        }
        return templates;
    }

    private Optional<TemplateInfo> loadBundled(String id) {
        String resource = "/templates/" + id + "/" + META_FILE;
        try (InputStream in = TemplateRegistry.class.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            TemplateInfo info = mapper.readValue(in, TemplateInfo.class);
            info.setBuiltin(true);
            return Optional.of(info);
        } catch (IOException e) {
            log.warn("Failed to read bundled template {}: {}", resource, e.getMessage());
            return Optional.empty();
        }
    }
}
