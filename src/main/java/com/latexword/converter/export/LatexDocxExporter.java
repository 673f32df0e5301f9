package com.latexword.converter.export;

import com.latexword.converter.aux.AuxFileParser;
import com.latexword.converter.aux.TexStructure;
import com.latexword.converter.convert.LatexToDocxConverter;
import com.latexword.converter.fonts.FontRegistry;
import com.latexword.converter.frontmatter.FrontmatterBuilders;
import com.latexword.converter.metadata.ExportMetadata;
import com.latexword.converter.metadata.MetadataExtractor;
import com.latexword.converter.metadata.PreparedSource;
import com.latexword.converter.pkg.DocxPackage;
import com.latexword.converter.pkg.DocxPackagePostProcessor;
import com.latexword.converter.profile.DocxProfile;
import com.latexword.converter.profile.ProfileLoader;
import com.latexword.converter.profile.TemplateRegistry;
import com.latexword.converter.util.FileWriteUtil;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Converts one LaTeX document into a saved .docx package.
 *
 * <p>The pipeline loads the template profile and the aux/bbl build artifacts,
 * converts the source, builds the front matter when the configuration asks
 * for it, then rewrites the serialized package to inject footnotes and writes
 * it atomically. Either the target file is fully written or a
 * {@link ConversionException} is raised and the target is left untouched.</p>
 *
 * <p>Instances hold no per-document state and may be reused.</p>
 */
public class LatexDocxExporter {
    private static final Logger log = LoggerFactory.getLogger(LatexDocxExporter.class);

    private final ConverterConfig config;
    private final ProfileLoader profileLoader;
    private final AuxFileParser auxFileParser;

    public LatexDocxExporter(ConverterConfig config) {
        this.config = config == null ? ConverterConfig.defaults() : config;
        this.profileLoader = new ProfileLoader(
            new TemplateRegistry(this.config.getTemplatesDir()),
            FontRegistry.forFontset(this.config.getFontset()));
        this.auxFileParser = new AuxFileParser();
    }

    public ConverterConfig getConfig() {
        return config;
    }

    /**
     * Runs the full export.
     *
     * @throws ConversionException if the source cannot be read, the reference
     *                             document cannot be opened or the package
     *                             cannot be written
     */
    public ExportResult export(ExportRequest request) {
        if (request.getOutputFile() == null) {
            throw new ConversionException("No output file given");
        }
        Path target = request.getOutputFile().toAbsolutePath();
        String templateId = request.getTemplateId() == null ? "" : request.getTemplateId();
        log.info("Starting export to {} (template '{}')", target, templateId);

        String latex = readSource(request);
        Path buildDir = resolveBuildDir(request);
        DocxProfile profile = profileLoader.load(templateId);

        Optional<TexStructure> texStructure = readAux(request, buildDir);
        log.info("Aux data {}", texStructure.isPresent() ? "available" : "not available, using computed numbering");

        ExportMetadata metadata = request.getMetadata();
        if (metadata == null && request.isExtractMetadata()) {
            PreparedSource prepared = new MetadataExtractor(profile).prepare(latex, templateId);
            latex = prepared.getLatex();
            metadata = prepared.getMetadata();
        }
        if (metadata == null) {
            metadata = new ExportMetadata();
            metadata.setTemplateId(templateId);
        }

        LatexToDocxConverter converter = new LatexToDocxConverter(
            profile, texStructure.orElse(null), buildDir, metadata, config.getDefaultImageWidthCm());

        byte[] serialized;
        boolean frontmatterBuilt = false;
        try (XWPFDocument doc = converter.convert(latex, openBaseDocument(request.getReferenceDocx()))) {
            if (config.shouldBuildFrontmatter(templateId, metadata.isCoverDetected())) {
                frontmatterBuilt = buildFrontmatter(doc, profile, metadata);
            }
            serialized = serialize(doc);
        } catch (ConversionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ConversionException("Failed to serialize document: " + e.getMessage(), e);
        }

        try {
            DocxPackage pkg = DocxPackage.read(serialized);
            new DocxPackagePostProcessor(converter.getFootnotes(), config.isStripNumberingPart()).process(pkg);
            FileWriteUtil.writeAtomically(target, pkg::write);
        } catch (IOException | RuntimeException e) {
            throw new ConversionException("Failed to write " + target + ": " + e.getMessage(), e);
        }

        long size = sizeOf(target);
        log.info("Saved {} ({} bytes)", target, size);
        return ExportResult.builder()
                .success(true)
                .outputPath(target)
                .templateId(templateId)
                .auxAvailable(texStructure.isPresent())
                .frontmatterBuilt(frontmatterBuilt)
                .chapters(converter.getCounters().getChapter())
                .footnotes(converter.getFootnotes().size())
                .bytesWritten(size)
                .build();
    }

    private static String readSource(ExportRequest request) {
        if (request.getLatex() != null) {
            return request.getLatex();
        }
        if (request.getSourceFile() == null) {
            throw new ConversionException("No LaTeX source given");
        }
        try {
            return Files.readString(request.getSourceFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException("Cannot read LaTeX source " + request.getSourceFile() + ": " + e.getMessage(), e);
        }
    }

    static Path resolveBuildDir(ExportRequest request) {
        if (request.getBuildDir() != null) {
            return request.getBuildDir();
        }
        if (request.getSourceFile() != null && request.getSourceFile().toAbsolutePath().getParent() != null) {
            return request.getSourceFile().toAbsolutePath().getParent();
        }
        return Path.of(".");
    }

    private Optional<TexStructure> readAux(ExportRequest request, Path buildDir) {
        Path aux = request.getAuxFile() != null ? request.getAuxFile() : buildDir.resolve(config.getAuxName());
        Path bbl = request.getBblFile() != null ? request.getBblFile() : buildDir.resolve(config.getBblName());
        if (!Files.isRegularFile(aux)) {
            log.debug("No aux file at {}", aux);
            return Optional.empty();
        }
        return auxFileParser.parse(aux, bbl);
    }

    private static XWPFDocument openBaseDocument(Path referenceDocx) {
        if (referenceDocx == null) {
            return new XWPFDocument();
        }
        try (InputStream in = Files.newInputStream(referenceDocx)) {
            XWPFDocument base = new XWPFDocument(in);
            // Keep styles and settings, drop the sample content
            for (int i = base.getBodyElements().size() - 1; i >= 0; i--) {
                base.removeBodyElement(i);
            }
            return base;
        } catch (IOException | RuntimeException e) {
            throw new ConversionException("Cannot open reference document " + referenceDocx + ": " + e.getMessage(), e);
        }
    }

    private static boolean buildFrontmatter(XWPFDocument doc, DocxProfile profile, ExportMetadata metadata) {
        try {
            FrontmatterBuilders.forProfile(profile).build(doc, metadata);
            return true;
        } catch (RuntimeException e) {
            log.warn("Front matter not built: {}", e.getMessage(), e);
            return false;
        }
    }

    private static byte[] serialize(XWPFDocument doc) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        doc.write(out);
        return out.toByteArray();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return -1;
        }
    }
}
