package com.latexword.converter.convert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ImageResolver.
 */
class ImageResolverTest {

    @TempDir
    Path baseDir;

    @Test
    void testResolvesNameAsWritten() throws IOException {
        Path image = Files.createFile(baseDir.resolve("logo.png"));

        assertThat(new ImageResolver(baseDir).resolve("logo.png")).contains(image);
    }

    @Test
    void testAddsExtensionsInOrder() throws IOException {
        Files.createFile(baseDir.resolve("chart.pdf"));
        Path png = Files.createFile(baseDir.resolve("chart.png"));

        assertThat(new ImageResolver(baseDir).resolve("chart")).contains(png);
    }

    @Test
    void testSearchesImmediateSubdirectories() throws IOException {
        Path figures = Files.createDirectory(baseDir.resolve("figures"));
        Path image = Files.createFile(figures.resolve("arch.jpg"));
        Path deep = Files.createDirectories(baseDir.resolve("a/b"));
        Files.createFile(deep.resolve("hidden.png"));

        ImageResolver resolver = new ImageResolver(baseDir);

        assertThat(resolver.resolve("arch")).contains(image);
        assertThat(resolver.resolve("hidden")).isEmpty();
    }

    @Test
    void testMissingOrBlankName() {
        ImageResolver resolver = new ImageResolver(baseDir);

        assertThat(resolver.resolve("nothing")).isEmpty();
        assertThat(resolver.resolve("  ")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    @Test
    void testIsPdf() {
        assertThat(ImageResolver.isPdf(Path.of("plot.PDF"))).isTrue();
        assertThat(ImageResolver.isPdf(Path.of("plot.png"))).isFalse();
    }
}
