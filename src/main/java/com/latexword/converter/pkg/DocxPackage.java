package com.latexword.converter.pkg;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * A saved OOXML package held as an ordered map from part name
 * ({@code word/document.xml}, {@code [Content_Types].xml}, ...) to raw bytes.
 */
public class DocxPackage {

    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String DOCUMENT_RELS = "word/_rels/document.xml.rels";

    private final Map<String, byte[]> parts = new LinkedHashMap<>();

    public static DocxPackage read(byte[] bytes) throws IOException {
        return read(new ByteArrayInputStream(bytes));
    }

    public static DocxPackage read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static DocxPackage read(InputStream in) throws IOException {
        DocxPackage pkg = new DocxPackage();
        try (ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    pkg.parts.put(entry.getName(), zip.readAllBytes());
                }
            }
        }
        if (!pkg.parts.containsKey(CONTENT_TYPES)) {
            throw new IOException("Not an OOXML package: " + CONTENT_TYPES + " is missing");
        }
        return pkg;
    }

    public void write(Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(out);
        }
    }

    /** Writes every part in its original order, content types first. */
    public void write(OutputStream out) throws IOException {
        ZipOutputStream zip = new ZipOutputStream(out);
        writeEntry(zip, CONTENT_TYPES, parts.get(CONTENT_TYPES));
        for (Map.Entry<String, byte[]> part : parts.entrySet()) {
            if (!CONTENT_TYPES.equals(part.getKey())) {
                writeEntry(zip, part.getKey(), part.getValue());
            }
        }
        zip.finish();
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(data);
        zip.closeEntry();
    }

    public Optional<byte[]> get(String partName) {
        return Optional.ofNullable(parts.get(partName));
    }

    public boolean contains(String partName) {
        return parts.containsKey(partName);
    }

    public void put(String partName, byte[] data) {
        parts.put(partName, data);
    }

    public boolean remove(String partName) {
        return parts.remove(partName) != null;
    }

    public Set<String> getPartNames() {
        return Collections.unmodifiableSet(parts.keySet());
    }
}
