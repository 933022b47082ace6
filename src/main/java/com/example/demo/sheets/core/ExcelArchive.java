package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.MissingEntryException;
import com.example.demo.sheets.exception.NotAnArchiveException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Read-only view over the zip container of an OOXML spreadsheet.
 */
@Slf4j
public class ExcelArchive implements AutoCloseable {

    public static final String SHARED_STRINGS_ENTRY = "xl/sharedStrings.xml";
    public static final String WORKBOOK_ENTRY = "xl/workbook.xml";
    public static final String WORKBOOK_RELATIONSHIPS_ENTRY = "xl/_rels/workbook.xml.rels";

    static final Pattern WORKSHEET_ENTRY = Pattern.compile("xl/worksheets/sheet(\\d+)\\.xml");

    private final Path path;
    private final ZipFile zipFile;

    private ExcelArchive(Path path, ZipFile zipFile) {
        this.path = path;
        this.zipFile = zipFile;
    }

    /**
     * Open the package at {@code path}.
     *
     * @throws NotAnArchiveException if the file is missing, unreadable or not a zip container
     */
    public static ExcelArchive open(Path path) {
        try {
            ZipFile zip = new ZipFile(path.toFile());
            log.debug("Opened package {} with {} entries", path, zip.size());
            return new ExcelArchive(path, zip);
        } catch (IOException e) {
            throw new NotAnArchiveException(path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    public boolean hasEntry(String name) {
        return zipFile.getEntry(name) != null;
    }

    public List<String> listEntries() {
        return zipFile.stream().map(ZipEntry::getName).collect(Collectors.toList());
    }

    /**
     * Worksheet entries ordered by their numeric suffix, so sheet2 precedes sheet10.
     */
    public List<String> worksheetEntries() {
        return listEntries().stream()
                .filter(name -> WORKSHEET_ENTRY.matcher(name).matches())
                .sorted(Comparator.comparingLong(ExcelArchive::worksheetNumber))
                .collect(Collectors.toList());
    }

    public byte[] readEntry(String name) {
        return findEntry(name).orElseThrow(() -> new MissingEntryException(name));
    }

    public Optional<byte[]> findEntry(String name) {
        ZipEntry entry = zipFile.getEntry(name);
        if (entry == null || entry.isDirectory()) {
            return Optional.empty();
        }
        try (InputStream in = zipFile.getInputStream(entry)) {
            return Optional.of(in.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read entry " + name + " from " + path, e);
        }
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }

    /**
     * Numeric suffix of a worksheet entry name, e.g. 3 for {@code xl/worksheets/sheet3.xml};
     * -1 when the name does not follow the convention.
     */
    static long worksheetNumber(String entryName) {
        Matcher m = WORKSHEET_ENTRY.matcher(entryName);
        if (!m.matches()) {
            return -1;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
