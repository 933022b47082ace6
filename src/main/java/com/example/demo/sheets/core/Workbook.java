package com.example.demo.sheets.core;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An Excel 2007+ workbook opened from disk.
 * <p>
 * Owns the package handle until {@link #close()}. The shared-string table, the sheet name
 * index and the workbook relationships are each read at most once and cached for the lifetime
 * of the instance.
 */
@Slf4j
public class Workbook implements AutoCloseable {

    private final Path path;
    private final boolean sanitize;
    private final ExcelArchive archive;

    private List<String> sharedStrings;
    private Map<Integer, String> sheetNames;
    private Map<Integer, String> relationshipTargets;
    private Map<String, String> declaredNames;

    private Workbook(Path path, boolean sanitize, ExcelArchive archive) {
        this.path = path;
        this.sanitize = sanitize;
        this.archive = archive;
    }

    /**
     * @param sanitize trim values and fold line breaks into single spaces
     * @throws com.example.demo.sheets.exception.NotAnArchiveException if the file is not a zip package
     */
    public static Workbook open(Path path, boolean sanitize) {
        Path resolved = path.toAbsolutePath().normalize();
        return new Workbook(resolved, sanitize, ExcelArchive.open(resolved));
    }

    public Path getPath() {
        return path;
    }

    public boolean isSanitize() {
        return sanitize;
    }

    public List<String> getSharedStrings() {
        if (sharedStrings == null) {
            sharedStrings = SharedStringsReader.load(archive);
        }
        return sharedStrings;
    }

    /**
     * Relationship number to declared sheet name, in manifest order.
     */
    public Map<Integer, String> getSheetNames() {
        if (sheetNames == null) {
            sheetNames = WorkbookIndexReader.load(archive);
        }
        return sheetNames;
    }

    /**
     * Relationship number to the package entry it targets, from the workbook relationships part.
     */
    public Map<Integer, String> getRelationshipTargets() {
        if (relationshipTargets == null) {
            relationshipTargets = WorkbookRelationshipsReader.load(archive);
        }
        return relationshipTargets;
    }

    /**
     * Worksheet entry name to declared sheet name. Each declaration is linked to its entry through
     * the workbook relationships; a package without that part falls back to {@code rIdN -> sheetN.xml}.
     */
    public Map<String, String> getDeclaredNames() {
        if (declaredNames == null) {
            Map<Integer, String> targets = getRelationshipTargets();
            Map<String, String> names = new LinkedHashMap<>();
            for (Map.Entry<Integer, String> declaration : getSheetNames().entrySet()) {
                String entry = targets.isEmpty()
                        ? "xl/worksheets/sheet" + declaration.getKey() + ".xml"
                        : targets.get(declaration.getKey());
                if (entry == null) {
                    log.debug("Sheet {} has no relationship target, its entry keeps the file name", declaration.getValue());
                    continue;
                }
                names.putIfAbsent(entry, declaration.getValue());
            }
            declaredNames = Collections.unmodifiableMap(names);
        }
        return declaredNames;
    }

    /**
     * Reads every worksheet part of the package, in sheet-number order.
     * Shared strings and sheet names are loaded first so the returned sheets never
     * go back to the package.
     */
    public List<Worksheet> getSheets() {
        getSharedStrings();
        getDeclaredNames();
        List<Worksheet> sheets = new ArrayList<>();
        for (String entry : archive.worksheetEntries()) {
            sheets.add(new Worksheet(this, entry, archive.readEntry(entry)));
        }
        log.debug("Found {} worksheets in {}", sheets.size(), path);
        return Collections.unmodifiableList(sheets);
    }

    /**
     * Reads one worksheet part by its entry name.
     *
     * @throws com.example.demo.sheets.exception.MissingEntryException if the package has no such entry
     */
    public Worksheet getSheet(String entryName) {
        getSharedStrings();
        getDeclaredNames();
        return new Worksheet(this, entryName, archive.readEntry(entryName));
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
