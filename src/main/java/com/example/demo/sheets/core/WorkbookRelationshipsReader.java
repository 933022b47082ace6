package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code xl/_rels/workbook.xml.rels}, mapping the numeric part of each relationship id
 * to the package entry it targets ({@code Target="worksheets/sheet2.xml"} gives
 * {@code xl/worksheets/sheet2.xml}).
 */
@Slf4j
public final class WorkbookRelationshipsReader {

    private static final String TAG_RELATIONSHIP = "Relationship";
    private static final String ATTR_ID = "Id";
    private static final String ATTR_TARGET = "Target";
    private static final String ATTR_TARGET_MODE = "TargetMode";
    private static final String TARGET_MODE_EXTERNAL = "External";
    private static final String BASE_DIRECTORY = "xl/";

    private WorkbookRelationshipsReader() {
    }

    /**
     * @return relationship number to entry name; empty when the package has no workbook relationships part
     */
    public static Map<Integer, String> load(ExcelArchive archive) {
        Optional<byte[]> content = archive.findEntry(ExcelArchive.WORKBOOK_RELATIONSHIPS_ENTRY);
        if (content.isEmpty()) {
            log.debug("No workbook relationships in {}, assuming rIdN targets sheetN", archive.getPath());
            return Collections.emptyMap();
        }
        return parse(content.get());
    }

    static Map<Integer, String> parse(byte[] content) {
        Map<Integer, String> targets = new LinkedHashMap<>();
        XMLStreamReader reader = null;
        try {
            reader = XmlSupport.streamReader(content);
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamReader.START_ELEMENT && TAG_RELATIONSHIP.equals(reader.getLocalName())) {
                    if (TARGET_MODE_EXTERNAL.equals(reader.getAttributeValue(null, ATTR_TARGET_MODE))) {
                        continue;
                    }
                    Integer relationship = WorkbookIndexReader.relationshipNumber(reader.getAttributeValue(null, ATTR_ID));
                    String target = reader.getAttributeValue(null, ATTR_TARGET);
                    if (relationship != null && target != null && !target.isBlank()) {
                        targets.putIfAbsent(relationship, resolveTarget(target.trim()));
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new SheetFormatException("Error while parsing workbook relationships", e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.warn("Error while closing relationships reader", e);
                }
            }
        }
        return Collections.unmodifiableMap(targets);
    }

    /**
     * Targets are relative to {@code xl/} unless they start with a slash, which anchors them at the package root.
     */
    static String resolveTarget(String target) {
        if (target.startsWith("/")) {
            return target.substring(1);
        }
        String resolved = BASE_DIRECTORY + target;
        while (resolved.contains("/./")) {
            resolved = resolved.replace("/./", "/");
        }
        return resolved;
    }
}
