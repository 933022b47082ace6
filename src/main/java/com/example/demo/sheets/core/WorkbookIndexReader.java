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
 * Reads the sheet declarations of {@code xl/workbook.xml}, mapping the numeric part of each
 * relationship id ({@code r:id="rId3"} gives 3) to the declared sheet name.
 */
@Slf4j
public final class WorkbookIndexReader {

    private static final String TAG_SHEET = "sheet";
    private static final String ATTR_NAME = "name";
    private static final String ATTR_ID = "id";

    private WorkbookIndexReader() {
    }

    /**
     * @return relationship number to sheet name in declaration order; empty when the package has no manifest
     */
    public static Map<Integer, String> load(ExcelArchive archive) {
        Optional<byte[]> content = archive.findEntry(ExcelArchive.WORKBOOK_ENTRY);
        if (content.isEmpty()) {
            log.debug("No workbook manifest in {}, sheets keep their entry names", archive.getPath());
            return Collections.emptyMap();
        }
        return parse(content.get());
    }

    static Map<Integer, String> parse(byte[] content) {
        Map<Integer, String> names = new LinkedHashMap<>();
        XMLStreamReader reader = null;
        try {
            reader = XmlSupport.streamReader(content);
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamReader.START_ELEMENT && TAG_SHEET.equals(reader.getLocalName())) {
                    String name = reader.getAttributeValue(null, ATTR_NAME);
                    Integer relationship = relationshipNumber(relationshipId(reader));
                    if (name != null && relationship != null) {
                        names.putIfAbsent(relationship, name);
                    } else {
                        log.debug("Skipping sheet declaration without usable name/id: {}", name);
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new SheetFormatException("Error while parsing workbook manifest", e);
        } finally {
            closeQuietly(reader);
        }
        return Collections.unmodifiableMap(names);
    }

    /**
     * The relationship id is the namespaced {@code id} attribute (transitional or strict namespace),
     * its prefix stripped.
     */
    private static String relationshipId(XMLStreamReader reader) {
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String ns = reader.getAttributeNamespace(i);
            if (ATTR_ID.equals(reader.getAttributeLocalName(i)) && ns != null && !ns.isEmpty()) {
                return reader.getAttributeValue(i);
            }
        }
        return null;
    }

    static Integer relationshipNumber(String relationshipId) {
        if (relationshipId == null) {
            return null;
        }
        int start = relationshipId.length();
        while (start > 0 && Character.isDigit(relationshipId.charAt(start - 1))) {
            start--;
        }
        String digits = relationshipId.substring(start);
        if (digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        return Integer.valueOf(digits);
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.warn("Error while closing manifest reader", e);
        }
    }
}
