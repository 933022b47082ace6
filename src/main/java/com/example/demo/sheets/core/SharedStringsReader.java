package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;
import lombok.extern.slf4j.Slf4j;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Loads the workbook-level shared-string table.
 */
@Slf4j
public final class SharedStringsReader {

    private SharedStringsReader() {
    }

    /**
     * Parse {@code xl/sharedStrings.xml}. A package without that part yields an empty table.
     */
    public static List<String> load(ExcelArchive archive) {
        Optional<byte[]> content = archive.findEntry(ExcelArchive.SHARED_STRINGS_ENTRY);
        if (content.isEmpty()) {
            log.debug("No shared strings in {}, using an empty table", archive.getPath());
            return Collections.emptyList();
        }
        return parse(content.get());
    }

    static List<String> parse(byte[] content) {
        SharedStringsHandler handler = new SharedStringsHandler();
        try {
            XmlSupport.saxParser().parse(new ByteArrayInputStream(content), handler);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new SheetFormatException("Error while parsing sharedStrings content", e);
        }
        List<String> strings = handler.getStrings();
        log.debug("Loaded {} shared strings", strings.size());
        return Collections.unmodifiableList(strings);
    }
}
