package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.SheetFormatException;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Pull scanner over the {@code <c>} elements of a worksheet part, in document order.
 * Cells without an {@code r} attribute get the reference implied by their position
 * (next column of the current row).
 */
@Slf4j
class CellScanner implements AutoCloseable {

    private static final String TAG_DIMENSION = "dimension";
    private static final String TAG_SHEETDATA = "sheetData";
    private static final String TAG_ROW = "row";
    private static final String TAG_C = "c";
    private static final String TAG_V = "v";
    private static final String TAG_IS = "is";
    private static final String TAG_T = "t";
    private static final String TAG_RPH = "rPh";
    private static final String ATTR_R = "r";
    private static final String ATTR_T = "t";
    private static final String ATTR_REF = "ref";

    private final XMLStreamReader reader;
    private final CellReferenceCodec codec;
    private int rowNumber = 0;
    private int lastColumn = -1;
    private boolean closed = false;

    CellScanner(byte[] content, CellReferenceCodec codec) {
        this.codec = codec;
        try {
            this.reader = XmlSupport.streamReader(content);
        } catch (XMLStreamException e) {
            throw new SheetFormatException("Error while creating XMLStreamReader instance", e);
        }
    }

    /**
     * Reads ahead to the {@code <dimension>} element. Must be called before any {@link #nextCell()}.
     *
     * @return the declared range, or null if the sheet data starts (or the document ends) first
     */
    String readDimension() {
        try {
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamReader.START_ELEMENT) {
                    String name = reader.getLocalName();
                    if (TAG_DIMENSION.equals(name)) {
                        return reader.getAttributeValue(null, ATTR_REF);
                    }
                    if (TAG_SHEETDATA.equals(name)) {
                        return null;
                    }
                }
            }
            return null;
        } catch (XMLStreamException e) {
            throw new SheetFormatException("Error while reading worksheet dimension", e);
        }
    }

    /**
     * @return the next cell, or null at the end of the document
     */
    RawCell nextCell() {
        if (closed) {
            return null;
        }
        try {
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamReader.START_ELEMENT) {
                    continue;
                }
                String name = reader.getLocalName();
                if (TAG_ROW.equals(name)) {
                    startRow();
                } else if (TAG_C.equals(name)) {
                    return readCell();
                }
            }
            close();
            return null;
        } catch (XMLStreamException e) {
            throw new SheetFormatException("Error while reading worksheet cells", e);
        }
    }

    private void startRow() {
        String r = reader.getAttributeValue(null, ATTR_R);
        if (r != null) {
            try {
                rowNumber = Integer.parseInt(r.trim());
            } catch (NumberFormatException e) {
                throw new SheetFormatException("Invalid row number '" + r + "'", e);
            }
        } else {
            rowNumber++;
        }
        lastColumn = -1;
    }

    private RawCell readCell() throws XMLStreamException {
        String reference = reader.getAttributeValue(null, ATTR_R);
        String type = reader.getAttributeValue(null, ATTR_T);
        if (reference == null) {
            if (rowNumber == 0) {
                throw new SheetFormatException("Cell without reference outside of a row");
            }
            reference = CellReferenceCodec.encodeColumn(lastColumn + 1) + rowNumber;
        }
        lastColumn = codec.decodeCell(reference).getColumn();

        String value = null;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamReader.START_ELEMENT) {
                String name = reader.getLocalName();
                if (TAG_V.equals(name)) {
                    value = reader.getElementText();
                } else if (TAG_IS.equals(name)) {
                    value = readInlineString();
                }
            } else if (event == XMLStreamReader.END_ELEMENT && TAG_C.equals(reader.getLocalName())) {
                return new RawCell(reference, type, value);
            }
        }
        throw new SheetFormatException("Unterminated cell element " + reference);
    }

    private String readInlineString() throws XMLStreamException {
        StringBuilder sb = new StringBuilder();
        boolean inPhonetic = false;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamReader.START_ELEMENT) {
                String name = reader.getLocalName();
                if (TAG_RPH.equals(name)) {
                    inPhonetic = true;
                } else if (TAG_T.equals(name) && !inPhonetic) {
                    sb.append(reader.getElementText());
                }
            } else if (event == XMLStreamReader.END_ELEMENT) {
                String name = reader.getLocalName();
                if (TAG_RPH.equals(name)) {
                    inPhonetic = false;
                } else if (TAG_IS.equals(name)) {
                    return sb.toString();
                }
            }
        }
        throw new SheetFormatException("Unterminated inline string");
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.warn("Error while closing worksheet reader", e);
        }
    }
}
