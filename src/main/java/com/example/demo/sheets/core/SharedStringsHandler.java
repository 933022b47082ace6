package com.example.demo.sheets.core;

import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * SAX handler collecting one string per {@code <si>} item of a shared-strings part.
 * Rich-text runs are concatenated; phonetic runs ({@code <rPh>}) are skipped.
 * An item without any {@code <t>} element yields {@code null}.
 */
class SharedStringsHandler extends DefaultHandler {

    private static final String TAG_SST = "sst";
    private static final String TAG_SI = "si";
    private static final String TAG_T = "t";
    private static final String TAG_RPH = "rPh";

    static final int DEFAULT_CAPACITY = 10;
    static final int MAX_INITIAL_CAPACITY = 1 << 16;

    private final StringBuilder sb = new StringBuilder();
    private List<String> strings = new ArrayList<>();
    private boolean inText = false;
    private boolean inPhonetic = false;
    private boolean sawText = false;

    List<String> getStrings() {
        return strings;
    }

    /**
     * List capacity for a declared {@code uniqueCount}. The attribute is only a hint and is capped.
     */
    static int initialCapacity(String uniqueCount) {
        if (uniqueCount == null || !uniqueCount.matches("\\d{1,7}")) {
            return DEFAULT_CAPACITY;
        }
        return Math.min(Integer.parseInt(uniqueCount), MAX_INITIAL_CAPACITY);
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attrs) {
        switch (localName) {
            case TAG_SST:
                strings = new ArrayList<>(initialCapacity(attrs.getValue("uniqueCount")));
                break;
            case TAG_SI:
                sb.setLength(0);
                sawText = false;
                break;
            case TAG_RPH:
                inPhonetic = true;
                break;
            case TAG_T:
                if (!inPhonetic) {
                    inText = true;
                    sawText = true;
                }
                break;
            default:
                break;
        }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        switch (localName) {
            case TAG_SI:
                strings.add(sawText ? sb.toString() : null);
                sb.setLength(0);
                break;
            case TAG_RPH:
                inPhonetic = false;
                break;
            case TAG_T:
                inText = false;
                break;
            default:
                break;
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        if (inText) {
            sb.append(ch, start, length);
        }
    }
}
