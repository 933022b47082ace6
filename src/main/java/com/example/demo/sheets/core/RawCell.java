package com.example.demo.sheets.core;

import lombok.Value;

/**
 * A cell element as found in the worksheet XML, before any resolution.
 */
@Value
class RawCell {
    String reference;
    /** value of the {@code t} attribute, null when absent */
    String type;
    /** text of {@code <v>}, or of {@code <is>} for inline strings; null when absent */
    String value;
}
