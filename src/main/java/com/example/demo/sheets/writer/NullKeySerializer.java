package com.example.demo.sheets.writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Renders a null record key (an empty header cell) as the empty field name.
 */
class NullKeySerializer extends StdSerializer<Object> {

    NullKeySerializer() {
        super(Object.class);
    }

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeFieldName("");
    }
}
