package com.example.demo.sheets;

import com.example.demo.sheets.config.ConverterProperties;
import com.example.demo.sheets.model.OutputFormat;
import com.example.demo.sheets.writer.SheetWriterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(args = "--help")
public class SheetHappensApplicationTest {

    @Autowired
    private SheetWriterRegistry writerRegistry;

    @Autowired
    private ConverterProperties properties;

    @Test
    public void contextLoads() {
        assertEquals(EnumSet.allOf(OutputFormat.class), writerRegistry.getSupportedFormats());
    }

    @Test
    public void bindsDefaultsFromApplicationYml() {
        assertTrue(properties.isSanitize());
        assertEquals(4, properties.getJsonIndent());
        assertTrue(properties.getFormats().isEmpty());
        assertNull(properties.getOutputDirectory());
    }
}
