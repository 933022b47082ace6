package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.EmptyTableException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TableProjectorTest {

    @Test
    public void toRecords_keysRowsByHeader() {
        List<List<String>> rows = Arrays.asList(
                Arrays.asList("Name", "Age"),
                Arrays.asList("Alice", "30"),
                Arrays.asList("Bob", null));

        List<Map<String, String>> records = TableProjector.toRecords(rows, "people");

        assertEquals(2, records.size());
        assertEquals("Alice", records.get(0).get("Name"));
        assertEquals("30", records.get(0).get("Age"));
        assertTrue(records.get(1).containsKey("Age"));
        assertNull(records.get(1).get("Age"));
    }

    @Test
    public void toRecords_keepsHeaderColumnOrder() {
        List<List<String>> rows = Arrays.asList(
                Arrays.asList("z", "a", "m"),
                Arrays.asList("1", "2", "3"));

        Map<String, String> record = TableProjector.toRecords(rows, "t").get(0);

        assertEquals(Arrays.asList("z", "a", "m"), new ArrayList<>(record.keySet()));
    }

    @Test
    public void toRecords_headerOnlyGivesNoRecords() {
        List<List<String>> rows = Collections.singletonList(Arrays.asList("a", "b"));

        assertTrue(TableProjector.toRecords(rows, "t").isEmpty());
    }

    @Test
    public void toRecords_emptyTableIsRejected() {
        EmptyTableException e = assertThrows(EmptyTableException.class,
                () -> TableProjector.toRecords(Collections.<List<String>>emptyList(), "01_Blank"));
        assertTrue(e.getMessage().contains("01_Blank"));
    }

    @Test
    public void toRecords_iteratorFormFailsBeforeFirstRecordIsRequested() {
        Iterator<List<String>> empty = Collections.emptyIterator();

        assertThrows(EmptyTableException.class, () -> TableProjector.toRecords(empty, "t"));
    }

    @Test
    public void zip_truncatesToShorterSide() {
        assertEquals(Map.of("a", "1"), TableProjector.zip(Arrays.asList("a", "b", "c"), List.of("1")));
        assertEquals(Map.of("a", "1", "b", "2"), TableProjector.zip(Arrays.asList("a", "b"), Arrays.asList("1", "2", "3")));
    }

    @Test
    public void zip_repeatedHeaderKeepsLastColumn() {
        Map<String, String> record = TableProjector.zip(Arrays.asList("k", "k"), Arrays.asList("first", "second"));

        assertEquals(1, record.size());
        assertEquals("second", record.get("k"));
    }

    @Test
    public void zip_allowsNullHeader() {
        Map<String, String> record = TableProjector.zip(Arrays.asList("a", null), Arrays.asList("1", "2"));

        assertEquals("2", record.get(null));
    }
}
