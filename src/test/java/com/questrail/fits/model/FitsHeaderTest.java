package com.questrail.fits.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FitsHeaderTest
{
    private static FitsHeader of(DuplicateKeywordPolicy policy, String... keyValues)
    {
        List<HeaderRecord> records = new java.util.ArrayList<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            records.add(new HeaderRecord(keyValues[i], keyValues[i + 1], null, i / 2));
        }
        return new FitsHeader(records, policy);
    }

    @Test
    void typedAccessors()
    {
        FitsHeader h = of(DuplicateKeywordPolicy.LAST_WINS,
                "NAXIS", "2",
                "BSCALE", "1.5D-2",
                "SIMPLE", "T",
                "EXTEND", "F",
                "DATE-OBS", "2024-01-02",
                "OBJECT", "M 1");

        assertEquals(2, h.intValue("naxis").getAsInt());
        assertEquals(0.015, h.doubleValue("BSCALE").getAsDouble(), 1e-15);
        assertEquals(Boolean.TRUE, h.booleanValue("SIMPLE").orElseThrow());
        assertEquals(Boolean.FALSE, h.booleanValue("EXTEND").orElseThrow());
        assertEquals(LocalDateTime.of(2024, 1, 2, 0, 0), h.dateValue("DATE-OBS").orElseThrow());
        assertTrue(h.intValue("OBJECT").isEmpty());
        assertTrue(h.doubleValue("OBJECT").isEmpty());
        assertTrue(h.booleanValue("OBJECT").isEmpty());
        assertTrue(h.intValue("MISSING").isEmpty());
    }

    @Test
    void doubleValueRejectsNonFiniteAndJavaOnlySyntax()
    {
        FitsHeader h = of(DuplicateKeywordPolicy.LAST_WINS,
                "A", "Infinity", "B", "0x1p3", "C", "1e400", "D", "2f");

        assertTrue(h.doubleValue("A").isEmpty());
        assertTrue(h.doubleValue("B").isEmpty());
        assertTrue(h.doubleValue("C").isEmpty());
        assertTrue(h.doubleValue("D").isEmpty());
    }

    @Test
    void intValueOutsideIntRangeIsAbsent()
    {
        assertTrue(of(DuplicateKeywordPolicy.LAST_WINS, "BIG", "3000000000").intValue("BIG").isEmpty());
    }

    @Test
    void duplicatesKeepEveryRecordButResolveOneValue()
    {
        FitsHeader last = of(DuplicateKeywordPolicy.LAST_WINS, "X", "1", "Y", "2", "X", "3");
        FitsHeader first = of(DuplicateKeywordPolicy.FIRST_WINS, "X", "1", "Y", "2", "X", "3");

        assertEquals(3, last.records().size());
        assertEquals(2, last.size());
        assertEquals("3", last.stringValue("X").orElseThrow());
        assertEquals("1", first.stringValue("X").orElseThrow());
        assertEquals(Map.of("X", "3", "Y", "2"), last.asMap());
    }

    @Test
    void recordsAreImmutable()
    {
        FitsHeader h = of(DuplicateKeywordPolicy.LAST_WINS, "X", "1");

        assertThrows(UnsupportedOperationException.class,
                () -> h.records().add(new HeaderRecord("Y", "2", null, 1)));
        assertThrows(UnsupportedOperationException.class, () -> h.asMap().put("Y", "2"));
    }
}
