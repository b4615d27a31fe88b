package com.perm.dates;

import com.perm.exception.MalformedDateException;
import com.perm.exception.MalformedInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class IsoDatesTest {

    @Test
    void parsesAndFormats() {
        LocalDate date = IsoDates.parse("2024-02-29");
        assertEquals(LocalDate.of(2024, 2, 29), date);
        assertEquals("2024-02-29", IsoDates.format(date));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-02-30", "2023-02-29", "2024-1-5", "01/15/2024", "2024-01-15T00:00:00", "soon"})
    void rejectsMalformedDates(String value) {
        MalformedDateException e = assertThrows(MalformedDateException.class, () -> IsoDates.parse(value));
        assertEquals(value, e.getRawValue());
        assertTrue(e.getMessage().contains("YYYY-MM-DD"));
    }

    @Test
    void malformedDateIsMalformedInput() {
        assertThrows(MalformedInputException.class, () -> IsoDates.parse(null));
    }

    @Test
    void optionalValues() {
        assertNull(IsoDates.parseOptional(null));
        assertNull(IsoDates.parseOptional("  "));
        assertNull(IsoDates.format(null));
        assertEquals(LocalDate.of(2024, 1, 15), IsoDates.parseOptional("2024-01-15"));
    }
}
