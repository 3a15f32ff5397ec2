package db.parts.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;

public class DataTypeTest {

    @Test
    void parsesEachType() {
        assertEquals("events", DataType.STRING.parse("events"));
        assertEquals(1, DataType.UINT8.parse("1"));
        assertEquals(4294967295L, DataType.UINT32.parse("4294967295"));
        assertEquals(9_000_000_000L, DataType.UINT64.parse("9000000000"));
        assertEquals(LocalDateTime.of(2019, 1, 15, 10, 30, 5), DataType.DATETIME.parse("2019-01-15 10:30:05"));
    }

    @Test
    void zeroDateTimeIsNull() {
        assertNull(DataType.DATETIME.parse("0000-00-00 00:00:00"));
        assertNull(DataType.DATETIME.parse("0"));
    }

    @Test
    void epochSecondsAreUtc() {
        assertEquals(LocalDateTime.of(2019, 1, 1, 0, 0, 0), DataType.DATETIME.parse("1546300800"));
    }

    @Test
    void rejectsOutOfRangeAndGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DataType.UINT8.parse("256"));
        assertThrows(IllegalArgumentException.class, () -> DataType.UINT32.parse("-1"));
        assertThrows(IllegalArgumentException.class, () -> DataType.UINT32.parse("4294967296"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DataType.UINT64.parse("lots"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertThrows(IllegalArgumentException.class, () -> DataType.DATETIME.parse("2019-13-01 00:00:00"));
    }

    @Test
    void epochOutsideInstantRangeIsRejectedWithCause() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> DataType.DATETIME.parse("99999999999999999"));
        assertInstanceOf(DateTimeException.class, e.getCause());
    }

    @Test
    void textAndEpochFormsOfSameInstantAgree() {
        ZoneId moscow = ZoneId.of("Europe/Moscow");
        Object fromText = DataType.DATETIME.parse("2019-01-01 03:00:00", moscow);
        Object fromEpoch = DataType.DATETIME.parse("1546300800", moscow);
        assertEquals(LocalDateTime.of(2019, 1, 1, 0, 0, 0), fromText);
        assertEquals(fromEpoch, fromText);
    }

    @Test
    void zoneIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> DataType.DATETIME.parse("2019-01-01 03:00:00", null));
    }
}
