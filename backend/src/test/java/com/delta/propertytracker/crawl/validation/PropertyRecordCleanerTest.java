package com.delta.propertytracker.crawl.validation;

import com.delta.propertytracker.crawl.model.PropertyRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PropertyRecordCleanerTest {
    private final PropertyRecordCleaner cleaner = new PropertyRecordCleaner();

    @Test
    void normalizesTextOnACopy() {
        PropertyRecord record = record();
        record.setTitle("  Departamento \n  en venta\t3D ");
        record.setAddress("  san carlos   de apoquindo, LAS CONDES ");
        record.setNeighborhood("   ");

        PropertyRecord cleaned = cleaner.clean(record);

        assertEquals("Departamento en venta 3D", cleaned.getTitle());
        assertEquals("San Carlos De Apoquindo, Las Condes", cleaned.getAddress());
        assertThat(cleaned.getNeighborhood()).isNull();
        assertEquals("  Departamento \n  en venta\t3D ", record.getTitle());
    }

    @Test
    void cleaningTwiceChangesNothing() {
        PropertyRecord record = record();
        record.setTitle(" Casa   en  Ñuñoa ");
        record.setAddress("avenida IRARRÁZAVAL 1234");
        record.setAmenities(List.of(" Pool", "gym "));

        PropertyRecord once = cleaner.clean(record);

        assertEquals(once, cleaner.clean(once));
        assertThat(once.getAmenities()).containsExactly("pool", "gym");
    }

    @Test
    void flagsImplausibleValuesWithoutChangingThem() {
        PropertyRecord record = record();
        record.setTotalAreaM2(15.0);
        record.setLatitude(-23.65);
        record.setLongitude(-70.40);
        record.setBedrooms(12);
        record.setBathrooms(9);

        List<String> flags = cleaner.rangeFlags(record);
        PropertyRecord cleaned = cleaner.clean(record);

        assertThat(flags).hasSize(4);
        assertThat(flags.get(0)).startsWith("Unusual area");
        assertThat(flags.get(1)).startsWith("Coordinates outside Santiago area");
        assertEquals(15.0, cleaned.getTotalAreaM2());
        assertEquals(12, cleaned.getBedrooms());
    }

    @Test
    void plausibleRecordHasNoFlags() {
        PropertyRecord record = record();
        record.setTotalAreaM2(85.0);
        record.setLatitude(-33.41);
        record.setLongitude(-70.55);
        record.setBedrooms(3);
        record.setBathrooms(2);

        assertThat(cleaner.rangeFlags(record)).isEmpty();
    }

    private PropertyRecord record() {
        PropertyRecord record = new PropertyRecord(Instant.parse("2024-06-15T21:00:00Z"));
        record.setListingId("1001");
        return record;
    }
}
