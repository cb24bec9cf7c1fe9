package com.participant.matching.source;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.ResidentialRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceRecordMapper Tests")
class ReferenceRecordMapperTest {

    @Nested
    @DisplayName("Demographic documents")
    class DemographicTests {

        @Test
        @DisplayName("Should map all known fields")
        void mapsFields() {
            Map<String, Object> document = new HashMap<>();
            document.put("parcel_id", "010-000123");
            document.put("email", "jane@x.com");
            document.put("mobile", 6.1455501E9);
            document.put("address", "12 Main St");
            document.put("parcel_zip", 43065);
            document.put("customer_name", "JANE DOE");
            document.put("estimated_income", 55000.0);
            document.put("total_energy_burden", 0.031);
            document.put("age in two-year increments - 1st individual", 42.0);

            DemographicRecord record = ReferenceRecordMapper.toDemographic("FranklinCounty", document).orElseThrow();

            assertEquals("FranklinCounty", record.county());
            assertEquals("010-000123", record.parcelId());
            assertEquals("6145550100", record.mobile());
            assertEquals("43065", record.parcelZip());
            assertEquals(55000.0, record.estimatedIncome());
            assertEquals(42, record.age());
        }

        @Test
        @DisplayName("Should fall back to phone when mobile is absent")
        void phoneFallback() {
            DemographicRecord record = ReferenceRecordMapper.toDemographic("FranklinCounty",
                    Map.of("parcel_id", "1", "mobile", -1, "phone", "614-555-0100")).orElseThrow();

            assertEquals("614-555-0100", record.mobile());
        }

        @Test
        @DisplayName("Placeholders should map to null")
        void placeholders() {
            DemographicRecord record = ReferenceRecordMapper.toDemographic("FranklinCounty", Map.of(
                    "parcel_id", "1",
                    "email", "nan",
                    "estimated_income", -1,
                    "age in two-year increments - 1st individual", Double.NaN,
                    "parcel_zip", "-1")).orElseThrow();

            assertNull(record.email());
            assertNull(record.estimatedIncome());
            assertNull(record.age());
            assertNull(record.parcelZip());
        }

        @Test
        @DisplayName("Documents without parcel id should be skipped")
        void noParcelId() {
            assertTrue(ReferenceRecordMapper.toDemographic("FranklinCounty", Map.of("email", "a@b.com")).isEmpty());
            assertTrue(ReferenceRecordMapper.toDemographic("FranklinCounty", Map.of("parcel_id", " ")).isEmpty());
        }
    }

    @Test
    @DisplayName("Residential age should map to year built")
    void residentialYearBuilt() {
        ResidentialRecord record = ReferenceRecordMapper.toResidential("MarionCounty",
                Map.of("parcel_id", 778899L, "address", "2 Elm St", "parcel_zip", 43302.0, "age", 1962)).orElseThrow();

        assertEquals("778899", record.parcelId());
        assertEquals("43302", record.parcelZip());
        assertEquals(1962, record.yearBuilt());
    }

    @Test
    @DisplayName("Text values should parse as numbers")
    void textNumbers() {
        assertEquals(1250.5, ReferenceRecordMapper.decimal("1250.5"));
        assertNull(ReferenceRecordMapper.decimal("unknown"));
        assertNull(ReferenceRecordMapper.integer("-1.0"));
        assertEquals(7, ReferenceRecordMapper.integer("7"));
        assertNull(ReferenceRecordMapper.integer("1e12"));
        assertNull(ReferenceRecordMapper.integer(3_000_000_000L));
        assertNull(ReferenceRecordMapper.integer("Infinity"));
        assertEquals(Integer.MAX_VALUE, ReferenceRecordMapper.integer((double) Integer.MAX_VALUE));
    }
}
