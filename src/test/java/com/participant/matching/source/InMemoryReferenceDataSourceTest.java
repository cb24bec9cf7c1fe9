package com.participant.matching.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReferenceDataSourceTest {

    @Test
    @DisplayName("Should stream documents in insertion order")
    void streamsDocuments() {
        var source = new InMemoryReferenceDataSource()
                .add("FranklinDemographic", Map.of("parcel_id", "1"))
                .add("FranklinDemographic", Map.of("parcel_id", "2"));

        List<Object> ids = new ArrayList<>();
        source.forEachDocument("FranklinDemographic", document -> ids.add(document.get("parcel_id")));

        assertEquals(List.of("1", "2"), ids);
        assertEquals(List.of("FranklinDemographic"), source.listCollections());
    }

    @Test
    @DisplayName("distinctValues should drop duplicates and nulls")
    void distinctValues() {
        var source = new InMemoryReferenceDataSource()
                .add("MarionResidential", Map.of("parcel_zip", 43302))
                .add("MarionResidential", Map.of("parcel_zip", 43302))
                .add("MarionResidential", Map.of("parcel_zip", "43301"))
                .add("MarionResidential", Map.of("parcel_id", "9"));

        assertEquals(Set.of(43302, "43301"), source.distinctValues("MarionResidential", "parcel_zip"));
    }

    @Test
    @DisplayName("Disconnected or unknown collections should fail")
    void failures() {
        var source = new InMemoryReferenceDataSource().createCollection("A");

        assertThrows(ReferenceSourceException.class, () -> source.forEachDocument("B", d -> { }));
        source.setConnected(false);
        assertFalse(source.isConnected());
        assertThrows(ReferenceSourceException.class, source::listCollections);
    }
}
