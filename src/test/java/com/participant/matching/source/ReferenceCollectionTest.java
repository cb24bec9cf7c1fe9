package com.participant.matching.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceCollectionTest {

    @ParameterizedTest
    @CsvSource({
            "FranklinCountyDemographic,FranklinCounty,DEMOGRAPHIC",
            "FranklinDemographic,FranklinCounty,DEMOGRAPHIC",
            "AthensCountyResidential,AthensCounty,RESIDENTIAL",
            "AthensResidential,AthensCounty,RESIDENTIAL"
    })
    void shouldParseCountyAndKind(String name, String county, ReferenceCollection.Kind kind) {
        ReferenceCollection collection = ReferenceCollection.parse(name).orElseThrow();

        assertEquals(name, collection.name());
        assertEquals(county, collection.county());
        assertEquals(kind, collection.kind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Demographic", "Residential", "participants", "FranklinCounty", ""})
    void shouldIgnoreOtherCollections(String name) {
        assertEquals(Optional.empty(), ReferenceCollection.parse(name));
    }

    @Test
    @DisplayName("Load order should be county first, demographic before residential")
    void loadOrder() {
        List<ReferenceCollection> collections = new ArrayList<>(List.of(
                ReferenceCollection.parse("MarionResidential").orElseThrow(),
                ReferenceCollection.parse("FranklinResidential").orElseThrow(),
                ReferenceCollection.parse("MarionDemographic").orElseThrow(),
                ReferenceCollection.parse("FranklinCountyDemographic").orElseThrow()));

        collections.sort(ReferenceCollection.LOAD_ORDER);

        assertEquals(List.of("FranklinCountyDemographic", "FranklinResidential", "MarionDemographic",
                "MarionResidential"), collections.stream().map(ReferenceCollection::name).toList());
    }
}
