package com.participant.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantTest {

    @Test
    @DisplayName("Blank fields should read as null")
    void blankFieldsAreNull() {
        Participant participant = Participant.builder()
                .email("  ")
                .zip("")
                .campaign(" Spring ")
                .build();

        assertNull(participant.getEmail());
        assertNull(participant.getZip());
        assertEquals("Spring", participant.getCampaign());
        assertNotNull(participant.getParticipantId());
    }

    @Test
    @DisplayName("Engaged means opened or clicked")
    void engagement() {
        assertFalse(Participant.builder().build().isEngaged());
        assertTrue(Participant.builder().opened(true).build().isEngaged());
        assertTrue(Participant.builder().clicked(true).build().isEngaged());
    }

    @ParameterizedTest
    @CsvSource({"Yes,true", "y,true", "TRUE,true", "1,true", "No,false", "0,false", "maybe,false", "'',false"})
    void parseFlag(String raw, boolean expected) {
        assertEquals(expected, Participant.parseFlag(raw));
    }

    @Test
    @DisplayName("Equality should be by participant id")
    void equalityById() {
        assertEquals(Participant.builder().participantId("x").email("a@b.com").build(),
                Participant.builder().participantId("x").build());
        assertNotEquals(Participant.builder().participantId("x").build(),
                Participant.builder().participantId("y").build());
    }
}
