package com.participant.matching.bulk;

import com.participant.matching.core.model.Participant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvParticipantReaderTest {

    private static final String CSV = """
            email,cell,Address,City,zip,FirstName,LastName,Campaign,Opened,Clicked
            jane@x.com,(614) 555-0100,"12 Main St, Apt 4",Columbus,43065,Jane,Doe,Spring,Yes,No
            ,,,,,,,,no,no

            bob@x.com,,,,44903,Bob,,Fall,0,1
            """;

    @Test
    @DisplayName("Should read every row with case-insensitive headers")
    void readsRows() throws IOException {
        ParticipantReadResult result = new CsvParticipantReader().read(new StringReader(CSV), null);

        assertEquals(3, result.rowsRead());
        assertEquals(0, result.filteredOut());
        Participant jane = result.participants().get(0);
        assertEquals("row-1", jane.getParticipantId());
        assertEquals("jane@x.com", jane.getEmail());
        assertEquals("12 Main St, Apt 4", jane.getAddress());
        assertEquals("43065", jane.getZip());
        assertTrue(jane.isOpened());
        assertFalse(jane.isClicked());
        assertNull(result.participants().get(1).getEmail());
    }

    @Test
    @DisplayName("Engaged-only should keep openers and clickers")
    void engagedOnly() throws IOException {
        List<String> messages = new ArrayList<>();

        ParticipantReadResult result = new CsvParticipantReader(true)
                .read(new StringReader(CSV), (processed, total, message) -> messages.add(message));

        assertEquals(List.of("jane@x.com", "bob@x.com"),
                result.participants().stream().map(Participant::getEmail).toList());
        assertEquals(1, result.filteredOut());
        assertEquals("Read completed", messages.get(messages.size() - 1));
    }

    @Test
    @DisplayName("Missing columns should read as empty")
    void missingColumns() throws IOException {
        ParticipantReadResult result = new CsvParticipantReader()
                .read(new StringReader("Email\njane@x.com\n"), ProgressCallback.NOOP);

        Participant participant = result.participants().get(0);
        assertEquals("jane@x.com", participant.getEmail());
        assertNull(participant.getZip());
        assertFalse(participant.isEngaged());
    }
}
