package com.participant.matching.bulk;

import com.participant.matching.core.model.Participant;

import java.util.List;

/**
 * Participants read from a CSV file.
 *
 * @param participants participants kept, in file order
 * @param rowsRead     data rows in the file
 * @param filteredOut  rows dropped by the engaged-only filter
 */
public record ParticipantReadResult(List<Participant> participants, long rowsRead, long filteredOut) {

    public ParticipantReadResult {
        participants = participants != null ? List.copyOf(participants) : List.of();
    }

    @Override
    public String toString() {
        return "ParticipantReadResult{participants=" + participants.size() +
                ", rows=" + rowsRead +
                ", filteredOut=" + filteredOut + '}';
    }
}
