package com.participant.matching.bulk;

import com.participant.matching.core.model.Participant;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads campaign participants from a CSV export.
 *
 * <p>Expected header (case-insensitive, any column order, missing columns read as empty):</p>
 * <pre>
 * Email,Cell,Address,City,ZIP,FirstName,LastName,Campaign,opened,clicked
 * jane@example.com,(614) 555-0100,12 Main St,Columbus,43065,Jane,Doe,Spring,Yes,No
 * </pre>
 *
 * <p>Each participant gets the id {@code row-<n>}, {@code n} being its 1-based data row.</p>
 */
public class CsvParticipantReader {
    private static final Logger log = LoggerFactory.getLogger(CsvParticipantReader.class);
    private static final int PROGRESS_INTERVAL = 1000;

    static final String COLUMN_EMAIL = "Email";
    static final String COLUMN_CELL = "Cell";
    static final String COLUMN_ADDRESS = "Address";
    static final String COLUMN_CITY = "City";
    static final String COLUMN_ZIP = "ZIP";
    static final String COLUMN_FIRST_NAME = "FirstName";
    static final String COLUMN_LAST_NAME = "LastName";
    static final String COLUMN_CAMPAIGN = "Campaign";
    static final String COLUMN_OPENED = "opened";
    static final String COLUMN_CLICKED = "clicked";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setTrim(true)
            .build();

    private final boolean engagedOnly;

    /**
     * @param engagedOnly keep only participants who opened or clicked
     */
    public CsvParticipantReader(boolean engagedOnly) {
        this.engagedOnly = engagedOnly;
    }

    public CsvParticipantReader() {
        this(false);
    }

    public ParticipantReadResult read(Path path, ProgressCallback callback) throws IOException {
        log.info("participants.read.started path={} engagedOnly={}", path, engagedOnly);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, callback);
        }
    }

    public ParticipantReadResult read(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Participant> participants = new ArrayList<>();
        long rows = 0;
        long filteredOut = 0;

        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                rows++;
                Participant participant = toParticipant(record, rows);
                if (engagedOnly && !participant.isEngaged()) {
                    filteredOut++;
                } else {
                    participants.add(participant);
                }
                if (rows % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rows, -1, "Read " + rows + " participants");
                }
            }
        }

        var result = new ParticipantReadResult(participants, rows, filteredOut);
        cb.onProgress(rows, rows, "Read completed");
        log.info("participants.read.completed result={}", result);
        return result;
    }

    private static Participant toParticipant(CSVRecord record, long row) {
        return Participant.builder()
                .participantId("row-" + row)
                .email(column(record, COLUMN_EMAIL))
                .cell(column(record, COLUMN_CELL))
                .address(column(record, COLUMN_ADDRESS))
                .city(column(record, COLUMN_CITY))
                .zip(column(record, COLUMN_ZIP))
                .firstName(column(record, COLUMN_FIRST_NAME))
                .lastName(column(record, COLUMN_LAST_NAME))
                .campaign(column(record, COLUMN_CAMPAIGN))
                .opened(Participant.parseFlag(column(record, COLUMN_OPENED)))
                .clicked(Participant.parseFlag(column(record, COLUMN_CLICKED)))
                .build();
    }

    private static String column(CSVRecord record, String name) {
        return record.isSet(name) ? record.get(name) : "";
    }
}
