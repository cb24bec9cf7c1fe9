package com.participant.matching.bulk;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.core.model.Participant;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes match results as CSV.
 *
 * <p>Matched export, one row per result whose demographic record carries a name:</p>
 * <pre>
 * Name,Campaign,County,Opened,Clicked,Applied,Age,Income,YearBuilt
 * JANE DOE,Spring,FranklinCounty,1,0,0,42,55000,1962
 * </pre>
 *
 * <p>Debug export, the first unmatched results up to a limit:</p>
 * <pre>
 * Email,FirstName,LastName,Address,City,ZIP,Cell,Campaign,County_Lookup,Opened,Clicked,Match_Quality,Match_Method
 * </pre>
 */
public class CsvMatchExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMatchExporter.class);
    private static final int PROGRESS_INTERVAL = 1000;

    public static final int DEFAULT_DEBUG_LIMIT = 50;
    static final String NO_ZIPCODE_COUNTY = "NO_ZIPCODE";

    static final String[] MATCHED_HEADER = {
            "Name", "Campaign", "County", "Opened", "Clicked", "Applied", "Age", "Income", "YearBuilt"
    };
    static final String[] DEBUG_HEADER = {
            "Email", "FirstName", "LastName", "Address", "City", "ZIP", "Cell", "Campaign",
            "County_Lookup", "Opened", "Clicked", "Match_Quality", "Match_Method"
    };

    public ExportResult exportMatched(Path path, List<MatchResult> results, ProgressCallback callback)
            throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            ExportResult result = exportMatched(writer, results, callback);
            log.info("export.matched.written path={} result={}", path, result);
            return result;
        }
    }

    public ExportResult exportMatched(Writer writer, List<MatchResult> results, ProgressCallback callback)
            throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long written = 0;
        long skipped = 0;

        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(MATCHED_HEADER).build());
        for (MatchResult result : results) {
            DemographicRecord demographic = result.isMatched() ? result.demographicRecord() : null;
            if (demographic == null || demographic.customerName() == null || demographic.customerName().isBlank()) {
                skipped++;
                continue;
            }
            Participant participant = result.participant();
            printer.printRecord(
                    demographic.customerName(),
                    nullToEmpty(participant.getCampaign()),
                    result.countyName(),
                    flag(participant.isOpened()),
                    flag(participant.isClicked()),
                    0,
                    number(demographic.age()),
                    number(demographic.estimatedIncome()),
                    number(result.residential().map(r -> r.yearBuilt()).orElse(null)));
            written++;
            if (written % PROGRESS_INTERVAL == 0) {
                cb.onProgress(written, results.size(), "Exported " + written + " matched rows");
            }
        }
        printer.flush();

        var exportResult = new ExportResult(written, skipped);
        cb.onProgress(written, written, "Export completed");
        log.info("export.matched.completed result={}", exportResult);
        return exportResult;
    }

    public ExportResult exportUnmatchedDebug(Path path, List<MatchResult> results, int limit) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            ExportResult result = exportUnmatchedDebug(writer, results, limit);
            log.info("export.debug.written path={} result={}", path, result);
            return result;
        }
    }

    /**
     * Writes at most {@code limit} unmatched results. Results without a county show
     * {@code NO_ZIPCODE} in the lookup column.
     */
    public ExportResult exportUnmatchedDebug(Writer writer, List<MatchResult> results, int limit)
            throws IOException {
        long written = 0;
        long skipped = 0;

        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(DEBUG_HEADER).build());
        for (MatchResult result : results) {
            if (result.isMatched()) {
                continue;
            }
            if (written >= limit) {
                skipped++;
                continue;
            }
            Participant p = result.participant();
            printer.printRecord(
                    nullToEmpty(p.getEmail()),
                    nullToEmpty(p.getFirstName()),
                    nullToEmpty(p.getLastName()),
                    nullToEmpty(p.getAddress()),
                    nullToEmpty(p.getCity()),
                    nullToEmpty(p.getZip()),
                    nullToEmpty(p.getCell()),
                    nullToEmpty(p.getCampaign()),
                    result.hasCounty() ? result.countyName() : NO_ZIPCODE_COUNTY,
                    flag(p.isOpened()),
                    flag(p.isClicked()),
                    result.matchQuality().getLabel(),
                    result.matchMethod());
            written++;
        }
        printer.flush();

        var exportResult = new ExportResult(written, skipped);
        log.info("export.debug.completed result={}", exportResult);
        return exportResult;
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    static String number(Number value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
