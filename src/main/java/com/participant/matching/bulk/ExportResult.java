package com.participant.matching.bulk;

/**
 * Result of one CSV export.
 *
 * @param rowsWritten data rows written, header excluded
 * @param rowsSkipped results not written because they did not qualify or exceeded the limit
 */
public record ExportResult(long rowsWritten, long rowsSkipped) {

    @Override
    public String toString() {
        return "ExportResult{written=" + rowsWritten + ", skipped=" + rowsSkipped + '}';
    }
}
