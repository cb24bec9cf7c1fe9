package com.participant.matching.zipcode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hand-curated ZIP ranges with their known county, taken from postal data.
 * Consulted only when several source collections claim the same ZIP.
 *
 * <p>Loaded once from JSON:</p>
 * <pre>
 * {
 *   "ranges": [
 *     {"county": "RichlandCounty", "start": 44901, "end": 44907, "note": "Mansfield"},
 *     {"county": "FranklinCounty", "start": 43201, "end": 43240}
 *   ]
 * }
 * </pre>
 *
 * <p>Ranges may overlap. Lookups return every matching county in table order.</p>
 */
public class AuthoritativeZipTable {
    private static final Logger log = LoggerFactory.getLogger(AuthoritativeZipTable.class);

    public static final String DEFAULT_RESOURCE = "authoritative-zip-ranges.json";

    private final List<ZipRange> ranges;

    public AuthoritativeZipTable(List<ZipRange> ranges) {
        this.ranges = List.copyOf(ranges);
    }

    /**
     * An empty table, which turns every conflict into a denylist or alphabetical decision.
     */
    public static AuthoritativeZipTable empty() {
        return new AuthoritativeZipTable(List.of());
    }

    /**
     * Loads the table bundled on the classpath.
     */
    public static AuthoritativeZipTable fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static AuthoritativeZipTable fromClasspath(String resource) {
        try (InputStream in = AuthoritativeZipTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Authoritative ZIP table not found on classpath: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read authoritative ZIP table " + resource, e);
        }
    }

    public static AuthoritativeZipTable fromPath(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read authoritative ZIP table " + path, e);
        }
    }

    private static AuthoritativeZipTable load(InputStream in, String origin) throws IOException {
        TableDocument document = new ObjectMapper().readValue(in, TableDocument.class);
        List<ZipRange> ranges = document.ranges() != null ? document.ranges() : List.of();
        for (ZipRange range : ranges) {
            range.validate();
        }
        log.info("zip.authoritative.loaded origin={} ranges={}", origin, ranges.size());
        return new AuthoritativeZipTable(ranges);
    }

    /**
     * Returns the counties whose ranges contain the ZIP, in table order, without duplicates.
     */
    public List<String> countiesFor(int zip) {
        List<String> counties = new ArrayList<>();
        for (ZipRange range : ranges) {
            if (range.contains(zip) && !counties.contains(range.county())) {
                counties.add(range.county());
            }
        }
        return counties;
    }

    /**
     * One inclusive ZIP range assigned to a county.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ZipRange(
            @JsonProperty("county") String county,
            @JsonProperty("start") int start,
            @JsonProperty("end") int end
    ) {
        public boolean contains(int zip) {
            return zip >= start && zip <= end;
        }

        void validate() {
            Objects.requireNonNull(county, "county is required for every range");
            if (start > end) {
                throw new IllegalArgumentException("Range " + start + ".." + end + " for " + county + " is inverted");
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableDocument(@JsonProperty("ranges") List<ZipRange> ranges) {}
}
