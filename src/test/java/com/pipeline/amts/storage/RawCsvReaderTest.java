package com.pipeline.amts.storage;

import com.pipeline.amts.SliceFixtures;
import com.pipeline.amts.model.RawBatch;
import com.pipeline.amts.model.RawRow;
import com.pipeline.amts.model.SliceDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RawCsvReaderTest {

    @TempDir
    Path dir;

    private final RawCsvReader reader = new RawCsvReader();

    @Test
    void shouldKeepRowsWhosePointStartsWithPointName() throws IOException {
        Path file = SliceFixtures.writeRaw(dir, "a.csv",
                "2024-03-01 12:00:00,P01,1000.001,2000.002,100.003",
                "2024-03-01 13:00:00,p01-b,1000.001,2000.002,100.003",
                "2024-03-01 14:00:00,P02,1000.001,2000.002,100.003");
        SliceDefinition definition = SliceFixtures.reflective(dir).build();

        RawBatch batch = reader.read(definition, List.of(file));

        assertEquals(2, batch.getRows().size());
        RawRow first = batch.getRows().get(0);
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), first.getTimestamp());
        assertEquals("P01", first.getPointName());
        assertEquals(1000.001, first.getNorthing());
        assertEquals(2000.002, first.getEasting());
        assertEquals(100.003, first.getElevation());
        assertEquals("a.csv", first.getSourceFile());
        assertEquals(1, batch.getFilesMatched());
        assertEquals(0, batch.getParseWarnings());
    }

    @Test
    void shouldCountUnparseableRowsAsWarnings() throws IOException {
        Path file = SliceFixtures.writeRaw(dir, "a.csv",
                "2024-03-01 12:00:00,P01,1000,2000,100",
                "not-a-time,P01,1000,2000,100",
                "2024-03-01 14:00:00,P01,abc,2000,100",
                "2024-03-01 15:00:00,P01,1000,2000,");

        RawBatch batch = reader.read(SliceFixtures.reflective(dir).build(), List.of(file));

        assertEquals(1, batch.getRows().size());
        assertEquals(3, batch.getParseWarnings());
    }

    @Test
    void shouldSkipFileMissingRequiredColumn() throws IOException {
        Path file = dir.resolve("a.csv");
        Files.writeString(file, "Event Time (UTC),Point Name,Elevation\n"
                + "2024-03-01 12:00:00,P01,100.5\n"
                + "2024-03-01 12:00:00,Q01,50.5\n");

        RawBatch reflective = reader.read(SliceFixtures.reflective(dir).build(), List.of(file));
        RawBatch reflectless = reader.read(SliceFixtures.reflectless(dir).build(), List.of(file));

        assertTrue(reflective.getRows().isEmpty());
        assertEquals(1, reflectless.getRows().size());
        assertNull(reflectless.getRows().get(0).getNorthing());
        assertNull(reflectless.getRows().get(0).getEasting());
        assertEquals(50.5, reflectless.getRows().get(0).getElevation());
    }

    @Test
    void shouldMatchHeadersIgnoringCaseAndBom() throws IOException {
        Path file = dir.resolve("a.csv");
        Files.writeString(file, "\uFEFFevent time (utc),POINT NAME,northing,easting,elevation\n"
                + "2024-03-01 12:00:00,P01,1000,2000,100\n", StandardCharsets.UTF_8);

        RawBatch batch = reader.read(SliceFixtures.reflective(dir).build(), List.of(file));

        assertEquals(1, batch.getRows().size());
    }

    @Test
    void shouldApplySliceTimeZone() throws IOException {
        Path file = SliceFixtures.writeRaw(dir, "a.csv", "2024-03-01 12:00:00,P01,1000,2000,100");
        SliceDefinition definition = SliceFixtures.reflective(dir).timeZone(ZoneId.of("Europe/Zurich")).build();

        RawBatch batch = reader.read(definition, List.of(file));

        assertEquals(Instant.parse("2024-03-01T11:00:00Z"), batch.getRows().get(0).getTimestamp());
    }

    @Test
    void shouldReportLatestModificationTime() throws IOException {
        Path a = SliceFixtures.writeRaw(dir, "a.csv", "2024-03-01 12:00:00,P01,1000,2000,100");
        Path b = SliceFixtures.writeRaw(dir, "b.csv", "2024-03-01 13:00:00,P01,1000,2000,100");
        Files.setLastModifiedTime(a, FileTime.fromMillis(2_000L));
        Files.setLastModifiedTime(b, FileTime.fromMillis(1_000L));

        RawBatch batch = reader.read(SliceFixtures.reflective(dir).build(), List.of(a, b));

        assertEquals(2, batch.getRows().size());
        assertEquals(2, batch.getFilesMatched());
        assertEquals(2_000L, batch.getMaxModifiedMillis());
    }
}
