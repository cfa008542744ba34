package com.property.distress.archive;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.CsvRecordReader;
import com.property.distress.ingest.IngestionConfigurationException;
import com.property.distress.ingest.SourceRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArchiveRotator Tests")
class ArchiveRotatorTest {

    @TempDir
    Path tempDir;

    private Path destination;
    private ArchiveRotator rotator;

    @BeforeEach
    void setUp() throws Exception {
        destination = tempDir.resolve("liens");
        Files.createDirectories(destination);
        rotator = new ArchiveRotator(Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC));
    }

    private Path write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("filterAgainstArchive")
    class Filter {

        @Test
        @DisplayName("Should keep only rows absent from the archive")
        void keepsNewRows() throws Exception {
            write(destination.resolve("old/liens_20261018.csv"), "Instrument,Grantor\nI-1,SMITH\nI-2,DOE\n");
            Path fresh = write(tempDir.resolve("liens.csv"),
                    "Instrument,Grantor\nI-1,SMITH\nI-2,DOE\nI-3,ROE\nI-4,\"LEE, ANN\"\n");

            ArchiveFilterResult result = rotator.filterAgainstArchive(fresh, destination, RecordType.LIENS);

            assertEquals(4, result.total());
            assertEquals(2, result.kept());
            assertEquals(2, result.duplicates());
            assertEquals(destination.resolve("new/liens_20261019.csv"), result.output());
            List<SourceRow> rows = new CsvRecordReader().read(result.output());
            assertEquals(List.of("I-3", "I-4"), rows.stream().map(r -> r.text("Instrument")).toList());
            assertEquals("LEE, ANN", rows.get(1).text("Grantor"));
        }

        @Test
        @DisplayName("Without an archive every row is kept")
        void noArchive() throws Exception {
            Path fresh = write(tempDir.resolve("liens.csv"), "Instrument,Grantor\nI-1,SMITH\n");

            ArchiveFilterResult result = rotator.filterAgainstArchive(fresh, destination, RecordType.LIENS);

            assertEquals(1, result.kept());
            assertEquals(0, result.duplicates());
        }

        @Test
        @DisplayName("Leftover candidates from an earlier run are replaced")
        void clearsLeftovers() throws Exception {
            Path leftover = write(destination.resolve("new/liens_20261001.csv"), "Instrument\nI-9\n");
            Path fresh = write(tempDir.resolve("liens.csv"), "Instrument,Grantor\nI-1,SMITH\n");

            rotator.filterAgainstArchive(fresh, destination, RecordType.LIENS);

            assertFalse(Files.exists(leftover));
        }

        @Test
        @DisplayName("Archive files without the identity column are ignored")
        void foreignArchiveFile() throws Exception {
            write(destination.resolve("old/notes.csv"), "Note\nI-1\n");
            Path fresh = write(tempDir.resolve("liens.csv"), "Instrument,Grantor\nI-1,SMITH\n");

            assertEquals(1, rotator.filterAgainstArchive(fresh, destination, RecordType.LIENS).kept());
        }

        @Test
        @DisplayName("An export without the identity column is rejected before writing")
        void missingIdentityColumn() throws Exception {
            Path fresh = write(tempDir.resolve("liens.csv"), "Grantor\nSMITH\n");

            assertThrows(IngestionConfigurationException.class,
                    () -> rotator.filterAgainstArchive(fresh, destination, RecordType.LIENS));
            assertFalse(Files.exists(destination.resolve("new/liens_20261019.csv")));
        }
    }

    @Nested
    @DisplayName("rotate")
    class Rotate {

        @Test
        @DisplayName("Should promote new files and drop stale ones")
        void promotes() throws Exception {
            write(destination.resolve("new/liens_20261019.csv"), "Instrument\nI-3\n");
            Path stale = write(destination.resolve("old/liens_20261018.csv"), "Instrument\nI-1\n");
            Path download = write(destination.resolve("old/CivilFiling_20261018.csv"), "CaseNumber\nC-1\n");

            assertTrue(rotator.rotate(destination));

            assertTrue(Files.exists(destination.resolve("old/liens_20261019.csv")));
            assertFalse(Files.exists(destination.resolve("new/liens_20261019.csv")));
            assertFalse(Files.exists(stale));
            assertTrue(Files.exists(download));
        }

        @Test
        @DisplayName("An empty candidate generation leaves the archive alone")
        void emptyNew() throws Exception {
            Path archived = write(destination.resolve("old/liens_20261018.csv"), "Instrument\nI-1\n");

            assertFalse(rotator.rotate(destination));
            assertTrue(Files.exists(archived));
        }
    }

    @Test
    @DisplayName("Output names carry the run date and drop scraper suffixes")
    void outputName() {
        assertEquals("liens_20261019.csv", rotator.outputName(Path.of("liens_temp.csv")));
        assertEquals("violations_20261019.csv", rotator.outputName(Path.of("violations_download.CSV")));
    }

    @Test
    @DisplayName("Raw scraper downloads are excluded")
    void exclusions() {
        assertTrue(ArchiveRotator.isExcluded(Path.of("ProbateFiling_2026.csv")));
        assertTrue(ArchiveRotator.isExcluded(Path.of("/data/hillsborough_realforeclose_1.csv")));
        assertFalse(ArchiveRotator.isExcluded(Path.of("liens_20261019.csv")));
    }
}
