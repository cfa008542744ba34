package com.property.distress.ingest;

import com.property.distress.archive.ArchiveFilterResult;
import com.property.distress.archive.ArchiveRotator;
import com.property.distress.core.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File-level entry point: archive filtering, CSV parsing, loading and, once the load has
 * committed, archive rotation.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final IngestionLoader loader;
    private final PropertyLoader propertyLoader;
    private final ArchiveRotator rotator;
    private final CsvRecordReader reader;

    public IngestionPipeline(IngestionLoader loader, PropertyLoader propertyLoader, ArchiveRotator rotator) {
        this(loader, propertyLoader, rotator, new CsvRecordReader());
    }

    public IngestionPipeline(IngestionLoader loader, PropertyLoader propertyLoader, ArchiveRotator rotator,
                             CsvRecordReader reader) {
        this.loader = loader;
        this.propertyLoader = propertyLoader;
        this.rotator = rotator;
        this.reader = reader;
    }

    public IngestionResult ingestCsv(RecordType recordType, Path csv, boolean skipDuplicates) {
        return ingestCsv(recordType, csv, null, skipDuplicates);
    }

    /**
     * Loads a CSV extract. With an {@code archiveDir}, only rows absent from the archived
     * generation are loaded and the archive is rotated after the load succeeds; a failed
     * load leaves the archive untouched.
     *
     * @throws BatchCommitException if the load could not be committed
     */
    public IngestionResult ingestCsv(RecordType recordType, Path csv, Path archiveDir, boolean skipDuplicates) {
        Path source = csv;
        if (archiveDir != null) {
            ArchiveFilterResult filtered = rotator.filterAgainstArchive(csv, archiveDir, recordType);
            source = filtered.output();
        }

        List<SourceRow> rows = reader.read(source);
        log.info("ingest.file_read type={} file={} rows={}", recordType.getKey(), source.getFileName(), rows.size());
        IngestionResult result = loader.loadFromRecords(recordType, rows, skipDuplicates);

        if (archiveDir != null) {
            try {
                rotator.rotate(archiveDir);
            } catch (UncheckedIOException e) {
                // The records are committed; the next run re-filters against the previous generation
                log.warn("archive.rotate_failed dir={} error={}", archiveDir, e.getMessage());
            }
        }
        return result;
    }

    public IngestionResult ingestMasterCsv(Path csv, boolean skipDuplicates) {
        List<SourceRow> rows = reader.read(csv);
        log.info("ingest.file_read type=master file={} rows={}", csv.getFileName(), rows.size());
        return propertyLoader.loadFromRecords(rows, skipDuplicates);
    }
}
