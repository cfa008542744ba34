package com.property.distress.archive;

import com.property.distress.core.model.RecordType;
import com.property.distress.ingest.CsvRecordReader;
import com.property.distress.ingest.IngestionConfigurationException;
import com.property.distress.logging.LogContext;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Keeps two generations of exports per destination directory so each scraper run only
 * forwards rows it has not exported before.
 *
 * <ul>
 *   <li>{@code old/}: the last generation whose rows are confirmed persisted</li>
 *   <li>{@code new/}: the candidate generation of the current run</li>
 * </ul>
 *
 * <p>{@link #rotate(Path)} must only run after the candidate rows are committed; until then
 * {@code old/} is never touched.</p>
 */
public class ArchiveRotator {
    private static final Logger log = LoggerFactory.getLogger(ArchiveRotator.class);

    static final String OLD_DIR = "old";
    static final String NEW_DIR = "new";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .build();

    // Raw scraper downloads that share the folder but are not archive generations
    private static final List<PathMatcher> EXCLUDED = Stream.of(
                    "CivilFiling_*.csv", "ProbateFiling_*.csv", "*realforeclose_*.csv", "*_temp.csv")
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .toList();

    private final Clock clock;

    public ArchiveRotator() {
        this(Clock.systemDefaultZone());
    }

    public ArchiveRotator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Writes the rows of {@code freshCsv} whose identity value is absent from every archived
     * file to {@code new/<stem>_<yyyyMMdd>.csv}, replacing any leftover candidates.
     *
     * @throws IngestionConfigurationException if the fresh export lacks the identity column
     * @throws UncheckedIOException            if the fresh export cannot be read or the output written
     */
    public ArchiveFilterResult filterAgainstArchive(Path freshCsv, Path destinationDir, RecordType recordType) {
        String identityColumn = recordType.getIdentityColumn();
        try (LogContext ignored = LogContext.forArchive(destinationDir.toString())) {
            Set<String> archived = archivedKeys(destinationDir.resolve(OLD_DIR), identityColumn);
            Path newDir = destinationDir.resolve(NEW_DIR);
            Files.createDirectories(newDir);
            clearDirectory(newDir);
            Path output = newDir.resolve(outputName(freshCsv));

            long total = 0;
            long kept = 0;
            try (Reader reader = CsvRecordReader.open(freshCsv);
                 CSVParser parser = READ_FORMAT.parse(reader)) {
                List<String> headers = parser.getHeaderNames();
                if (!headers.contains(identityColumn)) {
                    throw new IngestionConfigurationException("Export " + freshCsv.getFileName()
                            + " lacks identity column '" + identityColumn + "'");
                }
                try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
                     CSVPrinter printer = CSVFormat.DEFAULT.builder()
                             .setHeader(headers.toArray(String[]::new))
                             .build()
                             .print(writer)) {
                    for (CSVRecord record : parser) {
                        total++;
                        String key = record.isMapped(identityColumn) && record.isSet(identityColumn)
                                ? record.get(identityColumn).trim() : "";
                        if (!key.isEmpty() && archived.contains(key)) {
                            continue;
                        }
                        printer.printRecord(record.toList());
                        kept++;
                    }
                }
            }

            ArchiveFilterResult result = new ArchiveFilterResult(output, total, kept, total - kept);
            log.info("archive.filtered type={} total={} kept={} duplicates={} output={}",
                    recordType.getKey(), total, kept, result.duplicates(), output.getFileName());
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to filter " + freshCsv + " against " + destinationDir, e);
        }
    }

    /**
     * Promotes the candidate generation: every {@code new/} file moves into {@code old/}, then
     * {@code old/} files that are not part of the new generation are deleted.
     *
     * @return false when {@code new/} has nothing to promote
     * @throws UncheckedIOException on any file-system failure
     */
    public boolean rotate(Path destinationDir) {
        Path newDir = destinationDir.resolve(NEW_DIR);
        Path oldDir = destinationDir.resolve(OLD_DIR);
        try (LogContext ignored = LogContext.forArchive(destinationDir.toString())) {
            List<Path> candidates = csvFiles(newDir);
            if (candidates.isEmpty()) {
                log.info("archive.rotate_skipped reason=empty_new_generation");
                return false;
            }
            Files.createDirectories(oldDir);

            Set<Path> promoted = new HashSet<>();
            for (Path candidate : candidates) {
                Path target = oldDir.resolve(candidate.getFileName());
                Files.move(candidate, target, StandardCopyOption.REPLACE_EXISTING);
                promoted.add(target.getFileName());
            }
            int deleted = 0;
            for (Path stale : csvFiles(oldDir)) {
                if (!promoted.contains(stale.getFileName()) && !isExcluded(stale)) {
                    Files.delete(stale);
                    deleted++;
                }
            }
            log.info("archive.rotated promoted={} deleted={}", promoted.size(), deleted);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rotate archive in " + destinationDir, e);
        }
    }

    String outputName(Path freshCsv) {
        String name = freshCsv.getFileName().toString();
        String stem = name.toLowerCase(Locale.ROOT).endsWith(".csv") ? name.substring(0, name.length() - 4) : name;
        stem = stem.replace("_temp", "").replace("_download", "");
        return stem + "_" + LocalDate.now(clock).format(STAMP) + ".csv";
    }

    private Set<String> archivedKeys(Path oldDir, String identityColumn) throws IOException {
        Set<String> keys = new HashSet<>();
        for (Path file : csvFiles(oldDir)) {
            if (isExcluded(file)) {
                continue;
            }
            try (Reader reader = CsvRecordReader.open(file);
                 CSVParser parser = READ_FORMAT.parse(reader)) {
                if (!parser.getHeaderNames().contains(identityColumn)) {
                    log.warn("archive.file_skipped file={} reason=missing_identity_column", file.getFileName());
                    continue;
                }
                for (CSVRecord record : parser) {
                    if (record.isSet(identityColumn)) {
                        String key = record.get(identityColumn).trim();
                        if (!key.isEmpty()) {
                            keys.add(key);
                        }
                    }
                }
            } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
                log.warn("archive.file_skipped file={} error={}", file.getFileName(), e.getMessage());
            }
        }
        return keys;
    }

    private static List<Path> csvFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .forEach(files::add);
        }
        return files;
    }

    private static void clearDirectory(Path dir) throws IOException {
        for (Path leftover : csvFiles(dir)) {
            log.info("archive.leftover_removed file={}", leftover.getFileName());
            Files.delete(leftover);
        }
    }

    static boolean isExcluded(Path file) {
        Path name = file.getFileName();
        return EXCLUDED.stream().anyMatch(matcher -> matcher.matches(name));
    }
}
