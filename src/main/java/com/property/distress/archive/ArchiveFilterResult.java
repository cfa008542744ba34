package com.property.distress.archive;

import java.nio.file.Path;

/**
 * Outcome of filtering a fresh export against the archived generation.
 *
 * @param output     the candidate file written under {@code new/}
 * @param total      rows in the fresh export
 * @param kept       rows absent from the archive and written to {@code output}
 * @param duplicates rows already present in the archive
 */
public record ArchiveFilterResult(Path output, long total, long kept, long duplicates) {
}
