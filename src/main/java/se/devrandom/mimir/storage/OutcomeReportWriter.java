/*
 * Mimir - Literature Harvester
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.mimir.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.config.MimirProperties;
import se.devrandom.mimir.harvest.FetchOutcome;
import se.devrandom.mimir.harvest.MappedId;
import se.devrandom.mimir.harvest.SubjectReport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes the per-subject and aggregate CSV reports.
 */
@Service
public class OutcomeReportWriter {
    private static final Logger log = LoggerFactory.getLogger(OutcomeReportWriter.class);

    static final String MAPPING_HEADER = "primary_id,secondary_id,mapping_error";
    static final String OUTCOME_HEADER = "subject,identifier,persisted,failure,error";
    static final String SUBJECTS_HEADER = "subject,status,truncated,primary_ids,mapped,unmapped,persisted,failed,error";
    static final String SUMMARY_FILE = "harvest_summary.csv";
    static final String SUBJECTS_FILE = "harvest_subjects.csv";

    private final Path directory;

    @Autowired
    public OutcomeReportWriter(MimirProperties properties) {
        this(Paths.get(properties.getReport().getDirectory()));
    }

    public OutcomeReportWriter(Path directory) {
        this.directory = directory;
    }

    /**
     * Writes {@code <subject>_id_mapping.csv}. Nothing is written when mapping did not run.
     */
    public Path writeMapping(SubjectReport report) throws IOException {
        if (report.mappings().isEmpty()) {
            return null;
        }
        Path path = directory.resolve(report.subject().fileSafeName() + "_id_mapping.csv");
        Files.createDirectories(directory);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(MAPPING_HEADER);
            writer.newLine();
            for (MappedId mapped : report.mappings()) {
                writer.write(row(
                        mapped.primaryId(),
                        mapped.secondaryId().orElse(""),
                        mappingError(mapped)));
                writer.newLine();
            }
        }
        log.info("[{}] Wrote id mapping report with {} rows to {}",
                report.subject().name(), report.mappings().size(), path);
        return path;
    }

    /**
     * Writes {@code <subject>_outcomes.csv}, one row per downloaded identifier.
     */
    public Path writeOutcomes(SubjectReport report) throws IOException {
        Path path = directory.resolve(report.subject().fileSafeName() + "_outcomes.csv");
        Files.createDirectories(directory);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(OUTCOME_HEADER);
            writer.newLine();
            writeOutcomeRows(writer, report);
        }
        log.info("[{}] Wrote outcome report with {} rows to {}",
                report.subject().name(), report.outcomes().size(), path);
        return path;
    }

    /**
     * Writes {@code harvest_summary.csv} with the outcome rows of every subject.
     */
    public Path writeSummary(List<SubjectReport> reports) throws IOException {
        Path path = directory.resolve(SUMMARY_FILE);
        Files.createDirectories(directory);
        int rows = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(OUTCOME_HEADER);
            writer.newLine();
            for (SubjectReport report : reports) {
                writeOutcomeRows(writer, report);
                rows += report.outcomes().size();
            }
        }
        log.info("Wrote harvest summary with {} rows for {} subjects to {}", rows, reports.size(), path);
        return path;
    }

    /**
     * Writes {@code harvest_subjects.csv}, one row per subject with its final status, so subjects
     * without outcome rows (no results, cancelled, failed) and truncated searches show up in the reports too.
     */
    public Path writeSubjects(List<SubjectReport> reports) throws IOException {
        Path path = directory.resolve(SUBJECTS_FILE);
        Files.createDirectories(directory);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(SUBJECTS_HEADER);
            writer.newLine();
            for (SubjectReport report : reports) {
                writer.write(row(
                        report.subject().name(),
                        report.status().name(),
                        String.valueOf(report.truncated()),
                        String.valueOf(report.primaryCount()),
                        String.valueOf(report.mappedCount()),
                        String.valueOf(report.unmappedCount()),
                        String.valueOf(report.persistedCount()),
                        String.valueOf(report.failedCount()),
                        report.error()));
                writer.newLine();
            }
        }
        log.info("Wrote subject status report for {} subjects to {}", reports.size(), path);
        return path;
    }

    private void writeOutcomeRows(BufferedWriter writer, SubjectReport report) throws IOException {
        for (FetchOutcome outcome : report.outcomes()) {
            writer.write(row(
                    report.subject().name(),
                    outcome.identifier(),
                    String.valueOf(outcome.persisted()),
                    outcome.failure() == null ? "" : outcome.failure().name(),
                    outcome.error() == null ? "" : outcome.error()));
            writer.newLine();
        }
    }

    private static String mappingError(MappedId mapped) {
        if (mapped.malformed()) {
            return "malformed response";
        }
        return mapped.isMapped() ? "" : "no mapping";
    }

    static String row(String... fields) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(fields[i]));
        }
        return line.toString();
    }

    static String escape(String field) {
        if (field == null) {
            return "";
        }
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
