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
package se.devrandom.mimir.batchprocessing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import se.devrandom.mimir.harvest.SubjectReport;
import se.devrandom.mimir.storage.HarvestStatisticsService;
import se.devrandom.mimir.storage.OutcomeReportWriter;

import java.io.IOException;

/**
 * Records each finished subject in the job statistics and writes its CSV reports.
 * A report that cannot be written is logged; it does not fail the remaining subjects.
 */
public class SubjectReportWriter implements ItemWriter<SubjectReport> {
    private static final Logger log = LoggerFactory.getLogger(SubjectReportWriter.class);

    private final OutcomeReportWriter reportWriter;
    private final HarvestStatisticsService statisticsService;

    public SubjectReportWriter(OutcomeReportWriter reportWriter, HarvestStatisticsService statisticsService) {
        this.reportWriter = reportWriter;
        this.statisticsService = statisticsService;
    }

    @Override
    public void write(Chunk<? extends SubjectReport> chunk) {
        for (SubjectReport report : chunk) {
            statisticsService.recordSubject(report);
            try {
                reportWriter.writeMapping(report);
                reportWriter.writeOutcomes(report);
            } catch (IOException e) {
                log.error("[{}] Failed to write reports: {}", report.subject().name(), e.getMessage(), e);
            }
        }
    }
}
