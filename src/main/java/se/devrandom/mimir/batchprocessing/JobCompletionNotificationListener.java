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
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.harvest.SubjectReport;
import se.devrandom.mimir.storage.HarvestStatisticsService;
import se.devrandom.mimir.storage.OutcomeReportWriter;

import java.io.IOException;
import java.util.List;

@Component
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class JobCompletionNotificationListener implements JobExecutionListener {
    private static final Logger log = LoggerFactory.getLogger(JobCompletionNotificationListener.class);

    private final ApplicationContext applicationContext;
    private final HarvestStatisticsService statisticsService;
    private final OutcomeReportWriter reportWriter;

    public JobCompletionNotificationListener(ApplicationContext applicationContext,
                                             HarvestStatisticsService statisticsService,
                                             OutcomeReportWriter reportWriter) {
        this.applicationContext = applicationContext;
        this.statisticsService = statisticsService;
        this.reportWriter = reportWriter;
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("Starting harvest job");
        statisticsService.markJobStarted();
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        boolean completed = jobExecution.getStatus() == BatchStatus.COMPLETED;
        if (completed) {
            log.info("!!! JOB FINISHED! Writing summary");
        } else {
            log.error("!!! JOB {}! Check logs for errors", jobExecution.getStatus());
        }

        List<SubjectReport> reports = statisticsService.getReports();
        try {
            reportWriter.writeSummary(reports);
        } catch (IOException e) {
            log.error("Failed to write harvest summary: {}", e.getMessage(), e);
        }
        try {
            reportWriter.writeSubjects(reports);
        } catch (IOException e) {
            log.error("Failed to write subject status report: {}", e.getMessage(), e);
        }

        statisticsService.markJobComplete();
        String summary = statisticsService.generateSummaryReport();

        log.info("\n" + "=".repeat(80));
        log.info(completed ? "HARVEST JOB SUMMARY" : "HARVEST JOB SUMMARY (FAILED)");
        log.info("=".repeat(80));
        log.info(summary);
        log.info("=".repeat(80));

        int exitCode = completed ? 0 : 1;
        // Schedule shutdown after Spring Batch has finished updating job metadata
        new Thread(() -> {
            try {
                Thread.sleep(1000);
                log.info("Shutting down application with exit code {}...", exitCode);
                int code = SpringApplication.exit(applicationContext, () -> exitCode);
                System.exit(code);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Shutdown interrupted", e);
            }
        }, "mimir-shutdown").start();
    }
}
