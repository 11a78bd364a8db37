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

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import se.devrandom.mimir.config.MimirProperties;
import se.devrandom.mimir.harvest.Subject;
import se.devrandom.mimir.harvest.SubjectPipeline;
import se.devrandom.mimir.harvest.SubjectReport;
import se.devrandom.mimir.storage.HarvestStatisticsService;
import se.devrandom.mimir.storage.OutcomeReportWriter;

@Configuration
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class BatchConfiguration {

    private final MimirProperties properties;

    @Autowired
    public BatchConfiguration(MimirProperties properties) {
        this.properties = properties;
    }

    @Bean
    public SubjectItemReader subjectItemReader() {
        return new SubjectItemReader(properties.getSubjects());
    }

    @Bean
    public SubjectPipelineProcessor subjectPipelineProcessor(SubjectPipeline pipeline) {
        return new SubjectPipelineProcessor(pipeline);
    }

    @Bean
    public SubjectReportWriter subjectReportWriter(OutcomeReportWriter reportWriter,
                                                   HarvestStatisticsService statisticsService) {
        return new SubjectReportWriter(reportWriter, statisticsService);
    }

    @Bean
    public Job harvestJob(JobRepository jobRepository,
                          JobCompletionNotificationListener listener,
                          Step harvestStep) {
        return new JobBuilder("harvestJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(listener)
                .start(harvestStep)
                .build();
    }

    @Bean
    public Step harvestStep(JobRepository jobRepository,
                            PlatformTransactionManager transactionManager,
                            SubjectItemReader subjectItemReader,
                            SubjectPipelineProcessor subjectPipelineProcessor,
                            SubjectReportWriter subjectReportWriter) {
        int subjectConcurrency = properties.getSubjectConcurrency();
        SimpleAsyncTaskExecutor taskExecutor = new SimpleAsyncTaskExecutor("mimir-subject-");
        taskExecutor.setConcurrencyLimit(subjectConcurrency);

        // one subject per chunk, so each subject is processed and reported on its own thread
        return new StepBuilder("harvestStep", jobRepository)
                .<Subject, SubjectReport>chunk(1, transactionManager)
                .reader(subjectItemReader)
                .processor(subjectPipelineProcessor)
                .writer(subjectReportWriter)
                .taskExecutor(taskExecutor)
                .throttleLimit(subjectConcurrency)
                .build();
    }
}
