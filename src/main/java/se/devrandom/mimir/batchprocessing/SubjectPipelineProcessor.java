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

import org.springframework.batch.item.ItemProcessor;
import se.devrandom.mimir.harvest.Subject;
import se.devrandom.mimir.harvest.SubjectPipeline;
import se.devrandom.mimir.harvest.SubjectReport;

public class SubjectPipelineProcessor implements ItemProcessor<Subject, SubjectReport> {

    private final SubjectPipeline pipeline;

    public SubjectPipelineProcessor(SubjectPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public SubjectReport process(Subject subject) {
        return pipeline.run(subject);
    }
}
