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
import org.springframework.batch.item.ItemReader;
import se.devrandom.mimir.harvest.Subject;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands out the configured subjects one at a time. Safe for the multi-threaded step.
 */
public class SubjectItemReader implements ItemReader<Subject> {
    private static final Logger log = LoggerFactory.getLogger(SubjectItemReader.class);

    private final List<Subject> subjects;

    public SubjectItemReader(List<String> subjectNames) {
        this.subjects = new ArrayList<>();
        if (subjectNames == null) {
            return;
        }
        for (int i = 0; i < subjectNames.size(); i++) {
            String name = subjectNames.get(i);
            if (name == null || name.isBlank()) {
                log.warn("Ignoring blank subject at position {}", i);
                continue;
            }
            subjects.add(new Subject(name, i));
        }
        log.info("Queued {} subjects", subjects.size());
    }

    @Override
    public synchronized Subject read() {
        if (!subjects.isEmpty()) {
            return subjects.remove(0);
        }
        return null;
    }

    public synchronized int remaining() {
        return subjects.size();
    }
}
