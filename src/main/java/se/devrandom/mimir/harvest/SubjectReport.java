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
package se.devrandom.mimir.harvest;

import java.time.Duration;
import java.util.List;

/**
 * Everything one pipeline run produced for a subject.
 *
 * @param truncated the search hit the upstream paging limit, so ids may be missing
 * @param primaryCount distinct primary ids found by the search
 * @param mappings one entry per primary id when mapping ran, empty otherwise
 * @param outcomes one entry per downloaded identifier
 * @param error failure description for {@link Status#FAILED}, null otherwise
 */
public record SubjectReport(
        Subject subject,
        Status status,
        boolean truncated,
        int primaryCount,
        List<MappedId> mappings,
        List<FetchOutcome> outcomes,
        Duration duration,
        String error) {

    public enum Status {
        COMPLETED,
        COMPLETED_WITH_ERRORS,
        NO_RESULTS,
        CANCELLED,
        FAILED
    }

    public SubjectReport {
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static SubjectReport failed(Subject subject, Duration duration, String error) {
        return new SubjectReport(subject, Status.FAILED, false, 0, List.of(), List.of(), duration, error);
    }

    public long mappedCount() {
        return mappings.stream().filter(MappedId::isMapped).count();
    }

    public long unmappedCount() {
        return mappings.size() - mappedCount();
    }

    public long persistedCount() {
        return outcomes.stream().filter(FetchOutcome::persisted).count();
    }

    public long failedCount() {
        return outcomes.size() - persistedCount();
    }
}
