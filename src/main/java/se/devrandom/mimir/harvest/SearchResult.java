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

import java.util.List;

/**
 * Primary ids collected for one subject.
 *
 * @param ids          ids in page order, duplicates kept
 * @param truncated    the upstream paging limit was reached, more results may exist
 * @param cancelled    the search stopped early because the subject was cancelled
 * @param pagesFetched number of successful page requests
 */
public record SearchResult(List<String> ids, boolean truncated, boolean cancelled, int pagesFetched) {

    public SearchResult {
        ids = List.copyOf(ids);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
