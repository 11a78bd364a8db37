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
 * One batch of identifiers fetched with a single upstream request.
 *
 * @param index one-based chunk number within the subject, used in log lines
 * @param ids   the identifiers, in request order
 */
public record DocumentChunk(int index, List<String> ids) {

    public DocumentChunk {
        ids = List.copyOf(ids);
    }

    public int size() {
        return ids.size();
    }
}
