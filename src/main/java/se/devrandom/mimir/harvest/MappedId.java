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

import java.util.Optional;

/**
 * A primary id and, when the upstream knows one, its id in the secondary space.
 *
 * @param malformed the mapping request for this id's chunk returned an unusable body and was given up
 */
public record MappedId(String primaryId, Optional<String> secondaryId, boolean malformed) {

    public static MappedId of(String primaryId, String secondaryId) {
        return new MappedId(primaryId, Optional.ofNullable(secondaryId), false);
    }

    public static MappedId malformed(String primaryId) {
        return new MappedId(primaryId, Optional.empty(), true);
    }

    public boolean isMapped() {
        return secondaryId.isPresent();
    }
}
