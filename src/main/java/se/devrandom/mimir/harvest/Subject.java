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

/**
 * A named query target, e.g. a gene symbol. One subject drives one pipeline run.
 *
 * @param name     the search term as configured
 * @param position zero-based position in the configured subject list
 */
public record Subject(String name, int position) {

    public Subject {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subject name must not be blank");
        }
        name = name.trim();
    }

    /**
     * Exact-phrase search term sent upstream.
     */
    public String searchTerm() {
        return "\"" + name + "\"";
    }

    /**
     * Subject name usable as part of a file name.
     */
    public String fileSafeName() {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
