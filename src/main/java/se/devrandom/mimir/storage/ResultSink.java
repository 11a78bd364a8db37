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
package se.devrandom.mimir.storage;

/**
 * Durable destination for fetched documents, one document per identifier.
 * <p>
 * Implementations must be safe for concurrent use, must overwrite when the same identifier is
 * stored twice, and must report storage problems through {@link StoreResult} instead of throwing.
 */
public interface ResultSink {

    StoreResult store(String identifier, String content);

    /**
     * Human readable target, used in log lines.
     */
    String describe();
}
