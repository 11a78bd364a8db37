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
 * Outcome of a single {@link ResultSink#store} call.
 *
 * @param location file path or object key written, null on failure
 * @param error    failure description, null on success
 */
public record StoreResult(boolean success, String location, String error) {

    public static StoreResult success(String location) {
        return new StoreResult(true, location, null);
    }

    public static StoreResult failure(String error) {
        return new StoreResult(false, null, error);
    }
}
