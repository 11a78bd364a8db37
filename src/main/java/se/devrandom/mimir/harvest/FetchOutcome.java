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
 * Final result for one identifier handed to the downloader.
 */
public record FetchOutcome(String identifier, boolean persisted, FailureKind failure, String error) {

    public enum FailureKind {
        TRANSPORT,       // fetch kept failing (network, status, unparseable body) until retries ran out
        COUNT_MISMATCH,  // response document count never matched the requested ids
        SINK,            // document fetched but the sink could not store it
        TIMEOUT,         // chunk did not finish within the chunk timeout
        CANCELLED        // subject cancelled before the chunk started
    }

    public static FetchOutcome persisted(String identifier) {
        return new FetchOutcome(identifier, true, null, null);
    }

    public static FetchOutcome failed(String identifier, FailureKind failure, String error) {
        return new FetchOutcome(identifier, false, failure, error);
    }

    public boolean isFailed() {
        return !persisted;
    }
}
