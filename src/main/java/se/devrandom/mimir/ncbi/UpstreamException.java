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
package se.devrandom.mimir.ncbi;

/**
 * A request to the literature API failed: transport error, non-success status or unusable body.
 * Always considered transient by the retry policies.
 */
public class UpstreamException extends RuntimeException {
    private final int statusCode;

    public UpstreamException(String message) {
        this(message, -1, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status of the failed response, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
