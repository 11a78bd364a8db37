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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores each document as {@code <directory>/<identifier>.<extension>}.
 * Content is written to a temporary file in the same directory and moved into place, so a reader
 * never sees a half written document and a second store of the same identifier replaces the first.
 */
public class LocalFileResultSink implements ResultSink {
    private static final Logger log = LoggerFactory.getLogger(LocalFileResultSink.class);

    private final Path directory;
    private final String extension;

    public LocalFileResultSink(Path directory, String extension) {
        this.directory = directory;
        this.extension = extension;
        log.info("Local file sink writing to {}", directory.toAbsolutePath());
    }

    @Override
    public StoreResult store(String identifier, String content) {
        Path target = pathFor(identifier);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".store-", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            move(temp, target);
            log.debug("Saved {} to {}", identifier, target);
            return StoreResult.success(target.toString());
        } catch (IOException e) {
            log.error("Failed to write {} to {}: {}", identifier, target, e.getMessage());
            deleteQuietly(temp);
            return StoreResult.failure("Write failed: " + e.getMessage());
        }
    }

    private void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    Path pathFor(String identifier) {
        return directory.resolve(sanitize(identifier) + "." + extension);
    }

    static String sanitize(String identifier) {
        return identifier.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @Override
    public String describe() {
        return directory.toAbsolutePath().toString();
    }
}
