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
package se.devrandom.mimir.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import se.devrandom.mimir.storage.LocalFileResultSink;
import se.devrandom.mimir.storage.ResultSink;
import se.devrandom.mimir.storage.S3ResultSink;

import java.nio.file.Paths;

@Configuration
public class StorageConfig {

    @Bean
    public ResultSink resultSink(MimirProperties properties) {
        MimirProperties.Sink sink = properties.getSink();
        if (sink.getType() == null) {
            throw new ConfigException("mimir.sink.type must be local or s3");
        }
        return switch (sink.getType()) {
            case LOCAL -> new LocalFileResultSink(Paths.get(sink.getLocal().getDirectory()), sink.getExtension());
            case S3 -> new S3ResultSink(
                    sink.getS3().getBucket(),
                    sink.getS3().getPrefix(),
                    sink.getS3().getRegion(),
                    sink.getExtension());
        };
    }
}
