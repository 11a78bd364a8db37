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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.devrandom.mimir.storage.LocalFileResultSink;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MimirPropertiesTest {

    private MimirProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MimirProperties();
        properties.setCredentials(List.of(new MimirProperties.CredentialEntry("a@example.org", "key-a")));
    }

    @Test
    void defaultsAreValid() {
        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getDownload().getChunkSize()).isEqualTo(100);
        assertThat(properties.getMapping().getChunkSize()).isEqualTo(200);
        assertThat(properties.getSearch().getMaxOffset()).isEqualTo(9999);
    }

    @Test
    void rejectsMissingCredentials() {
        properties.setCredentials(List.of());

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigException.class)
                .hasMessageContaining("mimir.credentials");
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        properties.getDownload().setChunkSize(0);

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigException.class)
                .hasMessageContaining("mimir.download.chunk-size");
    }

    @Test
    void rejectsZeroConcurrency() {
        properties.getDownload().setConcurrency(0);

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsNegativeDelay() {
        properties.setRequestDelay(Duration.ofMillis(-1));

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void s3SinkNeedsBucket() {
        properties.getSink().setType(MimirProperties.SinkType.S3);

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigException.class)
                .hasMessageContaining("bucket");
    }

    @Test
    void localSinkIsTheDefault() {
        assertThat(new StorageConfig().resultSink(properties)).isInstanceOf(LocalFileResultSink.class);
    }

    @Test
    void credentialPoolIsBuiltFromProperties() {
        assertThat(new HarvestConfig().credentialPool(properties).size()).isEqualTo(1);
    }
}
