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
package se.devrandom.mimir.batchprocessing;

import org.junit.jupiter.api.Test;
import se.devrandom.mimir.harvest.Subject;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectItemReaderTest {

    @Test
    void readsSubjectsInConfiguredOrderThenNull() {
        SubjectItemReader reader = new SubjectItemReader(List.of("IL19", " IL20 "));

        assertThat(reader.read()).isEqualTo(new Subject("IL19", 0));
        assertThat(reader.read()).isEqualTo(new Subject("IL20", 1));
        assertThat(reader.read()).isNull();
    }

    @Test
    void skipsBlankSubjects() {
        SubjectItemReader reader = new SubjectItemReader(Arrays.asList("IL19", "", null, "IL22"));

        assertThat(reader.remaining()).isEqualTo(2);
        assertThat(reader.read().name()).isEqualTo("IL19");
        assertThat(reader.read().position()).isEqualTo(3);
    }

    @Test
    void noSubjectsConfigured() {
        assertThat(new SubjectItemReader(null).read()).isNull();
    }
}
