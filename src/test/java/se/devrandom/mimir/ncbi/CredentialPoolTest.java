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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.devrandom.mimir.config.ConfigException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialPoolTest {

    private static final List<Credential> CREDENTIALS = List.of(
            new Credential("a@example.org", "key-a"),
            new Credential("b@example.org", "key-b"),
            new Credential("c@example.org", "key-c"));

    @Test
    @DisplayName("Empty credential set is a configuration error")
    void rejectsEmptySet() {
        assertThatThrownBy(() -> new CredentialPool(List.of()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsCredentialWithoutKey() {
        assertThatThrownBy(() -> new CredentialPool(List.of(new Credential("a@example.org", " "))))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsNonPositiveRotation() {
        assertThatThrownBy(() -> new CredentialPool(CREDENTIALS, CredentialSelection.PER_SUBJECT, 0))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Draws only ever return members of the configured set")
    void drawsFromConfiguredSet() {
        CredentialPool pool = new CredentialPool(CREDENTIALS);
        Set<Credential> seen = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            seen.add(pool.next());
        }

        assertThat(CREDENTIALS).containsAll(seen);
        assertThat(seen).hasSize(3);
    }

    @Test
    void perRequestSelectionReturnsThePoolItself() {
        CredentialPool pool = new CredentialPool(CREDENTIALS);

        assertThat(pool.forSubject()).isSameAs(pool);
    }

    @Test
    @DisplayName("Per-subject selection pins one credential for every request of a subject")
    void perSubjectSelectionPinsCredential() {
        CredentialPool pool = new CredentialPool(CREDENTIALS, CredentialSelection.PER_SUBJECT, 2);

        CredentialSource first = pool.forSubject();
        Credential pinned = first.next();
        for (int i = 0; i < 20; i++) {
            assertThat(first.next()).isEqualTo(pinned);
        }
        assertThat(pool.forSubject().next()).isEqualTo(pinned);
    }

    @Test
    void toStringHidesApiKey() {
        assertThat(new Credential("a@example.org", "secret").toString())
                .contains("a@example.org")
                .doesNotContain("secret");
    }

    @Test
    void setIsCopiedOnConstruction() {
        List<Credential> mutable = new java.util.ArrayList<>(CREDENTIALS);
        CredentialPool pool = new CredentialPool(mutable);
        mutable.clear();

        assertThat(pool.size()).isEqualTo(3);
    }
}
