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
import se.devrandom.mimir.ncbi.Credential;
import se.devrandom.mimir.ncbi.CredentialPool;

import java.util.List;

@Configuration
public class HarvestConfig {

    @Bean
    public CredentialPool credentialPool(MimirProperties properties) {
        List<Credential> credentials = properties.getCredentials().stream()
                .map(entry -> new Credential(entry.getIdentity(), entry.getApiKey()))
                .toList();
        return new CredentialPool(credentials,
                properties.getCredentialSelection(),
                properties.getCredentialRotateEvery());
    }
}
