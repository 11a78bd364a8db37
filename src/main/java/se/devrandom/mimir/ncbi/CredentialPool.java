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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.mimir.config.ConfigException;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed set of requester credentials shared by every pipeline.
 * <p>
 * The set never changes after construction, so concurrent draws need no locking.
 * The only mutable state is the subject counter used by {@link CredentialSelection#PER_SUBJECT}
 * to decide when to re-draw the pinned credential.
 */
public class CredentialPool implements CredentialSource {
    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final List<Credential> credentials;
    private final CredentialSelection selection;
    private final int rotateEvery;

    private final AtomicLong subjectCounter = new AtomicLong(0);
    private final AtomicReference<Credential> pinned = new AtomicReference<>();

    public CredentialPool(List<Credential> credentials) {
        this(credentials, CredentialSelection.PER_REQUEST, 1);
    }

    public CredentialPool(List<Credential> credentials, CredentialSelection selection, int rotateEvery) {
        if (credentials == null || credentials.isEmpty()) {
            throw new ConfigException("At least one credential must be configured");
        }
        for (Credential credential : credentials) {
            if (credential == null
                    || credential.identity() == null || credential.identity().isBlank()
                    || credential.apiKey() == null || credential.apiKey().isBlank()) {
                throw new ConfigException("Credentials need both an identity and an api key: " + credential);
            }
        }
        if (rotateEvery < 1) {
            throw new ConfigException("Credential rotation interval must be at least 1, was " + rotateEvery);
        }
        this.credentials = List.copyOf(credentials);
        this.selection = selection == null ? CredentialSelection.PER_REQUEST : selection;
        this.rotateEvery = rotateEvery;

        log.info("CredentialPool created with {} credentials (selection: {}, rotate every {} subjects)",
                this.credentials.size(), this.selection, rotateEvery);
    }

    /**
     * Uniform random draw. Two consecutive calls may return the same credential.
     */
    @Override
    public Credential next() {
        return credentials.get(ThreadLocalRandom.current().nextInt(credentials.size()));
    }

    /**
     * Credential source for one subject's pipeline run.
     * With per-request selection this is the pool itself; with per-subject selection
     * every request of the subject uses the same credential.
     */
    public CredentialSource forSubject() {
        if (selection == CredentialSelection.PER_REQUEST) {
            return this;
        }

        long subjectNumber = subjectCounter.getAndIncrement();
        Credential credential;
        if (subjectNumber % rotateEvery == 0) {
            credential = next();
            pinned.set(credential);
            log.info("Rotated credential to {} after {} subjects", credential.identity(), subjectNumber);
        } else {
            credential = pinned.updateAndGet(current -> current != null ? current : next());
        }
        return () -> credential;
    }

    public int size() {
        return credentials.size();
    }

    public List<Credential> getCredentials() {
        return credentials;
    }
}
