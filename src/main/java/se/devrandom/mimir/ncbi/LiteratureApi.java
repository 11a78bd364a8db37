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

import java.util.List;
import java.util.Map;

/**
 * The three upstream operations the harvester depends on.
 * Implementations throw {@link UpstreamException} for every kind of failed request.
 */
public interface LiteratureApi {

    /**
     * One page of search results.
     *
     * @return ids in upstream order, empty once the result set is exhausted
     */
    List<String> searchPage(String term, int offset, int pageSize, Credential credential);

    /**
     * Resolves a batch of primary ids into the secondary id space.
     *
     * @return only the ids that have a mapping; unmapped ids are simply absent
     */
    Map<String, String> mapIds(List<String> ids, Credential credential);

    /**
     * Fetches a batch of full-text documents in one request.
     *
     * @return the sub-documents of the batch response, in response order
     */
    List<String> fetchDocuments(List<String> ids, Credential credential);
}
