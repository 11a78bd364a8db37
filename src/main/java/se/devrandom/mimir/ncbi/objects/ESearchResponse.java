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
package se.devrandom.mimir.ncbi.objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON body of {@code esearch.fcgi?retmode=json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ESearchResponse {
    public ESearchResult esearchresult;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ESearchResult {
        public String count;
        public String retmax;
        public String retstart;
        public List<String> idlist;
        @JsonProperty("ERROR")
        public String error;
    }
}
