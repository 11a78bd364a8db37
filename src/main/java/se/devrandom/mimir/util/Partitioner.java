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
package se.devrandom.mimir.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an ordered list into consecutive chunks of at most {@code chunkSize} items.
 * The split only depends on the input order and the chunk size.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static <T> List<List<T>> partition(List<T> items, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1: " + chunkSize);
        }
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        List<List<T>> chunks = new ArrayList<>((items.size() + chunkSize - 1) / chunkSize);
        for (int start = 0; start < items.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, items.size());
            chunks.add(List.copyOf(items.subList(start, end)));
        }
        return List.copyOf(chunks);
    }
}
