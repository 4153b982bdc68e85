/* Copyright (C) 2013-2023 TU Dortmund
 * This file is part of DawgLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dawglib.datastructure.arena;

import java.util.HashMap;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deduplicating store of canonical vertices, keyed by their {@link VertexSignature structure}.
 * <p>
 * Registering a vertex makes it canonical, i.e. immutable and the unique representative of its equivalence class.
 * Entries are never removed. Lookups compare transition targets by handle, so callers must only look up vertices whose
 * successors are all canonical already.
 */
public class VertexRegistry {

    private final VertexArena arena;
    private final Map<VertexSignature, Integer> canonicalVertices = new HashMap<>();

    public VertexRegistry(VertexArena arena) {
        this.arena = arena;
    }

    /**
     * Looks for a registered vertex that is equivalent to the vertex with the given handle.
     *
     * @param handle
     *         the handle of the vertex to look up
     *
     * @return the handle of the equivalent canonical vertex, or {@code null} if there is none
     */
    public @Nullable Integer findEquivalent(int handle) {
        return canonicalVertices.get(arena.get(handle).signature());
    }

    /**
     * Returns the canonical representative of the vertex with the given handle, registering the vertex itself if no
     * equivalent vertex exists yet.
     *
     * @param handle
     *         the handle of the vertex to canonicalize
     *
     * @return the handle of the canonical representative
     */
    public int canonicalize(int handle) {
        final Vertex vertex = arena.get(handle);
        final Integer existing = canonicalVertices.putIfAbsent(vertex.signature(), handle);
        if (existing != null) {
            return existing;
        }
        vertex.markCanonical();
        return handle;
    }

    public int size() {
        return canonicalVertices.size();
    }
}
