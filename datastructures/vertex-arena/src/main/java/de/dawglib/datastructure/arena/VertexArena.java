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

import com.google.common.base.Preconditions;
import net.automatalib.commons.smartcollections.ResizingArrayStorage;

/**
 * Append-only storage of {@link Vertex vertices}, addressed by stable integer handles.
 * <p>
 * The arena is the sole owner of all vertices. Vertices are never removed: a vertex that has been replaced by an
 * equivalent canonical one simply stays behind as an unreferenced slot. The root vertex is created together with the
 * arena and always has handle {@link #ROOT}.
 */
public final class VertexArena {

    public static final int ROOT = 0;

    /**
     * Handle value signaling the absence of a vertex, e.g. for a missing transition.
     */
    public static final int NO_VERTEX = -1;

    private static final int DEFAULT_INITIAL_CAPACITY = 64;

    private final ResizingArrayStorage<Vertex> storage;
    private int size;

    public VertexArena() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public VertexArena(int initialCapacity) {
        Preconditions.checkArgument(initialCapacity > 0, "Initial capacity must be positive");
        this.storage = new ResizingArrayStorage<>(Vertex.class, initialCapacity);
        createVertex();
    }

    /**
     * Allocates a new, empty, non-accepting vertex.
     *
     * @return the handle of the new vertex
     */
    public int createVertex() {
        storage.ensureCapacity(size + 1);
        storage.array[size] = new Vertex();
        return size++;
    }

    public Vertex get(int handle) {
        Preconditions.checkElementIndex(handle, size);
        return storage.array[handle];
    }

    public Vertex getRoot() {
        return storage.array[ROOT];
    }

    /**
     * Returns the number of allocated vertices, including the root and vertices that are no longer referenced.
     *
     * @return the number of allocated vertices
     */
    public int size() {
        return size;
    }
}
