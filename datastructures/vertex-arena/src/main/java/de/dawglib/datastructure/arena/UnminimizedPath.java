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

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * The chain of vertices of the most recently inserted word that have not yet been proven canonical.
 * <p>
 * Each entry consists of a vertex handle and the label of the transition leading to it from the previous entry (or
 * from the root, for the first entry). The path is used as a stack: the top entry is the most recently created, i.e.
 * deepest, vertex.
 */
public class UnminimizedPath {

    private int[] handles = new int[16];
    private char[] labels = new char[16];
    private int depth;

    public void push(int handle, char incomingLabel) {
        if (depth == handles.length) {
            handles = Arrays.copyOf(handles, depth * 2);
            labels = Arrays.copyOf(labels, depth * 2);
        }
        handles[depth] = handle;
        labels[depth] = incomingLabel;
        depth++;
    }

    /**
     * Removes the top entry.
     *
     * @throws NoSuchElementException
     *         if the path is empty
     */
    public void pop() {
        checkNotEmpty();
        depth--;
    }

    public int topHandle() {
        checkNotEmpty();
        return handles[depth - 1];
    }

    public char topLabel() {
        checkNotEmpty();
        return labels[depth - 1];
    }

    /**
     * Returns the handle of the top entry, or the given fallback if the path is empty.
     *
     * @param fallback
     *         the handle to return for an empty path
     *
     * @return the handle of the deepest unminimized vertex, or {@code fallback}
     */
    public int topHandleOr(int fallback) {
        return depth == 0 ? fallback : handles[depth - 1];
    }

    public int depth() {
        return depth;
    }

    public boolean isEmpty() {
        return depth == 0;
    }

    private void checkNotEmpty() {
        if (depth == 0) {
            throw new NoSuchElementException("The unminimized path is empty");
        }
    }
}
