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

import com.google.common.base.Preconditions;

/**
 * A vertex of a word graph: a transition table from single characters to target vertex handles, plus an accepting
 * flag.
 * <p>
 * Transitions are kept sorted by label, so two vertices with the same transitions always expose them in the same
 * order. Once a vertex has been registered as canonical (see {@link VertexRegistry}), it can no longer be modified.
 */
public final class Vertex {

    private static final int INITIAL_CAPACITY = 2;

    private char[] labels = new char[INITIAL_CAPACITY];
    private int[] targets = new int[INITIAL_CAPACITY];
    private int degree;

    private boolean accepting;
    private boolean canonical;

    Vertex() {}

    public boolean isAccepting() {
        return accepting;
    }

    public void markAccepting() {
        Preconditions.checkState(!canonical, "Canonical vertices are immutable");
        accepting = true;
    }

    public boolean isCanonical() {
        return canonical;
    }

    void markCanonical() {
        canonical = true;
    }

    /**
     * Returns the number of outgoing transitions.
     *
     * @return the out-degree of this vertex
     */
    public int getDegree() {
        return degree;
    }

    /**
     * Returns the label of the {@code index}-th transition, in ascending label order.
     *
     * @param index
     *         the transition index, {@code 0 <= index < getDegree()}
     *
     * @return the transition label
     */
    public char getLabel(int index) {
        Preconditions.checkElementIndex(index, degree);
        return labels[index];
    }

    /**
     * Returns the target handle of the {@code index}-th transition, in ascending label order.
     *
     * @param index
     *         the transition index, {@code 0 <= index < getDegree()}
     *
     * @return the handle of the transition target
     */
    public int getTarget(int index) {
        Preconditions.checkElementIndex(index, degree);
        return targets[index];
    }

    /**
     * Looks up the target of the transition labeled with the given character.
     *
     * @param label
     *         the transition label
     *
     * @return the target handle, or {@link VertexArena#NO_VERTEX} if there is no such transition
     */
    public int getTransition(char label) {
        final int idx = Arrays.binarySearch(labels, 0, degree, label);
        return idx >= 0 ? targets[idx] : VertexArena.NO_VERTEX;
    }

    /**
     * Sets (or replaces) the target of the transition labeled with the given character.
     *
     * @param label
     *         the transition label
     * @param target
     *         the target handle
     */
    public void setTransition(char label, int target) {
        Preconditions.checkState(!canonical, "Canonical vertices are immutable");
        Preconditions.checkArgument(target >= 0, "Invalid target handle %s", target);

        final int idx = Arrays.binarySearch(labels, 0, degree, label);
        if (idx >= 0) {
            targets[idx] = target;
            return;
        }

        final int insertionPoint = -idx - 1;
        if (degree == labels.length) {
            labels = Arrays.copyOf(labels, degree * 2);
            targets = Arrays.copyOf(targets, degree * 2);
        }
        System.arraycopy(labels, insertionPoint, labels, insertionPoint + 1, degree - insertionPoint);
        System.arraycopy(targets, insertionPoint, targets, insertionPoint + 1, degree - insertionPoint);
        labels[insertionPoint] = label;
        targets[insertionPoint] = target;
        degree++;
    }

    VertexSignature signature() {
        return new VertexSignature(accepting, Arrays.copyOf(labels, degree), Arrays.copyOf(targets, degree));
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(accepting ? "((" : "(");
        for (int i = 0; i < degree; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(labels[i]).append(" -> ").append(targets[i]);
        }
        return sb.append(accepting ? "))" : ")").toString();
    }
}
