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

/**
 * Structural key of a vertex: its accepting flag together with its ordered (label, target handle) pairs.
 * <p>
 * Targets are compared by handle, not by recursively comparing the target vertices. Two signatures are therefore only
 * meaningful to compare if all targets involved are canonical.
 */
final class VertexSignature {

    private final boolean accepting;
    private final char[] labels;
    private final int[] targets;
    private final int hash;

    VertexSignature(boolean accepting, char[] labels, int[] targets) {
        this.accepting = accepting;
        this.labels = labels;
        this.targets = targets;

        int h = Boolean.hashCode(accepting);
        h = 31 * h + Arrays.hashCode(labels);
        h = 31 * h + Arrays.hashCode(targets);
        this.hash = h;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VertexSignature)) {
            return false;
        }

        final VertexSignature that = (VertexSignature) o;
        return hash == that.hash && accepting == that.accepting && Arrays.equals(labels, that.labels) &&
               Arrays.equals(targets, that.targets);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
