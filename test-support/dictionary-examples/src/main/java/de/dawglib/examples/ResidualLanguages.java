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
package de.dawglib.examples;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Brute-force computation of the size of the minimal automaton of a finite language.
 * <p>
 * By the Myhill-Nerode theorem, the states of the minimal partial deterministic automaton correspond one-to-one to the
 * distinct non-empty residual languages {@code u^-1 L = { v | uv in L }}, where {@code u} ranges over the prefixes of
 * the words of {@code L}. The initial state (for {@code u = ""}) is always counted, even for an empty language.
 */
public final class ResidualLanguages {

    private ResidualLanguages() {
        // prevent instantiation
    }

    public static int countStates(Collection<String> language) {
        final Map<String, Set<String>> residuals = new HashMap<>();
        residuals.put("", new TreeSet<>());

        for (String word : language) {
            for (int i = 0; i <= word.length(); i++) {
                residuals.computeIfAbsent(word.substring(0, i), k -> new TreeSet<>()).add(word.substring(i));
            }
        }

        return new HashSet<>(residuals.values()).size();
    }
}
