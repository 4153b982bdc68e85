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

import java.util.Arrays;

/**
 * {@code {tap, taps, top, tops}}: a trie needs 8 states, the minimal automaton only 5, since the sub-trees behind
 * "ta" and "to" coincide.
 */
public class ExampleSharedSuffixes extends DefaultDictionaryExample {

    public ExampleSharedSuffixes() {
        super(Arrays.asList("tap", "taps", "top", "tops"), Arrays.asList("t", "ta", "to", "tip", "tapss", "opt"), 5);
    }

    public static ExampleSharedSuffixes createExample() {
        return new ExampleSharedSuffixes();
    }
}
