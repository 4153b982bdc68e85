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

import java.util.List;

/**
 * A dictionary together with known facts about its minimal automaton.
 */
public interface DictionaryExample {

    /**
     * @return the words of the dictionary, in ascending order and without duplicates
     */
    List<String> getWords();

    /**
     * @return words that are not in the dictionary
     */
    List<String> getRejectedWords();

    /**
     * @return the number of states of the minimal (partial) deterministic automaton accepting the dictionary
     */
    int getMinimalStateCount();
}
