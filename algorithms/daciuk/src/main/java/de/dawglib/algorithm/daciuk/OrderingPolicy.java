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
package de.dawglib.algorithm.daciuk;

/**
 * Controls how {@link IncrementalDawgBuilder} treats the requirement that dictionary words arrive in ascending order.
 */
public enum OrderingPolicy {

    /**
     * Every word is compared against its predecessor, and a word that sorts before it is rejected with an {@link
     * de.dawglib.exception.UnsortedInputException}. Repeating the previous word is allowed.
     */
    STRICT,

    /**
     * Input order is not checked. If the words are not sorted, construction still terminates, but the resulting
     * automaton is unspecified and in general does not accept the inserted words.
     */
    TRUSTED
}
