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
package de.dawglib.api;

/**
 * A finite, immutable set of words that can be queried for membership.
 * <p>
 * Implementations are expected to be safe for concurrent use by multiple readers.
 */
public interface Lexicon {

    /**
     * Checks whether the given word is a member of this lexicon.
     *
     * @param word
     *         the word to look up
     *
     * @return {@code true} if the word is contained, {@code false} otherwise
     */
    boolean contains(CharSequence word);

    /**
     * Returns the number of states of the underlying representation. For a minimal representation this is a measure
     * of how well common prefixes and suffixes of the contained words have been shared.
     *
     * @return the number of states
     */
    int size();
}
