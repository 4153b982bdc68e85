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
 * Incremental builder for a {@link Lexicon}. Words are fed one at a time via {@link #insert(CharSequence)}, and the
 * finished lexicon is obtained via {@link #build()}. A builder can only be built once.
 *
 * @param <L>
 *         lexicon type
 */
public interface LexiconBuilder<L extends Lexicon> {

    /**
     * Adds a word to the lexicon under construction.
     *
     * @param word
     *         the word to add
     *
     * @throws de.dawglib.exception.UnsortedInputException
     *         if the builder requires sorted input and the word does not follow the previously inserted one
     * @throws IllegalStateException
     *         if {@link #build()} has already been called
     */
    void insert(CharSequence word);

    /**
     * Adds all words of the given sequence, in iteration order.
     *
     * @param words
     *         the words to add
     *
     * @return this builder
     *
     * @see #insert(CharSequence)
     */
    default LexiconBuilder<L> insertAll(Iterable<? extends CharSequence> words) {
        for (CharSequence word : words) {
            insert(word);
        }
        return this;
    }

    /**
     * Finishes construction and returns the immutable lexicon.
     *
     * @return the built lexicon
     *
     * @throws IllegalStateException
     *         if this method has already been called
     */
    L build();
}
