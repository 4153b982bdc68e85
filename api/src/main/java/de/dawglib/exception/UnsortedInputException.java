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
package de.dawglib.exception;

// Thrown when a dictionary word sorts before its predecessor, so that incremental construction cannot proceed.
public class UnsortedInputException extends RuntimeException {

    private final String previousWord;
    private final String word;
    private final int position;

    /**
     * Constructor.
     *
     * @param previousWord
     *         the word inserted before the offending one
     * @param word
     *         the offending word
     * @param position
     *         the zero-based position of {@code word} in the input sequence
     */
    public UnsortedInputException(String previousWord, String word, int position) {
        super(String.format("Word #%d '%s' is not in ascending order after '%s'", position, word, previousWord));
        this.previousWord = previousWord;
        this.word = word;
        this.position = position;
    }

    public String getPreviousWord() {
        return previousWord;
    }

    public String getWord() {
        return word;
    }

    public int getPosition() {
        return position;
    }

}
