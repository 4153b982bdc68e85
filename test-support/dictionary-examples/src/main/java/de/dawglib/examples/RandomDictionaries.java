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
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;

/**
 * Generator for random sorted dictionaries over a small alphabet. A small alphabet makes shared suffixes, and thus
 * non-trivial minimization, likely.
 */
public final class RandomDictionaries {

    private RandomDictionaries() {
        // prevent instantiation
    }

    /**
     * Generates a sorted, duplicate-free dictionary.
     *
     * @param random
     *         the source of randomness
     * @param maxWords
     *         the number of words to draw (duplicates are removed, so the result may be smaller)
     * @param maxLength
     *         the maximum word length (inclusive)
     * @param firstLetter
     *         the smallest letter
     * @param lastLetter
     *         the largest letter (inclusive)
     *
     * @return the dictionary, in ascending order
     */
    public static List<String> generate(Random random, int maxWords, int maxLength, char firstLetter, char lastLetter) {
        final SortedSet<String> words = new TreeSet<>();
        final int numLetters = lastLetter - firstLetter + 1;

        for (int i = 0; i < maxWords; i++) {
            final int length = random.nextInt(maxLength + 1);
            final StringBuilder sb = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                sb.append((char) (firstLetter + random.nextInt(numLetters)));
            }
            words.add(sb.toString());
        }

        return ImmutableList.copyOf(words);
    }

    public static DictionaryExample createExample(long seed, int maxWords, int maxLength) {
        final List<String> words = generate(new Random(seed), maxWords, maxLength, 'a', 'c');
        return new DefaultDictionaryExample(words, ImmutableList.of(), ResidualLanguages.countStates(words));
    }
}
