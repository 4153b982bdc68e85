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

import com.google.common.collect.ImmutableList;

public class DefaultDictionaryExample implements DictionaryExample {

    private final List<String> words;
    private final List<String> rejectedWords;
    private final int minimalStateCount;

    public DefaultDictionaryExample(List<String> words, List<String> rejectedWords, int minimalStateCount) {
        this.words = ImmutableList.copyOf(words);
        this.rejectedWords = ImmutableList.copyOf(rejectedWords);
        this.minimalStateCount = minimalStateCount;
    }

    @Override
    public List<String> getWords() {
        return words;
    }

    @Override
    public List<String> getRejectedWords() {
        return rejectedWords;
    }

    @Override
    public int getMinimalStateCount() {
        return minimalStateCount;
    }

    @Override
    public String toString() {
        return words.size() <= 4 ? words.toString() : words.subList(0, 4) + "... (" + words.size() + " words)";
    }
}
