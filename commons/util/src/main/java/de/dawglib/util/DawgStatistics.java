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
package de.dawglib.util;

import java.util.Objects;

/**
 * Size figures of a {@link de.dawglib.algorithm.daciuk.Dawg}.
 */
public final class DawgStatistics {

    private final int states;
    private final int transitions;
    private final int acceptingStates;
    private final int alphabetSize;
    private final int longestWordLength;

    public DawgStatistics(int states, int transitions, int acceptingStates, int alphabetSize, int longestWordLength) {
        this.states = states;
        this.transitions = transitions;
        this.acceptingStates = acceptingStates;
        this.alphabetSize = alphabetSize;
        this.longestWordLength = longestWordLength;
    }

    public int getStates() {
        return states;
    }

    public int getTransitions() {
        return transitions;
    }

    public int getAcceptingStates() {
        return acceptingStates;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    /**
     * @return the length of the longest accepted word, or {@code -1} if the automaton accepts no word at all
     */
    public int getLongestWordLength() {
        return longestWordLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final DawgStatistics that = (DawgStatistics) o;
        return states == that.states && transitions == that.transitions && acceptingStates == that.acceptingStates &&
               alphabetSize == that.alphabetSize && longestWordLength == that.longestWordLength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, transitions, acceptingStates, alphabetSize, longestWordLength);
    }

    @Override
    public String toString() {
        return "DawgStatistics[states=" + states + ", transitions=" + transitions + ", accepting=" + acceptingStates +
               ", alphabet=" + alphabetSize + ", longestWord=" + longestWordLength + ']';
    }
}
