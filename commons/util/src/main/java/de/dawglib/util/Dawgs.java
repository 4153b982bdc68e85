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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

import com.google.common.collect.ImmutableSortedSet;
import de.dawglib.algorithm.daciuk.Dawg;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.equivalence.DeterministicEquivalenceTest;
import net.automatalib.words.Alphabet;

/**
 * Utility methods for {@link Dawg}s.
 */
public final class Dawgs {

    private static final byte UNVISITED = 0;
    private static final byte EXPANDED = 1;
    private static final byte FINISHED = 2;

    private Dawgs() {
        // prevent instantiation
    }

    /**
     * Copies the given automaton into a mutable {@link CompactDFA} over the automaton's own input alphabet. State
     * {@code i} of the DAWG becomes state {@code i} of the copy. The copy is partial, just like the DAWG itself.
     *
     * @param dawg
     *         the automaton to copy
     *
     * @return the copy
     */
    public static CompactDFA<Character> toCompactDFA(Dawg dawg) {
        final Alphabet<Character> alphabet = dawg.getInputAlphabet();
        final CompactDFA<Character> result = new CompactDFA<>(alphabet, dawg.size());

        for (int s = 0; s < dawg.size(); s++) {
            if (s == dawg.getInitialState()) {
                result.addInitialState(dawg.isAccepting(s));
            } else {
                result.addState(dawg.isAccepting(s));
            }
        }

        for (int s = 0; s < dawg.size(); s++) {
            for (Character label : dawg.getOutgoingLabels(s)) {
                result.addTransition(s, label, dawg.getTransition(s, label));
            }
        }

        return result;
    }

    /**
     * Checks whether two automata accept the same language.
     * <p>
     * A DAWG has no dead states (every state lies on the path of some accepted word), so a transition that is defined
     * in only one of the automata always leads to a word accepted by only one of them. This allows the partial
     * automata to be compared directly, without completing them first.
     *
     * @param first
     *         the first automaton
     * @param second
     *         the second automaton
     *
     * @return {@code true} if both automata accept the same words, {@code false} otherwise
     */
    public static boolean equivalent(Dawg first, Dawg second) {
        final Set<Character> inputs = ImmutableSortedSet.<Character>naturalOrder()
                                                        .addAll(first.getInputAlphabet())
                                                        .addAll(second.getInputAlphabet())
                                                        .build();

        return DeterministicEquivalenceTest.findSeparatingWord(first, second, inputs) == null;
    }

    /**
     * Collects size figures of the given automaton.
     *
     * @param dawg
     *         the automaton to inspect
     *
     * @return the statistics
     */
    public static DawgStatistics statistics(Dawg dawg) {
        int acceptingStates = 0;
        for (int s = 0; s < dawg.size(); s++) {
            if (dawg.isAccepting(s)) {
                acceptingStates++;
            }
        }

        final int longestWord = longestAcceptedWord(dawg);

        return new DawgStatistics(dawg.size(),
                                  dawg.getTransitionCount(),
                                  acceptingStates,
                                  dawg.getInputAlphabet().size(),
                                  longestWord);
    }

    /**
     * Computes the length of the longest accepted word via an iterative post-order traversal, so that the depth of the
     * automaton is not limited by the call stack. State numbers are not topologically ordered, hence the explicit
     * traversal.
     */
    private static int longestAcceptedWord(Dawg dawg) {
        final int[] longest = new int[dawg.size()];
        final byte[] marks = new byte[dawg.size()];
        final Deque<Integer> stack = new ArrayDeque<>();

        stack.push(dawg.getInitialState());

        while (!stack.isEmpty()) {
            final int state = stack.peek();

            if (marks[state] == UNVISITED) {
                marks[state] = EXPANDED;
                for (Character label : dawg.getOutgoingLabels(state)) {
                    final int succ = dawg.getTransition(state, label);
                    if (marks[succ] == UNVISITED) {
                        stack.push(succ);
                    }
                }
                continue;
            }

            stack.pop();
            if (marks[state] == FINISHED) {
                continue;
            }

            // successors are finished: the graph is acyclic and they were pushed on top of this state
            int result = dawg.isAccepting(state) ? 0 : -1;
            for (Character label : dawg.getOutgoingLabels(state)) {
                final int succLength = longest[dawg.getTransition(state, label)];
                if (succLength >= 0) {
                    result = Math.max(result, succLength + 1);
                }
            }

            longest[state] = result;
            marks[state] = FINISHED;
        }

        return longest[dawg.getInitialState()];
    }
}
