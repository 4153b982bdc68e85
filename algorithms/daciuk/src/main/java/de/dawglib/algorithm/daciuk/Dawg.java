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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import de.dawglib.api.Lexicon;
import de.dawglib.datastructure.arena.Vertex;
import de.dawglib.datastructure.arena.VertexArena;
import net.automatalib.automata.concepts.InputAlphabetHolder;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.ListAlphabet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable directed acyclic word graph, i.e. the minimal deterministic automaton accepting a finite set of words.
 * <p>
 * States are numbered densely from {@code 0} (the initial state) to {@code size() - 1}. Transitions are stored in a
 * compressed row layout, sorted by label, so lookups use binary search. Instances are obtained from {@link
 * IncrementalDawgBuilder} or {@link #fromDictionary(Iterable)} and may be shared freely between threads.
 * <p>
 * Besides {@link #contains(CharSequence)}, the automaton is exposed as an AutomataLib {@link DFA} over {@link
 * Character} inputs, so it can be analysed with the utilities of that library.
 */
public final class Dawg implements Lexicon, DFA<Integer, Character>, InputAlphabetHolder<Character> {

    private static final int INITIAL_STATE = 0;

    private final int[] offsets;
    private final char[] labels;
    private final int[] targets;
    private final boolean[] accepting;
    private final Alphabet<Character> alphabet;

    private Dawg(int[] offsets, char[] labels, int[] targets, boolean[] accepting) {
        this.offsets = offsets;
        this.labels = labels;
        this.targets = targets;
        this.accepting = accepting;
        this.alphabet = collectAlphabet(labels);
    }

    /**
     * Builds the automaton for the given dictionary, which must be sorted in ascending order.
     *
     * @param words
     *         the words, in ascending order
     *
     * @return the minimal automaton accepting exactly the given words
     *
     * @throws de.dawglib.exception.UnsortedInputException
     *         if the words are not sorted
     */
    public static Dawg fromDictionary(Iterable<? extends CharSequence> words) {
        return fromDictionary(words, OrderingPolicy.STRICT);
    }

    public static Dawg fromDictionary(Iterable<? extends CharSequence> words, OrderingPolicy orderingPolicy) {
        return new IncrementalDawgBuilder(orderingPolicy).insertAll(words).build();
    }

    @Override
    public boolean contains(CharSequence word) {
        int state = INITIAL_STATE;
        for (int i = 0; i < word.length(); i++) {
            state = successor(state, word.charAt(i));
            if (state < 0) {
                return false;
            }
        }
        return accepting[state];
    }

    /**
     * Returns the number of states, i.e. the number of distinct vertices reachable from the root (including the root).
     *
     * @return the number of states
     */
    @Override
    public int size() {
        return accepting.length;
    }

    /**
     * Returns the total number of transitions.
     *
     * @return the number of transitions
     */
    public int getTransitionCount() {
        return labels.length;
    }

    @Override
    public Collection<Integer> getStates() {
        return IntStream.range(0, size()).boxed().collect(Collectors.toList());
    }

    @Override
    public Integer getInitialState() {
        return INITIAL_STATE;
    }

    @Override
    public @Nullable Integer getTransition(Integer state, Character input) {
        final int succ = successor(state, input);
        return succ < 0 ? null : succ;
    }

    @Override
    public Integer getSuccessor(Integer transition) {
        return transition;
    }

    @Override
    public Void getTransitionProperty(Integer transition) {
        return null;
    }

    @Override
    public boolean isAccepting(Integer state) {
        return accepting[state];
    }

    /**
     * Returns the labels that occur on at least one transition, in ascending order.
     *
     * @return the input alphabet of this automaton
     */
    @Override
    public Alphabet<Character> getInputAlphabet() {
        return alphabet;
    }

    /**
     * Returns the labels of the outgoing transitions of the given state, in ascending order.
     *
     * @param state
     *         the state
     *
     * @return the outgoing labels
     */
    public List<Character> getOutgoingLabels(int state) {
        final List<Character> result = new ArrayList<>(offsets[state + 1] - offsets[state]);
        for (int i = offsets[state]; i < offsets[state + 1]; i++) {
            result.add(labels[i]);
        }
        return Collections.unmodifiableList(result);
    }

    private int successor(int state, char label) {
        final int idx = Arrays.binarySearch(labels, offsets[state], offsets[state + 1], label);
        return idx >= 0 ? targets[idx] : -1;
    }

    /**
     * Copies the vertices reachable from the root of the given (fully minimized) arena into a dense, immutable
     * representation. Vertices left behind during minimization are dropped. States are numbered in depth-first order
     * with the root first.
     */
    static Dawg compact(VertexArena arena) {
        final int[] stateOf = new int[arena.size()];
        Arrays.fill(stateOf, -1);

        final List<Vertex> order = new ArrayList<>();
        final Deque<Integer> stack = new ArrayDeque<>();

        stateOf[VertexArena.ROOT] = 0;
        order.add(arena.getRoot());
        stack.push(VertexArena.ROOT);

        int transitionCount = 0;

        while (!stack.isEmpty()) {
            final Vertex vertex = arena.get(stack.pop());
            transitionCount += vertex.getDegree();

            for (int i = vertex.getDegree() - 1; i >= 0; i--) {
                final int target = vertex.getTarget(i);
                if (stateOf[target] < 0) {
                    stateOf[target] = order.size();
                    order.add(arena.get(target));
                    stack.push(target);
                }
            }
        }

        final int numStates = order.size();
        final int[] offsets = new int[numStates + 1];
        final char[] labels = new char[transitionCount];
        final int[] targets = new int[transitionCount];
        final boolean[] accepting = new boolean[numStates];

        int pos = 0;
        for (int s = 0; s < numStates; s++) {
            final Vertex vertex = order.get(s);
            offsets[s] = pos;
            accepting[s] = vertex.isAccepting();
            for (int i = 0; i < vertex.getDegree(); i++) {
                labels[pos] = vertex.getLabel(i);
                targets[pos] = stateOf[vertex.getTarget(i)];
                pos++;
            }
        }
        offsets[numStates] = pos;

        return new Dawg(offsets, labels, targets, accepting);
    }

    private static Alphabet<Character> collectAlphabet(char[] labels) {
        final char[] sorted = labels.clone();
        Arrays.sort(sorted);

        final List<Character> symbols = new ArrayList<>();
        for (int i = 0; i < sorted.length; i++) {
            if (i == 0 || sorted[i] != sorted[i - 1]) {
                symbols.add(sorted[i]);
            }
        }
        return new ListAlphabet<>(symbols);
    }

    @Override
    public String toString() {
        return "Dawg[states=" + size() + ", transitions=" + getTransitionCount() + ']';
    }
}
