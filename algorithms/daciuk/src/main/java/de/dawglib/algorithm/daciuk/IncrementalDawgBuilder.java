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

import java.util.Objects;

import com.google.common.base.Preconditions;
import de.dawglib.api.LexiconBuilder;
import de.dawglib.datastructure.arena.UnminimizedPath;
import de.dawglib.datastructure.arena.VertexArena;
import de.dawglib.datastructure.arena.VertexRegistry;
import de.dawglib.exception.UnsortedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a minimal acyclic deterministic automaton (a {@link Dawg}) from a dictionary sorted in ascending order, using
 * the incremental construction described by Daciuk et al. in "Incremental Construction of Minimal Acyclic Finite-State
 * Automata" (Computational Linguistics 26(1), 2000).
 * <p>
 * Words are inserted one at a time. Only the vertices of the most recently inserted word that are not shared with any
 * earlier word may still change; they are kept on an {@link UnminimizedPath}. Whenever a new word diverges from the
 * previous one, the divergent tail of the previous word can no longer change, so it is minimized: each of its
 * vertices, deepest first, is either replaced by an equivalent vertex from the {@link VertexRegistry} or registered as
 * canonical itself. Because deeper vertices are always resolved first, equivalence checks only have to compare
 * transition targets by handle.
 * <p>
 * Words are compared by their {@code char} values, which coincides with byte-wise order for ASCII input. Instances
 * are single-use and not thread-safe.
 */
public class IncrementalDawgBuilder implements LexiconBuilder<Dawg> {

    private static final Logger LOGGER = LoggerFactory.getLogger(IncrementalDawgBuilder.class);

    private final OrderingPolicy orderingPolicy;

    private final VertexArena arena = new VertexArena();
    private final VertexRegistry registry = new VertexRegistry(arena);
    private final UnminimizedPath unminimizedPath = new UnminimizedPath();

    private String previousWord = "";
    private int wordCount;
    private boolean built;

    public IncrementalDawgBuilder() {
        this(OrderingPolicy.STRICT);
    }

    public IncrementalDawgBuilder(OrderingPolicy orderingPolicy) {
        this.orderingPolicy = Objects.requireNonNull(orderingPolicy);

        if (orderingPolicy == OrderingPolicy.TRUSTED) {
            LOGGER.debug("Input order is not validated, unsorted dictionaries yield unspecified automata");
        }
    }

    @Override
    public void insert(CharSequence word) {
        Objects.requireNonNull(word, "word");
        Preconditions.checkState(!built, "The automaton has already been built");

        final String current = word.toString();
        final int commonPrefixLength = commonPrefixLength(previousWord, current);

        if (orderingPolicy == OrderingPolicy.STRICT) {
            checkOrder(current, commonPrefixLength);
        }

        // everything of the previous word beyond the common prefix is final now
        minimizeUntil(commonPrefixLength);
        addSuffix(current, commonPrefixLength);

        previousWord = current;
        wordCount++;
    }

    @Override
    public IncrementalDawgBuilder insertAll(Iterable<? extends CharSequence> words) {
        LexiconBuilder.super.insertAll(words);
        return this;
    }

    @Override
    public Dawg build() {
        Preconditions.checkState(!built, "The automaton has already been built");
        built = true;

        finishMinimization();

        final Dawg result = Dawg.compact(arena);

        LOGGER.debug("Built automaton with {} states from {} words ({} vertices allocated, {} canonical)",
                     result.size(),
                     wordCount,
                     arena.size(),
                     registry.size());

        return result;
    }

    /**
     * Minimizes the unminimized path down to the given depth. Entries are processed deepest first: each vertex is
     * either redirected to an equivalent canonical vertex, in which case its parent's transition is updated and the
     * vertex is discarded, or registered as canonical itself.
     *
     * @param depth
     *         the number of path entries to keep
     */
    void minimizeUntil(int depth) {
        while (unminimizedPath.depth() > depth) {
            final int handle = unminimizedPath.topHandle();
            final char label = unminimizedPath.topLabel();
            unminimizedPath.pop();

            final int canonical = registry.canonicalize(handle);

            if (canonical != handle) {
                final int parent = unminimizedPath.topHandleOr(VertexArena.ROOT);
                arena.get(parent).setTransition(label, canonical);
            }
        }
    }

    void finishMinimization() {
        minimizeUntil(0);
    }

    /**
     * Creates a chain of fresh vertices for {@code word.substring(from)}, attached to the deepest unminimized vertex (or
     * the root), and marks the end of the chain as accepting. If there is nothing left to add, the current end is
     * marked accepting instead.
     *
     * @param word
     *         the word being inserted
     * @param from
     *         the index of the first character not shared with the previous word
     */
    void addSuffix(String word, int from) {
        int parent = unminimizedPath.topHandleOr(VertexArena.ROOT);

        for (int i = from; i < word.length(); i++) {
            final char label = word.charAt(i);
            final int child = arena.createVertex();
            arena.get(parent).setTransition(label, child);
            unminimizedPath.push(child, label);
            parent = child;
        }

        arena.get(parent).markAccepting();
    }

    private void checkOrder(String current, int commonPrefixLength) {
        final boolean sorted;

        if (commonPrefixLength < current.length() && commonPrefixLength < previousWord.length()) {
            sorted = current.charAt(commonPrefixLength) > previousWord.charAt(commonPrefixLength);
        } else {
            // one word is a prefix of the other, which is fine unless the current one is the shorter
            sorted = current.length() >= previousWord.length();
        }

        if (!sorted) {
            throw new UnsortedInputException(previousWord, current, wordCount);
        }
    }

    static int commonPrefixLength(String a, String b) {
        final int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    int getUnminimizedDepth() {
        return unminimizedPath.depth();
    }

    int getCanonicalVertexCount() {
        return registry.size();
    }

    int getAllocatedVertexCount() {
        return arena.size();
    }
}
