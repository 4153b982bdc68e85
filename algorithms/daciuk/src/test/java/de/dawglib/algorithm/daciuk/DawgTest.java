package de.dawglib.algorithm.daciuk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import de.dawglib.examples.ExampleFrenchWords;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DawgTest {

    private final Dawg frenchWords = Dawg.fromDictionary(Arrays.asList(ExampleFrenchWords.WORDS));

    @Test
    public void testReferenceWordList() {
        for (String word : ExampleFrenchWords.WORDS) {
            Assert.assertTrue(frenchWords.contains(word), word);
        }
        Assert.assertFalse(frenchWords.contains("balade"));
    }

    @Test
    public void testSingleCharacter() {
        final Dawg dawg = Dawg.fromDictionary(Collections.singletonList("a"));

        Assert.assertTrue(dawg.contains("a"));
        Assert.assertFalse(dawg.contains(""));
        Assert.assertFalse(dawg.contains("aa"));
        Assert.assertEquals(dawg.size(), 2);
    }

    @Test
    public void testEmptyDictionary() {
        final Dawg dawg = Dawg.fromDictionary(Collections.emptyList());

        Assert.assertFalse(dawg.contains(""));
        Assert.assertFalse(dawg.contains("a"));
        Assert.assertFalse(dawg.contains("abaca"));
        Assert.assertEquals(dawg.size(), 1);
        Assert.assertEquals(dawg.getTransitionCount(), 0);
        Assert.assertEquals(dawg.getInputAlphabet().size(), 0);
    }

    @Test
    public void testEmptyWord() {
        final Dawg dawg = Dawg.fromDictionary(Arrays.asList("", "a"));

        Assert.assertTrue(dawg.contains(""));
        Assert.assertTrue(dawg.contains("a"));
        Assert.assertFalse(dawg.contains("b"));

        final Dawg onlyEmpty = Dawg.fromDictionary(Collections.singletonList(""));
        Assert.assertTrue(onlyEmpty.contains(""));
        Assert.assertFalse(onlyEmpty.contains("a"));
        Assert.assertEquals(onlyEmpty.size(), 1);
    }

    @Test
    public void testDuplicatesAreIdempotent() {
        final Dawg once = Dawg.fromDictionary(Arrays.asList("a", "ab", "b", "bb"));
        final Dawg twice = Dawg.fromDictionary(Arrays.asList("a", "a", "ab", "ab", "b", "bb", "bb"));

        Assert.assertEquals(twice.size(), once.size());
        Assert.assertEquals(twice.getTransitionCount(), once.getTransitionCount());
        for (String word : Arrays.asList("", "a", "ab", "b", "bb", "aa", "ba", "abb", "bbb")) {
            Assert.assertEquals(twice.contains(word), once.contains(word), word);
        }
    }

    @Test
    public void testDFAView() {
        Assert.assertEquals(frenchWords.getInitialState(), Integer.valueOf(0));
        Assert.assertEquals(frenchWords.getStates().size(), frenchWords.size());

        Assert.assertTrue(frenchWords.accepts(Word.fromSymbols('a', 'b', 'a', 'c', 'a')));
        Assert.assertFalse(frenchWords.accepts(Word.fromSymbols('a', 'b', 'a', 'c')));
        Assert.assertFalse(frenchWords.accepts(Word.fromSymbols('z')));

        final Integer initial = frenchWords.getInitialState();
        Assert.assertNull(frenchWords.getTransition(initial, 'z'));
        Assert.assertNotNull(frenchWords.getTransition(initial, 'a'));
        Assert.assertFalse(frenchWords.isAccepting(initial));
        Assert.assertEquals(frenchWords.getOutgoingLabels(initial), Arrays.asList('a', 'b'));
    }

    @Test
    public void testInputAlphabet() {
        final Alphabet<Character> alphabet = frenchWords.getInputAlphabet();

        Assert.assertEquals(alphabet.size(), 12);
        for (char c : "abcdeilorstu".toCharArray()) {
            Assert.assertTrue(alphabet.containsSymbol(c), String.valueOf(c));
        }
        Assert.assertFalse(alphabet.containsSymbol('z'));
    }

    @Test
    public void testConcurrentQueries() throws InterruptedException, ExecutionException {
        final ExecutorService executor = Executors.newFixedThreadPool(4);

        try {
            final List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> {
                    boolean result = true;
                    for (String word : ExampleFrenchWords.WORDS) {
                        result &= frenchWords.contains(word);
                    }
                    return result && !frenchWords.contains("balade");
                });
            }

            for (Future<Boolean> future : executor.invokeAll(tasks)) {
                Assert.assertTrue(future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
