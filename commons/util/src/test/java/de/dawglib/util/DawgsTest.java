package de.dawglib.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.primitives.Chars;
import de.dawglib.algorithm.daciuk.Dawg;
import de.dawglib.examples.ExampleFrenchWords;
import de.dawglib.examples.ExampleSharedSuffixes;
import de.dawglib.examples.RandomDictionaries;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DawgsTest {

    @Test
    public void testRepeatedBuildsAreEquivalent() {
        final List<String> words = Arrays.asList(ExampleFrenchWords.WORDS);

        final Dawg first = Dawg.fromDictionary(words);
        final Dawg second = Dawg.fromDictionary(words);

        Assert.assertNotSame(first, second);
        Assert.assertTrue(Dawgs.equivalent(first, second));
        Assert.assertEquals(Dawgs.statistics(first), Dawgs.statistics(second));
    }

    @Test
    public void testRandomBuildsAreEquivalent() {
        for (int i = 0; i < 5; i++) {
            final List<String> words = RandomDictionaries.createExample(7 + i, 50, 6).getWords();
            Assert.assertTrue(Dawgs.equivalent(Dawg.fromDictionary(words), Dawg.fromDictionary(words)));
        }
    }

    @Test
    public void testDifferentDictionariesAreNotEquivalent() {
        final Dawg dawg = Dawg.fromDictionary(Arrays.asList("abaca", "abacas"));

        Assert.assertFalse(Dawgs.equivalent(dawg, Dawg.fromDictionary(Collections.singletonList("abaca"))));
        Assert.assertFalse(Dawgs.equivalent(dawg, Dawg.fromDictionary(Arrays.asList("abaca", "abacas", "abacus"))));
        Assert.assertFalse(Dawgs.equivalent(dawg, Dawg.fromDictionary(Arrays.asList("", "abaca", "abacas"))));
    }

    @Test
    public void testToCompactDFA() {
        final Dawg dawg = Dawg.fromDictionary(Arrays.asList(ExampleFrenchWords.WORDS));
        final CompactDFA<Character> copy = Dawgs.toCompactDFA(dawg);

        Assert.assertEquals(copy.size(), dawg.size());
        Assert.assertEquals(copy.getInputAlphabet(), dawg.getInputAlphabet());

        for (String word : ExampleFrenchWords.WORDS) {
            Assert.assertTrue(copy.accepts(asWord(word)), word);
        }
        Assert.assertFalse(copy.accepts(asWord("balade")));
        Assert.assertFalse(copy.accepts(Word.epsilon()));
    }

    @Test
    public void testStatistics() {
        final Dawg dawg = Dawg.fromDictionary(ExampleSharedSuffixes.createExample().getWords());
        final DawgStatistics statistics = Dawgs.statistics(dawg);

        Assert.assertEquals(statistics.getStates(), 5);
        Assert.assertEquals(statistics.getTransitions(), 5);
        Assert.assertEquals(statistics.getAcceptingStates(), 2);
        Assert.assertEquals(statistics.getAlphabetSize(), 5);
        Assert.assertEquals(statistics.getLongestWordLength(), 4);
    }

    @Test
    public void testStatisticsOfEmptyDictionary() {
        final DawgStatistics statistics = Dawgs.statistics(Dawg.fromDictionary(Collections.emptyList()));

        Assert.assertEquals(statistics.getStates(), 1);
        Assert.assertEquals(statistics.getTransitions(), 0);
        Assert.assertEquals(statistics.getAcceptingStates(), 0);
        Assert.assertEquals(statistics.getLongestWordLength(), -1);
    }

    @Test
    public void testLongWordStatistics() {
        final String longWord = Strings.repeat("a", 100_000);
        final Dawg dawg = Dawg.fromDictionary(Arrays.asList("", longWord, "ab"));
        final DawgStatistics statistics = Dawgs.statistics(dawg);

        Assert.assertEquals(statistics.getLongestWordLength(), longWord.length());
        Assert.assertEquals(statistics.getStates(), dawg.size());
        Assert.assertEquals(statistics.getAlphabetSize(), 2);
        Assert.assertTrue(dawg.contains(longWord));
    }

    @Test
    public void testLongestWordWithSharedStates() {
        // the shared tail is reached from both "x" and "yy", so the longest word runs through the longer branch
        final Dawg dawg = Dawg.fromDictionary(Arrays.asList("xab", "yyab", "z"));

        Assert.assertEquals(Dawgs.statistics(dawg).getLongestWordLength(), 4);
    }

    private static Word<Character> asWord(String word) {
        return Word.fromList(Chars.asList(word.toCharArray()));
    }
}
