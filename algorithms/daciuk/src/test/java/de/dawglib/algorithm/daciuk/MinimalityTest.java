package de.dawglib.algorithm.daciuk;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import de.dawglib.examples.DictionaryExample;
import de.dawglib.examples.ExampleCommonEndings;
import de.dawglib.examples.ExampleFrenchWords;
import de.dawglib.examples.ExampleNestedPrefixes;
import de.dawglib.examples.ExampleSharedSuffixes;
import de.dawglib.examples.ExampleSingleLetter;
import de.dawglib.examples.RandomDictionaries;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class MinimalityTest {

    private static final int RANDOM_MAX_LENGTH = 5;

    @DataProvider
    public static Object[][] examples() {
        return new Object[][] {{ExampleFrenchWords.createExample()},
                               {ExampleSharedSuffixes.createExample()},
                               {ExampleSingleLetter.createExample()},
                               {ExampleNestedPrefixes.createExample()},
                               {ExampleCommonEndings.createExample()}};
    }

    @DataProvider
    public static Object[][] randomExamples() {
        final Object[][] result = new Object[10][];
        for (int i = 0; i < result.length; i++) {
            result[i] = new Object[] {RandomDictionaries.createExample(42 + i, 20 + 10 * i, RANDOM_MAX_LENGTH)};
        }
        return result;
    }

    @Test(dataProvider = "examples")
    public void testExample(DictionaryExample example) {
        final Dawg dawg = Dawg.fromDictionary(example.getWords());

        Assert.assertEquals(dawg.size(), example.getMinimalStateCount());

        for (String word : example.getWords()) {
            Assert.assertTrue(dawg.contains(word), word);
        }
        for (String word : example.getRejectedWords()) {
            Assert.assertFalse(dawg.contains(word), word);
        }
    }

    @Test(dataProvider = "randomExamples")
    public void testRandomDictionary(DictionaryExample example) {
        final Dawg dawg = Dawg.fromDictionary(example.getWords());
        final Set<String> dictionary = new HashSet<>(example.getWords());

        Assert.assertEquals(dawg.size(), example.getMinimalStateCount());

        // exhaustively compare against the dictionary, including words one letter too long
        checkAllWords(dawg, dictionary, new StringBuilder(), RANDOM_MAX_LENGTH + 1);
    }

    @Test
    public void testSmallerThanTrie() {
        final List<String> words = ExampleSharedSuffixes.createExample().getWords();
        final Dawg dawg = Dawg.fromDictionary(words);

        final Set<String> prefixes = new HashSet<>();
        for (String word : words) {
            for (int i = 0; i <= word.length(); i++) {
                prefixes.add(word.substring(0, i));
            }
        }

        Assert.assertEquals(prefixes.size(), 8);
        Assert.assertTrue(dawg.size() < prefixes.size());
    }

    private static void checkAllWords(Dawg dawg, Set<String> dictionary, StringBuilder prefix, int remaining) {
        final String word = prefix.toString();
        Assert.assertEquals(dawg.contains(word), dictionary.contains(word), word);

        if (remaining == 0) {
            return;
        }

        for (char c = 'a'; c <= 'c'; c++) {
            prefix.append(c);
            checkAllWords(dawg, dictionary, prefix, remaining - 1);
            prefix.setLength(prefix.length() - 1);
        }
    }
}
