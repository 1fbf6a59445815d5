package io.github.tfls.search;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FuzzyMatcherTest {

    private void assertBetterScore(String pattern, String betterMatch, String worseMatch) {
        var matcher = new FuzzyMatcher(pattern);
        int scoreBetter = matcher.score(betterMatch);
        int scoreWorse = matcher.score(worseMatch);
        assertTrue(
                scoreBetter < scoreWorse,
                String.format(
                        "Expected score for '%s' (%d) to be less than score for '%s' (%d) with pattern '%s'",
                        betterMatch, scoreBetter, worseMatch, scoreWorse, pattern));
    }

    @ParameterizedTest
    @CsvSource({"myb, myblock \"custom\"", "MYB, myblock", "pgh, provider \"github\"", "aws, resource \"aws_vpc\""})
    @DisplayName("Case-insensitive subsequences match")
    void testSubsequenceMatches(String pattern, String name) {
        assertTrue(new FuzzyMatcher(pattern).matches(name));
    }

    @ParameterizedTest
    @CsvSource({"myb, provider \"github\"", "zz, aws_instance", "longerthanname, short"})
    @DisplayName("Non-matches score Integer.MAX_VALUE")
    void testNonMatches(String pattern, String name) {
        assertEquals(Integer.MAX_VALUE, new FuzzyMatcher(pattern).score(name));
    }

    @Test
    void testExactWeights() {
        // m at 0: 1 + 10; y contiguous: 1 + 5; b contiguous: 1 + 5
        assertEquals(-23, new FuzzyMatcher("myb").score("myblock"));
        // a after a quote starts a word: skip 10 leading chars, then 1 + 3, then two contiguous 1 + 5
        assertEquals(-(-10 + 4 + 6 + 6), new FuzzyMatcher("aws").score("resource \"aws_vpc\""));
    }

    @Test
    void testBlankPatternMatchesEverything() {
        assertEquals(0, new FuzzyMatcher("").score("anything"));
        assertEquals(0, new FuzzyMatcher("   ").score("anything"));
    }

    @Test
    @DisplayName("Contiguous match outranks scattered match")
    void testContiguousOutranksScattered() {
        assertBetterScore("web", "aws_web", "xwxexb");
    }

    @Test
    @DisplayName("Prefix match outranks mid-word match")
    void testPrefixOutranksMidWord() {
        assertBetterScore("mod", "module \"x\"", "resource \"amodx\"");
    }

    @Test
    @DisplayName("Word boundary outranks mid-word")
    void testWordBoundaryOutranksMidWord() {
        assertBetterScore("vpc", "aws_vpc", "awsvpc");
        assertBetterScore("inst", "awsInstance", "awsinstance");
    }

    @Test
    @DisplayName("The best alignment wins, not the first")
    void testBestAlignmentIsChosen() {
        // greedy would take the first 'a' in "xa_ab"; the best alignment uses the word start of "ab"
        var matcher = new FuzzyMatcher("ab");
        assertEquals(-(-3 + 4 + 6), matcher.score("xa_ab"));
    }
}
