package br.edu.ifba.meetingrag.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TokenUtil with jtokkit's cl100k_base encoding.
 */
class TokenUtilTest {

    private static final String SENTENCE = "The quick brown fox jumps over the lazy dog.";

    @Test
    @DisplayName("Should count tokens accurately for English text")
    void testEstimateTokensEnglish() {
        assertEquals(4, TokenUtil.estimateTokens("Hello, world!"));
    }

    @Test
    @DisplayName("Should return 0 for empty string")
    void testEstimateTokensEmpty() {
        assertEquals(0, TokenUtil.estimateTokens(""));
    }

    @Test
    @DisplayName("Approximation uses four characters per token")
    void testApproximation() {
        assertEquals(3, TokenUtil.estimateTokensApproximate("123456789"));
        assertEquals(0, TokenUtil.estimateTokensApproximate(""));
    }

    @Test
    @DisplayName("headTokens keeps a prefix within the budget")
    void testHeadTokens() {
        final String head = TokenUtil.headTokens(SENTENCE, 3);

        assertTrue(SENTENCE.startsWith(head), head);
        assertTrue(TokenUtil.estimateTokens(head) <= 3);
        assertTrue(head.length() < SENTENCE.length());
    }

    @Test
    @DisplayName("tailTokens keeps a suffix within the budget")
    void testTailTokens() {
        final String tail = TokenUtil.tailTokens(SENTENCE, 3);

        assertTrue(SENTENCE.endsWith(tail), tail);
        assertTrue(TokenUtil.estimateTokens(tail) <= 3);
    }

    @Test
    @DisplayName("Text within the budget is returned unchanged")
    void testFitsBudget() {
        assertEquals(SENTENCE, TokenUtil.headTokens(SENTENCE, 1000));
        assertEquals(SENTENCE, TokenUtil.tailTokens(SENTENCE, 1000));
        assertEquals("", TokenUtil.headTokens(SENTENCE, 0));
    }

    @Test
    @DisplayName("Should count whitespace separated words")
    void testCountWords() {
        assertEquals(9, TokenUtil.countWords(SENTENCE));
        assertEquals(2, TokenUtil.countWords("  two\n\twords "));
        assertEquals(0, TokenUtil.countWords("   "));
    }
}
