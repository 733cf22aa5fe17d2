package ai.blackjack.player.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Rate-limit delay parsing; no calls are made to OpenAI.
 */
class OpenAIPlayerTest {

    @Test
    void usesTheServerSuggestedDelayPlusBuffer() {
        assertEquals(2_000L, OpenAIPlayer.extractRetryDelayMillis(
                "Rate limit reached for gpt-4o. Please try again in 1.5s. Visit ..."));
        assertEquals(4_500L, OpenAIPlayer.extractRetryDelayMillis("try again in 4s"));
    }

    @Test
    void fallsBackToDefaultDelay() {
        assertEquals(3_500L, OpenAIPlayer.extractRetryDelayMillis("quota exceeded"));
        assertEquals(3_500L, OpenAIPlayer.extractRetryDelayMillis(null));
    }

    @Test
    void explicitKeyWins() {
        assertEquals("sk-test", OpenAIPlayer.resolveApiKey("  sk-test "));
    }
}
