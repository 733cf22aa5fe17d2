package ai.blackjack.player.ai.policy;

import static ai.blackjack.game.Rank.ACE;
import static ai.blackjack.game.Rank.FIVE;
import static ai.blackjack.game.Rank.SIX;
import static ai.blackjack.game.Rank.TEN;
import static ai.blackjack.game.TableTestHelper.card;
import static ai.blackjack.game.TableTestHelper.hand;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blackjack.game.Decision;
import ai.blackjack.game.RoundContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

/**
 * Policy service player against a stubbed client, plus the request wire format.
 */
class PolicyServicePlayerTest {
    private static final List<Decision> LEGAL = List.of(Decision.HIT, Decision.STAND);

    private static RoundContext context(OptionalDouble probTen) {
        return new RoundContext(1, List.of(card(TEN), card(SIX), card(ACE)), 1,
                new BigDecimal("990"), new BigDecimal("10"), probTen);
    }

    /**
     * Returns a fixed response and keeps the requests it was sent.
     */
    private static final class StubClient extends PolicyServiceClient {
        private final PolicyResponse response;
        private final List<PolicyRequest> requests = new ArrayList<>();

        StubClient(PolicyResponse response) {
            this.response = response;
        }

        @Override
        public PolicyResponse evaluate(PolicyRequest request) {
            requests.add(request);
            return response;
        }
    }

    private static PolicyResponse choosing(String decision) {
        PolicyResponse response = new PolicyResponse();
        response.setChosenDecision(decision);
        response.setExpectedValue(-0.12);
        return response;
    }

    @Test
    void followsTheServiceRecommendation() {
        StubClient client = new StubClient(choosing("hit"));
        PolicyServicePlayer player = new PolicyServicePlayer(client);

        assertEquals(Decision.HIT, player.decide(hand(TEN, SIX), card(ACE), context(OptionalDouble.empty()), LEGAL));
        PolicyRequest sent = client.requests.get(0);
        assertEquals(16, sent.getHandValue());
        assertEquals("A♠", sent.getDealerUpcard());
        assertEquals(List.of("hit", "stand"), sent.getLegalDecisions());
    }

    @Test
    void unavailableServiceFallsBackToStand() {
        PolicyServicePlayer player = new PolicyServicePlayer(new StubClient(null));
        assertEquals(Decision.STAND, player.decide(hand(TEN, SIX), card(ACE), context(OptionalDouble.empty()), LEGAL));
    }

    @Test
    void illegalRecommendationFallsBackToStand() {
        PolicyServicePlayer player = new PolicyServicePlayer(new StubClient(choosing("split")));
        assertEquals(Decision.STAND, player.decide(hand(TEN, SIX), card(ACE), context(OptionalDouble.empty()), LEGAL));
    }

    @Test
    void insuranceFollowsTheTenProbability() {
        PolicyServicePlayer player = new PolicyServicePlayer(new StubClient(null));
        assertTrue(player.decideInsurance(context(OptionalDouble.of(0.34))));
        assertFalse(player.decideInsurance(context(OptionalDouble.of(0.29))));
        assertFalse(player.decideInsurance(context(OptionalDouble.empty())));
    }

    @Test
    void betsTheSmallestOffer() {
        PolicyServicePlayer player = new PolicyServicePlayer(new StubClient(null));
        assertEquals(new BigDecimal("10"), player.chooseBet(List.of(new BigDecimal("10"), new BigDecimal("50"))));
    }

    @Test
    void requestSerialisesWithSnakeCaseKeys() throws Exception {
        PolicyRequest request = PolicyRequest.fromState(hand(ACE, FIVE), card(SIX), context(OptionalDouble.empty()),
                List.of(Decision.HIT, Decision.STAND, Decision.DOUBLE_DOWN));
        JsonNode json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(request));

        assertEquals(16, json.get("hand_value").asInt());
        assertTrue(json.get("is_soft").asBoolean());
        assertEquals("6♠", json.get("dealer_upcard").asText());
        assertEquals("double-down", json.get("legal_decisions").get(2).asText());
        assertEquals(3, json.get("cards_visible").size());
        assertEquals(1, json.get("num_participants").asInt());
        assertEquals(0, new BigDecimal("10").compareTo(json.get("primary_bet").decimalValue()));
    }

    @Test
    void responseIgnoresUnknownFields() throws Exception {
        PolicyResponse response = new ObjectMapper().readValue(
                "{\"chosen_decision\":\"stand\",\"expected_value\":0.25,"
                        + "\"decision_scores\":[{\"decision\":\"stand\",\"probability\":0.7}],\"model\":\"v2\"}",
                PolicyResponse.class);
        assertEquals("stand", response.getChosenDecision());
        assertEquals(0.7, response.getDecisionScores().get(0).getProbability(), 1e-9);
    }

    @Test
    void unreachableServiceReturnsNull() {
        PolicyServiceClient client = new PolicyServiceClient("http://127.0.0.1:1/");
        assertEquals("http://127.0.0.1:1/evaluate", client.getEvaluateUri().toString());
        assertNull(client.evaluate(PolicyRequest.fromState(hand(TEN, SIX), card(ACE),
                context(OptionalDouble.empty()), LEGAL)));
    }
}
