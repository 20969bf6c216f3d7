package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ToolArgumentsBuilder")
class ToolArgumentsBuilderTest {

    private final ToolArgumentsBuilder builder = new ToolArgumentsBuilder(new ObjectMapper());

    private static ToolArgumentsBuilder.CallContext context(IntentName intent, String prompt, Map<String, Object> slots) {
        return new ToolArgumentsBuilder.CallContext("user-42", "trc_0000abcd", prompt, intent, slots);
    }

    @Nested
    @DisplayName("clamping")
    class Clamping {

        @Test
        @DisplayName("clamps the goal horizon to 1..360 months")
        void goalHorizon() {
            ObjectNode args = builder.argumentsFor(ToolName.GOAL_FEASIBILITY,
                    context(IntentName.PLANNING, "", Map.of("target_amount_vnd", 500_000_000, "horizon_months", 999)));

            assertEquals(360, args.path("horizon_months").asInt());
            assertEquals(500_000_000.0, args.path("target_amount").asDouble());
            assertEquals("user-42", args.path("user_id").asText());
        }

        @Test
        @DisplayName("clamps the scenario horizon to 1..60 months and defaults to 12")
        void scenarioHorizon() {
            ObjectNode clamped = builder.argumentsFor(ToolName.WHAT_IF_SCENARIO,
                    context(IntentName.SCENARIO, "", Map.of("horizon_months", 120)));
            ObjectNode defaulted = builder.argumentsFor(ToolName.WHAT_IF_SCENARIO,
                    context(IntentName.SCENARIO, "", Map.of()));

            assertEquals(60, clamped.path("horizon_months").asInt());
            assertEquals(12, defaulted.path("horizon_months").asInt());
            assertFalse(defaulted.has("variants"));
        }

        @Test
        @DisplayName("keeps anomaly and risk lookbacks inside their ranges")
        void lookbacks() {
            ObjectNode anomaly = builder.argumentsFor(ToolName.ANOMALY_SIGNALS,
                    context(IntentName.RISK, "", Map.of("lookback_days", 5)));
            ObjectNode risk = builder.argumentsFor(ToolName.RISK_PROFILE_NON_INVESTMENT,
                    context(IntentName.RISK, "", Map.of("lookback_days", "2000")));

            assertEquals(30, anomaly.path("lookback_days").asInt());
            assertEquals(720, risk.path("lookback_days").asInt());
        }

        @Test
        @DisplayName("lands values beyond the int range on the upper bound")
        void hugeValues() {
            ObjectNode anomaly = builder.argumentsFor(ToolName.ANOMALY_SIGNALS,
                    context(IntentName.RISK, "", Map.of("lookback_days", 1e12)));
            ObjectNode goal = builder.argumentsFor(ToolName.GOAL_FEASIBILITY,
                    context(IntentName.PLANNING, "", Map.of("horizon_months", 3e9)));
            ObjectNode scenario = builder.argumentsFor(ToolName.WHAT_IF_SCENARIO,
                    context(IntentName.SCENARIO, "", Map.of("horizon_months", 5_000_000_000L)));

            assertEquals(365, anomaly.path("lookback_days").asInt());
            assertEquals(360, goal.path("horizon_months").asInt());
            assertEquals(60, scenario.path("horizon_months").asInt());
        }
    }

    @Nested
    @DisplayName("what-if variants")
    class Variants {

        @Test
        @DisplayName("sends one user_requested variant with percentages scaled to fractions")
        void userRequested() {
            ObjectNode args = builder.argumentsFor(ToolName.WHAT_IF_SCENARIO,
                    context(IntentName.SCENARIO, "", Map.of("horizon_months", 6, "spend_delta_pct", -15)));

            assertEquals(1, args.path("variants").size());
            ObjectNode variant = (ObjectNode) args.path("variants").get(0);
            assertEquals("user_requested", variant.path("name").asText());
            assertEquals(-0.15, variant.path("scenario_overrides").path("spend_delta_pct").asDouble(), 1e-9);
        }
    }

    @Nested
    @DisplayName("requested action")
    class RequestedAction {

        @Test
        @DisplayName("maps trading verbs in both languages")
        void tradingVerbs() {
            assertEquals("buy", ToolArgumentsBuilder.requestedAction("Should I buy VNM stock?"));
            assertEquals("sell", ToolArgumentsBuilder.requestedAction("Tôi có nên bán cổ phiếu FPT?"));
            assertEquals("buy", ToolArgumentsBuilder.requestedAction("Mua chứng khoán lúc này được không?"));
            assertEquals("trade", ToolArgumentsBuilder.requestedAction("Đặt lệnh giúp tôi"));
        }

        @Test
        @DisplayName("does not read accent-stripped words as trading verbs")
        void noFalsePositives() {
            assertEquals("advice", ToolArgumentsBuilder.requestedAction("Bạn có thể giúp tôi tiết kiệm không?"));
            assertEquals("advice", ToolArgumentsBuilder.requestedAction(null));
        }

        @Test
        @DisplayName("guard arguments carry intent, action, prompt and trace")
        void guardArguments() {
            ObjectNode args = builder.argumentsFor(ToolName.SUITABILITY_GUARD,
                    context(IntentName.INVEST, "Should I sell my shares?", Map.of()));

            assertEquals("invest", args.path("intent").asText());
            assertEquals("sell", args.path("requested_action").asText());
            assertEquals("trc_0000abcd", args.path("trace_id").asText());
        }
    }

    @Test
    @DisplayName("builds arguments for every tool of the bundle")
    void bundle() {
        Map<ToolName, ObjectNode> arguments = builder.build(
                List.of(ToolName.SPEND_ANALYTICS, ToolName.CASHFLOW_FORECAST, ToolName.JAR_ALLOCATION_SUGGEST),
                context(IntentName.SUMMARY, "", Map.of("lookback_days", 60)));

        assertEquals(3, arguments.size());
        assertEquals("60d", arguments.get(ToolName.SPEND_ANALYTICS).path("range").asText());
        assertEquals("weekly_12", arguments.get(ToolName.CASHFLOW_FORECAST).path("horizon").asText());
        assertTrue(arguments.get(ToolName.JAR_ALLOCATION_SUGGEST).has("user_id"));
    }
}
