package com.demoBank.advisor.router.service;

import com.demoBank.advisor.router.model.ClarificationState;
import com.demoBank.advisor.router.model.ClarifyingQuestion;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.TopIntentScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Service for the bounded clarification protocol.
 *
 * Handles:
 * - Choosing exactly one clarifying question from a fixed precedence table
 * - Advancing the per-customer round counter, resetting it only after a decisive route
 * - Rendering the question as the response text
 *
 * Precedence: scenario_horizon, scenario_delta_dimension, planning_vs_scenario, summary_vs_risk,
 * intent_pair, generic_intent.
 */
@Slf4j
@Service
public class ClarificationService {

    private static final Map<IntentName, String> INTENT_LABELS_EN = Map.of(
            IntentName.SUMMARY, "Cashflow overview",
            IntentName.RISK, "Risk alerts",
            IntentName.PLANNING, "Savings plan",
            IntentName.SCENARIO, "What-if scenario comparison",
            IntentName.INVEST, "Investment education",
            IntentName.OUT_OF_SCOPE, "Something else");

    private static final Map<IntentName, String> INTENT_LABELS_VI = Map.of(
            IntentName.SUMMARY, "Tổng quan dòng tiền",
            IntentName.RISK, "Cảnh báo rủi ro",
            IntentName.PLANNING, "Kế hoạch tiết kiệm",
            IntentName.SCENARIO, "So sánh kịch bản what-if",
            IntentName.INVEST, "Kiến thức đầu tư",
            IntentName.OUT_OF_SCOPE, "Chủ đề khác");

    /**
     * Builds the clarifying question for the fired reason codes.
     *
     * @param extraction   extraction that triggered clarification, null when extraction failed
     * @param reasonCodes  reason codes of the routing decision
     * @param maxQuestions configured bound, echoed in the question
     * @param vietnamese   whether to localize to Vietnamese
     * @return exactly one question
     */
    public ClarifyingQuestion buildQuestion(IntentExtraction extraction, Collection<String> reasonCodes,
                                            int maxQuestions, boolean vietnamese) {
        Set<String> reasons = Set.copyOf(reasonCodes);
        List<IntentName> topIntents = extraction == null ? List.of()
                : extraction.top2().stream().map(TopIntentScore::intent).toList();
        Set<IntentName> topSet = topIntents.isEmpty() ? Set.of() : EnumSet.copyOf(topIntents);

        if (reasons.contains("scenario_horizon_missing")) {
            return vietnamese
                    ? question("scenario_horizon", "Bạn muốn phân tích kịch bản trong khoảng thời gian nào?",
                    List.of("3 tháng", "6 tháng", "12 tháng"), maxQuestions)
                    : question("scenario_horizon", "Which time horizon should the scenario cover?",
                    List.of("3 months", "6 months", "12 months"), maxQuestions);
        }

        if (reasons.contains("scenario_delta_missing")) {
            return vietnamese
                    ? question("scenario_delta_dimension", "Bạn muốn thay đổi biến nào trong kịch bản?",
                    List.of("Thu nhập", "Chi tiêu", "Cả hai"), maxQuestions)
                    : question("scenario_delta_dimension", "Which variable do you want to change in the scenario?",
                    List.of("Income", "Spending", "Both"), maxQuestions);
        }

        if (topSet.equals(EnumSet.of(IntentName.PLANNING, IntentName.SCENARIO))) {
            return vietnamese
                    ? question("planning_vs_scenario", "Bạn đang muốn lập kế hoạch tiết kiệm hay so sánh kịch bản what-if?",
                    List.of("Lập kế hoạch tiết kiệm", "So sánh kịch bản what-if"), maxQuestions)
                    : question("planning_vs_scenario", "Do you want a savings plan or a what-if scenario comparison?",
                    List.of("Savings plan", "What-if scenario comparison"), maxQuestions);
        }

        if (topSet.equals(EnumSet.of(IntentName.SUMMARY, IntentName.RISK))) {
            return vietnamese
                    ? question("summary_vs_risk", "Bạn muốn xem tổng quan dòng tiền hay cảnh báo rủi ro?",
                    List.of("Tổng quan dòng tiền", "Cảnh báo rủi ro"), maxQuestions)
                    : question("summary_vs_risk", "Do you want a cashflow overview or risk alerts?",
                    List.of("Cashflow overview", "Risk alerts"), maxQuestions);
        }

        if (reasons.contains("low_top2_gap") && topSet.size() == 2) {
            Map<IntentName, String> labels = vietnamese ? INTENT_LABELS_VI : INTENT_LABELS_EN;
            List<String> options = topIntents.stream().map(labels::get).toList();
            return vietnamese
                    ? question("intent_pair", "Yêu cầu của bạn gần với lựa chọn nào hơn?", options, maxQuestions)
                    : question("intent_pair", "Which of these is closer to what you need?", options, maxQuestions);
        }

        return vietnamese
                ? question("generic_intent", "Để tư vấn chính xác, bạn vui lòng chọn mục tiêu chính:",
                List.of("Tổng quan dòng tiền", "Kế hoạch tiết kiệm", "Phân tích kịch bản"), maxQuestions)
                : question("generic_intent", "To advise accurately, please choose your main goal:",
                List.of("Cashflow overview", "Savings plan", "Scenario analysis"), maxQuestions);
    }

    /**
     * Advances the round counter after a clarifying turn and resets it after a decisive route.
     * A route forced through by an exhausted counter keeps the round, so an ambiguous conversation
     * is never asked again.
     *
     * @param state    session clarification state, updated in place
     * @param decision decision served for this turn
     */
    public void advance(ClarificationState state, RouteDecision decision) {
        if (decision.clarifyNeeded()) {
            state.setPending(true);
            state.setRound(state.getRound() + 1);
            state.setQuestion(decision.clarifyingQuestion());
            state.setAskedAt(Instant.now());
            log.debug("Clarification round advanced - round: {}, max: {}, questionId: {}",
                    state.getRound(), state.getMaxQuestions(),
                    decision.clarifyingQuestion() != null ? decision.clarifyingQuestion().questionId() : "none");
            return;
        }
        state.setPending(false);
        state.setQuestion(null);
        state.setAskedAt(null);
        if (decision.isClarifyExhausted()) {
            log.debug("Clarification exhausted, round kept - round: {}, max: {}",
                    state.getRound(), state.getMaxQuestions());
            return;
        }
        state.setRound(0);
    }

    /**
     * Renders a question with its numbered options.
     */
    public String render(ClarifyingQuestion question) {
        String options = IntStream.range(0, question.options().size())
                .mapToObj(i -> (i + 1) + ". " + question.options().get(i))
                .collect(Collectors.joining("\n"));
        return options.isEmpty() ? question.questionText() : question.questionText() + "\n" + options;
    }

    private static ClarifyingQuestion question(String id, String text, List<String> options, int maxQuestions) {
        return new ClarifyingQuestion(id, text, options, maxQuestions);
    }
}
