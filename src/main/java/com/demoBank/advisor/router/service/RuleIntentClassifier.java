package com.demoBank.advisor.router.service;

import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.TopIntentScore;
import com.demoBank.advisor.router.util.PromptText;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword classifier used in rule mode and as the served decision in semantic shadow mode.
 * Produces a fully confident extraction so it never triggers clarification.
 */
@Service
public class RuleIntentClassifier {

    private static final Pattern INVEST_ORDER = Pattern.compile(
            "\\b(mua|buy|ban|sell)\\s+(co phieu|chung khoan|crypto|coin|etf|stock|shares?|bond|trai phieu)\\b");
    private static final List<String> INVEST_TERMS = List.of(
            "co phieu", "chung khoan", "crypto", "etf", "stock", "dau tu", "invest", "portfolio", "trai phieu");
    private static final List<String> RISK_TERMS = List.of(
            "bat thuong", "anomaly", "fraud", "lua dao", "rui ro", "risk", "canh bao", "suspicious");
    private static final List<String> SCENARIO_TERMS = List.of(
            "what if", "what-if", "gia su", "kich ban", "scenario");
    private static final List<String> PLANNING_TERMS = List.of(
            "tiet kiem", "saving", "muc tieu", "goal", "mua nha", "ke hoach", "plan", "ngan sach", "budget");
    private static final List<String> SUMMARY_TERMS = List.of(
            "chi tieu", "dong tien", "thu nhap", "tong quan", "giao dich", "spend", "cashflow", "income",
            "summary", "overview", "transaction");

    /**
     * Classifies the prompt by keyword groups in a fixed order.
     *
     * @param prompt admitted prompt
     * @return extraction with confidence 1 and a second candidate scored 0
     */
    public IntentExtraction classify(String prompt) {
        String text = PromptText.fold(prompt);
        IntentName intent = classifyFolded(text);
        IntentName runnerUp = intent == IntentName.SUMMARY ? IntentName.OUT_OF_SCOPE : IntentName.SUMMARY;
        double relevance = intent == IntentName.OUT_OF_SCOPE ? 0.0 : 1.0;
        return new IntentExtraction(intent, "", 1.0, relevance,
                List.of(new TopIntentScore(intent, 1.0), new TopIntentScore(runnerUp, 0.0)),
                Map.of(), null, "rule_classifier");
    }

    private static IntentName classifyFolded(String text) {
        if (INVEST_ORDER.matcher(text).find() || PromptText.containsAny(text, INVEST_TERMS)) {
            return IntentName.INVEST;
        }
        if (PromptText.containsAny(text, RISK_TERMS)) {
            return IntentName.RISK;
        }
        if (PromptText.containsAny(text, SCENARIO_TERMS)) {
            return IntentName.SCENARIO;
        }
        if (PromptText.containsAny(text, PLANNING_TERMS)) {
            return IntentName.PLANNING;
        }
        if (PromptText.containsAny(text, SUMMARY_TERMS)) {
            return IntentName.SUMMARY;
        }
        return IntentName.OUT_OF_SCOPE;
    }
}
