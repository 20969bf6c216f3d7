package com.demoBank.advisor.router.prompt;

/**
 * Prompt for the structured intent and slot extractor.
 */
public class IntentExtractionPrompt {

    public static final String PROMPT_VERSION = "intent_extractor_v1";

    private IntentExtractionPrompt() {}

    private static final String INSTRUCTIONS = """
            You are an intent+slot extractor for a fintech advisor.
            Return ONLY one valid JSON object.
            Do not add markdown, comments, or explanation.
            Use schema_version='intent_extraction_v1'.
            Allowed intent values: summary, risk, planning, scenario, invest, out_of_scope.
            top2 must contain exactly two intent+score entries.
            scores must be between 0 and 1.
            domain_relevance must be between 0 and 1 and represent how related the prompt is to personal-finance advisory scope.
            slots should include structured values when present.
            Classify as scenario only for explicit what-if/counterfactual prompts (e.g., neu/gia su/what-if with changes).
            If user asks current-state analysis by period (30/60/90 days) without hypothetical changes, prefer summary or risk.
            If user asks feasibility of goals (buy house/save target), prefer planning unless explicit what-if deltas are requested.
            If prompt is not about personal finance advisory (cashflow, budgeting, non-investment risk, planning, what-if), classify as out_of_scope.
            For scenario intent, extract if possible: horizon_months, income_delta_pct, spend_delta_pct, income_delta_amount_vnd, spend_delta_amount_vnd.
            For summary or risk intent, extract lookback_days when the user names a period in days.
            For planning intent, extract target_amount_vnd and horizon_months when stated.
            If user states risk preference, extract slots.risk_appetite with one of: conservative, moderate, aggressive.
            If missing values, keep slots empty rather than hallucinating.
            Output JSON fields: schema_version, intent, sub_intent, confidence, domain_relevance, top2, slots, scenario_confidence, reason.
            """;

    /**
     * Builds the extraction prompt for one user prompt.
     *
     * @param userPrompt prompt after the encoding gate
     * @return full prompt text
     */
    public static String build(String userPrompt) {
        return INSTRUCTIONS + "User prompt: " + userPrompt;
    }
}
