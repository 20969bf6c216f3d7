package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.ActionCandidate;
import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.EvidencePack;
import com.demoBank.advisor.response.model.Insight;
import com.demoBank.advisor.response.model.RiskAppetite;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the advisory context from evidence: insights, then actions, then policy flags.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdvisoryContextBuilder {

    private final InsightRuleTable insightRuleTable;
    private final ActionPolicy actionPolicy;

    public record Assembly(AdvisoryContext context, List<String> reasonCodes) {}

    public Assembly build(EvidencePack evidence, String policyVersion) {
        List<Insight> insights = insightRuleTable.derive(evidence.intent(), evidence.facts(), evidence.policyFlags());
        RiskAppetite appetite = RiskAppetite.resolve(evidence.policyFlags(), evidence.fact("slot.risk_appetite"));
        List<ActionCandidate> actions = actionPolicy.plan(evidence.intent(), insights, appetite,
                evidence.isVietnamese());

        List<String> reasonCodes = new ArrayList<>();
        if (insights.isEmpty()) {
            reasonCodes.add("insights_empty");
        }
        if (actions.isEmpty()) {
            reasonCodes.add("action_candidates_empty");
        }

        Map<String, Object> policyFlags = new LinkedHashMap<>(evidence.policyFlags());
        policyFlags.put("policy_version", policyVersion);

        AdvisoryContext context = new AdvisoryContext(AdvisoryContext.SCHEMA_VERSION, evidence.intent(),
                evidence.language(), evidence.facts(), insights, actions, evidence.citations(), policyFlags);
        log.debug("Advisory context built - intent: {}, insights: {}, actions: {}",
                evidence.intent(), insights.size(), actions.size());
        return new Assembly(context, reasonCodes);
    }
}
