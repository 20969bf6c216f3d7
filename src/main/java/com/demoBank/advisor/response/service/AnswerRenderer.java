package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.KeyMetric;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a validated answer plan as markdown-style text with placeholders bound to fact values.
 */
@Service
public class AnswerRenderer {

    public String render(AnswerPlan plan, AdvisoryContext context) {
        Map<String, Fact> facts = RenderSupport.index(context);
        boolean vi = "vi".equals(plan.language());
        List<String> lines = new ArrayList<>();

        lines.add(vi ? "**Tổng Quan Chính**" : "**Main Overview**");
        List<String> overview = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> summaryFactIds = new HashSet<>();
        for (String item : plan.summaryLines()) {
            summaryFactIds.addAll(GroundingValidator.placeholderIds(item));
            RenderSupport.appendUnique(overview, seen, "- " + RenderSupport.bind(item, facts));
        }
        for (KeyMetric metric : plan.keyMetrics()) {
            String factId = metric.factId() == null ? "" : metric.factId().trim();
            if (factId.startsWith("anomaly.flag_reason.") || summaryFactIds.contains(factId)) {
                continue;
            }
            String label = metric.label() == null ? "" : metric.label().trim();
            Fact fact = facts.get(factId);
            if (fact == null) {
                RenderSupport.appendUnique(overview, seen,
                        "- " + (label.isEmpty() ? factId : label) + ": " + RenderSupport.NOT_AVAILABLE);
                continue;
            }
            String timeframe = fact.timeframe().isBlank() ? "" : " (" + fact.timeframe() + ")";
            RenderSupport.appendUnique(overview, seen, "- " + (label.isEmpty() ? fact.label() : label) + ": "
                    + RenderSupport.localizedValue(fact, vi) + timeframe);
        }
        if (overview.isEmpty()) {
            overview.add("- " + RenderSupport.NOT_AVAILABLE);
        }
        lines.addAll(overview);

        lines.add("");
        lines.add(vi ? "**Khuyến Nghị Tư Vấn**" : "**Advisory Actions**");
        for (int i = 0; i < plan.actions().size(); i++) {
            lines.add((i + 1) + ". " + RenderSupport.bind(plan.actions().get(i), facts));
        }

        lines.add("");
        lines.add(vi ? "**Giả Định Và Giới Hạn Dữ Liệu**" : "**Assumptions & Limits**");
        plan.assumptions().forEach(item ->
                lines.add((vi ? "- Giả định: " : "- Assumption: ") + RenderSupport.bind(item, facts)));
        plan.limitations().forEach(item ->
                lines.add((vi ? "- Giới hạn: " : "- Limitation: ") + RenderSupport.bind(item, facts)));
        if (plan.assumptions().isEmpty() && plan.limitations().isEmpty()) {
            lines.add("- " + RenderSupport.NOT_AVAILABLE);
        }

        lines.add("");
        lines.add("**Disclaimer**");
        lines.add("- " + plan.disclaimer());
        return String.join("\n", lines);
    }
}
