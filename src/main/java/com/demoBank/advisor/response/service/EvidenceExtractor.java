package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.EvidencePack;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.util.JsonValues;
import com.demoBank.advisor.response.util.ValueFormats;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.util.PromptText;
import com.demoBank.advisor.tools.model.KnowledgeBaseResult;
import com.demoBank.advisor.tools.model.KnowledgeMatch;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.util.SlotValues;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evidence extraction - turns tool outputs, slots and knowledge-base passages into facts.
 *
 * Responsibilities:
 * - Read each tool's output only through its own extractor
 * - Omit facts whose source fields are missing instead of defaulting them
 * - Format values once, so answers can quote valueText verbatim
 * - Flag turns whose intent lacks its required fact family with {@code insufficient_facts}
 */
@Slf4j
@Service
public class EvidenceExtractor {

    public static final String INSUFFICIENT_FACTS = "insufficient_facts";
    static final String SLOT_SOURCE = "intent_extraction";
    static final String KB_SOURCE = "retrieve_from_aws_kb";
    static final int ANOMALY_REASON_MAX = 5;

    private static final List<String> FLAG_PRIORITY = List.of(
            "change_point", "category_spike", "spend_outlier", "spend_drift", "abnormal_spend", "income_drop",
            "low_balance_risk");

    private record ServiceCategory(String family, String labelEn, String labelVi, List<String> terms) {}

    private static final List<ServiceCategory> SERVICE_CATEGORIES = List.of(
            new ServiceCategory("savings_deposit", "Savings and deposit services available",
                    "Có dịch vụ tiết kiệm và tiền gửi",
                    List.of("saving", "tiet kiem", "deposit", "term deposit", "recurring savings", "goal bucket")),
            new ServiceCategory("loans_credit", "Loan and credit services available",
                    "Có dịch vụ vay và tín dụng",
                    List.of("loan", "vay", "overdraft", "debt consolidation", "installment")),
            new ServiceCategory("cards_payments", "Card and payment control services available",
                    "Có dịch vụ thẻ và kiểm soát thanh toán",
                    List.of("credit card", "debit card", "auto debit", "payment", "spend cap")),
            new ServiceCategory("service_playbook", "Service advisory playbook available",
                    "Có hướng dẫn tư vấn dịch vụ",
                    List.of("advisory playbook", "service suggestion policy", "mapping guide")));

    /**
     * Evidence for one turn plus the reason codes raised while building it.
     */
    public record Extraction(EvidencePack evidence, List<String> reasonCodes) {}

    /**
     * Builds the evidence pack.
     *
     * @param intent      routed intent
     * @param language    "vi" or "en"
     * @param outputs     successful tool outputs keyed by tool
     * @param kb          knowledge-base result, may be null
     * @param policyFlags policy flags of the turn
     * @param slots       extracted slots, may be empty
     */
    public Extraction extract(IntentName intent, String language, Map<ToolName, JsonNode> outputs,
                              KnowledgeBaseResult kb, Map<String, Object> policyFlags, Map<String, Object> slots) {
        boolean vi = "vi".equals(language);
        List<Fact> facts = new ArrayList<>();

        extractSpend(outputs.get(ToolName.SPEND_ANALYTICS), vi, facts);
        extractForecast(outputs.get(ToolName.CASHFLOW_FORECAST), vi, facts);
        extractRisk(outputs.get(ToolName.RISK_PROFILE_NON_INVESTMENT), vi, facts);
        extractAnomaly(outputs.get(ToolName.ANOMALY_SIGNALS), vi, facts);
        extractGoal(outputs.get(ToolName.GOAL_FEASIBILITY), vi, facts);
        extractRecurring(outputs.get(ToolName.RECURRING_CASHFLOW_DETECT), vi, facts);
        extractJar(outputs.get(ToolName.JAR_ALLOCATION_SUGGEST), vi, facts);
        extractScenario(outputs.get(ToolName.WHAT_IF_SCENARIO), vi, facts);
        extractGuard(outputs.get(ToolName.SUITABILITY_GUARD), vi, facts);
        extractSlots(slots == null ? Map.of() : slots, vi, facts);
        extractServiceCategories(kb, vi, facts);

        IntentName effectiveIntent = intent == null ? IntentName.OUT_OF_SCOPE : intent;
        List<String> reasonCodes = new ArrayList<>();
        List<String> required = requiredPrefixes(effectiveIntent);
        boolean covered = facts.stream().anyMatch(fact -> required.stream().anyMatch(fact.factId()::startsWith));
        if (!covered) {
            reasonCodes.add(INSUFFICIENT_FACTS);
        }

        EvidencePack evidence = new EvidencePack(EvidencePack.SCHEMA_VERSION, effectiveIntent, vi ? "vi" : "en",
                facts, kb == null ? List.of() : kb.citations(), policyFlags);
        log.debug("Evidence extracted - intent: {}, facts: {}, reasonCodes: {}", effectiveIntent, facts.size(), reasonCodes);
        return new Extraction(evidence, reasonCodes);
    }

    /**
     * Fact id prefixes of which at least one must be present for the intent.
     */
    public static List<String> requiredPrefixes(IntentName intent) {
        return switch (intent) {
            case SUMMARY -> List.of("spend.", "forecast.");
            case RISK -> List.of("risk.");
            case PLANNING -> List.of("goal.", "spend.");
            case SCENARIO -> List.of("scenario.");
            case INVEST, OUT_OF_SCOPE -> List.of("policy.");
        };
    }

    private void extractSpend(JsonNode spend, boolean vi, List<Fact> facts) {
        if (spend == null || !spend.isObject()) {
            return;
        }
        String timeframe = sanitizeTimeframe(JsonValues.text(spend, "range"), "30d");
        String tool = ToolName.SPEND_ANALYTICS.code();
        Optional<Double> income = JsonValues.number(spend, "total_income");
        Optional<Double> total = JsonValues.number(spend, "total_spend");
        Optional<Double> net = JsonValues.number(spend, "net_cashflow");
        if (net.isEmpty() && income.isPresent() && total.isPresent()) {
            net = Optional.of(income.get() - total.get());
        }

        income.ifPresent(value -> facts.add(new Fact("spend.total_income." + timeframe,
                label(vi, "Total income", "Tổng thu nhập"), value, ValueFormats.money(value), "VND", timeframe,
                tool, "total_income")));
        total.ifPresent(value -> facts.add(new Fact("spend.total_spend." + timeframe,
                label(vi, "Total spend", "Tổng chi tiêu"), value, ValueFormats.money(value), "VND", timeframe,
                tool, "total_spend")));
        net.ifPresent(value -> facts.add(new Fact("spend.net_cashflow." + timeframe,
                label(vi, "Net cashflow", "Dòng tiền ròng"), value, ValueFormats.signedMoney(value), "VND",
                timeframe, tool, "net_cashflow")));
    }

    private void extractForecast(JsonNode forecast, boolean vi, List<Fact> facts) {
        if (forecast == null || !forecast.isObject()) {
            return;
        }
        JsonNode points = forecast.get("points");
        if (points == null || !points.isArray() || points.isEmpty()) {
            return;
        }
        String tool = ToolName.CASHFLOW_FORECAST.code();
        String timeframe = "weekly_12";

        average(points, "income_estimate").ifPresent(value -> facts.add(new Fact("forecast.avg_income." + timeframe,
                label(vi, "Average forecast income per period", "Thu nhập dự báo trung bình/kỳ"), value,
                ValueFormats.money(value), "VND", timeframe, tool, "points[].income_estimate")));
        average(points, "spend_estimate").ifPresent(value -> facts.add(new Fact("forecast.avg_spend." + timeframe,
                label(vi, "Average forecast spend per period", "Chi tiêu dự báo trung bình/kỳ"), value,
                ValueFormats.money(value), "VND", timeframe, tool, "points[].spend_estimate")));
        average(points, "p50").ifPresent(value -> facts.add(new Fact("forecast.avg_net_p50." + timeframe,
                label(vi, "Average forecast net P50 per period", "Net P50 dự báo trung bình/kỳ"), value,
                ValueFormats.signedMoney(value), "VND", timeframe, tool, "points[].p50")));
    }

    private void extractRisk(JsonNode risk, boolean vi, List<Fact> facts) {
        if (risk == null || !risk.isObject()) {
            return;
        }
        int lookback = clamp(JsonValues.integer(risk, "lookback_days").orElse(180), 60, 720);
        String timeframe = lookback + "d";
        String tool = ToolName.RISK_PROFILE_NON_INVESTMENT.code();

        String band = JsonValues.text(risk, "risk_band").toLowerCase(Locale.ROOT);
        if (!band.isEmpty()) {
            facts.add(new Fact("risk.risk_band." + timeframe, label(vi, "Risk level", "Mức rủi ro"), band, band,
                    "", timeframe, tool, "risk_band"));
        }
        JsonValues.number(risk, "emergency_runway_months").ifPresent(value -> facts.add(new Fact(
                "risk.runway_months." + timeframe, label(vi, "Emergency runway", "Runway dự phòng"), value,
                ValueFormats.decimal(value), "months", timeframe, tool, "emergency_runway_months")));
        JsonValues.number(risk, "cashflow_volatility").ifPresent(value -> facts.add(new Fact(
                "risk.cashflow_volatility." + timeframe, label(vi, "Cashflow volatility", "Biến động dòng tiền"),
                value, ValueFormats.percent(value), "pct", timeframe, tool, "cashflow_volatility")));
        JsonValues.number(risk, "overspend_propensity").ifPresent(value -> facts.add(new Fact(
                "risk.overspend_propensity." + timeframe, label(vi, "Overspend propensity", "Xác suất vượt chi"),
                value, ValueFormats.percent(value), "pct", timeframe, tool, "overspend_propensity")));
    }

    private void extractAnomaly(JsonNode anomaly, boolean vi, List<Fact> facts) {
        if (anomaly == null || !anomaly.isObject()) {
            return;
        }
        int lookback = clamp(JsonValues.integer(anomaly, "lookback_days").orElse(90), 30, 365);
        String timeframe = lookback + "d";
        String tool = ToolName.ANOMALY_SIGNALS.code();

        if (anomaly.has("flags")) {
            List<String> flags = prioritizedFlags(JsonValues.texts(anomaly, "flags"));
            facts.add(new Fact("anomaly.flags_count." + timeframe,
                    label(vi, "Anomaly alerts", "Số cảnh báo bất thường"), flags.size(),
                    String.valueOf(flags.size()), "", timeframe, tool, "flags"));
            if (!flags.isEmpty()) {
                facts.add(new Fact("anomaly.top_flag." + timeframe, label(vi, "Main alert", "Cảnh báo chính"),
                        flags.get(0), flags.get(0), "", timeframe, tool, "flags[0]"));
                List<String> highlights = flags.subList(0, Math.min(ANOMALY_REASON_MAX, flags.size()));
                facts.add(new Fact("anomaly.top_flags." + timeframe,
                        label(vi, "Highlighted alerts", "Cảnh báo nổi bật"), List.copyOf(highlights),
                        String.join(", ", highlights), "", timeframe, tool, "flags"));
                for (int i = 0; i < highlights.size(); i++) {
                    String flag = highlights.get(i);
                    int index = i + 1;
                    facts.add(new Fact("anomaly.flag_reason." + index + "." + timeframe,
                            label(vi, "Alert reason " + index, "Lý do cảnh báo " + index), flag,
                            AnomalyReasons.describe(flag, anomaly, vi), "", timeframe, tool, "flags::" + flag));
                }
            }
        }

        List<String> changePoints = AnomalyReasons.changePoints(anomaly);
        if (!changePoints.isEmpty()) {
            facts.add(new Fact("anomaly.change_points." + timeframe,
                    label(vi, "Spending change dates", "Các mốc ngày biến động chi tiêu"), List.copyOf(changePoints),
                    String.join(", ", changePoints), "", timeframe, tool,
                    "external_engines.ruptures_pelt.change_points"));
            String latest = changePoints.get(changePoints.size() - 1);
            facts.add(new Fact("anomaly.latest_change_point." + timeframe,
                    label(vi, "Latest anomaly date", "Ngày bất thường gần nhất"), latest, latest, "", timeframe,
                    tool, "external_engines.ruptures_pelt.change_points[-1]"));
        }
    }

    private void extractGoal(JsonNode goal, boolean vi, List<Fact> facts) {
        if (goal == null || !goal.isObject()) {
            return;
        }
        String tool = ToolName.GOAL_FEASIBILITY.code();
        String status = JsonValues.text(goal, "status").toLowerCase(Locale.ROOT);
        if (status.startsWith("insufficient_")) {
            addInsufficientStatus("goal", status, JsonValues.texts(goal, "reason_codes"), tool, vi, facts,
                    "Goal feasibility data status", "Trạng thái dữ liệu mục tiêu");
            return;
        }

        Optional<Double> horizon = JsonValues.number(goal, "horizon_months").filter(value -> value > 0);
        String horizonFrame = horizon.map(value -> Math.round(value) + "m").orElse("");

        JsonValues.number(goal, "target_amount").filter(value -> value > 0).ifPresent(value -> facts.add(new Fact(
                "goal.target_amount", label(vi, "Savings target", "Mục tiêu tiết kiệm"), value,
                ValueFormats.money(value), "VND", horizonFrame, tool, "target_amount")));
        horizon.ifPresent(value -> facts.add(new Fact("goal.horizon_months",
                label(vi, "Goal horizon", "Kỳ hạn mục tiêu"), Math.round(value), String.valueOf(Math.round(value)),
                "months", "", tool, "horizon_months")));
        JsonValues.number(goal, "required_monthly_saving").filter(value -> value > 0).ifPresent(value ->
                facts.add(new Fact("goal.required_monthly_saving",
                        label(vi, "Required monthly saving", "Tiết kiệm tối thiểu mỗi tháng"), value,
                        ValueFormats.money(value), "VND", "", tool, "required_monthly_saving")));
        JsonNode feasible = goal.get("feasible");
        if (feasible != null && feasible.isBoolean()) {
            boolean value = feasible.asBoolean();
            String text = vi ? (value ? "khả thi" : "chưa khả thi") : (value ? "feasible" : "not feasible");
            facts.add(new Fact("goal.feasible", label(vi, "Goal feasibility", "Tính khả thi mục tiêu"), value,
                    text, "", "", tool, "feasible"));
        }
        JsonValues.number(goal, "gap_amount").filter(value -> value > 0).ifPresent(value -> facts.add(new Fact(
                "goal.gap_amount", label(vi, "Gap to target", "Khoảng thiếu so với mục tiêu"), value,
                ValueFormats.money(value), "VND", "", tool, "gap_amount")));
    }

    private void extractRecurring(JsonNode recurring, boolean vi, List<Fact> facts) {
        if (recurring == null || !recurring.isObject()) {
            return;
        }
        int lookback = clamp(JsonValues.integer(recurring, "lookback_months").orElse(6), 3, 24);
        String timeframe = lookback + "m";
        JsonValues.number(recurring, "fixed_cost_ratio").filter(value -> value > 0).ifPresent(value ->
                facts.add(new Fact("recurring.fixed_cost_ratio." + timeframe,
                        label(vi, "Fixed cost ratio", "Tỷ lệ chi phí cố định"), value, ValueFormats.percent(value),
                        "pct", timeframe, ToolName.RECURRING_CASHFLOW_DETECT.code(), "fixed_cost_ratio")));
    }

    private void extractJar(JsonNode allocation, boolean vi, List<Fact> facts) {
        if (allocation == null || !allocation.isObject()) {
            return;
        }
        String tool = ToolName.JAR_ALLOCATION_SUGGEST.code();
        String status = JsonValues.text(allocation, "status").toLowerCase(Locale.ROOT);
        if (status.startsWith("insufficient_")) {
            addInsufficientStatus("jar", status, JsonValues.texts(allocation, "reason_codes"), tool, vi, facts,
                    "Jar allocation data status", "Trạng thái dữ liệu phân bổ");
            return;
        }
        JsonNode rows = allocation.get("allocations");
        if (rows == null || !rows.isArray() || rows.isEmpty() || !rows.get(0).isObject()) {
            return;
        }
        JsonNode first = rows.get(0);
        String name = JsonValues.text(first, "jar_name");
        if (!name.isEmpty()) {
            facts.add(new Fact("jar.top.name", label(vi, "Priority allocation bucket", "Nhóm phân bổ ưu tiên"),
                    name, name, "", "", tool, "allocations[0].jar_name"));
        }
        JsonValues.number(first, "ratio").filter(value -> value > 0).ifPresent(value -> facts.add(new Fact(
                "jar.top.ratio", label(vi, "Priority bucket ratio", "Tỷ lệ phân bổ nhóm ưu tiên"), value,
                ValueFormats.percent(value), "pct", "", tool, "allocations[0].ratio")));
        JsonValues.number(first, "amount").filter(value -> value > 0).ifPresent(value -> facts.add(new Fact(
                "jar.top.amount", label(vi, "Priority bucket amount", "Số tiền phân bổ nhóm ưu tiên"), value,
                ValueFormats.money(value), "VND", "", tool, "allocations[0].amount")));
    }

    private void extractScenario(JsonNode raw, boolean vi, List<Fact> facts) {
        if (raw == null || !raw.isObject()) {
            return;
        }
        JsonNode scenario = scenarioPayload(raw);
        String tool = ToolName.WHAT_IF_SCENARIO.code();

        JsonValues.number(scenario, "base_total_net_p50").ifPresent(value -> facts.add(new Fact(
                "scenario.base_total_net_p50", label(vi, "Baseline total net P50", "Tổng net P50 cơ sở"), value,
                ValueFormats.money(value), "VND", "", tool, "base_total_net_p50")));

        String bestVariant = JsonValues.text(scenario, "best_variant_by_goal");
        if (bestVariant.isEmpty()) {
            return;
        }
        facts.add(new Fact("scenario.best_variant.name", label(vi, "Best scenario", "Kịch bản tốt nhất"),
                bestVariant, bestVariant, "", "", tool, "best_variant_by_goal"));
        JsonNode comparisons = scenario.get("scenario_comparison");
        if (comparisons == null || !comparisons.isArray()) {
            return;
        }
        for (JsonNode row : comparisons) {
            if (!bestVariant.equals(JsonValues.text(row, "name"))) {
                continue;
            }
            JsonValues.number(row, "delta_vs_base").ifPresent(value -> facts.add(new Fact(
                    "scenario.best_variant.delta",
                    label(vi, "Best scenario delta vs baseline", "Delta kịch bản tốt nhất so với cơ sở"), value,
                    ValueFormats.signedMoney(value), "VND", "", tool, "scenario_comparison[].delta_vs_base")));
            break;
        }
    }

    private void extractGuard(JsonNode guard, boolean vi, List<Fact> facts) {
        if (guard == null || !guard.isObject()) {
            return;
        }
        String tool = ToolName.SUITABILITY_GUARD.code();
        JsonNode allow = guard.get("allow");
        if (allow != null && allow.isBoolean()) {
            boolean value = allow.asBoolean();
            facts.add(new Fact("policy.suitability.allow", label(vi, "Policy allows request", "Trạng thái policy cho phép"),
                    value, value ? "allow" : "deny", "", "", tool, "allow"));
        }
        String decision = JsonValues.text(guard, "decision");
        if (!decision.isEmpty()) {
            facts.add(new Fact("policy.suitability.decision", label(vi, "Suitability decision", "Quyết định suitability"),
                    decision, decision, "", "", tool, "decision"));
        }
    }

    private void extractSlots(Map<String, Object> slots, boolean vi, List<Fact> facts) {
        SlotValues.firstPositive(slots, SlotValues.TARGET_AMOUNT_KEYS).ifPresent(value -> facts.add(new Fact(
                "slot.target_amount_vnd", label(vi, "Target amount from request", "Mục tiêu số tiền từ yêu cầu"),
                value, ValueFormats.money(value), "VND", "", SLOT_SOURCE, "slots.target_amount_vnd")));

        SlotValues.firstPositive(slots, SlotValues.HORIZON_KEYS).map(value -> (int) Math.floor(value))
                .filter(value -> value > 0)
                .ifPresent(value -> facts.add(new Fact("slot.horizon_months",
                        label(vi, "Horizon from request", "Kỳ hạn từ yêu cầu"), value, String.valueOf(value),
                        "months", "", SLOT_SOURCE, "slots.horizon_months")));

        String appetite = SlotValues.text(slots, "risk_appetite").toLowerCase(Locale.ROOT);
        if (Set.of("conservative", "moderate", "aggressive").contains(appetite)) {
            facts.add(new Fact("slot.risk_appetite", label(vi, "Risk appetite from request", "Khẩu vị rủi ro từ yêu cầu"),
                    appetite, appetiteText(appetite, vi), "", "", SLOT_SOURCE, "slots.risk_appetite"));
        }

        for (String key : List.of("income_delta_pct", "spend_delta_pct")) {
            SlotValues.number(slots, key)
                    .map(value -> Math.abs(value) > 1.0 ? value / 100.0 : value)
                    .filter(value -> value != 0.0)
                    .ifPresent(value -> facts.add(new Fact("slot." + key,
                            label(vi, slotLabel(key, false), slotLabel(key, true)), value, ValueFormats.percent(value),
                            "pct", "", SLOT_SOURCE, "slots." + key)));
        }
        for (String key : List.of("income_delta_amount_vnd", "spend_delta_amount_vnd")) {
            SlotValues.number(slots, key)
                    .filter(value -> value > 0)
                    .ifPresent(value -> facts.add(new Fact("slot." + key,
                            label(vi, slotLabel(key, false), slotLabel(key, true)), value, ValueFormats.money(value),
                            "VND", "", SLOT_SOURCE, "slots." + key)));
        }
    }

    private void extractServiceCategories(KnowledgeBaseResult kb, boolean vi, List<Fact> facts) {
        if (kb == null || kb.matches().isEmpty()) {
            return;
        }
        List<String> parts = new ArrayList<>();
        for (KnowledgeMatch match : kb.matches()) {
            for (String value : new String[]{match.snippet(), match.citation()}) {
                if (value != null && !value.isBlank()) {
                    parts.add(value.trim());
                }
            }
        }
        if (!kb.note().isBlank()) {
            parts.add(kb.note().trim());
        }
        if (parts.isEmpty()) {
            return;
        }
        String corpus = PromptText.fold(String.join(" ", parts));

        Set<String> existing = new HashSet<>();
        facts.forEach(fact -> existing.add(fact.factId()));
        int matched = 0;
        for (ServiceCategory category : SERVICE_CATEGORIES) {
            String factId = "kb.service_category." + category.family();
            if (existing.contains(factId) || !PromptText.containsAny(corpus, category.terms())) {
                continue;
            }
            facts.add(new Fact(factId, vi ? category.labelVi() : category.labelEn(), true, "available", "", "",
                    KB_SOURCE, "matches[].text"));
            existing.add(factId);
            matched++;
        }
        if (matched > 0) {
            facts.add(new Fact("kb.service_category.count",
                    label(vi, "Service categories supported by the knowledge base", "Số nhóm dịch vụ có trong tri thức"),
                    matched, String.valueOf(matched), "", "", KB_SOURCE, "matches[].text"));
        }
    }

    private static void addInsufficientStatus(String family, String status, List<String> reasons, String tool,
                                              boolean vi, List<Fact> facts, String labelEn, String labelVi) {
        String reasonText = reasons.isEmpty() ? status : String.join(", ", reasons);
        facts.add(new Fact(family + ".status", label(vi, labelEn, labelVi), status, status, "", "", tool, "status"));
        facts.add(new Fact(family + ".reason_codes", label(vi, "Missing data reasons", "Lý do thiếu dữ liệu"),
                List.copyOf(reasons), reasonText, "", "", tool, "reason_codes"));
    }

    private static JsonNode scenarioPayload(JsonNode raw) {
        if (raw.has("scenario_comparison") || raw.has("best_variant_by_goal")) {
            return raw;
        }
        for (String key : List.of("payload", "result", "data", "output")) {
            JsonNode nested = raw.get(key);
            if (nested != null && nested.isObject()
                    && (nested.has("scenario_comparison") || nested.has("best_variant_by_goal"))) {
                return nested;
            }
        }
        return raw;
    }

    static List<String> prioritizedFlags(List<String> rawFlags) {
        Set<String> distinct = new LinkedHashSet<>();
        rawFlags.forEach(flag -> distinct.add(flag.toLowerCase(Locale.ROOT)));
        return distinct.stream()
                .sorted(Comparator.comparingInt(EvidenceExtractor::flagRank).thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private static int flagRank(String flag) {
        int index = FLAG_PRIORITY.indexOf(flag);
        return index < 0 ? 99 : index;
    }

    private static Optional<Double> average(JsonNode points, String field) {
        double sum = 0.0;
        int count = 0;
        for (JsonNode point : points) {
            Optional<Double> value = JsonValues.number(point, field);
            if (value.isPresent()) {
                sum += value.get();
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of(sum / count);
    }

    static String sanitizeTimeframe(String raw, String defaultValue) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "");
        return normalized.isEmpty() ? defaultValue : normalized;
    }

    private static String appetiteText(String appetite, boolean vi) {
        if (!vi) {
            return appetite;
        }
        return switch (appetite) {
            case "conservative" -> "thận trọng";
            case "moderate" -> "cân bằng";
            default -> "chấp nhận rủi ro cao";
        };
    }

    private static String slotLabel(String key, boolean vi) {
        return switch (key) {
            case "income_delta_pct" -> vi ? "Thay đổi thu nhập (%) từ yêu cầu" : "Requested income change (%)";
            case "spend_delta_pct" -> vi ? "Thay đổi chi tiêu (%) từ yêu cầu" : "Requested spend change (%)";
            case "income_delta_amount_vnd" -> vi ? "Thay đổi thu nhập từ yêu cầu" : "Requested income change";
            default -> vi ? "Thay đổi chi tiêu từ yêu cầu" : "Requested spend change";
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String label(boolean vi, String english, String vietnamese) {
        return vi ? vietnamese : english;
    }
}
