package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.RiskAppetite;
import com.demoBank.advisor.router.model.IntentName;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic answer built from facts and fixed templates. Used when generation is off, fails or is rejected.
 */
@Service
public class FallbackRenderer {

    private static final Pattern REASON_ID = Pattern.compile("^anomaly\\.flag_reason\\.(\\d+)\\.(\\d+)d$");
    private static final int TOP_FACTS = 4;
    private static final int TIMEFRAME_FACTS = 5;
    private static final int MAX_ACTIONS = 4;

    private record RankedReason(int rank, int windowDays, Fact fact) {}

    public String render(AdvisoryContext context, String disclaimer) {
        boolean vi = context.isVietnamese();
        FactSignals signals = FactSignals.of(context.facts(), context.policyFlags());
        List<String> lines = new ArrayList<>();

        lines.add(vi ? "**Tổng Quan Nhanh**" : "**Quick Overview**");
        List<String> overview = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (context.facts().isEmpty()) {
            RenderSupport.appendUnique(overview, seen, vi
                    ? "- Chưa đủ dữ liệu để đưa ra kết luận đáng tin cậy."
                    : "- Not enough data for a reliable conclusion.");
            RenderSupport.appendUnique(overview, seen, vi
                    ? "- Vui lòng đồng bộ thêm giao dịch và hỏi lại."
                    : "- Please sync more transactions and retry.");
            RenderSupport.appendUnique(overview, seen, vi
                    ? "- Hệ thống đang dùng chế độ an toàn để tránh suy diễn sai."
                    : "- The system is using safe fallback mode.");
        } else {
            context.facts().stream().limit(TOP_FACTS).forEach(fact -> RenderSupport.appendUnique(overview, seen,
                    "- " + fact.label() + ": " + RenderSupport.localizedValue(fact, vi)));
            if (context.intent() == IntentName.RISK) {
                List<Fact> reasons = topAnomalyReasons(context, 2);
                for (int i = 0; i < reasons.size(); i++) {
                    String reason = reasons.get(i).valueText().trim();
                    if (!reason.isEmpty()) {
                        RenderSupport.appendUnique(overview, seen, (vi ? "- Lý do cảnh báo " : "- Anomaly reason ")
                                + (i + 1) + ": " + reason);
                    }
                }
                context.facts().stream()
                        .filter(fact -> fact.factId().startsWith("anomaly.latest_change_point."))
                        .findFirst()
                        .map(fact -> fact.valueText().trim())
                        .filter(date -> !date.isEmpty())
                        .ifPresent(date -> RenderSupport.appendUnique(overview, seen,
                                (vi ? "- Ngày bất thường gần nhất: " : "- Latest anomaly date: ") + date));
            }
            context.facts().stream().limit(TIMEFRAME_FACTS).forEach(fact -> RenderSupport.appendUnique(overview, seen,
                    "- " + fact.label() + ": " + RenderSupport.localizedValue(fact, vi)
                            + (fact.timeframe().isBlank() ? "" : " (" + fact.timeframe() + ")")));
        }
        lines.addAll(overview.isEmpty() ? List.of("- " + RenderSupport.NOT_AVAILABLE) : overview);

        lines.add("");
        lines.add(vi ? "**Khuyến Nghị Tư Vấn**" : "**Advisory Actions**");
        List<String> actions = actions(context, signals, vi);
        for (int i = 0; i < actions.size() && i < MAX_ACTIONS; i++) {
            lines.add((i + 1) + ". " + actions.get(i));
        }

        lines.add("");
        lines.add(vi ? "**Giả Định Và Giới Hạn Dữ Liệu**" : "**Assumptions & Limits**");
        lines.add(vi ? "- Giả định: dữ liệu từ công cụ là hợp lệ." : "- Assumption: tool outputs are valid.");
        lines.add(vi
                ? "- Giới hạn: chế độ dự phòng chưa thể tạo lập luận dài và cá nhân hóa sâu."
                : "- Limitation: fallback mode omits richer narrative and personalization.");

        lines.add("");
        lines.add("**Disclaimer**");
        lines.add("- " + disclaimer);
        return String.join("\n", lines);
    }

    private List<String> actions(AdvisoryContext context, FactSignals signals, boolean vi) {
        List<String> actions = new ArrayList<>(List.of(
                vi ? "Chốt một mục tiêu 30 ngày (an toàn dòng tiền, trả nợ, hoặc tích lũy)."
                        : "Lock one 30-day priority (cashflow safety, debt control, or savings).",
                vi ? "Đặt hạn mức cho nhóm chi tiêu lớn nhất và theo dõi theo tuần."
                        : "Set a cap for the largest spending bucket and review weekly.",
                vi ? "Rà soát lại sau 14 ngày để cập nhật khuyến nghị."
                        : "Reassess in 14 days for an updated recommendation."));
        if (signals.riskAppetite() == RiskAppetite.UNKNOWN && InsightRuleTable.needsRiskAppetite(context.intent())) {
            actions.add(0, vi
                    ? "Bạn ưu tiên khẩu vị rủi ro nào: thấp, vừa hay cao? Mình sẽ tinh chỉnh khuyến nghị ngay sau khi bạn chọn."
                    : "Which risk appetite fits you best: low, medium, or high? I will refine guidance after your choice.");
        }

        List<String> services = serviceSuggestions(signals, vi);
        if (services.isEmpty()) {
            return actions;
        }
        List<String> merged = new ArrayList<>(List.of(actions.get(0), services.get(0), actions.get(1)));
        if (services.size() > 1) {
            merged.add(services.get(1));
        }
        return merged;
    }

    static List<String> serviceSuggestions(FactSignals s, boolean vi) {
        double net = s.netValue();
        List<String> suggestions = new ArrayList<>();
        if (s.serviceSavings().isPresent() && (net >= 0 || s.riskAppetite() == RiskAppetite.CONSERVATIVE)) {
            suggestions.add(vi
                    ? "Cân nhắc gói tiết kiệm định kỳ hoặc tiết kiệm kỳ hạn để giữ kỷ luật tích lũy."
                    : "Consider recurring or term-deposit savings to keep savings discipline.");
        }
        if (s.serviceLoans().isPresent() && (net < 0 || s.goalGapValue() > 0)) {
            suggestions.add(vi
                    ? "Đặt lịch tư vấn vay/tái cơ cấu nợ để giảm áp lực dòng tiền ngắn hạn."
                    : "Book a loan/debt-restructure consultation to reduce short-term cashflow pressure.");
        }
        if (s.serviceCards().isPresent() && (s.anomalyCountValue() >= 1 || s.overspendAlert())) {
            suggestions.add(vi
                    ? "Bật hạn mức chi thẻ và cảnh báo giao dịch để kiểm soát nhóm chi lớn."
                    : "Enable card spend caps and alerts to control large spending buckets.");
        }
        if (s.riskAppetite() == RiskAppetite.AGGRESSIVE && s.serviceLoans().isPresent() && net < 0) {
            suggestions.add(vi
                    ? "Nếu chấp nhận rủi ro cao hơn, có thể xem gói tín dụng linh hoạt nhưng cần giới hạn trả nợ rõ ràng."
                    : "If you accept higher risk, evaluate flexible credit with strict repayment guardrails.");
        }
        if (suggestions.isEmpty() && s.serviceCount().isPresent()) {
            suggestions.add(vi
                    ? "Đặt lịch tư vấn để chọn gói dịch vụ ngân hàng phù hợp mục tiêu hiện tại."
                    : "Book a service consultation to map suitable banking products to your current goal.");
        }
        return suggestions.size() > 2 ? suggestions.subList(0, 2) : suggestions;
    }

    /**
     * Anomaly reasons of the widest window, lowest rank first.
     */
    static List<Fact> topAnomalyReasons(AdvisoryContext context, int limit) {
        List<RankedReason> parsed = new ArrayList<>();
        for (Fact fact : context.facts()) {
            Matcher matcher = REASON_ID.matcher(fact.factId());
            if (matcher.matches()) {
                parsed.add(new RankedReason(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), fact));
            }
        }
        int window = parsed.stream().mapToInt(RankedReason::windowDays).max().orElse(0);
        return parsed.stream()
                .filter(reason -> reason.windowDays() == window)
                .sorted(Comparator.comparingInt(RankedReason::rank).thenComparing(reason -> reason.fact().factId()))
                .limit(Math.max(1, limit))
                .map(RankedReason::fact)
                .toList();
    }
}
