package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.KeyMetric;
import com.demoBank.advisor.router.model.IntentName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnswerRenderer")
class AnswerRendererTest {

    private static final String NET = "spend.net_cashflow.30d";
    private static final String RUNWAY = "risk.runway_months.180d";
    private static final String BAND = "risk.risk_band.180d";

    private final AnswerRenderer renderer = new AnswerRenderer();

    private static AdvisoryContext context(String language) {
        return new AdvisoryContext(null, IntentName.RISK, language, List.of(
                new Fact(NET, "Net cashflow", 6_600_000.0, "+6,600,000", "VND", "30d", "spend_analytics_v1",
                        "net_cashflow"),
                new Fact(RUNWAY, "Emergency runway", 2.4, "2.40", "months", "180d",
                        "risk_profile_non_investment_v1", "emergency_runway_months"),
                new Fact(BAND, "Risk band", "moderate", "moderate", "", "180d",
                        "risk_profile_non_investment_v1", "risk_band")),
                List.of(), List.of(), List.of(), null);
    }

    @Test
    @DisplayName("binds placeholders and skips metrics already shown in the summary")
    void rendersEnglishPlan() {
        AnswerPlan plan = new AnswerPlan(AnswerPlan.SCHEMA_VERSION, "en",
                List.of("Net cashflow is [F:" + NET + "]."),
                List.of(new KeyMetric(NET, "Net"), new KeyMetric(RUNWAY, "Runway")),
                List.of("Review weekly.", "Keep a buffer."), List.of(), List.of("Only 30 days of data."),
                "Educational guidance only.", List.of(NET, RUNWAY), List.of(), List.of());

        String expected = String.join("\n",
                "**Main Overview**",
                "- Net cashflow is +6,600,000.",
                "- Runway: 2.40 (180d)",
                "",
                "**Advisory Actions**",
                "1. Review weekly.",
                "2. Keep a buffer.",
                "",
                "**Assumptions & Limits**",
                "- Limitation: Only 30 days of data.",
                "",
                "**Disclaimer**",
                "- Educational guidance only.");
        assertEquals(expected, renderer.render(plan, context("en")));
    }

    @Test
    @DisplayName("localizes risk bands and month units for Vietnamese answers")
    void rendersVietnamesePlan() {
        AnswerPlan plan = new AnswerPlan(AnswerPlan.SCHEMA_VERSION, "vi", List.of("Tổng quan dòng tiền ổn định."),
                List.of(new KeyMetric(BAND, "Mức rủi ro"), new KeyMetric(RUNWAY, "Quỹ dự phòng"),
                        new KeyMetric("goal.gap_amount", "Khoảng thiếu")),
                List.of("Theo dõi hằng tuần."), List.of(), List.of(), "Chỉ mang tính giáo dục.",
                List.of(BAND, RUNWAY), List.of(), List.of());

        String rendered = renderer.render(plan, context("vi"));

        assertTrue(rendered.startsWith("**Tổng Quan Chính**"));
        assertTrue(rendered.contains("- Mức rủi ro: trung bình (180d)"));
        assertTrue(rendered.contains("- Quỹ dự phòng: 2.40 tháng (180d)"));
        assertTrue(rendered.contains("- Khoảng thiếu: n/a"));
        assertTrue(rendered.contains("**Giả Định Và Giới Hạn Dữ Liệu**\n- n/a"));
    }

    @Test
    @DisplayName("unknown placeholders render as n/a")
    void unknownPlaceholder() {
        assertEquals("Gap: n/a.", RenderSupport.bind("Gap: [F:goal.gap_amount] .", RenderSupport.index(context("en"))));
    }
}
