package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.util.JsonValues;
import com.demoBank.advisor.response.util.ValueFormats;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Localized one-line explanations for anomaly flags, built from the engine details of the anomaly output.
 */
class AnomalyReasons {

    private AnomalyReasons() {}

    static String describe(String flag, JsonNode anomaly, boolean vi) {
        JsonNode engines = anomaly.path("external_engines");
        switch (flag) {
            case "change_point" -> {
                List<String> points = changePoints(anomaly);
                if (!points.isEmpty()) {
                    String latest = points.get(points.size() - 1);
                    return vi
                            ? "Phát hiện điểm đổi chế độ chi tiêu, mốc gần nhất là " + latest + "."
                            : "A spending regime change was detected, latest on " + latest + ".";
                }
                return vi
                        ? "Phát hiện dấu hiệu đổi chế độ chi tiêu theo chuỗi thời gian."
                        : "The spending series shows signs of a regime change.";
            }
            case "category_spike" -> {
                JsonNode spikes = anomaly.path("category_spikes");
                JsonNode top = spikes.isArray() && !spikes.isEmpty() ? spikes.get(0) : MissingNode.getInstance();
                String category = JsonValues.text(top, "category_name");
                double deltaShare = JsonValues.number(top, "delta_share").orElse(0.0);
                double recentAmount = JsonValues.number(top, "recent_amount").orElse(0.0);
                if (!category.isEmpty() || deltaShare > 0) {
                    String name = category.isEmpty() ? "Unknown" : category;
                    return vi
                            ? "Danh mục " + name + " tăng tỉ trọng " + ValueFormats.percent(deltaShare)
                              + " với mức chi " + ValueFormats.money(recentAmount) + "."
                            : "Category " + name + " grew its share by " + ValueFormats.percent(deltaShare)
                              + " with spend of " + ValueFormats.money(recentAmount) + ".";
                }
                return vi
                        ? "Có danh mục chi tiêu tăng tỉ trọng bất thường so với nền."
                        : "A spending category grew its share unusually against the baseline.";
            }
            case "spend_outlier" -> {
                double probability = JsonValues.number(engines.path("pyod_ecod"), "outlier_probability").orElse(0.0);
                if (probability > 0) {
                    return vi
                            ? "Mẫu chi tiêu gần nhất nằm trong nhóm ngoại lệ với xác suất "
                              + ValueFormats.percent(probability) + "."
                            : "Recent spending is an outlier with probability " + ValueFormats.percent(probability) + ".";
                }
                return vi
                        ? "Mẫu chi tiêu gần nhất được đánh dấu là ngoại lệ."
                        : "Recent spending was flagged as an outlier.";
            }
            case "spend_drift" -> {
                JsonNode driftPoints = engines.path("river_adwin").path("drift_points");
                int count = driftPoints.isArray() ? driftPoints.size() : 0;
                if (count > 0) {
                    return vi
                            ? "Chuỗi chi tiêu xuất hiện dấu hiệu drift với " + count + " mốc thay đổi."
                            : "The spending series drifted at " + count + " change points.";
                }
                return vi
                        ? "Chuỗi chi tiêu xuất hiện dấu hiệu drift so với nền."
                        : "The spending series drifted from its baseline.";
            }
            case "abnormal_spend" -> {
                double zScore = JsonValues.number(anomaly.path("abnormal_spend"), "z_score").orElse(0.0);
                if (zScore > 0) {
                    return vi
                            ? "Mức chi tiêu 7 ngày gần đây lệch mạnh so với trung vị nền (z="
                              + ValueFormats.decimal(zScore) + ")."
                            : "Spending in the last 7 days deviates strongly from the baseline median (z="
                              + ValueFormats.decimal(zScore) + ").";
                }
                return vi
                        ? "Mức chi tiêu gần đây lệch đáng kể so với nền lịch sử."
                        : "Recent spending deviates significantly from history.";
            }
            case "income_drop" -> {
                double dropPct = JsonValues.number(anomaly.path("income_drop"), "drop_pct").orElse(0.0);
                if (dropPct > 0) {
                    return vi
                            ? "Thu nhập trung bình giảm " + ValueFormats.percent(dropPct) + " so với giai đoạn nền."
                            : "Average income dropped " + ValueFormats.percent(dropPct) + " against the baseline.";
                }
                return vi
                        ? "Thu nhập trung bình giảm đáng kể so với giai đoạn nền."
                        : "Average income dropped significantly against the baseline.";
            }
            case "low_balance_risk" -> {
                double runwayDays = JsonValues.number(anomaly.path("low_balance_risk"), "runway_days_estimate")
                        .orElse(0.0);
                if (runwayDays > 0) {
                    return vi
                            ? "Runway ước tính còn " + ValueFormats.decimal(runwayDays)
                              + " ngày, dưới ngưỡng an toàn 90 ngày."
                            : "Estimated runway is " + ValueFormats.decimal(runwayDays)
                              + " days, below the 90-day safety threshold.";
                }
                return vi
                        ? "Runway ước tính dưới ngưỡng an toàn 90 ngày."
                        : "Estimated runway is below the 90-day safety threshold.";
            }
            default -> {
                return vi
                        ? "Phát hiện tín hiệu bất thường cần theo dõi thêm để đánh giá rủi ro."
                        : "An unusual signal was detected and needs monitoring.";
            }
        }
    }

    /**
     * Distinct change-point dates, preferring the ruptures engine output over the top-level list.
     */
    static List<String> changePoints(JsonNode anomaly) {
        JsonNode raw = anomaly.path("external_engines").path("ruptures_pelt").path("change_points");
        if (!raw.isArray()) {
            raw = anomaly.path("change_points");
        }
        List<String> points = new ArrayList<>();
        if (!raw.isArray()) {
            return points;
        }
        for (JsonNode item : raw) {
            String value = item.asText("").trim();
            if (!value.isEmpty() && !points.contains(value)) {
                points.add(value);
            }
        }
        return points;
    }
}
