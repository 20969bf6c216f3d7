package com.demoBank.advisor.router.service;

import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.IntentOverride;
import com.demoBank.advisor.router.util.PromptText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitelisted lexical corrections of the extracted intent.
 *
 * Rules are evaluated in table order over the accent-stripped, lower-cased prompt; the first match wins.
 * Each rule names a target intent, so adding a correction means adding a row.
 */
@Slf4j
@Service
public class HeuristicOverrideTable {

    private static final List<String> INVEST_TERMS = List.of(
            "co phieu", "chung khoan", "crypto", "coin", "etf", "stock", "shares", "share",
            "bond", "trai phieu", "dau tu", "invest", "portfolio", "trade");
    private static final Pattern INVEST_ORDER = Pattern.compile(
            "\\b(mua|buy|ban|sell)\\s+(co phieu|chung khoan|crypto|coin|etf|stock|shares?|portfolio|bond|trai phieu)\\b");
    private static final List<String> OPTIMIZE_TERMS = List.of(
            "toi uu tai chinh", "toi uu tai chinh ca nhan", "quan ly tai chinh", "toi uu dong tien",
            "optimize personal finance", "financial optimization");
    private static final List<String> ANOMALY_TERMS = List.of(
            "giao dich la", "giao dich bat thuong", "bat thuong", "anomaly", "fraud", "lua dao",
            "suspicious transaction", "unrecognized transaction");
    private static final List<String> SAVINGS_DEPOSIT_TERMS = List.of(
            "gui tiet kiem", "mo so tiet kiem", "lap so tiet kiem", "tiet kiem ky han", "goi tiet kiem",
            "term deposit", "fixed deposit", "recurring savings");
    private static final List<String> HOME_GOAL_TERMS = List.of(
            "mua nha", "mua can ho", "mua xe", "mua o to", "mua oto", "muc tieu tiet kiem", "ke hoach tiet kiem",
            "saving goal", "goal", "saving plan", "bao lau", "kha thi");
    private static final List<String> GOAL_CUES = List.of(
            "muc tieu", "ke hoach", "tiet kiem", "tra gop", "bao lau", "kha thi", "du tien", "ngan sach",
            "saving plan", "goal", "budget", "installment");
    private static final Pattern PURCHASE = Pattern.compile("\\b(mua|buy)\\b\\s+\\S");
    private static final Pattern TIME_HORIZON = Pattern.compile(
            "\\b(trong|sau)\\s+\\d{1,3}\\s*(ngay|tuan|thang|nam|days?|weeks?|months?|years?)\\b");
    private static final Pattern BUDGET_AMOUNT = Pattern.compile(
            "\\b\\d+(?:[.,]\\d+)?\\s*(k|nghin|ngan|trieu|ty|ti|m|million|billion)\\b");
    private static final List<String> RECURRING_TERMS = List.of(
            "chi co dinh", "chi dinh ky", "dinh ky", "moi thang", "hang thang", "thuong xuyen",
            "fixed expense", "fixed cost", "recurring", "auto debit");
    private static final List<String> SERVICE_PRIORITY_TERMS = List.of(
            "dich vu ngan hang", "uu tien dich vu", "ngan hang nao truoc", "banking service", "service nao");
    private static final List<String> CASHFLOW_PRESSURE_TERMS = List.of(
            "dong tien am", "thieu hut dong tien", "negative cashflow", "cashflow am");
    private static final List<String> FINANCE_TERMS = List.of(
            "chi tieu", "tieu", "dong tien", "thu nhap", "ngan sach", "tai chinh", "giao dich", "spend",
            "cashflow", "budget", "transaction", "saving", "tiet kiem");
    private static final Pattern CALENDAR_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2,4}))?\\b");
    private static final int DEFAULT_DATE_YEAR = 2025;

    private static final List<String> WHAT_IF_TERMS = List.of(
            "what if", "what-if", "scenario", "kich ban", "gia su", "neu", "if ");
    private static final List<String> CHANGE_TERMS = List.of(
            "giam", "tang", "cat", "thay doi", "reduce", "increase", "decrease", "drop", "up ", "down ");
    private static final List<String> SCENARIO_PLANNING_TERMS = List.of(
            "mua nha", "kha thi", "muc tieu", "tiet kiem", "bao lau", "goal", "saving plan", "ke hoach");
    private static final List<String> SCENARIO_RISK_TERMS = List.of(
            "rui ro", "risk", "canh bao", "khau vi", "volatility");
    private static final List<String> SCENARIO_SUMMARY_TERMS = List.of(
            "dong tien", "chi tieu", "thu nhap", "tong quan", "khoan nao chi", "largest", "spending", "summary",
            "phan tich");
    private static final List<String> SCENARIO_DELTA_SLOTS = List.of(
            "income_delta_pct", "spend_delta_pct", "income_delta_amount_vnd", "spend_delta_amount_vnd", "variants");

    private record Signals(String text, boolean investTerms) {
    }

    private record Rule(String name, IntentName target, BiPredicate<Signals, IntentExtraction> matches) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule("invest_to_planning_optimize", IntentName.PLANNING, (s, e) ->
                    e.intent() == IntentName.INVEST && has(s, OPTIMIZE_TERMS) && !s.investTerms()),
            new Rule("anomaly_to_risk", IntentName.RISK, (s, e) ->
                    has(s, ANOMALY_TERMS) && !s.investTerms()),
            new Rule("savings_deposit_to_planning", IntentName.PLANNING, (s, e) ->
                    has(s, SAVINGS_DEPOSIT_TERMS) && !s.investTerms()),
            new Rule("home_goal_to_planning", IntentName.PLANNING, (s, e) ->
                    has(s, HOME_GOAL_TERMS)),
            new Rule("purchase_goal_to_planning", IntentName.PLANNING, (s, e) ->
                    isNonInvestPurchaseGoal(s)),
            new Rule("recurring_to_planning", IntentName.PLANNING, (s, e) ->
                    has(s, RECURRING_TERMS)),
            new Rule("service_priority_to_planning", IntentName.PLANNING, (s, e) ->
                    has(s, SERVICE_PRIORITY_TERMS) && has(s, CASHFLOW_PRESSURE_TERMS)),
            new Rule("oos_invalid_date_in_scope", IntentName.SUMMARY, (s, e) ->
                    e.intent() == IntentName.OUT_OF_SCOPE && has(s, FINANCE_TERMS) && hasInvalidCalendarDate(s.text())),
            new Rule("low_domain_relevance", IntentName.OUT_OF_SCOPE, (s, e) ->
                    e.intent() != IntentName.OUT_OF_SCOPE && e.domainRelevance() <= 0.25),
            new Rule("low_domain_relevance_top2_oos", IntentName.OUT_OF_SCOPE, (s, e) ->
                    e.intent() != IntentName.OUT_OF_SCOPE && e.domainRelevance() <= 0.40
                            && e.top2Score(IntentName.OUT_OF_SCOPE) >= 0.30),
            new Rule("scenario_to_planning", IntentName.PLANNING, (s, e) ->
                    isImplicitScenario(s, e) && has(s, SCENARIO_PLANNING_TERMS)),
            new Rule("scenario_to_risk", IntentName.RISK, (s, e) ->
                    isImplicitScenario(s, e) && has(s, SCENARIO_RISK_TERMS)),
            new Rule("scenario_to_summary", IntentName.SUMMARY, (s, e) ->
                    isImplicitScenario(s, e) && has(s, SCENARIO_SUMMARY_TERMS)),
            new Rule("scenario_to_summary_default", IntentName.SUMMARY, (s, e) ->
                    isImplicitScenario(s, e) && !hasScenarioDelta(e.slots()))
    );

    /**
     * Suggests a correction for the extracted intent.
     *
     * @param prompt     prompt after the encoding gate
     * @param extraction extractor output
     * @return the first matching override, or empty
     */
    public Optional<IntentOverride> suggest(String prompt, IntentExtraction extraction) {
        String folded = PromptText.fold(prompt);
        boolean investTerms = PromptText.containsAny(folded, INVEST_TERMS) || INVEST_ORDER.matcher(folded).find();
        Signals signals = new Signals(folded, investTerms);
        for (Rule rule : RULES) {
            if (rule.matches().test(signals, extraction)) {
                log.debug("Intent override matched - rule: {}, from: {}, to: {}", rule.name(), extraction.intent(), rule.target());
                return Optional.of(new IntentOverride(rule.target(), rule.name()));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the scenario slots carry at least one meaningful delta.
     */
    static boolean hasScenarioDelta(Map<String, Object> slots) {
        for (String key : SCENARIO_DELTA_SLOTS) {
            Object value = slots.get(key);
            if (value == null) {
                continue;
            }
            if (value instanceof String text && text.isBlank()) {
                continue;
            }
            if (value instanceof Number number && number.doubleValue() == 0.0) {
                continue;
            }
            if (value instanceof Collection<?> collection && collection.isEmpty()) {
                continue;
            }
            if (value instanceof Map<?, ?> map && map.isEmpty()) {
                continue;
            }
            return true;
        }
        return false;
    }

    // Scenario intent without explicit what-if phrasing and without a requested change.
    private static boolean isImplicitScenario(Signals signals, IntentExtraction extraction) {
        if (extraction.intent() != IntentName.SCENARIO) {
            return false;
        }
        boolean explicitWhatIf = has(signals, WHAT_IF_TERMS);
        boolean changeRequest = has(signals, CHANGE_TERMS);
        return !(explicitWhatIf || (hasScenarioDelta(extraction.slots()) && changeRequest));
    }

    private static boolean isNonInvestPurchaseGoal(Signals signals) {
        if (signals.investTerms()) {
            return false;
        }
        String text = signals.text();
        if (!PURCHASE.matcher(text).find()) {
            return false;
        }
        if (PromptText.containsAny(text, GOAL_CUES)) {
            return true;
        }
        return TIME_HORIZON.matcher(text).find() || BUDGET_AMOUNT.matcher(text).find();
    }

    static boolean hasInvalidCalendarDate(String text) {
        Matcher matcher = CALENDAR_DATE.matcher(text);
        while (matcher.find()) {
            int day = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int year = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : DEFAULT_DATE_YEAR;
            if (month < 1 || month > 12) {
                return true;
            }
            try {
                LocalDate.of(year, month, day);
            } catch (DateTimeException e) {
                return true;
            }
        }
        return false;
    }

    private static boolean has(Signals signals, List<String> terms) {
        return PromptText.containsAny(signals.text(), terms);
    }
}
