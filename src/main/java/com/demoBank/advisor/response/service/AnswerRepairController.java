package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerOutcome;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.SynthesisAttempt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generate, validate, repair and retry loop.
 *
 * Responsibilities:
 * - Validate every generated plan against the advisory context
 * - Repair a plan whose only violation is an undeclared placeholder fact
 * - Run at most one corrective generation, fed with the violated rule names
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerRepairController {

    static final int MAX_GENERATIONS = 2;

    private final AnswerSynthesizer answerSynthesizer;
    private final GroundingValidator groundingValidator;

    /**
     * Produces a validated plan, or the last failing attempt when both generations fail.
     *
     * @param userPrompt          prompt after the encoding gate
     * @param context             advisory context
     * @param promptNumericTokens numeric tokens of the user prompt
     * @param traceId             trace id for logging
     */
    public AnswerOutcome generate(String userPrompt, AdvisoryContext context, Set<String> promptNumericTokens,
                                  String traceId) {
        String feedback = "";
        AnswerOutcome last = new AnswerOutcome(null, false, 0, false, List.of());

        for (int generation = 1; generation <= MAX_GENERATIONS; generation++) {
            SynthesisAttempt attempt = answerSynthesizer.synthesize(userPrompt, context, feedback, traceId);
            if (!attempt.hasPlan()) {
                last = new AnswerOutcome(null, false, generation, false, attempt.errors());
                if (attempt.errors().contains("model_not_configured")) {
                    break;
                }
            } else {
                last = check(attempt.plan(), context, promptNumericTokens, generation, traceId);
                if (last.valid()) {
                    return last;
                }
            }
            feedback = String.join(", ", GroundingValidator.ruleNames(last.errors()));
            log.info("Answer attempt rejected - traceId: {}, generation: {}, issues: {}", traceId, generation, feedback);
        }

        log.warn("Answer generation exhausted - traceId: {}, generations: {}, errors: {}",
                traceId, last.generations(), last.errors());
        return last;
    }

    private AnswerOutcome check(AnswerPlan plan, AdvisoryContext context, Set<String> promptNumericTokens,
                                int generation, String traceId) {
        List<String> errors = groundingValidator.validate(plan, context, promptNumericTokens);
        if (errors.isEmpty()) {
            return new AnswerOutcome(plan, true, generation, false, List.of());
        }
        if (!GroundingValidator.ruleNames(errors).equals(List.of(GroundingValidator.PLACEHOLDER_NOT_DECLARED))) {
            return new AnswerOutcome(plan, false, generation, false, errors);
        }

        AnswerPlan repaired = declarePlaceholders(plan);
        List<String> repairedErrors = groundingValidator.validate(repaired, context, promptNumericTokens);
        log.info("Placeholder repair applied - traceId: {}, generation: {}, valid: {}",
                traceId, generation, repairedErrors.isEmpty());
        return new AnswerOutcome(repaired, repairedErrors.isEmpty(), generation, true, repairedErrors);
    }

    /**
     * Extends the used fact ids with every placeholder fact the prose references.
     */
    static AnswerPlan declarePlaceholders(AnswerPlan plan) {
        Set<String> used = new LinkedHashSet<>(plan.usedFactIds());
        GroundingValidator.textSections(plan).forEach(section -> used.addAll(GroundingValidator.placeholderIds(section)));
        return plan.withUsedFactIds(List.copyOf(used));
    }
}
