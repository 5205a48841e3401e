package com.neurasense.jitai.engine;

import com.neurasense.jitai.catalog.CatalogService;
import com.neurasense.jitai.domain.CatalogEntry;
import com.neurasense.jitai.domain.CompanionTask;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.Rule;
import com.neurasense.jitai.domain.RuleAction;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.domain.SelectedAction;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.domain.Tier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a ruleset and a tailoring context into a decision.
 *
 * <ol>
 *   <li>skip disabled rules</li>
 *   <li>evaluate each remaining rule's condition</li>
 *   <li>flatten the recommend actions of matching rules into candidates</li>
 *   <li>stable sort by tier rank ascending, then priority descending</li>
 *   <li>walk the candidates, dropping catalog ids already selected, until {@code maxResults}</li>
 *   <li>if nothing was collected, use the default actions (capped) and the default task</li>
 *   <li>otherwise the task comes from the first matched rule, in sorted order, that has one</li>
 * </ol>
 *
 * Rules with equal tier and priority keep document order, but callers must not depend on it.
 */
@ApplicationScoped
public class DecisionResolver {

    private static final Logger LOG = Logger.getLogger(DecisionResolver.class);

    private static final Comparator<Rule> RESOLUTION_ORDER =
            Comparator.comparingInt((Rule r) -> r.getTier().rank())
                    .thenComparing(Comparator.comparingInt(Rule::getPriority).reversed());

    @Inject
    ConditionEvaluator conditionEvaluator;

    @Inject
    CatalogService catalogService;

    private record Candidate(Rule rule, RuleAction action) {}

    public Decision resolve(TailoringContext context, Ruleset ruleset, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1, got " + maxResults);
        }

        List<Rule> matched = new ArrayList<>();
        for (Rule rule : ruleset.getRules()) {
            if (!rule.isEnabled()) {
                continue;
            }
            if (conditionEvaluator.evaluate(rule.getCondition(), context)) {
                matched.add(rule);
            } else if (LOG.isDebugEnabled()) {
                LOG.debugf("Rule %s did not match", rule.getRuleId());
            }
        }
        // List.sort is stable
        matched.sort(RESOLUTION_ORDER);

        List<Candidate> candidates = new ArrayList<>();
        for (Rule rule : matched) {
            for (RuleAction action : rule.getActions()) {
                if (action.isRecommendation()) {
                    candidates.add(new Candidate(rule, action));
                }
            }
        }

        Decision decision = new Decision();
        decision.setContext(context);
        decision.setRulesetVersion(ruleset.getVersion());
        matched.forEach(rule -> decision.addMatchedRule(rule.getRuleId()));

        Set<String> seen = new HashSet<>();
        for (Candidate candidate : candidates) {
            if (decision.getActions().size() >= maxResults) {
                break;
            }
            if (!seen.add(candidate.action().getActionId())) {
                continue;
            }
            Rule rule = candidate.rule();
            decision.addAction(describe(new SelectedAction(rule.getRuleId(), rule.getTier(), rule.getPriority(),
                    candidate.action().getActionId(), candidate.action().getReason())));
        }

        if (decision.getActions().isEmpty()) {
            applyDefaults(decision, ruleset, maxResults);
        } else {
            decision.setTask(firstTask(matched).orElse(null));
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Resolved %d actions from %d matched rules (default=%s)",
                    decision.getActions().size(), matched.size(), Boolean.valueOf(decision.isUsedDefault()));
        }
        return decision;
    }

    private void applyDefaults(Decision decision, Ruleset ruleset, int maxResults) {
        Set<String> seen = new HashSet<>();
        for (RuleAction action : ruleset.getDefaultActions()) {
            if (decision.getActions().size() >= maxResults) {
                break;
            }
            if (!action.isRecommendation() || !seen.add(action.getActionId())) {
                continue;
            }
            decision.addAction(describe(new SelectedAction(SelectedAction.DEFAULT_RULE_ID, Tier.DEFAULT, 0,
                    action.getActionId(), action.getReason())));
        }
        decision.setTask(ruleset.getDefaultTask());
        decision.setUsedDefault(true);
    }

    private static Optional<CompanionTask> firstTask(List<Rule> matched) {
        return matched.stream()
                .map(Rule::getTask)
                .filter(task -> task != null)
                .findFirst();
    }

    private SelectedAction describe(SelectedAction action) {
        Optional<CatalogEntry> entry = catalogService.find(action.getActionId());
        action.setTitle(entry.map(CatalogEntry::getTitle).orElse(action.getActionId()));
        action.setIcon(entry.map(CatalogEntry::getIcon).orElse(""));
        action.setCategory(entry.map(CatalogEntry::getCategory).orElse(""));
        return action;
    }
}
