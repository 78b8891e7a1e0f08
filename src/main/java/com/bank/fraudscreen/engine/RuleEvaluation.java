package com.bank.fraudscreen.engine;

import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RuleResult;

import java.util.List;
import java.util.Set;

/**
 * Clamped additive score and factors produced by the rule engine.
 */
public record RuleEvaluation(double baseScore, Set<RiskFactor> factors, List<RuleResult> ruleResults) {}
