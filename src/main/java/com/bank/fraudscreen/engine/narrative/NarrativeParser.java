package com.bank.fraudscreen.engine.narrative;

import com.bank.fraudscreen.config.NarrativeConfig;
import com.bank.fraudscreen.model.ParsedNarrative;
import com.bank.fraudscreen.model.RiskFactor;
import com.bank.fraudscreen.model.RiskThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads free-text risk narratives into a score, a stated level and a set of risk factors.
 *
 * <p>A factor is only tagged when one of its keywords occurs and none of its negating phrases
 * does, so "no sanctions concern" does not produce {@link RiskFactor#SANCTIONS_CONCERN}.
 * When the text carries no explicit "risk score: N" statement a score is inferred from the
 * phrases present: baseline, plus increments per matched term, then ceilings and floors
 * from recommendation phrases.
 *
 * <p>Stateless and shared by the scoring and audit stages.
 */
@Component
public class NarrativeParser {

    private static final Logger log = LoggerFactory.getLogger(NarrativeParser.class);

    // a stated score needs its separator; "risk score 30 understates ..." is not one
    private static final Pattern SCORE_PATTERN =
            Pattern.compile("risk\\s*score\\s*[:=]\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEVEL_PATTERN =
            Pattern.compile("risk\\s*level\\s*[:\\-]?\\s*(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSACTION_ID_PATTERN =
            Pattern.compile("(?:transaction(?:\\s+id)?|txn)[:\\s#]+([A-Z]{1,5}\\d+[A-Z0-9]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CUSTOMER_ID_PATTERN =
            Pattern.compile("customer(?:\\s+id)?[:\\s#]+([A-Z]+\\d+)", Pattern.CASE_INSENSITIVE);

    private final NarrativeConfig config;

    public NarrativeParser(NarrativeConfig config) {
        this.config = config;
    }

    public ParsedNarrative parse(String text) {
        if (text == null || text.isBlank()) {
            return ParsedNarrative.builder()
                    .score(inferScore("", Collections.emptySet()))
                    .scoreExplicit(false)
                    .factors(Collections.emptySet())
                    .build();
        }

        String lower = text.toLowerCase(Locale.ROOT);
        Set<RiskFactor> factors = extractFactors(lower);

        Double explicit = extractExplicitScore(text);
        double score = explicit != null ? RiskThresholds.clamp(explicit) : inferScore(lower, factors);

        ParsedNarrative parsed = ParsedNarrative.builder()
                .score(score)
                .scoreExplicit(explicit != null)
                .statedRiskLevel(firstGroup(LEVEL_PATTERN, text))
                .transactionId(firstGroup(TRANSACTION_ID_PATTERN, text))
                .customerId(firstGroup(CUSTOMER_ID_PATTERN, text))
                .factors(Collections.unmodifiableSet(factors))
                .build();

        log.debug("Parsed narrative: score={} explicit={} level={} factors={}",
                parsed.getScore(), parsed.isScoreExplicit(), parsed.getStatedRiskLevel(), factors);
        return parsed;
    }

    Set<RiskFactor> extractFactors(String lower) {
        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);
        for (Map.Entry<RiskFactor, NarrativeConfig.Cue> entry : config.getCues().entrySet()) {
            NarrativeConfig.Cue cue = entry.getValue();
            if (containsAny(lower, cue.getKeywords()) && !containsAny(lower, cue.getNegations())) {
                factors.add(entry.getKey());
            }
        }
        return factors;
    }

    private double inferScore(String lower, Set<RiskFactor> factors) {
        double score = config.getBaselineScore();

        if (containsAny(lower, config.getHighRiskCountryTerms())) {
            score += config.getCountryIncrement();
        }
        score += factors.size() * config.getFactorIncrement();

        // ceiling first, floors after: a block phrase wins over an approve phrase
        if (containsAny(lower, config.getApprovePhrases()) && !containsAny(lower, config.getApproveNegations())) {
            score = Math.min(score, config.getApproveCeiling());
        }
        if (containsAny(lower, config.getMediumPhrases())) {
            score = Math.max(score, config.getMediumFloor());
        }
        if (containsAny(lower, config.getBlockPhrases()) && !containsAny(lower, config.getBlockNegations())) {
            score = Math.max(score, config.getBlockFloor());
        }

        return Math.max(config.getMinScore(), Math.min(RiskThresholds.MAX_SCORE, score));
    }

    private static Double extractExplicitScore(String text) {
        Matcher matcher = SCORE_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            log.warn("Unreadable risk score '{}' in narrative, inferring instead", matcher.group(1));
            return null;
        }
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group(1).toUpperCase(Locale.ROOT);
    }

    private static boolean containsAny(String lower, List<String> phrases) {
        if (phrases == null) {
            return false;
        }
        for (String phrase : phrases) {
            if (!phrase.isEmpty() && lower.contains(phrase.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
