package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.analysis.CostPattern;
import com.cloudcost.analytics.domain.model.RootCause;
import com.cloudcost.analytics.domain.model.Trend;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Attributes an anomaly to one factor of the {@link RootCause} catalog.
 *
 * SCORING:
 * score = base weight x signal boost, where the boost comes only from the pattern itself:
 * - UNTAGGED_RESOURCES: doubled for the untagged (default project) bucket, halved otherwise
 * - UNUSUAL_USAGE: scaled by seasonality amplitude; doubled when cost dropped below baseline
 * - MISCONFIGURATION: a spike on an otherwise stable series, scaled by deviation
 * - PRICE_CHANGE: a rising trend, strongest when the deviation stays moderate
 * - DATA_TRANSFER: services whose name points at network traffic (NAT and CDN as whole words)
 *
 * The highest score wins; ties go to the factor listed first in the catalog.
 */
@Component
public class RootCauseAnalyzer {

    private static final Set<String> TRANSFER_KEYWORDS =
            Set.of("transfer", "network", "egress", "bandwidth", "cloudfront");
    // too short to match inside other words ("Cloud Natural Language")
    private static final Set<String> TRANSFER_WORDS = Set.of("nat", "cdn");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final double MODERATE_DEVIATION = 0.5;
    private static final double MAX_AMPLITUDE_BOOST = 6.0;
    private static final double MAX_DEVIATION_BOOST = 3.0;

    public RootCauseAssessment assess(CostPattern pattern, double deviation) {
        RootCause best = null;
        double bestScore = -1;

        for (RootCause cause : RootCause.values()) {
            double score = cause.getBaseWeight() * boost(cause, pattern, deviation);
            if (score > bestScore) {
                best = cause;
                bestScore = score;
            }
        }

        return new RootCauseAssessment(best, bestScore, best.describe(pattern.key().service()));
    }

    double boost(RootCause cause, CostPattern pattern, double deviation) {
        boolean spike = pattern.actualCost() > pattern.expectedCost();

        return switch (cause) {
            case UNTAGGED_RESOURCES -> pattern.key().isDefaultProject() ? 2.0 : 0.5;
            case UNUSUAL_USAGE -> {
                double b = 1.0;
                if (pattern.hasSeasonality()) {
                    b *= 1.0 + Math.min(pattern.seasonality().amplitude(), MAX_AMPLITUDE_BOOST) / 2.0;
                }
                if (!spike) {
                    b *= 2.0;
                }
                yield b;
            }
            case MISCONFIGURATION -> spike && pattern.trend() == Trend.STABLE
                    ? 1.0 + Math.min(deviation, MAX_DEVIATION_BOOST)
                    : 1.0;
            case PRICE_CHANGE -> {
                if (pattern.trend() != Trend.INCREASING) {
                    yield 1.0;
                }
                yield deviation <= MODERATE_DEVIATION ? 3.0 : 1.5;
            }
            case DATA_TRANSFER -> isTransferService(pattern.key().service()) ? 5.0 : 1.0;
        };
    }

    private static boolean isTransferService(String service) {
        String normalized = service.toLowerCase(Locale.ROOT);
        return TRANSFER_KEYWORDS.stream().anyMatch(normalized::contains)
                || WORD_SEPARATOR.splitAsStream(normalized).anyMatch(TRANSFER_WORDS::contains);
    }
}
