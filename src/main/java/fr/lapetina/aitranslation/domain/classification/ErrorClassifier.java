package fr.lapetina.aitranslation.domain.classification;

import fr.lapetina.aitranslation.domain.classification.ClassificationRule.CooldownRule;
import fr.lapetina.aitranslation.domain.exception.ProviderCallException;
import fr.lapetina.aitranslation.domain.model.FailureKind;
import fr.lapetina.aitranslation.domain.model.ProviderFamily;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a failed provider call to a health transition.
 *
 * Rules are evaluated in order and the first match wins:
 * authentication, family-specific rules, daily limit, per-minute limit, bare rate limit.
 * Anything else is transient and leaves the provider available.
 */
public final class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    public static final Duration DEFAULT_PER_MINUTE_COOLDOWN = Duration.ofSeconds(60);
    public static final Duration DEFAULT_DAILY_COOLDOWN = Duration.ofHours(24);

    private static final List<String> AUTH_MARKERS = List.of(
            "unauthorized", "user not found", "invalid api key", "invalid_api_key",
            "incorrect api key", "authentication");

    private static final List<String> DAILY_MARKERS = List.of(
            "tokens per day", "requests per day", "daily limit", "per day", "per-day");

    private static final List<String> MINUTE_MARKERS = List.of(
            "tokens per minute", "requests per minute", "per minute", "per-minute");

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate_limit_exceeded", "rate limit", "too many requests");

    // Acronyms are matched case-sensitively so "tpd" inside an unrelated word never counts.
    private static final Pattern DAILY_ACRONYM = Pattern.compile("\\b(TPD|RPD)\\b");
    private static final Pattern MINUTE_ACRONYM = Pattern.compile("\\b(TPM|RPM)\\b");

    private final Duration perMinuteCooldown;
    private final Duration dailyCooldown;
    private final Map<ProviderFamily, List<ClassificationRule>> rulesByFamily;

    public ErrorClassifier() {
        this(DEFAULT_PER_MINUTE_COOLDOWN, DEFAULT_DAILY_COOLDOWN);
    }

    public ErrorClassifier(Duration perMinuteCooldown, Duration dailyCooldown) {
        this.perMinuteCooldown = perMinuteCooldown != null ? perMinuteCooldown : DEFAULT_PER_MINUTE_COOLDOWN;
        this.dailyCooldown = dailyCooldown != null ? dailyCooldown : DEFAULT_DAILY_COOLDOWN;
        this.rulesByFamily = new EnumMap<>(ProviderFamily.class);
        for (ProviderFamily family : ProviderFamily.values()) {
            rulesByFamily.put(family, Collections.unmodifiableList(buildRules(family)));
        }
    }

    /**
     * Classifies a failed call made against a provider of the given family.
     */
    public Classification classify(ProviderFamily family, ProviderCallException failure) {
        ProviderFamily effective = family != null ? family : ProviderFamily.OPENAI_COMPATIBLE;
        for (ClassificationRule rule : rulesByFamily.get(effective)) {
            if (rule.matches(failure)) {
                Classification classification = rule.apply(failure);
                log.debug("Classified failure: providerId={}, status={}, rule={}, target={}, cooldown={}",
                        failure.getProviderId(), failure.getStatusCode(), rule.name(),
                        classification.targetStatus(), classification.cooldown());
                return classification;
            }
        }
        return Classification.transientFailure();
    }

    /**
     * The ordered rule table used for {@code family}.
     */
    public List<ClassificationRule> rulesFor(ProviderFamily family) {
        return rulesByFamily.get(family);
    }

    public Duration getPerMinuteCooldown() {
        return perMinuteCooldown;
    }

    public Duration getDailyCooldown() {
        return dailyCooldown;
    }

    private List<ClassificationRule> buildRules(ProviderFamily family) {
        List<ClassificationRule> rules = new ArrayList<>();

        rules.add(new ClassificationRule(
                "authentication",
                (status, body) -> status == 401 || containsAny(body, AUTH_MARKERS),
                FailureKind.AUTHENTICATION,
                ProviderStatus.DISABLED,
                CooldownRule.none(),
                "Authentication failed - invalid API key"));

        rules.addAll(familyRules(family));

        rules.add(new ClassificationRule(
                "daily-limit",
                (status, body) -> containsAny(body, DAILY_MARKERS) || DAILY_ACRONYM.matcher(body).find(),
                FailureKind.RATE_LIMIT,
                ProviderStatus.RATE_LIMITED,
                CooldownRule.parsedOr(dailyCooldown),
                "Daily token limit exceeded"));

        rules.add(new ClassificationRule(
                "per-minute-limit",
                (status, body) -> containsAny(body, MINUTE_MARKERS) || MINUTE_ACRONYM.matcher(body).find(),
                FailureKind.RATE_LIMIT,
                ProviderStatus.RATE_LIMITED,
                CooldownRule.parsedOr(perMinuteCooldown),
                "Per-minute rate limit exceeded"));

        rules.add(new ClassificationRule(
                "rate-limit",
                (status, body) -> status == 429 || containsAny(body, RATE_LIMIT_MARKERS),
                FailureKind.RATE_LIMIT,
                ProviderStatus.RATE_LIMITED,
                CooldownRule.parsedOr(perMinuteCooldown),
                "Rate limit exceeded"));

        return rules;
    }

    private List<ClassificationRule> familyRules(ProviderFamily family) {
        if (family == ProviderFamily.OPENROUTER) {
            return List.of(new ClassificationRule(
                    "openrouter-free-daily",
                    (status, body) -> body.toLowerCase(Locale.ROOT).contains("free-models-per-day"),
                    FailureKind.RATE_LIMIT,
                    ProviderStatus.RATE_LIMITED,
                    CooldownRule.parsedOr(dailyCooldown),
                    "Daily free-model quota exhausted"));
        }
        return List.of();
    }

    private static boolean containsAny(String body, List<String> markers) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
