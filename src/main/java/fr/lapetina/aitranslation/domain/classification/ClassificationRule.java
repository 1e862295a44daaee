package fr.lapetina.aitranslation.domain.classification;

import fr.lapetina.aitranslation.domain.exception.ProviderCallException;
import fr.lapetina.aitranslation.domain.model.FailureKind;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;

import java.time.Duration;
import java.util.function.BiPredicate;

/**
 * One row of the classification table: a predicate over status code and error body,
 * the transition it implies, and how its cooldown is computed.
 */
public record ClassificationRule(
        String name,
        BiPredicate<Integer, String> matcher,
        FailureKind kind,
        ProviderStatus targetStatus,
        CooldownRule cooldownRule,
        String reason
) {

    public boolean matches(ProviderCallException failure) {
        return matcher.test(failure.getStatusCode(), failure.getResponseBody());
    }

    public Classification apply(ProviderCallException failure) {
        return new Classification(kind, targetStatus, cooldownRule.cooldownFor(failure), reason, name);
    }

    /**
     * Computes the cooldown for a matched failure.
     */
    @FunctionalInterface
    public interface CooldownRule {

        Duration cooldownFor(ProviderCallException failure);

        /**
         * No cooldown: permanent disable or no state change.
         */
        static CooldownRule none() {
            return failure -> null;
        }

        /**
         * Retry hint in the body, then the {@code Retry-After} header, then {@code defaultCooldown}.
         */
        static CooldownRule parsedOr(Duration defaultCooldown) {
            return failure -> CooldownParser.parse(failure.getResponseBody())
                    .orElseGet(() -> failure.getRetryAfter() != null && !failure.getRetryAfter().isZero()
                            ? failure.getRetryAfter()
                            : defaultCooldown);
        }
    }
}
