package fr.lapetina.aitranslation.infrastructure.credential;

import fr.lapetina.aitranslation.domain.classification.CooldownParser;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Interchangeable API keys for one logical provider, handed out round-robin.
 *
 * Every operation runs under the pool's monitor. Rate-limited keys come back on
 * their own once their reset time passes; disabled keys stay out until reset.
 */
public final class CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(15);

    private final String name;
    private final List<Credential> credentials;
    private final Clock clock;
    private final Duration defaultCooldown;
    private int cursor;

    public CredentialPool(String name, List<Credential> credentials, Clock clock, Duration defaultCooldown) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pool name is required");
        }
        this.name = name;
        this.credentials = new ArrayList<>(credentials);
        this.clock = clock;
        this.defaultCooldown = defaultCooldown != null ? defaultCooldown : DEFAULT_COOLDOWN;
        log.info("Credential pool initialized: pool={}, keys={}", name, this.credentials.size());
    }

    /**
     * Builds a pool named "Primary NAME", "Backup 1", "Backup 2"... Blank keys are skipped.
     */
    public static CredentialPool of(String name, String primaryKey, List<String> backupKeys, Clock clock) {
        List<Credential> credentials = new ArrayList<>();
        if (primaryKey != null && !primaryKey.isBlank()) {
            credentials.add(new Credential(primaryKey, "Primary " + name.toUpperCase(Locale.ROOT)));
        }
        int index = 1;
        for (String key : backupKeys) {
            if (key != null && !key.isBlank()) {
                credentials.add(new Credential(key, "Backup " + index++));
            }
        }
        return new CredentialPool(name, credentials, clock, DEFAULT_COOLDOWN);
    }

    public String getName() {
        return name;
    }

    /**
     * Next available credential, rotating over the keys that are available right now.
     */
    public synchronized Optional<Credential> nextAvailable() {
        Instant now = clock.instant();
        recoverExpired(now);

        List<Credential> available = credentials.stream()
                .filter(Credential::isAvailable)
                .toList();
        if (available.isEmpty()) {
            log.warn("No available credentials: pool={}", name);
            return Optional.empty();
        }

        if (cursor >= available.size()) {
            cursor = 0;
        }
        Credential credential = available.get(cursor);
        cursor = (cursor + 1) % available.size();
        credential.markUsed(now);
        log.debug("Credential selected: pool={}, credential={}", name, credential.getDisplayName());
        return Optional.of(credential);
    }

    public synchronized boolean hasAvailable() {
        recoverExpired(clock.instant());
        return credentials.stream().anyMatch(Credential::isAvailable);
    }

    /**
     * Excludes the credential until the retry hint in {@code errorText}, or for the default cooldown.
     */
    public synchronized void markRateLimited(Credential credential, String errorText) {
        if (!owns(credential) || credential.getStatus() == ProviderStatus.DISABLED) {
            return;
        }
        Duration cooldown = CooldownParser.parseOrDefault(errorText, defaultCooldown);
        Instant until = clock.instant().plus(cooldown);
        credential.rateLimitUntil(until);
        log.warn("Credential rate limited: pool={}, credential={}, until={}",
                name, credential.getDisplayName(), until);
    }

    /**
     * Permanently excludes the credential. Used for authentication failures.
     */
    public synchronized void markDisabled(Credential credential, String reason) {
        if (!owns(credential)) {
            return;
        }
        credential.disable(reason);
        log.error("Credential disabled: pool={}, credential={}, reason={}",
                name, credential.getDisplayName(), reason);
    }

    public synchronized void recordSuccess(Credential credential, long latencyMs) {
        if (owns(credential)) {
            credential.recordSuccess(latencyMs);
        }
    }

    /**
     * Counts a failure that does not change the credential's status.
     */
    public synchronized void recordFailure(Credential credential) {
        if (owns(credential)) {
            credential.recordFailure();
        }
    }

    /**
     * Operator reset of one credential, by display name.
     *
     * @return true if a credential with that name exists
     */
    public synchronized boolean reset(String displayName) {
        for (Credential credential : credentials) {
            if (credential.getDisplayName().equals(displayName)) {
                credential.reset();
                log.info("Credential manually reset: pool={}, credential={}", name, displayName);
                return true;
            }
        }
        return false;
    }

    public synchronized void resetDailyCounters() {
        credentials.forEach(Credential::resetDailyCounters);
        log.info("Daily credential counters reset: pool={}", name);
    }

    public synchronized PoolStatus status() {
        Instant now = clock.instant();
        recoverExpired(now);

        int available = 0;
        int rateLimited = 0;
        int disabled = 0;
        List<PoolStatus.CredentialSnapshot> keys = new ArrayList<>();
        for (Credential credential : credentials) {
            switch (credential.getStatus()) {
                case AVAILABLE -> available++;
                case RATE_LIMITED -> rateLimited++;
                case DISABLED -> disabled++;
            }
            String resetIn = credential.getResetTime() != null
                    ? formatRemaining(Duration.between(now, credential.getResetTime()))
                    : null;
            keys.add(new PoolStatus.CredentialSnapshot(
                    credential.getDisplayName(),
                    credential.getStatus(),
                    credential.getCallsToday(),
                    credential.getLastUsed(),
                    resetIn,
                    credential.getDisabledReason(),
                    credential.getAverageLatencyMs()));
        }
        return new PoolStatus(name, credentials.size(), available, rateLimited, disabled, keys);
    }

    public synchronized int size() {
        return credentials.size();
    }

    private void recoverExpired(Instant now) {
        for (Credential credential : credentials) {
            if (credential.recoverIfDue(now)) {
                log.info("Credential available again: pool={}, credential={}", name, credential.getDisplayName());
            }
        }
    }

    private boolean owns(Credential credential) {
        // Identity: two pools may hold the same key string under different names.
        for (Credential candidate : credentials) {
            if (candidate == credential) {
                return true;
            }
        }
        return false;
    }

    static String formatRemaining(Duration remaining) {
        if (remaining.isNegative() || remaining.isZero()) {
            return "0s";
        }
        long minutes = remaining.toMinutes();
        long seconds = remaining.toSecondsPart();
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
