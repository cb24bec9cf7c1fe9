package com.participant.matching.matching;

import com.participant.matching.core.model.MatchResult;
import com.participant.matching.core.model.Participant;
import com.participant.matching.index.ReferenceIndex;
import com.participant.matching.logging.LogContext;
import com.participant.matching.metrics.MetricsService;
import com.participant.matching.metrics.NoOpMetricsService;
import com.participant.matching.rules.IdentityNormalizer;
import com.participant.matching.zipcode.ZipCountyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves participants against the reference index.
 *
 * <p>Strategies are tried in order (email, phone, address by default) and the first
 * success wins; weaker signals are never consulted after a stronger one matched.
 * Participants no strategy can place get a {@code NO_MATCH} result carrying the
 * county of their ZIP, if it resolves.</p>
 *
 * <p>Holds no mutable state, so one instance can resolve from many threads.</p>
 */
public class MatchResolver {
    private static final Logger log = LoggerFactory.getLogger(MatchResolver.class);

    private final List<MatchStrategy> strategies;
    private final ZipCountyResolver zipCountyResolver;
    private final IdentityNormalizer normalizer;
    private final MetricsService metricsService;

    public MatchResolver(List<MatchStrategy> strategies, ZipCountyResolver zipCountyResolver,
                         IdentityNormalizer normalizer, MetricsService metricsService) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one match strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.zipCountyResolver = Objects.requireNonNull(zipCountyResolver, "zipCountyResolver is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Creates a resolver with the default email, phone, address chain.
     */
    public static MatchResolver withDefaultStrategies(ReferenceIndex index, ZipCountyResolver zipCountyResolver,
                                                      IdentityNormalizer normalizer, MetricsService metricsService) {
        return new MatchResolver(defaultStrategies(index, normalizer), zipCountyResolver, normalizer, metricsService);
    }

    public static List<MatchStrategy> defaultStrategies(ReferenceIndex index, IdentityNormalizer normalizer) {
        return List.of(
                new EmailMatchStrategy(index, normalizer),
                new PhoneMatchStrategy(index, normalizer),
                new AddressMatchStrategy(index, normalizer));
    }

    /**
     * Resolves a single participant. Always returns a result.
     */
    public MatchResult resolve(Participant participant) {
        Objects.requireNonNull(participant, "participant is required");
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forParticipant(participant.getParticipantId())) {
            MatchResult result = firstMatch(participant).orElseGet(() -> noMatch(participant));
            metricsService.recordMatch(result.matchQuality(), result.countyName());
            metricsService.recordResolutionDuration(result.matchQuality(), Duration.ofNanos(System.nanoTime() - start));
            log.trace("participant.resolved quality={} method={} county={}",
                    result.matchQuality(), result.matchMethod(), result.countyName());
            return result;
        }
    }

    /**
     * Resolves all participants, keeping input order in the returned list.
     *
     * @param parallel resolve on the common fork-join pool; workers inherit the caller's MDC
     */
    public List<MatchResult> resolveAll(List<Participant> participants, boolean parallel) {
        log.info("resolve.started participants={} parallel={}", participants.size(), parallel);
        List<MatchResult> results;
        if (parallel) {
            Map<String, String> callerContext = MDC.getCopyOfContextMap();
            results = participants.parallelStream()
                    .map(participant -> resolveWithContext(participant, callerContext))
                    .toList();
        } else {
            results = participants.stream().map(this::resolve).toList();
        }
        log.info("resolve.completed results={}", results.size());
        return results;
    }

    private MatchResult resolveWithContext(Participant participant, Map<String, String> callerContext) {
        try (LogContext ctx = LogContext.fromMap(callerContext)) {
            return resolve(participant);
        }
    }

    public List<MatchResult> resolveAll(List<Participant> participants) {
        return resolveAll(participants, false);
    }

    private Optional<MatchResult> firstMatch(Participant participant) {
        for (MatchStrategy strategy : strategies) {
            Optional<MatchResult> result = strategy.match(participant);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private MatchResult noMatch(Participant participant) {
        if (normalizer.normalizeZip(participant.getZip()) == null) {
            return MatchResult.noMatch(participant, MatchResult.METHOD_NO_ZIPCODE, "");
        }
        return zipCountyResolver.resolve(participant.getZip())
                .map(county -> MatchResult.noMatch(participant, MatchResult.METHOD_ZIPCODE_COUNTY, county))
                .orElseGet(() -> MatchResult.noMatch(participant, MatchResult.METHOD_NO_COUNTY, ""));
    }
}
