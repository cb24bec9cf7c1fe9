package com.participant.matching.matching;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.core.model.Participant;
import com.participant.matching.index.ReferenceIndex;
import com.participant.matching.rules.IdentityNormalizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Base for strategies that find a demographic record by a personal identifier and
 * then attach the residential record of the same parcel, when one exists.
 */
public abstract class DemographicMatchStrategy implements MatchStrategy {

    protected final ReferenceIndex index;
    protected final IdentityNormalizer normalizer;

    protected DemographicMatchStrategy(ReferenceIndex index, IdentityNormalizer normalizer) {
        this.index = Objects.requireNonNull(index, "index is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * Normalized lookup key of the participant, or null when the signal is unusable.
     */
    protected abstract String key(Participant participant);

    protected abstract Optional<DemographicRecord> lookup(String key);

    @Override
    public Optional<MatchResult> match(Participant participant) {
        String key = key(participant);
        if (key == null) {
            return Optional.empty();
        }
        return lookup(key).map(demographic -> MatchResult.matched(
                participant,
                quality(),
                demographic,
                index.findResidential(demographic.parcelKey()).orElse(null)));
    }
}
