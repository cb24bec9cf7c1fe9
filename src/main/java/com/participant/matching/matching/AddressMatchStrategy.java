package com.participant.matching.matching;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.core.model.Participant;
import com.participant.matching.core.model.ResidentialRecord;
import com.participant.matching.index.ReferenceIndex;
import com.participant.matching.rules.IdentityNormalizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Matches on the normalized street address plus five-digit ZIP. The address key leads to a
 * parcel, whose demographic and residential records are both attached when present.
 */
public class AddressMatchStrategy implements MatchStrategy {

    private final ReferenceIndex index;
    private final IdentityNormalizer normalizer;

    public AddressMatchStrategy(ReferenceIndex index, IdentityNormalizer normalizer) {
        this.index = Objects.requireNonNull(index, "index is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    @Override
    public MatchQuality quality() {
        return MatchQuality.ADDRESS;
    }

    @Override
    public Optional<MatchResult> match(Participant participant) {
        String addressKey = normalizer.normalizeAddress(participant.getAddress(), participant.getZip());
        return index.lookupByAddress(addressKey).flatMap(parcelKey -> {
            DemographicRecord demographic = index.findDemographic(parcelKey).orElse(null);
            ResidentialRecord residential = index.findResidential(parcelKey).orElse(null);
            if (demographic == null && residential == null) {
                return Optional.empty();
            }
            return Optional.of(MatchResult.matched(participant, MatchQuality.ADDRESS, demographic, residential));
        });
    }
}
