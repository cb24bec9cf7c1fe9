package com.participant.matching.matching;

import com.participant.matching.core.model.DemographicRecord;
import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.core.model.Participant;
import com.participant.matching.index.ReferenceIndex;
import com.participant.matching.rules.IdentityNormalizer;

import java.util.Optional;

public class EmailMatchStrategy extends DemographicMatchStrategy {

    public EmailMatchStrategy(ReferenceIndex index, IdentityNormalizer normalizer) {
        super(index, normalizer);
    }

    @Override
    public MatchQuality quality() {
        return MatchQuality.EMAIL;
    }

    @Override
    protected String key(Participant participant) {
        return normalizer.normalizeEmail(participant.getEmail());
    }

    @Override
    protected Optional<DemographicRecord> lookup(String key) {
        return index.lookupByEmail(key);
    }
}
