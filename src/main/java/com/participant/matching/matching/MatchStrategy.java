package com.participant.matching.matching;

import com.participant.matching.core.model.MatchQuality;
import com.participant.matching.core.model.MatchResult;
import com.participant.matching.core.model.Participant;

import java.util.Optional;

/**
 * One identity signal in the resolver chain.
 * Implementations are read-only and must not throw for missing or malformed participant data.
 */
public interface MatchStrategy {

    /**
     * The quality a successful match of this strategy carries.
     */
    MatchQuality quality();

    /**
     * Tries to match the participant on this strategy's signal.
     *
     * @return the match, or empty if the signal is absent or unknown
     */
    Optional<MatchResult> match(Participant participant);
}
