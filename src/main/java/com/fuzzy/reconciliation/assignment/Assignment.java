package com.fuzzy.reconciliation.assignment;

import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The current one-to-one matching, held as two mirrored maps.
 * Attempting to match an already-matched record raises {@link StateCorruptionException}
 * instead of silently displacing the existing partner.
 */
public class Assignment {

    private final Map<RecordId, Match> byLeft = new HashMap<>();
    private final Map<RecordId, RecordId> leftByRight = new HashMap<>();

    public void match(Match match) {
        Match existingLeft = byLeft.get(match.leftId());
        if (existingLeft != null) {
            throw new StateCorruptionException("Left record " + match.leftId()
                    + " is already matched to " + existingLeft.rightId()
                    + "; refusing to also match " + match.rightId());
        }
        RecordId existingRight = leftByRight.get(match.rightId());
        if (existingRight != null) {
            throw new StateCorruptionException("Right record " + match.rightId()
                    + " is already matched to " + existingRight
                    + "; refusing to also match " + match.leftId());
        }
        byLeft.put(match.leftId(), match);
        leftByRight.put(match.rightId(), match.leftId());
    }

    /**
     * Releases the match held by a left record.
     */
    public Optional<Match> unmatchLeft(RecordId leftId) {
        Match removed = byLeft.remove(leftId);
        if (removed == null) {
            return Optional.empty();
        }
        RecordId mirrored = leftByRight.remove(removed.rightId());
        if (!leftId.equals(mirrored)) {
            throw new StateCorruptionException("Mirror of " + leftId + " -> " + removed.rightId()
                    + " points at " + mirrored);
        }
        return Optional.of(removed);
    }

    public Optional<Match> matchOf(RecordKey key) {
        if (key.side() == Side.LEFT) {
            return Optional.ofNullable(byLeft.get(key.id()));
        }
        RecordId leftId = leftByRight.get(key.id());
        return leftId == null ? Optional.empty() : Optional.ofNullable(byLeft.get(leftId));
    }

    public Optional<RecordKey> partnerOf(RecordKey key) {
        return matchOf(key).map(m -> key.side() == Side.LEFT
                ? RecordKey.right(m.rightId())
                : RecordKey.left(m.leftId()));
    }

    public boolean isMatched(RecordKey key) {
        return key.side() == Side.LEFT ? byLeft.containsKey(key.id()) : leftByRight.containsKey(key.id());
    }

    public Map<RecordId, Match> matchesByLeft() {
        return Collections.unmodifiableMap(byLeft);
    }

    public int size() {
        return byLeft.size();
    }

    /**
     * Checks that the two maps mirror each other for the given records.
     *
     * @throws StateCorruptionException on the first inconsistency found
     */
    public void verify(Collection<RecordKey> keys) {
        for (RecordKey key : keys) {
            if (key.side() == Side.LEFT) {
                Match m = byLeft.get(key.id());
                if (m != null && !key.id().equals(leftByRight.get(m.rightId()))) {
                    throw new StateCorruptionException("Left " + key.id() + " -> right " + m.rightId()
                            + " is not mirrored (right maps to " + leftByRight.get(m.rightId()) + ")");
                }
            } else {
                RecordId leftId = leftByRight.get(key.id());
                if (leftId != null) {
                    Match m = byLeft.get(leftId);
                    if (m == null || !m.rightId().equals(key.id())) {
                        throw new StateCorruptionException("Right " + key.id() + " -> left " + leftId
                                + " is not mirrored");
                    }
                }
            }
        }
    }

    /**
     * Checks every entry for one-to-one consistency.
     */
    public void verifyAll() {
        if (byLeft.size() != leftByRight.size()) {
            throw new StateCorruptionException("Assignment maps disagree in size: " + byLeft.size()
                    + " left entries vs " + leftByRight.size() + " right entries");
        }
        for (Match m : byLeft.values()) {
            if (!m.leftId().equals(leftByRight.get(m.rightId()))) {
                throw new StateCorruptionException("Right " + m.rightId()
                        + " is claimed by more than one left record");
            }
        }
    }
}
