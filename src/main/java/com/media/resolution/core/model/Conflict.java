package com.media.resolution.core.model;

import java.util.Objects;

/**
 * Two sources claimed the same target; the loser is reported and never applied.
 */
public record Conflict(ResolvedMapping loser, ResolvedMapping winner) {

    public Conflict {
        Objects.requireNonNull(loser, "loser is required");
        Objects.requireNonNull(winner, "winner is required");
        if (!loser.targetId().equals(winner.targetId())) {
            throw new IllegalArgumentException("conflicting mappings must share a target");
        }
    }

    public TargetId targetId() {
        return winner.targetId();
    }

    public String loserTitle() {
        return loser.source().getTitle();
    }

    public String winnerTitle() {
        return winner.source().getTitle();
    }

    public String targetTitle() {
        return winner.target().getTitle();
    }

    public String loserStrategy() {
        return loser.strategyName();
    }

    public String winnerStrategy() {
        return winner.strategyName();
    }

    /**
     * Operator-facing reason attached to the losing source.
     */
    public String reason() {
        return String.format("duplicate: same target already matched by \"%s\" via %s",
                winnerTitle(), winnerStrategy());
    }
}
