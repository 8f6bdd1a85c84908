package com.civicdesk.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BadgeEvaluation {

    private final List<EarnedBadge> earned;
    private final List<EarnedBadge> newlyEarned;

    public BadgeEvaluation(List<EarnedBadge> earned, List<EarnedBadge> newlyEarned) {
        this.earned = Collections.unmodifiableList(new ArrayList<>(earned));
        this.newlyEarned = Collections.unmodifiableList(new ArrayList<>(newlyEarned));
    }

    /**
     * Every badge the history qualifies for, in catalog order.
     */
    public List<EarnedBadge> getEarned() {
        return earned;
    }

    /**
     * The subset of {@link #getEarned()} not present in the previously recorded set.
     */
    public List<EarnedBadge> getNewlyEarned() {
        return newlyEarned;
    }
}
