package com.civicdesk;

import com.civicdesk.models.LeaderboardEntry;
import com.civicdesk.models.UserProgress;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class LeaderboardService {

    private static final Comparator<UserProgress> RANKING = Comparator
        .comparingInt(UserProgress::getPoints).reversed()
        .thenComparing(Comparator.comparingInt(UserProgress::getIssuesSubmitted).reversed())
        .thenComparing(UserProgress::getUserId);

    private final IssueLifecycleCoordinator coordinator;

    public LeaderboardService(IssueLifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public List<LeaderboardEntry> top(int limit) {
        List<UserProgress> users = coordinator.listProgress();
        users.sort(RANKING);

        List<LeaderboardEntry> entries = new ArrayList<>();
        int max = limit > 0 ? Math.min(limit, users.size()) : users.size();
        for (int i = 0; i < max; i++) {
            entries.add(new LeaderboardEntry(i + 1, users.get(i)));
        }
        return entries;
    }
}
