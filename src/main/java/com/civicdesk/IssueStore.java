package com.civicdesk;

import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueDraft;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canonical in-memory collection of issues. Records handed out are copies; the stored
 * ones only change through {@link #update(Issue)}.
 */
public class IssueStore {

    private final Map<String, Issue> issues = new ConcurrentHashMap<>();
    private final Clock clock;

    public IssueStore(Clock clock) {
        this.clock = clock;
    }

    public String create(IssueDraft draft) {
        validate(draft);

        String id = UUID.randomUUID().toString();
        while (issues.containsKey(id)) {
            id = UUID.randomUUID().toString();
        }

        Issue issue = new Issue();
        issue.setId(id);
        issue.setTitle(draft.getTitle().trim());
        issue.setDescription(draft.getDescription() != null ? draft.getDescription() : "");
        issue.setCategory(draft.getCategory());
        issue.setPriority(draft.getPriority() != null ? draft.getPriority() : IssuePriority.MEDIUM);
        issue.setStatus(IssueStatus.OPEN);
        issue.setLocation(draft.getLocation().trim());
        issue.setUserId(draft.getUserId());
        issue.setSubmittedAt(clock.millis());
        issue.setAttachments(cleanAttachments(draft.getAttachments()));

        issues.put(id, issue);
        log("Issue created: " + id + " - " + issue.getTitle());
        return id;
    }

    public Optional<Issue> get(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Issue issue = issues.get(id);
        return issue != null ? Optional.of(new Issue(issue)) : Optional.empty();
    }

    /**
     * Replaces the stored record. Identity, owner, submission time and content never change,
     * and awarded points may be assigned only while still unset.
     */
    public Issue update(Issue updated) {
        if (updated == null || updated.getId() == null || updated.getId().isBlank()) {
            throw new IllegalArgumentException("Issue id is required for update");
        }

        Issue existing = issues.get(updated.getId());
        if (existing == null) {
            throw new IssueNotFoundException(updated.getId());
        }
        if (existing.getAwardedPoints() != 0 && existing.getAwardedPoints() != updated.getAwardedPoints()) {
            throw new IllegalStateException("Awarded points are fixed for issue " + existing.getId());
        }
        if (existing.getResolvedAt() != null && !existing.getResolvedAt().equals(updated.getResolvedAt())) {
            throw new IllegalStateException("Resolution time is fixed for issue " + existing.getId());
        }

        Issue replacement = new Issue(existing);
        replacement.setStatus(updated.getStatus());
        replacement.setResolvedAt(updated.getResolvedAt());
        replacement.setAwardedPoints(updated.getAwardedPoints());
        issues.put(replacement.getId(), replacement);
        return new Issue(replacement);
    }

    /**
     * Snapshot of every issue, in no particular order.
     */
    public List<Issue> listAll() {
        List<Issue> results = new ArrayList<>();
        for (Issue issue : issues.values()) {
            results.add(new Issue(issue));
        }
        return results;
    }

    public int size() {
        return issues.size();
    }

    private void validate(IssueDraft draft) {
        List<String> missing = new ArrayList<>();
        if (draft == null) {
            missing.add("issue");
            throw new ValidationException(missing);
        }
        if (isBlank(draft.getTitle())) {
            missing.add("title");
        }
        if (isBlank(draft.getLocation())) {
            missing.add("location");
        }
        if (draft.getCategory() == null) {
            missing.add("category");
        }
        if (isBlank(draft.getUserId())) {
            missing.add("userId");
        }
        if (!missing.isEmpty()) {
            logWarning("Rejected issue submission, missing " + missing);
            throw new ValidationException(missing);
        }
    }

    private List<String> cleanAttachments(List<String> attachments) {
        List<String> cleaned = new ArrayList<>();
        if (attachments == null) {
            return cleaned;
        }
        for (String reference : attachments) {
            if (!isBlank(reference)) {
                cleaned.add(reference.trim());
            }
        }
        return cleaned;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IssueStore] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IssueStore] " + message);
        }
    }
}
