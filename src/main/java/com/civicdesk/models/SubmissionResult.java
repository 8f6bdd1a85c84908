package com.civicdesk.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one issue submission. Points and badges are those awarded by this call only.
 */
public class SubmissionResult {

    private boolean success;
    private Issue issue;
    private int pointsAwarded;
    private List<EarnedBadge> badgesEarned = new ArrayList<>();
    private UserProgress progress;
    private String errorMessage;
    private List<String> errorFields = new ArrayList<>();

    public static SubmissionResult succeeded(Issue issue, int pointsAwarded, List<EarnedBadge> badgesEarned,
                                             UserProgress progress) {
        SubmissionResult result = new SubmissionResult();
        result.success = true;
        result.issue = issue;
        result.pointsAwarded = pointsAwarded;
        result.badgesEarned = new ArrayList<>(badgesEarned);
        result.progress = progress;
        return result;
    }

    public static SubmissionResult failed(String errorMessage, List<String> errorFields) {
        SubmissionResult result = new SubmissionResult();
        result.success = false;
        result.errorMessage = errorMessage;
        result.errorFields = errorFields != null ? new ArrayList<>(errorFields) : new ArrayList<>();
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public Issue getIssue() {
        return issue;
    }

    public int getPointsAwarded() {
        return pointsAwarded;
    }

    public List<EarnedBadge> getBadgesEarned() {
        return badgesEarned;
    }

    public UserProgress getProgress() {
        return progress;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getErrorFields() {
        return errorFields;
    }
}
