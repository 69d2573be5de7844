package com.phillippitts.echoscribe.domain;

import java.util.List;

/**
 * Action items extracted from a meeting transcript.
 */
public record ActionItemsResult(String meetingId, List<ActionItem> actionItems) {

    public ActionItemsResult {
        actionItems = List.copyOf(actionItems);
    }

    /**
     * @param deadline ISO date, or {@code null} when none was mentioned
     */
    public record ActionItem(int id, String description, String priority, String assignee, String deadline) {
    }
}
