package com.copilot.report;

import java.util.List;
import java.util.Map;

/**
 * Execution summary of one subject's decision record.
 *
 * @param subjectId         Subject id
 * @param totalActions      Number of actions in the record
 * @param urgencyCounts     Actions per template urgency ({@code immediate}, {@code high}, {@code critical})
 * @param budgetRequired    Actions whose template needs budget
 * @param approvalsRequired Actions whose template needs approval
 * @param actions           Action ids in record order
 */
public record ActionReport(
        String subjectId,
        int totalActions,
        Map<String, Integer> urgencyCounts,
        int budgetRequired,
        int approvalsRequired,
        List<String> actions
) {
    public ActionReport {
        urgencyCounts = Map.copyOf(urgencyCounts);
        actions = List.copyOf(actions);
    }

    public int urgencyCount(String urgency) {
        return urgencyCounts.getOrDefault(urgency, 0);
    }
}
