package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.SelectionStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks a session status against the statuses of its selections. Pure: reports problems,
 * never repairs them.
 */
@Component
public class StateConsistencyValidator {

    public ConsistencyReport validate(SessionStatus sessionStatus, Collection<SelectionStatus> itemStatuses) {
        Map<SelectionStatus, Integer> counts = new EnumMap<>(SelectionStatus.class);
        for (SelectionStatus status : itemStatuses) {
            counts.merge(status, 1, Integer::sum);
        }
        return validate(sessionStatus, counts);
    }

    public ConsistencyReport validate(SessionStatus sessionStatus, Map<SelectionStatus, Integer> counts) {
        ImportSessionStats stats = ImportSessionStats.fromCounts(counts);
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        int open = stats.getPending() + stats.getProcessing();

        if (stats.getTotal() == 0) {
            if (!sessionStatus.isIdle() && !sessionStatus.isTerminal() && sessionStatus != SessionStatus.EXPANDING) {
                issues.add(String.format("Session is %s but has no selections", sessionStatus));
                recommendations.add("Roll the session up as IMPORTED or re-expand the picker selection");
            }
        } else {
            if (sessionStatus.isTerminal() && open > 0) {
                issues.add(String.format("Session is %s but %d selections are not terminal", sessionStatus, open));
                recommendations.add("Let running selections finish or wait for the watchdog to reclaim them");
            }

            if (sessionStatus.isProcessing() && open == 0) {
                issues.add(String.format("Session is %s but all %d selections are terminal", sessionStatus, stats.getTotal()));
                recommendations.add("Run the watchdog roll-up to complete the session");
            }

            if (sessionStatus.isIdle() && stats.getProcessing() > 0) {
                issues.add(String.format("Session is %s but %d selections are running", sessionStatus, stats.getProcessing()));
                recommendations.add("Move the session to PROCESSING or ENQUEUED");
            }

            if (sessionStatus == SessionStatus.FAILED && stats.getSuccessRate() > 0.5) {
                issues.add(String.format("Session is FAILED with success rate %.2f", stats.getSuccessRate()));
                recommendations.add("Re-run the roll-up; the session should be IMPORTED");
            }

            if (sessionStatus == SessionStatus.ERROR && stats.getSuccess() > 0) {
                issues.add(String.format("Session is ERROR but %d selections imported", stats.getSuccess()));
                recommendations.add("Re-run the roll-up; any imported selection makes the session IMPORTED");
            }

            if (sessionStatus == SessionStatus.IMPORTED && open == 0 && stats.getSuccess() == 0 && stats.getFailed() > 0) {
                issues.add("Session is IMPORTED but no selection imported successfully");
                recommendations.add("Mark the session as ERROR");
            }
        }

        return ConsistencyReport.builder()
                .sessionStatus(sessionStatus)
                .consistent(issues.isEmpty())
                .issues(issues)
                .recommendations(recommendations)
                .stats(stats)
                .build();
    }
}
