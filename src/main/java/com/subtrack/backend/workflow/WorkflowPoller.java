package com.subtrack.backend.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Wakes parked workflow runs. This is what lets a run sleep for days and survive restarts:
 * nothing is held in memory between executions, the poller finds due runs in the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowPoller {

    private final WorkflowEngine workflowEngine;

    @Scheduled(fixedDelayString = "${workflow.poller.interval-ms:60000}",
            initialDelayString = "${workflow.poller.initial-delay-ms:10000}")
    public void resumeDueRuns() {
        try {
            int resumed = workflowEngine.resumeDueRuns();
            if (resumed == 0) {
                log.debug("No due workflow runs");
            }
        } catch (Exception e) {
            log.error("Error resuming due workflow runs: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRate = 300000) // Every 5 minutes
    public void recoverStuckRuns() {
        try {
            workflowEngine.recoverStuckRuns();
        } catch (Exception e) {
            log.error("Error recovering stuck workflow runs: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "0 0 2 * * ?") // 2 AM daily
    public void purgeCompletedRuns() {
        log.info("Starting cleanup of completed workflow runs");
        try {
            workflowEngine.purgeCompletedRuns();
        } catch (Exception e) {
            log.error("Error during workflow run cleanup: {}", e.getMessage(), e);
        }
    }
}
