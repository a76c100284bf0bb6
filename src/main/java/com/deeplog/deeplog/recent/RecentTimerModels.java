package com.deeplog.deeplog.recent;

import java.util.List;

public final class RecentTimerModels {

    private RecentTimerModels() {
    }

    public record AddTimerRequest(Long id, String description, Long projectId, List<Long> tagIds, Integer usageCount) {
    }

    public record UsageRequest(String description, Long projectId, List<Long> tagIds) {
    }

    public record RecentTimerResponse(long id, String description, Long projectId, List<Long> tagIds, int usageCount) {

        static RecentTimerResponse from(RecentTimerEntry entry) {
            return new RecentTimerResponse(
                    entry.id(),
                    entry.description(),
                    entry.projectId(),
                    entry.tagIds(),
                    entry.usageCount()
            );
        }
    }

    public record StoreStatusResponse(StoreStatus status, int entryCount, String detail) {

        static StoreStatusResponse from(StoreOutcome<List<RecentTimerEntry>> outcome) {
            return new StoreStatusResponse(outcome.status(), outcome.value().size(), outcome.detail());
        }
    }
}
