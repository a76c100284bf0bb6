package com.deeplog.deeplog.recent;

import java.util.List;

/**
 * Persistence of one ordered recent-timers list. Implementations absorb every failure and
 * report it through the returned {@link StoreOutcome}.
 */
public interface RecentTimerStore {

    StoreOutcome<List<RecentTimerEntry>> load();

    StoreOutcome<List<RecentTimerEntry>> save(List<RecentTimerEntry> entries);

    StoreOutcome<List<RecentTimerEntry>> clear();
}
