package com.deeplog.deeplog.recent;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized recent-timers configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "recent-timers")
public class RecentTimerProperties {

    private String slotKey = RecentTimerConstants.DEFAULT_SLOT_KEY;
    private int maxDescriptionLength = RecentTimerConstants.DEFAULT_MAX_DESCRIPTION_LENGTH;
    private int defaultLimit = RecentTimerConstants.DEFAULT_LIMIT;
    private int maxLimit = RecentTimerConstants.DEFAULT_MAX_LIMIT;

    public String getSlotKey() {
        return slotKey;
    }

    public void setSlotKey(String slotKey) {
        this.slotKey = slotKey;
    }

    /**
     * Exclusive upper bound on description length admitted during reconciliation.
     */
    public int getMaxDescriptionLength() {
        return maxDescriptionLength;
    }

    public void setMaxDescriptionLength(int maxDescriptionLength) {
        this.maxDescriptionLength = maxDescriptionLength;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }
}
