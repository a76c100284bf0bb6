package com.deeplog.deeplog.recent;

import com.deeplog.deeplog.context.ClientContextService;
import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Releases the cache handle of a client context when its HTTP session ends.
 */
@Component
public class RecentTimerSessionListener implements HttpSessionListener {

    private static final Logger log = LoggerFactory.getLogger(RecentTimerSessionListener.class);

    private final RecentTimerService recentTimerService;

    public RecentTimerSessionListener(RecentTimerService recentTimerService) {
        this.recentTimerService = recentTimerService;
    }

    @Override
    public void sessionDestroyed(HttpSessionEvent event) {
        String contextId = ClientContextService.contextIdOf(event.getSession());
        if (contextId != null) {
            recentTimerService.release(contextId);
            log.debug("Released recent timers cache for context {}", contextId);
        }
    }
}
