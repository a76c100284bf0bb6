package com.deeplog.deeplog.recent;

import com.deeplog.deeplog.context.ClientContextService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/recent-timers")
public class RecentTimerController {

    private final RecentTimerService recentTimerService;
    private final ClientContextService clientContextService;

    public RecentTimerController(RecentTimerService recentTimerService, ClientContextService clientContextService) {
        this.recentTimerService = recentTimerService;
        this.clientContextService = clientContextService;
    }

    @GetMapping("/search")
    public ResponseEntity<List<RecentTimerModels.RecentTimerResponse>> search(
            @RequestParam(defaultValue = "") String query,
            @RequestParam(required = false) Integer limit,
            HttpSession session
    ) {
        String contextId = clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(recentTimerService.search(contextId, query, limit));
    }

    @GetMapping("/entries")
    public ResponseEntity<List<RecentTimerModels.RecentTimerResponse>> listEntries(HttpSession session) {
        String contextId = clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(recentTimerService.listEntries(contextId));
    }

    @PostMapping("/entries")
    public ResponseEntity<RecentTimerModels.StoreStatusResponse> addEntry(
            @RequestBody RecentTimerModels.AddTimerRequest request,
            HttpServletRequest httpRequest,
            HttpSession session
    ) {
        clientContextService.requireValidToken(httpRequest, session);
        String contextId = clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(recentTimerService.addEntry(contextId, request));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<RecentTimerModels.StoreStatusResponse> reconcile(
            @RequestBody List<FetchedTimeEntry> fetched,
            HttpServletRequest httpRequest,
            HttpSession session
    ) {
        clientContextService.requireValidToken(httpRequest, session);
        String contextId = clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(recentTimerService.reconcile(contextId, fetched));
    }

    @PostMapping("/usage")
    public ResponseEntity<RecentTimerModels.StoreStatusResponse> incrementUsage(
            @RequestBody RecentTimerModels.UsageRequest request,
            HttpServletRequest httpRequest,
            HttpSession session
    ) {
        clientContextService.requireValidToken(httpRequest, session);
        String contextId = clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(recentTimerService.incrementUsage(contextId, request));
    }

    @DeleteMapping("/entries")
    public ResponseEntity<Void> clearEntries(
            HttpServletRequest httpRequest,
            HttpSession session
    ) {
        clientContextService.requireValidToken(httpRequest, session);
        String contextId = clientContextService.getOrCreateContextId(session);
        recentTimerService.clear(contextId);
        return ResponseEntity.noContent().build();
    }
}
