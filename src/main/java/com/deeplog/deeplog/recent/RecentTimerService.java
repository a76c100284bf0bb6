package com.deeplog.deeplog.recent;

import com.deeplog.deeplog.storage.SlotStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns one {@link RecentTimerCache} per client context and maps request payloads onto it.
 * A cache is opened on first use and released when its session ends; its slot outlives it.
 */
@Service
public class RecentTimerService {

    private final SlotStorage slotStorage;
    private final ObjectMapper objectMapper;
    private final RecentTimerProperties properties;
    private final ConcurrentMap<String, RecentTimerCache> caches = new ConcurrentHashMap<>();

    public RecentTimerService(SlotStorage slotStorage, ObjectMapper objectMapper, RecentTimerProperties properties) {
        this.slotStorage = slotStorage;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public RecentTimerCache cacheFor(String contextId) {
        return caches.computeIfAbsent(contextId, this::openCache);
    }

    public void release(String contextId) {
        if (contextId != null) {
            caches.remove(contextId);
        }
    }

    public List<RecentTimerModels.RecentTimerResponse> search(String contextId, String query, Integer limit) {
        return cacheFor(contextId).search(query, safeLimit(limit)).stream()
                .map(RecentTimerModels.RecentTimerResponse::from)
                .toList();
    }

    public List<RecentTimerModels.RecentTimerResponse> listEntries(String contextId) {
        return cacheFor(contextId).entries().value().stream()
                .map(RecentTimerModels.RecentTimerResponse::from)
                .toList();
    }

    public RecentTimerModels.StoreStatusResponse addEntry(String contextId, RecentTimerModels.AddTimerRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_BODY_REQUIRED);
        }
        if (request.id() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_ID_REQUIRED);
        }
        RecentTimerEntry entry = new RecentTimerEntry(
                request.id(),
                requireDescription(request.description()),
                request.projectId(),
                requireTagIds(request.tagIds()),
                request.usageCount() == null ? 0 : request.usageCount()
        );
        return RecentTimerModels.StoreStatusResponse.from(cacheFor(contextId).add(entry));
    }

    public RecentTimerModels.StoreStatusResponse reconcile(String contextId, List<FetchedTimeEntry> fetched) {
        if (fetched == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_BODY_REQUIRED);
        }
        return RecentTimerModels.StoreStatusResponse.from(cacheFor(contextId).reconcile(fetched));
    }

    public RecentTimerModels.StoreStatusResponse incrementUsage(String contextId, RecentTimerModels.UsageRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_BODY_REQUIRED);
        }
        return RecentTimerModels.StoreStatusResponse.from(cacheFor(contextId).incrementUsage(
                requireDescription(request.description()),
                request.projectId(),
                requireTagIds(request.tagIds())
        ));
    }

    public RecentTimerModels.StoreStatusResponse clear(String contextId) {
        return RecentTimerModels.StoreStatusResponse.from(cacheFor(contextId).clear());
    }

    private RecentTimerCache openCache(String contextId) {
        String slotKey = properties.getSlotKey() + RecentTimerConstants.SLOT_KEY_SEPARATOR + contextId;
        return new RecentTimerCache(
                new SlotRecentTimerStore(slotStorage, objectMapper, slotKey),
                properties.getMaxDescriptionLength()
        );
    }

    private int safeLimit(Integer limit) {
        int requested = limit == null ? properties.getDefaultLimit() : limit;
        return Math.max(1, Math.min(requested, properties.getMaxLimit()));
    }

    private String requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_DESCRIPTION_REQUIRED);
        }
        return description;
    }

    private List<Long> requireTagIds(List<Long> tagIds) {
        if (tagIds != null && tagIds.stream().anyMatch(Objects::isNull)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, RecentTimerConstants.MSG_NULL_TAG_ID);
        }
        return tagIds;
    }
}
