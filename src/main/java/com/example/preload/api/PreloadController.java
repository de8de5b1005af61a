package com.example.preload.api;

import com.example.preload.backend.TaskDetail;
import com.example.preload.backend.TaskDetailBackend;
import com.example.preload.core.LoadStatus;
import com.example.preload.core.PreloadCache;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PreloadController {

    private final TaskDetailBackend backend;
    private final PreloadCache<String, TaskDetail> cache;

    public PreloadController(TaskDetailBackend backend, PreloadCache<String, TaskDetail> cache) {
        this.backend = backend;
        this.cache = cache;
    }

    // Opening a detail sheet: the preloaded value if ready, else a placeholder while it loads.
    @GetMapping("/task")
    public Map<String, Object> getTask(@RequestParam String id) {
        TaskDetail detail = cache.getOrCreate(id, TaskDetail::placeholder, backend);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", !detail.isPlaceholder());
        body.put("status", cache.status(id).toString());
        body.put("detail", detail);
        return body;
    }

    // Rows scrolled into view. Only the first batch-width eligible ids are scheduled.
    @GetMapping("/preload")
    public Map<String, Object> preload(@RequestParam List<String> ids) {
        List<String> keys = new ArrayList<>();
        for (String id : ids) {
            if (id.isBlank()) {
                throw new IllegalArgumentException("ids must not contain blanks");
            }
            keys.add(id.trim());
        }
        List<String> scheduled = cache.startBatch(keys, backend).keys();

        Map<String, String> statuses = new LinkedHashMap<>();
        for (String key : keys) {
            statuses.put(key, cache.status(key).toString());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scheduled", scheduled);
        body.put("statuses", statuses);
        return body;
    }

    @GetMapping("/status")
    public Map<String, Object> status(@RequestParam String id) {
        LoadStatus status = cache.status(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("status", status.kind().name());
        body.put("reason", status.reason());
        body.put("ready", cache.isReady(id));
        return body;
    }

    @GetMapping("/invalidate")
    public String invalidate(@RequestParam String id) {
        cache.invalidate(id);
        return "Invalidated " + id;
    }

    @GetMapping("/config")
    public String configure(
        @RequestParam(defaultValue = "500") long latency,
        @RequestParam(defaultValue = "0.0") double failureRatio
    ) {
        backend.setLatencyMillis(latency);
        backend.setFailureRatio(failureRatio);
        return "Backend latency=" + latency + ", failureRatio=" + failureRatio + ", cache=" + cache.settings();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> body = new LinkedHashMap<>(cache.stats().snapshot());
        body.put("backendRequests", backend.getRequestCount());
        body.put("cacheSize", cache.size());
        return body;
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
        cache.clear();
        cache.resetStats();
    }
}
