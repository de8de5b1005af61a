package com.example.preload.api;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.preload.backend.TaskDetail;
import com.example.preload.backend.TaskDetailBackend;
import com.example.preload.core.CacheStats;
import com.example.preload.core.LoadStatus;
import com.example.preload.core.PreloadCache;
import com.example.preload.core.ScheduledBatch;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = PreloadController.class)
class PreloadControllerTest {

    @Autowired MockMvc mvc;
    @MockBean TaskDetailBackend backend;
    @MockBean PreloadCache<String, TaskDetail> cache;

    @Test
    void openingAPreloadedTaskReturnsItsDetail() throws Exception {
        TaskDetail detail = new TaskDetail("t1", "plan", 30, List.of("guide-t1"));
        when(cache.getOrCreate(eq("t1"), any(), eq(backend))).thenReturn(detail);
        when(cache.status("t1")).thenReturn(LoadStatus.COMPLETED);

        mvc.perform(get("/task").param("id", "t1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ready").value(true))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.detail.estimatedMinutes").value(30));
    }

    @Test
    void openingAColdTaskReturnsPlaceholder() throws Exception {
        when(cache.getOrCreate(eq("t2"), any(), eq(backend))).thenReturn(TaskDetail.placeholder("t2"));
        when(cache.status("t2")).thenReturn(LoadStatus.LOADING);

        mvc.perform(get("/task").param("id", "t2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ready").value(false))
            .andExpect(jsonPath("$.status").value("LOADING"));
    }

    @Test
    void preloadSchedulesBatchAndReportsStatuses() throws Exception {
        List<String> ids = List.of("a", "b", "c");
        when(cache.startBatch(ids, backend))
            .thenReturn(new ScheduledBatch<>(List.of("a", "b"), CompletableFuture.completedFuture(null)));
        when(cache.status("a")).thenReturn(LoadStatus.LOADING);
        when(cache.status("b")).thenReturn(LoadStatus.LOADING);
        when(cache.status("c")).thenReturn(LoadStatus.NOT_STARTED);

        mvc.perform(get("/preload").param("ids", "a,b,c"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scheduled", contains("a", "b")))
            .andExpect(jsonPath("$.statuses.c").value("NOT_STARTED"));

        verify(cache).startBatch(ids, backend);
    }

    @Test
    void statusExposesFailureReason() throws Exception {
        when(cache.status("t3")).thenReturn(LoadStatus.failed("timeout"));

        mvc.perform(get("/status").param("id", "t3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.reason").value("timeout"))
            .andExpect(jsonPath("$.ready").value(false));
    }

    @Test
    void invalidateDelegatesToCache() throws Exception {
        mvc.perform(get("/invalidate").param("id", "t4"))
            .andExpect(status().isOk());

        verify(cache).invalidate("t4");
    }

    @Test
    void statsIncludeBackendRequests() throws Exception {
        when(cache.stats()).thenReturn(new CacheStats());
        when(cache.size()).thenReturn(2);
        when(backend.getRequestCount()).thenReturn(7L);

        mvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.backendRequests").value(7))
            .andExpect(jsonPath("$.cacheSize").value(2))
            .andExpect(jsonPath("$.hits").value(0));
    }

    @Test
    void invalidBackendConfigIsBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("latency must not be negative, got: -5"))
            .when(backend).setLatencyMillis(-5);

        mvc.perform(get("/config").param("latency", "-5"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("latency must not be negative, got: -5"));
    }
}
