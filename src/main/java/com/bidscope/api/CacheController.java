package com.bidscope.api;

import com.bidscope.cache.ResultCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final ResultCache cache;

    public CacheController(ResultCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return cache.getCacheStats();
    }

    /**
     * Call after the dataset snapshot is refreshed.
     */
    @DeleteMapping
    public Map<String, Object> invalidate() {
        return Map.of("invalidated", cache.invalidateAll());
    }
}
