package dev.relaygate.controller;

import dev.relaygate.cache.CacheStats;
import dev.relaygate.cache.SemanticCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final SemanticCache cache;

    public CacheController(SemanticCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cache.stats();
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        cache.clear();
        return Map.of("success", true, "message", "Semantic cache cleared");
    }
}
