package com.example.mediacache.api;

import com.example.mediacache.backend.MediaMetadata;
import com.example.mediacache.backend.MetadataBackend;
import com.example.mediacache.core.CacheService;
import com.example.mediacache.core.CacheStats;
import com.example.mediacache.service.DownloadDecision;
import com.example.mediacache.service.FetchResult;
import com.example.mediacache.service.MediaInfoService;
import com.example.mediacache.service.SessionView;
import com.example.mediacache.session.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class MediaController {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final MediaInfoService mediaInfoService;
    private final CacheService<MediaMetadata> cache;
    private final SessionStore sessions;
    private final MetadataBackend backend;

    public MediaController(
        MediaInfoService mediaInfoService,
        CacheService<MediaMetadata> cache,
        SessionStore sessions,
        MetadataBackend backend
    ) {
        this.mediaInfoService = mediaInfoService;
        this.cache = cache;
        this.sessions = sessions;
        this.backend = backend;
    }

    @PostMapping("/fetch")
    public FetchResult fetch(@RequestBody FetchRequest body, HttpServletRequest request) {
        return mediaInfoService.fetch(body.url(), clientAddress(request), userAgent(request));
    }

    @PostMapping("/download")
    public ResponseEntity<DownloadDecision> download(@RequestBody FetchRequest body, HttpServletRequest request) {
        if (body.url() == null || body.url().isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        DownloadDecision decision = mediaInfoService.recordDownload(body.url(), clientAddress(request), userAgent(request));
        HttpStatus status = decision.allowed() ? HttpStatus.OK : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status).body(decision);
    }

    @GetMapping("/session")
    public SessionView session(HttpServletRequest request) {
        return mediaInfoService.currentSession(clientAddress(request), userAgent(request));
    }

    @PostMapping("/session/ad-view")
    public SessionView adView(HttpServletRequest request) {
        return mediaInfoService.recordAdView(clientAddress(request), userAgent(request));
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> stats() {
        CacheStats stats = cache.stats();
        return Map.of(
            "cache", stats,
            "backendRequests", backend.getRequestCount()
        );
    }

    @DeleteMapping("/cache")
    public Map<String, Object> invalidate(@RequestParam String url) {
        return Map.of("invalidated", cache.invalidate(url));
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Void> clear() {
        cache.clear();
        backend.resetCount();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of(
            "name", "media-cache",
            "endpoints", Map.of(
                "POST /fetch", "Fetch media metadata, served from cache when possible",
                "POST /download", "Record a download against the daily quota",
                "GET /session", "Current session, rate limit and delay state",
                "POST /session/ad-view", "Record an ad view",
                "GET /cache/stats", "Cache statistics",
                "DELETE /cache", "Invalidate one cached url",
                "POST /cache/clear", "Clear the cache and the backend request counter",
                "GET /health", "Health check"
            )
        );
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", "healthy",
            "cacheSize", cache.size(),
            "sessions", sessions.size()
        );
    }

    static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static String userAgent(HttpServletRequest request) {
        String ua = request.getHeader(HttpHeaders.USER_AGENT);
        return ua == null ? "" : ua;
    }
}
