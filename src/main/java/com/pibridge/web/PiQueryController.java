package com.pibridge.web;

import com.pibridge.domain.ExecutionResult;
import com.pibridge.plugin.DataSourcePlugin;
import com.pibridge.plugin.DataSourceSchema;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HTTP entry point used by the trigger layer.
 *
 * Note: authn/authz is expected to be enforced upstream.
 */
@RestController
@RequestMapping("/api/pi")
public class PiQueryController {

    private final DataSourcePlugin historianDataSource;

    public PiQueryController(DataSourcePlugin historianDataSource) {
        this.historianDataSource = historianDataSource;
    }

    @PostMapping("/query")
    public Mono<ExecutionResult> query(@RequestBody PiQueryRequest request) {
        return historianDataSource.executeQuery(request.getQuery(), request.toParameters());
    }

    @PostMapping("/preview")
    public Map<String, String> preview(@RequestBody PiQueryRequest request) {
        return Map.of("preview", historianDataSource.previewQuery(request.getQuery(), request.toParameters()));
    }

    @GetMapping("/schema")
    public Mono<DataSourceSchema> schema() {
        return historianDataSource.discoverSchema();
    }

    @GetMapping("/tags/suggest")
    public Mono<Map<String, Object>> suggestTag(@RequestParam(name = "pattern", required = false) String pattern) {
        return historianDataSource.suggestTag(pattern)
            .map(tag -> Map.<String, Object>of("found", true, "tag", tag))
            .defaultIfEmpty(Map.of("found", false));
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return historianDataSource.testConnection()
            .map(reachable -> Map.<String, Object>of(
                "type", historianDataSource.type(),
                "reachable", reachable));
    }
}
