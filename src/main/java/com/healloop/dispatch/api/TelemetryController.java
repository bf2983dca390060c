package com.healloop.dispatch.api;

import com.healloop.core.memory.Recommendation;
import com.healloop.core.memory.RecommendationLog;
import com.healloop.core.telemetry.TelemetryRecorder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for attempt telemetry and proactive recommendations.
 */
@RestController
@RequestMapping("/api/v1")
public class TelemetryController {

    private final TelemetryRecorder telemetry;
    private final RecommendationLog recommendations;

    public TelemetryController(TelemetryRecorder telemetry, RecommendationLog recommendations) {
        this.telemetry = telemetry;
        this.recommendations = recommendations;
    }

    /**
     * GET /api/v1/telemetry — Recent attempt records plus a summary of the whole buffer.
     */
    @GetMapping("/telemetry")
    public Map<String, Object> telemetry(@RequestParam(defaultValue = "50") int limit) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("summary", telemetry.summary());
        result.put("capacity", telemetry.capacity());
        result.put("records", telemetry.recent(Math.max(0, limit)));
        return result;
    }

    @GetMapping("/recommendations")
    public List<Recommendation> recommendations() {
        return recommendations.all();
    }
}
