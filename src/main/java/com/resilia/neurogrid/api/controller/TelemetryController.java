package com.resilia.neurogrid.api.controller;

import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.web.result.ApiResult;
import com.resilia.neurogrid.core.telemetry.ForecastFeedUpdate;
import com.resilia.neurogrid.core.telemetry.TelemetryIngest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 遥测接入接口
 */
@Slf4j
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final TelemetryIngest telemetryIngest;

    @PostMapping
    public ApiResult<Map<String, Integer>> submit(@RequestBody List<TelemetrySample> samples) {
        int accepted = telemetryIngest.submitAll(samples);
        return ApiResult.success(Map.of("accepted", accepted));
    }

    @PostMapping("/forecast-feed")
    public ApiResult<Map<String, Integer>> submitForecastFeed(@RequestBody ForecastFeedUpdate update) {
        telemetryIngest.submitForecastFeed(update);
        return ApiResult.success(Map.of("points", update.getPoints().size()));
    }

    @GetMapping("/stats")
    public ApiResult<Map<String, Long>> statistics() {
        return ApiResult.success(telemetryIngest.statistics());
    }
}
