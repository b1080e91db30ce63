package com.resilia.neurogrid.core.telemetry;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 天气预报点
 */
@Value
@Builder
@Jacksonized
public class WeatherPoint {

    long timestamp;

    /**
     * 太阳辐照度 W/m²
     */
    double solarIrradiance;

    /**
     * 风速 m/s
     */
    double windSpeed;

    /**
     * 温度 °C
     */
    double temperature;
}
