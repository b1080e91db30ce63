package com.resilia.neurogrid.core.estimator;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.telemetry.WeatherPoint;
import org.springframework.stereotype.Component;

/**
 * 由天气预报估算可再生能源出力
 *
 * <p>光伏 kW = 辐照度 · solarFactor；风电 kW = 风速³ · windFactor。</p>
 */
@Component
public class RenewableProductionModel {

    private final double solarFactor;
    private final double windFactor;

    public RenewableProductionModel(NeuroGridProperties properties) {
        this.solarFactor = properties.getEstimator().getSolarFactor();
        this.windFactor = properties.getEstimator().getWindFactor();
    }

    public double solarKw(double irradiance) {
        return Math.max(0.0, irradiance) * solarFactor;
    }

    public double windKw(double windSpeed) {
        double speed = Math.max(0.0, windSpeed);
        return speed * speed * speed * windFactor;
    }

    public double productionKw(WeatherPoint point) {
        return solarKw(point.getSolarIrradiance()) + windKw(point.getWindSpeed());
    }
}
