package villagecompute.forecastcache.api.types;

/**
 * Fixed set of numeric readings a forecast sample may carry. Every metric is optional on every sample.
 */
public enum ForecastMetric {

    PM10("pm10"),

    PM25("pm25"),

    NO2("no2"),

    O3("o3"),

    SO2("so2"),

    CO("co"),

    UNIVERSAL_AQI("uaqi"),

    CAI_KR("kor_airkorea");

    private final String upstreamCode;

    ForecastMetric(String upstreamCode) {
        this.upstreamCode = upstreamCode;
    }

    /**
     * Pollutant or index code used by the upstream provider for this metric.
     */
    public String getUpstreamCode() {
        return upstreamCode;
    }

    /**
     * Resolves an upstream pollutant/index code.
     *
     * @return metric, or null if the code is not tracked
     */
    public static ForecastMetric fromUpstreamCode(String code) {
        if (code == null) {
            return null;
        }
        for (ForecastMetric metric : values()) {
            if (metric.upstreamCode.equalsIgnoreCase(code)) {
                return metric;
            }
        }
        return null;
    }
}
