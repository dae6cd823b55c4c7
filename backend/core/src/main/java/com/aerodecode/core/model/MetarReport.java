package com.aerodecode.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded METAR or SPECI observation. Trend-scoped fields hold the groups that followed the first trend marker.
 */
public record MetarReport(
        String raw,
        String reportType,
        String station,
        ReportTime time,
        boolean automated,
        boolean nil,
        Wind wind,
        WindVariability windVariability,
        Visibility visibility,
        List<RunwayVisualRange> runwayVisualRanges,
        List<RunwayCondition> runwayConditions,
        List<WeatherPhenomenon> weather,
        List<CloudLayer> clouds,
        TemperatureDewpoint temperature,
        AltimeterSetting altimeter,
        List<TrendGroup> trends,
        List<Visibility> trendVisibilities,
        List<WeatherPhenomenon> trendWeather,
        List<CloudLayer> trendClouds,
        String remarks,
        RemarkDetails remarkDetails,
        List<String> unparsed
) {
    public MetarReport {
        runwayVisualRanges = List.copyOf(runwayVisualRanges);
        runwayConditions = List.copyOf(runwayConditions);
        weather = List.copyOf(weather);
        clouds = List.copyOf(clouds);
        trends = List.copyOf(trends);
        trendVisibilities = List.copyOf(trendVisibilities);
        trendWeather = List.copyOf(trendWeather);
        trendClouds = List.copyOf(trendClouds);
        unparsed = List.copyOf(unparsed);
        remarks = remarks == null ? "" : remarks;
        remarkDetails = remarkDetails == null ? RemarkDetails.NONE : remarkDetails;
    }

    public static Builder builder(String raw) {
        return new Builder(raw);
    }

    /**
     * Collects fields while a report is scanned; {@link #build()} freezes them.
     */
    public static final class Builder {
        private final String raw;
        private String reportType;
        private String station;
        private ReportTime time;
        private boolean automated;
        private boolean nil;
        private Wind wind;
        private WindVariability windVariability;
        private Visibility visibility;
        private final List<RunwayVisualRange> runwayVisualRanges = new ArrayList<>();
        private final List<RunwayCondition> runwayConditions = new ArrayList<>();
        private final List<WeatherPhenomenon> weather = new ArrayList<>();
        private final List<CloudLayer> clouds = new ArrayList<>();
        private TemperatureDewpoint temperature;
        private AltimeterSetting altimeter;
        private final List<TrendGroup> trends = new ArrayList<>();
        private final List<Visibility> trendVisibilities = new ArrayList<>();
        private final List<WeatherPhenomenon> trendWeather = new ArrayList<>();
        private final List<CloudLayer> trendClouds = new ArrayList<>();
        private String remarks = "";
        private RemarkDetails remarkDetails = RemarkDetails.NONE;
        private final List<String> unparsed = new ArrayList<>();

        private Builder(String raw) {
            this.raw = raw;
        }

        public Builder reportType(String reportType) {
            this.reportType = reportType;
            return this;
        }

        public Builder station(String station) {
            this.station = station;
            return this;
        }

        public Builder time(ReportTime time) {
            this.time = time;
            return this;
        }

        public Builder automated(boolean automated) {
            this.automated = automated;
            return this;
        }

        public Builder nil(boolean nil) {
            this.nil = nil;
            return this;
        }

        public Builder wind(Wind wind) {
            this.wind = wind;
            return this;
        }

        public Builder windVariability(WindVariability windVariability) {
            this.windVariability = windVariability;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder addRunwayVisualRange(RunwayVisualRange range) {
            runwayVisualRanges.add(range);
            return this;
        }

        public Builder addRunwayCondition(RunwayCondition condition) {
            runwayConditions.add(condition);
            return this;
        }

        public Builder addWeather(WeatherPhenomenon phenomenon) {
            weather.add(phenomenon);
            return this;
        }

        public Builder addCloud(CloudLayer layer) {
            clouds.add(layer);
            return this;
        }

        public Builder temperature(TemperatureDewpoint temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder altimeter(AltimeterSetting altimeter) {
            this.altimeter = altimeter;
            return this;
        }

        public Builder addTrend(TrendGroup trend) {
            trends.add(trend);
            return this;
        }

        public Builder addTrendVisibility(Visibility visibility) {
            trendVisibilities.add(visibility);
            return this;
        }

        public Builder addTrendWeather(WeatherPhenomenon phenomenon) {
            trendWeather.add(phenomenon);
            return this;
        }

        public Builder addTrendCloud(CloudLayer layer) {
            trendClouds.add(layer);
            return this;
        }

        public Builder remarks(String remarks) {
            this.remarks = remarks;
            return this;
        }

        public Builder remarkDetails(RemarkDetails remarkDetails) {
            this.remarkDetails = remarkDetails;
            return this;
        }

        public Builder addUnparsed(String token) {
            unparsed.add(token);
            return this;
        }

        public MetarReport build() {
            return new MetarReport(
                    raw,
                    reportType,
                    station,
                    time,
                    automated,
                    nil,
                    wind,
                    windVariability,
                    visibility,
                    runwayVisualRanges,
                    runwayConditions,
                    weather,
                    clouds,
                    temperature,
                    altimeter,
                    trends,
                    trendVisibilities,
                    trendWeather,
                    trendClouds,
                    remarks,
                    remarkDetails,
                    unparsed
            );
        }
    }
}
