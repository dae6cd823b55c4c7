package com.aerodecode.decoder.taf;

import com.aerodecode.core.model.ChangeGroup;
import com.aerodecode.core.model.DayHour;
import com.aerodecode.core.model.ForecastBody;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.TafForecast;
import com.aerodecode.core.model.TemperatureExtremes;
import com.aerodecode.core.model.ValidityPeriod;
import com.aerodecode.decoder.api.ReportScanner;
import com.aerodecode.decoder.field.ForecastFieldParser;
import com.aerodecode.decoder.token.ReportTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes TAF forecasts. A header that does not match is the only failure; it yields
 * {@link TafForecast#structuralError(String, String)}.
 */
public class TafScanner implements ReportScanner<TafForecast> {
    private static final Logger LOGGER = Logger.getLogger(TafScanner.class.getName());

    public static final String HEADER_ERROR = "Неверный формат TAF";

    private static final Pattern HEADER = Pattern.compile(
            "^(?:TAF )?(?:(?<flag>AMD|COR) )?(?<station>[A-Z]{4}) (?<issued>\\d{6})Z (?<from>\\d{4})/(?<to>\\d{4})(?= |$)"
    );
    private static final Pattern TEMPERATURES = Pattern.compile(
            "TX(?<max>M?\\d{2})/(?<maxAt>\\d{4})Z TN(?<min>M?\\d{2})/(?<minAt>\\d{4})Z"
    );

    @Override
    public String name() {
        return "taf";
    }

    @Override
    public TafForecast scan(String raw) {
        String text = ReportTokenizer.normalize(raw);
        Matcher header = HEADER.matcher(text);
        if (!header.lookingAt()) {
            LOGGER.log(Level.WARNING, "TAF header not recognized, {0} characters rejected", text.length());
            return TafForecast.structuralError(raw, HEADER_ERROR);
        }

        String flag = header.group("flag");
        ValidityPeriod validity = new ValidityPeriod(
                DayHour.parse(header.group("from")),
                DayHour.parse(header.group("to"))
        );

        List<String> body = ReportTokenizer.words(text.substring(header.end()));
        ChangeGroupSegmenter.Segments segments = ChangeGroupSegmenter.segment(body);

        // the TX/TN pair is searched over the whole report, independent of group boundaries
        Matcher extremesMatch = TEMPERATURES.matcher(text);
        TemperatureExtremes extremes = null;
        List<String> consumed = new ArrayList<>();
        if (extremesMatch.find()) {
            extremes = extremes(extremesMatch);
            consumed.addAll(ReportTokenizer.words(extremesMatch.group()));
        }

        ForecastBody base = forecastBody(segments.base(), consumed);
        List<ChangeGroup> groups = new ArrayList<>();
        for (ChangeGroupSegmenter.Segment segment : segments.groups()) {
            groups.add(new ChangeGroup(
                    segment.type(),
                    segment.period(),
                    segment.from(),
                    forecastBody(segment.tokens(), consumed)
            ));
        }

        return new TafForecast(
                raw,
                null,
                header.group("station"),
                ReportTime.parse(header.group("issued")),
                validity,
                "AMD".equals(flag),
                "COR".equals(flag),
                base,
                groups,
                extremes
        );
    }

    /**
     * Tokens of the matched TX/TN pair are removed once each; any other temperature token stays unparsed.
     */
    private static ForecastBody forecastBody(List<String> tokens, List<String> consumed) {
        List<String> fields = new ArrayList<>();
        for (String token : tokens) {
            if (!consumed.remove(token)) {
                fields.add(token);
            }
        }
        ForecastBody body = ForecastFieldParser.body(fields);
        if (!body.unparsed().isEmpty()) {
            LOGGER.log(Level.FINE, "Unrecognized TAF groups {0}", body.unparsed());
        }
        return body;
    }

    private static TemperatureExtremes extremes(Matcher m) {
        return new TemperatureExtremes(
                signedDegrees(m.group("max")),
                DayHour.parse(m.group("maxAt")),
                signedDegrees(m.group("min")),
                DayHour.parse(m.group("minAt"))
        );
    }

    private static int signedDegrees(String value) {
        if (value.startsWith("M")) {
            return -Integer.parseInt(value.substring(1));
        }
        return Integer.parseInt(value);
    }
}
