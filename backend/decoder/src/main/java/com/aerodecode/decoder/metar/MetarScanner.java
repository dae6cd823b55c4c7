package com.aerodecode.decoder.metar;

import com.aerodecode.core.model.MetarReport;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.RunwayCondition;
import com.aerodecode.core.model.RunwayVisualRange;
import com.aerodecode.core.model.TemperatureDewpoint;
import com.aerodecode.core.model.TrendGroup;
import com.aerodecode.core.model.Visibility;
import com.aerodecode.core.model.Wind;
import com.aerodecode.core.model.WindVariability;
import com.aerodecode.decoder.api.ReportScanner;
import com.aerodecode.decoder.derive.Derivations;
import com.aerodecode.decoder.field.ForecastFieldParser;
import com.aerodecode.decoder.token.ReportTokenizer;
import com.aerodecode.decoder.token.TokenizedReport;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes METAR and SPECI reports. The header is positional; the body is a first-match-wins loop
 * over {@link #BODY_RULES}. Decoding never fails: groups matching no rule are kept as unparsed.
 */
public class MetarScanner implements ReportScanner<MetarReport> {
    private static final Logger LOGGER = Logger.getLogger(MetarScanner.class.getName());

    private static final Pattern REPORT_TYPE = Pattern.compile("^(METAR|SPECI)$");
    private static final Pattern STATION = Pattern.compile("^[A-Z]{4}$");
    private static final Pattern TIME = Pattern.compile("^(\\d{6})Z$");
    private static final String AUTO = "AUTO";
    private static final String NIL = "NIL";

    static final Pattern RUNWAY_CONDITION = Pattern.compile(
            "^R(?<runway>\\d{2}[LCR]?)/(?<type>\\d|/)(?<extent>\\d|/|NR)(?<depth>\\d{2}|//)(?<friction>\\d{2}|//)$"
    );
    static final Pattern RUNWAY_VISUAL_RANGE = Pattern.compile(
            "^R(?<runway>\\d{2}[LCR]?)/(?<value>[PM]?\\d{3,4}|\\d{5,6}|\\d{2,4}//\\d{2})"
                    + "(?:V(?<max>[PM]?\\d{4}))?(?<tendency>[UDN])?$"
    );
    private static final Pattern TEMPERATURE = Pattern.compile("^(?<temp>M?\\d{1,2})/(?<dew>M?\\d{1,2})$");
    private static final Pattern ALTIMETER = Pattern.compile("^(?<unit>[AQ])(?<value>\\d{4})$");
    private static final Pattern TREND_MARKER = Pattern.compile(
            "^(TEMPO|BECMG|PROB\\d{2}|FM\\d{4}|TL\\d{4}|AT\\d{4}|NOSIG)$"
    );

    private static final Predicate<ScanState> ANY_STATE = state -> true;
    private static final Predicate<ScanState> MAIN_ONLY = state -> !state.trendScoped();
    private static final Predicate<ScanState> TREND_ONLY = ScanState::trendScoped;

    /**
     * Evaluated in order for every body token. Runway condition precedes runway visual range because
     * its shape overlaps; the trend marker precedes the trend-scoped field rules.
     */
    static final List<TokenRule> BODY_RULES = List.of(
            new TokenRule("runway condition", ANY_STATE, MetarScanner::runwayCondition),
            new TokenRule("runway visual range", ANY_STATE, MetarScanner::runwayVisualRange),
            new TokenRule("weather", MAIN_ONLY, (token, scan) -> ForecastFieldParser.weather(token)
                    .map(scan.report::addWeather)
                    .isPresent()),
            new TokenRule("cloud", MAIN_ONLY, (token, scan) -> ForecastFieldParser.cloud(token)
                    .map(scan.report::addCloud)
                    .isPresent()),
            new TokenRule("temperature", ANY_STATE, MetarScanner::temperature),
            new TokenRule("altimeter", ANY_STATE, MetarScanner::altimeter),
            new TokenRule("trend marker", ANY_STATE, MetarScanner::trendMarker),
            new TokenRule("trend visibility", TREND_ONLY, (token, scan) -> ForecastFieldParser.visibility(token)
                    .map(scan.report::addTrendVisibility)
                    .isPresent()),
            new TokenRule("trend weather", TREND_ONLY, (token, scan) -> ForecastFieldParser.weather(token)
                    .map(scan.report::addTrendWeather)
                    .isPresent()),
            new TokenRule("trend cloud", TREND_ONLY, (token, scan) -> ForecastFieldParser.cloud(token)
                    .map(scan.report::addTrendCloud)
                    .isPresent())
    );

    @Override
    public String name() {
        return "metar";
    }

    @Override
    public MetarReport scan(String raw) {
        TokenizedReport tokenized = ReportTokenizer.tokenize(raw);
        List<String> tokens = tokenized.body();
        Scan scan = new Scan(MetarReport.builder(raw));

        int next = scanHeader(tokens, scan);
        if (scan.state == ScanState.NIL) {
            return scan.report.build();
        }
        for (String token : tokens.subList(next, tokens.size())) {
            scanBodyToken(token, scan);
        }

        if (tokenized.hasRemarks()) {
            scan.report.remarks(tokenized.remarks());
            scan.report.remarkDetails(RemarksParser.parse(tokenized.remarkTokens()));
        }
        return scan.report.build();
    }

    private int scanHeader(List<String> tokens, Scan scan) {
        int i = 0;
        if (i < tokens.size() && REPORT_TYPE.matcher(tokens.get(i)).matches()) {
            scan.report.reportType(tokens.get(i));
            i++;
        }
        if (i < tokens.size() && STATION.matcher(tokens.get(i)).matches()) {
            scan.report.station(tokens.get(i));
            i++;
        }
        if (i < tokens.size()) {
            Matcher time = TIME.matcher(tokens.get(i));
            if (time.matches()) {
                scan.report.time(ReportTime.parse(time.group(1)));
                i++;
            }
        }
        if (i < tokens.size() && AUTO.equals(tokens.get(i))) {
            scan.report.automated(true);
            i++;
        }
        if (i < tokens.size() && NIL.equals(tokens.get(i))) {
            scan.report.nil(true);
            scan.state = scan.state.afterHeader(true);
            return tokens.size();
        }
        if (i < tokens.size()) {
            Optional<Wind> wind = ForecastFieldParser.wind(tokens.get(i));
            if (wind.isPresent()) {
                scan.report.wind(wind.get());
                i++;
            }
        }
        if (i < tokens.size()) {
            Optional<WindVariability> variability = ForecastFieldParser.windVariability(tokens.get(i));
            if (variability.isPresent()) {
                scan.report.windVariability(variability.get());
                i++;
            }
        }
        Optional<Visibility> visibility = Optional.empty();
        if (i + 1 < tokens.size()) {
            visibility = ForecastFieldParser.visibility(tokens.get(i), tokens.get(i + 1));
            if (visibility.isPresent()) {
                i += 2;
            }
        }
        if (visibility.isEmpty() && i < tokens.size()) {
            visibility = ForecastFieldParser.visibility(tokens.get(i));
            if (visibility.isPresent()) {
                i++;
            }
        }
        visibility.ifPresent(scan.report::visibility);
        scan.state = scan.state.afterHeader(false);
        return i;
    }

    private void scanBodyToken(String token, Scan scan) {
        for (TokenRule rule : BODY_RULES) {
            if (rule.applies().test(scan.state) && rule.handler().handle(token, scan)) {
                return;
            }
        }
        LOGGER.log(Level.FINE, "Unrecognized METAR group {0}", token);
        scan.report.addUnparsed(token);
    }

    private static boolean runwayCondition(String token, Scan scan) {
        Matcher m = RUNWAY_CONDITION.matcher(token);
        if (!m.matches()) {
            return false;
        }
        scan.report.addRunwayCondition(new RunwayCondition(
                m.group("runway"),
                m.group("type"),
                m.group("extent"),
                m.group("depth"),
                m.group("friction")
        ));
        return true;
    }

    private static boolean runwayVisualRange(String token, Scan scan) {
        Matcher m = RUNWAY_VISUAL_RANGE.matcher(token);
        if (!m.matches()) {
            return false;
        }
        scan.report.addRunwayVisualRange(new RunwayVisualRange(
                m.group("runway"),
                m.group("value"),
                m.group("max"),
                m.group("tendency")
        ));
        return true;
    }

    private static boolean temperature(String token, Scan scan) {
        Matcher m = TEMPERATURE.matcher(token);
        if (!m.matches()) {
            return false;
        }
        int temperature = signedDegrees(m.group("temp"));
        int dewpoint = signedDegrees(m.group("dew"));
        scan.report.temperature(new TemperatureDewpoint(
                temperature,
                dewpoint,
                Derivations.relativeHumidity(temperature, dewpoint).orElse(null)
        ));
        return true;
    }

    private static boolean altimeter(String token, Scan scan) {
        Matcher m = ALTIMETER.matcher(token);
        if (!m.matches()) {
            return false;
        }
        int value = Integer.parseInt(m.group("value"));
        scan.report.altimeter("A".equals(m.group("unit"))
                ? Derivations.fromInchesOfMercury(value)
                : Derivations.fromHectopascals(value));
        return true;
    }

    private static boolean trendMarker(String token, Scan scan) {
        if (!TREND_MARKER.matcher(token).matches()) {
            return false;
        }
        scan.report.addTrend(new TrendGroup(token));
        scan.state = scan.state.afterTrendMarker();
        return true;
    }

    private static int signedDegrees(String value) {
        if (value.startsWith("M")) {
            return -Integer.parseInt(value.substring(1));
        }
        return Integer.parseInt(value);
    }

    @FunctionalInterface
    interface TokenHandler {
        boolean handle(String token, Scan scan);
    }

    record TokenRule(String name, Predicate<ScanState> applies, TokenHandler handler) {
    }

    static final class Scan {
        private final MetarReport.Builder report;
        private ScanState state = ScanState.HEADER;

        private Scan(MetarReport.Builder report) {
            this.report = report;
        }
    }
}
