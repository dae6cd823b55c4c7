package com.aerodecode.decoder.field;

import com.aerodecode.core.model.CloudLayer;
import com.aerodecode.core.model.ForecastBody;
import com.aerodecode.core.model.Visibility;
import com.aerodecode.core.model.WeatherPhenomenon;
import com.aerodecode.core.model.Wind;
import com.aerodecode.core.model.WindVariability;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sub-grammar shared by the METAR and TAF scanners: one token in, at most one typed field out.
 */
public final class ForecastFieldParser {
    /**
     * Cloud heights are coded in hundreds of feet; both report types scale them to meters with this factor.
     */
    public static final int CLOUD_HEIGHT_METERS = 30;

    public static final String CAVOK = "CAVOK";

    private static final Pattern WIND = Pattern.compile(
            "^(?<dir>\\d{3}|VRB)(?<speed>\\d{2,3})(?:G(?<gust>\\d{2,3}))?(?<unit>KT|MPS|KMH)?$"
    );
    private static final Pattern WIND_VARIABILITY = Pattern.compile("^(?<from>\\d{3})V(?<to>\\d{3})$");
    private static final Pattern VISIBILITY_METERS = Pattern.compile("^\\d{4}$");
    private static final Pattern VISIBILITY_MILES = Pattern.compile(
            "^(?:(?<whole>\\d{1,2})|(?<num>\\d)/(?<den>\\d{1,2}))SM$"
    );
    private static final Pattern WHOLE_MILES = Pattern.compile("^\\d$");
    private static final Pattern FRACTION_MILES = Pattern.compile("^(?<num>\\d)/(?<den>\\d{1,2})SM$");
    private static final Pattern WEATHER = Pattern.compile(
            "^(?<intensity>[-+])?"
                    + "(?<descriptor>(?:MI|PR|BC|DR|BL|SH|TS|FZ|VC){1,2})?"
                    + "(?<phenomena>(?:DZ|RA|SN|SG|IC|PL|GR|GS|UP|BR|FG|FU|VA|DU|SA|HZ|PY|SQ|FC|SS|DS)+)$"
    );
    private static final Pattern CLOUD = Pattern.compile(
            "^(?<cover>SKC|CLR|NSC|NCD|FEW|SCT|BKN|OVC|VV)(?<height>\\d{3}|///)?(?<convective>CB|TCU)?$"
    );

    private ForecastFieldParser() {
    }

    public static Optional<Wind> wind(String token) {
        Matcher m = WIND.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Wind(
                m.group("dir"),
                Integer.parseInt(m.group("speed")),
                m.group("gust") == null ? null : Integer.parseInt(m.group("gust")),
                m.group("unit")
        ));
    }

    public static Optional<WindVariability> windVariability(String token) {
        Matcher m = WIND_VARIABILITY.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new WindVariability(Integer.parseInt(m.group("from")), Integer.parseInt(m.group("to"))));
    }

    /**
     * CAVOK, four-digit meters, or a single-token statute-mile form.
     */
    public static Optional<Visibility> visibility(String token) {
        if (CAVOK.equals(token)) {
            return Optional.of(Visibility.cavokVisibility());
        }
        if (VISIBILITY_METERS.matcher(token).matches()) {
            return Optional.of(Visibility.ofMeters(Integer.parseInt(token)));
        }
        Matcher m = VISIBILITY_MILES.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        if (m.group("whole") != null) {
            return Optional.of(Visibility.ofMiles(Integer.parseInt(m.group("whole"))));
        }
        return fraction(m).map(Visibility::ofMiles);
    }

    /**
     * Two-token statute-mile form such as {@code 1 1/2SM}.
     */
    public static Optional<Visibility> visibility(String wholeToken, String fractionToken) {
        if (!WHOLE_MILES.matcher(wholeToken).matches()) {
            return Optional.empty();
        }
        Matcher m = FRACTION_MILES.matcher(fractionToken);
        if (!m.matches()) {
            return Optional.empty();
        }
        int whole = Integer.parseInt(wholeToken);
        return fraction(m).map(fraction -> Visibility.ofMiles(whole + fraction));
    }

    public static Optional<WeatherPhenomenon> weather(String token) {
        Matcher m = WEATHER.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new WeatherPhenomenon(m.group("intensity"), m.group("descriptor"), m.group("phenomena")));
    }

    public static Optional<CloudLayer> cloud(String token) {
        Matcher m = CLOUD.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        String height = m.group("height");
        Integer meters = height == null || height.startsWith("/")
                ? null
                : Integer.parseInt(height) * CLOUD_HEIGHT_METERS;
        return Optional.of(new CloudLayer(m.group("cover"), height, meters, m.group("convective")));
    }

    /**
     * Parses one forecast field group. The first wind and visibility groups are kept; repeated ones
     * and tokens matching no field are kept as unparsed.
     */
    public static ForecastBody body(List<String> tokens) {
        Wind wind = null;
        Visibility visibility = null;
        List<WeatherPhenomenon> weather = new ArrayList<>();
        List<CloudLayer> clouds = new ArrayList<>();
        List<String> unparsed = new ArrayList<>();

        for (String token : tokens) {
            Optional<Wind> parsedWind = wind(token);
            if (parsedWind.isPresent() && wind == null) {
                wind = parsedWind.get();
                continue;
            }
            Optional<Visibility> parsedVisibility = visibility(token);
            if (parsedVisibility.isPresent() && visibility == null) {
                visibility = parsedVisibility.get();
                continue;
            }
            if (parsedWind.isPresent() || parsedVisibility.isPresent()) {
                unparsed.add(token);
                continue;
            }
            Optional<WeatherPhenomenon> parsedWeather = weather(token);
            if (parsedWeather.isPresent()) {
                weather.add(parsedWeather.get());
                continue;
            }
            Optional<CloudLayer> parsedCloud = cloud(token);
            if (parsedCloud.isPresent()) {
                clouds.add(parsedCloud.get());
                continue;
            }
            unparsed.add(token);
        }
        return new ForecastBody(wind, visibility, weather, clouds, unparsed);
    }

    private static Optional<Double> fraction(Matcher m) {
        int denominator = Integer.parseInt(m.group("den"));
        if (denominator == 0) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(m.group("num")) / (double) denominator);
    }
}
