package com.aerodecode.decoder.taf;

import com.aerodecode.core.model.ChangeGroupType;
import com.aerodecode.core.model.DayHour;
import com.aerodecode.core.model.ReportTime;
import com.aerodecode.core.model.ValidityPeriod;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits TAF body tokens into the base forecast and its change groups, in encounter order.
 */
public final class ChangeGroupSegmenter {
    private static final Pattern MARKER = Pattern.compile("^(?:(?<label>BECMG|TEMPO|PROB30|PROB40)|FM(?<from>\\d{6}))$");
    private static final Pattern PERIOD = Pattern.compile("^(\\d{4})/(\\d{4})$");

    private ChangeGroupSegmenter() {
    }

    public static Segments segment(List<String> tokens) {
        int i = 0;
        while (i < tokens.size() && !isMarker(tokens.get(i))) {
            i++;
        }
        List<String> base = tokens.subList(0, i);

        List<Segment> groups = new ArrayList<>();
        while (i < tokens.size()) {
            Matcher marker = MARKER.matcher(tokens.get(i));
            if (!marker.matches()) {
                throw new IllegalStateException("Expected change group marker at " + tokens.get(i));
            }
            i++;

            ChangeGroupType type;
            ReportTime from = null;
            ValidityPeriod period = null;
            if (marker.group("from") != null) {
                type = ChangeGroupType.FM;
                from = ReportTime.parse(marker.group("from"));
            } else {
                type = ChangeGroupType.fromLabel(marker.group("label")).orElseThrow();
                if (type.probability() && i < tokens.size() && ChangeGroupType.TEMPO.label().equals(tokens.get(i))) {
                    type = type.withTempo();
                    i++;
                }
                Optional<ValidityPeriod> explicit = i < tokens.size() ? period(tokens.get(i)) : Optional.empty();
                if (explicit.isPresent()) {
                    period = explicit.get();
                    i++;
                }
            }

            int start = i;
            while (i < tokens.size() && !isMarker(tokens.get(i))) {
                i++;
            }
            groups.add(new Segment(type, period, from, tokens.subList(start, i)));
        }
        return new Segments(base, groups);
    }

    public static boolean isMarker(String token) {
        return MARKER.matcher(token).matches();
    }

    static Optional<ValidityPeriod> period(String token) {
        Matcher m = PERIOD.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ValidityPeriod(DayHour.parse(m.group(1)), DayHour.parse(m.group(2))));
    }

    public record Segment(ChangeGroupType type, ValidityPeriod period, ReportTime from, List<String> tokens) {
        public Segment {
            tokens = List.copyOf(tokens);
        }
    }

    public record Segments(List<String> base, List<Segment> groups) {
        public Segments {
            base = List.copyOf(base);
            groups = List.copyOf(groups);
        }
    }
}
