package com.aerodecode.decoder.phenomenon;

import com.aerodecode.core.model.WeatherPhenomenon;

import java.util.ArrayList;
import java.util.List;

import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.CONNECTOR;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.CONNECTORS;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.DESCRIPTORS;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.INSTRUMENTAL;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.PHRASES;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.SHOWER;
import static com.aerodecode.decoder.phenomenon.PhenomenonVocabulary.THUNDERSTORM;

/**
 * Renders a weather group as a Russian phrase. Stages run in a fixed order: compound lookup,
 * decomposition, descriptor phrasing, then intensity.
 */
public final class WeatherPhenomenonTranslator {
    private WeatherPhenomenonTranslator() {
    }

    public static String translate(WeatherPhenomenon weather) {
        List<String> descriptors = codes(weather.descriptor());
        String phenomena = weather.phenomena();

        String base;
        boolean showerInPhrase = false;
        if (descriptors.contains(SHOWER) && PHRASES.containsKey(SHOWER + phenomena)) {
            base = PHRASES.get(SHOWER + phenomena);
            showerInPhrase = true;
        } else if (PHRASES.containsKey(phenomena)) {
            base = PHRASES.get(phenomena);
        } else {
            base = decompose(phenomena);
        }

        List<String> remaining = new ArrayList<>(descriptors);
        if (showerInPhrase) {
            remaining.remove(SHOWER);
        }

        if (remaining.remove(THUNDERSTORM)) {
            String storm = "гроза " + CONNECTOR + " " + instrumental(base);
            return join(describe(remaining), join(intensity(weather.intensity(), true), storm));
        }
        return join(intensity(weather.intensity(), false), join(describe(remaining), base));
    }

    /**
     * Translates each two-letter code and joins them with the connector; every term after the first is inflected.
     */
    static String decompose(String phenomena) {
        List<String> parts = new ArrayList<>();
        for (String code : codes(phenomena)) {
            String word = PHRASES.getOrDefault(code, code);
            parts.add(parts.isEmpty() ? word : instrumental(word));
        }
        return parts.isEmpty() ? phenomena : String.join(" " + CONNECTOR + " ", parts);
    }

    /**
     * Inflects the whole phrase when known, otherwise every word up to the first connector.
     */
    static String instrumental(String phrase) {
        String whole = INSTRUMENTAL.get(phrase);
        if (whole != null) {
            return whole;
        }
        List<String> words = new ArrayList<>();
        boolean head = true;
        for (String word : phrase.split(" ")) {
            if (CONNECTORS.contains(word)) {
                head = false;
            }
            words.add(head ? INSTRUMENTAL.getOrDefault(word, word) : word);
        }
        return String.join(" ", words);
    }

    private static String describe(List<String> descriptors) {
        List<String> words = new ArrayList<>();
        for (String descriptor : descriptors) {
            words.add(DESCRIPTORS.getOrDefault(descriptor, descriptor));
        }
        return String.join(" ", words);
    }

    private static String intensity(String sign, boolean feminine) {
        if ("+".equals(sign)) {
            return feminine ? "сильная" : "сильный";
        }
        if ("-".equals(sign)) {
            return feminine ? "слабая" : "слабый";
        }
        return "";
    }

    private static List<String> codes(String value) {
        List<String> codes = new ArrayList<>();
        if (value == null) {
            return codes;
        }
        for (int i = 0; i + 2 <= value.length(); i += 2) {
            codes.add(value.substring(i, i + 2));
        }
        return codes;
    }

    private static String join(String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        return first + " " + second;
    }
}
