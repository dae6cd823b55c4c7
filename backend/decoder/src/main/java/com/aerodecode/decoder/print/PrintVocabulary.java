package com.aerodecode.decoder.print;

import com.aerodecode.core.model.ChangeGroupType;

import java.util.EnumMap;
import java.util.Map;

final class PrintVocabulary {
    static final Map<String, String> CLOUD_COVER = Map.of(
            "SKC", "ясно",
            "CLR", "ясно (авто)",
            "NSC", "нет значимой облачности",
            "NCD", "облачность не обнаружена",
            "FEW", "малооблачно (1-3 балла)",
            "SCT", "рассеянные облака (3-6 баллов)",
            "BKN", "разорванные облака (6-9 баллов)",
            "OVC", "сплошная облачность (10 баллов)",
            "VV", "вертикальная видимость"
    );

    static final Map<String, String> CONVECTIVE_CLOUD = Map.of(
            "CB", "кучево-дождевые",
            "TCU", "мощно-кучевые"
    );

    static final Map<String, String> WIND_UNIT = Map.of(
            "KT", "узлы",
            "MPS", "м/с",
            "KMH", "км/ч"
    );

    static final Map<String, String> RUNWAY_CONTAMINATION = Map.ofEntries(
            Map.entry("0", "чистая и сухая"),
            Map.entry("1", "влажная"),
            Map.entry("2", "мокрая или лужи"),
            Map.entry("3", "изморозь или иней"),
            Map.entry("4", "сухой снег"),
            Map.entry("5", "мокрый снег"),
            Map.entry("6", "слякоть"),
            Map.entry("7", "лёд"),
            Map.entry("8", "уплотнённый или укатанный снег"),
            Map.entry("9", "замёрзшие колеи или гребни"),
            Map.entry("/", "тип не определён")
    );

    static final Map<String, String> RUNWAY_EXTENT = Map.of(
            "1", "10% или менее",
            "2", "11-25%",
            "5", "26-50%",
            "9", "51-100%",
            "/", "не определена",
            "NR", "не сообщается"
    );

    static final Map<String, String> RVR_TENDENCY = Map.of(
            "U", "увеличивается",
            "D", "уменьшается",
            "N", "без изменений"
    );

    static final Map<String, String> TREND_MARKER = Map.of(
            "BECMG", "Ожидается изменение условий",
            "TEMPO", "Временные изменения",
            "PROB30", "Вероятность 30%",
            "PROB40", "Вероятность 40%",
            "NOSIG", "Прогноз без изменений"
    );

    static final Map<String, String> TREND_TIME_PREFIX = Map.of(
            "FM", "с",
            "TL", "до",
            "AT", "в"
    );

    static final Map<ChangeGroupType, String> CHANGE_GROUP_TITLE = new EnumMap<>(Map.of(
            ChangeGroupType.BECMG, "Постепенное изменение (BECMG)",
            ChangeGroupType.TEMPO, "Временные изменения (TEMPO)",
            ChangeGroupType.FM, "С определённого времени (FM)",
            ChangeGroupType.PROB30, "Вероятность 30% (PROB30)",
            ChangeGroupType.PROB40, "Вероятность 40% (PROB40)",
            ChangeGroupType.PROB30_TEMPO, "Вероятность 30% (PROB30 TEMPO)",
            ChangeGroupType.PROB40_TEMPO, "Вероятность 40% (PROB40 TEMPO)"
    ));

    private PrintVocabulary() {
    }
}
