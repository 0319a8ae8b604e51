package com.stopengine.text;

import java.util.Locale;

/**
 * 土耳其语大小写归一化，处理带点/不带点 I 与扬抑符元音。
 */
public final class TurkishCaseNormalizer {

    private static final String[][] LOWER_MAPPINGS = {
        {"I", "ı"}, {"İ", "i"}, {"Â", "â"}, {"Î", "î"}, {"Û", "û"}
    };

    private static final String[][] UPPER_MAPPINGS = {
        {"i", "İ"}, {"ı", "I"}, {"â", "Â"}, {"î", "Î"}, {"û", "Û"}
    };

    private TurkishCaseNormalizer() {
    }

    /**
     * 转为小写：I→ı、İ→i，其余字符按 ROOT 规则小写。
     */
    public static String lower(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return applyMappings(text, LOWER_MAPPINGS).toLowerCase(Locale.ROOT);
    }

    /**
     * 转为大写：i→İ、ı→I，其余字符按 ROOT 规则大写。
     */
    public static String upper(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return applyMappings(text, UPPER_MAPPINGS).toUpperCase(Locale.ROOT);
    }

    public static String normalize(String text, CaseMode mode) {
        return switch (mode) {
            case LOWER -> lower(text);
            case UPPER -> upper(text);
            case NONE -> text;
        };
    }

    private static String applyMappings(String text, String[][] mappings) {
        String adjusted = text;
        for (String[] mapping : mappings) {
            adjusted = adjusted.replace(mapping[0], mapping[1]);
        }
        return adjusted;
    }
}
