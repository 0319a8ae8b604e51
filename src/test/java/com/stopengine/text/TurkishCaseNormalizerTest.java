package com.stopengine.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TurkishCaseNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "İSTANBUL, istanbul",
        "IRMAK, ırmak",
        "Işık, ışık",
        "KÂĞIT, kâğıt",
        "Servis, servis",
        "ÇÜNKÜ, çünkü"
    })
    @DisplayName("lower: 带点/不带点 I 与扬抑符")
    void testLower(String input, String expected) {
        assertEquals(expected, TurkishCaseNormalizer.lower(input));
    }

    @ParameterizedTest
    @CsvSource({
        "istanbul, İSTANBUL",
        "ırmak, IRMAK",
        "kâğıt, KÂĞIT"
    })
    @DisplayName("upper: i→İ, ı→I")
    void testUpper(String input, String expected) {
        assertEquals(expected, TurkishCaseNormalizer.upper(input));
    }

    @Test
    @DisplayName("normalize: NONE 原样返回，空值透传")
    void testNormalizeModesAndEdgeCases() {
        assertEquals("Işık", TurkishCaseNormalizer.normalize("Işık", CaseMode.NONE));
        assertEquals("ışık", TurkishCaseNormalizer.normalize("Işık", CaseMode.LOWER));
        assertEquals("IŞIK", TurkishCaseNormalizer.normalize("ışık", CaseMode.UPPER));
        assertNull(TurkishCaseNormalizer.lower(null));
        assertEquals("", TurkishCaseNormalizer.upper(""));
    }
}
