package com.onthegomap.mapkit.measure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class DegreeFormatTest {

  @ParameterizedTest
  @CsvSource(value = {
    "45.5, 45.5, en",
    "45.5°, 45.5, en",
    "' 45.5 ° ', 45.5, en",
    "-45.5, -45.5, en",
    "+45.5, 45.5, en",
    "'45,5', 45.5, de",
    "'45,5°', 45.5, de",
    "'-12,25', -12.25, de",
    "90, 90, en",
    "0, 0, en",
    "12 30 36, 12.51, en",
    "-12 30, -12.5, en",
  })
  void testParse(String input, double expected, Locale locale) {
    assertEquals(expected, DegreeFormat.forLocale(locale).parse(input), 1e-9);
  }

  @Test
  void testParseDegreesMinutesSeconds() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertEquals(12.51, format.parse("12°30'36\""), 1e-9);
    assertEquals(12.5, format.parse("12°30'"), 1e-9);
    assertEquals(-12.5, format.parse("-12° 30′"), 1e-9);
    assertEquals(12.5101388889, DegreeFormat.forLocale(Locale.FRANCE).parse("12°30'36,5\""), 1e-9);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "",
    "   ",
    "abc",
    "45.5x",
    "1,5",
    "12 60",
    "12 30 60",
    "12 -30",
    "1 2 3 4",
    "-",
    "45..5",
  })
  void testParseInvalid(String input) {
    var exception = assertThrows(ValueFormatException.class, () -> DegreeFormat.forLocale(Locale.US).parse(input));
    assertEquals(input, exception.input());
  }

  @Test
  void testParseNull() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertThrows(ValueFormatException.class, () -> format.parse(null));
  }

  @ParameterizedTest
  @EnumSource(ReferenceLatitude.class)
  void testParsePresetNames(ReferenceLatitude preset) {
    var format = DegreeFormat.forLocale(Locale.US);
    assertEquals(preset.degrees(), format.parse(preset.displayName()));
    assertEquals(preset.degrees(), format.parse(preset.name()));
    assertEquals(preset.degrees(), format.parse(preset.displayName().toUpperCase(Locale.ROOT)));
  }

  @ParameterizedTest
  @CsvSource(value = {
    "23.5°N, 23.5",
    "23.5°S, -23.5",
    "23.5 s, -23.5",
    "N 12, 12",
    "-12, -12",
    "SouthPole, -90",
    "north pole, 90",
  })
  void testParseLatitude(String input, double expected) {
    assertEquals(expected, DegreeFormat.forLocale(Locale.US).parseLatitude(input), 1e-9);
  }

  @ParameterizedTest
  @ValueSource(strings = {"N", "S", "23.5°X", "NS 12"})
  void testParseLatitudeInvalid(String input) {
    var format = DegreeFormat.forLocale(Locale.US);
    assertThrows(ValueFormatException.class, () -> format.parseLatitude(input));
  }

  @Test
  void testHemisphereLetterOnlyAllowedForLatitude() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertThrows(ValueFormatException.class, () -> format.parse("23.5°N"));
  }

  @ParameterizedTest
  @CsvSource(value = {
    "0, 0°, en",
    "-0.0, 0°, en",
    "45.5, 45.5°, en",
    "45.5, '45,5°', de",
    "1234.5, 1234.5°, en",
    "0.123456, 0.1235°, en",
    "-90, -90°, en",
    "-0.00001, 0°, en",
    "0.00004, 0°, en",
    "-0.00006, -0.0001°, en",
  })
  void testFormat(double degrees, String expected, Locale locale) {
    assertEquals(expected, DegreeFormat.forLocale(locale).format(degrees));
  }

  @ParameterizedTest
  @CsvSource(value = {
    "0, 0°",
    "23.5, 23.5°N",
    "-12, 12°S",
    "90, 90°N",
    "-0.00001, 0°",
  })
  void testFormatLatitude(double degrees, String expected) {
    assertEquals(expected, DegreeFormat.forLocale(Locale.US).formatLatitude(degrees));
  }

  @Test
  void testParseIgnoresBidiMarks() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertEquals(-45.5, format.parse("\u200E-45.5°"), 1e-9);
    assertEquals(-45.5, format.parse("\u061C-45.5\u200F°"), 1e-9);
    assertEquals(-12, format.parseLatitude("\u200E12°S"), 1e-9);
    assertThrows(ValueFormatException.class, () -> format.parse("\u200E\u200F"));
  }

  @Test
  void testFormatDms() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertEquals("12°30'36\"", format.formatDms(12.51));
    assertEquals("-45°30'0\"", format.formatDms(-45.5));
    assertEquals("0°0'0\"", format.formatDms(0));
    assertEquals("10°0'0.5\"", format.formatDms(10.000138889));
    assertEquals(-12.5, format.parseLatitude("S 12°30'"), 1e-9);
  }

  @Test
  void testDmsTextParsesBack() {
    var format = DegreeFormat.forLocale(Locale.US);
    assertEquals(-33.8568, format.parse(format.formatDms(-33.8568)), 1e-6);
  }

  @Test
  void testInstancesAreCachedPerLocale() {
    assertSame(DegreeFormat.forLocale(Locale.GERMANY), DegreeFormat.forLocale(Locale.GERMANY));
    assertSame(DegreeFormat.forLocale(DegreeFormat.defaultLocale()), DegreeFormat.forLocale(null));
  }
}
