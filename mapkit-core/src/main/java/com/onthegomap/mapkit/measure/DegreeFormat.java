package com.onthegomap.mapkit.measure;

import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Locale-aware formatting and parsing of angles in decimal degrees or degrees/minutes/seconds.
 * <p>
 * Accepted input forms, where numbers use the decimal separator of the locale:
 * <ul>
 * <li>a {@link ReferenceLatitude} name like {@code "TropicOfCancer"}</li>
 * <li>decimal degrees with an optional degree sign: {@code "45.5"}, {@code "-12,25°"}</li>
 * <li>degrees, minutes, seconds: {@code "12°30'36\""} or {@code "12 30 36"}</li>
 * <li>for latitudes only, a leading or trailing hemisphere letter: {@code "23.5°N"}, {@code "S 12"}</li>
 * </ul>
 */
public class DegreeFormat {

  public static final char DEGREE_SIGN = '°';
  public static final String ZERO_TEXT = "0" + DEGREE_SIGN;

  private static final ConcurrentMap<Locale, DegreeFormat> instances = new ConcurrentHashMap<>();
  private static final Pattern COMPONENT_SEPARATORS = Pattern.compile("[°º'\"′″\\s]+");
  // bidi marks that some locales put around the minus sign
  private static final Pattern FORMAT_CHARACTERS = Pattern.compile("\\p{Cf}+");
  private static final int MAX_FRACTION_DIGITS = 4;
  // magnitudes below this round to zero
  private static final double ROUNDS_TO_ZERO = 0.5 / Math.pow(10, MAX_FRACTION_DIGITS);

  // NumberFormat instances are not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> formatter;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> parser;
  private final char minusSign;

  private DegreeFormat(Locale locale) {
    minusSign = DecimalFormatSymbols.getInstance(locale).getMinusSign();
    formatter = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(MAX_FRACTION_DIGITS);
      f.setGroupingUsed(false);
      return f;
    });
    parser = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setGroupingUsed(false);
      return f;
    });
  }

  public static DegreeFormat forLocale(Locale locale) {
    return instances.computeIfAbsent(locale == null ? defaultLocale() : locale, DegreeFormat::new);
  }

  /** Returns the locale used when callers do not supply one. */
  public static Locale defaultLocale() {
    return Locale.getDefault(Locale.Category.FORMAT);
  }

  /** Returns {@code degrees} with up to 4 decimals followed by a degree sign, like {@code "45.5°"}. */
  public String format(double degrees) {
    return number(degrees) + DEGREE_SIGN;
  }

  /** Returns the absolute value of {@code degrees} followed by {@code N} or {@code S}, or {@code "0°"} at the equator. */
  public String formatLatitude(double degrees) {
    if (Math.abs(degrees) < ROUNDS_TO_ZERO) {
      return ZERO_TEXT;
    }
    return format(Math.abs(degrees)) + (degrees > 0 ? 'N' : 'S');
  }

  /** Returns {@code degrees} like {@code 12°30'36"} with seconds rounded to 4 decimals. */
  public String formatDms(double degrees) {
    double abs = Math.abs(degrees);
    long totalMicroSeconds = Math.round(abs * 3600 * 10_000);
    long wholeDegrees = totalMicroSeconds / (3600 * 10_000L);
    long remainder = totalMicroSeconds - wholeDegrees * 3600 * 10_000L;
    long minutes = remainder / (60 * 10_000L);
    double seconds = (remainder - minutes * 60 * 10_000L) / 10_000d;
    String sign = degrees < 0 && totalMicroSeconds > 0 ? "-" : "";
    return sign + wholeDegrees + DEGREE_SIGN + minutes + "'" + number(seconds) + "\"";
  }

  private String number(double value) {
    // avoid rendering "-0" for negative values that round to zero
    return formatter.get().format(Math.abs(value) < ROUNDS_TO_ZERO ? 0d : value);
  }

  /** Parses an angle in decimal degrees or degrees/minutes/seconds. */
  public double parse(String text) {
    return parse(text, false);
  }

  /** Parses an angle that may also carry a hemisphere letter, where {@code S} makes the result negative. */
  public double parseLatitude(String text) {
    return parse(text, true);
  }

  private double parse(String text, boolean allowHemisphere) {
    String remaining = text == null ? "" : FORMAT_CHARACTERS.matcher(text).replaceAll("").strip();
    if (StringUtils.isBlank(remaining)) {
      throw new ValueFormatException(text, "Empty angle");
    }
    var preset = ReferenceLatitude.fromName(remaining);
    if (preset.isPresent()) {
      return preset.get().degrees();
    }

    boolean negative = false;
    if (allowHemisphere) {
      char first = Character.toUpperCase(remaining.charAt(0));
      char last = Character.toUpperCase(remaining.charAt(remaining.length() - 1));
      if (last == 'N' || last == 'S') {
        negative = last == 'S';
        remaining = remaining.substring(0, remaining.length() - 1).strip();
      } else if (first == 'N' || first == 'S') {
        negative = first == 'S';
        remaining = remaining.substring(1).strip();
      }
    }
    if (remaining.isEmpty()) {
      throw new ValueFormatException(text, "Missing angle");
    } else if (isMinusSign(remaining.charAt(0))) {
      negative = !negative;
      remaining = remaining.substring(1).strip();
    } else if (remaining.startsWith("+")) {
      remaining = remaining.substring(1).strip();
    }

    List<String> parts = new ArrayList<>(3);
    for (String part : COMPONENT_SEPARATORS.split(remaining)) {
      if (!part.isEmpty()) {
        parts.add(part);
      }
    }
    if (parts.isEmpty() || parts.size() > 3) {
      throw new ValueFormatException(text, "Expected 1 to 3 angle components");
    }

    double degrees = parseComponent(text, parts.get(0));
    double minutes = parts.size() > 1 ? parseComponent(text, parts.get(1)) : 0;
    double seconds = parts.size() > 2 ? parseComponent(text, parts.get(2)) : 0;
    if (degrees < 0 || minutes < 0 || minutes >= 60 || seconds < 0 || seconds >= 60) {
      throw new ValueFormatException(text, "Angle component out of range");
    }
    double result = degrees + minutes / 60d + seconds / 3600d;
    return negative ? -result : result;
  }

  private boolean isMinusSign(char c) {
    return c == '-' || c == '\u2212' || c == minusSign;
  }

  private double parseComponent(String text, String component) {
    ParsePosition position = new ParsePosition(0);
    Number number = parser.get().parse(component, position);
    if (number == null || position.getIndex() != component.length()) {
      throw new ValueFormatException(text, "Invalid number '" + component + "'");
    }
    return number.doubleValue();
  }
}
