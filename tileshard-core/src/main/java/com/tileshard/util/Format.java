package com.tileshard.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;

/**
 * Formats counts, ratios and durations for progress and summary log lines.
 */
public class Format {

  private static final String[] UNITS = {"", "k", "M", "B", "T", "Q"};
  private static final Format DEFAULT = new Format(Locale.getDefault(Locale.Category.FORMAT));

  // NumberFormat is not thread safe
  private final ThreadLocal<NumberFormat> percentFormat;
  private final ThreadLocal<NumberFormat> decimalFormat;

  private Format(Locale locale) {
    percentFormat = ThreadLocal.withInitial(() -> {
      var format = NumberFormat.getPercentInstance(locale);
      format.setMaximumFractionDigits(0);
      return format;
    });
    decimalFormat = ThreadLocal.withInitial(() -> {
      var format = NumberFormat.getNumberInstance(locale);
      format.setMaximumFractionDigits(1);
      return format;
    });
  }

  public static Format forLocale(Locale locale) {
    return new Format(locale);
  }

  public static Format defaultInstance() {
    return DEFAULT;
  }

  public static String padLeft(String str, int size) {
    return " ".repeat(Math.max(0, size - str.length())) + str;
  }

  public static String padRight(String str, int size) {
    return str + " ".repeat(Math.max(0, size - str.length()));
  }

  /**
   * Returns a count abbreviated to at most 3 significant digits, like {@code 999}, {@code 1.2k} or {@code 25M}.
   * <p>
   * Fractions below 1 print as {@code <1} and negative values as {@code -}.
   */
  public String numeric(double value) {
    if (value < 0) {
      return "-";
    } else if (value > 0 && value < 1) {
      return "<1";
    }
    long whole = (long) value;
    long divisor = 1;
    int unit = 0;
    while (whole / divisor >= 1000 && unit < UNITS.length - 1) {
      divisor *= 1000;
      unit++;
    }
    if (unit == 0) {
      return Long.toString(whole);
    }
    long tenths = whole / (divisor / 10);
    boolean showTenths = tenths < 100 && tenths % 10 != 0;
    return (showTenths ? decimal(tenths / 10d) : Long.toString(tenths / 10)) + UNITS[unit];
  }

  /** Returns a ratio from 0 to 1 as a whole percentage. */
  public String percent(double ratio) {
    return percentFormat.get().format(ratio);
  }

  public String decimal(double value) {
    return decimalFormat.get().format(value);
  }

  /** Returns a duration like {@code 0.3s}, {@code 1m30s} or {@code 1h2m3s}. */
  public String duration(Duration duration) {
    if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
      return decimal(duration.toNanos() / 1e9) + "s";
    }
    long seconds = Math.round(duration.toNanos() / 1e9);
    StringBuilder result = new StringBuilder();
    appendUnit(result, seconds / 3600, "h");
    appendUnit(result, seconds % 3600 / 60, "m");
    appendUnit(result, seconds % 60, "s");
    return result.toString();
  }

  private static void appendUnit(StringBuilder builder, long amount, String unit) {
    if (amount > 0) {
      builder.append(amount).append(unit);
    }
  }
}
