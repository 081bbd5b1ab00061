package com.skypulse.ingester.api;

import com.skypulse.analytics.model.WeightClass;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Parsing of query parameters shared by the API controllers. */
public final class QueryParser {
  private static final Pattern WINDOW_PATTERN = Pattern.compile("^(\\d+)([mhd])$");
  private static final int MAX_SEARCH_LENGTH = 32;
  private static final String WEIGHT_CLASS_VALUES = Arrays.stream(WeightClass.values())
      .map(value -> value.name().toLowerCase(Locale.ROOT))
      .collect(Collectors.joining(","));

  private QueryParser() {}

  /**
   * Parses a duration window string such as {@code 30m}, {@code 24h} or {@code 2d}.
   *
   * @param raw raw window query value
   * @param defaultValue fallback when absent
   * @param maxValue hard maximum
   * @return validated window
   */
  public static Duration parseWindow(String raw, Duration defaultValue, Duration maxValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }

    Matcher matcher = WINDOW_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new BadRequestException("window must use format like 30m,6h,24h,2d");
    }

    Duration parsed;
    try {
      long amount = Long.parseLong(matcher.group(1));
      parsed = switch (matcher.group(2)) {
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        default -> Duration.ofDays(amount);
      };
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new BadRequestException("window amount is too large");
    }

    if (parsed.isZero()) {
      throw new BadRequestException("window must be > 0");
    }
    if (parsed.compareTo(maxValue) > 0) {
      throw new BadRequestException("window exceeds maximum allowed duration");
    }
    return parsed;
  }

  /**
   * Builds the record filter of the snapshot endpoints. Blank values mean "no filter".
   *
   * @param searchRaw callsign or icao24 fragment
   * @param weightClassRaw weight class name, case-insensitive
   * @param countryRaw origin country
   * @return parsed filter, {@link FlightFilter#NONE} when every value is blank
   */
  public static FlightFilter parseFlightFilter(String searchRaw, String weightClassRaw, String countryRaw) {
    String search = normalizeOptional(searchRaw);
    if (search != null && search.length() > MAX_SEARCH_LENGTH) {
      throw new BadRequestException("q must be at most " + MAX_SEARCH_LENGTH + " characters");
    }
    String weightClass = normalizeOptional(weightClassRaw);
    String country = normalizeOptional(countryRaw);
    if (search == null && weightClass == null && country == null) {
      return FlightFilter.NONE;
    }
    return new FlightFilter(search, parseWeightClass(weightClass), country);
  }

  private static WeightClass parseWeightClass(String normalized) {
    if (normalized == null) {
      return null;
    }
    try {
      return WeightClass.valueOf(normalized.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("weight_class must be one of: " + WEIGHT_CLASS_VALUES);
    }
  }

  private static String normalizeOptional(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return raw.trim().toLowerCase(Locale.ROOT);
  }
}
