package com.skypulse.ingester.api;

import com.skypulse.analytics.model.FlightRecord;
import com.skypulse.analytics.model.WeightClass;
import java.util.List;
import java.util.Locale;

/**
 * Optional record filters of the snapshot and CSV endpoints. A {@code null} field matches
 * everything.
 *
 * @param search case-insensitive substring of callsign or icao24, already lower-cased
 * @param weightClass exact weight class
 * @param country case-insensitive origin country, already lower-cased
 */
public record FlightFilter(String search, WeightClass weightClass, String country) {
  public static final FlightFilter NONE = new FlightFilter(null, null, null);

  public boolean isEmpty() {
    return search == null && weightClass == null && country == null;
  }

  public boolean matches(FlightRecord record) {
    if (weightClass != null && record.weightClass() != weightClass) {
      return false;
    }
    if (country != null && !record.country().toLowerCase(Locale.ROOT).equals(country)) {
      return false;
    }
    if (search == null) {
      return true;
    }
    return record.callsign().toLowerCase(Locale.ROOT).contains(search)
        || record.icao24().contains(search);
  }

  public List<FlightRecord> apply(List<FlightRecord> records) {
    if (isEmpty()) {
      return records;
    }
    return records.stream().filter(this::matches).toList();
  }
}
