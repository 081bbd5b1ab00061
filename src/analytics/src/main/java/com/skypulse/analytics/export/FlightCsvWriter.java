package com.skypulse.analytics.export;

import com.skypulse.analytics.model.FlightRecord;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Writes flight records as CSV with a fixed column order.
 *
 * <p>Unknown measurements and positions are written as empty cells, so a reported zero and a
 * missing value stay distinguishable downstream.
 */
public final class FlightCsvWriter {
  public static final List<String> COLUMNS = List.of(
      "icao24",
      "callsign",
      "country",
      "lat",
      "lon",
      "altitude_m",
      "speed_mps",
      "heading_deg",
      "vertical_rate_mps",
      "weight_class",
      "flight_phase",
      "is_anomalous");

  private static final String LINE_END = "\n";

  public String write(List<FlightRecord> records) {
    StringWriter out = new StringWriter();
    try {
      write(records, out);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  public void write(List<FlightRecord> records, Writer out) throws IOException {
    out.write(String.join(",", COLUMNS));
    out.write(LINE_END);
    for (FlightRecord record : records) {
      out.write(row(record));
      out.write(LINE_END);
    }
    out.flush();
  }

  String row(FlightRecord record) {
    StringBuilder sb = new StringBuilder(128);
    sb.append(escape(record.icao24())).append(',');
    sb.append(escape(record.callsign())).append(',');
    sb.append(escape(record.country())).append(',');
    sb.append(record.position().map(p -> Double.toString(p.lat())).orElse("")).append(',');
    sb.append(record.position().map(p -> Double.toString(p.lon())).orElse("")).append(',');
    sb.append(number(record.altitudeM())).append(',');
    sb.append(number(record.speedMps())).append(',');
    sb.append(number(record.headingDeg())).append(',');
    sb.append(number(record.verticalRateMps())).append(',');
    sb.append(record.weightClass().name()).append(',');
    sb.append(record.flightPhase().name()).append(',');
    sb.append(record.isAnomalous());
    return sb.toString();
  }

  private static String number(OptionalDouble value) {
    return value.isPresent() ? Double.toString(value.getAsDouble()) : "";
  }

  static String escape(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    boolean quote = value.indexOf(',') >= 0
        || value.indexOf('"') >= 0
        || value.indexOf('\n') >= 0
        || value.indexOf('\r') >= 0;
    if (!quote) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
