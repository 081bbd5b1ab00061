package com.skypulse.ingester.aircraft;

import com.skypulse.analytics.classify.AircraftTypeLookup;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves ICAO type codes from a read-only SQLite aircraft reference database.
 *
 * <p>Expects an {@code aircraft} table keyed by {@code icao24}. The type code comes from
 * {@code typecode}; when that column is absent or empty, {@code icao_aircraft_class} is used.
 * Lookups go through a bounded LRU cache that also remembers misses.
 */
public class SqliteAircraftTypeLookup implements AircraftTypeLookup, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqliteAircraftTypeLookup.class);
  private static final String MISS = "";

  private final Connection connection;
  private final PreparedStatement byIcao24;
  private final Map<String, String> cache;

  public SqliteAircraftTypeLookup(Path sqlitePath, int cacheSize) {
    if (!Files.exists(sqlitePath)) {
      throw new IllegalStateException("Aircraft DB not found at " + sqlitePath);
    }
    try {
      String url = "jdbc:sqlite:file:" + sqlitePath.toAbsolutePath() + "?mode=ro";
      this.connection = DriverManager.getConnection(url);
      this.byIcao24 = connection.prepareStatement(buildSelectSql(connection));
    } catch (SQLException ex) {
      throw new IllegalStateException("Failed to open aircraft SQLite DB at " + sqlitePath, ex);
    }

    int maxEntries = Math.max(0, cacheSize);
    this.cache = Collections.synchronizedMap(new LinkedHashMap<>(1024, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
        return size() > maxEntries;
      }
    });
    log.info("Aircraft type DB opened: {} (cache size {})", sqlitePath, maxEntries);
  }

  /** Lookup failures count as misses so classification falls through to UNKNOWN. */
  @Override
  public Optional<String> typecodeFor(String icao24) {
    if (icao24 == null || icao24.isBlank()) {
      return Optional.empty();
    }
    String key = icao24.trim().toLowerCase(Locale.ROOT);
    String cached = cache.get(key);
    if (cached != null) {
      return cached.isEmpty() ? Optional.empty() : Optional.of(cached);
    }

    String typecode = query(key);
    cache.put(key, typecode == null ? MISS : typecode);
    return Optional.ofNullable(typecode);
  }

  // PreparedStatement is not thread-safe; region workers call in parallel.
  private synchronized String query(String key) {
    try {
      byIcao24.setString(1, key);
      try (ResultSet rs = byIcao24.executeQuery()) {
        if (!rs.next()) {
          return null;
        }
        String typecode = blankToNull(rs.getString("typecode"));
        return typecode != null ? typecode : blankToNull(rs.getString("icao_aircraft_class"));
      }
    } catch (SQLException ex) {
      log.debug("Aircraft DB lookup failed for {}", key, ex);
      return null;
    }
  }

  @Override
  public synchronized void close() {
    try {
      byIcao24.close();
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close aircraft DB", ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
  }

  private static String buildSelectSql(Connection connection) throws SQLException {
    Set<String> columns = new HashSet<>();
    try (PreparedStatement stmt = connection.prepareStatement("PRAGMA table_info(aircraft)");
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String name = rs.getString("name");
        if (name != null) {
          columns.add(name);
        }
      }
    }
    if (columns.isEmpty()) {
      throw new SQLException("Aircraft DB has no 'aircraft' table");
    }
    return "SELECT " + optionalColumn(columns, "typecode") + ", "
        + optionalColumn(columns, "icao_aircraft_class")
        + " FROM aircraft WHERE icao24 = ? LIMIT 1";
  }

  private static String optionalColumn(Set<String> columns, String name) {
    return columns.contains(name) ? name : ("NULL AS " + name);
  }
}
