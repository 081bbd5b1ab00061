package com.skypulse.ingester.aircraft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteAircraftTypeLookupTest {

  @TempDir
  Path tempDir;

  private Path createDb(String ddl, String... inserts) throws Exception {
    Path db = tempDir.resolve("aircraft.db");
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
         Statement statement = connection.createStatement()) {
      statement.execute(ddl);
      for (String insert : inserts) {
        statement.execute(insert);
      }
    }
    return db;
  }

  @Test
  void resolvesTypecodeCaseInsensitively() throws Exception {
    Path db = createDb(
        "CREATE TABLE aircraft (icao24 TEXT PRIMARY KEY, typecode TEXT, icao_aircraft_class TEXT)",
        "INSERT INTO aircraft VALUES ('3c6444', 'a320', 'L2J')",
        "INSERT INTO aircraft VALUES ('4ca7b5', '', 'L1P')");

    try (SqliteAircraftTypeLookup lookup = new SqliteAircraftTypeLookup(db, 10)) {
      assertThat(lookup.typecodeFor("3C6444")).contains("A320");
      assertThat(lookup.typecodeFor("4ca7b5")).contains("L1P");
      assertThat(lookup.typecodeFor("ffffff")).isEmpty();
      assertThat(lookup.typecodeFor(" ")).isEmpty();
    }
  }

  @Test
  void toleratesMissingTypecodeColumn() throws Exception {
    Path db = createDb(
        "CREATE TABLE aircraft (icao24 TEXT PRIMARY KEY, icao_aircraft_class TEXT)",
        "INSERT INTO aircraft VALUES ('abc123', 'H1T')");

    try (SqliteAircraftTypeLookup lookup = new SqliteAircraftTypeLookup(db, 10)) {
      assertThat(lookup.typecodeFor("abc123")).contains("H1T");
    }
  }

  @Test
  void missingFileFailsFast() {
    assertThatThrownBy(() -> new SqliteAircraftTypeLookup(tempDir.resolve("absent.db"), 10))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not found");
  }
}
