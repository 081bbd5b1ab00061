package com.skypulse.analytics.classify;

import com.skypulse.analytics.model.RawStateVector;
import com.skypulse.analytics.model.WeightClass;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a state vector to a {@link WeightClass}.
 *
 * <p>Resolution order: ADS-B emitter category, then ICAO type-code prefix (longest prefix wins)
 * when a type lookup is available, then {@link WeightClass#UNKNOWN}.
 */
public class WeightClassifier {
  private final Map<Integer, WeightClass> categoryClasses;
  private final Map<String, WeightClass> typecodePrefixes;
  private final AircraftTypeLookup typeLookup;

  public WeightClassifier(
      Map<Integer, WeightClass> categoryClasses,
      Map<String, WeightClass> typecodePrefixes,
      AircraftTypeLookup typeLookup) {
    this.categoryClasses = Map.copyOf(categoryClasses);
    Map<String, WeightClass> prefixes = new LinkedHashMap<>();
    typecodePrefixes.forEach((prefix, weightClass) ->
        prefixes.put(prefix.trim().toUpperCase(Locale.ROOT), weightClass));
    this.typecodePrefixes = Collections.unmodifiableMap(prefixes);
    this.typeLookup = typeLookup == null ? AircraftTypeLookup.none() : typeLookup;
  }

  public static WeightClassifier withDefaults() {
    return new WeightClassifier(
        defaultCategoryClasses(), defaultTypecodePrefixes(), AircraftTypeLookup.none());
  }

  public WeightClass classify(RawStateVector vector) {
    Integer category = vector.category();
    if (category != null) {
      WeightClass byCategory = categoryClasses.get(category);
      if (byCategory != null) {
        return byCategory;
      }
    }
    return classifyTypecode(typeLookup.typecodeFor(vector.icao24())).orElse(WeightClass.UNKNOWN);
  }

  Optional<WeightClass> classifyTypecode(Optional<String> typecode) {
    if (typecode.isEmpty() || typecode.get().isBlank()) {
      return Optional.empty();
    }
    String normalized = typecode.get().trim().toUpperCase(Locale.ROOT);
    String bestPrefix = null;
    for (String prefix : typecodePrefixes.keySet()) {
      if (normalized.startsWith(prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
        bestPrefix = prefix;
      }
    }
    return bestPrefix == null ? Optional.empty() : Optional.of(typecodePrefixes.get(bestPrefix));
  }

  /** OpenSky extended category codes (state vector index 17). */
  public static Map<Integer, WeightClass> defaultCategoryClasses() {
    Map<Integer, WeightClass> classes = new LinkedHashMap<>();
    classes.put(2, WeightClass.LIGHT);
    classes.put(3, WeightClass.SMALL);
    classes.put(4, WeightClass.LARGE);
    // 5 is "high vortex large", grouped with large airframes.
    classes.put(5, WeightClass.LARGE);
    classes.put(6, WeightClass.HEAVY);
    classes.put(7, WeightClass.HIGH_PERF);
    classes.put(8, WeightClass.ROTORCRAFT);
    return classes;
  }

  public static Map<String, WeightClass> defaultTypecodePrefixes() {
    Map<String, WeightClass> prefixes = new LinkedHashMap<>();
    prefixes.put("C1", WeightClass.LIGHT);
    prefixes.put("P28", WeightClass.LIGHT);
    prefixes.put("SR2", WeightClass.LIGHT);
    prefixes.put("DA4", WeightClass.LIGHT);
    prefixes.put("AT4", WeightClass.SMALL);
    prefixes.put("AT7", WeightClass.SMALL);
    prefixes.put("DH8", WeightClass.SMALL);
    prefixes.put("CRJ", WeightClass.SMALL);
    prefixes.put("CRJ9", WeightClass.LARGE);
    prefixes.put("E17", WeightClass.LARGE);
    prefixes.put("E19", WeightClass.LARGE);
    prefixes.put("BCS", WeightClass.LARGE);
    prefixes.put("A31", WeightClass.LARGE);
    prefixes.put("A32", WeightClass.LARGE);
    prefixes.put("A20N", WeightClass.LARGE);
    prefixes.put("A21N", WeightClass.LARGE);
    prefixes.put("B73", WeightClass.LARGE);
    prefixes.put("B3", WeightClass.LARGE);
    prefixes.put("B75", WeightClass.LARGE);
    prefixes.put("A30", WeightClass.HEAVY);
    prefixes.put("A33", WeightClass.HEAVY);
    prefixes.put("A34", WeightClass.HEAVY);
    prefixes.put("A35", WeightClass.HEAVY);
    prefixes.put("A38", WeightClass.HEAVY);
    prefixes.put("B74", WeightClass.HEAVY);
    prefixes.put("B76", WeightClass.HEAVY);
    prefixes.put("B77", WeightClass.HEAVY);
    prefixes.put("B78", WeightClass.HEAVY);
    prefixes.put("F16", WeightClass.HIGH_PERF);
    prefixes.put("F18", WeightClass.HIGH_PERF);
    prefixes.put("EUFI", WeightClass.HIGH_PERF);
    prefixes.put("RFAL", WeightClass.HIGH_PERF);
    prefixes.put("R44", WeightClass.ROTORCRAFT);
    prefixes.put("EC", WeightClass.ROTORCRAFT);
    prefixes.put("AS3", WeightClass.ROTORCRAFT);
    prefixes.put("AS5", WeightClass.ROTORCRAFT);
    prefixes.put("H60", WeightClass.ROTORCRAFT);
    return prefixes;
  }
}
