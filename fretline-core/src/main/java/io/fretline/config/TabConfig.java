package io.fretline.config;

import io.fretline.tuning.Tuning;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Editing defaults for a tablature session. Loads from {@code ~/.fretline/fretline.properties} by
 * default.
 *
 * @param staffWidth length of each string-line of a newly made staff
 * @param maxEntryFret highest fret accepted by note entry
 * @param mode what the cursor does after a note is entered
 * @param twelveToneSpelling whether chord spellings carry a numeric semitone suffix
 * @param tuningNames six note names, high string first, seeding the session tuning
 */
public record TabConfig(
    int staffWidth,
    int maxEntryFret,
    EntryMode mode,
    boolean twelveToneSpelling,
    List<String> tuningNames) {

  /** Cursor behaviour after note entry. */
  public enum EntryMode {
    /** Advance one cell, for single-note lines. */
    LEAD,
    /** Stay in the column and move to the entered string, for building chords. */
    CHORD
  }

  public static final int DEFAULT_STAFF_WIDTH = 77;
  public static final int DEFAULT_MAX_ENTRY_FRET = 12;

  public TabConfig {
    if (staffWidth < 8) {
      throw new IllegalArgumentException("staff.width must be at least 8: " + staffWidth);
    }
    if (maxEntryFret < 0 || maxEntryFret > 24) {
      throw new IllegalArgumentException("entry.maxFret must be within 0..24: " + maxEntryFret);
    }
    tuningNames = List.copyOf(tuningNames);
    // Fails fast on an unusable tuning declaration.
    Tuning.fromNames(tuningNames);
  }

  /**
   * Creates the default configuration: 77-column staves, entry up to fret 12, lead mode, no
   * twelve-tone spelling, standard tuning.
   */
  public static TabConfig defaults() {
    return new TabConfig(
        DEFAULT_STAFF_WIDTH,
        DEFAULT_MAX_ENTRY_FRET,
        EntryMode.LEAD,
        false,
        List.of("e", "B", "G", "D", "A", "E"));
  }

  /**
   * Loads configuration from {@code ~/.fretline/fretline.properties}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static TabConfig load() throws IOException {
    return load(getConfigPath());
  }

  /**
   * Loads configuration from the given file.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static TabConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  /**
   * Loads configuration from a classpath resource.
   *
   * @return loaded configuration, or defaults if the resource doesn't exist
   * @throws IOException if the resource exists but cannot be read
   */
  public static TabConfig loadResource(String resource) throws IOException {
    try (InputStream in = TabConfig.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        return defaults();
      }
      Properties props = new Properties();
      props.load(in);
      return fromProperties(props);
    }
  }

  /**
   * Saves this configuration to {@code ~/.fretline/fretline.properties}.
   *
   * @throws IOException if the file cannot be written
   */
  public void save() throws IOException {
    save(getConfigPath());
  }

  /**
   * Saves this configuration to the given file, creating parent directories.
   *
   * @throws IOException if the file cannot be written
   */
  public void save(Path configPath) throws IOException {
    if (configPath.getParent() != null) {
      Files.createDirectories(configPath.getParent());
    }
    Properties props = toProperties();
    try (var writer = Files.newBufferedWriter(configPath)) {
      props.store(writer, "fretline configuration\n# Modes: LEAD, CHORD");
    }
  }

  private static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".fretline", "fretline.properties");
  }

  /**
   * Converts properties to a configuration; missing keys take their default values.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static TabConfig fromProperties(Properties props) {
    int staffWidth =
        Integer.parseInt(
            props.getProperty("staff.width", String.valueOf(DEFAULT_STAFF_WIDTH)).trim());
    int maxEntryFret =
        Integer.parseInt(
            props.getProperty("entry.maxFret", String.valueOf(DEFAULT_MAX_ENTRY_FRET)).trim());
    EntryMode mode = EntryMode.valueOf(props.getProperty("mode", "LEAD").trim().toUpperCase());
    boolean twelveTone =
        Boolean.parseBoolean(props.getProperty("chord.twelveToneSpelling", "false").trim());
    List<String> tuning =
        Arrays.asList(props.getProperty("tuning", "e B G D A E").trim().split("\\s+"));
    return new TabConfig(staffWidth, maxEntryFret, mode, twelveTone, tuning);
  }

  private Properties toProperties() {
    Properties props = new Properties();
    props.setProperty("staff.width", String.valueOf(staffWidth));
    props.setProperty("entry.maxFret", String.valueOf(maxEntryFret));
    props.setProperty("mode", mode.name());
    props.setProperty("chord.twelveToneSpelling", String.valueOf(twelveToneSpelling));
    props.setProperty("tuning", String.join(" ", tuningNames));
    return props;
  }

  /** The tuning declared by {@link #tuningNames()}. */
  public Tuning tuning() {
    return Tuning.fromNames(tuningNames);
  }
}
