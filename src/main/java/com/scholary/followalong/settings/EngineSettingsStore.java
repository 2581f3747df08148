package com.scholary.followalong.settings;

import com.scholary.followalong.backend.BackendPreference;
import com.scholary.followalong.config.EngineProperties;
import java.util.HashMap;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Key/value store for the user's engine preferences.
 *
 * <p>Keys missing from the {@code settings} table fall back to the {@code engine.*} defaults.
 */
@Repository
public class EngineSettingsStore {

  static final String BACKEND_KEY = "transcription_backend";
  static final String MODEL_KEY = "transcription_model";
  static final String LANGUAGE_KEY = "transcription_language";

  private final JdbcTemplate jdbcTemplate;
  private final EngineProperties properties;

  public EngineSettingsStore(JdbcTemplate jdbcTemplate, EngineProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.properties = properties;
  }

  public EngineSettings current() {
    Map<String, String> values = new HashMap<>();
    jdbcTemplate.query(
        "SELECT setting_key, setting_value FROM settings",
        rs -> {
          values.put(rs.getString("setting_key"), rs.getString("setting_value"));
        });
    return new EngineSettings(
        BackendPreference.parse(values.getOrDefault(BACKEND_KEY, properties.defaultBackend())),
        values.getOrDefault(MODEL_KEY, properties.defaultModel()),
        values.getOrDefault(LANGUAGE_KEY, properties.defaultLanguage()));
  }

  @Transactional
  public void save(EngineSettings settings) {
    put(BACKEND_KEY, settings.backend().id());
    put(MODEL_KEY, settings.model());
    put(LANGUAGE_KEY, settings.language());
  }

  private void put(String key, String value) {
    int updated =
        jdbcTemplate.update(
            "UPDATE settings SET setting_value = ? WHERE setting_key = ?", value, key);
    if (updated == 0) {
      jdbcTemplate.update(
          "INSERT INTO settings (setting_key, setting_value) VALUES (?, ?)", key, value);
    }
  }
}
