package com.scholary.followalong.engine.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.followalong.engine.EngineException;
import com.scholary.followalong.engine.TimedFragment;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code -oj} output of whisper-cli.
 *
 * <pre>
 * { "transcription": [ { "offsets": { "from": 0, "to": 2480 }, "text": " Hello there." } ] }
 * </pre>
 */
@Component
public class WhisperJsonParser {

  private final ObjectMapper objectMapper;

  public WhisperJsonParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<TimedFragment> parse(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new EngineException("Unreadable whisper output", e);
    }
    JsonNode segments = root.path("transcription");
    if (!segments.isArray()) {
      throw new EngineException("Whisper output has no transcription array");
    }
    List<TimedFragment> fragments = new ArrayList<>(segments.size());
    for (JsonNode segment : segments) {
      JsonNode offsets = segment.path("offsets");
      fragments.add(
          new TimedFragment(
              segment.path("text").asText(""),
              offsets.path("from").asLong(0),
              offsets.path("to").asLong(0)));
    }
    return fragments;
  }
}
