package com.flamingo.ai.semanticquery.extract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds {@link JsonTarget}s on top of a strict copy of the application {@link ObjectMapper}.
 *
 * <p>Model output is full of JSON that merely resembles the requested shape, so the copy rejects
 * spans with missing creator properties, null primitives or trailing tokens. Unknown properties
 * are accepted by default.
 */
@Component
@Slf4j
public class JsonTargetFactory {

  private final ObjectMapper strictMapper;

  public JsonTargetFactory(ObjectMapper objectMapper, SemanticQueryConfig config) {
    SemanticQueryConfig.Extraction extraction = config.getExtraction();
    this.strictMapper =
        objectMapper
            .copy()
            .configure(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                extraction.isFailOnUnknownProperties())
            .configure(
                DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES,
                extraction.isFailOnMissingProperties())
            .configure(
                DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES,
                extraction.isFailOnNullForPrimitives())
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    log.debug(
        "JSON target factory initialized: failOnUnknown={}, failOnMissing={}",
        extraction.isFailOnUnknownProperties(),
        extraction.isFailOnMissingProperties());
  }

  /**
   * Creates a target for a concrete class.
   *
   * @param type the class to deserialize into
   * @return a reusable target
   */
  public <T> JsonTarget<T> forType(Class<T> type) {
    return new JacksonJsonTarget<>(strictMapper, strictMapper.constructType(type));
  }

  /**
   * Creates a target for a generic type, e.g. {@code new TypeReference<Map<String, Integer>>()
   * {}}.
   *
   * @param type the type to deserialize into
   * @return a reusable target
   */
  public <T> JsonTarget<T> forType(TypeReference<T> type) {
    return new JacksonJsonTarget<>(strictMapper, strictMapper.constructType(type));
  }
}
