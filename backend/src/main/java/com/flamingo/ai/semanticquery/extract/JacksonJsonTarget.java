package com.flamingo.ai.semanticquery.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link JsonTarget} backed by a Jackson {@link ObjectReader}.
 *
 * <p>Readers are resolved once per target, so trying many spans costs one parse each and no
 * repeated type introspection.
 */
@Slf4j
public class JacksonJsonTarget<T> implements JsonTarget<T> {

  private final ObjectReader reader;
  private final ObjectReader listReader;
  private final String typeName;

  JacksonJsonTarget(ObjectMapper objectMapper, JavaType type) {
    JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
    this.reader = objectMapper.readerFor(type);
    this.listReader = objectMapper.readerFor(listType);
    this.typeName = type.getRawClass().getSimpleName();
  }

  @Override
  public Optional<T> read(String json) {
    try {
      return Optional.ofNullable(reader.readValue(json));
    } catch (JsonProcessingException e) {
      log.trace("Span is not a {}: {}", typeName, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public Optional<List<T>> readList(String json) {
    try {
      return Optional.ofNullable(listReader.readValue(json));
    } catch (JsonProcessingException e) {
      log.trace("Span is not a list of {}: {}", typeName, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  @Override
  public String typeName() {
    return typeName;
  }
}
