package com.flamingo.ai.semanticquery.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import com.flamingo.ai.semanticquery.extract.ExtractedItem;
import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.scan.JsonStructureScanner;
import com.flamingo.ai.semanticquery.scan.StructureNode;
import com.flamingo.ai.semanticquery.stream.StreamItem;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-stream state of the event-protocol aggregator: the lines of the event being read and the
 * token text not yet resolved into text or data items.
 *
 * <p>Three independent triggers drain the token buffer: a structure that deserializes as the
 * target, a paragraph break, and a completion marker in the event envelope. The terminal sentinel
 * drains whatever is left and ends the stream.
 */
@Slf4j
class EventAggregation<T> {

  private final TypedExtractor<T> extractor;
  private final SemanticQueryConfig.EventProtocol protocol;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  private final List<String> eventLines = new ArrayList<>();
  private final StringBuilder buffer = new StringBuilder();
  private boolean done;

  EventAggregation(
      TypedExtractor<T> extractor,
      SemanticQueryConfig.EventProtocol protocol,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.extractor = extractor;
    this.protocol = protocol;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Consumes one protocol line.
   *
   * @param line a line without its terminator
   * @return items produced if this line completed an event
   */
  List<StreamItem<T>> onLine(String line) {
    if (done) {
      return List.of();
    }
    String stripped = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    if (!stripped.isEmpty()) {
      eventLines.add(stripped);
      return List.of();
    }
    return completeEvent();
  }

  /**
   * Called when the line source ends. A pending event is processed as if terminated, then the
   * remaining buffer is flushed.
   */
  List<StreamItem<T>> onEnd() {
    if (done) {
      return List.of();
    }
    List<StreamItem<T>> items = new ArrayList<>(completeEvent());
    if (!done) {
      flushAll(items);
      done = true;
    }
    return items;
  }

  boolean isDone() {
    return done;
  }

  private List<StreamItem<T>> completeEvent() {
    if (eventLines.isEmpty()) {
      return List.of();
    }
    String payload = dataPayload();
    eventLines.clear();
    if (payload == null) {
      return List.of();
    }
    meterRegistry.counter("semantic.events").increment();

    List<StreamItem<T>> items = new ArrayList<>();
    if (payload.trim().equals(protocol.getDoneSentinel())) {
      log.debug("Terminal sentinel received, flushing {} buffered chars", buffer.length());
      flushAll(items);
      done = true;
      return items;
    }

    JsonNode envelope;
    try {
      envelope = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      log.warn("Skipping event with unparseable payload: {}", e.getOriginalMessage());
      meterRegistry.counter("semantic.events.skipped").increment();
      return items;
    }

    JsonNode token = envelope.at(protocol.getTokenPointer());
    if (token.isTextual()) {
      String text = token.asText();
      log.trace("Token: {}", text);
      items.add(StreamItem.token(text));
      buffer.append(text);
      consumeStructures(items);
      flushParagraphs(items);
    }

    JsonNode finish = envelope.at(protocol.getFinishPointer());
    if (!finish.isMissingNode() && !finish.isNull()) {
      log.debug("Completion marker '{}' received", finish.asText());
      flushAll(items);
    }
    return items;
  }

  private String dataPayload() {
    String prefix = protocol.getDataPrefix();
    String barePrefix = prefix.stripTrailing();
    StringBuilder payload = null;
    for (String line : eventLines) {
      String data;
      if (line.startsWith(prefix)) {
        data = line.substring(prefix.length());
      } else if (line.startsWith(barePrefix)) {
        data = line.substring(barePrefix.length());
      } else {
        continue;
      }
      if (payload == null) {
        payload = new StringBuilder(data);
      } else {
        payload.append('\n').append(data);
      }
    }
    return payload == null ? null : payload.toString();
  }

  /**
   * Emits every structure in the buffer that matches the target, with the text before it. When
   * the match is nested inside a root that does not match, the rest of that root stays buffered
   * and leaves with the next text flush, e.g. {@code "} Then more."}.
   */
  private void consumeStructures(List<StreamItem<T>> items) {
    String text = buffer.toString();
    int consumed = 0;
    for (StructureNode root : JsonStructureScanner.findStructures(text)) {
      for (ExtractedItem<T> item : extractor.extract(text, root)) {
        StructureNode node = item.node();
        if (item instanceof ExtractedItem.Parsed<T> parsed && node.start() >= consumed) {
          emitTrimmed(text.substring(consumed, node.start()), items);
          items.add(StreamItem.data(parsed.value(), node.slice(text)));
          consumed = node.endExclusive();
        }
      }
    }
    if (consumed > 0) {
      buffer.delete(0, consumed);
    }
  }

  private void flushParagraphs(List<StreamItem<T>> items) {
    String delimiter = protocol.getParagraphDelimiter();
    int index;
    while ((index = buffer.indexOf(delimiter)) >= 0) {
      emitTrimmed(buffer.substring(0, index), items);
      buffer.delete(0, index + delimiter.length());
    }
  }

  private void flushAll(List<StreamItem<T>> items) {
    emitTrimmed(buffer.toString(), items);
    buffer.setLength(0);
  }

  private void emitTrimmed(String text, List<StreamItem<T>> items) {
    String trimmed = text.trim();
    if (!trimmed.isEmpty()) {
      items.add(StreamItem.text(trimmed));
    }
  }
}
