package com.flamingo.ai.semanticquery.stream;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A complete model response as ordered text and data items.
 *
 * <p>Tokens are dropped on construction; they only matter while a response is still streaming.
 */
public record ParsedResponse<T>(List<StreamItem<T>> items) {

  public ParsedResponse {
    items = items.stream().filter(item -> !(item instanceof StreamItem.Token)).toList();
  }

  /** The data values, in response order. */
  public List<T> dataOnly() {
    return items.stream()
        .filter(item -> item instanceof StreamItem.Data)
        .map(item -> ((StreamItem.Data<T>) item).value())
        .toList();
  }

  public Optional<T> firstData() {
    return dataOnly().stream().findFirst();
  }

  public boolean hasData() {
    return items.stream().anyMatch(item -> item instanceof StreamItem.Data);
  }

  public int dataCount() {
    return dataOnly().size();
  }

  /** All items joined by a single space; data items contribute their source JSON. */
  public String textContent() {
    return items.stream().map(StreamItem::asText).collect(Collectors.joining(" "));
  }
}
