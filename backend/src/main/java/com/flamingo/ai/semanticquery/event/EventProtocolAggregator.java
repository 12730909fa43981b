package com.flamingo.ai.semanticquery.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import com.flamingo.ai.semanticquery.extract.JsonTarget;
import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.stream.IncrementalTextDecoder;
import com.flamingo.ai.semanticquery.stream.StreamItem;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns a server-sent-events token stream into token, text and data items.
 *
 * <p>Events are separated by a blank line. The data line of each event carries a JSON envelope
 * whose token field holds the next piece of generated text. Every token is forwarded immediately
 * as a {@link StreamItem.Token}; the same text is accumulated and searched for structures that
 * deserialize as the target type. Field locations, the data prefix and the terminal sentinel come
 * from {@code semantic-query.event-protocol}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventProtocolAggregator {

  private final SemanticQueryConfig config;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Aggregates a stream of protocol lines.
   *
   * @param lines protocol lines without terminators
   * @param target the type to extract
   * @return items in arrival order; completes at the terminal sentinel or when the lines end
   */
  public <T> Flux<StreamItem<T>> aggregate(Flux<String> lines, JsonTarget<T> target) {
    return Flux.defer(
        () -> {
          LineFeed<T> feed = open(target);
          return lines
              .map(feed::line)
              .takeUntil(ignored -> feed.isDone())
              .concatWith(Mono.fromCallable(feed::end))
              .concatMapIterable(items -> items)
              .doOnNext(this::countItem)
              .doOnComplete(() -> log.debug("Event stream for {} completed", target.typeName()));
        });
  }

  /**
   * Aggregates a raw byte stream: bytes are decoded as UTF-8 and split on {@code \n} or {@code
   * \r\n} before aggregation.
   *
   * @param source upstream chunks in arrival order
   * @param target the type to extract
   * @return items in arrival order
   */
  public <T> Flux<StreamItem<T>> aggregateBytes(Flux<byte[]> source, JsonTarget<T> target) {
    Flux<String> lines =
        Flux.defer(
            () -> {
              IncrementalTextDecoder decoder = new IncrementalTextDecoder();
              LineSplitter splitter = new LineSplitter();
              return source
                  .concatMapIterable(bytes -> splitter.push(decoder.decode(bytes)))
                  .concatWith(
                      Flux.defer(
                          () -> Flux.fromIterable(splitter.finish(decoder.finish()))));
            });
    return aggregate(lines, target);
  }

  private void countItem(StreamItem<?> item) {
    String kind = item.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    meterRegistry.counter("semantic.items", "kind", kind).increment();
  }

  /**
   * Opens a synchronous aggregation for callers that read protocol lines themselves.
   *
   * @param target the type to extract
   * @return a new feed owned by the caller
   */
  public <T> LineFeed<T> open(JsonTarget<T> target) {
    EventAggregation<T> aggregation =
        new EventAggregation<>(
            new TypedExtractor<>(target), config.getEventProtocol(), objectMapper, meterRegistry);
    return new LineFeed<>(aggregation);
  }

  /** Synchronous handle on one aggregation, fed a line at a time. */
  public static final class LineFeed<T> {
    private final EventAggregation<T> aggregation;

    private LineFeed(EventAggregation<T> aggregation) {
      this.aggregation = aggregation;
    }

    /** Consumes one line and returns the items it completed. */
    public List<StreamItem<T>> line(String line) {
      return aggregation.onLine(line);
    }

    /** Signals the end of the line source and returns the final items. */
    public List<StreamItem<T>> end() {
      return aggregation.onEnd();
    }

    public boolean isDone() {
      return aggregation.isDone();
    }
  }
}
