package com.flamingo.ai.semanticquery.stream;

import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import com.flamingo.ai.semanticquery.exception.StreamDecodingException;
import com.flamingo.ai.semanticquery.exception.StreamSourceException;
import com.flamingo.ai.semanticquery.extract.JsonTarget;
import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.scan.JsonStructureScanner;
import com.flamingo.ai.semanticquery.scan.StructureNode;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Produces the ordered text/data item sequence for model output.
 *
 * <p>Text between structures is kept verbatim (whitespace-only gaps are skipped), structures that
 * match the target become data items, and structures that do not match are kept as text. Items
 * are always emitted in the order their text appears.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItemStreamReconciler {

  private static final int MIN_READ_BUFFER = 1024;

  private final SemanticQueryConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Reconciles a complete response.
   *
   * @param raw the full text
   * @param target the type to extract
   * @return ordered text and data items
   */
  public <T> List<StreamItem<T>> reconcile(String raw, JsonTarget<T> target) {
    TypedExtractor<T> extractor = new TypedExtractor<>(target);
    List<StreamItem<T>> items = new ArrayList<>();
    int cursor = 0;

    for (StructureNode root : JsonStructureScanner.findStructures(raw)) {
      RootEmitter.emitGap(raw, cursor, root.start(), items);
      RootEmitter.emitRoot(raw, root, extractor, items);
      cursor = root.endExclusive();
    }
    RootEmitter.emitGap(raw, cursor, raw.length(), items);

    items.forEach(this::countItem);
    log.debug(
        "Reconciled {} chars into {} item(s) of {}",
        raw.length(),
        items.size(),
        target.typeName());
    return items;
  }

  /**
   * Opens an incremental session for text that arrives in chunks.
   *
   * @param target the type to extract
   * @return a new session owned by the caller
   */
  public <T> ReconcilingSession<T> open(JsonTarget<T> target) {
    return new ReconcilingSession<>(new TypedExtractor<>(target));
  }

  /**
   * Reconciles a byte stream as it arrives. Bytes are decoded as UTF-8 against the continuous
   * stream, so multi-byte characters may be split across chunks.
   *
   * @param source upstream chunks; its errors terminate the returned sequence
   * @param target the type to extract
   * @return items in text order; fails with {@link StreamDecodingException} on invalid UTF-8
   */
  public <T> Flux<StreamItem<T>> stream(Flux<byte[]> source, JsonTarget<T> target) {
    return Flux.defer(
        () -> {
          IncrementalTextDecoder decoder = new IncrementalTextDecoder();
          ReconcilingSession<T> session = open(target);
          return source
              .concatMapIterable(bytes -> session.accept(decoder.decode(bytes)))
              .concatWith(
                  Flux.defer(
                      () -> {
                        List<StreamItem<T>> tail =
                            new ArrayList<>(session.accept(decoder.finish()));
                        tail.addAll(session.finish());
                        return Flux.fromIterable(tail);
                      }))
              .doOnNext(this::countItem)
              .doOnError(
                  StreamDecodingException.class,
                  e -> {
                    log.error("Stopping stream after decode failure: {}", e.getMessage());
                    meterRegistry.counter("semantic.decode.errors").increment();
                  });
        });
  }

  /**
   * Reconciles a blocking input stream, reading it on the bounded-elastic scheduler. The stream is
   * not closed; it belongs to the caller.
   *
   * @param in the byte source
   * @param target the type to extract
   * @return items in text order; fails with {@link StreamSourceException} if reading fails
   */
  public <T> Flux<StreamItem<T>> stream(InputStream in, JsonTarget<T> target) {
    int bufferSize = Math.max(MIN_READ_BUFFER, config.getStreaming().getReadBufferSize());
    Flux<byte[]> chunks =
        Flux.<byte[]>generate(
                sink -> {
                  byte[] buffer = new byte[bufferSize];
                  try {
                    int read = in.read(buffer);
                    if (read < 0) {
                      sink.complete();
                    } else {
                      sink.next(Arrays.copyOf(buffer, read));
                    }
                  } catch (IOException e) {
                    sink.error(new StreamSourceException("Failed to read response stream", e));
                  }
                })
            .subscribeOn(Schedulers.boundedElastic());
    return stream(chunks, target);
  }

  /**
   * Reconciles already-decoded tokens, forwarding every token as a {@link StreamItem.Token} before
   * the text and data items it completes.
   *
   * @param tokens token text in arrival order
   * @param target the type to extract
   * @return tokens interleaved with reconciled items
   */
  public <T> Flux<StreamItem<T>> streamTokens(Flux<String> tokens, JsonTarget<T> target) {
    return Flux.defer(
        () -> {
          ReconcilingSession<T> session = open(target);
          return tokens
              .concatMapIterable(
                  token -> {
                    List<StreamItem<T>> items = new ArrayList<>();
                    items.add(StreamItem.token(token));
                    items.addAll(session.accept(token));
                    return items;
                  })
              .concatWith(Flux.defer(() -> Flux.fromIterable(session.finish())))
              .doOnNext(this::countItem);
        });
  }

  private void countItem(StreamItem<?> item) {
    String kind = item.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    meterRegistry.counter("semantic.items", "kind", kind).increment();
  }
}
