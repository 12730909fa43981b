package com.flamingo.ai.semanticquery.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import com.flamingo.ai.semanticquery.exception.StreamDecodingException;
import com.flamingo.ai.semanticquery.extract.JsonTarget;
import com.flamingo.ai.semanticquery.extract.JsonTargetFactory;
import com.flamingo.ai.semanticquery.stream.StreamItem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@DisplayName("EventProtocolAggregator Tests")
class EventProtocolAggregatorTest {

  record Named(String name) {}

  record ToolCall(String name, JsonNode args) {}

  record Weather(String city, int tempC) {}

  private static final String DONE = "data: [DONE]";

  private SemanticQueryConfig config;
  private SimpleMeterRegistry meterRegistry;
  private EventProtocolAggregator aggregator;
  private JsonTargetFactory targetFactory;

  @BeforeEach
  void setUp() {
    config = new SemanticQueryConfig();
    meterRegistry = new SimpleMeterRegistry();
    ObjectMapper objectMapper = new ObjectMapper();
    aggregator = new EventProtocolAggregator(config, objectMapper, meterRegistry);
    targetFactory = new JsonTargetFactory(objectMapper, config);
  }

  /** One token event followed by its blank separator line. */
  private static List<String> tokenEvent(String token) {
    return List.of(
        "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":"
            + TextNode.valueOf(token)
            + "},\"finish_reason\":null}]}",
        "");
  }

  private static List<String> tokenEvents(String... tokens) {
    List<String> lines = new ArrayList<>();
    for (String token : tokens) {
      lines.addAll(tokenEvent(token));
    }
    return lines;
  }

  private static <T> Flux<StreamItem<T>> withoutTokens(Flux<StreamItem<T>> items) {
    return items.filter(item -> !(item instanceof StreamItem.Token));
  }

  @Nested
  @DisplayName("Structure detection")
  class StructureDetection {

    @Test
    @DisplayName("Should emit text then data once a structure closes across single-char tokens")
    void shouldAssembleStructureFromSingleCharTokens() {
      List<String> tokens = new ArrayList<>();
      tokens.add("Intro ");
      for (char c : "{\"name\":\"x\"}".toCharArray()) {
        tokens.add(String.valueOf(c));
      }
      List<String> lines = tokenEvents(tokens.toArray(String[]::new));
      lines.add(DONE);
      lines.add("");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("Intro "))
          .expectNextCount(11)
          .expectNext(StreamItem.token("}"))
          .expectNext(StreamItem.text("Intro"))
          .expectNext(StreamItem.data(new Named("x"), "{\"name\":\"x\"}"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should separate paragraphs and tool calls across many events")
    void shouldHandleMultipleToolCalls() {
      List<String> lines =
          tokenEvents(
              "Intro paragraph about tokio.",
              "\n\n",
              "{",
              "\"name\":\"fetch_docs\"",
              ",",
              "\"args\":{\"q\":\"tokio runtime\"}",
              "}",
              " Checking crates.io stats.",
              "\n\n",
              "{\"name\":\"fetch_repo\",",
              "\"args\":{\"repo\":\"tokio-rs/tokio\"}}",
              " Note: \"text with { braces } inside\" should be fine.",
              "\n\n");
      lines.add(DONE);
      lines.add("");
      JsonTarget<ToolCall> target = targetFactory.forType(ToolCall.class);

      List<StreamItem<ToolCall>> items =
          withoutTokens(aggregator.aggregate(Flux.fromIterable(lines), target))
              .collectList()
              .block();

      assertThat(items).hasSize(5);
      assertThat(items.get(0)).isEqualTo(StreamItem.text("Intro paragraph about tokio."));
      assertThat(((StreamItem.Data<ToolCall>) items.get(1)).value().name()).isEqualTo("fetch_docs");
      assertThat(((StreamItem.Data<ToolCall>) items.get(1)).value().args().get("q").asText())
          .isEqualTo("tokio runtime");
      assertThat(items.get(2)).isEqualTo(StreamItem.text("Checking crates.io stats."));
      assertThat(((StreamItem.Data<ToolCall>) items.get(3)).value().name()).isEqualTo("fetch_repo");
      assertThat(items.get(4))
          .isEqualTo(StreamItem.text("Note: \"text with { braces } inside\" should be fine."));
    }

    @Test
    @DisplayName("Should keep structures that do not match as text")
    void shouldKeepUnmatchedStructuresAsText() {
      List<String> lines = tokenEvents("see {\"other\":1}", "\n\n", "bye");

      StepVerifier.create(
              withoutTokens(
                  aggregator.aggregate(
                      Flux.fromIterable(lines), targetFactory.forType(Named.class))))
          .expectNext(StreamItem.text("see {\"other\":1}"))
          .expectNext(StreamItem.text("bye"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should emit nested data and keep the rest of its root with the following text")
    void shouldEmitNestedMatch() {
      List<String> lines = tokenEvents("{\"result\":", "{\"name\":\"x\"}", "} Then more.");

      StepVerifier.create(
              withoutTokens(
                  aggregator.aggregate(
                      Flux.fromIterable(lines), targetFactory.forType(Named.class))))
          .expectNext(StreamItem.text("{\"result\":"))
          .expectNext(StreamItem.data(new Named("x"), "{\"name\":\"x\"}"))
          .expectNext(StreamItem.text("} Then more."))
          .verifyComplete();
    }
  }

  @Nested
  @DisplayName("Flush triggers")
  class FlushTriggers {

    @Test
    @DisplayName("Should flush buffered text when the completion marker arrives")
    void shouldFlushOnFinishReason() {
      List<String> lines = tokenEvents("partial answer");
      lines.add("data: {\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"stop\"}]}");
      lines.add("");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("partial answer"))
          .expectNext(StreamItem.text("partial answer"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should emit a token before flushing on a completion marker in the same event")
    void shouldFlushAfterTokenInCompletionEvent() {
      List<String> lines = tokenEvents("first ");
      lines.add(
          "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"last words\"},"
              + "\"finish_reason\":\"stop\"}]}");
      lines.add("");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("first "))
          .expectNext(StreamItem.token("last words"))
          .expectNext(StreamItem.text("first last words"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should not flush on a null completion marker but flush when lines end")
    void shouldFlushAtEndOfLines() {
      List<String> lines = tokenEvents("a", "b");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("a"))
          .expectNext(StreamItem.token("b"))
          .expectNext(StreamItem.text("ab"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should flush every paragraph contained in one token")
    void shouldFlushEveryParagraph() {
      List<String> lines = tokenEvents("one\n\ntwo\n\nthree");

      StepVerifier.create(
              withoutTokens(
                  aggregator.aggregate(
                      Flux.fromIterable(lines), targetFactory.forType(Named.class))))
          .expectNext(StreamItem.text("one"))
          .expectNext(StreamItem.text("two"))
          .expectNext(StreamItem.text("three"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should stop reading lines at the terminal sentinel")
    void shouldStopAtSentinel() {
      List<String> lines = tokenEvents("hello");
      lines.add(DONE);
      lines.add("");
      lines.addAll(tokenEvent("ignored"));
      Flux<String> source =
          Flux.concat(
              Flux.fromIterable(lines),
              Flux.error(new IllegalStateException("read past the sentinel")));

      StepVerifier.create(aggregator.aggregate(source, targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("hello"))
          .expectNext(StreamItem.text("hello"))
          .verifyComplete();
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    private byte[] sseBytes(String... tokens) {
      StringBuilder sse = new StringBuilder();
      for (String line : tokenEvents(tokens)) {
        sse.append(line).append('\n');
      }
      return sse.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should fail on invalid UTF-8 after delivering earlier items")
    void shouldFailOnInvalidBytes() {
      byte[] good = sseBytes("Intro", "\n\n", "{\"name\":\"x\"}", " pending");
      byte[] bad = {(byte) 0xC3, 0x28, '\n', '\n'};

      StepVerifier.create(
              aggregator.aggregateBytes(Flux.just(good, bad), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("Intro"))
          .expectNext(StreamItem.token("\n\n"))
          .expectNext(StreamItem.text("Intro"))
          .expectNext(StreamItem.token("{\"name\":\"x\"}"))
          .expectNext(StreamItem.data(new Named("x"), "{\"name\":\"x\"}"))
          .expectNext(StreamItem.token(" pending"))
          .expectErrorSatisfies(
              error -> {
                assertThat(error).isInstanceOf(StreamDecodingException.class);
                assertThat(((StreamDecodingException) error).getByteOffset())
                    .isEqualTo(good.length);
              })
          .verify();
    }

    @Test
    @DisplayName("Should propagate an upstream line error without flushing buffered text")
    void shouldPropagateLineSourceError() {
      Flux<String> source =
          Flux.concat(
              Flux.fromIterable(tokenEvents("partial")),
              Flux.error(new IllegalStateException("connection reset")));

      StepVerifier.create(aggregator.aggregate(source, targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("partial"))
          .expectErrorSatisfies(
              error ->
                  assertThat(error)
                      .isInstanceOf(IllegalStateException.class)
                      .hasMessage("connection reset"))
          .verify();
    }

    @Test
    @DisplayName("Should propagate an upstream byte error without flushing buffered text")
    void shouldPropagateByteSourceError() {
      Flux<byte[]> source =
          Flux.concat(
              Flux.just(sseBytes("partial")),
              Flux.error(new IllegalStateException("connection reset")));

      StepVerifier.create(aggregator.aggregateBytes(source, targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("partial"))
          .expectErrorSatisfies(
              error ->
                  assertThat(error)
                      .isInstanceOf(IllegalStateException.class)
                      .hasMessage("connection reset"))
          .verify();
    }
  }

  @Nested
  @DisplayName("Protocol framing")
  class ProtocolFraming {

    @Test
    @DisplayName("Should skip events whose payload is not JSON")
    void shouldSkipUnparseablePayload() {
      List<String> lines = new ArrayList<>(List.of("data: {not json", ""));
      lines.addAll(tokenEvent("ok"));

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("ok"))
          .expectNext(StreamItem.text("ok"))
          .verifyComplete();

      assertThat(meterRegistry.counter("semantic.events.skipped").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("semantic.events").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should ignore comment and field lines and join multi-line data")
    void shouldHandleFieldLinesAndMultiLineData() {
      List<String> lines =
          List.of(
              ": keep-alive",
              "",
              "event: message",
              "id: 7",
              "data: {\"choices\":",
              "data:[{\"delta\":{\"content\":\"joined\"}}]}",
              "");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("joined"))
          .expectNext(StreamItem.text("joined"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should read token and completion fields from configured locations")
    void shouldUseConfiguredPointers() {
      config.getEventProtocol().setTokenPointer("/text");
      config.getEventProtocol().setFinishPointer("/stop");
      config.getEventProtocol().setDoneSentinel("END");
      List<String> lines =
          List.of(
              "data: {\"text\":\"hi there\"}",
              "",
              "data: {\"stop\":true}",
              "",
              "data: END",
              "",
              "data: {\"text\":\"late\"}",
              "");

      StepVerifier.create(
              aggregator.aggregate(Flux.fromIterable(lines), targetFactory.forType(Named.class)))
          .expectNext(StreamItem.token("hi there"))
          .expectNext(StreamItem.text("hi there"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should decode CRLF-framed bytes split at arbitrary points")
    void shouldAggregateBytes() {
      StringBuilder sse = new StringBuilder();
      for (String line : tokenEvents("Café ", "{\"name\":\"ñ\"}", " done")) {
        sse.append(line).append("\r\n");
      }
      sse.append(DONE).append("\r\n\r\n");
      byte[] bytes = sse.toString().getBytes(StandardCharsets.UTF_8);
      List<byte[]> chunks = new ArrayList<>();
      for (int i = 0; i < bytes.length; i += 5) {
        chunks.add(Arrays.copyOfRange(bytes, i, Math.min(bytes.length, i + 5)));
      }

      StepVerifier.create(
              withoutTokens(
                  aggregator.aggregateBytes(
                      Flux.fromIterable(chunks), targetFactory.forType(Named.class))))
          .expectNext(StreamItem.text("Café"))
          .expectNext(StreamItem.data(new Named("ñ"), "{\"name\":\"ñ\"}"))
          .expectNext(StreamItem.text("done"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should aggregate a recorded chat-completion stream")
    void shouldAggregateRecordedStream() throws Exception {
      byte[] bytes;
      try (InputStream in =
          getClass().getResourceAsStream("/fixtures/chat-completion-stream.txt")) {
        assertThat(in).isNotNull();
        bytes = in.readAllBytes();
      }

      List<StreamItem<Weather>> items =
          aggregator
              .aggregateBytes(Flux.just(bytes), targetFactory.forType(Weather.class))
              .collectList()
              .block();

      assertThat(items).filteredOn(item -> item instanceof StreamItem.Token).hasSize(8);
      assertThat(items)
          .filteredOn(item -> !(item instanceof StreamItem.Token))
          .containsExactly(
              StreamItem.text("Here is the weather:"),
              StreamItem.data(new Weather("Paris", 21), "{\"city\":\"Paris\",\"tempC\":21}"),
              StreamItem.text("Enjoy!"));
    }
  }

  @Test
  @DisplayName("LineFeed should report completion after the sentinel")
  void lineFeedShouldTrackCompletion() {
    EventProtocolAggregator.LineFeed<Named> feed =
        aggregator.open(targetFactory.forType(Named.class));

    assertThat(feed.line("data: {\"choices\":[{\"delta\":{\"content\":\"x\"}}]}")).isEmpty();
    assertThat(feed.line("")).containsExactly(StreamItem.token("x"));
    assertThat(feed.isDone()).isFalse();

    feed.line(DONE);
    assertThat(feed.line("")).containsExactly(StreamItem.text("x"));
    assertThat(feed.isDone()).isTrue();
    assertThat(feed.end()).isEmpty();
  }
}
