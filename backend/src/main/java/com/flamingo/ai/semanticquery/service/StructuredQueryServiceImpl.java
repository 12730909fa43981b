package com.flamingo.ai.semanticquery.service;

import com.flamingo.ai.semanticquery.exception.LlmServiceException;
import com.flamingo.ai.semanticquery.exception.NoMatchingDataException;
import com.flamingo.ai.semanticquery.extract.JsonTarget;
import com.flamingo.ai.semanticquery.extract.TypedExtractor;
import com.flamingo.ai.semanticquery.stream.ItemStreamReconciler;
import com.flamingo.ai.semanticquery.stream.ParsedResponse;
import com.flamingo.ai.semanticquery.stream.StreamItem;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Implementation of StructuredQueryService on top of LangChain4j chat models. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredQueryServiceImpl implements StructuredQueryService {

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;
  private final ItemStreamReconciler reconciler;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "semantic.query.mixed", description = "Time to answer a mixed-content query")
  public <T> ParsedResponse<T> queryMixed(String prompt, JsonTarget<T> target) {
    log.info(
        "Starting mixed content query for {} (prompt length {})",
        target.typeName(),
        prompt.length());

    String raw = ask(prompt);
    ParsedResponse<T> response = new ParsedResponse<>(reconciler.reconcile(raw, target));

    log.info(
        "Mixed content query completed: {} data item(s), {} item(s) total",
        response.dataCount(),
        response.items().size());
    return response;
  }

  @Override
  @Timed(
      value = "semantic.query.extract_first",
      description = "Time to answer a query that requires data")
  public <T> ParsedResponse<T> queryExtractFirst(String prompt, JsonTarget<T> target) {
    ParsedResponse<T> response = queryMixed(prompt, target);
    if (!response.hasData()) {
      log.warn(
          "No {} found in response of {} chars",
          target.typeName(),
          response.textContent().length());
      meterRegistry.counter("semantic.query.no_data").increment();
      throw new NoMatchingDataException(target.typeName(), response.textContent());
    }
    return response;
  }

  @Override
  @Timed(value = "semantic.query.first", description = "Time to extract the first value")
  public <T> T queryFirst(String prompt, JsonTarget<T> target) {
    return queryExtractFirst(prompt, target).dataOnly().get(0);
  }

  @Override
  @Timed(value = "semantic.query.extract_all", description = "Time to extract all instances")
  public <T> List<T> queryExtractAll(String prompt, JsonTarget<T> target) {
    String raw = ask(prompt);
    List<T> values = new TypedExtractor<>(target).extractInstances(raw);
    log.info("Extracted {} instance(s) of {}", values.size(), target.typeName());
    return values;
  }

  @Override
  public <T> Flux<StreamItem<T>> streamStructured(
      List<ChatMessage> messages, JsonTarget<T> target) {
    Flux<String> tokens =
        Flux.defer(
            () -> {
              Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
              AtomicInteger tokenCount = new AtomicInteger(0);

              log.debug(
                  "Starting structured stream for {} with {} message(s)",
                  target.typeName(),
                  messages.size());
              streamingChatModel.chat(
                  messages,
                  new StreamingChatResponseHandler() {
                    @Override
                    public void onPartialResponse(String token) {
                      tokenCount.incrementAndGet();
                      Sinks.EmitResult result = sink.tryEmitNext(token);
                      if (result.isFailure()) {
                        log.warn("Failed to emit token: {}", result);
                      }
                    }

                    @Override
                    public void onCompleteResponse(ChatResponse response) {
                      log.debug("Model stream completed after {} token(s)", tokenCount.get());
                      meterRegistry.counter("semantic.stream.tokens").increment(tokenCount.get());
                      sink.tryEmitComplete();
                    }

                    @Override
                    public void onError(Throwable error) {
                      log.error("Error during model streaming: {}", error.getMessage(), error);
                      meterRegistry.counter("semantic.stream.errors").increment();
                      sink.tryEmitError(
                          new LlmServiceException("Model stream failed", error, true));
                    }
                  });
              return sink.asFlux();
            });
    return reconciler.streamTokens(tokens, target);
  }

  private String ask(String prompt) {
    try {
      return chatModel.chat(prompt);
    } catch (RuntimeException e) {
      meterRegistry.counter("semantic.query.errors").increment();
      throw new LlmServiceException("Model call failed: " + e.getMessage(), e);
    }
  }
}
