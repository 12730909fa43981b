package com.flamingo.ai.semanticquery.service;

import com.flamingo.ai.semanticquery.extract.JsonTarget;
import com.flamingo.ai.semanticquery.stream.ParsedResponse;
import com.flamingo.ai.semanticquery.stream.StreamItem;
import dev.langchain4j.data.message.ChatMessage;
import java.util.List;
import reactor.core.publisher.Flux;

/**
 * Queries a language model and returns its answer as ordered text and typed data.
 *
 * <p>Model answers mix commentary with JSON. Every method keeps the commentary and extracts the
 * structures that fit the requested target type.
 */
public interface StructuredQueryService {

  /**
   * Asks the model and returns the full answer as text and data items.
   *
   * @param prompt the user prompt
   * @param target the type to extract
   * @return the parsed answer; may contain no data
   */
  <T> ParsedResponse<T> queryMixed(String prompt, JsonTarget<T> target);

  /**
   * Like {@link #queryMixed} but requires at least one data item.
   *
   * @throws com.flamingo.ai.semanticquery.exception.NoMatchingDataException if none was found
   */
  <T> ParsedResponse<T> queryExtractFirst(String prompt, JsonTarget<T> target);

  /** Returns only the first data item of the answer. */
  <T> T queryFirst(String prompt, JsonTarget<T> target);

  /**
   * Returns every instance of the target in the answer, flattening arrays of the target.
   *
   * @param prompt the user prompt
   * @param target the element type
   * @return all instances in answer order
   */
  <T> List<T> queryExtractAll(String prompt, JsonTarget<T> target);

  /**
   * Streams the answer: each token as it arrives, followed by the text and data items it
   * completes.
   *
   * @param messages the conversation to send
   * @param target the type to extract
   * @return a lazy item stream; model failures end it with an error
   */
  <T> Flux<StreamItem<T>> streamStructured(List<ChatMessage> messages, JsonTarget<T> target);
}
