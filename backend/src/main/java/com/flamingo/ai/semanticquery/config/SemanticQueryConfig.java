package com.flamingo.ai.semanticquery.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for structured extraction from streamed text. */
@Configuration
@ConfigurationProperties(prefix = "semantic-query")
@Getter
@Setter
public class SemanticQueryConfig {

  private Streaming streaming = new Streaming();
  private EventProtocol eventProtocol = new EventProtocol();
  private Extraction extraction = new Extraction();

  @Getter
  @Setter
  public static class Streaming {
    /** Size of each read from a blocking byte source. Values below 1024 are raised to 1024. */
    private int readBufferSize = 4096;
  }

  /**
   * Wire settings of the line-delimited event protocol. Defaults match the OpenAI-compatible
   * chat-completions stream.
   */
  @Getter
  @Setter
  public static class EventProtocol {
    private String dataPrefix = "data: ";
    private String doneSentinel = "[DONE]";

    /** JSON Pointer of the incremental token text inside each event payload. */
    private String tokenPointer = "/choices/0/delta/content";

    /** JSON Pointer of the natural-completion marker; a non-null value triggers a flush. */
    private String finishPointer = "/choices/0/finish_reason";

    private String paragraphDelimiter = "\n\n";
  }

  /** Strictness of the deserializer used when trying structures against a target type. */
  @Getter
  @Setter
  public static class Extraction {
    private boolean failOnUnknownProperties = false;
    private boolean failOnMissingProperties = true;
    private boolean failOnNullForPrimitives = true;
  }
}
