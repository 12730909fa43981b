package com.flamingo.ai.semanticquery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.semanticquery.config.SemanticQueryConfig;
import com.flamingo.ai.semanticquery.event.EventProtocolAggregator;
import com.flamingo.ai.semanticquery.extract.JsonTargetFactory;
import com.flamingo.ai.semanticquery.service.StructuredQueryService;
import com.flamingo.ai.semanticquery.stream.ItemStreamReconciler;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads with the model beans mocked, so the test runs
 * without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private StreamingChatModel streamingChatModel;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private StructuredQueryService queryService;
  @Autowired private JsonTargetFactory targetFactory;
  @Autowired private MeterRegistry meterRegistry;

  record Reading(String name, int value) {}

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(StructuredQueryService.class)).isNotNull();
    assertThat(applicationContext.getBean(ItemStreamReconciler.class)).isNotNull();
    assertThat(applicationContext.getBean(EventProtocolAggregator.class)).isNotNull();
    assertThat(applicationContext.getBean(JsonTargetFactory.class)).isNotNull();
  }

  @Test
  @DisplayName("Event protocol defaults should bind from application.yml")
  void eventProtocolDefaultsShouldBind() {
    SemanticQueryConfig config = applicationContext.getBean(SemanticQueryConfig.class);

    assertThat(config.getEventProtocol().getDataPrefix()).isEqualTo("data: ");
    assertThat(config.getEventProtocol().getDoneSentinel()).isEqualTo("[DONE]");
    assertThat(config.getEventProtocol().getParagraphDelimiter()).isEqualTo("\n\n");
    assertThat(config.getStreaming().getReadBufferSize()).isEqualTo(4096);
  }

  @Test
  @DisplayName("Every blocking query entry point should record its own timer")
  void queryEntryPointsShouldBeTimed() {
    when(chatModel.chat(anyString())).thenReturn("Result: {\"name\":\"a\",\"value\":1}");

    queryService.queryFirst("first", targetFactory.forType(Reading.class));
    queryService.queryExtractFirst("extract", targetFactory.forType(Reading.class));

    Timer first = meterRegistry.find("semantic.query.first").timer();
    Timer extractFirst = meterRegistry.find("semantic.query.extract_first").timer();
    assertThat(first).isNotNull();
    assertThat(first.count()).isEqualTo(1);
    assertThat(extractFirst).isNotNull();
    assertThat(extractFirst.count()).isEqualTo(1);
  }
}
