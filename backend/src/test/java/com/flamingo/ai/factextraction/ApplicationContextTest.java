package com.flamingo.ai.factextraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.llm.LlmClient;
import com.flamingo.ai.factextraction.service.orchestration.FactExtractionService;
import com.flamingo.ai.factextraction.service.orchestration.TextFactExtractor;
import dev.langchain4j.model.chat.ChatModel;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies that the application context loads with the LLM mocked out, and that the pipeline
 * beans are wired with their configuration.
 */
@SpringBootTest(properties = "langchain4j.openai.api-key=test-key")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Autowired private FactExtractionConfig config;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(FactExtractionService.class)).isNotNull();
    assertThat(applicationContext.getBean(TextFactExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean("factExtractionExecutor", Executor.class)).isNotNull();
  }

  @Test
  @DisplayName("LLM client should be proxied for the bulkhead and timer")
  void llmClientShouldBeProxied() {
    assertThat(AopUtils.isAopProxy(applicationContext.getBean(LlmClient.class))).isTrue();
  }

  @Test
  @DisplayName("Configuration defaults should be bound from application.yml")
  void configurationShouldBeBound() {
    assertThat(config.getChunking().getMaxChars()).isEqualTo(3000);
    assertThat(config.getExtraction().getScope()).isEqualTo("memory_extract_facts");
    assertThat(config.getOrdering().getSecondsPerFact()).isEqualTo(10);
    assertThat(config.getAutoSplit().getMinChunkChars()).isEqualTo(200);
  }
}
