package com.flamingo.ai.doctranslator;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doctranslator.service.extraction.PageExtractor;
import com.flamingo.ai.doctranslator.service.extraction.VisionExtractor;
import com.flamingo.ai.doctranslator.service.history.TranslationHistoryService;
import com.flamingo.ai.doctranslator.service.pipeline.DocumentTranslationPipeline;
import com.flamingo.ai.doctranslator.service.progress.ProgressTracker;
import com.flamingo.ai.doctranslator.service.translation.ChunkTranslator;
import com.flamingo.ai.doctranslator.service.translation.TextTranslator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads. Model clients are mocked so the test needs no API
 * keys.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private VisionExtractor visionExtractor;
  @MockitoBean private TextTranslator textTranslator;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(PageExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkTranslator.class)).isNotNull();
    assertThat(applicationContext.getBean(ProgressTracker.class)).isNotNull();
    assertThat(applicationContext.getBean(TranslationHistoryService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentTranslationPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean("pageTranslationExecutor")).isNotNull();
  }
}
