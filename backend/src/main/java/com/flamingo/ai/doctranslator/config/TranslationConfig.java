package com.flamingo.ai.doctranslator.config;

import com.flamingo.ai.doctranslator.service.chunking.ChunkingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the translation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "translation")
@Validated
@Getter
@Setter
public class TranslationConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Extraction extraction = new Extraction();
  @Valid private Retry retry = new Retry();
  @Valid private Pipeline pipeline = new Pipeline();
  @Valid private Models models = new Models();

  /** How page markup is cut into chunks before translation. */
  @Getter
  @Setter
  public static class Chunking {
    @NotNull private ChunkingMode mode = ChunkingMode.SENTENCE;

    /** Maximum chunk size in characters. */
    @Min(1)
    private int maxSize = 2500;

    /** Per target language overrides of {@link #maxSize}, keyed by lower-case language name. */
    private Map<String, Integer> languageMaxSize = new HashMap<>();

    /** Resolves the chunk size for a target language. */
    public int maxSizeFor(String language) {
      if (language == null) {
        return maxSize;
      }
      return languageMaxSize.getOrDefault(language.toLowerCase(Locale.ROOT), maxSize);
    }
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Minimum length of the model's own markup, before styles are added. */
    @Min(1)
    private int minLength = 50;

    @NotBlank private String imageMimeType = "image/png";
  }

  /** Chunk translation retry settings. */
  @Getter
  @Setter
  public static class Retry {
    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(2);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @Min(1)
    private int minOutputLength = 1;
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** Number of pages translated in parallel. Bounded by provider rate limits. */
    @Min(1)
    private int concurrency = 4;

    @Min(1)
    private int queueCapacity = 1000;
  }

  @Getter
  @Setter
  public static class Models {
    @Valid private Model vision = Model.of("openai", "gpt-4o", Duration.ofSeconds(120));
    @Valid
    private Model text =
        Model.of("anthropic", "claude-3-5-sonnet-20241022", Duration.ofSeconds(120));
  }

  /** Connection settings of a single chat model. */
  @Getter
  @Setter
  public static class Model {
    /** {@code openai} or {@code anthropic}. */
    @NotBlank private String provider;

    private String apiKey;
    private String baseUrl;
    @NotBlank private String modelName;
    private double temperature = 0.0;

    @Min(1)
    private int maxTokens = 4096;

    @NotNull private Duration timeout;

    static Model of(String provider, String modelName, Duration timeout) {
      Model model = new Model();
      model.setProvider(provider);
      model.setModelName(modelName);
      model.setTimeout(timeout);
      return model;
    }

    public boolean hasApiKey() {
      return apiKey != null && !apiKey.isBlank();
    }
  }
}
