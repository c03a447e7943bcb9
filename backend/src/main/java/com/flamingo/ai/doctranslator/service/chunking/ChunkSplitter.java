package com.flamingo.ai.doctranslator.service.chunking;

import com.flamingo.ai.doctranslator.config.TranslationConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits page markup into chunks that fit a single translation request.
 *
 * <p>Chunks are built from whole sentences. Joining the returned chunks with {@link
 * #CHUNK_SEPARATOR} gives back the input exactly. A sentence longer than the limit becomes a
 * chunk of its own and is never cut.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkSplitter {

  /** Separator that reconstructs the input from its chunks. */
  public static final String CHUNK_SEPARATOR = " ";

  private static final String SENTENCE_BOUNDARY = ". ";

  private final TranslationConfig translationConfig;

  /** Splits using the configured default mode. */
  public List<String> split(String text, int maxSize) {
    return split(text, maxSize, translationConfig.getChunking().getMode());
  }

  public List<String> split(String text, int maxSize, ChunkingMode mode) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
    }
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    List<String> sentences =
        mode == ChunkingMode.MARKUP_AWARE ? sentencesOutsideTags(text) : sentences(text);

    List<String> chunks = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    boolean bufferStarted = false;
    for (String sentence : sentences) {
      if (bufferStarted) {
        if (buffer.length() + CHUNK_SEPARATOR.length() + sentence.length() > maxSize) {
          chunks.add(buffer.toString());
          buffer.setLength(0);
        } else {
          buffer.append(CHUNK_SEPARATOR);
        }
      }
      buffer.append(sentence);
      bufferStarted = true;
    }
    chunks.add(buffer.toString());

    log.debug(
        "Split {} chars into {} chunks (maxSize={}, mode={})",
        text.length(),
        chunks.size(),
        maxSize,
        mode);
    return chunks;
  }

  private List<String> sentences(String text) {
    String[] parts = text.split(Pattern.quote(SENTENCE_BOUNDARY), -1);
    List<String> sentences = new ArrayList<>(parts.length);
    for (int i = 0; i < parts.length; i++) {
      sentences.add(i < parts.length - 1 ? parts[i] + "." : parts[i]);
    }
    return sentences;
  }

  private List<String> sentencesOutsideTags(String text) {
    List<String> sentences = new ArrayList<>();
    boolean insideTag = false;
    int sentenceStart = 0;
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (!insideTag && c == '<' && opensTag(text, i)) {
        insideTag = true;
      } else if (insideTag && c == '>') {
        insideTag = false;
      } else if (!insideTag && text.startsWith(SENTENCE_BOUNDARY, i)) {
        sentences.add(text.substring(sentenceStart, i + 1));
        i += SENTENCE_BOUNDARY.length();
        sentenceStart = i;
        continue;
      }
      i++;
    }
    sentences.add(text.substring(sentenceStart));
    return sentences;
  }

  /** A {@code <} starts a tag only when followed by a letter, {@code /} or {@code !}. */
  private static boolean opensTag(String text, int index) {
    if (index + 1 >= text.length()) {
      return false;
    }
    char next = text.charAt(index + 1);
    return Character.isLetter(next) || next == '/' || next == '!';
  }
}
