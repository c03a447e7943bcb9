package com.flamingo.ai.doctranslator.service.extraction;

/** Vision-capable model that turns a page image into text. */
@FunctionalInterface
public interface VisionExtractor {

  /** Describes the page using the default structure detection instruction. */
  default String generate(byte[] imageBytes) {
    return generate(imageBytes, ExtractionPrompts.STRUCTURE_DETECTION);
  }

  String generate(byte[] imageBytes, String instruction);
}
