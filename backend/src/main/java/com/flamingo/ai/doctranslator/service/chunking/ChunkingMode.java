package com.flamingo.ai.doctranslator.service.chunking;

/** Sentence boundary detection used by {@link ChunkSplitter}. */
public enum ChunkingMode {
  /** Every ". " is a boundary. */
  SENTENCE,

  /** Like {@link #SENTENCE}, but a ". " inside a tag is not a boundary. */
  MARKUP_AWARE
}
