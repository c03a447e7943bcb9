package com.flamingo.ai.doctranslator.service.translation;

/** Text generation model used for chunk translation. */
@FunctionalInterface
public interface TextTranslator {

  String generate(String systemPrompt, String userPrompt);
}
