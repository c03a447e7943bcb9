package com.flamingo.ai.doctranslator.service.assembly;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentAssemblerTest {

  private final DocumentAssembler assembler = new DocumentAssembler();

  @Test
  void shouldWrapEachPageAndTheDocument() {
    String document = assembler.combine(List.of("<p>A</p>", "<html><body><p>B</p></body></html>"));

    assertThat(document)
        .isEqualTo(
            "<div class='document'>\n"
                + "<div class='page'>\n<p>A</p>\n</div>\n"
                + "<div class='page'>\n<p>B</p>\n</div>\n"
                + "</div>");
  }

  @Test
  void shouldRemoveHeadTagsCaseInsensitively_butKeepHeaderElements() {
    String document =
        assembler.combine(
            List.of("<HTML lang=\"en\"><Head></Head><BODY><header>Top</header></BODY></HTML>"));

    assertThat(document)
        .isEqualTo(
            "<div class='document'>\n<div class='page'>\n<header>Top</header>\n</div>\n</div>");
  }

  @Test
  void shouldProduceEmptyDocument_whenNoPages() {
    assertThat(assembler.combine(List.of())).isEqualTo("<div class='document'>\n</div>");
  }
}
