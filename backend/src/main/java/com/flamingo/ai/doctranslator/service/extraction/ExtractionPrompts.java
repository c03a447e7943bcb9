package com.flamingo.ai.doctranslator.service.extraction;

/** Fixed instruction and stylesheet used when turning a page image into markup. */
public final class ExtractionPrompts {

  /** Structure detection instruction sent with every page image. */
  public static final String STRUCTURE_DETECTION =
      """
      Convert this document page into well-formed HTML, detecting its structure.

      1. Structure detection
         - Decide whether each region is tabular/columnar or flowing text.
         - Use tables only for genuinely tabular content with clear rows and columns.
         - Render form-like "label: value" content as flex rows without visible borders.
         - Render ordinary paragraphs as plain <p> elements, never inside a table.
         - Keep the page's spacing and reading order.

      2. Elements
         - Use semantic elements: <article>, <section>, <header>, <p>, <table>.
         - Use <h1> to <h6> for the heading hierarchy.
         - Borderless columns and forms:
           <div class="form-section">
             <div class="form-row">
               <div class="label">Name:</div>
               <div class="value">John Smith</div>
             </div>
           </div>
         - Tables with visible borders:
           <table class="data-table">
             <tr><th>Header 1</th><th>Header 2</th></tr>
             <tr><td>Data 1</td><td>Data 2</td></tr>
           </table>
         - Put section numbers such as 1.2.3 in an element with class "index".

      3. Classes
         - form-section for form-like content
         - data-table for true tables
         - text-content for flowing text
         - no-borders on any element that must not show borders

      Choose the most appropriate structure for each region. Return only valid HTML.
      """;

  /** Presentational rules for the classes named in {@link #STRUCTURE_DETECTION}. */
  public static final String PAGE_STYLES =
      """
      <style>
          .document { width: 100%; max-width: 1000px; margin: 0 auto;
                      font-family: Arial, sans-serif; line-height: 1.5; }
          .text-content { margin-bottom: 1em; }
          .form-section { margin-bottom: 1em; }
          .form-row { display: flex; gap: 1em; margin-bottom: 0.5em; }
          .label { width: 200px; flex-shrink: 0; }
          .value { flex-grow: 1; }
          .data-table { width: 100%; border-collapse: collapse; margin-bottom: 1em; }
          .data-table:not(.no-borders) td,
          .data-table:not(.no-borders) th { border: 1px solid black; padding: 0.5em; }
          .no-borders td,
          .no-borders th { border: none !important; }
          .header { text-align: right; margin-bottom: 20px; }
      </style>
      """;

  private ExtractionPrompts() {}
}
