package ca.gc.cra.logdrop.domain.template;

/**
 * Syntax violations reported by {@link TemplateParser}.
 *
 * @since 0.1.0
 */
public enum TemplateSyntaxError {
  EOF_WHILE_PARSING_PLACEHOLDER("unexpected end while parsing placeholder");

  private final String description;

  TemplateSyntaxError(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
