package se.alipsa.sqlseries;

import java.util.Objects;

/**
 * A raw SQL fragment supplied by the developer.
 *
 * <p>
 * The text is spliced into the generated SQL without escaping or
 * parameterization. Never build a {@code TrustedSql} from end user input.
 * </p>
 *
 * @param text
 *          the fragment text, not {@code null}
 */
public record TrustedSql(String text) {

  /**
   * Canonical constructor.
   *
   * @param text
   *          the fragment text, not {@code null}
   */
  public TrustedSql {
    Objects.requireNonNull(text, "text");
  }

  /**
   * Wrap a fragment.
   *
   * @param text
   *          the fragment text, not {@code null}
   * @return the trusted fragment
   */
  public static TrustedSql of(String text) {
    return new TrustedSql(text);
  }

  @Override
  public String toString() {
    return text;
  }
}
