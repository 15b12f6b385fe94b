package se.alipsa.sqlseries;

import java.util.Objects;

/**
 * Replacement for the join condition a {@link SeriesRange} uses by default.
 */
public sealed interface JoinOverride permits JoinOverride.UseDefault, JoinOverride.Clause {

  /**
   * No override; the range's default join condition applies.
   *
   * @return the default marker
   */
  static JoinOverride useDefault() {
    return UseDefault.INSTANCE;
  }

  /**
   * Override the join condition with a raw clause.
   *
   * @param clause
   *          the clause, either a complete boolean expression or a single
   *          equality whose sides are truncated to the series precision
   * @return the override
   */
  static JoinOverride clause(TrustedSql clause) {
    return new Clause(clause);
  }

  /**
   * Override the join condition with a raw clause.
   *
   * @param clause
   *          the clause text, not {@code null}
   * @return the override
   */
  static JoinOverride clause(String clause) {
    return new Clause(TrustedSql.of(clause));
  }

  /**
   * Map a loosely typed argument to an override. Strings become a
   * {@link Clause}; anything else, {@code null} included, means "use the
   * default".
   *
   * @param argument
   *          the argument, may be {@code null}
   * @return the corresponding override
   */
  static JoinOverride of(Object argument) {
    if (argument instanceof JoinOverride override) {
      return override;
    }
    if (argument instanceof TrustedSql sql) {
      return clause(sql);
    }
    if (argument instanceof String text) {
      return clause(text);
    }
    return useDefault();
  }

  /**
   * Marker for "no override".
   */
  enum UseDefault implements JoinOverride {
    INSTANCE
  }

  /**
   * A raw override clause.
   *
   * @param sql
   *          the clause
   */
  record Clause(TrustedSql sql) implements JoinOverride {

    /**
     * Canonical constructor.
     *
     * @param sql
     *          the clause, not {@code null}
     */
    public Clause {
      Objects.requireNonNull(sql, "sql");
    }
  }
}
