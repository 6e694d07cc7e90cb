package ca.gc.cra.logkit.logging;

/**
 * <strong>What:</strong> Coarse operating profiles that drive default logging verbosity.
 * <p><strong>Why:</strong> Operators pick a profile rather than a level; the profile decides both the floor and
 * the renderer.</p>
 * <p><strong>Role:</strong> Configuration enum produced by {@link ModeResolver#parseMode(String)}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 * @see ModeResolver
 */
public enum Mode {
  /** Local development: verbose, human-oriented output. */
  DEVELOPMENT("dev"),
  /** Production: machine-readable output at info and above. */
  PRODUCTION("prod");

  private final String value;

  Mode(String value) {
    this.value = value;
  }

  /**
   * Returns the configuration literal for this mode.
   *
   * @return {@code "dev"} or {@code "prod"}
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
