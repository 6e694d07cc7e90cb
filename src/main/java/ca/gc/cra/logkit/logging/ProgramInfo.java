package ca.gc.cra.logkit.logging;

/**
 * Static process metadata attached to every record under the {@code program_info} group.
 *
 * @param javaVersion runtime version, or {@code "unknown"}
 * @param version artifact implementation version from the jar manifest, or {@code "unknown"}
 * @since 0.1.0
 */
record ProgramInfo(String javaVersion, String version) {
  static final String GROUP_KEY = "program_info";
  static final String UNKNOWN = "unknown";

  /**
   * Reads metadata from the running JVM; missing values become {@code "unknown"}.
   *
   * @return detected metadata
   */
  static ProgramInfo detect() {
    Package pkg = ProgramInfo.class.getPackage();
    String implementationVersion = pkg == null ? null : pkg.getImplementationVersion();
    return new ProgramInfo(
        orUnknown(System.getProperty("java.version")), orUnknown(implementationVersion));
  }

  /**
   * Renders the metadata as the permanent {@code program_info} group.
   *
   * @return group attribute
   */
  Attribute toAttribute() {
    return Attribute.group(
        GROUP_KEY,
        Attribute.string("java_version", javaVersion),
        Attribute.string("version", version));
  }

  private static String orUnknown(String value) {
    return value == null || value.isBlank() ? UNKNOWN : value;
  }
}
