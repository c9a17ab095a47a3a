package clitics;

/**
 * Main clause (HV, hlavní věta) or dependent clause (VV, vedlejší věta).
 */
public enum ClauseType {
  MAIN("HV"),
  DEPENDENT("VV"),
  NONE("_");

  private final String label;

  ClauseType(String label) {
    this.label = label;
  }

  public String label() { return label; }

  public String toString() { return label; }
}
