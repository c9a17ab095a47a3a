package clitics;

/**
 * Where the clitic group stands among the units of its clause.
 */
public enum ClausePosition {
  INITIAL("iniciální"),
  POST_INITIAL("postiniciální"),
  MEDIAL("mediální"),
  PRE_FINAL("prefinální"),
  FINAL("finální"),
  NONE("_");

  private final String label;

  ClausePosition(String label) {
    this.label = label;
  }

  public String label() { return label; }

  public String toString() { return label; }
}
