package clitics;

/**
 * How the clitic group stands relative to its governing predicate.
 */
public enum RegentRelation {
  /** Group directly before the predicate. */
  CONTACT_PREVERBAL("kontaktní preverbální"),
  /** Group directly after the predicate. */
  CONTACT_POSTVERBAL("kontaktní postverbální"),
  /** Group wedged between two members of the complex predicate. */
  CONTACT_INTERVERBAL("kontaktní interverbální"),
  /** Group before the predicate, with other words in between. */
  ISOLATED("izolovaná"),
  OTHER("jiné"),
  NONE("_");

  private final String label;

  RegentRelation(String label) {
    this.label = label;
  }

  public String label() { return label; }

  public String toString() { return label; }
}
