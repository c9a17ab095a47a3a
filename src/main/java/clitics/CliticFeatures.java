package clitics;

import edu.stanford.nlp.util.StringUtils;


/**
 * One output row: the features of a single clitic token.
 */
public class CliticFeatures {
  public static final String[] COLUMNS = {
    "sent_id", "ord", "predicate_form", "clause_type", "clause_position", "relation_to_regent"
  };

  private final String sentId;
  private final int ord;
  private final String predicateForm;
  private final ClauseType clauseType;
  private final ClausePosition clausePosition;
  private final RegentRelation relationToRegent;


  public CliticFeatures(String sentId, int ord, String predicateForm, ClauseType clauseType,
                        ClausePosition clausePosition, RegentRelation relationToRegent) {
    this.sentId = sentId;
    this.ord = ord;
    this.predicateForm = predicateForm;
    this.clauseType = clauseType;
    this.clausePosition = clausePosition;
    this.relationToRegent = relationToRegent;
  }

  public static String header() {
    return StringUtils.join(COLUMNS, "\t");
  }

  public String getSentId() { return sentId; }
  public int getOrd() { return ord; }
  public String getPredicateForm() { return predicateForm; }
  public ClauseType getClauseType() { return clauseType; }
  public ClausePosition getClausePosition() { return clausePosition; }
  public RegentRelation getRelationToRegent() { return relationToRegent; }

  public String toTsv() {
    String[] values = { sentId, String.valueOf(ord), predicateForm, clauseType.label(),
                        clausePosition.label(), relationToRegent.label() };
    return StringUtils.join(values, "\t");
  }

  public String toString() {
    return toTsv();
  }
}
