package clitics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import clitics.tree.DepNode;
import clitics.tree.Deprels;


/**
 * Rule-based features for a Czech clitic token (se, si) in a dependency tree:
 *
 *   predicate_form     - the complex predicate governing the clitic
 *   clause_type        - HV for a main clause, VV for a dependent clause
 *   clause_position    - where the clitic group stands in its clause
 *   relation_to_regent - where the clitic group stands relative to the predicate
 *
 * The predicate is always the clitic's parent.  Every upward walk keeps a
 * visited set, so parent cycles in broken input end the walk instead of
 * looping.  Nothing in the tree is modified.
 */
public class CliticAnalyzer {
  private final ClausePolicy _policy;


  public CliticAnalyzer() {
    this(ClausePolicy.defaults());
  }

  public CliticAnalyzer(ClausePolicy policy) {
    _policy = policy;
  }

  public ClausePolicy getPolicy() { return _policy; }

  /**
   * Features for every target clitic in the sentence, in token order.
   */
  public List<CliticFeatures> analyzeSentence(DepNode root) {
    List<CliticFeatures> found = new ArrayList<CliticFeatures>();
    for( DepNode node : root.descendants() ) {
      if( _policy.isTarget(node) )
        found.add(analyze(node));
    }
    return found;
  }

  /**
   * All four features for one clitic token.
   */
  public CliticFeatures analyze(DepNode clitic) {
    DepNode predicate = clitic.getParent();
    ComplexPredicate complex = complexPredicate(predicate);
    List<DepNode> group = cliticGroup(clitic, predicate);

    String sentId = clitic.getSentId();
    return new CliticFeatures(sentId == null ? "" : sentId,
                              clitic.getOrd(),
                              complex.form(),
                              clauseType(predicate),
                              clausePosition(predicate, group),
                              relationToRegent(predicate, group, complex));
  }

  public ComplexPredicate complexPredicate(DepNode predicate) {
    return ComplexPredicate.of(predicate, _policy);
  }

  /**
   * @return Forms of the complex predicate in sentence order, or "_".
   */
  public String predicateForm(DepNode predicate) {
    return complexPredicate(predicate).form();
  }

  /**
   * Walks up from the predicate until a relation decides the clause type:
   * root gives HV, a subordinating relation gives VV, reaching the top of
   * the tree gives HV.  xcomp is passed through unless the policy makes it
   * subordinating.  A cycle gives HV.
   */
  public ClauseType clauseType(DepNode predicate) {
    if( predicate == null || predicate.isRoot() )
      return ClauseType.NONE;

    Set<DepNode> visited = new HashSet<DepNode>();
    DepNode node = predicate;
    while( true ) {
      if( !visited.add(node) )
        return ClauseType.MAIN;

      String base = node.getBaseDeprel();
      if( base.equals(Deprels.ROOT) )
        return ClauseType.MAIN;
      if( _policy.isSubordinating(base) )
        return ClauseType.DEPENDENT;
      if( base.equals(Deprels.XCOMP) && !_policy.isXcompTransparent() )
        return ClauseType.DEPENDENT;
      if( !Deprels.hasRealParent(node) )
        return ClauseType.MAIN;
      node = node.getParent();
    }
  }

  /**
   * The top node of the predicate's clause: climbs from the predicate while
   * the current node is an xcomp of a real parent.
   *
   * @return The clause root, or null for a missing predicate or the virtual root.
   */
  public DepNode clauseRoot(DepNode predicate) {
    if( predicate == null || predicate.isRoot() )
      return null;
    if( !_policy.isXcompTransparent() )
      return predicate;

    Set<DepNode> visited = new HashSet<DepNode>();
    visited.add(predicate);
    DepNode node = predicate;
    while( node.getBaseDeprel().equals(Deprels.XCOMP) && Deprels.hasRealParent(node) ) {
      DepNode head = node.getParent();
      if( !visited.add(head) ) break;
      node = head;
    }
    return node;
  }

  /**
   * @return The clause root and everything below it, sorted by ord.  Empty if
   *         there is no clause root.
   */
  public List<DepNode> clauseNodes(DepNode predicate) {
    DepNode top = clauseRoot(predicate);
    if( top == null )
      return new ArrayList<DepNode>();
    return top.subtree();
  }

  /**
   * @return The clause tokens without punctuation, sorted by ord.
   */
  public List<DepNode> clauseWords(DepNode predicate) {
    List<DepNode> words = new ArrayList<DepNode>();
    for( DepNode node : clauseNodes(predicate) ) {
      if( !node.isPunct() ) words.add(node);
    }
    return words;
  }

  /**
   * The longest run of clitic tokens around the target in the clause's
   * non-punctuation sequence.  Falls back to the target alone if it is not
   * in its predicate's clause.
   *
   * @return Group tokens sorted by ord, always including the target.
   */
  public List<DepNode> cliticGroup(DepNode target, DepNode predicate) {
    List<DepNode> words = clauseWords(predicate);
    int index = words.indexOf(target);
    if( index < 0 )
      return Collections.singletonList(target);

    int start = index;
    while( start > 0 && _policy.isClitic(words.get(start-1)) )
      start--;
    int end = index;
    while( end < words.size()-1 && _policy.isClitic(words.get(end+1)) )
      end++;

    return new ArrayList<DepNode>(words.subList(start, end+1));
  }

  public ClauseUnits clauseUnits(DepNode predicate, List<DepNode> group) {
    return new ClauseUnits(clauseWords(predicate), group);
  }

  /**
   * First match wins: unit 0 is initial, unit 1 post-initial, the last unit
   * right after the predicate final, the unit right before a final predicate
   * pre-final, anything else medial.
   */
  public ClausePosition clausePosition(DepNode predicate, List<DepNode> group) {
    ClauseUnits units = clauseUnits(predicate, group);
    int g = units.groupIndex();
    if( g < 0 ) return ClausePosition.NONE;

    int last = units.size() - 1;
    if( g == 0 ) return ClausePosition.INITIAL;
    if( g == 1 ) return ClausePosition.POST_INITIAL;
    if( g == last && units.get(g-1) == predicate )
      return ClausePosition.FINAL;
    if( g == last-1 && units.get(g+1) == predicate )
      return ClausePosition.PRE_FINAL;
    return ClausePosition.MEDIAL;
  }

  public RegentRelation relationToRegent(DepNode predicate, List<DepNode> group) {
    return relationToRegent(predicate, group, complexPredicate(predicate));
  }

  /**
   * Adjacent before or after the predicate is contact; squeezed between two
   * members of the complex predicate is interverbal; otherwise isolated if the
   * group comes first, and other if it comes after.
   */
  public RegentRelation relationToRegent(DepNode predicate, List<DepNode> group, ComplexPredicate complex) {
    ClauseUnits units = clauseUnits(predicate, group);
    int g = units.groupIndex();
    int p = units.indexOf(predicate);
    if( g < 0 || p < 0 ) return RegentRelation.NONE;

    if( g + 1 == p ) return RegentRelation.CONTACT_PREVERBAL;
    if( g == p + 1 ) return RegentRelation.CONTACT_POSTVERBAL;
    if( complex.contains(units.get(g-1)) && complex.contains(units.get(g+1)) )
      return RegentRelation.CONTACT_INTERVERBAL;
    if( g < p ) return RegentRelation.ISOLATED;
    return RegentRelation.OTHER;
  }
}
