package clitics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import clitics.tree.DepNode;
import clitics.tree.Deprels;


/**
 * The verb cluster that governs a clitic: the governing verb with its
 * auxiliaries and copulas, plus every head reached up an xcomp chain
 * (modal and phase verbs) together with their own auxiliaries and copulas.
 *
 * "musel by se opírat" gives the members musel, by, opírat in sentence order.
 */
public class ComplexPredicate {
  public static final String NONE = "_";

  private final DepNode governor;
  private final List<DepNode> members;
  private final Set<DepNode> memberSet;


  private ComplexPredicate(DepNode governor, List<DepNode> members) {
    this.governor = governor;
    this.members = Collections.unmodifiableList(members);
    this.memberSet = new HashSet<DepNode>(members);
  }

  /**
   * Collects the complex predicate around the given governor.  A missing
   * governor or the virtual root gives an empty predicate.
   */
  public static ComplexPredicate of(DepNode governor, ClausePolicy policy) {
    if( governor == null || governor.isRoot() )
      return new ComplexPredicate(governor, new ArrayList<DepNode>());

    Set<DepNode> parts = new LinkedHashSet<DepNode>();
    parts.add(governor);
    addAuxiliaries(governor, parts);

    // Climb the xcomp chain.  The visited set stops a malformed cycle.
    Set<DepNode> visited = new HashSet<DepNode>();
    visited.add(governor);
    DepNode node = governor;
    while( node.getBaseDeprel().equals(Deprels.XCOMP) && Deprels.hasRealParent(node) ) {
      DepNode head = node.getParent();
      if( !visited.add(head) ) break;
      parts.add(head);
      if( policy.chainAuxiliaries() )
        addAuxiliaries(head, parts);
      node = head;
    }

    List<DepNode> sorted = new ArrayList<DepNode>(parts);
    Collections.sort(sorted, DepNode.BY_ORD);
    return new ComplexPredicate(governor, sorted);
  }

  private static void addAuxiliaries(DepNode head, Set<DepNode> parts) {
    for( DepNode child : head.getChildren() ) {
      if( Deprels.isAuxOrCop(child) )
        parts.add(child);
    }
  }

  public DepNode getGovernor() { return governor; }

  /** Members sorted by ord. */
  public List<DepNode> getMembers() { return members; }

  public boolean contains(DepNode node) {
    return node != null && memberSet.contains(node);
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  /**
   * @return The member forms joined by spaces in sentence order, or "_".
   */
  public String form() {
    if( members.isEmpty() ) return NONE;
    StringBuilder sb = new StringBuilder();
    for( DepNode member : members ) {
      if( sb.length() > 0 ) sb.append(' ');
      sb.append(member.getForm());
    }
    return sb.toString();
  }

  public String toString() {
    return form();
  }
}
