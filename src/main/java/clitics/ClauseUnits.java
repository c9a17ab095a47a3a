package clitics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import clitics.tree.DepNode;


/**
 * The words of a clause in sentence order, with the clitic group collapsed
 * into a single unit.  Position and regent relation are both read off this
 * sequence.
 */
public class ClauseUnits {
  private final List<DepNode> units;
  private final int groupIndex;


  /**
   * @param clauseWords Non-punctuation clause tokens sorted by ord.
   * @param group The clitic group.
   */
  public ClauseUnits(List<DepNode> clauseWords, List<DepNode> group) {
    Set<DepNode> members = new HashSet<DepNode>(group);
    List<DepNode> collapsed = new ArrayList<DepNode>();
    int index = -1;

    boolean inGroup = false;
    for( DepNode word : clauseWords ) {
      if( members.contains(word) ) {
        // One placeholder per run of group tokens.
        if( !inGroup ) {
          if( index < 0 ) index = collapsed.size();
          collapsed.add(null);
          inGroup = true;
        }
      }
      else {
        collapsed.add(word);
        inGroup = false;
      }
    }

    units = Collections.unmodifiableList(collapsed);
    groupIndex = index;
  }

  /** Index of the collapsed group, or -1 if the group is not in the clause. */
  public int groupIndex() { return groupIndex; }

  public int size() { return units.size(); }

  public boolean isGroup(int i) {
    return units.get(i) == null;
  }

  /**
   * @return The word at unit i, or null for the group placeholder or an
   *         index outside the sequence.
   */
  public DepNode get(int i) {
    if( i < 0 || i >= units.size() ) return null;
    return units.get(i);
  }

  /**
   * @return The unit index of the given word, or -1.
   */
  public int indexOf(DepNode word) {
    if( word == null ) return -1;
    for( int i = 0; i < units.size(); i++ ) {
      if( units.get(i) == word ) return i;
    }
    return -1;
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    for( DepNode unit : units ) {
      if( sb.length() > 0 ) sb.append(' ');
      sb.append(unit == null ? "[CL]" : unit.getForm());
    }
    return sb.toString();
  }
}
