package clitics.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;


/**
 * One token of a dependency tree, or the virtual root of a sentence.
 *
 * The virtual root has ord 0, no relation of its own, and carries the
 * sentence-level metadata (sent_id and the surface text).  Nodes are built
 * by the reader and are read-only to the analyzers.
 */
public class DepNode {
  public static final Comparator<DepNode> BY_ORD = new Comparator<DepNode>() {
    public int compare(DepNode a, DepNode b) {
      return Integer.compare(a.ord, b.ord);
    }
  };

  private final int ord;
  private final String form;
  private final String lemma;
  private final String upos;
  private final String xpos;
  private final String feats;
  private final String deprel;
  private final String misc;
  private final boolean isRoot;

  private DepNode parent = null;
  private final List<DepNode> children = new ArrayList<DepNode>();

  // Only set on the virtual root.
  private String sentId = null;
  private String text = null;


  public DepNode(int ord, String form, String lemma, String upos, String xpos,
                 String feats, String deprel, String misc) {
    this(ord, form, lemma, upos, xpos, feats, deprel, misc, false);
  }

  private DepNode(int ord, String form, String lemma, String upos, String xpos,
                  String feats, String deprel, String misc, boolean isRoot) {
    this.ord = ord;
    this.form = (form == null ? "" : form);
    this.lemma = lemma;
    this.upos = upos;
    this.xpos = xpos;
    this.feats = feats;
    this.deprel = (deprel == null ? "" : deprel);
    this.misc = misc;
    this.isRoot = isRoot;
  }

  /**
   * @return A new virtual root for a sentence.
   */
  public static DepNode createRoot(String sentId, String text) {
    DepNode root = new DepNode(0, "<root>", "<root>", "_", "_", "_", "", "_", true);
    root.sentId = sentId;
    root.text = text;
    return root;
  }

  /**
   * Attaches the given node below this one.  The child's old parent, if any,
   * loses it.
   */
  public DepNode addChild(DepNode child) {
    if( child.parent != null )
      child.parent.children.remove(child);
    child.parent = this;
    children.add(child);
    return child;
  }

  public int getOrd() { return ord; }
  public String getForm() { return form; }
  public String getLemma() { return lemma; }
  public String getUpos() { return upos; }
  public String getXpos() { return xpos; }
  public String getFeats() { return feats; }
  public String getDeprel() { return deprel; }
  public String getMisc() { return misc; }
  public DepNode getParent() { return parent; }
  public List<DepNode> getChildren() { return Collections.unmodifiableList(children); }
  public boolean isRoot() { return isRoot; }

  /** Relation label without its subtype: "aux:pass" becomes "aux". */
  public String getBaseDeprel() {
    return Deprels.base(deprel);
  }

  public boolean isPunct() {
    return "PUNCT".equals(upos);
  }

  /**
   * Walks up to the virtual root.  A parent cycle among real nodes yields null.
   */
  public DepNode getRoot() {
    Set<DepNode> visited = new HashSet<DepNode>();
    DepNode node = this;
    while( node != null && !node.isRoot ) {
      if( !visited.add(node) ) return null;
      node = node.parent;
    }
    return node;
  }

  public String getSentId() {
    DepNode root = getRoot();
    return (root == null ? null : root.sentId);
  }

  /**
   * All nodes below this one (not including it), sorted by ord.  Children
   * links that loop back are followed only once.
   */
  public List<DepNode> descendants() {
    Set<DepNode> seen = new HashSet<DepNode>();
    seen.add(this);
    List<DepNode> found = new ArrayList<DepNode>();

    LinkedList<DepNode> stack = new LinkedList<DepNode>();
    stack.addAll(children);
    while( !stack.isEmpty() ) {
      DepNode node = stack.removeFirst();
      if( seen.add(node) ) {
        found.add(node);
        for( DepNode child : node.children )
          stack.addFirst(child);
      }
    }

    Collections.sort(found, BY_ORD);
    return found;
  }

  /**
   * This node plus all of its descendants, sorted by ord.
   */
  public List<DepNode> subtree() {
    List<DepNode> nodes = descendants();
    nodes.add(this);
    Collections.sort(nodes, BY_ORD);
    return nodes;
  }

  /**
   * The surface text of this node's sentence: the text comment if the input
   * had one, otherwise the forms joined with spaces, honouring SpaceAfter=No.
   */
  public String getSentence() {
    DepNode root = getRoot();
    if( root == null ) return "";
    if( root.text != null ) return root.text;

    StringBuilder sb = new StringBuilder();
    List<DepNode> nodes = root.descendants();
    for( int i = 0; i < nodes.size(); i++ ) {
      DepNode node = nodes.get(i);
      sb.append(node.form);
      if( i < nodes.size()-1 && !node.noSpaceAfter() )
        sb.append(' ');
    }
    return sb.toString();
  }

  private boolean noSpaceAfter() {
    if( misc == null ) return false;
    for( String item : misc.split("\\|") ) {
      if( item.equals("SpaceAfter=No") ) return true;
    }
    return false;
  }

  public String toString() {
    return ord + ":" + form + "/" + upos + "/" + deprel;
  }
}
