package clitics.tree;

/**
 * Universal Dependencies relation labels the clitic rules look at.
 */
public class Deprels {
  public static final String ROOT  = "root";
  public static final String AUX   = "aux";
  public static final String COP   = "cop";
  public static final String XCOMP = "xcomp";
  public static final String CCOMP = "ccomp";
  public static final String ADVCL = "advcl";
  public static final String ACL   = "acl";
  public static final String CSUBJ = "csubj";

  private Deprels() { }

  /**
   * Strips the subtype off a relation label: "expl:pv" becomes "expl".
   * A null label gives the empty string.
   */
  public static String base(String deprel) {
    if( deprel == null ) return "";
    int colon = deprel.indexOf(':');
    if( colon < 0 ) return deprel;
    return deprel.substring(0, colon);
  }

  /**
   * @return True if the node hangs on its parent as an auxiliary or copula.
   */
  public static boolean isAuxOrCop(DepNode node) {
    String base = node.getBaseDeprel();
    return base.equals(AUX) || base.equals(COP);
  }

  /**
   * @return True if the node has a real (non-root) parent.
   */
  public static boolean hasRealParent(DepNode node) {
    return node.getParent() != null && !node.getParent().isRoot();
  }
}
