package clitics.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;


public class DepNodeTest {

  private static DepNode node(int ord, String form, String misc) {
    return new DepNode(ord, form, null, "X", null, null, "dep", misc);
  }

  @Test
  public void baseRelationDropsSubtype() {
    assertEquals("aux", Deprels.base("aux:pass"));
    assertEquals("root", Deprels.base("root"));
    assertEquals("", Deprels.base(null));
    assertEquals("expl", new DepNode(1, "se", "se", "PRON", null, null, "expl:pv", null).getBaseDeprel());
  }

  @Test
  public void sentenceIsRebuiltFromForms() {
    DepNode root = DepNode.createRoot("s", null);
    DepNode jde = root.addChild(node(1, "Jde", null));
    jde.addChild(node(3, ".", null));
    jde.addChild(node(2, "domů", "SpaceAfter=No"));

    assertEquals("Jde domů.", jde.getSentence());
    assertEquals("s", jde.getSentId());
  }

  @Test
  public void descendantsSurviveChildCycle() {
    DepNode root = DepNode.createRoot("s", null);
    DepNode a = root.addChild(node(2, "a", null));
    DepNode b = a.addChild(node(1, "b", null));
    b.addChild(a);

    // a now hangs below b, which hangs below a.
    assertTrue(root.descendants().isEmpty());
    List<DepNode> below = b.descendants();
    assertEquals(1, below.size());
    assertSame(a, below.get(0));
    assertEquals(2, b.subtree().size());
    assertNull(a.getRoot());
  }

  @Test
  public void addChildMovesNode() {
    DepNode root = DepNode.createRoot("s", null);
    DepNode a = root.addChild(node(1, "a", null));
    DepNode b = root.addChild(node(2, "b", null));
    b.addChild(a);

    assertEquals(1, root.getChildren().size());
    assertSame(b, a.getParent());
  }
}
