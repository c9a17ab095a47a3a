package clitics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import clitics.tree.DepNode;


public class ComplexPredicateTest {

  @Test
  public void membersComeOutInSentenceOrder() {
    // Budu se muset učit: the chain head "muset" carries the auxiliary.
    TreeBuilder tb = new TreeBuilder();
    DepNode muset = tb.top(3, "muset");
    tb.add(muset, 1, "Budu", "AUX", "aux");
    DepNode ucit = tb.add(muset, 4, "učit", "VERB", "xcomp");
    tb.add(ucit, 2, "se", "PRON", "expl:pv");

    ComplexPredicate pred = ComplexPredicate.of(ucit, ClausePolicy.defaults());
    assertEquals("Budu muset učit", pred.form());

    List<DepNode> members = pred.getMembers();
    for( int i = 1; i < members.size(); i++ )
      assertTrue(members.get(i-1).getOrd() < members.get(i).getOrd());
  }

  @Test
  public void copulaAndPassiveAuxiliaryAreMembers() {
    TreeBuilder tb = new TreeBuilder();
    DepNode rad = tb.top(3, "rád");
    tb.add(rad, 1, "Byl", "AUX", "cop");
    tb.add(rad, 2, "jsem", "AUX", "aux:pass");
    tb.add(rad, 4, "domů", "ADV", "advmod");

    ComplexPredicate pred = ComplexPredicate.of(rad, ClausePolicy.defaults());
    assertEquals("Byl jsem rád", pred.form());
    assertFalse(pred.contains(rad.getChildren().get(2)));
  }

  @Test
  public void chainAuxiliariesCanBeLeftOut() {
    Properties props = new Properties();
    props.setProperty(ClausePolicy.CHAIN_AUXILIARIES, "false");

    TreeBuilder tb = new TreeBuilder();
    DepNode muset = tb.top(3, "muset");
    tb.add(muset, 1, "Budu", "AUX", "aux");
    DepNode ucit = tb.add(muset, 4, "učit", "VERB", "xcomp");

    assertEquals("muset učit", ComplexPredicate.of(ucit, new ClausePolicy(props)).form());
  }

  @Test
  public void chainStopsBelowVirtualRoot() {
    TreeBuilder tb = new TreeBuilder();
    DepNode top = tb.add(tb.root, 1, "učit", "VERB", "xcomp");

    ComplexPredicate pred = ComplexPredicate.of(top, ClausePolicy.defaults());
    assertEquals("učit", pred.form());
    assertEquals(1, pred.getMembers().size());
  }

  @Test
  public void missingGovernorIsEmpty() {
    TreeBuilder tb = new TreeBuilder();
    assertEquals("_", ComplexPredicate.of(null, ClausePolicy.defaults()).form());
    assertTrue(ComplexPredicate.of(tb.root, ClausePolicy.defaults()).isEmpty());
  }
}
