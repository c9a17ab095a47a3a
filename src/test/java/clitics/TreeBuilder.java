package clitics;

import java.util.Locale;

import clitics.tree.DepNode;

/**
 * Builds small dependency trees by hand for the tests.
 */
class TreeBuilder {
  final DepNode root;

  TreeBuilder() {
    this("test-1");
  }

  TreeBuilder(String sentId) {
    root = DepNode.createRoot(sentId, null);
  }

  DepNode add(DepNode parent, int ord, String form, String upos, String deprel) {
    return parent.addChild(node(ord, form, upos, deprel));
  }

  DepNode top(int ord, String form) {
    return add(root, ord, form, "VERB", "root");
  }

  static DepNode node(int ord, String form, String upos, String deprel) {
    return new DepNode(ord, form, form.toLowerCase(Locale.ROOT), upos, null, null, deprel, null);
  }
}
