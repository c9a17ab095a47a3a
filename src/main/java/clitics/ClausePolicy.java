package clitics;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import clitics.tree.DepNode;


/**
 * The rule settings the analyzer runs with: which surface forms count as
 * clitics, which tokens get a row, which relations open a dependent clause,
 * and how xcomp chains are treated.
 *
 * Defaults live in clitics.properties on the classpath.  A user properties
 * file overrides any of the keys.
 */
public class ClausePolicy {
  public static final String DEFAULTS_RESOURCE = "/clitics.properties";

  public static final String CLITIC_FORMS = "clitic.forms";
  public static final String TARGET_FORMS = "target.forms";
  public static final String SUBORDINATING = "subordinating.deprels";
  public static final String XCOMP_TRANSPARENT = "xcomp.transparent";
  public static final String CHAIN_AUXILIARIES = "chain.auxiliaries";

  private final Set<String> cliticForms;
  private final Set<String> targetForms;
  private final Set<String> subordinating;
  private final boolean xcompTransparent;
  private final boolean chainAuxiliaries;


  public ClausePolicy(Properties props) {
    cliticForms = readSet(props, CLITIC_FORMS, "se,si,mi,ti,mu,ho,bych,jsem");
    targetForms = readSet(props, TARGET_FORMS, "se,si");
    subordinating = readSet(props, SUBORDINATING, "ccomp,advcl,acl,csubj");
    xcompTransparent = Boolean.parseBoolean(props.getProperty(XCOMP_TRANSPARENT, "true").trim());
    chainAuxiliaries = Boolean.parseBoolean(props.getProperty(CHAIN_AUXILIARIES, "true").trim());
  }

  /**
   * @return The policy built from the bundled defaults.
   */
  public static ClausePolicy defaults() {
    return new ClausePolicy(loadDefaults());
  }

  /**
   * Bundled defaults, overridden by the given properties file.
   */
  public static ClausePolicy fromFile(String path) throws IOException {
    Properties props = loadDefaults();
    InputStream in = new FileInputStream(path);
    try {
      props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
    } finally {
      in.close();
    }
    return new ClausePolicy(props);
  }

  static Properties loadDefaults() {
    Properties props = new Properties();
    InputStream in = ClausePolicy.class.getResourceAsStream(DEFAULTS_RESOURCE);
    if( in == null ) {
      System.err.println("WARNING: " + DEFAULTS_RESOURCE + " not on classpath, using built-in defaults");
      return props;
    }
    try {
      props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
      in.close();
    } catch( IOException ex ) {
      System.err.println("WARNING: could not read " + DEFAULTS_RESOURCE + ", using built-in defaults");
      ex.printStackTrace();
    }
    return props;
  }

  private static Set<String> readSet(Properties props, String key, String fallback) {
    Set<String> values = new LinkedHashSet<String>();
    for( String item : props.getProperty(key, fallback).split(",") ) {
      item = item.trim().toLowerCase(Locale.ROOT);
      if( item.length() > 0 ) values.add(item);
    }
    return Collections.unmodifiableSet(values);
  }

  /**
   * A token is a clitic if its lowercased form is in the clitic set, except
   * "se" tagged as ADP, which is the preposition.
   */
  public boolean isClitic(DepNode node) {
    String form = node.getForm().toLowerCase(Locale.ROOT);
    if( !cliticForms.contains(form) ) return false;
    return !(form.equals("se") && isPreposition(node));
  }

  /**
   * @return True if the token gets an output row.
   */
  public boolean isTarget(DepNode node) {
    if( node.isRoot() ) return false;
    return targetForms.contains(node.getForm().toLowerCase(Locale.ROOT)) && !isPreposition(node);
  }

  private static boolean isPreposition(DepNode node) {
    return "ADP".equals(node.getUpos());
  }

  public boolean isSubordinating(String baseDeprel) {
    return subordinating.contains(baseDeprel);
  }

  public Set<String> getCliticForms() { return cliticForms; }
  public Set<String> getTargetForms() { return targetForms; }
  public Set<String> getSubordinating() { return subordinating; }
  public boolean isXcompTransparent() { return xcompTransparent; }
  public boolean chainAuxiliaries() { return chainAuxiliaries; }
}
