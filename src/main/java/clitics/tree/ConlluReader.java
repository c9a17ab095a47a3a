package clitics.tree;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;


/**
 * Reads dependency trees from a CoNLL-U file, one sentence at a time.
 *
 * Each call to nextSentence() returns the virtual root of the next sentence,
 * with the sent_id and text comments attached to it.  Multiword token lines
 * (3-4) and empty nodes (5.1) are skipped.
 */
public class ConlluReader implements Closeable {
  private static final int NUM_COLUMNS = 10;
  private static final String SENT_ID = "sent_id";
  private static final String TEXT = "text";

  private final BufferedReader in;
  private int lineNum = 0;
  private int numSentences = 0;

  /**
   * Thrown when a token line cannot be read as CoNLL-U.
   */
  public static class ConlluFormatException extends RuntimeException {
    private final int line;

    public ConlluFormatException(int line, String message) {
      super("line " + line + ": " + message);
      this.line = line;
    }

    public int getLine() { return line; }
  }


  public ConlluReader(String filename) throws IOException {
    this(open(filename));
  }

  public ConlluReader(Reader reader) {
    if( reader instanceof BufferedReader )
      in = (BufferedReader)reader;
    else
      in = new BufferedReader(reader);
  }

  private static Reader open(String filename) throws IOException {
    InputStream stream = new FileInputStream(filename);
    if( filename.endsWith(".gz") )
      stream = new GZIPInputStream(stream);
    return new InputStreamReader(stream, StandardCharsets.UTF_8);
  }

  /**
   * @return The virtual root of the next sentence, or null at the end of input.
   */
  public DepNode nextSentence() throws IOException {
    String sentId = null;
    String text = null;
    List<DepNode> nodes = new ArrayList<DepNode>();
    List<String> heads = new ArrayList<String>();
    boolean started = false;

    String line;
    while( (line = in.readLine()) != null ) {
      lineNum++;

      if( line.trim().isEmpty() ) {
        if( started ) break;
        else continue;
      }
      started = true;

      if( line.startsWith("#") ) {
        String[] keyValue = splitComment(line);
        if( keyValue != null ) {
          if( keyValue[0].equals(SENT_ID) ) sentId = keyValue[1];
          else if( keyValue[0].equals(TEXT) ) text = keyValue[1];
        }
        continue;
      }

      String[] cols = line.split("\t");
      if( cols.length < NUM_COLUMNS )
        throw new ConlluFormatException(lineNum, "expected " + NUM_COLUMNS + " columns, found " + cols.length);

      // Multiword tokens and empty nodes are not part of the basic tree.
      if( cols[0].indexOf('-') > -1 || cols[0].indexOf('.') > -1 )
        continue;

      int ord = parseInt(cols[0], "ID");
      nodes.add(new DepNode(ord, cols[1], value(cols[2]), value(cols[3]), value(cols[4]),
                            value(cols[5]), deprel(cols[7]), value(cols[9])));
      heads.add(cols[6]);
    }

    if( !started ) return null;

    numSentences++;
    return buildTree(sentId, text, nodes, heads);
  }

  /**
   * Links each token to its head once the whole sentence is known, so heads
   * may point forward.  Heads outside the sentence go to the root.
   */
  private DepNode buildTree(String sentId, String text, List<DepNode> nodes, List<String> heads) {
    DepNode root = DepNode.createRoot(sentId, text);

    Map<Integer,DepNode> byOrd = new HashMap<Integer,DepNode>();
    for( DepNode node : nodes )
      byOrd.put(node.getOrd(), node);

    for( int i = 0; i < nodes.size(); i++ ) {
      DepNode node = nodes.get(i);
      String head = heads.get(i);
      if( head.equals("_") || head.equals("0") ) {
        root.addChild(node);
        continue;
      }

      int headOrd = parseInt(head, "HEAD");
      DepNode parent = byOrd.get(headOrd);
      if( parent == null ) {
        System.err.println("WARNING: sentence " + sentId + " token " + node.getOrd()
                           + " has unknown head " + headOrd + ", attaching to root");
        root.addChild(node);
      }
      else parent.addChild(node);
    }
    return root;
  }

  private int parseInt(String str, String column) {
    try {
      return Integer.parseInt(str);
    } catch( NumberFormatException ex ) {
      throw new ConlluFormatException(lineNum, "bad " + column + " value '" + str + "'");
    }
  }

  /**
   * "# sent_id = s1" gives {"sent_id", "s1"}.  Comments without " = " give null.
   */
  private static String[] splitComment(String line) {
    String body = line.substring(1).trim();
    int eq = body.indexOf('=');
    if( eq < 0 ) return null;
    return new String[] { body.substring(0, eq).trim(), body.substring(eq+1).trim() };
  }

  private static String value(String col) {
    return (col.equals("_") ? null : col);
  }

  private static String deprel(String col) {
    return (col.equals("_") ? "" : col);
  }

  public int numSentences() { return numSentences; }

  public void close() throws IOException {
    in.close();
  }
}
