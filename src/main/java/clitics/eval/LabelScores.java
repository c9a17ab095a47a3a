package clitics.eval;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;
import edu.stanford.nlp.stats.TwoDimensionalCounter;


/**
 * Accuracy, confusion matrix and per-class precision/recall/F1 of predicted
 * labels against gold labels, aligned by position.
 */
public class LabelScores {
  private final List<String> _classes;
  private final TwoDimensionalCounter<String,String> _confusion;
  private final Counter<String> _goldCounts;
  private final Counter<String> _predCounts;
  private final int _total;
  private int _correct = 0;


  public LabelScores(List<String> gold, List<String> pred) {
    if( gold.size() != pred.size() )
      throw new IllegalArgumentException("Row count mismatch after filtering: gold=" + gold.size()
                                         + ", pred=" + pred.size() + ". Check the skip options.");

    _total = gold.size();
    _confusion = new TwoDimensionalCounter<String,String>();
    _goldCounts = new ClassicCounter<String>();
    _predCounts = new ClassicCounter<String>();

    TreeSet<String> classes = new TreeSet<String>();
    for( int i = 0; i < _total; i++ ) {
      String g = gold.get(i);
      String p = pred.get(i);
      _confusion.incrementCount(g, p);
      _goldCounts.incrementCount(g);
      _predCounts.incrementCount(p);
      classes.add(g);
      classes.add(p);
      if( g.equals(p) ) _correct++;
    }
    _classes = new ArrayList<String>(classes);
  }

  public int total() { return _total; }
  public int correct() { return _correct; }

  /** Sorted union of gold and predicted labels. */
  public List<String> classes() { return _classes; }

  public double accuracy() {
    if( _total == 0 ) return 0.0;
    return (double)_correct / (double)_total;
  }

  /**
   * @return Number of pairs with this gold and this predicted label.
   */
  public int confusion(String gold, String pred) {
    return (int)_confusion.getCount(gold, pred);
  }

  public double precision(String label) {
    double predicted = _predCounts.getCount(label);
    if( predicted == 0.0 ) return 0.0;
    return _confusion.getCount(label, label) / predicted;
  }

  public double recall(String label) {
    double gold = _goldCounts.getCount(label);
    if( gold == 0.0 ) return 0.0;
    return _confusion.getCount(label, label) / gold;
  }

  public double f1(String label) {
    double p = precision(label);
    double r = recall(label);
    if( p + r == 0.0 ) return 0.0;
    return 2 * p * r / (p + r);
  }

  public void print(PrintStream out) {
    out.println("Total pairs: " + _total);
    out.println("Correct:     " + _correct);
    if( _total > 0 )
      out.printf(Locale.US, "Accuracy:    %.4f%n", accuracy());
    else
      out.println("Accuracy:    N/A");

    out.println();
    out.println("Confusion matrix (rows=gold, cols=pred):");
    StringBuilder header = new StringBuilder();
    for( String cls : _classes )
      header.append('\t').append(cls);
    out.println(header);
    for( String g : _classes ) {
      StringBuilder row = new StringBuilder(g);
      for( String p : _classes )
        row.append('\t').append(confusion(g, p));
      out.println(row);
    }

    out.println();
    out.println("Per-class metrics:");
    for( String cls : _classes )
      out.printf(Locale.US, "  %s:  P=%.4f  R=%.4f  F1=%.4f%n", cls, precision(cls), recall(cls), f1(cls));
  }
}
