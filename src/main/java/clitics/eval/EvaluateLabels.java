package clitics.eval;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import clitics.util.HandleParameters;


/**
 * Scores plain label files, one label per line.  The first N lines of each
 * file can be skipped, and pairs whose gold label is empty are not scored.
 *
 * EvaluateLabels [-skip-gold N] [-skip-pred N] <gold.txt> <pred.txt>
 */
public class EvaluateLabels {

  public static List<String> readLabels(String path, int skip) throws IOException {
    List<String> lines = Files.readAllLines(Paths.get(path), StandardCharsets.UTF_8);
    if( skip >= lines.size() ) return new ArrayList<String>();
    return new ArrayList<String>(lines.subList(skip, lines.size()));
  }

  /**
   * Aligns the two lists and drops pairs with an empty gold label.
   */
  public static LabelScores evaluate(List<String> gold, List<String> pred) {
    if( gold.size() != pred.size() )
      throw new IllegalArgumentException("after skipping lines, gold has " + gold.size()
                                         + " entries but predicted has " + pred.size() + " entries.");

    List<String> keptGold = new ArrayList<String>();
    List<String> keptPred = new ArrayList<String>();
    for( int i = 0; i < gold.size(); i++ ) {
      if( gold.get(i).length() > 0 ) {
        keptGold.add(gold.get(i));
        keptPred.add(pred.get(i));
      }
    }
    if( keptGold.isEmpty() )
      throw new IllegalArgumentException("no examples remain after filtering empty gold labels.");

    System.err.println("Evaluating " + keptGold.size() + " examples (" + (gold.size() - keptGold.size())
                       + " skipped due to empty gold labels).");
    return new LabelScores(keptGold, keptPred);
  }


  public static void main(String[] args) {
    HandleParameters params = new HandleParameters(args);
    if( params.positional().size() != 2 ) {
      System.err.println("EvaluateLabels [-skip-gold N] [-skip-pred N] <gold> <pred>");
      System.exit(1);
    }

    try {
      List<String> gold = readLabels(params.positional().get(0), params.getInt("-skip-gold", 0));
      List<String> pred = readLabels(params.positional().get(1), params.getInt("-skip-pred", 0));
      evaluate(gold, pred).print(System.out);
    } catch( IllegalArgumentException ex ) {
      System.err.println("Error: " + ex.getMessage());
      System.exit(1);
    } catch( IOException ex ) {
      ex.printStackTrace();
      System.exit(1);
    }
  }
}
