package clitics.eval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import clitics.util.HandleParameters;


/**
 * Statistical significance of the accuracy difference between two runs of
 * the feature extractor (say, two rule policies) over the same gold rows.
 * This is approximate randomization: the two runs' per-row outcomes are
 * swapped at random many times, and we count how many shuffles give an
 * accuracy difference at least as large as the real one.  The p-value is
 * the chance that the real difference is noise; lower is better.
 *
 * SigTestApproxRand [-shuffles N] [-col C] <gold.tsv> <predA.tsv> <predB.tsv>
 */
public class SigTestApproxRand {
  int _numShuffles = 1000;
  Random _random;


  public SigTestApproxRand() {
    _random = new Random();
  }

  public SigTestApproxRand(int numShuffles, long seed) {
    _numShuffles = numShuffles;
    _random = new Random(seed);
  }

  /**
   * 1 where the guess matches gold, 0 where it does not.
   */
  public static List<Integer> outcomes(List<String> gold, List<String> guesses) {
    if( gold.size() != guesses.size() )
      throw new IllegalArgumentException("gold has " + gold.size() + " rows, guesses have " + guesses.size());

    List<Integer> outcomes = new ArrayList<Integer>(gold.size());
    for( int i = 0; i < gold.size(); i++ )
      outcomes.add(gold.get(i).equals(guesses.get(i)) ? 1 : 0);
    return outcomes;
  }

  private double score(List<Integer> outcomes) {
    if( outcomes.isEmpty() ) return 0.0;
    double score = 0.0;
    for( Integer outcome : outcomes )
      score += outcome;
    return score / (double)outcomes.size();
  }

  /**
   * Calculate the p-value between two outcome lists over the same rows.
   */
  public double calculatePValue(List<Integer> outcomes1, List<Integer> outcomes2) {
    int numTests = outcomes1.size();
    if( numTests != outcomes2.size() )
      throw new IllegalArgumentException("outcome lists of different sizes: " + numTests + " vs " + outcomes2.size());

    double actualDiff = Math.abs(score(outcomes1) - score(outcomes2));
    System.err.printf(Locale.US, "score1=%.2f%% score2=%.2f%%%n", 100*score(outcomes1), 100*score(outcomes2));

    int matched = 0;
    for( int i = 0; i < _numShuffles; i++ ) {
      List<Integer> pseudo1 = new ArrayList<Integer>(numTests);
      List<Integer> pseudo2 = new ArrayList<Integer>(numTests);

      // Swap each row's outcomes with probability one half.
      for( int j = 0; j < numTests; j++ ) {
        if( _random.nextDouble() <= 0.5 ) {
          pseudo1.add(outcomes1.get(j));
          pseudo2.add(outcomes2.get(j));
        } else {
          pseudo2.add(outcomes1.get(j));
          pseudo1.add(outcomes2.get(j));
        }
      }

      if( Math.abs(score(pseudo1) - score(pseudo2)) >= actualDiff )
        matched++;
    }

    System.err.println("matched or exceeded " + matched + " of " + _numShuffles);
    return (matched + 1.0) / (_numShuffles + 1.0);
  }


  public static void main(String[] args) {
    HandleParameters params = new HandleParameters(args);
    if( params.positional().size() != 3 ) {
      System.err.println("SigTestApproxRand [-shuffles N] [-col C] <gold.tsv> <predA.tsv> <predB.tsv>");
      System.exit(1);
    }

    String col = params.get("-col", EvaluateClauses.DEFAULT_COLUMN);
    try {
      List<String> gold = EvaluateClauses.loadColumn(params.positional().get(0), col, new HashSet<Integer>(), false);
      List<String> predA = EvaluateClauses.loadColumn(params.positional().get(1), col, new HashSet<Integer>(), true);
      List<String> predB = EvaluateClauses.loadColumn(params.positional().get(2), col, new HashSet<Integer>(), true);

      SigTestApproxRand test = new SigTestApproxRand();
      test._numShuffles = params.getInt("-shuffles", test._numShuffles);
      double p = test.calculatePValue(outcomes(gold, predA), outcomes(gold, predB));
      System.out.println("p = " + p);
    } catch( IllegalArgumentException ex ) {
      System.err.println("ERROR: " + ex.getMessage());
      System.exit(1);
    } catch( IOException ex ) {
      ex.printStackTrace();
      System.exit(1);
    }
  }
}
