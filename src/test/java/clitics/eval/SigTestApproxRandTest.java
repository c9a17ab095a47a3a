package clitics.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class SigTestApproxRandTest {

  @Test
  public void outcomesMarkCorrectRows() {
    List<Integer> outcomes = SigTestApproxRand.outcomes(Arrays.asList("HV", "VV", "HV"),
                                                        Arrays.asList("HV", "HV", "HV"));
    assertEquals(Arrays.asList(1, 0, 1), outcomes);
  }

  @Test
  public void identicalRunsAreNotSignificant() {
    List<Integer> run = Arrays.asList(1, 0, 1, 1, 0, 1);
    double p = new SigTestApproxRand(200, 42L).calculatePValue(run, run);
    // Every shuffle matches a zero difference.
    assertEquals(1.0, p, 1e-9);
  }

  @Test
  public void clearDifferenceIsSignificant() {
    List<Integer> good = new ArrayList<Integer>();
    List<Integer> bad = new ArrayList<Integer>();
    for( int i = 0; i < 100; i++ ) {
      good.add(1);
      bad.add(0);
    }
    double p = new SigTestApproxRand(500, 7L).calculatePValue(good, bad);
    assertTrue(p < 0.01, "p = " + p);
  }

  @Test
  public void differentLengthsAreRejected() {
    assertThrows(IllegalArgumentException.class,
                 new Executable() {
                   public void execute() throws Throwable {
                     new SigTestApproxRand(10, 1L).calculatePValue(Arrays.asList(1), Arrays.asList(1, 0));
                   }
                 });
  }
}
