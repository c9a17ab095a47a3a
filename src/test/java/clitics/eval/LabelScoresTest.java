package clitics.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class LabelScoresTest {

  @Test
  public void accuracyConfusionAndPerClass() {
    List<String> gold = Arrays.asList("HV", "HV", "VV", "VV", "HV");
    List<String> pred = Arrays.asList("HV", "VV", "VV", "HV", "HV");
    LabelScores scores = new LabelScores(gold, pred);

    assertEquals(5, scores.total());
    assertEquals(3, scores.correct());
    assertEquals(0.6, scores.accuracy(), 1e-9);
    assertEquals(Arrays.asList("HV", "VV"), scores.classes());
    assertEquals(2, scores.confusion("HV", "HV"));
    assertEquals(1, scores.confusion("HV", "VV"));
    assertEquals(1, scores.confusion("VV", "HV"));

    assertEquals(2.0/3.0, scores.precision("HV"), 1e-9);
    assertEquals(2.0/3.0, scores.recall("HV"), 1e-9);
    assertEquals(0.5, scores.precision("VV"), 1e-9);
    assertEquals(0.5, scores.recall("VV"), 1e-9);
    assertEquals(0.5, scores.f1("VV"), 1e-9);
  }

  @Test
  public void labelNeverPredictedScoresZero() {
    LabelScores scores = new LabelScores(Arrays.asList("HV", "_"), Arrays.asList("HV", "HV"));
    assertEquals(0.0, scores.precision("_"), 0.0);
    assertEquals(0.0, scores.recall("_"), 0.0);
    assertEquals(0.0, scores.f1("_"), 0.0);
  }

  @Test
  public void mismatchedLengthsAreRejected() {
    assertThrows(IllegalArgumentException.class,
                 new Executable() {
                   public void execute() throws Throwable {
                     new LabelScores(Arrays.asList("HV"), Collections.<String>emptyList());
                   }
                 });
  }

  @Test
  public void reportPrintsMatrix() {
    LabelScores scores = new LabelScores(Arrays.asList("HV", "VV"), Arrays.asList("HV", "HV"));
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    scores.print(new PrintStream(bytes, true));
    String report = bytes.toString();

    assertTrue(report.contains("Accuracy:    0.5000"));
    assertTrue(report.contains("\tHV\tVV"));
    assertTrue(report.contains("VV\t1\t0"));
    assertTrue(report.contains("HV:  P=0.5000  R=1.0000  F1=0.6667"));
  }

  @Test
  public void emptyReportHasNoAccuracy() {
    LabelScores scores = new LabelScores(Collections.<String>emptyList(), Collections.<String>emptyList());
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    scores.print(new PrintStream(bytes, true));
    assertTrue(bytes.toString().contains("Accuracy:    N/A"));
  }
}
