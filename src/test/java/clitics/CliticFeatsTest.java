package clitics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

import clitics.tree.ConlluReader;


public class CliticFeatsTest {
  @TempDir
  File tmp;

  private String run(boolean printSentences) throws Exception {
    InputStream in = getClass().getResourceAsStream("/clitics/sample.conllu");
    ConlluReader reader = new ConlluReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    StringWriter buffer = new StringWriter();

    CliticFeats feats = new CliticFeats(new CliticAnalyzer(), printSentences);
    feats.process(reader, new PrintWriter(buffer));
    reader.close();

    assertEquals(4, feats.numSentences());
    assertEquals(3, feats.numClitics());
    return buffer.toString();
  }

  @Test
  public void writesHeaderAndOneRowPerClitic() throws Exception {
    String[] lines = run(false).split("\\r?\\n");

    assertEquals(4, lines.length);
    assertEquals("sent_id\tord\tpredicate_form\tclause_type\tclause_position\trelation_to_regent", lines[0]);
    assertEquals("s1\t3\tČetl\tHV\tpostiniciální\tkontaktní postverbální", lines[1]);
    assertEquals("s2\t3\tbych učil\tVV\tpostiniciální\tkontaktní preverbální", lines[2]);
    assertEquals("\t2\tMyl\tHV\tpostiniciální\tkontaktní postverbální", lines[3]);
  }

  @Test
  public void sentenceTextFollowsEachRow() throws Exception {
    String[] lines = run(true).split("\\r?\\n");

    assertEquals(7, lines.length);
    assertEquals("Četl ho se.", lines[2]);
    assertEquals("Abych se učil, musím.", lines[4]);
    assertEquals("Myl si ruce", lines[6]);
  }

  @Test
  public void badOutputPathLeavesInputUnopened() throws Exception {
    final boolean[] opened = new boolean[1];
    String outPath = new File(tmp, "missing/dir/out.tsv").getPath();
    final CliticFeats feats = new CliticFeats(new String[] { "-output", outPath, "in.conllu" }) {
      ConlluReader openInput() throws IOException {
        opened[0] = true;
        return super.openInput();
      }
    };

    assertThrows(IOException.class, new Executable() {
      public void execute() throws Throwable {
        feats.processData();
      }
    });
    assertFalse(opened[0]);
  }
}
