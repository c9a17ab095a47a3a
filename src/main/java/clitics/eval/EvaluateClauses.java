package clitics.eval;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import clitics.util.HandleParameters;


/**
 * Scores one column of a predicted features file against a gold TSV file.
 * Both files have a header row.  Data rows are numbered from 1 (the header
 * does not count); rows named in -skip-gold / -skip-pred are dropped before
 * the two columns are aligned, so what remains must have the same length.
 *
 * EvaluateClauses [-gold-col C] [-pred-col C] [-skip-gold 3,7] [-skip-pred 5]
 *                 [-skip-sentences] <gold.tsv> <pred.tsv>
 *
 * -gold-col, -pred-col
 * Column header name or 0-based index, default clause_type.
 *
 * -skip-sentences
 * Ignore the one-cell sentence lines CliticFeats prints with -sentences.
 */
public class EvaluateClauses {
  public static final String DEFAULT_COLUMN = "clause_type";


  /**
   * Reads the values of one column.
   *
   * @param column A header name, or a 0-based column index given as digits.
   * @param skipRows 1-based data row numbers to leave out.
   * @param skipSentenceLines Drop rows without a tab before numbering.
   */
  public static List<String> loadColumn(String path, String column, Set<Integer> skipRows,
                                        boolean skipSentenceLines) throws IOException {
    List<String> values = new ArrayList<String>();
    BufferedReader in = new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8));
    try {
      String headerLine = in.readLine();
      if( headerLine == null )
        throw new IllegalArgumentException("Empty file " + path);
      List<String> header = Arrays.asList(headerLine.split("\t", -1));
      int colIndex = columnIndex(column, header, path);

      int rowNum = 0;
      String line;
      while( (line = in.readLine()) != null ) {
        if( skipSentenceLines && line.indexOf('\t') < 0 ) continue;
        rowNum++;
        if( skipRows.contains(rowNum) ) continue;

        String[] cells = line.split("\t", -1);
        values.add(colIndex < cells.length ? cells[colIndex].trim() : "");
      }
    } finally {
      in.close();
    }
    return values;
  }

  private static int columnIndex(String column, List<String> header, String path) {
    if( column.matches("\\d+") )
      return Integer.parseInt(column);
    int index = header.indexOf(column);
    if( index < 0 )
      throw new IllegalArgumentException("Column '" + column + "' not found in " + path + ". Available: " + header);
    return index;
  }

  /**
   * "3,7, 12" gives {3, 7, 12}.  Null or empty gives the empty set.
   */
  public static Set<Integer> parseSkip(String rowList) {
    Set<Integer> rows = new HashSet<Integer>();
    if( rowList == null ) return rows;
    for( String item : rowList.split(",") ) {
      item = item.trim();
      if( item.length() == 0 ) continue;
      try {
        rows.add(Integer.parseInt(item));
      } catch( NumberFormatException ex ) {
        throw new IllegalArgumentException("Bad row number '" + item + "' in skip list");
      }
    }
    return rows;
  }

  public static LabelScores evaluate(String goldPath, String predPath, String goldCol, String predCol,
                                     Set<Integer> skipGold, Set<Integer> skipPred,
                                     boolean skipSentenceLines) throws IOException {
    List<String> gold = loadColumn(goldPath, goldCol, skipGold, false);
    List<String> pred = loadColumn(predPath, predCol, skipPred, skipSentenceLines);
    return new LabelScores(gold, pred);
  }


  public static void main(String[] args) {
    HandleParameters params = new HandleParameters(args, "-skip-sentences");
    if( params.positional().size() != 2 ) {
      System.err.println("EvaluateClauses [-gold-col C] [-pred-col C] [-skip-gold rows] [-skip-pred rows] [-skip-sentences] <gold> <pred>");
      System.exit(1);
    }

    try {
      LabelScores scores = evaluate(params.positional().get(0), params.positional().get(1),
                                    params.get("-gold-col", DEFAULT_COLUMN),
                                    params.get("-pred-col", DEFAULT_COLUMN),
                                    parseSkip(params.get("-skip-gold")),
                                    parseSkip(params.get("-skip-pred")),
                                    params.hasFlag("-skip-sentences"));
      scores.print(System.out);
    } catch( IllegalArgumentException ex ) {
      System.err.println("ERROR: " + ex.getMessage());
      System.exit(1);
    } catch( IOException ex ) {
      ex.printStackTrace();
      System.exit(1);
    }
  }
}
