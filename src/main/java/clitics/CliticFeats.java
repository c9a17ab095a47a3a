package clitics;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import clitics.tree.ConlluReader;
import clitics.tree.DepNode;
import clitics.util.HandleParameters;


/**
 * Reads CoNLL-U parses and writes one TSV row per clitic se/si (not the
 * preposition se):
 *
 *   sent_id  ord  predicate_form  clause_type  clause_position  relation_to_regent
 *
 * CliticFeats [-props <file>] [-sentences] [-output <file>] [<input.conllu>]
 *
 * -props
 * Properties file overriding the rule settings in clitics.properties.
 *
 * -sentences
 * Print the sentence text after each row.
 *
 * -output
 * Write the rows here instead of STDOUT.
 *
 * The input is read from STDIN if no file is given.  Files ending in .gz are
 * gunzipped.
 */
public class CliticFeats {
  CliticAnalyzer _analyzer;
  String _dataPath = null;
  String _outputPath = null;
  boolean _printSentences = false;

  int _numSentences = 0;
  int _numClitics = 0;


  CliticFeats(String[] args) throws IOException {
    HandleParameters params = new HandleParameters(args, "-sentences");

    ClausePolicy policy;
    if( params.hasFlag("-props") )
      policy = ClausePolicy.fromFile(params.get("-props"));
    else
      policy = ClausePolicy.defaults();
    _analyzer = new CliticAnalyzer(policy);

    _printSentences = params.hasFlag("-sentences");
    _outputPath = params.get("-output");
    if( params.positional().size() > 0 )
      _dataPath = params.positional().get(params.positional().size()-1);

    System.err.println("input= " + (_dataPath == null ? "STDIN" : _dataPath));
    System.err.println("clitic forms= " + policy.getCliticForms());
  }

  public CliticFeats(CliticAnalyzer analyzer, boolean printSentences) {
    _analyzer = analyzer;
    _printSentences = printSentences;
  }

  /**
   * Writes the header and one row per target clitic for every sentence the
   * reader returns.
   */
  public void process(ConlluReader reader, PrintWriter out) throws IOException {
    out.println(CliticFeatures.header());

    DepNode root;
    while( (root = reader.nextSentence()) != null ) {
      _numSentences++;
      List<CliticFeatures> rows = _analyzer.analyzeSentence(root);
      for( CliticFeatures row : rows ) {
        _numClitics++;
        out.println(row.toTsv());
        if( _printSentences )
          out.println(root.getSentence());
      }
    }
    out.flush();
  }

  /**
   * The output is opened before the input, so a bad output path leaves
   * nothing open.
   */
  public void processData() throws IOException {
    PrintWriter out = openOutput();
    try {
      ConlluReader reader = openInput();
      try {
        process(reader, out);
      } finally {
        reader.close();
      }
    } finally {
      if( _outputPath != null ) out.close();
      else out.flush();
    }

    System.err.println("Read " + _numSentences + " sentences, " + _numClitics + " clitic tokens");
  }

  PrintWriter openOutput() throws IOException {
    Writer writer;
    if( _outputPath == null )
      writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
    else
      writer = new OutputStreamWriter(new FileOutputStream(_outputPath), StandardCharsets.UTF_8);
    return new PrintWriter(new BufferedWriter(writer));
  }

  ConlluReader openInput() throws IOException {
    if( _dataPath == null )
      return new ConlluReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    return new ConlluReader(_dataPath);
  }

  public int numSentences() { return _numSentences; }
  public int numClitics() { return _numClitics; }


  public static void main(String[] args) {
    try {
      CliticFeats feats = new CliticFeats(args);
      feats.processData();
    } catch( IOException ex ) {
      ex.printStackTrace();
      System.exit(1);
    } catch( ConlluReader.ConlluFormatException ex ) {
      System.err.println("ERROR: bad CoNLL-U input, " + ex.getMessage());
      System.exit(1);
    }
  }
}
