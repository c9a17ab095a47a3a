package clitics.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Command-line flags of the form "-flag value".  Flags named as switches take
 * no value.  Anything that is not a flag or a flag's value is positional.
 *
 *   new HandleParameters(args, "-sentences")
 */
public class HandleParameters {
  private final Map<String,String> _flags = new HashMap<String,String>();
  private final List<String> _positional = new ArrayList<String>();


  public HandleParameters(String[] args, String... switches) {
    Set<String> switchSet = new HashSet<String>(Arrays.asList(switches));

    for( int i = 0; i < args.length; i++ ) {
      String arg = args[i];
      if( arg.startsWith("-") && arg.length() > 1 ) {
        if( switchSet.contains(arg) || i+1 >= args.length )
          _flags.put(arg, "true");
        else {
          _flags.put(arg, args[i+1]);
          i++;
        }
      }
      else _positional.add(arg);
    }
  }

  public boolean hasFlag(String flag) {
    return _flags.containsKey(flag);
  }

  /**
   * @return The flag's value, or null if it was not given.
   */
  public String get(String flag) {
    return _flags.get(flag);
  }

  public String get(String flag, String defaultValue) {
    return (_flags.containsKey(flag) ? _flags.get(flag) : defaultValue);
  }

  public int getInt(String flag, int defaultValue) {
    if( !_flags.containsKey(flag) ) return defaultValue;
    try {
      return Integer.parseInt(_flags.get(flag));
    } catch( NumberFormatException ex ) {
      throw new IllegalArgumentException("Flag " + flag + " needs an integer, got '" + _flags.get(flag) + "'");
    }
  }

  /** Arguments that are not flags, in order. */
  public List<String> positional() {
    return _positional;
  }
}
