package com.cliffc.untangle.sig;

import java.util.ArrayList;
import java.util.HashMap;

/**
 * Interned endpoint transforms.  A transform is a string of distinct
 * placeholder letters {@code a..i}; character {@code i} names the slot that
 * placeholder {@code i} binds to.  Id 0 is the empty transform.
 */
public final class Transforms {
  public static final int IBIT = 0x80000000;
  private final HashMap<String,Integer> _ids = new HashMap<>();
  private final ArrayList<String> _names = new ArrayList<>();

  public Transforms() { intern(""); }

  /** @return id of a transform, or {@link #IBIT} when not a valid transform */
  public int lookup( String name ) {
    Integer id = _ids.get(name);
    if( id != null ) return id;
    return valid(name) ? intern(name) : IBIT;
  }

  public String name( int tid ) { return _names.get(tid); }
  public int size() { return _names.size(); }

  private int intern( String name ) {
    int id = _names.size();
    _names.add(name);
    _ids.put(name,id);
    return id;
  }

  static boolean valid( String name ) {
    if( name.length() > Footprint.NUMVARS ) return false;
    int seen=0;
    for( int i=0; i<name.length(); i++ ) {
      int c = name.charAt(i)-'a';
      if( c < 0 || c >= Footprint.NUMVARS || (seen & (1<<c)) != 0 ) return false;
      seen |= 1<<c;
    }
    return true;
  }

  /** Apply a transform to a slot vector: {@code out[i] = slots[t[i]-'a']}. */
  public static int[] apply( String t, int[] slots, int[] out ) {
    for( int i=0; i<t.length(); i++ )
      out[i] = slots[t.charAt(i)-'a'];
    return out;
  }
}
