package com.cliffc.untangle.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB s() { _sb.append(' '); return this; }
  public SB nl( ) { return p('\n'); }
  // Remove last char
  public SB unchar() { _sb.setLength(_sb.length()-1); return this; }
  public int len() { return _sb.length(); }

  @Override public String toString() { return _sb.toString(); }
}
