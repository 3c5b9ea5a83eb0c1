package com.cliffc.untangle.util;

import java.util.Arrays;

/**
 * Bit set with an O(1) clear.  An index is marked this round iff its stamp
 * equals the current round; {@link #bump} starts a new round.  Counter
 * wraparound forces a full clear.  Optionally carries an int value per index,
 * valid only while the index is marked.
 */
public final class VersionedMarks {
  private int[] _stamps;
  private int[] _vals;
  private int _round;

  public VersionedMarks( int size ) { this(size,0); }
  // Start at a given round; tests use this to exercise wraparound
  VersionedMarks( int size, int round ) {
    _stamps = new int[Math.max(16,size)];
    _vals   = new int[_stamps.length];
    _round  = round;
    bump();
  }

  /** Start a new round; all indices become unmarked. */
  public VersionedMarks bump() {
    if( ++_round == 0 ) {       // Wrapped; old stamps could alias
      Arrays.fill(_stamps,0);
      _round = 1;
    }
    return this;
  }

  public int round() { return _round; }

  public boolean test( int idx ) { return idx < _stamps.length && _stamps[idx]==_round; }
  public void set( int idx ) { grow(idx); _stamps[idx]=_round; }
  // Test and set; returns the prior mark
  public boolean tset( int idx ) { boolean b = test(idx); set(idx); return b; }
  public void clr( int idx ) { if( idx < _stamps.length && _stamps[idx]==_round ) _stamps[idx]=_round-1; }

  // Mark and store a value
  public void put( int idx, int val ) { set(idx); _vals[idx]=val; }
  // Value at a marked index, or the default when not marked this round
  public int get( int idx, int dflt ) { return test(idx) ? _vals[idx] : dflt; }

  private void grow( int idx ) {
    if( idx < _stamps.length ) return;
    int len = Util.pow2(idx+1);
    _stamps = Arrays.copyOf(_stamps,len);
    _vals   = Arrays.copyOf(_vals  ,len);
  }
}
