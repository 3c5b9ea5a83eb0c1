package com.cliffc.untangle.util;

import java.util.Arrays;

// Growable int stack; holds node references, so the top may carry IBIT
public class AryInt {
  public int[] _es = new int[4];
  public int _len;

  public boolean isEmpty() { return _len==0; }

  /** @param i element index
   *  @return element being returned; throws if OOB */
  public int at( int i ) {
    range_check(i);
    return _es[i];
  }

  /** @return remove and return last element */
  public int pop( ) {
    range_check(0);
    return _es[--_len];
  }

  /** @return 'this' for flow-coding */
  public AryInt push( int e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,_es.length<<1);
    _es[_len++] = e;
    return this;
  }

  /** Flip {@code bits} in the top element; used to invert the last operand. */
  public void xorLast( int bits ) {
    range_check(0);
    _es[_len-1] ^= bits;
  }

  @Override public String toString() { return Arrays.toString(Arrays.copyOf(_es,_len)); }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
