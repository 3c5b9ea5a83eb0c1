package com.cliffc.untangle.util;

import java.lang.reflect.Array;
import java.util.Arrays;

// Growable array of objects; ids index straight into it
public class Ary<E> {
  public E[] _es;
  public int _len;
  public Ary(Class<E> clazz) { _es = (E[]) Array.newInstance(clazz, 4); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }

  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    E e = _es[--_len];
    _es[_len] = null;
    return e;
  }

  /** Add element in amortized constant time
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,_es.length<<1);
    _es[_len++] = e;
    return this;
  }

  /** @return exactly-sized copy of the live elements */
  public E[] asAry() { return Arrays.copyOf(_es,_len); }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
