package com.cliffc.untangle.util;

/**
 * Pool of {@link VersionedMarks}.  Acquire and release nest strictly LIFO;
 * an acquired map is bumped so it starts with nothing marked.
 */
public final class MarksPool {
  private final Ary<VersionedMarks> _free = new Ary<>(VersionedMarks.class);
  private final Ary<VersionedMarks> _busy = new Ary<>(VersionedMarks.class);
  private int _size;

  public MarksPool( int size ) { _size = size; }

  // Hint for freshly made maps; they still grow on demand
  public void resize( int size ) { _size = Math.max(_size,size); }

  public VersionedMarks acquire() {
    VersionedMarks m = _free.isEmpty() ? new VersionedMarks(_size) : _free.pop();
    _busy.add(m);
    return m.bump();
  }

  public void release( VersionedMarks m ) {
    if( _busy.isEmpty() || _busy.last() != m )
      throw new IllegalStateException("marks released out of order");
    _free.add(_busy.pop());
  }

  public int inUse() { return _busy.len(); }
}
