package com.cliffc.untangle.sig;

import java.util.Arrays;

/**
 * Truth table over the nine slot variables, 512 bits.  Bit {@code x} holds
 * the function value for the assignment whose variable {@code v} is bit
 * {@code v} of {@code x}.
 */
public final class Footprint {
  public static final int NUMVARS = 9;
  static final int WORDS = 8;
  private static final long[] VAR_LO = {
    0xAAAAAAAAAAAAAAAAL, 0xCCCCCCCCCCCCCCCCL, 0xF0F0F0F0F0F0F0F0L,
    0xFF00FF00FF00FF00L, 0xFFFF0000FFFF0000L, 0xFFFFFFFF00000000L,
  };
  private static final Footprint[] VARS = new Footprint[NUMVARS];
  public static final Footprint ZERO = new Footprint();
  static {
    for( int v=0; v<NUMVARS; v++ ) {
      Footprint fp = new Footprint();
      for( int w=0; w<WORDS; w++ )
        fp._bits[w] = v < 6 ? VAR_LO[v] : (((w>>(v-6))&1)!=0 ? -1L : 0L);
      VARS[v] = fp;
    }
  }

  final long[] _bits = new long[WORDS];

  public static Footprint var( int v ) { return VARS[v]; }

  // Q ? (T ^ Ti) : F
  public static Footprint ite( Footprint q, Footprint t, boolean ti, Footprint f ) {
    Footprint r = new Footprint();
    for( int w=0; w<WORDS; w++ ) {
      long tw = ti ? ~t._bits[w] : t._bits[w];
      r._bits[w] = (q._bits[w] & tw) | (~q._bits[w] & f._bits[w]);
    }
    return r;
  }

  public Footprint not() {
    Footprint r = new Footprint();
    for( int w=0; w<WORDS; w++ ) r._bits[w] = ~_bits[w];
    return r;
  }

  public boolean isZero() {
    for( long w : _bits ) if( w != 0 ) return false;
    return true;
  }

  public boolean bit( int x ) { return ((_bits[x>>6] >>> (x&63)) & 1) != 0; }

  /** @return whether the function changes with variable {@code v} */
  public boolean depends( int v ) {
    if( v < 6 ) {
      long hi = VAR_LO[v];
      int shift = 1<<v;
      for( long w : _bits )
        if( ((w & hi) >>> shift) != (w & ~hi) )
          return true;
      return false;
    }
    int b = 1<<(v-6);
    for( int w=0; w<WORDS; w++ )
      if( (w & b)==0 && _bits[w] != _bits[w|b] )
        return true;
    return false;
  }

  /** Truth table restricted to {@code k<=6} variables: bit {@code x} is the
   *  value where variable {@code vars[j]} takes bit {@code j} of {@code x}
   *  and every other variable is false. */
  public long compact( int[] vars, int k ) {
    assert k <= 6;
    long r=0;
    for( int x=0; x < (1<<k); x++ ) {
      int a=0;
      for( int j=0; j<k; j++ )
        if( ((x>>j)&1) != 0 ) a |= 1<<vars[j];
      if( bit(a) ) r |= 1L<<x;
    }
    return r;
  }

  /** Evaluate a token stream with placeholder {@code i} bound to {@code args[i]}. */
  public static Footprint eval( Token[] toks, Footprint[] args ) {
    Footprint[] stack = new Footprint[toks.length];
    Footprint[] nodes = new Footprint[toks.length];
    int sp=0, nn=0;
    for( Token t : toks ) {
      Footprint q, tt, f;
      switch( t._kind ) {
      case ZERO:     stack[sp++] = ZERO; continue;
      case ENDPOINT: stack[sp++] = args[t._val]; continue;
      case BACKREF:  stack[sp++] = nodes[nn - t._val]; continue;
      case NOT:      stack[sp-1] = stack[sp-1].not(); continue;
      case OR:   f = stack[--sp]; tt = ZERO;        q = stack[--sp]; break;
      case GT:   f = ZERO;        tt = stack[--sp]; q = stack[--sp]; break;
      case NE:   f = stack[--sp]; tt = f;           q = stack[--sp]; break;
      case AND:  f = ZERO;        tt = stack[--sp]; q = stack[--sp]; break;
      case QNTF:
      case QTF:  f = stack[--sp]; tt = stack[--sp]; q = stack[--sp]; break;
      default: throw new IllegalStateException();
      }
      Footprint r = ite(q,tt,t._kind.invertsT(),f);
      stack[sp++] = r;
      nodes[nn++] = r;
    }
    assert sp==1;
    return stack[0];
  }

  @Override public boolean equals( Object o ) {
    return o instanceof Footprint fp && Arrays.equals(_bits,fp._bits);
  }
  @Override public int hashCode() { return Arrays.hashCode(_bits); }
}
