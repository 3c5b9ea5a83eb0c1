package com.cliffc.untangle.eval;

import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.group.GNode;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.sig.Signature;
import com.cliffc.untangle.sig.Token;

import static com.cliffc.untangle.group.GroupTree.IBIT;

/**
 * Bit-parallel evaluation: every id holds a 64-bit word, one bit per lane,
 * so 64 key assignments are evaluated at once.
 */
public final class Evaluator {
  private final GroupTree _t;
  private long[] _v = new long[0];

  public Evaluator( GroupTree t ) { _t = t; }

  /**
   * Key words for one round of an exhaustive enumeration: lane {@code l} of
   * round {@code r} holds assignment {@code r*64+l}, key {@code i} taking bit
   * {@code i} of it.
   */
  public static long[] laneKeys( int numKeys, int round ) {
    long[] keys = new long[numKeys];
    for( int l=0; l<64; l++ ) {
      long assignment = (long)round*64 + l;
      for( int i=0; i<numKeys && i<63; i++ )
        if( ((assignment >>> i) & 1) != 0 )
          keys[i] |= 1L << l;
    }
    return keys;
  }

  /** @return number of 64-lane rounds covering every assignment of {@code numKeys} keys */
  public static int numRounds( int numKeys ) {
    return numKeys <= 6 ? 1 : 1 << Math.min(numKeys-6,24);
  }

  /**
   * Evaluate every live group through its single-node member.
   * @param keys one word per entry point, starting at {@code kstart}
   * @return words indexed by id; headers and entry points hold their value
   */
  public long[] evalGroups( long[] keys ) {
    if( _v.length < _t._ncount ) _v = new long[_t._ncount];
    long[] v = _v;
    for( int i=_t._kstart; i<_t._nstart; i++ )
      v[i] = keys[i-_t._kstart];
    int[] qtf = new int[4];
    for( int gid=_t._nstart; gid<_t._ncount; gid++ ) {
      if( !_t.isHeader(gid) ) continue;
      int first = _t.first1n9(gid);
      if( first == 0 ) throw new InconsistencyException("group misses 1n9",gid);
      _t.decode1n9(first,qtf);
      if( qtf[0] >= gid || qtf[1] >= gid || qtf[3] >= gid )
        throw new InconsistencyException("forward reference",gid);
      long t = v[qtf[1]];
      if( qtf[2] != 0 ) t = ~t;
      v[gid] = ite(v[qtf[0]],t,v[qtf[3]]);
    }
    return v;
  }

  /** Value of a reference after {@link #evalGroups}. */
  public long value( int ref ) {
    long x = _v[_t.chase(ref & ~IBIT)];
    return (ref & IBIT) != 0 ? ~x : x;
  }

  /** Evaluate one node through its signature, after {@link #evalGroups}. */
  public long evalNode( int nid ) {
    GNode n = _t.N(nid);
    Signature sig = _t._db.signature(n._sid);
    long[] args = new long[sig._numPlaceholder];
    for( int i=0; i<args.length; i++ ) args[i] = value(n._slots[i]);
    return evalTokens(sig._tokens,args,sig._name);
  }

  /**
   * Evaluate notation directly, without building anything.
   * @param map optional entry point transform, as from {@code Notation.decodeTransform}
   */
  public static long evalString( String name, int kstart, int nstart, long[] keys, int[] map ) {
    Token[] toks = Token.tokenize(name);
    long[] args = new long[nstart-kstart];
    for( int i=kstart; i<nstart; i++ ) {
      int id = map == null ? i : map[i];
      args[i-kstart] = id < kstart ? 0 : keys[id-kstart];
    }
    return evalTokens(toks,args,name);
  }

  private static long ite( long q, long t, long f ) { return (q & t) | (~q & f); }

  // Stack machine over words; endpoints index args
  private static long evalTokens( Token[] toks, long[] args, String name ) {
    long[] stack = new long[toks.length+1];
    long[] nodes = new long[toks.length+1];
    int sp = 0, np = 0;
    for( Token tok : toks ) {
      switch( tok._kind ) {
      case ZERO: stack[sp++] = 0; break;
      case ENDPOINT:
        if( tok._val >= args.length ) throw new UntangleException(ErrMsg.syntax("[endpoint out of range: "+tok._val+"]",name));
        stack[sp++] = args[tok._val];
        break;
      case BACKREF:
        if( tok._val < 1 || tok._val > np ) throw new UntangleException(ErrMsg.syntax("[node out of range: "+(np-tok._val)+"]",name));
        stack[sp++] = nodes[np-tok._val];
        break;
      case NOT:
        if( sp < 1 ) throw new UntangleException(ErrMsg.syntax("[stack underflow]",name));
        stack[sp-1] = ~stack[sp-1];
        break;
      default: {
        if( sp < tok._kind._arity ) throw new UntangleException(ErrMsg.syntax("[stack underflow]",name));
        long q, t, f;
        switch( tok._kind ) {
        case OR:  f = stack[--sp]; q = stack[--sp]; t = ~0L;        break;
        case GT:  t = ~stack[--sp]; q = stack[--sp]; f = 0;         break;
        case NE:  f = stack[--sp]; t = ~f; q = stack[--sp];         break;
        case AND: t = stack[--sp]; q = stack[--sp]; f = 0;          break;
        case QNTF: f = stack[--sp]; t = ~stack[--sp]; q = stack[--sp]; break;
        default:  f = stack[--sp]; t = stack[--sp]; q = stack[--sp]; break;
        }
        long r = ite(q,t,f);
        stack[sp++] = r;
        nodes[np++] = r;
      }
      }
    }
    if( sp != 1 ) throw new UntangleException(ErrMsg.syntax(sp == 0 ? "[stack underflow]" : "[stack not empty]",name));
    return stack[0];
  }
}
