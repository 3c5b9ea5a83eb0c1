package com.cliffc.untangle.io;

import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.group.GNode;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.sig.Signature;
import com.cliffc.untangle.sig.Token;
import com.cliffc.untangle.util.Ary;
import com.cliffc.untangle.util.AryInt;
import com.cliffc.untangle.util.SB;
import com.cliffc.untangle.util.VersionedMarks;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.sig.SignatureOracle.SID_SELF;

/**
 * Postfix text form of a tree.  Groups render through their first
 * single-node member, so every group appears as one operator over its
 * operands; repeated groups become back-references counted in operators.
 * Endpoints beyond {@code z} and back-references beyond {@code 9} carry a
 * base-26 uppercase prefix.
 */
public final class Notation {
  private final GroupTree _t;

  public Notation( GroupTree t ) { _t = t; }

  /** Base-26 {@code A..Z} digits of {@code value}, most significant first. */
  public static void encodePrefix( SB sb, int value ) {
    char[] buf = new char[8];
    int n = 0;
    do {
      buf[n++] = (char)('A' + value % 26);
      value /= 26;
    } while( value != 0 );
    while( n > 0 ) sb.p(buf[--n]);
  }

  // Placeholder number as (prefixed) lowercase letter
  static void encodeEndpoint( SB sb, int value ) {
    if( value >= 26 ) encodePrefix(sb,value/26);
    sb.p((char)('a' + value % 26));
  }

  public String saveString( int id ) { return saveString(id,null); }

  /**
   * Render a reference.
   * @param transformOut when non-null, endpoints render as placeholders
   *                     {@code a, b, c..} in first-seen order and the
   *                     actual endpoints are appended here
   */
  public String saveString( int id, SB transformOut ) {
    int nid = id & ~IBIT;
    if( _t.N(nid)._sid != SID_SELF ) {
      assert transformOut == null;
      return saveStringNode(nid) + ((id & IBIT) != 0 ? "~" : "");
    }
    int gid = _t.chase(nid);
    SB name = new SB();

    if( gid < _t._nstart ) {
      if( gid == 0 ) name.p('0');
      else if( transformOut != null ) {
        encodeEndpoint(transformOut,gid - _t._kstart);
        name.p('a');
      } else encodeEndpoint(name,gid - _t._kstart);
      if( (id & IBIT) != 0 ) name.p('~');
      return name.toString();
    }

    int nextPlaceholder = 0;
    int nextNode = 0;
    int[] qtf = new int[4];
    AryInt stack = new AryInt();
    VersionedMarks visited = _t.pool().acquire();
    try {
      stack.push(gid);
      while( !stack.isEmpty() ) {
        int curr = _t.chase(stack.pop());

        if( curr < _t._nstart ) {
          int value = curr - _t._kstart;
          if( transformOut != null ) {
            if( !visited.test(curr) ) {
              visited.put(curr,nextPlaceholder++);
              encodeEndpoint(transformOut,value);
            }
            value = visited.get(curr,0);
          }
          encodeEndpoint(name,value);
          continue;
        }

        int first = _t.first1n9(curr);
        if( first == 0 ) throw new InconsistencyException("group misses 1n9",curr);
        _t.decode1n9(first,qtf);
        int Q = qtf[0], Tu = qtf[1], Ti = qtf[2], F = qtf[3];

        if( !visited.test(curr) ) {
          // Revisit after the operands
          visited.put(curr,-1);
          stack.push(curr);
          if( F >= _t._kstart ) stack.push(F);
          if( Tu != F && Tu >= _t._kstart ) stack.push(Tu);
          if( Q >= _t._kstart ) stack.push(Q);
        } else if( visited.get(curr,0) == -1 ) {
          visited.put(curr,nextNode++);
          if( Ti != 0 ) name.p(Tu == 0 ? '+' : F == 0 ? '>' : F == Tu ? '^' : '!');
          else          name.p(F == 0 ? '&' : '?');
        } else {
          int dist = nextNode - visited.get(curr,0);
          if( dist >= 10 ) encodePrefix(name,dist/10);
          name.p((char)('0' + dist % 10));
        }
      }
    } finally {
      _t.pool().release(visited);
    }
    if( (id & IBIT) != 0 ) name.p('~');
    return name.toString();
  }

  /**
   * Render one node by expanding its signature, each slot rendered as its
   * group.  Structure shared across slots is not detected; components are
   * separated by spaces, so the result is for reading, not reloading.
   */
  public String saveStringNode( int nid ) {
    GNode n = _t.N(nid);
    Signature sig = _t._db.signature(n._sid);
    Ary<String> stack = new Ary<>(String.class);
    Ary<String> nodes = new Ary<>(String.class);
    for( Token tok : sig._tokens ) {
      switch( tok._kind ) {
      case ZERO:     stack.add("0"); break;
      case ENDPOINT: stack.add(saveString(n._slots[tok._val])); break;
      case BACKREF:  stack.add(nodes.at(nodes._len - tok._val)); break;
      case NOT:      stack.add(stack.pop()+"~"); break;
      default: {
        String r = stack.pop(), l = stack.pop();
        if( tok._kind._arity == 3 ) l = stack.pop()+" "+l;
        String s = l+" "+r+tok._kind._ch;
        stack.add(s);
        nodes.add(s);
      }
      }
    }
    assert stack._len == 1;
    return stack.at(0);
  }

  /**
   * Decode a transform string into an id map indexed by entry point id.
   * Unmapped entries hold the reserved sentinel 1.
   */
  public int[] decodeTransform( String transform ) {
    int[] map = new int[_t._nstart];
    for( int i=_t._kstart; i<_t._nstart; i++ ) map[i] = 1;
    int t = _t._kstart;
    for( int i=0; i<transform.length(); i++ ) {
      char c = transform.charAt(i);
      if( c == ' ' ) continue;
      if( t >= _t._nstart )
        throw new UntangleException(ErrMsg.syntax("[transform string too long]",transform));
      int v = 0;
      while( c >= 'A' && c <= 'Z' ) {
        v = v*26 + (c - 'A');
        c = ++i < transform.length() ? transform.charAt(i) : '\0';
      }
      if( c < 'a' || c > 'z' )
        throw new UntangleException(ErrMsg.syntax("[bad token '"+(c=='\0' ? "" : String.valueOf(c))+"' in transform]",transform));
      int id = _t._kstart + v*26 + (c - 'a');
      if( id >= _t._nstart )
        throw new UntangleException(ErrMsg.syntax("[endpoint out of range: "+id+"]",transform));
      map[t++] = id;
    }
    return map;
  }

  public int loadStringSafe( String name ) { return loadStringSafe(name,null); }

  /**
   * Build a postfix string into the tree, feeding every operator through
   * the normaliser.
   * @param skin endpoint transform; when null, the part of {@code name}
   *             after {@code /} is used
   * @return chased reference to the result, polarity kept
   * @throws UntangleException on malformed input
   */
  public int loadStringSafe( String name, String skin ) {
    if( name.isEmpty() ) throw new UntangleException(ErrMsg.syntax("[empty name]",name));
    if( skin == null ) skin = Token.transformOf(name);
    int[] map = skin == null || skin.isEmpty() ? null : decodeTransform(skin);

    Token[] toks = Token.tokenize(name);
    AryInt stack = new AryInt();
    AryInt nodes = new AryInt();
    int[] qtf = new int[4];
    for( Token tok : toks ) {
      switch( tok._kind ) {
      case ZERO:
        stack.push(0);
        continue;
      case BACKREF: {
        if( tok._val < 1 || tok._val > nodes._len )
          throw new UntangleException(ErrMsg.syntax("[node out of range: "+(_t._nstart + nodes._len - tok._val)+"]",name));
        stack.push(nodes.at(nodes._len - tok._val));
        continue;
      }
      case ENDPOINT: {
        int v = _t._kstart + tok._val;
        if( v >= _t._nstart )
          throw new UntangleException(ErrMsg.syntax("[endpoint out of range: "+v+"]",name));
        if( map != null ) {
          v = map[v];
          if( v == 1 ) throw new UntangleException(ErrMsg.syntax("[endpoint not in transform: "+tok+"]",name));
        }
        stack.push(v);
        continue;
      }
      case NOT:
        if( stack.isEmpty() ) throw new UntangleException(ErrMsg.syntax("[stack underflow]",name));
        stack.xorLast(IBIT);
        continue;
      default:
        if( stack._len < tok._kind._arity )
          throw new UntangleException(ErrMsg.syntax("[stack underflow]",name));
        Token.popQTF(tok._kind,stack,qtf);
      }
      int nid = _t.addNormaliseNode(qtf[0],qtf[1] ^ qtf[2],qtf[3]);
      stack.push(nid);
      nodes.push(nid);
      if( stack._len > _t._maxNodes )
        throw new UntangleException(ErrMsg.syntax("[stack overflow]",name));
    }
    if( stack._len != 1 )
      throw new UntangleException(ErrMsg.syntax(stack.isEmpty() ? "[stack underflow]" : "[stack not empty]",name));
    return _t.chaseRef(stack.at(0));
  }
}
