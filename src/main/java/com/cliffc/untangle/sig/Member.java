package com.cliffc.untangle.sig;

/** An alternate structure of a signature.  Placeholder {@code i} of the member
 *  binds to the signature slot named by character {@code i} of the transform. */
public final class Member {
  public final int _mid;
  public final int _sid;
  public final String _name;
  public final String _transform;
  public final Token[] _tokens;
  public int _nextMember;       // Chain of members of the same signature, 0 ends

  public Member( int mid, int sid, String name, String transform ) {
    _mid = mid;
    _sid = sid;
    _name = name;
    _transform = transform;
    _tokens = Token.tokenize(name);
  }
  @Override public String toString() { return _name+"/"+_transform; }
}
