package com.cliffc.untangle.sig;

/** A canonical shape: a postfix structure over placeholders. */
public final class Signature {
  public final int _sid;
  public final String _name;
  public final int _numPlaceholder;
  public final int _size;       // Operator count
  public final Token[] _tokens;
  public String[] _swaps = new String[0]; // Non-identity placeholder permutations preserving the function
  public int _firstMember;      // 0 when the signature has no alternate structure

  public Signature( int sid, String name, int numPlaceholder ) {
    _sid = sid;
    _name = name;
    _numPlaceholder = numPlaceholder;
    _tokens = Token.tokenize(name);
    _size = Token.countOps(_tokens);
  }
  @Override public String toString() { return _name; }
}
