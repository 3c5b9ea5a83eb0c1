package com.cliffc.untangle.sig;

import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.util.Ary;
import com.cliffc.untangle.util.AryInt;

/**
 * One instruction of the postfix notation.  Names are tokenized once and the
 * resulting stream is matched by the loaders, the re-expansion routines and
 * the evaluators.
 * <p>
 * Grammar: {@code 0} pushes false; {@code 1-9} back-reference the n'th most
 * recent operator result; {@code a-z} push a placeholder; uppercase letters
 * are a base-26 prefix widening the following digit (times 10) or letter
 * (times 26); {@code + > ^ ! & ?} are the operators; {@code ~} inverts the top
 * of stack; spaces are ignored and {@code /} starts a transform.
 */
public final class Token {
  public enum Kind {
    ZERO    ('0',0),
    ENDPOINT('a',0),
    BACKREF ('1',0),
    OR      ('+',2),            // Q ? !0 : F
    GT      ('>',2),            // Q ? !T : 0
    NE      ('^',2),            // Q ? !F : F
    AND     ('&',2),            // Q ?  T : 0
    QNTF    ('!',3),            // Q ? !T : F
    QTF     ('?',3),            // Q ?  T : F
    NOT     ('~',1);
    public final char _ch;
    public final int _arity;
    Kind( char ch, int arity ) { _ch=ch; _arity=arity; }
    // Operators create a node
    public boolean isOp() { return this.ordinal() >= OR.ordinal() && this != NOT; }
    // Operator with an inverted T leg
    public boolean invertsT() { return this==OR || this==GT || this==NE || this==QNTF; }
  }

  public final Kind _kind;
  public final int _val;        // Placeholder number or back-reference distance

  private Token( Kind kind, int val ) { _kind=kind; _val=val; }
  private static final Token[] FIXED = new Token[Kind.values().length];
  static {
    for( Kind k : Kind.values() )
      if( k != Kind.ENDPOINT && k != Kind.BACKREF )
        FIXED[k.ordinal()] = new Token(k,0);
  }
  public static Token of( Kind k ) { return FIXED[k.ordinal()]; }
  public static Token endpoint( int v ) { return new Token(Kind.ENDPOINT,v); }
  public static Token backref ( int v ) { return new Token(Kind.BACKREF ,v); }

  /** Tokenize the pattern part of a name, stopping at the first {@code /}.
   *  @throws UntangleException on a bad token */
  public static Token[] tokenize( String name ) {
    Ary<Token> toks = new Ary<>(Token.class);
    for( int i=0; i<name.length(); i++ ) {
      char c = name.charAt(i);
      if( c=='/' ) break;
      if( c==' ' ) continue;
      if( c=='0' ) { toks.add(of(Kind.ZERO)); continue; }
      if( c>='1' && c<='9' ) { toks.add(backref(c-'0')); continue; }
      if( c>='a' && c<='z' ) { toks.add(endpoint(c-'a')); continue; }
      if( c>='A' && c<='Z' ) {
        int v=0;
        while( i<name.length() && name.charAt(i)>='A' && name.charAt(i)<='Z' )
          v = v*26 + (name.charAt(i++)-'A');
        char d = i<name.length() ? name.charAt(i) : '\0';
        if( d>='0' && d<='9' ) toks.add(backref(v*10 + (d-'0')));
        else if( d>='a' && d<='z' ) toks.add(endpoint(v*26 + (d-'a')));
        else throw bad(d,name);
        continue;
      }
      Kind k = op(c);
      if( k==null ) throw bad(c,name);
      toks.add(of(k));
    }
    return toks.asAry();
  }

  /** @return the transform part of a name, after the {@code /}, or null */
  public static String transformOf( String name ) {
    int idx = name.indexOf('/');
    return idx < 0 ? null : name.substring(idx+1);
  }

  private static Kind op( char c ) {
    switch( c ) {
    case '+': return Kind.OR;
    case '>': return Kind.GT;
    case '^': return Kind.NE;
    case '!': return Kind.QNTF;
    case '&': return Kind.AND;
    case '?': return Kind.QTF;
    case '~': return Kind.NOT;
    default:  return null;
    }
  }

  private static UntangleException bad( char c, String name ) {
    return new UntangleException(ErrMsg.syntax("[bad token '"+(c=='\0' ? "" : String.valueOf(c))+"']",name));
  }

  /** Pop the operands of an operator into {Q, Tu, Ti, F}.  The caller checks
   *  the stack holds at least {@code arity} entries. */
  public static int[] popQTF( Kind k, AryInt stack, int[] qtf ) {
    switch( k ) {
    case OR:   qtf[3]=stack.pop(); qtf[1]=0;           qtf[0]=stack.pop(); break;
    case GT:   qtf[3]=0;           qtf[1]=stack.pop(); qtf[0]=stack.pop(); break;
    case NE:   qtf[3]=stack.pop(); qtf[1]=qtf[3];      qtf[0]=stack.pop(); break;
    case AND:  qtf[3]=0;           qtf[1]=stack.pop(); qtf[0]=stack.pop(); break;
    case QNTF:
    case QTF:  qtf[3]=stack.pop(); qtf[1]=stack.pop(); qtf[0]=stack.pop(); break;
    default: throw new IllegalArgumentException("not an operator: "+k);
    }
    qtf[2] = k.invertsT() ? 0x80000000 : 0;
    return qtf;
  }

  /** Count of operator tokens; the structure size of a signature name. */
  public static int countOps( Token[] toks ) {
    int n=0;
    for( Token t : toks ) if( t._kind.isOp() ) n++;
    return n;
  }

  @Override public String toString() {
    switch( _kind ) {
    case ENDPOINT: return _val < 26 ? String.valueOf((char)('a'+_val)) : "#"+_val;
    case BACKREF:  return _val < 10 ? String.valueOf((char)('0'+_val)) : "@"+_val;
    default:       return String.valueOf(_kind._ch);
    }
  }
}
