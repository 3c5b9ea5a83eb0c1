package com.cliffc.untangle.sig;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.util.Ary;
import com.cliffc.untangle.util.AryInt;
import com.cliffc.untangle.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.zip.CRC32;

/**
 * In-memory signature database.  Enumerates every normalised postfix
 * structure up to a maximum operator count, and groups them by function
 * class under placeholder permutation.  The first structure of a class names
 * the signature; later structures of the same size become its members.
 * <p>
 * Pattern lookups evaluate {@code Q ? (T ^ Ti) : F} as a truth table over the
 * merged slot positions and classify the result.  Results are cached.
 */
public class GeneratedOracle implements SignatureOracle {
  private static final Logger LOG = LogManager.getLogger(GeneratedOracle.class);

  // Largest placeholder count a class may have; truth tables compact into a long
  static final int MAXK = 6;
  private static final String[] ONE_NODE = { "ab+", "ab>", "ab^", "ab&", "abc!", "abc?" };
  private static final Token.Kind[] ALL_OPS  = { Token.Kind.OR, Token.Kind.GT, Token.Kind.NE, Token.Kind.AND, Token.Kind.QNTF, Token.Kind.QTF };
  private static final Token.Kind[] PURE_OPS = { Token.Kind.OR, Token.Kind.GT, Token.Kind.NE, Token.Kind.QNTF };

  // Placeholder permutations per count, identity first, and the bit maps they induce
  static final int[][][] PERMS = new int[MAXK+1][][];
  private static final int[][][] PMAPS = new int[MAXK+1][][];
  static {
    for( int k=0; k<=MAXK; k++ ) {
      ArrayList<int[]> ps = new ArrayList<>();
      permute(new int[k],0,0,ps);
      PERMS[k] = ps.toArray(new int[0][]);
      PMAPS[k] = new int[PERMS[k].length][1<<k];
      for( int p=0; p<PERMS[k].length; p++ )
        for( int x=0; x < (1<<k); x++ ) {
          int y=0;
          for( int i=0; i<k; i++ )
            if( ((x>>i)&1) != 0 ) y |= 1<<PERMS[k][p][i];
          PMAPS[k][p][x] = y;
        }
    }
  }
  private static void permute( int[] p, int i, int used, ArrayList<int[]> out ) {
    if( i==p.length ) { out.add(p.clone()); return; }
    for( int v=0; v<p.length; v++ )
      if( (used & (1<<v))==0 ) { p[i]=v; permute(p,i+1,used|(1<<v),out); }
  }

  private final Ary<Signature> _sigs = new Ary<>(Signature.class);
  private final HashMap<String,Integer> _sigByName = new HashMap<>();
  private final ArrayList<Long> _sigTables = new ArrayList<>();
  private final Ary<Member> _members = new Ary<>(Member.class);
  @SuppressWarnings("unchecked")
  private final HashMap<Long,Integer>[] _classes = new HashMap[MAXK+1];
  private final Transforms _tx = new Transforms();

  private final HashMap<Long,Integer> _firstIds = new HashMap<>();
  private final AryInt _firsts = new AryInt(); // (sidQ, sidT, tidT) triples
  private final HashMap<Long,Integer> _secondIds = new HashMap<>();
  private final Ary<Pattern> _patterns = new Ary<>(Pattern.class);
  private final int _sidCRC;
  private final int _maxSize;
  private final boolean _pure;

  public GeneratedOracle( Context ctx ) { this(ctx._sigSize, ctx.pure()); }

  public GeneratedOracle( int maxSize, boolean pure ) {
    _maxSize = maxSize;
    _pure = pure;
    for( int k=0; k<=MAXK; k++ ) _classes[k] = new HashMap<>();
    _sigs.add(null);              // sid 0 is reserved
    _sigTables.add(0L);
    _members.add(null);
    _patterns.add(null);
    _firsts.push(0).push(0).push(0);

    addSignature("0",0,0L);
    addSignature("a",1,0b10L);
    for( String name : ONE_NODE ) {
      Token[] toks = Token.tokenize(name);
      int k = name.length()-1;
      addSignature(name,k,table(toks,k));
    }
    for( int size=1; size<=maxSize; size++ )
      generate(size);

    CRC32 crc = new CRC32();
    for( int sid=1; sid<_sigs._len; sid++ ) {
      crc.update(_sigs.at(sid)._name.getBytes(StandardCharsets.US_ASCII));
      crc.update(0);
    }
    _sidCRC = (int)crc.getValue();
    LOG.debug("generated {} signatures, {} members, maxsize={} pure={}",_sigs._len-1,_members._len-1,maxSize,pure);
  }

  private int addSignature( String name, int k, long table ) {
    int sid = _sigs._len;
    Signature sig = new Signature(sid,name,k);
    _sigs.add(sig);
    _sigTables.add(table);
    _sigByName.put(name,sid);
    _classes[k].put(canon(table,k),sid);
    // Swap rules: automorphisms of the function
    ArrayList<String> swaps = new ArrayList<>();
    for( int p=1; p<PERMS[k].length; p++ )
      if( permute(table,k,p)==table )
        swaps.add(letters(PERMS[k][p],k));
    sig._swaps = swaps.toArray(new String[0]);
    return sid;
  }

  // Enumerate all structures with exactly 'size' operators
  private void generate( int size ) {
    Token.Kind[] ops = _pure && size > 1 ? PURE_OPS : ALL_OPS;
    for( Shape shape : shapes(size,ops) ) {
      int leaves = shape.leaves(0);
      int[] labels = new int[leaves];
      label(shape,labels,0,-1,size);
    }
  }

  // Restricted growth strings: placeholders appear in first-seen order
  private void label( Shape shape, int[] labels, int i, int max, int size ) {
    if( i==labels.length ) { consider(shape,labels,max+1,size); return; }
    for( int v=0; v<=max+1 && v<MAXK; v++ ) {
      labels[i]=v;
      label(shape,labels,i+1,Math.max(max,v),size);
    }
  }

  private void consider( Shape shape, int[] labels, int k, int size ) {
    SB sb = new SB();
    if( !shape.render(sb,labels,new int[1]) ) return; // Repeated operands
    String name = sb.toString();
    if( _sigByName.containsKey(name) ) return;
    Token[] toks = Token.tokenize(name);
    Footprint fp = eval(toks,k);
    for( int v=0; v<k; v++ )
      if( !fp.depends(v) ) return;  // Every placeholder must matter
    long table = fp.compact(identity(k),k);
    Integer sid = _classes[k].get(canon(table,k));
    if( sid==null ) {
      addSignature(name,k,table);
      return;
    }
    Signature sig = _sigs.at(sid);
    if( sig._size != size ) return; // Class already has a smaller structure
    int p = match(_sigTables.get(sid),k,table,k);
    if( p < 0 ) return;
    // Member placeholder i binds to signature slot perm^-1
    int[] inv = new int[k];
    for( int i=0; i<k; i++ ) inv[PERMS[k][p][i]] = i;
    int mid = _members._len;
    Member m = new Member(mid,sid,name,letters(inv,k));
    _members.add(m);
    if( sig._firstMember==0 ) sig._firstMember = mid;
    else {
      Member last = _members.at(sig._firstMember);
      while( last._nextMember != 0 ) last = _members.at(last._nextMember);
      last._nextMember = mid;
    }
  }

  // Tree shape with unlabeled leaves
  private static final class Shape {
    final Token.Kind _op;       // null for a leaf
    final Shape[] _kids;
    Shape( Token.Kind op, Shape[] kids ) { _op=op; _kids=kids; }
    int leaves( int n ) {
      if( _op==null ) return n+1;
      for( Shape k : _kids ) n = k.leaves(n);
      return n;
    }
    // Render postfix; false if an operator sees two equal operands
    boolean render( SB sb, int[] labels, int[] leaf ) {
      if( _op==null ) { sb.p((char)('a'+labels[leaf[0]++])); return true; }
      String[] args = new String[_kids.length];
      for( int i=0; i<_kids.length; i++ ) {
        SB arg = new SB();
        if( !_kids[i].render(arg,labels,leaf) ) return false;
        args[i] = arg.toString();
        for( int j=0; j<i; j++ )
          if( args[j].equals(args[i]) ) return false;
        sb.p(args[i]);
      }
      sb.p(_op._ch);
      return true;
    }
  }
  private static final Shape LEAF = new Shape(null,null);

  private static ArrayList<Shape> shapes( int size, Token.Kind[] ops ) {
    ArrayList<Shape> res = new ArrayList<>();
    if( size==0 ) { res.add(LEAF); return res; }
    for( Token.Kind op : ops )
      fill(op,new Shape[op._arity],op._arity-1,size-1,ops,res);
    return res;
  }
  // Distribute 'left' operators over the operands, the last operand first and heaviest first
  private static void fill( Token.Kind op, Shape[] kids, int i, int left, Token.Kind[] ops, ArrayList<Shape> res ) {
    if( i<0 ) {
      if( left==0 ) res.add(new Shape(op,kids.clone()));
      return;
    }
    int lo = i==0 ? left : 0;    // Q takes whatever is left
    for( int n=left; n>=lo; n-- ) {
      for( Shape s : shapes(n,ops) ) {
        kids[i]=s;
        fill(op,kids,i-1,left-n,ops,res);
      }
    }
  }

  private static Footprint eval( Token[] toks, int k ) {
    Footprint[] args = new Footprint[Math.max(k,1)];
    for( int i=0; i<k; i++ ) args[i] = Footprint.var(i);
    return Footprint.eval(toks,args);
  }
  private static long table( Token[] toks, int k ) { return eval(toks,k).compact(identity(k),k); }
  private static int[] identity( int k ) {
    int[] id = new int[k];
    for( int i=0; i<k; i++ ) id[i]=i;
    return id;
  }
  private static String letters( int[] p, int k ) {
    SB sb = new SB();
    for( int i=0; i<k; i++ ) sb.p((char)('a'+p[i]));
    return sb.toString();
  }

  // Table with placeholder i moved to position perm[i]
  static long permute( long table, int k, int p ) {
    int[] map = PMAPS[k][p];
    long r=0;
    for( int x=0; x < (1<<k); x++ )
      if( ((table>>>x)&1) != 0 ) r |= 1L<<map[x];
    return r;
  }
  static long canon( long table, int k ) {
    long min = table;
    for( int p=1; p<PERMS[k].length; p++ )
      min = Math.min(min,permute(table,k,p));
    return min;
  }
  // Permutation index turning 'sig' into 'target', or -1
  private static int match( long sig, int k, long target, int k2 ) {
    if( k != k2 ) return -1;
    for( int p=0; p<PERMS[k].length; p++ )
      if( permute(sig,k,p)==target ) return p;
    return -1;
  }

  @Override public int sidCRC() { return _sidCRC; }
  @Override public int numSignatures() { return _sigs._len; }
  @Override public Signature signature( int sid ) { return _sigs.at(sid); }
  @Override public int lookupSignature( String name ) {
    Integer sid = _sigByName.get(name);
    return sid==null ? 0 : sid;
  }
  @Override public Member member( int mid ) { return _members.at(mid); }
  public int numMembers() { return _members._len; }
  public int maxSize() { return _maxSize; }

  @Override public int lookupFwdTransform( String slots ) { return _tx.lookup(slots); }
  @Override public String fwdTransformName( int tid ) { return _tx.name(tid); }

  @Override public int lookupPatternFirst( int sidQ, int sidT, int tidT ) {
    int sidTu = sidT & ~IBIT;
    if( sidQ <= 0 || sidQ >= _sigs._len || sidTu <= 0 || sidTu >= _sigs._len ) return 0;
    if( tidT < 0 || tidT >= _tx.size() ) return 0;
    long key = ((long)sidQ<<42) | ((long)sidTu<<21) | tidT | (sidT<0 ? 1L<<63 : 0);
    Integer id = _firstIds.get(key);
    if( id != null ) return id;
    int nid = _firsts._len/3;
    _firsts.push(sidQ).push(sidT).push(tidT);
    _firstIds.put(key,nid);
    return nid;
  }

  @Override public int lookupPatternSecond( int idFirst, int sidF, int tidF ) {
    if( idFirst <= 0 || idFirst*3 >= _firsts._len ) return 0;
    if( sidF <= 0 || sidF >= _sigs._len || tidF < 0 || tidF >= _tx.size() ) return 0;
    long key = ((long)idFirst<<42) | ((long)sidF<<21) | tidF;
    Integer id = _secondIds.get(key);
    if( id != null ) return id;
    int res = classify(_firsts.at(idFirst*3),_firsts.at(idFirst*3+1),_firsts.at(idFirst*3+2),sidF,tidF);
    _secondIds.put(key,res);
    return res;
  }

  @Override public Pattern patternSecond( int idSecond ) { return _patterns.at(idSecond); }

  private int classify( int sidQ, int sidT, int tidT, int sidF, int tidF ) {
    Signature sigQ = _sigs.at(sidQ), sigT = _sigs.at(sidT & ~IBIT), sigF = _sigs.at(sidF);
    Footprint q = bind(sigQ,null);
    Footprint t = bind(sigT,_tx.name(tidT));
    Footprint f = bind(sigF,_tx.name(tidF));
    if( q==null || t==null || f==null ) return 0;
    Footprint r = Footprint.ite(q,t,sidT<0,f);

    int[] pos = new int[Footprint.NUMVARS];
    int k=0;
    for( int v=0; v<Footprint.NUMVARS; v++ )
      if( r.depends(v) ) {
        if( k==MAXK ) return 0;   // Wider than any signature
        pos[k++]=v;
      }
    int sidR;
    String extract;
    if( k==0 ) {
      assert r.isZero();          // Every operator preserves false
      sidR = SID_ZERO;
      extract = "";
    } else {
      long c = r.compact(pos,k);
      Integer sid = _classes[k].get(canon(c,k));
      if( sid==null ) return 0;
      sidR = sid;
      int p = match(_sigTables.get(sidR),k,c,k);
      assert p >= 0;
      SB sb = new SB();
      for( int i=0; i<k; i++ ) sb.p((char)('a'+pos[PERMS[k][p][i]]));
      extract = sb.toString();
    }
    int power = Math.max(0,sigQ._size + sigT._size + sigF._size + 1 - _sigs.at(sidR)._size);
    int id = _patterns._len;
    _patterns.add(new Pattern(sidR,extract,power));
    return id;
  }

  // Truth table of a signature with placeholder i bound to slot position tid[i]
  private Footprint bind( Signature sig, String tid ) {
    int k = sig._numPlaceholder;
    if( tid != null && tid.length() != k ) return null;
    Footprint[] args = new Footprint[Math.max(k,1)];
    for( int i=0; i<k; i++ )
      args[i] = Footprint.var(tid==null ? i : tid.charAt(i)-'a');
    return Footprint.eval(sig._tokens,args);
  }
}
