package com.cliffc.untangle.group;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.sig.Signature;
import com.cliffc.untangle.sig.SignatureOracle;
import com.cliffc.untangle.util.MarksPool;
import com.cliffc.untangle.util.SB;
import com.cliffc.untangle.util.Util;
import com.cliffc.untangle.util.VersionedMarks;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

import static com.cliffc.untangle.sig.SignatureOracle.*;

/**
 * Arena of nodes grouped into equivalence classes.  Every group is a
 * circular doubly linked list threaded through its header; the header id is
 * the group id.  Ids below {@code _nstart} are the constant false (0), a
 * reserved sentinel (1) and the entry points, each its own singleton group.
 * <p>
 * References carry {@link #IBIT} to invert the referenced function.  Group
 * ids go stale as groups merge; resolve with {@link #chase} at every use.
 */
public class GroupTree {
  public static final int IBIT = 0x80000000;
  public static final int MAXSLOTS = GNode.MAXSLOTS;

  public final Context _ctx;
  public final SignatureOracle _db;
  public final int _kstart, _ostart, _estart, _nstart;
  public final int _maxNodes;
  public int _ncount;
  public int _numRoots;
  public int _system;
  public int _flags;
  public String[] _keyNames;    // Indexed by id; ids below kstart are reserved
  public String[] _rootNames;
  public int[] _roots;

  GNode[] _N;
  final NodeIndex _index;
  final MarksPool _pool;
  final Collector _coll;
  final Normaliser _norm;

  public GroupTree( @NotNull Context ctx, @NotNull SignatureOracle db, int kstart, int ostart, int estart, int nstart, int numRoots ) {
    if( kstart < 2 || ostart < kstart || estart < ostart || nstart < estart || numRoots < estart )
      throw new IllegalArgumentException("bad dimensions kstart="+kstart+" ostart="+ostart+" estart="+estart+" nstart="+nstart+" numroots="+numRoots);
    _ctx = ctx;
    _db = db;
    _kstart = kstart;
    _ostart = ostart;
    _estart = estart;
    _nstart = nstart;
    _numRoots = numRoots;
    _flags = ctx._flags;
    _maxNodes = Math.max(ctx._maxNode,nstart+16);
    _N = new GNode[Math.min(_maxNodes,Util.pow2(nstart*4))];
    _pool = new MarksPool(_N.length);
    _index = new NodeIndex(this,_N.length);
    _coll = new Collector(this);
    _norm = new Normaliser(this);

    // Constant false, then the sentinel and the entry points as singleton groups
    GNode zero = _N[0] = new GNode();
    zero.reset(0,SID_ZERO);
    zero._next = zero._prev = 0;
    for( int i=1; i<nstart; i++ ) {
      GNode n = _N[i] = new GNode();
      n.reset(i,SID_SELF);
      n._slots[0] = i;
      n._next = n._prev = i;
    }
    _ncount = nstart;

    _keyNames = new String[nstart];
    _keyNames[0] = "0";
    for( int i=1; i<kstart; i++ )
      _keyNames[i] = "KERROR";
    for( int i=kstart; i<nstart; i++ )
      _keyNames[i] = "k"+(i-kstart);
    _rootNames = new String[numRoots];
    _roots = new int[numRoots];
    for( int i=0; i<numRoots; i++ ) {
      _rootNames[i] = i < nstart ? _keyNames[i] : "r"+i;
      _roots[i] = i >= kstart && i < nstart ? i : 0;
    }
  }

  /** Forget all nodes, keeping the entry points. */
  public void rewind() {
    for( int i=_nstart; i<_ncount; i++ ) _N[i] = null;
    _ncount = _nstart;
    _index.clear();
  }

  public GNode N( int id ) { return _N[id]; }
  public Signature sig( int id ) { return _db.signature(_N[id]._sid); }
  public Normaliser normaliser() { return _norm; }
  public Collector collector() { return _coll; }

  /** @return a new unlinked, unindexed node */
  int newNode( int gid, int sid ) {
    if( _ncount > _maxNodes-10 )
      throw new UntangleException(ErrMsg.overflow(_maxNodes));
    int nid = _ncount++;
    if( nid >= _N.length ) {
      _N = Arrays.copyOf(_N,Math.min(_maxNodes,_N.length*2));
      _pool.resize(_N.length);
    }
    GNode n = _N[nid];
    if( n==null ) n = _N[nid] = new GNode();
    n.reset(gid,sid);
    n._next = n._prev = nid;
    return nid;
  }

  /** @return a new empty group; the header is a SELF node pointing at itself */
  int newHeader() {
    int gid = newNode(0,SID_SELF);
    GNode h = _N[gid];
    h._gid = gid;
    h._slots[0] = gid;
    return gid;
  }

  /** Follow group forwarding to the live header. */
  public int chase( int id ) {
    assert (id & IBIT)==0;
    while( id != _N[id]._gid )
      id = _N[id]._gid;
    return id;
  }
  /** Chase a reference, keeping its polarity. */
  public int chaseRef( int ref ) { return chase(ref & ~IBIT) | (ref & IBIT); }

  public boolean isHeader( int id ) { return _N[id]._gid==id; }
  // Unlinked and forwarding
  boolean isOrphan( int id ) { return id >= _nstart && _N[id]._next==id && _N[id]._gid != id; }

  /** Splice the (singleton) list of {@code nid} after {@code head}. */
  void linkNode( int head, int nid ) {
    assert head != nid;
    GNode h = _N[head], n = _N[nid];
    int headNext = h._next;
    int nodeLast = n._prev;
    _N[headNext]._prev = nodeLast;
    _N[nodeLast]._next = headNext;
    h._next = nid;
    n._prev = head;
  }

  /** Remove a node from its list; its group id is left in place to forward. */
  void unlinkNode( int nid ) {
    GNode n = _N[nid];
    _N[n._prev]._next = n._next;
    _N[n._next]._prev = n._prev;
    n._next = n._prev = nid;
  }

  /** Order a node against an anonymous (sid, slots): endpoints first, then
   *  signature id, then the chased slots. */
  int compare( int lhs, int sid, int[] slots ) {
    if( lhs < _nstart ) return -1;
    GNode l = _N[lhs];
    if( l._sid != sid ) return l._sid < sid ? -1 : 1;
    for( int i=0; i<MAXSLOTS; i++ ) {
      int a = chase(l._slots[i]), b = chase(slots[i]);
      if( a != b ) return a < b ? -1 : 1;
    }
    return 0;
  }

  /** First node of a group with the given signature, or 0 */
  int findSid( int gid, int sid ) {
    for( int iNode=_N[gid]._next; iNode != _N[iNode]._gid; iNode=_N[iNode]._next )
      if( _N[iNode]._sid==sid )
        return iNode;
    return 0;
  }

  public static boolean is1n9( int sid ) { return sid >= SID_OR && sid <= SID_QTF; }

  /** @return the first single-node member of a group, 0 if none */
  public int first1n9( int gid ) {
    for( int iNode=_N[gid]._next; iNode != _N[iNode]._gid; iNode=_N[iNode]._next )
      if( is1n9(_N[iNode]._sid) )
        return iNode;
    return 0;
  }

  /** Decode a single-node member into {Q, Tu, Ti, F}, slots chased. */
  public int[] decode1n9( int nid, int[] qtf ) {
    GNode n = _N[nid];
    int s0 = chase(n._slots[0]), s1 = chase(n._slots[1]), s2 = chase(n._slots[2]);
    switch( n._sid ) {
    case SID_OR:   qtf[0]=s0; qtf[1]=0;  qtf[2]=IBIT; qtf[3]=s1; break;
    case SID_GT:   qtf[0]=s0; qtf[1]=s1; qtf[2]=IBIT; qtf[3]=0;  break;
    case SID_NE:   qtf[0]=s0; qtf[1]=s1; qtf[2]=IBIT; qtf[3]=s1; break;
    case SID_AND:  qtf[0]=s0; qtf[1]=s1; qtf[2]=0;    qtf[3]=0;  break;
    case SID_QNTF: qtf[0]=s0; qtf[1]=s1; qtf[2]=IBIT; qtf[3]=s2; break;
    case SID_QTF:  qtf[0]=s0; qtf[1]=s1; qtf[2]=0;    qtf[3]=s2; break;
    default: throw new InconsistencyException("not a single-node signature",nid);
    }
    return qtf;
  }

  /** Build {@code Q ? T : F}, fully reduced.  Callers must chase the result. */
  public int addNormaliseNode( int Q, int T, int F ) {
    return _norm.addNormaliseNode(Q,T,F,IBIT,0);
  }

  public MarksPool pool() { return _pool; }

  /** Start a group while reloading a saved tree; nodes follow with {@link #restoreNode}. */
  public int restoreHeader() { return newHeader(); }

  /** Append a node to the tail of a group while reloading a saved tree. */
  public int restoreNode( int gid, int sid, int[] slots ) {
    if( !isHeader(gid) || gid < _nstart ) throw new InconsistencyException("node outside a group",gid);
    int nid = newNode(gid,sid);
    System.arraycopy(slots,0,_N[nid]._slots,0,MAXSLOTS);
    linkNode(_N[gid]._prev,nid);
    _index.insert(nid);
    return nid;
  }

  /** @return count of live groups */
  public int numGroups() {
    int cnt=0;
    for( int i=_nstart; i<_ncount; i++ ) if( isHeader(i) ) cnt++;
    return cnt;
  }
  /** @return count of listed non-header nodes */
  public int numListed() {
    int cnt=0;
    for( int i=_nstart; i<_ncount; i++ )
      if( !isHeader(i) && _N[i]._next != i ) cnt++;
    return cnt;
  }

  /**
   * Check the structural invariants.
   * @param allowForward tolerate what happens mid-construction: slots pointing at
   *                     later groups, and a group briefly without a single-node member
   * @throws InconsistencyException on the first violation
   */
  public void validateTree( boolean allowForward ) {
    if( _N[0]._gid != 0 || _N[0]._sid != SID_ZERO ) throw new InconsistencyException("constant false damaged",0);
    for( int i=1; i<_nstart; i++ ) {
      GNode k = _N[i];
      if( k._gid != i || k._sid != SID_SELF || k._slots[0] != i || k._next != i )
        throw new InconsistencyException("entry point damaged",i);
    }
    VersionedMarks seen = _pool.acquire();
    VersionedMarks sids = _pool.acquire();
    try {
      for( int gid=_nstart; gid<_ncount; gid++ ) {
        GNode h = _N[gid];
        if( h._gid < 0 || h._gid >= _ncount ) throw new InconsistencyException("group id out of range",gid);
        if( h._gid != gid ) continue;
        if( h._sid != SID_SELF || h._slots[0] != gid ) throw new InconsistencyException("bad group header",gid);
        if( h._next==gid ) throw new InconsistencyException("empty group",gid);
        sids.bump();
        boolean has1n9 = false;
        for( int iNode=h._next; iNode != gid; iNode=_N[iNode]._next ) {
          GNode n = _N[iNode];
          if( n._gid != gid ) throw new InconsistencyException("listed node in foreign group "+n._gid,iNode);
          if( _N[n._next]._prev != iNode ) throw new InconsistencyException("broken list",iNode);
          if( seen.tset(iNode) ) throw new InconsistencyException("node listed twice",iNode);
          if( sids.tset(n._sid) ) throw new InconsistencyException("duplicate signature "+n._sid+" in group "+gid,iNode);
          if( is1n9(n._sid) ) has1n9 = true;
          int k = _db.signature(n._sid)._numPlaceholder;
          for( int i=0; i<k; i++ ) {
            int s = chase(n._slots[i]);
            if( s==gid ) throw new InconsistencyException("self reference in group "+gid,iNode);
            if( s > gid && !allowForward ) throw new InconsistencyException("forward reference to "+s+" in group "+gid,iNode);
          }
        }
        if( !has1n9 && !allowForward ) throw new InconsistencyException("group misses 1n9",gid);
      }
      // Linked nodes must belong to a live list
      for( int i=_nstart; i<_ncount; i++ )
        if( !isHeader(i) && _N[i]._next != i && !seen.test(i) )
          throw new InconsistencyException("linked orphan",i);
    } finally {
      _pool.release(sids);
      _pool.release(seen);
    }
  }

  /** Listing of a group, one node per line, for diagnostics. */
  public String dumpGroup( int gid ) {
    gid = chase(gid);
    SB sb = new SB().p("group ").p(gid).nl();
    if( gid < _nstart ) return sb.toString();
    for( int iNode=_N[gid]._next; iNode != _N[iNode]._gid; iNode=_N[iNode]._next ) {
      GNode n = _N[iNode];
      Signature sig = _db.signature(n._sid);
      sb.p("  nid=").p(iNode).p(' ').p(n._sid).p(':').p(sig._name).p("/[");
      for( int i=0; i<sig._numPlaceholder; i++ ) sb.p(n._slots[i]).s();
      if( sig._numPlaceholder>0 ) sb.unchar();
      sb.p("] pwr=").p(n._power).nl();
    }
    return sb.toString();
  }
}
