package com.cliffc.untangle.group;

import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.sig.Signature;
import com.cliffc.untangle.util.AryInt;
import com.cliffc.untangle.util.VersionedMarks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.group.GroupTree.MAXSLOTS;

/**
 * Keeps the group lists honest: one node per signature per group, no stale
 * or forward slots in a finished structure, and merges when two groups are
 * proven equal.
 * <p>
 * The group graph (group to the groups its nodes' slots chase to) is kept
 * acyclic at all times; a link that would close a cycle is refused.  Groups
 * below {@link #_floor} are finished: every slot of theirs chases to a lower
 * id, so neither the cycle check nor the merge flood needs to look at them.
 */
public final class Collector {
  private static final Logger LOG = LogManager.getLogger(Collector.class);
  // Scrub and reorder rounds before the repair pass gives up
  static final int REPAIR_LIMIT = 1000;
  // Walk states in reorder
  private static final int ENTERED = 1, DONE = 2;

  private final GroupTree _t;
  // Lowest group touched by a merge since it was last reset
  int _lowWater = Integer.MAX_VALUE;
  // Groups below this id only reference lower ids
  int _floor;
  // Some scrub in the current repair round merged groups
  private boolean _merged;

  Collector( GroupTree t ) { _t = t; _floor = t._nstart; }

  /** Start of an outermost build; everything already built is finished. */
  void open() {
    _floor = _t._ncount;
    _lowWater = Integer.MAX_VALUE;
  }

  /**
   * Add {@code sid/slots} to group {@code gid}, or to a new group when
   * {@code gid} is {@link GroupTree#IBIT}.  An identical indexed node is
   * returned, merging its group into {@code gid} when they differ; an
   * orphaned twin is re-linked where it now belongs.  A same-signature peer
   * in the group keeps its place when it orders first; otherwise it is
   * orphaned.
   * @return id of the node representing sid/slots, or {@link GroupTree#IBIT}
   *         when the slots repeat, or name or reach {@code gid}
   */
  public int addToCollection( int sid, int[] slots, int gid, int power, int depth ) {
    int k = _t._db.signature(sid)._numPlaceholder;
    if( gid != IBIT ) {
      gid = _t.chase(gid);
      if( gid < _t._nstart || badSlots(slots,k,gid) ) return IBIT;
    }

    int nid = _t._index.lookup(sid,slots);
    if( nid != 0 ) {
      int latest = _t.chase(nid);
      if( gid != IBIT && gid != latest ) latest = importGroup(gid,latest);
      if( _t.isOrphan(nid) && latest >= _t._nstart ) relink(nid,latest,k);
      return nid;
    }

    if( gid != IBIT ) {
      if( reaches(slots,k,gid) ) {
        LOG.debug("{}CYCLE gid={} {}",indent(depth),gid,_t._db.signature(sid)._name);
        return IBIT;
      }
      int iNode = _t.findSid(gid,sid);
      if( iNode != 0 ) {
        if( _t.compare(iNode,sid,slots) <= 0 )
          return iNode;
        _t.unlinkNode(iNode);     // Worse; forwards to gid
      }
    } else {
      gid = _t.newHeader();
    }

    nid = _t.newNode(gid,sid);
    GNode n = _t._N[nid];
    System.arraycopy(slots,0,n._slots,0,MAXSLOTS);
    n._power = power;
    _t.linkNode(gid,nid);
    _t._index.insert(nid);
    lowerFloor(gid,slots,k);
    if( LOG.isDebugEnabled() )
      LOG.debug("{}NEW gid={} nid={} {}",indent(depth),gid,nid,_t._db.signature(sid)._name);
    return nid;
  }

  // Slots that are zero, repeat, or name the group itself
  boolean badSlots( int[] slots, int k, int gid ) {
    for( int i=0; i<k; i++ ) {
      int s = _t.chase(slots[i]);
      if( s == 0 || s == gid ) return true;
      for( int j=0; j<i; j++ )
        if( _t.chase(slots[j]) == s ) return true;
    }
    return false;
  }

  // Put an orphaned twin back into the group it forwards to
  private void relink( int nid, int gid, int k ) {
    GNode n = _t._N[nid];
    if( badSlots(n._slots,k,gid) || reaches(n._slots,k,gid) ) return;
    if( orphanWorse(gid,n._sid,n._slots) != IBIT ) return;
    n._gid = gid;
    _t.linkNode(gid,nid);
    lowerFloor(gid,n._slots,k);
    LOG.debug("RELINK gid={} nid={}",gid,nid);
  }

  // A finished group that gains a later slot is no longer finished
  private void lowerFloor( int gid, int[] slots, int k ) {
    if( gid >= _floor ) return;
    for( int i=0; i<k; i++ )
      if( _t.chase(slots[i]) > gid ) { _floor = gid; return; }
  }

  /**
   * Whether any group reachable from {@code slots} is {@code gid}, in which
   * case linking the node into {@code gid} would close a cycle.
   */
  boolean reaches( int[] slots, int k, int gid ) {
    GNode[] N = _t._N;
    VersionedMarks seen = _t._pool.acquire();
    try {
      AryInt work = new AryInt();
      for( int i=0; i<k; i++ ) {
        int s = _t.chase(slots[i]);
        if( s == gid ) return true;
        if( s >= _t._nstart && !seen.tset(s) ) work.push(s);
      }
      while( !work.isEmpty() ) {
        int g = work.pop();
        if( g < _floor && g < gid ) continue;   // Only reaches below itself
        for( int iNode=N[g]._next; iNode != g; iNode=N[iNode]._next )
          for( int s : N[iNode]._slots ) {
            if( s == 0 ) continue;
            int d = _t.chase(s);
            if( d == gid ) return true;
            if( d >= _t._nstart && !seen.tset(d) ) work.push(d);
          }
      }
      return false;
    } finally {
      _t._pool.release(seen);
    }
  }

  /**
   * Orphan the same-signature node of {@code gid} when {@code sid/slots} orders first.
   * @return the existing node when it orders first or equal, otherwise {@link GroupTree#IBIT}
   */
  int orphanWorse( int gid, int sid, int[] slots ) {
    int iNode = _t.findSid(gid,sid);
    if( iNode == 0 ) return IBIT;
    if( _t.compare(iNode,sid,slots) <= 0 ) return iNode;
    _t.unlinkNode(iNode);
    return IBIT;
  }

  /**
   * Merge two groups proven equal.  Nodes whose slots reach a group that
   * (transitively) references either side would become cyclic and are
   * orphaned.  Surviving nodes of {@code oldest} move into {@code newest},
   * keeping the better of any same-signature pair.  When nothing of
   * {@code newest} survives the roles invert.  Merging with an entry point
   * or the constant collapses the other group onto it.
   * @return the surviving group
   */
  public int importGroup( int newest, int oldest ) {
    GNode[] N = _t._N;
    newest = _t.chase(newest);
    oldest = _t.chase(oldest);
    if( newest == oldest ) return newest;
    if( newest < _t._nstart ) { int tmp = newest; newest = oldest; oldest = tmp; }
    if( newest < _t._nstart )
      throw new InconsistencyException("entry points "+newest+" and "+oldest+" proven equal");
    _lowWater = Math.min(_lowWater,oldest < _t._nstart ? newest : Math.min(newest,oldest));
    _floor = Math.min(_floor,_lowWater);

    if( oldest < _t._nstart ) {
      // Total collapse onto an entry point or the constant
      for( int iNode=N[newest]._next, next; iNode != newest; iNode=next ) {
        next = N[iNode]._next;
        _t.unlinkNode(iNode);
        N[iNode]._gid = oldest;
      }
      N[newest]._gid = oldest;
      LOG.debug("COLLAPSE {} -> {}",newest,oldest);
      return oldest;
    }

    VersionedMarks flood = _t._pool.acquire();
    try {
      floodFill(flood,newest,oldest);

      for( int iNode=N[newest]._next, next; iNode != newest; iNode=next ) {
        next = N[iNode]._next;
        if( touches(iNode,flood) ) _t.unlinkNode(iNode);
      }

      if( N[newest]._next == newest ) {
        // Nothing informative left in newest; it forwards to oldest
        if( !hasSurvivor(oldest,flood) )
          throw new InconsistencyException("every node of groups "+newest+" and "+oldest+" is cyclic after merge",oldest);
        for( int iNode=N[oldest]._next, next; iNode != oldest; iNode=next ) {
          next = N[iNode]._next;
          if( touches(iNode,flood) ) _t.unlinkNode(iNode);
        }
        N[newest]._gid = oldest;
        LOG.debug("MERGE {} -> {}",newest,oldest);
        return oldest;
      }

      for( int iNode=N[oldest]._next, next; iNode != oldest; iNode=next ) {
        next = N[iNode]._next;
        GNode n = N[iNode];
        _t.unlinkNode(iNode);
        n._gid = newest;
        if( touches(iNode,flood) ) continue;
        if( orphanWorse(newest,n._sid,n._slots) == IBIT )
          _t.linkNode(N[newest]._prev,iNode);
      }
      N[oldest]._gid = newest;
      if( LOG.isDebugEnabled() )
        LOG.debug("MERGE {} -> {}\n{}",oldest,newest,_t.dumpGroup(newest));
      return newest;
    } finally {
      _t._pool.release(flood);
    }
  }

  /**
   * Mark the seeds and every group transitively referencing them.  Users of
   * either seed are never below the floor, so the scan starts there.  Sweeps
   * repeat only while a flooded group could still be used by an earlier one.
   */
  private void floodFill( VersionedMarks flood, int a, int b ) {
    flood.set(a);
    flood.set(b);
    int lo = Math.max(_t._nstart,Math.min(_floor,Math.min(a,b)));
    boolean changed = true;
    while( changed ) {
      changed = false;
      boolean forward = false;
      GNode[] N = _t._N;
      for( int gid=lo; gid<_t._ncount; gid++ ) {
        if( !_t.isHeader(gid) || flood.test(gid) ) continue;
        boolean hit = false;
        for( int iNode=N[gid]._next; iNode != gid; iNode=N[iNode]._next )
          for( int s : N[iNode]._slots ) {
            if( s == 0 ) continue;
            int r = _t.chase(s);
            if( r > gid ) forward = true;
            if( flood.test(r) ) hit = true;
          }
        if( hit ) { flood.set(gid); changed = true; }
      }
      if( !forward ) break;
    }
  }

  private boolean touches( int nid, VersionedMarks flood ) {
    for( int s : _t._N[nid]._slots )
      if( s != 0 && flood.test(_t.chase(s)) )
        return true;
    return false;
  }

  private boolean hasSurvivor( int gid, VersionedMarks flood ) {
    GNode[] N = _t._N;
    for( int iNode=N[gid]._next; iNode != gid; iNode=N[iNode]._next )
      if( !touches(iNode,flood) )
        return true;
    return false;
  }

  /**
   * Bring a group up to date: chase every slot, orphan nodes that fold,
   * rebuild nodes whose slots went stale, and drop nodes dominated by a
   * same-size peer over a subset of the slots with at least the power.
   * A single-node member that folds is re-classified, which may merge the
   * group away.
   */
  void scrubGroup( int iGroup ) {
    GNode[] N;
    int[] newSlots = new int[MAXSLOTS];
    int[] qtf = new int[4];
    int[] cl = new int[5];
    VersionedMarks marks = _t._pool.acquire();
    try {
      restart:
      while( true ) {
        if( !_t.isHeader(iGroup) ) return;
        N = _t._N;                // Adds may grow the arena
        for( int iNode=N[iGroup]._next, next; iNode != iGroup; iNode=next ) {
          next = N[iNode]._next;
          GNode n = N[iNode];
          Signature sig = _t._db.signature(n._sid);
          marks.bump();
          marks.set(iGroup);
          boolean outdated=false, selfRef=false, collide=false;
          Arrays.fill(newSlots,0);
          for( int i=0; i<sig._numPlaceholder; i++ ) {
            int s = _t.chase(n._slots[i]);
            if( s != n._slots[i] ) outdated = true;
            newSlots[i] = s;
            if( s == iGroup ) selfRef = true;
            else if( s == 0 || marks.tset(s) ) collide = true;
          }
          if( selfRef || (collide && !GroupTree.is1n9(n._sid)) ) {
            _t.unlinkNode(iNode);
            LOG.debug("FOLD gid={} nid={}",iGroup,iNode);
            continue;
          }
          if( collide ) {
            // Single node with merged operands; reduce it like a fresh one
            _t.unlinkNode(iNode);
            _t.decode1n9(iNode,qtf);
            int fold = _t._norm.classify(qtf[0],qtf[1],qtf[2],qtf[3],cl);
            if( fold != IBIT ) {
              int latest = _t.chase(fold);
              LOG.debug("FOLD gid={} nid={} -> {}",iGroup,iNode,latest);
              if( latest != iGroup ) importGroup(iGroup,latest);
            } else {
              addToCollection(cl[4],_t._norm.tlSlots(cl,new int[MAXSLOTS]),iGroup,0,0);
            }
            continue restart;
          }
          if( outdated ) {
            _t.unlinkNode(iNode);
            _t._norm.applySwapping(sig,newSlots,sig._numPlaceholder);
            addToCollection(n._sid,newSlots.clone(),iGroup,n._power,0);
            continue restart;     // The add may have orphaned 'next'
          }
        }
        break;
      }
      pruneWeak(iGroup);
    } finally {
      _t._pool.release(marks);
    }
  }

  // Orphan nodes dominated by a same-size peer using a strict subset of their slots
  private void pruneWeak( int iGroup ) {
    GNode[] N = _t._N;
    AryInt ids = new AryInt();
    for( int iNode=N[iGroup]._next; iNode != iGroup; iNode=N[iNode]._next )
      ids.push(iNode);
    if( ids._len < 2 ) return;
    for( int i=0; i<ids._len; i++ ) {
      int x = ids._es[i];
      GNode nx = N[x];
      Signature sx = _t._db.signature(nx._sid);
      for( int j=0; j<ids._len; j++ ) {
        int y = ids._es[j];
        if( x==y || N[y]._next==y ) continue;
        GNode ny = N[y];
        Signature sy = _t._db.signature(ny._sid);
        if( sy._size != sx._size || ny._power < nx._power ) continue;
        if( sy._numPlaceholder >= sx._numPlaceholder ) continue;
        if( subset(ny,sy._numPlaceholder,nx,sx._numPlaceholder) ) {
          _t.unlinkNode(x);
          LOG.debug("WEAK gid={} nid={} dominated by {}",iGroup,x,y);
          break;
        }
      }
    }
  }
  private boolean subset( GNode small, int ks, GNode big, int kb ) {
    outer:
    for( int i=0; i<ks; i++ ) {
      int s = _t.chase(small._slots[i]);
      for( int j=0; j<kb; j++ )
        if( _t.chase(big._slots[j]) == s ) continue outer;
      return false;
    }
    return true;
  }

  /**
   * Repair pass from {@code firstGid} (or the floor, when lower) to the end
   * of the arena.  Each round scrubs every live group, then walks the group
   * graph operands first and moves any group still referencing a later one
   * to a fresh header behind everything it uses.  Rounds repeat until
   * nothing moves or merges; the graph is acyclic, so this settles.
   */
  public void updateGroups( int firstGid ) {
    int first = Math.max(_t._nstart,Math.min(firstGid,_floor));
    for( int round=0; ; round++ ) {
      if( round == REPAIR_LIMIT )
        throw new InconsistencyException("repair pass does not settle",first);
      first = scrubFrom(first);
      if( !reorder(first) && !_merged ) break;
    }
    _lowWater = Integer.MAX_VALUE;
    _floor = _t._ncount;
  }

  // Scrub live groups from 'first' on; a merge reaching below the current group restarts there
  private int scrubFrom( int first ) {
    _merged = false;
    for( int iGroup=first; iGroup<_t._ncount; iGroup++ ) {
      if( !_t.isHeader(iGroup) ) continue;
      _lowWater = Integer.MAX_VALUE;
      scrubGroup(iGroup);
      if( _lowWater != Integer.MAX_VALUE ) _merged = true;
      if( _lowWater < iGroup ) {
        iGroup = Math.max(_lowWater,_t._nstart);
        first = Math.min(first,iGroup);
        iGroup--;                 // Revisit groups referencing the merge
      }
    }
    return first;
  }

  // Post-order walk over the live groups from 'first' on; returns whether any group moved
  private boolean reorder( int first ) {
    boolean moved = false;
    int end = _t._ncount;
    VersionedMarks state = _t._pool.acquire();
    try {
      AryInt work = new AryInt();
      for( int root=first; root<end; root++ ) {
        if( !_t.isHeader(root) || state.test(root) ) continue;
        work.push(root);
        while( !work.isEmpty() ) {
          int g = work.pop();
          if( g < 0 ) {           // Every operand group is placed
            g = ~g;
            state.put(g,DONE);
            int h = place(g);
            if( h != g ) { state.put(h,DONE); moved = true; }
            continue;
          }
          if( state.test(g) ) continue;
          state.put(g,ENTERED);
          work.push(~g);
          GNode[] N = _t._N;
          for( int iNode=N[g]._next; iNode != g; iNode=N[iNode]._next )
            for( int s : N[iNode]._slots ) {
              if( s == 0 ) continue;
              int d = _t.chase(s);
              if( d < first ) continue;
              int st = state.get(d,0);
              if( st == ENTERED ) throw new InconsistencyException("reference cycle through group "+d,g);
              if( st == 0 ) work.push(d);
            }
        }
      }
    } finally {
      _t._pool.release(state);
    }
    return moved;
  }

  // Move a group referencing a later one to a fresh header; returns where it lives
  private int place( int g ) {
    GNode[] N = _t._N;
    int max = 0;
    for( int iNode=N[g]._next; iNode != g; iNode=N[iNode]._next )
      for( int s : N[iNode]._slots )
        if( s != 0 ) max = Math.max(max,_t.chase(s));
    if( max < g ) return g;
    if( max == g ) throw new InconsistencyException("self reference",g);
    int newGid = _t.newHeader();
    N = _t._N;
    for( int iNode=N[g]._next, next; iNode != g; iNode=next ) {
      next = N[iNode]._next;
      _t.unlinkNode(iNode);
      N[iNode]._gid = newGid;
      _t.linkNode(N[newGid]._prev,iNode);
    }
    N[g]._gid = newGid;
    LOG.debug("REBUILD {} -> {}",g,newGid);
    return newGid;
  }

  static String indent( int depth ) {
    return depth <= 1 ? "" : "  ".repeat(depth-1);
  }
}
