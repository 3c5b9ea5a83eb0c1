package com.cliffc.untangle.group;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.sig.Member;
import com.cliffc.untangle.sig.Pattern;
import com.cliffc.untangle.sig.Signature;
import com.cliffc.untangle.sig.SignatureOracle;
import com.cliffc.untangle.sig.Token;
import com.cliffc.untangle.util.AryInt;
import com.cliffc.untangle.util.VersionedMarks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.group.GroupTree.MAXSLOTS;
import static com.cliffc.untangle.sig.SignatureOracle.*;

/**
 * Turns {@code Q ? T : F} into a reference to a group.
 * <p>
 * Level 1 strips trivial and inverted shapes.  Level 2 folds the remaining
 * degenerate operand combinations and names the single-node signature.
 * Level 3 walks every combination of the operand groups' members, encodes
 * each through the two-stage pattern lookup, and files the results in one
 * group; each compound result may be expanded back into single-node
 * components, which discovers equalities with existing groups.
 */
public final class Normaliser {
  private static final Logger LOG = LogManager.getLogger(Normaliser.class);
  // Hard ceiling on recursion, regardless of the configured depth
  static final int MAX_RECURSION = 30;

  private final GroupTree _t;
  private final Collector _c;
  private final VersionedMarks _slotMap = new VersionedMarks(256);
  private final int[] _slotsR = new int[MAXSLOTS];

  Normaliser( GroupTree t ) { _t = t; _c = t._coll; }

  // ---------------------------------------------------------------------------
  /**
   * Level 2 on chased, non-inverted operands.
   * @param cl receives {Q, Tu, Ti, F, sid} of the rewritten single node
   * @return the operand the expression folds to, or {@link GroupTree#IBIT} when it does not fold
   */
  public int classify( int Q, int Tu, int Ti, int F, int[] cl ) {
    if( Q == 0 ) return F;
    int sid;
    if( Ti != 0 ) {
      if( Tu == 0 ) {                         // Q ? !0 : F
        if( Q == F || F == 0 ) return Q;
        sid = SID_OR;
      } else if( Q == Tu ) {                  // Q ? !Q : F
        if( Q == F || F == 0 ) return 0;
        Q = F; F = 0; sid = SID_GT;           // F ? !Q : 0
      } else if( Q == F ) {
        F = 0; sid = SID_GT;
      } else if( F == 0 ) {
        sid = SID_GT;
      } else if( Tu == F ) {
        sid = SID_NE;
      } else {
        sid = SID_QNTF;
      }
    } else {
      if( Tu == 0 ) {                         // Q ? 0 : F
        if( Q == F || F == 0 ) return 0;
        Tu = Q; Ti = IBIT; Q = F; F = 0; sid = SID_GT;
      } else if( Q == Tu ) {                  // Q ? Q : F
        if( F == 0 || Q == F ) return Q;
        Tu = 0; Ti = IBIT; sid = SID_OR;
      } else if( Tu == F ) {
        return F;
      } else if( Q == F ) {
        F = 0; sid = SID_AND;
      } else if( F == 0 ) {
        sid = SID_AND;
      } else {
        sid = SID_QTF;
      }
    }
    cl[0] = Q; cl[1] = Tu; cl[2] = Ti; cl[3] = F; cl[4] = sid;
    return IBIT;
  }

  /** Slots of the single node described by {@link #classify}'s output; unused entries are zero. */
  public int[] tlSlots( int[] cl, int[] out ) {
    Arrays.fill(out,0);
    int Q = cl[0], Tu = cl[1], F = cl[3];
    switch( cl[4] ) {
    case SID_OR:
    case SID_NE:   out[0] = Math.min(Q,F);  out[1] = Math.max(Q,F);  break;
    case SID_GT:   out[0] = Q;              out[1] = Tu;             break;
    case SID_AND:  out[0] = Math.min(Q,Tu); out[1] = Math.max(Q,Tu); break;
    case SID_QNTF:
    case SID_QTF:  out[0] = Q; out[1] = Tu; out[2] = F;              break;
    default: throw new IllegalArgumentException("not a single-node signature: "+cl[4]);
    }
    return out;
  }

  /**
   * Rewrite {@code v[0..k)} to the lexicographically smallest ordering
   * reachable through the signature's swaps.
   */
  public void applySwapping( Signature sig, int[] v, int k ) {
    if( sig._swaps.length == 0 ) return;
    int[] tmp = new int[k];
    boolean changed;
    do {
      changed = false;
      for( String swap : sig._swaps ) {
        for( int i=0; i<k; i++ ) tmp[i] = v[swap.charAt(i)-'a'];
        if( less(tmp,v,k) ) {
          System.arraycopy(tmp,0,v,0,k);
          changed = true;
        }
      }
    } while( changed );
  }

  private static boolean less( int[] a, int[] b, int k ) {
    for( int i=0; i<k; i++ )
      if( a[i] != b[i] ) return a[i] < b[i];
    return false;
  }

  // ---------------------------------------------------------------------------
  /**
   * Reduce {@code Q ? T : F} and add it to the tree.
   * @param gid group the result is known to equal, or {@link GroupTree#IBIT}
   * @param depth caller's depth; top-level callers pass 0
   * @return reference to the node or group representing the expression
   */
  public int addNormaliseNode( int Q, int T, int F, int gid, int depth ) {
    depth++;
    if( depth >= MAX_RECURSION )
      throw new InconsistencyException("recursion too deep: "+depth);
    if( depth == 1 ) _c.open();
    final int oldCount = _t._ncount;

    Q = _t.chaseRef(Q);
    T = _t.chaseRef(T);
    F = _t.chaseRef(F);
    if( gid != IBIT ) gid = _t.chase(gid);

    // Level 1
    if( T == F ) return F;
    if( (Q & IBIT) != 0 ) {                   // !Q ? T : F  ->  Q ? F : T
      Q ^= IBIT;
      int tmp = T; T = F; F = tmp;
      if( T == F ) return F;
    }
    if( Q == 0 ) return F;
    if( (F & IBIT) != 0 )                     // Q ? T : !F  ->  !(Q ? !T : F)
      return addNormaliseNode(Q,T^IBIT,F^IBIT,IBIT,depth-1) ^ IBIT;

    // Level 2
    int Tu = T & ~IBIT, Ti = T & IBIT;
    int[] cl = new int[5];
    int fold = classify(Q,Tu,Ti,F,cl);
    if( fold != IBIT ) return fold;
    Q = cl[0]; Tu = cl[1]; Ti = cl[2]; F = cl[3];
    final int tlSid = cl[4];
    int[] slots = tlSlots(cl,new int[MAXSLOTS]);

    int nid = _t._index.lookup(tlSid,slots);
    if( nid != 0 ) {
      int latest = _t.chase(nid);
      if( gid == IBIT || gid == latest ) return nid;
      _c.importGroup(gid,latest);
      finish(depth,oldCount);
      return nid;
    }
    if( gid != IBIT ) {
      int better = _t.findSid(gid,tlSid);
      if( better != 0 && _t.compare(better,tlSid,slots) <= 0 ) return better;
    }

    if( !_t._ctx.rewrite() ) {
      nid = _c.addToCollection(tlSid,slots,gid,0,depth);
      finish(depth,oldCount);
      return nid == IBIT ? gid : nid;
    }

    return cartesian(Q,Tu,Ti,F,gid,depth,oldCount);
  }

  /** Level 3: every member combination of the operand groups. */
  private int cartesian( final int Q0, final int Tu0, final int Ti, final int F0, int gid, int depth, int oldCount ) {
    final Context ctx = _t._ctx;
    final SignatureOracle db = _t._db;
    int[] cl = new int[5];
    int[] finalSlots = new int[MAXSLOTS];
    int[] power = new int[1];
    int first1n9 = 0;

    int Q = Q0, Tu = Tu0, F = F0;
    int iQ = Q, iTu = Tu, iF = F;
    while( true ) {
      combo: {
        if( LOG.isDebugEnabled() )
          LOG.debug("{}COMBO Q={} T={}{} F={}",Collector.indent(depth),iQ,Ti != 0 ? "~" : "",iTu,iF);
        int fold = classify(iQ,iTu,Ti,iF,cl);
        if( fold != IBIT ) {
          fold = _t.chase(fold);
          LOG.debug("{}FOLD {}",Collector.indent(depth),fold);
          if( gid != IBIT && gid != fold )
            _c.importGroup(gid,fold);
          finish(depth,oldCount);
          return fold;
        }

        int sid = constructSlots(cl[0],cl[2],cl[1],cl[3],finalSlots,power);
        if( sid == 0 ) break combo;

        if( sid == SID_ZERO || sid == SID_SELF ) {
          int endpoint = sid == SID_ZERO ? 0 : finalSlots[0];
          LOG.debug("{}COLLAPSE {}",Collector.indent(depth),endpoint);
          if( gid != IBIT && gid != endpoint )
            _c.importGroup(gid,endpoint);
          finish(depth,oldCount);
          return endpoint;
        }

        if( gid != IBIT && hasBetter(gid,sid,finalSlots) )
          break combo;

        Signature sig = db.signature(sid);
        if( sig._size > 1 && depth < ctx._maxDepth && ctx.cascade() ) {
          int expand = ctx._expand == Context.Expand.MEMBER && sig._firstMember != 0
            ? expandMember(db.member(sig._firstMember),finalSlots,gid,depth)
            : expandSignature(sig,finalSlots,gid,depth);
          if( (expand & IBIT) != 0 ) {
            if( gid != IBIT ) gid = _t.chase(gid);
            break combo;
          }
          gid = _t.chase(expand);
          if( gid < _t._nstart ) {
            finish(depth,oldCount);
            return expand;
          }
          // Expansion may have merged the slots' groups, possibly with gid
          for( int i=0; i<sig._numPlaceholder; i++ ) finalSlots[i] = _t.chase(finalSlots[i]);
          if( _c.badSlots(finalSlots,sig._numPlaceholder,gid) ) break combo;
          applySwapping(sig,finalSlots,sig._numPlaceholder);
        }

        int nid = _c.addToCollection(sid,finalSlots,gid,power[0],depth);
        if( nid == IBIT ) break combo;  // Would close a cycle through gid
        gid = _t.chase(nid);
        if( iQ == Q && iTu == Tu && iF == F && first1n9 == 0 && GroupTree.is1n9(sid) )
          first1n9 = nid;
      }

      // The arena may have grown and groups merged; re-read state
      GNode[] N = _t._N;
      if( gid != IBIT ) {
        gid = _t.chase(gid);
        if( gid < _t._nstart ) break;
      }
      boolean changed = false;
      if( N[iQ]._gid != Q || _t.isOrphan(iQ) ) {
        LOG.debug("{}JUMP Q {} -> {}",Collector.indent(depth),iQ,_t.chase(iQ));
        iQ = Q = _t.chase(iQ); changed = true;
      }
      if( N[iTu]._gid != Tu || _t.isOrphan(iTu) ) {
        LOG.debug("{}JUMP T {} -> {}",Collector.indent(depth),iTu,_t.chase(iTu));
        iTu = Tu = _t.chase(iTu); changed = true;
      }
      if( N[iF]._gid != F || _t.isOrphan(iF) ) {
        LOG.debug("{}JUMP F {} -> {}",Collector.indent(depth),iF,_t.chase(iF));
        iF = F = _t.chase(iF); changed = true;
      }
      if( gid != IBIT && (Q == gid || (Tu != 0 && Tu == gid) || (F != 0 && F == gid)) ) break;
      if( changed ) continue;

      iF = N[iF]._next;
      if( iF != F ) continue;
      iTu = N[iTu]._next;
      if( iTu != Tu ) continue;
      iQ = N[iQ]._next;
      if( iQ != Q ) continue;
      break;
    }

    if( gid == IBIT )
      throw new InconsistencyException("no combination of "+Q0+","+Tu0+","+F0+" could be encoded");
    gid = _t.chase(gid);
    if( gid < _t._nstart ) {
      finish(depth,oldCount);
      return gid;
    }
    _c.scrubGroup(gid);
    finish(depth,oldCount);
    return first1n9 != 0 ? first1n9 : gid;
  }

  // A same-signature node of the group orders at or before sid/slots
  private boolean hasBetter( int gid, int sid, int[] slots ) {
    int iNode = _t.findSid(gid,sid);
    return iNode != 0 && _t.compare(iNode,sid,slots) <= 0;
  }

  // Repair forward references after the outermost call; sanity-check when paranoid
  private void finish( int depth, int oldCount ) {
    if( depth == 1 )
      _c.updateGroups(Math.min(oldCount,_c._lowWater));
    if( _t._ctx.paranoid() )
      _t.validateTree(depth != 1);
  }

  // ---------------------------------------------------------------------------
  /**
   * Encode {@code nQ ? (nTu^Ti) : nF} over three nodes into one signature.
   * @param pFinal receives the chased result slots, canonically swapped
   * @param power receives the pattern's power
   * @return result signature id, or 0 when the combination has no encoding
   */
  int constructSlots( int nQ, int Ti, int nTu, int nF, int[] pFinal, int[] power ) {
    GNode[] N = _t._N;
    final SignatureOracle db = _t._db;
    _slotMap.bump();
    int next = 0;

    GNode q = N[nQ];
    Signature sigQ = db.signature(q._sid);
    for( int i=0; i<sigQ._numPlaceholder; i++ ) {
      int s = _t.chase(q._slots[i]);
      if( s == 0 || _slotMap.test(s) ) return 0;  // Outdated node, slots folded
      _slotMap.put(s,next);
      _slotsR[next++] = s;
    }

    int[] letters = new int[MAXSLOTS];
    GNode t = N[nTu];
    Signature sigT = db.signature(t._sid);
    next = legLetters(t,sigT,letters,next);
    if( next < 0 ) return 0;
    int tidT = db.lookupFwdTransform(lettersName(sigT,letters));
    if( tidT == IBIT ) return 0;
    int first = db.lookupPatternFirst(q._sid,t._sid | Ti,tidT);
    if( first == 0 ) return 0;

    GNode f = N[nF];
    Signature sigF = db.signature(f._sid);
    next = legLetters(f,sigF,letters,next);
    if( next < 0 ) return 0;
    int tidF = db.lookupFwdTransform(lettersName(sigF,letters));
    if( tidF == IBIT ) return 0;
    int second = db.lookupPatternSecond(first,f._sid,tidF);
    if( second == 0 ) return 0;

    Pattern p = db.patternSecond(second);
    Arrays.fill(pFinal,0);
    for( int i=0; i<p._extract.length(); i++ )
      pFinal[i] = _slotsR[p._extract.charAt(i)-'a'];
    applySwapping(db.signature(p._sidR),pFinal,p._extract.length());
    power[0] = p._power;
    return p._sidR;
  }

  // Assign letters to the chased slots of a T or F leg; -1 on overflow or a folded slot
  private int legLetters( GNode n, Signature sig, int[] letters, int next ) {
    for( int i=0; i<sig._numPlaceholder; i++ ) {
      int s = _t.chase(n._slots[i]);
      if( s == 0 ) return -1;
      int l = _slotMap.get(s,-1);
      if( l < 0 ) {
        if( next >= MAXSLOTS ) return -1;
        l = next;
        _slotMap.put(s,next);
        _slotsR[next++] = s;
      }
      letters[i] = l;
    }
    applySwapping(sig,letters,sig._numPlaceholder);
    return next;
  }

  private static String lettersName( Signature sig, int[] letters ) {
    char[] cs = new char[sig._numPlaceholder];
    for( int i=0; i<cs.length; i++ ) cs[i] = (char)('a'+letters[i]);
    return new String(cs);
  }

  // ---------------------------------------------------------------------------
  /**
   * Rebuild a compound node out of single-node components, one call of
   * {@link #addNormaliseNode} per operator.
   * @return the component representing the whole, or {@link GroupTree#IBIT}
   *         when the structure collapses onto one of its own slots or cycles
   */
  public int expandSignature( Signature sig, int[] slots, int gid, int depth ) {
    return expand(sig._tokens,slots,null,gid,depth);
  }

  /** As {@link #expandSignature}, using an alternate member structure whose
   *  placeholders map through the member's transform. */
  public int expandMember( Member m, int[] slots, int gid, int depth ) {
    return expand(m._tokens,slots,m._transform,gid,depth);
  }

  private int expand( Token[] toks, int[] slots, String transform, int gid, int depth ) {
    VersionedMarks active = _t._pool.acquire();
    try {
      for( int s : slots )
        if( s != 0 ) active.set(_t.chase(s));
      AryInt stack = new AryInt();
      AryInt nodes = new AryInt();
      int[] qtf = new int[4];
      int[] cl = new int[5];
      for( int i=0; i<toks.length; i++ ) {
        Token tok = toks[i];
        switch( tok._kind ) {
        case ZERO:     stack.push(0); continue;
        case ENDPOINT: stack.push(transform == null ? slots[tok._val] : slots[transform.charAt(tok._val)-'a']); continue;
        case BACKREF:  stack.push(nodes.at(nodes._len - tok._val)); continue;
        case NOT:      stack.xorLast(IBIT); continue;
        default:       Token.popQTF(tok._kind,stack,qtf);
        }
        int Q = _t.chaseRef(qtf[0]), Tu = _t.chase(qtf[1] & ~IBIT), Ti = qtf[2] ^ (qtf[1] & IBIT), F = _t.chaseRef(qtf[3]);
        if( ((Q | F) & IBIT) != 0 ) return IBIT;
        if( gid != IBIT ) gid = _t.chase(gid);
        if( classify(Q,Tu,Ti,F,cl) != IBIT ) return IBIT;
        if( cl[0] == gid || cl[1] == gid || cl[3] == gid ) return IBIT;

        boolean last = i == toks.length-1;
        if( last && gid != IBIT && gid < _t._nstart ) return IBIT;
        int nid = last
          ? addNormaliseNode(Q,Tu ^ Ti,F,gid,depth)
          : addNormaliseNode(Q,Tu ^ Ti,F,IBIT,depth+1);
        int latest = _t.chase(nid & ~IBIT);
        if( active.test(latest) ) return IBIT;
        if( last && gid != IBIT && (nid & IBIT) == 0 ) {
          gid = _t.chase(gid);
          if( gid != latest && gid >= _t._nstart )
            latest = _c.importGroup(gid,latest);
        }
        stack.push(nid);
        nodes.push(nid);
        active.set(latest);
      }
      if( stack._len != 1 )
        throw new InconsistencyException("malformed structure, "+stack._len+" results");
      return stack.at(0);
    } finally {
      _t._pool.release(active);
    }
  }
}
