package com.cliffc.untangle.group;

import com.cliffc.untangle.util.Util;

import java.util.Arrays;

/**
 * Open addressing hash index from (signature, slots) to node id, linear
 * probing.  Nodes remember their position so they can be removed.  Deleted
 * entries leave a tombstone until the next rehash.
 */
final class NodeIndex {
  static final int IDDELETED = -1;
  private final GroupTree _tree;
  private int[] _ids;           // 0 is empty
  private int _used;            // Live entries plus tombstones

  NodeIndex( GroupTree tree, int size ) {
    _tree = tree;
    _ids = new int[Util.pow2(size*2)];
  }

  static int hash( int sid, int[] slots ) { return Util.hashNode(sid,slots); }

  /** @return position of the matching node, or of the empty cell ending the probe */
  private int probe( int sid, int[] slots ) {
    int mask = _ids.length-1;
    int ix = hash(sid,slots) & mask;
    int tomb = -1;
    while( true ) {
      int id = _ids[ix];
      if( id==0 ) return tomb >= 0 ? tomb : ix;
      if( id==IDDELETED ) { if( tomb < 0 ) tomb = ix; }
      else {
        GNode n = _tree._N[id];
        if( n._sid==sid && Arrays.equals(n._slots,slots) ) return ix;
      }
      ix = (ix+1) & mask;
    }
  }

  /** @return node id with exactly this signature and slots, or 0 */
  int lookup( int sid, int[] slots ) {
    int id = _ids[probe(sid,slots)];
    return id==IDDELETED ? 0 : id;
  }

  void insert( int nid ) {
    if( (_used+1)*2 > _ids.length ) rehash(_ids.length*2);
    GNode n = _tree._N[nid];
    int ix = probe(n._sid,n._slots);
    assert _ids[ix]==0 || _ids[ix]==IDDELETED : "already indexed";
    if( _ids[ix]==0 ) _used++;
    _ids[ix] = nid;
    n._hashIX = ix;
  }

  void remove( int nid ) {
    GNode n = _tree._N[nid];
    if( n._hashIX < 0 ) return;
    assert _ids[n._hashIX]==nid;
    _ids[n._hashIX] = IDDELETED;
    n._hashIX = -1;
  }

  void clear() { Arrays.fill(_ids,0); _used=0; }

  private void rehash( int len ) {
    int[] old = _ids;
    _ids = new int[len];
    _used = 0;
    for( int id : old )
      if( id > 0 ) {
        GNode n = _tree._N[id];
        int ix = hash(n._sid,n._slots) & (len-1);
        while( _ids[ix] != 0 ) ix = (ix+1) & (len-1);
        _ids[ix] = id;
        n._hashIX = ix;
        _used++;
      }
  }
}
