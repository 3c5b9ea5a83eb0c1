package com.cliffc.untangle.group;

import com.cliffc.untangle.util.SB;

/**
 * Arena node.  Headers have {@code _gid} equal to their own id; listed nodes
 * point at their header; orphans are unlinked ({@code _next==_prev==self})
 * and forward through {@code _gid}.
 */
public final class GNode {
  public static final int MAXSLOTS = 9;
  public int _gid;
  public int _prev, _next;
  public int _hashIX = -1;      // Position in the node index, -1 when not indexed
  public int _sid;
  public final int[] _slots = new int[MAXSLOTS];
  public int _power;

  void reset( int gid, int sid ) {
    _gid = gid;
    _sid = sid;
    _hashIX = -1;
    _power = 0;
    java.util.Arrays.fill(_slots,0);
  }

  @Override public String toString() {
    SB sb = new SB().p("gid=").p(_gid).p(" sid=").p(_sid).p(" [");
    for( int s : _slots ) sb.p(s).s();
    return sb.unchar().p("] pwr=").p(_power).toString();
  }
}
