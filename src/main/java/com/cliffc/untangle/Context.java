package com.cliffc.untangle;

import com.cliffc.untangle.util.SB;

/**
 * Creation flags and runtime options shared by the tree, the oracle and the
 * command line.  One per builder; not thread safe.
 */
public class Context {
  // Creation flags, stored in the binary file header
  public static final int MAGICMASK_PARANOID = 1<<0;
  public static final int MAGICMASK_PURE     = 1<<1;
  public static final int MAGICMASK_CASCADE  = 1<<4;
  public static final int MAGICMASK_REWRITE  = 1<<5;

  public static final int DEFAULT_MAXNODE  = 1_000_000;
  public static final int DEFAULT_MAXDEPTH = 6;
  public static final int DEFAULT_SIGSIZE  = 2;

  // How multi-node signatures are re-derived
  public enum Expand { SIGNATURE, MEMBER }

  public int _flags = MAGICMASK_CASCADE | MAGICMASK_REWRITE;
  public int _maxNode = DEFAULT_MAXNODE;
  public int _maxDepth = DEFAULT_MAXDEPTH;
  public int _sigSize = DEFAULT_SIGSIZE; // Largest structure in the generated oracle
  public int _timer = 1;                 // Progress interval in seconds, 0 is off
  public int _verbose = 4;
  public boolean _force;
  public Expand _expand = Expand.SIGNATURE;

  public boolean paranoid() { return (_flags & MAGICMASK_PARANOID) != 0; }
  public boolean pure    () { return (_flags & MAGICMASK_PURE    ) != 0; }
  public boolean cascade () { return (_flags & MAGICMASK_CASCADE ) != 0; }
  public boolean rewrite () { return (_flags & MAGICMASK_REWRITE ) != 0; }

  public Context copy() {
    Context c = new Context();
    c._flags = _flags;
    c._maxNode = _maxNode;
    c._maxDepth = _maxDepth;
    c._sigSize = _sigSize;
    c._timer = _timer;
    c._verbose = _verbose;
    c._force = _force;
    c._expand = _expand;
    return c;
  }

  public Context flag( int mask, boolean on ) {
    _flags = on ? (_flags | mask) : (_flags & ~mask);
    return this;
  }

  /** @return flags as {@code PARANOID|PURE|CASCADE|REWRITE}, empty when none are set */
  public static String flagsToText( int flags ) {
    SB sb = new SB();
    if( (flags & MAGICMASK_PARANOID) != 0 ) sb.p("PARANOID|");
    if( (flags & MAGICMASK_PURE    ) != 0 ) sb.p("PURE|");
    if( (flags & MAGICMASK_CASCADE ) != 0 ) sb.p("CASCADE|");
    if( (flags & MAGICMASK_REWRITE ) != 0 ) sb.p("REWRITE|");
    if( sb.len() > 0 ) sb.unchar();
    return sb.toString();
  }
}
