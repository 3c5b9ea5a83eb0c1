package com.cliffc.untangle;

/** An internal invariant of the group tree was violated.  Signals an engine
 *  defect, never bad input. */
public class InconsistencyException extends RuntimeException {
  public final int _gid;        // Offending group or node, 0 when not known
  public InconsistencyException( String msg ) { this(msg,0); }
  public InconsistencyException( String msg, int gid ) {
    super(gid==0 ? msg : msg+" (id="+gid+")");
    _gid = gid;
  }
}
