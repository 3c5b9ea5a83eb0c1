package com.cliffc.untangle.sig;

/** Result of a second-stage lookup: the whole-triple signature, the letters
 *  extracting its slots from the merged slot list, and the power score. */
public final class Pattern {
  public final int _sidR;
  public final String _extract;
  public final int _power;
  public Pattern( int sidR, String extract, int power ) { _sidR=sidR; _extract=extract; _power=power; }
  @Override public String toString() { return _sidR+"/"+_extract+" pwr="+_power; }
}
