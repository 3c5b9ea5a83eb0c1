package com.cliffc.untangle.util;

public class Util {
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }

  /**
   * Hash of a node's signature id and slots, after Bob Jenkins' lookup3:
   * words are folded three at a time, then given a final mix.  Never 0.
   */
  public static int hashNode( int sid, int[] slots ) {
    int a = 0xdeadbeef + ((slots.length+1)<<2), b = a, c = a;
    int n = slots.length+1;
    for( int i=0; i<n; i+=3 ) {
      a += word(sid,slots,i);
      if( i+1 < n ) b += word(sid,slots,i+1);
      if( i+2 < n ) c += word(sid,slots,i+2);
      if( i+3 >= n ) break;
      a -= c;  a ^= rot(c, 4);  c += b;
      b -= a;  b ^= rot(a, 6);  a += c;
      c -= b;  c ^= rot(b, 8);  b += a;
      a -= c;  a ^= rot(c,16);  c += b;
      b -= a;  b ^= rot(a,19);  a += c;
      c -= b;  c ^= rot(b, 4);  b += a;
    }
    c ^= b; c -= rot(b,14);
    a ^= c; a -= rot(c,11);
    b ^= a; b -= rot(a,25);
    c ^= b; c -= rot(b,16);
    a ^= c; a -= rot(c, 4);
    b ^= a; b -= rot(a,14);
    c ^= b; c -= rot(b,24);
    return c != 0 ? c : 0x1f2e3d4c;
  }
  private static int word( int sid, int[] slots, int i ) { return i==0 ? sid : slots[i-1]; }

  // Round up to a power of 2, min 16
  static public int pow2( int x ) {
    int p=16;
    while( p < x ) p<<=1;
    return p;
  }
}
