package com.cliffc.untangle.sig;

/**
 * The signature database as seen by the tree.  A zero id from either
 * pattern stage means no known encoding; callers skip the candidate.
 */
public interface SignatureOracle {
  int IBIT = 0x80000000;
  int SID_ZERO = 1;
  int SID_SELF = 2;
  int SID_OR   = 3;
  int SID_GT   = 4;
  int SID_NE   = 5;
  int SID_AND  = 6;
  int SID_QNTF = 7;
  int SID_QTF  = 8;

  /** @return CRC32 over the signature names; guards files against a different database */
  int sidCRC();
  int numSignatures();
  Signature signature( int sid );
  /** @return signature id by name, 0 when unknown */
  int lookupSignature( String name );
  Member member( int mid );

  /** @return transform id, or {@link #IBIT} when the string is not a transform */
  int lookupFwdTransform( String slots );
  String fwdTransformName( int tid );

  /** First stage, keyed on Q's signature, T's signature (with {@link #IBIT} when
   *  inverted) and T's endpoint transform. */
  int lookupPatternFirst( int sidQ, int sidT, int tidT );
  /** Second stage, keyed on the first-stage result, F's signature and F's transform. */
  int lookupPatternSecond( int idFirst, int sidF, int tidF );
  Pattern patternSecond( int idSecond );
}
