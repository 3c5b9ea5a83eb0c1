package com.cliffc.untangle;

/** Fatal, user facing failure: bad input, bad files, or a full arena. */
public class UntangleException extends RuntimeException {
  public final ErrMsg _err;
  public UntangleException( ErrMsg err ) { super(err.toJson()); _err = err; }
  public UntangleException( ErrMsg err, Throwable cause ) { super(err.toJson(),cause); _err = err; }
}
