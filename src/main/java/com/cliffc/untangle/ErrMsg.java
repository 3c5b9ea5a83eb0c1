package com.cliffc.untangle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

// Error messages, rendered as single-line JSON
public class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    Usage,                    // Bad command line
    Syntax,                   // Malformed notation
    Format,                   // Bad binary or JSON file contents
    Io,                       // File system failures
    Overflow,                 // Arena full
    Internal,                 // Engine defect
  }

  private static final ObjectMapper JSON = new ObjectMapper();

  public final String _msg;   // Printable error message, the "error" field
  public final Level _lvl;    // Priority for printing
  private final Map<String,Object> _extra = new LinkedHashMap<>();
  public ErrMsg(String msg, Level lvl) { _msg=msg; _lvl=lvl; }

  // Additional JSON field, in insertion order
  public ErrMsg put( String key, Object val ) { _extra.put(key,val); return this; }
  public Object get( String key ) { return _extra.get(key); }

  public static ErrMsg overflow(int maxnode) {
    return new ErrMsg("overflow",Level.Overflow).put("maxnode",maxnode);
  }
  public static ErrMsg syntax(String msg, String name) {
    return new ErrMsg(msg,Level.Syntax).put("name",name);
  }
  public static ErrMsg format(String msg, String filename) {
    return new ErrMsg(msg,Level.Format).put("filename",filename);
  }
  public static ErrMsg io(String msg, String filename, Throwable cause) {
    ErrMsg e = new ErrMsg(msg,Level.Io).put("filename",filename);
    if( cause != null && cause.getMessage() != null ) e.put("reason",cause.getMessage());
    return e;
  }
  public static ErrMsg internal(String msg) {
    return new ErrMsg("internal inconsistency",Level.Internal).put("reason",msg);
  }
  public static ErrMsg usage(String msg) {
    return new ErrMsg(msg,Level.Usage);
  }

  public String toJson() {
    Map<String,Object> m = new LinkedHashMap<>();
    m.put("error",_msg);
    m.putAll(_extra);
    try {
      return JSON.writeValueAsString(m);
    } catch( JsonProcessingException e ) {
      throw new IllegalStateException(e);
    }
  }

  @Override public String toString() { return toJson(); }
  @Override public int compareTo(ErrMsg msg) {
    int cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _msg.compareTo(msg._msg);
  }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _msg.equals(err._msg) && _extra.equals(err._extra);
  }
  @Override public int hashCode() {
    return _msg.hashCode()+_lvl.hashCode();
  }
}
