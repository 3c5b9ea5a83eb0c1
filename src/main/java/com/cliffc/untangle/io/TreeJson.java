package com.cliffc.untangle.io;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.sig.SignatureOracle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON metadata of a tree: dimensions, key and root names, and one
 * notation string per root under {@code data}.
 */
public final class TreeJson {
  static final ObjectMapper JSON = new ObjectMapper();

  private TreeJson() {}

  public static ObjectNode object() { return JSON.createObjectNode(); }

  /** Header fields of an encoded tree file. */
  public static ObjectNode headerInfo( ObjectNode j, byte[] file ) {
    ByteBuffer b = ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN);
    int nstart = b.getInt(32), ncount = b.getInt(36);
    j.put("flags",b.getInt(4));
    j.put("size",b.getLong(80));
    j.put("crc",String.format("%08x",b.getInt(16)));
    j.put("kstart",b.getInt(20));
    j.put("ostart",b.getInt(24));
    j.put("estart",b.getInt(28));
    j.put("nstart",nstart);
    j.put("ncount",ncount);
    j.put("numnodes",ncount - nstart);
    j.put("numroots",b.getInt(40));
    j.put("system",b.getInt(12));
    return j;
  }

  /** Dimensions and names.  {@code rnames} is the string {@code "enames"} when roots equal keys. */
  public static ObjectNode extraInfo( ObjectNode j, GroupTree t ) {
    j.put("kstart",t._kstart);
    j.put("ostart",t._ostart);
    j.put("estart",t._estart);
    j.put("nstart",t._nstart);
    j.put("ncount",t._ncount);
    j.put("numroots",t._numRoots);
    j.set("knames",names(t._keyNames,t._kstart,t._ostart));
    j.set("onames",names(t._keyNames,t._ostart,t._estart));
    j.set("enames",names(t._keyNames,t._estart,t._nstart));

    boolean rootsDiffer = t._nstart != t._numRoots;
    for( int i=t._kstart; !rootsDiffer && i<t._nstart; i++ )
      rootsDiffer = !t._keyNames[i].equals(t._rootNames[i]);
    if( rootsDiffer ) j.set("rnames",names(t._rootNames,t._estart,t._numRoots));
    else j.put("rnames","enames");
    return j;
  }

  private static ArrayNode names( String[] names, int lo, int hi ) {
    ArrayNode a = JSON.createArrayNode();
    for( int i=lo; i<hi; i++ ) a.add(names[i]);
    return a;
  }

  /** Metadata plus the notation of every root. */
  public static ObjectNode toJson( GroupTree t ) {
    ObjectNode j = extraInfo(object(),t);
    Notation note = new Notation(t);
    ArrayNode data = j.putArray("data");
    for( int i=0; i<t._numRoots; i++ )
      data.add(note.saveString(t._roots[i]));
    return j;
  }

  /**
   * Create a tree from metadata, building every {@code data} string into
   * its root.
   * @throws UntangleException on missing tags or out-of-range dimensions
   */
  public static GroupTree build( JsonNode in, String filename, Context ctx, SignatureOracle db ) {
    int kstart   = dim(in,"kstart",filename);
    int ostart   = dim(in,"ostart",filename);
    int estart   = dim(in,"estart",filename);
    int nstart   = dim(in,"nstart",filename);
    int numRoots = dim(in,"numroots",filename);
    int ncount   = in.has("ncount") ? in.get("ncount").asInt() : nstart;

    if( kstart < 2 || kstart > ncount )
      throw new UntangleException(ErrMsg.format("kstart out of range",filename).put("kstart",kstart).put("ncount",ncount));
    if( ostart < kstart || ostart > ncount )
      throw new UntangleException(ErrMsg.format("ostart out of range",filename).put("kstart",kstart).put("ostart",ostart).put("ncount",ncount));
    if( estart < ostart || estart > ncount )
      throw new UntangleException(ErrMsg.format("estart out of range",filename).put("ostart",ostart).put("estart",estart).put("ncount",ncount));
    if( nstart < estart || nstart > ncount )
      throw new UntangleException(ErrMsg.format("nstart out of range",filename).put("estart",estart).put("nstart",nstart).put("ncount",ncount));
    if( numRoots < estart )
      throw new UntangleException(ErrMsg.format("numroots out of range",filename).put("numroots",numRoots).put("estart",estart));

    GroupTree t = new GroupTree(ctx,db,kstart,ostart,estart,nstart,numRoots);
    loadNames(in,"knames",t._keyNames,kstart,ostart,filename);
    loadNames(in,"onames",t._keyNames,ostart,estart,filename);
    loadNames(in,"enames",t._keyNames,estart,nstart,filename);

    System.arraycopy(t._keyNames,0,t._rootNames,0,estart);
    JsonNode rnames = in.get("rnames");
    if( rnames == null )
      throw new UntangleException(ErrMsg.format("Missing tag 'rnames'",filename));
    if( rnames.isTextual() && rnames.asText().equalsIgnoreCase("enames") ) {
      if( nstart != numRoots )
        throw new UntangleException(ErrMsg.format("rnames == enames AND nstart != numRoots",filename).put("nstart",nstart).put("numroots",numRoots));
      System.arraycopy(t._keyNames,0,t._rootNames,0,nstart);
    } else {
      loadNames(in,"rnames",t._rootNames,estart,numRoots,filename);
    }

    JsonNode data = in.get("data");
    if( data != null ) {
      if( !data.isArray() || data.size() != numRoots )
        throw new UntangleException(ErrMsg.format("Incorrect number of data",filename).put("expected",numRoots).put("encountered",data.isArray() ? data.size() : 1));
      Notation note = new Notation(t);
      for( int i=0; i<numRoots; i++ )
        t._roots[i] = note.loadStringSafe(data.get(i).asText());
    }
    return t;
  }

  private static int dim( JsonNode in, String tag, String filename ) {
    JsonNode n = in.get(tag);
    if( n == null || !n.canConvertToInt() )
      throw new UntangleException(ErrMsg.format("Missing tag '"+tag+"'",filename));
    return n.asInt();
  }

  private static void loadNames( JsonNode in, String tag, String[] names, int lo, int hi, String filename ) {
    JsonNode a = in.get(tag);
    if( a == null || !a.isArray() )
      throw new UntangleException(ErrMsg.format("Missing tag '"+tag+"'",filename));
    if( a.size() != hi-lo )
      throw new UntangleException(ErrMsg.format("Incorrect number of "+tag,filename).put("expected",hi-lo).put("encountered",a.size()));
    for( int i=0; i<a.size(); i++ )
      names[lo+i] = a.get(i).asText();
  }

  public static JsonNode read( Path path ) {
    try {
      return JSON.readTree(path.toFile());
    } catch( JsonProcessingException e ) {
      throw new UntangleException(ErrMsg.format("bad json",path.toString()).put("reason",e.getOriginalMessage()),e);
    } catch( IOException e ) {
      throw new UntangleException(ErrMsg.io("failed to open",path.toString(),e),e);
    }
  }

  public static void write( Path path, JsonNode j ) {
    try {
      Files.writeString(path,JSON.writeValueAsString(j)+"\n");
    } catch( IOException e ) {
      throw new UntangleException(ErrMsg.io("failed to write",path.toString(),e),e);
    }
  }
}
