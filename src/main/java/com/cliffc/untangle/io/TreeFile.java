package com.cliffc.untangle.io;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.ErrMsg;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.group.GNode;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.sig.SignatureOracle;
import com.cliffc.untangle.util.AryInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.group.GroupTree.MAXSLOTS;
import static com.cliffc.untangle.sig.SignatureOracle.SID_SELF;
import static com.cliffc.untangle.sig.SignatureOracle.SID_ZERO;

/**
 * Binary tree file, little-endian.
 * <pre>
 *   header   96 bytes
 *     u32 magic, flags, sidCRC, system, crc32,
 *         kstart, ostart, estart, nstart, ncount, numRoots, numGroups, reserved
 *     u32 pad
 *     u64 offNames, offNodes, offRoots, offEnd
 *     8 reserved bytes
 *   names    key names kstart..nstart, then root names, each zero terminated,
 *            then one extra zero
 *   nodes    ncount records: u32 sid, u32 slots[9]
 *   roots    numRoots u32 references, polarity in the top bit
 * </pre>
 * Sections start 16-byte aligned.  The checksum covers the node and root
 * sections.  Saving compacts: live groups and their listed nodes are
 * renumbered in ascending order, each group written as a {@code SID_SELF}
 * record followed by its members, orphans dropped.
 */
public final class TreeFile {
  private static final Logger LOG = LogManager.getLogger(TreeFile.class);
  public static final int MAGIC = 0x20211102;
  static final int HEADER_SIZE = 96;
  static final int RECORD_SIZE = 4 + 4*MAXSLOTS;

  private TreeFile() {}

  static long align16( long x ) { return (x + 15) & ~15L; }

  /** Encode a compacted copy of the tree. */
  public static byte[] encode( GroupTree t ) {
    // Renumber
    int[] map = new int[t._ncount];
    AryInt order = new AryInt();
    for( int i=0; i<t._nstart; i++ ) { map[i] = i; order.push(i); }
    int next = t._nstart, numGroups = 0;
    for( int gid=t._nstart; gid<t._ncount; gid++ ) {
      if( !t.isHeader(gid) ) continue;
      numGroups++;
      map[gid] = next++;
      order.push(gid);
      for( int iNode=t.N(gid)._next; iNode != gid; iNode=t.N(iNode)._next ) {
        map[iNode] = next++;
        order.push(iNode);
      }
    }
    int ncount = next;

    byte[] names = encodeNames(t);
    long offNames = HEADER_SIZE;
    long offNodes = align16(offNames + names.length);
    long offRoots = align16(offNodes + (long)ncount*RECORD_SIZE);
    long offEnd   = align16(offRoots + 4L*t._numRoots);
    if( offEnd > Integer.MAX_VALUE ) throw new UntangleException(ErrMsg.overflow(t._maxNodes));

    ByteBuffer b = ByteBuffer.allocate((int)offEnd).order(ByteOrder.LITTLE_ENDIAN);
    b.position((int)offNames);
    b.put(names);

    b.position((int)offNodes);
    for( int k=0; k<order._len; k++ ) {
      int id = order.at(k);
      GNode n = t.N(id);
      if( id >= t._nstart && t.isHeader(id) ) {
        b.putInt(SID_SELF).putInt(map[id]);
        for( int i=1; i<MAXSLOTS; i++ ) b.putInt(0);
        continue;
      }
      b.putInt(n._sid);
      int k2 = t._db.signature(n._sid)._numPlaceholder;
      for( int i=0; i<MAXSLOTS; i++ )
        b.putInt(i < k2 ? map[t.chase(n._slots[i])] : 0);
    }

    b.position((int)offRoots);
    for( int i=0; i<t._numRoots; i++ )
      b.putInt(remap(t,map,t._roots[i]));

    CRC32 crc = new CRC32();
    crc.update(b.array(),(int)offNodes,(int)(offEnd-offNodes));

    b.position(0);
    b.putInt(MAGIC).putInt(t._flags).putInt(t._db.sidCRC()).putInt(remap(t,map,t._system)).putInt((int)crc.getValue());
    b.putInt(t._kstart).putInt(t._ostart).putInt(t._estart).putInt(t._nstart).putInt(ncount);
    b.putInt(t._numRoots).putInt(numGroups).putInt(0);
    b.putInt(0);
    b.putLong(offNames).putLong(offNodes).putLong(offRoots).putLong(offEnd);
    return b.array();
  }

  private static int remap( GroupTree t, int[] map, int ref ) {
    return map[t.chase(ref & ~IBIT)] | (ref & IBIT);
  }

  private static byte[] encodeNames( GroupTree t ) {
    ByteArrayOutputStream os = new ByteArrayOutputStream();
    for( int i=t._kstart; i<t._nstart; i++ ) writeName(os,t._keyNames[i]);
    for( int i=0; i<t._numRoots; i++ ) writeName(os,t._rootNames[i]);
    os.write(0);
    return os.toByteArray();
  }
  private static void writeName( ByteArrayOutputStream os, String name ) {
    byte[] bs = name.getBytes(StandardCharsets.UTF_8);
    os.write(bs,0,bs.length);
    os.write(0);
  }

  /** Write the tree to a file.
   *  @return the bytes written */
  public static byte[] save( GroupTree t, Path path ) {
    byte[] bytes = encode(t);
    try {
      Files.write(path,bytes);
    } catch( IOException e ) {
      throw new UntangleException(ErrMsg.io("failed to write",path.toString(),e),e);
    }
    LOG.info("saved {} ({} bytes)",path,bytes.length);
    return bytes;
  }

  /**
   * Load a tree from a file.
   * @param mapped map the file into memory instead of reading it into a buffer
   */
  public static GroupTree load( Path path, Context ctx, SignatureOracle db, boolean mapped ) {
    ByteBuffer b;
    try {
      if( mapped ) {
        try( FileChannel ch = FileChannel.open(path,StandardOpenOption.READ) ) {
          MappedByteBuffer mb = ch.map(FileChannel.MapMode.READ_ONLY,0,ch.size());
          b = mb;
        }
      } else {
        b = ByteBuffer.wrap(Files.readAllBytes(path));
      }
    } catch( IOException e ) {
      throw new UntangleException(ErrMsg.io("failed to open",path.toString(),e),e);
    }
    GroupTree t = decode(b.order(ByteOrder.LITTLE_ENDIAN),path.toString(),ctx,db);
    LOG.info("loaded {} ncount={} groups={}",path,t._ncount,t.numGroups());
    return t;
  }

  /** Decode and rebuild a tree, including its node index. */
  public static GroupTree decode( ByteBuffer b, String filename, Context ctx, SignatureOracle db ) {
    long size = b.limit();
    if( size < HEADER_SIZE ) throw bad("file too short",filename);
    if( b.getInt(0) != MAGIC )
      throw new UntangleException(ErrMsg.format("db magic",filename).put("encountered",String.format("%08x",b.getInt(0))).put("expected",String.format("%08x",MAGIC)));
    int flags = b.getInt(4), sidCRC = b.getInt(8), system = b.getInt(12), crc32 = b.getInt(16);
    int kstart = b.getInt(20), ostart = b.getInt(24), estart = b.getInt(28), nstart = b.getInt(32);
    int ncount = b.getInt(36), numRoots = b.getInt(40);
    long offNames = b.getLong(56), offNodes = b.getLong(64), offRoots = b.getLong(72), offEnd = b.getLong(80);

    if( nstart < 1 || ncount < nstart || numRoots < 0 )
      throw bad("bad dimensions",filename);
    if( offEnd != size )
      throw new UntangleException(ErrMsg.format("db size mismatch",filename).put("encountered",size).put("expected",offEnd));
    if( sidCRC != db.sidCRC() )
      throw new UntangleException(ErrMsg.format("sidCRC mismatch",filename).put("encountered",String.format("%08x",sidCRC)).put("expected",String.format("%08x",db.sidCRC())));
    if( offNames < HEADER_SIZE || offNodes < offNames || offRoots < offNodes + (long)ncount*RECORD_SIZE || offEnd < offRoots + 4L*numRoots )
      throw bad("bad section offsets",filename);
    CRC32 crc = new CRC32();
    ByteBuffer dup = b.duplicate();
    dup.position((int)offNodes).limit((int)offEnd);
    crc.update(dup);
    if( (int)crc.getValue() != crc32 )
      throw new UntangleException(ErrMsg.format("crc mismatch",filename).put("encountered",String.format("%08x",(int)crc.getValue())).put("expected",String.format("%08x",crc32)));

    Context c2 = ctx;
    if( ctx._maxNode < ncount ) {
      c2 = ctx.copy();
      c2._maxNode = ncount + 16;
    }
    GroupTree t;
    try {
      t = new GroupTree(c2,db,kstart,ostart,estart,nstart,numRoots);
    } catch( IllegalArgumentException e ) {
      throw new UntangleException(ErrMsg.format(e.getMessage(),filename),e);
    }
    t._flags = flags;

    // Names
    int pos = (int)offNames;
    for( int i=kstart; i<nstart; i++ ) {
      int end = pos;
      while( end < offNodes && b.get(end) != 0 ) end++;
      if( end >= offNodes ) throw bad("names truncated",filename);
      t._keyNames[i] = readName(b,pos,end);
      pos = end+1;
    }
    for( int i=0; i<numRoots; i++ ) {
      int end = pos;
      while( end < offNodes && b.get(end) != 0 ) end++;
      if( end >= offNodes ) throw bad("names truncated",filename);
      t._rootNames[i] = readName(b,pos,end);
      pos = end+1;
    }

    // Entry points are rebuilt by the tree; check they agree
    int[] slots = new int[MAXSLOTS];
    for( int id=0; id<nstart && id<ncount; id++ ) {
      int sid = b.getInt((int)(offNodes + (long)id*RECORD_SIZE));
      if( sid != (id==0 ? SID_ZERO : SID_SELF) ) throw bad("bad entry point record "+id,filename);
    }
    int gid = -1;
    for( int id=nstart; id<ncount; id++ ) {
      int at = (int)(offNodes + (long)id*RECORD_SIZE);
      int sid = b.getInt(at);
      if( sid <= 0 || sid >= db.numSignatures() ) throw bad("signature out of range: "+sid,filename);
      for( int i=0; i<MAXSLOTS; i++ ) slots[i] = b.getInt(at+4+4*i);
      if( sid == SID_SELF ) {
        if( slots[0] != id ) throw bad("bad group header "+id,filename);
        gid = t.restoreHeader();
        if( gid != id ) throw bad("record out of sequence "+id,filename);
        continue;
      }
      if( gid < 0 ) throw bad("node outside a group "+id,filename);
      int k = db.signature(sid)._numPlaceholder;
      for( int i=0; i<k; i++ )
        if( slots[i] < 0 || slots[i] >= ncount ) throw bad("slot out of range: "+slots[i],filename);
      if( t.restoreNode(gid,sid,slots) != id ) throw bad("record out of sequence "+id,filename);
    }

    for( int i=0; i<numRoots; i++ ) {
      int r = b.getInt((int)(offRoots + 4L*i));
      if( (r & ~IBIT) >= ncount ) throw bad("root out of range: "+r,filename);
      t._roots[i] = r;
    }
    if( (system & ~IBIT) >= ncount ) throw bad("system out of range: "+system,filename);
    t._system = system;
    if( ctx.paranoid() ) t.validateTree(false);
    return t;
  }

  private static String readName( ByteBuffer b, int pos, int end ) {
    byte[] bs = new byte[end-pos];
    for( int i=0; i<bs.length; i++ ) bs[i] = b.get(pos+i);
    return new String(bs,StandardCharsets.UTF_8);
  }

  private static UntangleException bad( String msg, String filename ) {
    return new UntangleException(ErrMsg.format(msg,filename));
  }
}
