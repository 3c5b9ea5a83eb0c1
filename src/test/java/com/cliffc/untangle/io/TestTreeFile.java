package com.cliffc.untangle.io;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.eval.Evaluator;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.sig.GeneratedOracle;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Arrays;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static org.junit.Assert.*;

public class TestTreeFile {
  private static GeneratedOracle DB;
  @BeforeClass public static void setup() { DB = new GeneratedOracle(2,false); }

  @Rule public TemporaryFolder _tmp = new TemporaryFolder();

  static final String[] ROOTS = { "ab+c&", "ab^c^d&", "abc?da!~", "ab>", "a" };

  // Keys a..d, roots r0..r4 after them
  static GroupTree sample() {
    GroupTree t = new GroupTree(new Context(),DB,2,6,6,6,6+ROOTS.length);
    for( int i=2; i<6; i++ ) t._keyNames[i] = String.valueOf((char)('a'+i-2));
    for( int i=0; i<6; i++ ) t._rootNames[i] = t._keyNames[i];
    Notation note = new Notation(t);
    for( int i=0; i<ROOTS.length; i++ ) {
      t._rootNames[6+i] = "r"+i;
      t._roots[6+i] = note.loadStringSafe(ROOTS[i]);
    }
    return t;
  }

  private static GroupTree decode( byte[] bytes, Context ctx ) {
    return TreeFile.decode(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN),"mem",ctx,DB);
  }

  private static void assertRoots( GroupTree t ) {
    Evaluator ev = new Evaluator(t);
    long[] keys = Evaluator.laneKeys(4,0);
    ev.evalGroups(keys);
    for( int i=0; i<ROOTS.length; i++ )
      assertEquals(ROOTS[i],Evaluator.evalString(ROOTS[i],2,6,keys,null),ev.value(t._roots[6+i]));
  }

  private static void assertFormat( byte[] bytes, String msg ) {
    try {
      decode(bytes,new Context());
      fail();
    } catch( UntangleException e ) {
      assertEquals(msg,e._err._msg);
      assertEquals("mem",e._err.get("filename"));
    }
  }

  @Test public void testLayout() {
    byte[] bytes = TreeFile.encode(sample());
    ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    assertEquals(TreeFile.MAGIC,b.getInt(0));
    assertEquals(DB.sidCRC(),b.getInt(8));
    assertEquals(2,b.getInt(20));
    assertEquals(6,b.getInt(32));
    assertEquals(6+ROOTS.length,b.getInt(40));
    assertEquals(TreeFile.HEADER_SIZE,b.getLong(56));
    long offNodes = b.getLong(64);
    assertEquals(0,offNodes % 16);
    assertEquals(bytes.length,b.getLong(80));
    // Names: keys, then roots
    assertEquals('a',bytes[TreeFile.HEADER_SIZE]);
    assertEquals(0,bytes[TreeFile.HEADER_SIZE+1]);
  }

  @Test public void testRoundTrip() {
    GroupTree t = sample();
    byte[] bytes = TreeFile.encode(t);
    GroupTree t2 = decode(bytes,new Context().flag(Context.MAGICMASK_PARANOID,true));
    assertEquals(t._kstart,t2._kstart);
    assertEquals(t._nstart,t2._nstart);
    assertEquals(t._numRoots,t2._numRoots);
    assertEquals(t.numGroups(),t2.numGroups());
    assertEquals("c",t2._keyNames[4]);
    assertEquals("r3",t2._rootNames[9]);
    assertEquals(2,t2._roots[10]);            // A bare key stays a key
    assertRoots(t2);
    // Already compact, so encoding again is stable
    assertArrayEquals(bytes,TreeFile.encode(t2));
  }

  // The node index is rebuilt; known single-node structure is found again
  @Test public void testReloadIndexed() {
    GroupTree t2 = decode(TreeFile.encode(sample()),new Context());
    int count = t2._ncount;
    Notation note = new Notation(t2);
    int gt = note.loadStringSafe("ab>");
    int and = note.loadStringSafe("ab+c&");
    assertEquals(count,t2._ncount);
    assertEquals(t2.chaseRef(t2._roots[9]),gt);
    assertEquals(t2.chaseRef(t2._roots[6]),and);
  }

  @Test public void testCompaction() {
    GroupTree t = sample();
    int orphans = t._ncount - t._nstart - t.numGroups() - t.numListed();
    GroupTree t2 = decode(TreeFile.encode(t),new Context());
    assertEquals(t._ncount - orphans,t2._ncount);
    assertEquals(0,t2._ncount - t2._nstart - t2.numGroups() - t2.numListed());
  }

  @Test public void testSaveLoad() throws IOException {
    Path path = _tmp.newFile("tree.dat").toPath();
    byte[] bytes = TreeFile.save(sample(),path);
    GroupTree mapped = TreeFile.load(path,new Context(),DB,true);
    GroupTree read   = TreeFile.load(path,new Context(),DB,false);
    assertRoots(mapped);
    assertRoots(read);
    assertArrayEquals(bytes,TreeFile.encode(read));
  }

  @Test public void testMissingFile() {
    try {
      TreeFile.load(_tmp.getRoot().toPath().resolve("nope.dat"),new Context(),DB,false);
      fail();
    } catch( UntangleException e ) {
      assertEquals("failed to open",e._err._msg);
    }
  }

  @Test public void testSmallArena() {
    Context ctx = new Context();
    ctx._maxNode = 1;
    GroupTree t2 = decode(TreeFile.encode(sample()),ctx);
    assertRoots(t2);
  }

  @Test public void testCorrupt() {
    byte[] good = TreeFile.encode(sample());
    assertFormat(Arrays.copyOf(good,50),"file too short");

    byte[] bad = good.clone();
    bad[0] ^= 1;
    assertFormat(bad,"db magic");

    assertFormat(Arrays.copyOf(good,good.length-16),"db size mismatch");

    bad = good.clone();
    int offNodes = (int)ByteBuffer.wrap(good).order(ByteOrder.LITTLE_ENDIAN).getLong(64);
    bad[offNodes + 6*TreeFile.RECORD_SIZE + 4] ^= 1;
    assertFormat(bad,"crc mismatch");

    try {
      TreeFile.decode(ByteBuffer.wrap(good).order(ByteOrder.LITTLE_ENDIAN),"mem",new Context(),new GeneratedOracle(1,false));
      fail();
    } catch( UntangleException e ) {
      assertEquals("sidCRC mismatch",e._err._msg);
    }
  }

  @Test public void testInvertedRoot() {
    GroupTree t = sample();
    assertEquals(IBIT,t._roots[8] & IBIT);
    GroupTree t2 = decode(TreeFile.encode(t),new Context());
    assertEquals(IBIT,t2._roots[8] & IBIT);
  }
}
