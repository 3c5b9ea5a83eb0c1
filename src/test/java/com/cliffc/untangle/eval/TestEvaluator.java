package com.cliffc.untangle.eval;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.InconsistencyException;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.group.GroupTree;
import com.cliffc.untangle.io.Notation;
import com.cliffc.untangle.sig.GeneratedOracle;
import org.junit.BeforeClass;
import org.junit.Test;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.sig.SignatureOracle.SID_AND;
import static org.junit.Assert.*;

public class TestEvaluator {
  private static GeneratedOracle DB;
  @BeforeClass public static void setup() { DB = new GeneratedOracle(2,false); }

  @Test public void testLaneKeys() {
    long[] k = Evaluator.laneKeys(2,0);
    assertEquals(0xAAAAAAAAAAAAAAAAL,k[0]);
    assertEquals(0xCCCCCCCCCCCCCCCCL,k[1]);
    long[] k7 = Evaluator.laneKeys(7,1);
    assertEquals(-1L,k7[6]);                  // Round 1 has bit 6 set everywhere
    assertEquals(k[0],k7[0]);
    assertEquals(1,Evaluator.numRounds(6));
    assertEquals(2,Evaluator.numRounds(7));
    assertEquals(16,Evaluator.numRounds(10));
  }

  @Test public void testEvalString() {
    long[] k = Evaluator.laneKeys(3,0);
    long a = k[0], b = k[1], c = k[2];
    assertEquals(a|b,      Evaluator.evalString("ab+",2,5,k,null));
    assertEquals(a&~b,     Evaluator.evalString("ab>",2,5,k,null));
    assertEquals(a^b,      Evaluator.evalString("ab^",2,5,k,null));
    assertEquals(a&b,      Evaluator.evalString("ab&",2,5,k,null));
    assertEquals((a&~b)|(~a&c),Evaluator.evalString("abc!",2,5,k,null));
    assertEquals((a&b)|(~a&c), Evaluator.evalString("abc?",2,5,k,null));
    assertEquals(~(a|b)^c, Evaluator.evalString("ab+~c^",2,5,k,null));
    assertEquals(0L,       Evaluator.evalString("0",2,5,k,null));
    // Back-reference to the first operator
    assertEquals((a|b)&((a|b)^c),Evaluator.evalString("ab+1c^&",2,5,k,null));
    // Transform: placeholder a reads key c, b reads key a
    int[] map = {0,0,4,2,1};
    assertEquals(c&~a,     Evaluator.evalString("ab>",2,5,k,map));
  }

  @Test public void testEvalStringErrors() {
    long[] k = Evaluator.laneKeys(2,0);
    try {
      Evaluator.evalString("ab",2,4,k,null);
      fail();
    } catch( UntangleException e ) {
      assertEquals("[stack not empty]",e._err._msg);
    }
    try {
      Evaluator.evalString("ac+",2,4,k,null);
      fail();
    } catch( UntangleException e ) {
      assertEquals("[endpoint out of range: 2]",e._err._msg);
    }
    try {
      Evaluator.evalString("a&",2,4,k,null);
      fail();
    } catch( UntangleException e ) {
      assertEquals("[stack underflow]",e._err._msg);
    }
  }

  @Test public void testGroupsAndNodes() {
    GroupTree t = new GroupTree(new Context(),DB,2,5,5,5,5);
    Notation note = new Notation(t);
    int and = note.loadStringSafe("ab&");
    int xor = note.loadStringSafe("ab^c^");
    long[] k = Evaluator.laneKeys(3,0);
    Evaluator ev = new Evaluator(t);
    ev.evalGroups(k);
    assertEquals(k[0]&k[1],ev.value(and));
    assertEquals(~(k[0]&k[1]),ev.value(and|IBIT));
    assertEquals(k[0]^k[1]^k[2],ev.value(xor));
    assertEquals(0L,ev.value(0));
    assertEquals(-1L,ev.value(IBIT));
    assertEquals(k[2],ev.value(4));
    int first = t.first1n9(t.chase(and));
    assertEquals(SID_AND,t.N(first)._sid);
    assertEquals(k[0]&k[1],ev.evalNode(first));
  }

  @Test(expected = InconsistencyException.class)
  public void testGroupWithout1n9() {
    GroupTree t = new GroupTree(new Context(),DB,2,5,5,5,5);
    int gid = t.restoreHeader();
    t.restoreNode(gid,DB.lookupSignature("abc^^"),new int[]{2,3,4,0,0,0,0,0,0});
    new Evaluator(t).evalGroups(Evaluator.laneKeys(3,0));
  }
}
