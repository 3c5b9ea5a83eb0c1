package com.cliffc.untangle.group;

import com.cliffc.untangle.Context;
import com.cliffc.untangle.UntangleException;
import com.cliffc.untangle.eval.Evaluator;
import com.cliffc.untangle.io.Notation;
import com.cliffc.untangle.sig.GeneratedOracle;
import com.cliffc.untangle.sig.Signature;
import org.junit.BeforeClass;
import org.junit.Test;

import static com.cliffc.untangle.group.GroupTree.IBIT;
import static com.cliffc.untangle.sig.SignatureOracle.*;
import static org.junit.Assert.*;

public class TestGroupTree {
  private static GeneratedOracle DB;
  @BeforeClass public static void setup() { DB = new GeneratedOracle(2,false); }

  // Keys a,b,c.. are ids 2,3,4..
  static GroupTree tree( Context ctx, int numKeys ) {
    int n = 2+numKeys;
    return new GroupTree(ctx,DB,2,n,n,n,n);
  }
  static final int A=2, B=3, C=4, D=5;

  private static int load( GroupTree t, String name ) { return new Notation(t).loadStringSafe(name); }

  // Every listed node must compute the same function as its group
  private static void checkGroups( GroupTree t, int numKeys ) {
    Evaluator ev = new Evaluator(t);
    for( int r=0; r<Evaluator.numRounds(numKeys); r++ ) {
      ev.evalGroups(Evaluator.laneKeys(numKeys,r));
      for( int gid=t._nstart; gid<t._ncount; gid++ ) {
        if( !t.isHeader(gid) ) continue;
        for( int iNode=t.N(gid)._next; iNode != gid; iNode=t.N(iNode)._next )
          assertEquals("group "+gid+" node "+iNode,ev.value(gid),ev.evalNode(iNode));
      }
    }
  }

  @Test public void testConstruct() {
    GroupTree t = tree(new Context(),3);
    assertEquals(5,t._ncount);
    assertEquals("0",t._keyNames[0]);
    assertEquals("KERROR",t._keyNames[1]);
    assertEquals("k0",t._keyNames[A]);
    assertEquals(0,t.numGroups());
    t.validateTree(false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testReservedKstart() {
    new GroupTree(new Context(),DB,1,3,3,3,3);
  }

  @Test public void testLevel1() {
    GroupTree t = tree(new Context(),3);
    assertEquals(B,t.addNormaliseNode(A,B,B));        // T == F
    assertEquals(C,t.addNormaliseNode(0,B,C));        // Q false
    assertEquals(B,t.addNormaliseNode(IBIT,B,C));     // Q true
    assertEquals(A,t.addNormaliseNode(A,IBIT,0));     // a ? 1 : 0
    assertEquals(A|IBIT,t.addNormaliseNode(A,0,IBIT));// a ? 0 : 1
    assertEquals(0,t.addNormaliseNode(A,A|IBIT,0));   // a & !a
    assertEquals(A,t.addNormaliseNode(A,A,0));        // a & a
    assertEquals(t._nstart,t._ncount);               // nothing added
  }

  @Test public void testAnd() {
    GroupTree t = tree(new Context(),2);
    int r = t.chase(t.addNormaliseNode(A,B,0));
    assertTrue(r >= t._nstart);
    int first = t.first1n9(r);
    assertEquals(SID_AND,t.N(first)._sid);
    assertEquals(A,t.N(first)._slots[0]);
    assertEquals(B,t.N(first)._slots[1]);
    t.validateTree(false);
    checkGroups(t,2);
  }

  // a ? b : a  and  a ? a : b  reduce to two-slot nodes
  @Test public void testDegenerateQTF() {
    GroupTree t = tree(new Context(),2);
    int and = t.chase(t.addNormaliseNode(A,B,A));
    int or  = t.chase(t.addNormaliseNode(A,A,B));
    assertEquals(SID_AND,t.N(t.first1n9(and))._sid);
    assertEquals(SID_OR ,t.N(t.first1n9(or ))._sid);
    for( int i=t._nstart; i<t._ncount; i++ )
      if( !t.isHeader(i) )
        assertTrue(t.sig(i)._numPlaceholder <= 2);
    assertEquals(t.chase(t.addNormaliseNode(A,B,0)),and);
    assertEquals(t.chase(t.addNormaliseNode(A,IBIT,B)),or);
  }

  @Test public void testOperandOrder() {
    GroupTree t = tree(new Context(),3);
    assertEquals(t.chase(t.addNormaliseNode(A,IBIT,B)),t.chase(t.addNormaliseNode(B,IBIT,A)));
    assertEquals(t.chase(t.addNormaliseNode(A,B,0)),t.chase(t.addNormaliseNode(B,A,0)));
    assertEquals(t.chase(t.addNormaliseNode(A,B|IBIT,B)),t.chase(t.addNormaliseNode(B,A|IBIT,A)));
    // !a ? c : b  is  a ? b : c
    assertEquals(t.chase(t.addNormaliseNode(A,B,C)),t.chase(t.addNormaliseNode(A|IBIT,C,B)));
    t.validateTree(false);
  }

  // a ? b : !c  is  !(a ? !b : c)
  @Test public void testInvertedF() {
    GroupTree t = tree(new Context(),3);
    int r = t.addNormaliseNode(A,B,C|IBIT);
    assertEquals(IBIT,r & IBIT);
    int qntf = t.chase(t.addNormaliseNode(A,B|IBIT,C));
    assertEquals(qntf,t.chase(r & ~IBIT));
    assertEquals(SID_QNTF,t.N(t.first1n9(qntf))._sid);
  }

  @Test public void testIdempotent() {
    GroupTree t = tree(new Context(),4);
    int r1 = t.chase(t.addNormaliseNode(A,B|IBIT,C));
    int count = t._ncount;
    int r2 = t.chase(t.addNormaliseNode(A,B|IBIT,C));
    assertEquals(r1,r2);
    assertEquals(count,t._ncount);
  }

  // Both groupings of a three-way exclusive-or end up in one group
  @Test public void testXorAssociates() {
    GroupTree t = tree(new Context(),3);
    int left  = load(t,"ab^c^");
    int right = load(t,"abc^^");
    int other = load(t,"ac^b^");
    assertEquals(t.chase(left),t.chase(right));
    assertEquals(t.chase(left),t.chase(other));
    t.validateTree(false);
    checkGroups(t,3);
  }

  @Test public void testMixedBuild() {
    GroupTree t = tree(new Context(),4);
    String[] names = { "ab+c&", "abc?d^", "ab>cd!", "ab^cd^&", "abc!d&", "ab&c+d>", "ab+cd+&ab^cd^&+" };
    for( String name : names ) load(t,name);
    t.validateTree(false);
    checkGroups(t,4);
  }

  @Test public void testWithoutRewrite() {
    Context ctx = new Context().flag(Context.MAGICMASK_REWRITE,false);
    GroupTree t = tree(ctx,3);
    int r = t.chase(load(t,"abc?"));
    assertEquals(SID_QTF,t.N(t.first1n9(r))._sid);
    assertEquals(r,t.chase(load(t,"abc?")));
    load(t,"ab^c^");
    t.validateTree(false);
    checkGroups(t,3);
  }

  @Test public void testParanoidMember() {
    Context ctx = new Context().flag(Context.MAGICMASK_PARANOID,true);
    ctx._expand = Context.Expand.MEMBER;
    GroupTree t = tree(ctx,4);
    load(t,"ab^c^");
    load(t,"abc?d&");
    t.validateTree(false);
    checkGroups(t,4);
  }

  @Test public void testOverflow() {
    Context ctx = new Context();
    ctx._maxNode = 1;                           // Raised to nstart+16
    GroupTree t = tree(ctx,4);
    try {
      load(t,"ab+cd+&ab^cd^&+");
      fail();
    } catch( UntangleException e ) {
      assertEquals("overflow",e._err._msg);
      assertEquals(t._maxNodes,e._err.get("maxnode"));
    }
  }

  // Merging two groups proven equal keeps one of each signature and folds the rest
  @Test public void testImportGroup() {
    GroupTree t = tree(new Context(),2);
    int and = t.chase(t.addNormaliseNode(A,B,0));
    int gid = t.restoreHeader();
    t.restoreNode(gid,SID_QTF,new int[]{A,B,0,0,0,0,0,0,0});
    Collector c = t.collector();
    assertEquals(gid,c.importGroup(gid,and));
    assertEquals(gid,t.chase(and));
    assertEquals(and,c._lowWater);
    c.updateGroups(t._nstart);
    int first = t.first1n9(gid);
    assertEquals(SID_AND,t.N(first)._sid);
    assertEquals(first,t.N(gid)._next);
    assertEquals(gid,t.N(first)._next);       // Only the conjunction survives
    t.validateTree(false);
  }

  // Load in order into one tree; after each the structure is finished and computes the expression
  private static void loadAll( Context ctx, String... names ) {
    GroupTree t = tree(ctx,5);
    long[] keys = Evaluator.laneKeys(5,0);
    for( String name : names ) {
      int r = load(t,name);
      t.validateTree(false);
      checkGroups(t,5);
      Evaluator ev = new Evaluator(t);
      ev.evalGroups(keys);
      assertEquals(name,Evaluator.evalString(name,t._kstart,t._nstart,keys,null),ev.value(r));
    }
  }

  // Merges during these builds made groups reference each other
  @Test public void testRepairSettles() {
    loadAll(new Context(),"0a0&cd&&ed>dd&^~+>~","beb+ead!a00+~!0a&cc>~0b&~!aea++??",
            "ad>~ca^>cb^~00&+&dbde0?~cb&&?ce+~ee^&~bace!^>!","aa&bdb+ca&~+~0c+eac!>+?");
  }

  // A merge here used to orphan the only single-node member of a group
  @Test public void testMergeKeeps1n9() {
    loadAll(new Context(),"0a&a0>0bd?!bb&&b0c^&~aa^e0>^~^a!","b0ab+dc>&c!>~");
  }

  // Expansion merges a slot's group into the group under construction
  @Test public void testExpansionSelfReference() {
    loadAll(new Context().flag(Context.MAGICMASK_PARANOID,true),"cb^","bea?ec^~^~dd>~e+~&dae^ad^^cc>cb+&~>?");
  }

  @Test public void testMemberExpansionSettles() {
    Context ctx = new Context();
    ctx._expand = Context.Expand.MEMBER;
    loadAll(ctx,"bdee!a0^?ca>ae>+~+eac&~>bcb+^~+ab>a0b!bbe??~e0b?a&0?~!");
  }

  // A node may not join a group its slots already depend on
  @Test public void testRefuseCycle() {
    GroupTree t = tree(new Context(),3);
    int and = t.chase(t.addNormaliseNode(A,B,0));
    int or  = t.chase(t.addNormaliseNode(and,IBIT,C));
    Collector c = t.collector();
    assertTrue (c.reaches(new int[]{or ,0,0,0,0,0,0,0,0},1,and));
    assertFalse(c.reaches(new int[]{and,0,0,0,0,0,0,0,0},1,or ));
    assertEquals(IBIT,c.addToCollection(SID_AND,new int[]{or,A,0,0,0,0,0,0,0},and,0,1));
    assertEquals(IBIT,c.addToCollection(SID_AND,new int[]{and,A,0,0,0,0,0,0,0},and,0,1));
    assertEquals(IBIT,c.addToCollection(SID_AND,new int[]{A,A,0,0,0,0,0,0,0},or,0,1));
    t.validateTree(false);
  }

  // A node reaching the other side through a user group is dropped by the merge
  @Test public void testImportFloodsUsers() {
    GroupTree t = tree(new Context(),3);
    int and = t.chase(t.addNormaliseNode(A,B,0));
    int or  = t.chase(t.addNormaliseNode(and,IBIT,C));
    int gid = t.restoreHeader();
    int nid = t.restoreNode(gid,SID_QTF,new int[]{A,or,B,0,0,0,0,0,0});
    Collector c = t.collector();
    assertEquals(and,c.importGroup(gid,and));
    assertEquals(and,t.chase(gid));
    assertTrue(t.isOrphan(nid));
    assertTrue(t.isHeader(or));
    assertEquals(0,t.pool().inUse());
    t.validateTree(false);
  }

  @Test public void testConstructSlotsOverflow() {
    GroupTree t = tree(new Context(),10);
    int wide = 0;
    for( int sid=SID_QTF+1; sid<DB.numSignatures() && wide==0; sid++ )
      if( DB.signature(sid)._numPlaceholder == 5 ) wide = sid;
    assertNotEquals(0,wide);
    int g1 = t.restoreHeader();
    int n1 = t.restoreNode(g1,wide,new int[]{2,3,4,5,6,0,0,0,0});
    int g2 = t.restoreHeader();
    int n2 = t.restoreNode(g2,wide,new int[]{7,8,9,10,11,0,0,0,0});
    int[] pFinal = new int[GroupTree.MAXSLOTS];
    int[] power = new int[1];
    assertEquals(0,t.normaliser().constructSlots(n1,0,n2,0,pFinal,power));
    // Sharing slots fits
    assertNotEquals(0,t.normaliser().constructSlots(n1,0,n1,0,pFinal,power));
  }

  @Test public void testClassify() {
    GroupTree t = tree(new Context(),3);
    Normaliser norm = t.normaliser();
    int[] cl = new int[5];
    assertEquals(A,norm.classify(A,0,IBIT,0,cl));           // a ? 1 : 0
    assertEquals(0,norm.classify(A,A,IBIT,A,cl));           // a ? !a : a
    assertEquals(B,norm.classify(A,B,0,B,cl));              // a ? b : b
    assertEquals(IBIT,norm.classify(A,A,0,B,cl));           // a ? a : b
    assertEquals(SID_OR,cl[4]);
    assertEquals(IBIT,norm.classify(A,0,0,B,cl));           // a ? 0 : b  is  b > a
    assertEquals(SID_GT,cl[4]);
    assertArrayEquals(new int[]{B,A,0,0,0,0,0,0,0},norm.tlSlots(cl,new int[GroupTree.MAXSLOTS]));
    assertEquals(IBIT,norm.classify(A,B,IBIT,B,cl));
    assertEquals(SID_NE,cl[4]);
    assertEquals(IBIT,norm.classify(C,B,0,A,cl));
    assertEquals(SID_QTF,cl[4]);
  }

  @Test public void testApplySwapping() {
    GroupTree t = tree(new Context(),3);
    Signature xor3 = DB.signature(DB.lookupSignature("abc^^"));
    int[] v = {9,4,7};
    t.normaliser().applySwapping(xor3,v,3);
    assertArrayEquals(new int[]{4,7,9},v);
    int[] g = {9,4};
    t.normaliser().applySwapping(DB.signature(SID_GT),g,2);
    assertArrayEquals(new int[]{9,4},g);
  }
}
