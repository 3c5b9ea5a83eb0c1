package com.cliffc.untangle.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestAry {
  @Test public void testPushPop() {
    Ary<String> ary = new Ary<>(String.class);
    assertTrue(ary.isEmpty());
    for( int i=0; i<10; i++ ) ary.add("s"+i);     // grows past the initial capacity
    assertEquals(10,ary.len());
    assertEquals("s9",ary.last());
    assertEquals("s9",ary.pop());
    assertEquals("s8",ary.pop());
    assertEquals(8,ary.len());
    assertEquals("s7",ary.last());
    assertEquals("s3",ary.at(3));
    assertArrayEquals(new String[]{"s0","s1","s2","s3","s4","s5","s6","s7"},ary.asAry());
    while( !ary.isEmpty() ) ary.pop();
    assertEquals(0,ary.len());
  }

  @Test(expected = ArrayIndexOutOfBoundsException.class)
  public void testPopEmpty() {
    new Ary<>(String.class).pop();
  }

  @Test(expected = ArrayIndexOutOfBoundsException.class)
  public void testLastEmpty() {
    Ary<String> ary = new Ary<>(String.class);
    ary.add("x");
    ary.pop();
    ary.last();
  }

  @Test(expected = ArrayIndexOutOfBoundsException.class)
  public void testAtPastEnd() {
    Ary<String> ary = new Ary<>(String.class);
    ary.add("x");
    ary.at(1);
  }

  @Test public void testIntPushPop() {
    AryInt ary = new AryInt();
    for( int i=0; i<9; i++ ) ary.push(i*10);
    assertEquals(9,ary._len);
    assertEquals(80,ary.pop());
    ary.xorLast(0x80000000);
    assertEquals(70|0x80000000,ary.pop());
    assertEquals(60,ary.at(6));
    while( !ary.isEmpty() ) ary.pop();
    assertEquals(0,ary._len);
  }

  @Test(expected = ArrayIndexOutOfBoundsException.class)
  public void testIntPopEmpty() {
    new AryInt().push(1).pop();
    new AryInt().pop();
  }

  // Pooled marks come back in LIFO order
  @Test public void testMarksPool() {
    MarksPool pool = new MarksPool(8);
    VersionedMarks a = pool.acquire();
    VersionedMarks b = pool.acquire();
    assertEquals(2,pool.inUse());
    b.set(3);
    pool.release(b);
    pool.release(a);
    assertEquals(0,pool.inUse());
    VersionedMarks c = pool.acquire();
    assertSame(a,c);
    assertFalse(c.test(3));
    try {
      pool.release(b);
      fail();
    } catch( IllegalStateException e ) {
      assertEquals("marks released out of order",e.getMessage());
    }
  }
}
