package exm.lola.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collection;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import exm.lola.common.exceptions.LolaRuntimeError;
import exm.lola.common.exceptions.UnificationException;
import exm.lola.common.util.UnionFind.Mark;
import exm.lola.common.util.UnionFind.Var;

public class UnionFindTest {

  /**
   * Either a constant or a box around another variable
   */
  private static class Term {
    final Integer leaf;
    final Var inner;

    Term(Integer leaf, Var inner) {
      this.leaf = leaf;
      this.inner = inner;
    }

    @Override
    public String toString() {
      return leaf != null ? leaf.toString() : "box(" + inner + ")";
    }
  }

  private static Term leaf(int i) {
    return new Term(i, null);
  }

  private static Term box(Var v) {
    return new Term(null, v);
  }

  private static final UnionFind.Lattice<Term> LATTICE =
      new UnionFind.Lattice<Term>() {
    @Override
    public Term merge(UnionFind<Term> uf, Term left, Term right)
        throws UnificationException {
      if (left.leaf != null && right.leaf != null) {
        if (!left.leaf.equals(right.leaf)) {
          throw new UnificationException(left, right);
        }
        return left;
      } else if (left.inner != null && right.inner != null) {
        uf.unify(left.inner, right.inner);
        return left;
      }
      throw new UnificationException(left, right);
    }

    @Override
    public Collection<Var> children(Term value) {
      if (value.inner == null) {
        return Collections.emptyList();
      }
      return Collections.singletonList(value.inner);
    }
  };

  private UnionFind<Term> uf;

  @Before
  public void setup() {
    uf = new UnionFind<Term>(LATTICE);
  }

  @Test
  public void testBasicMerge() throws Exception {
    Var a = uf.newVar();
    Var b = uf.newVar();
    Var c = uf.newVar(leaf(3));
    assertFalse(uf.sameSet(a, b));
    assertNull(uf.lookup(a));

    uf.unify(a, b);
    assertTrue(uf.sameSet(a, b));
    assertEquals(uf.find(a), uf.find(b));
    assertFalse(uf.isBound(b));

    uf.unify(b, c);
    assertEquals(3, (int) uf.lookup(a).leaf);
    assertTrue(uf.sameSet(a, c));
  }

  @Test
  public void testUnifyIdempotent() throws Exception {
    Var a = uf.newVar(leaf(1));
    Var b = uf.newVar();
    uf.unify(a, b);
    uf.unify(a, b);
    uf.unify(b, a);
    uf.unify(a, a);
    assertEquals(1, (int) uf.lookup(b).leaf);
    uf.unify(b, leaf(1));
    assertEquals(1, (int) uf.lookup(a).leaf);
  }

  @Test
  public void testConflictLeavesStateUnchanged() throws Exception {
    Var a = uf.newVar(leaf(1));
    Var b = uf.newVar(leaf(2));
    Var c = uf.newVar();
    uf.unify(b, c);
    int before = uf.numVars();
    try {
      uf.unify(a, c);
      fail("1 and 2 should not unify");
    } catch (UnificationException e) {
      assertEquals(1, (int) ((Term) e.getLeft()).leaf);
      assertEquals(2, (int) ((Term) e.getRight()).leaf);
    }
    assertFalse(uf.sameSet(a, c));
    assertEquals(2, (int) uf.lookup(c).leaf);
    assertEquals(before, uf.numVars());
  }

  @Test
  public void testNestedUnification() throws Exception {
    Var x = uf.newVar();
    Var y = uf.newVar(leaf(7));
    Var bx = uf.newVar(box(x));
    Var by = uf.newVar(box(y));
    uf.unify(bx, by);
    assertTrue(uf.sameSet(x, y));
    assertEquals(7, (int) uf.lookup(x).leaf);
  }

  @Test
  public void testNestedConflictRollsBackAll() throws Exception {
    Var x = uf.newVar(leaf(1));
    Var y = uf.newVar(leaf(2));
    Var bx = uf.newVar(box(x));
    Var by = uf.newVar(box(y));
    try {
      uf.unify(bx, by);
      fail("Boxes of 1 and 2 should not unify");
    } catch (UnificationException e) {
      // expected
    }
    assertFalse(uf.sameSet(bx, by));
    assertFalse(uf.sameSet(x, y));
  }

  @Test
  public void testOccursCheck() throws Exception {
    Var a = uf.newVar();
    Var boxA = uf.newVar(box(a));
    try {
      uf.unify(a, boxA);
      fail("a = box(a) should be rejected");
    } catch (UnificationException e) {
      // expected
    }
    assertFalse(uf.isBound(a));

    Var b = uf.newVar();
    Var boxBoxB = uf.newVar(box(uf.newVar(box(b))));
    try {
      uf.unify(b, boxBoxB);
      fail("b = box(box(b)) should be rejected");
    } catch (UnificationException e) {
      // expected
    }
  }

  @Test
  public void testRollback() throws Exception {
    Var a = uf.newVar();
    Var b = uf.newVar();
    Mark m = uf.snapshot();
    uf.unify(a, b);
    Var c = uf.newVar(leaf(4));
    uf.unify(b, c);
    assertEquals(4, (int) uf.lookup(a).leaf);

    uf.rollback(m);
    assertFalse(uf.sameSet(a, b));
    assertNull(uf.lookup(a));
    assertNull(uf.lookup(b));
    assertEquals(2, uf.numVars());
  }

  @Test
  public void testNestedMarks() throws Exception {
    Var a = uf.newVar();
    Var b = uf.newVar(leaf(1));
    Var c = uf.newVar();

    Mark outer = uf.snapshot();
    uf.unify(a, b);
    Mark inner = uf.snapshot();
    uf.unify(a, c);
    uf.commit(inner);
    assertEquals(1, (int) uf.lookup(c).leaf);

    uf.rollback(outer);
    assertNull(uf.lookup(a));
    assertNull(uf.lookup(c));
    assertFalse(uf.sameSet(a, c));

    Mark again = uf.snapshot();
    uf.unify(a, c);
    uf.commit(again);
    assertTrue(uf.sameSet(a, c));
  }

  @Test
  public void testRollbackDiscardsVars() {
    Mark m = uf.snapshot();
    Var v = uf.newVar();
    uf.rollback(m);
    try {
      uf.lookup(v);
      fail("Discarded variable should be rejected");
    } catch (LolaRuntimeError e) {
      // expected
    }
  }

  @Test(expected=LolaRuntimeError.class)
  public void testClosedMark() {
    Mark m = uf.snapshot();
    uf.commit(m);
    uf.rollback(m);
  }

  @Test
  public void testLongChains() throws Exception {
    Var first = uf.newVar();
    Var prev = first;
    for (int i = 0; i < 1000; i++) {
      Var next = uf.newVar();
      uf.unify(prev, next);
      prev = next;
    }
    uf.unify(prev, leaf(9));
    assertEquals(9, (int) uf.lookup(first).leaf);
  }

  @Test
  public void testBindingValuesCreatesNoVars() throws Exception {
    Var a = uf.newVar();
    Var b = uf.newVar();
    uf.unify(a, b);
    int before = uf.numVars();
    for (int i = 0; i < 100; i++) {
      uf.unify(b, leaf(5));
    }
    assertEquals(before, uf.numVars());
    assertEquals(5, (int) uf.lookup(a).leaf);

    Var inner = uf.newVar();
    Var boxed = uf.newVar(box(inner));
    before = uf.numVars();
    uf.unify(boxed, box(uf.newVar(leaf(8))));
    assertEquals(before + 1, uf.numVars());
    assertEquals(8, (int) uf.lookup(inner).leaf);
  }
}
