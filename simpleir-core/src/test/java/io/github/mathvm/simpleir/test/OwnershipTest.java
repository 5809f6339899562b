package io.github.mathvm.simpleir.test;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ir.*;
import io.github.mathvm.simpleir.ops.BinaryOp;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class OwnershipTest {
    @Test
    void testOperandsHaveOneOwner() {
        IntConst x = new IntConst(1);
        Print print = new Print(x);
        assertSame(print, x.getOwner());
        assertSame(print, x.getNullable(CommonExts.OWNER));

        assertThrows(IllegalStateException.class, () -> new Print(x));
        assertThrows(IllegalStateException.class, () -> new BinOp(x, new IntConst(2), BinaryOp.ADD));
        assertThrows(IllegalStateException.class,
                () -> new Call(1, Collections.singletonList(x), Collections.emptyList()));
        assertSame(print, x.getOwner());
    }

    @Test
    void testSameNodeTwiceInOneOwner() {
        Variable x = new Variable(1);
        assertThrows(IllegalStateException.class, () -> new BinOp(x, x, BinaryOp.ADD));
        assertNull(x.getOwner());
        assertThrows(IllegalStateException.class,
                () -> new Call(0, Arrays.asList(x, x), Collections.emptyList()));
        assertNull(x.getOwner());

        Block a = new Block("A");
        Block b = new Block("B");
        Print print = new Print(new IntConst(1));
        a.addStatement(print);
        assertThrows(IllegalStateException.class, () -> a.addStatement(print));
        assertEquals(1, a.getContents().size());

        Phi phi = new Phi(x);
        assertThrows(IllegalStateException.class, () -> phi.addVar(x));
        assertTrue(phi.getVars().isEmpty());

        a.getContents().remove(0);
        b.addStatement(print);
        assertTrue(a.getContents().isEmpty());
        assertEquals(Collections.singletonList(print), b.getContents());
    }

    @Test
    void testRejectedOperandsStayFree() {
        Variable fresh = new Variable(1);
        IntConst owned = new IntConst(2);
        Print holder = new Print(owned);

        assertThrows(IllegalStateException.class, () -> new BinOp(fresh, owned, BinaryOp.ADD));
        assertNull(fresh.getOwner());
        assertThrows(IllegalStateException.class, () -> new Assignment(fresh, owned));
        assertNull(fresh.getOwner());
        assertThrows(IllegalStateException.class,
                () -> new Call(0, Arrays.asList(fresh, owned), Collections.emptyList()));
        assertNull(fresh.getOwner());
        assertSame(holder, owned.getOwner());

        Block a = new Block("A");
        Block b = new Block("B");
        Print first = new Print(new IntConst(3));
        Print elsewhere = new Print(new IntConst(4));
        b.addStatement(elsewhere);
        assertThrows(IllegalStateException.class,
                () -> a.getContents().addAll(Arrays.asList(first, elsewhere)));
        assertTrue(a.getContents().isEmpty());
        assertNull(first.getOwner());
        assertSame(b, elsewhere.getOwner());

        b.addStatement(first);
        assertSame(b, first.getOwner());
        assertEquals("$1 + 5", new BinOp(fresh, new IntConst(5), BinaryOp.ADD).toString());
    }

    @Test
    void testJumpIsNotAStatementOfTheBody() {
        Block a = new Block("A");
        Block b = new Block("B");
        JumpAlways jump = new JumpAlways(b);
        assertThrows(IllegalArgumentException.class, () -> a.addStatement(jump));
        assertThrows(IllegalArgumentException.class,
                () -> a.getContents().add(new JumpCond(b, b, new IntConst(1))));
        assertTrue(a.getContents().isEmpty());
        assertNull(jump.getOwner());

        a.setTransition(jump);
        assertEquals(Collections.singleton(a), b.getPredecessors());
    }

    @Test
    void testNestedOwnership() {
        Variable left = new Variable(1);
        IntConst right = new IntConst(2);
        BinOp sum = new BinOp(left, right, BinaryOp.ADD);
        Assignment assignment = new Assignment(3, sum);

        assertSame(sum, left.getOwner());
        assertSame(sum, right.getOwner());
        assertSame(assignment, sum.getOwner());
        assertSame(assignment, assignment.var.getOwner());
    }

    @Test
    void testStatementInOneBlock() {
        Block a = new Block("A");
        Block b = new Block("B");
        Print print = new Print(new IntConst(1));
        a.addStatement(print);

        assertThrows(IllegalStateException.class, () -> b.addStatement(print));
        assertTrue(b.getContents().isEmpty());
        assertSame(a, print.getOwner());

        a.getContents().remove(print);
        assertNull(print.getOwner());
        b.addStatement(print);
        assertSame(b, print.getOwner());
    }

    @Test
    void testJumpInOneBlock() {
        Block a = new Block("A");
        Block b = new Block("B");
        Block target = new Block("T");
        JumpAlways jump = new JumpAlways(target);
        a.setTransition(jump);

        assertThrows(IllegalStateException.class, () -> b.setTransition(jump));
        assertTrue(b.isLastBlock());
        assertEquals(Collections.singleton(a), target.getPredecessors());
    }

    @Test
    void testReleaseBlockOnce() {
        Block a = new Block("A");
        Block b = new Block("B");
        Block c = new Block("C");
        Print first = new Print(new IntConst(1));
        Print second = new Print(new IntConst(2));
        a.getContents().addAll(Arrays.asList(first, second));
        JumpAlways jump = new JumpAlways(b);
        a.setTransition(jump);

        a.release();
        assertTrue(a.getContents().isEmpty());
        assertTrue(a.isLastBlock());
        assertNull(first.getOwner());
        assertNull(second.getOwner());
        assertNull(jump.getOwner());
        assertTrue(b.getPredecessors().isEmpty());

        // released statements can move, and a second release must not take them back
        c.addStatement(first);
        c.setTransition(jump);
        a.release();
        assertSame(c, first.getOwner());
        assertSame(c, jump.getOwner());
        assertEquals(Collections.singleton(c), b.getPredecessors());
    }

    @Test
    void testReleaseFunction() {
        Function f = new Function(1, VarType.UNIT, "f");
        Block entry = f.getEntry();
        Block exit = f.newBlock("exit");
        Print print = new Print(new IntConst(1));
        entry.addStatement(print);
        entry.link(exit);
        exit.addStatement(new Return(null));

        f.release();
        assertTrue(f.blocks.isEmpty());
        assertNull(print.getOwner());
        assertNull(entry.getNullable(CommonExts.OWNING_FUNCTION));
        assertTrue(exit.getPredecessors().isEmpty());
        assertTrue(exit.getContents().isEmpty());
    }

    @Test
    void testRelinkMovesCondition() {
        Block a = new Block("A");
        Block b = new Block("B");
        Block c = new Block("C");
        Block d = new Block("D");
        Variable condition = new Variable(9);
        JumpCond jump = new JumpCond(b, c, condition);
        a.link(jump);

        a.relink(c, d);
        JumpCond relinked = (JumpCond) a.getTransition();
        assertNotSame(jump, relinked);
        assertSame(condition, relinked.condition);
        assertSame(relinked, condition.getOwner());
        assertSame(a, relinked.getOwner());
        assertNull(jump.getOwner());
    }

    @Test
    void testReplaceYesCopiesCondition() {
        Block b = new Block("B");
        Block c = new Block("C");
        ReadRef condition = new ReadRef(4);
        JumpCond jump = new JumpCond(b, c, condition);

        JumpCond replaced = jump.replaceYes(c);
        assertNotSame(condition, replaced.condition);
        assertEquals(4, ((ReadRef) replaced.condition).refId);
        assertSame(jump, condition.getOwner());
        assertSame(replaced, replaced.condition.getOwner());
    }

    @Test
    void testPhiOperands() {
        Phi phi = new Phi(10);
        Variable one = new Variable(1);
        assertTrue(phi.addVar(one));
        assertFalse(phi.addVar(one));
        assertSame(phi, one.getOwner());

        assertTrue(phi.removeVar(one));
        assertNull(one.getOwner());
        assertTrue(phi.getVars().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> phi.getVars().add(new Variable(2)));
    }

    @Test
    void testCallParams() {
        IntConst arg = new IntConst(3);
        Call call = new Call(2, Arrays.asList(arg, new Variable(1)), Collections.singletonList(5L));
        assertSame(call, arg.getOwner());
        assertEquals(Collections.singletonList(5L), call.refParams);

        call.params.remove(0);
        assertNull(arg.getOwner());
        assertEquals(1, call.params.size());
    }
}
