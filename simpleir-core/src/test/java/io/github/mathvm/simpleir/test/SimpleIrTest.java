package io.github.mathvm.simpleir.test;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class SimpleIrTest {
    @Test
    void testStringPool() {
        SimpleIr ir = new SimpleIr();
        int hello = ir.intern("hello");
        int world = ir.intern("world");
        assertEquals(0, hello);
        assertEquals(1, world);
        assertEquals(hello, ir.intern("hello"));

        int again = ir.addString("hello");
        assertEquals(2, again);
        assertEquals(hello, ir.intern("hello"));
        assertEquals(Arrays.asList("hello", "world", "hello"), ir.getPool());
        assertThrows(UnsupportedOperationException.class, () -> ir.getPool().add("nope"));

        assertEquals("world", ir.pooledString(PtrConst.pooled(world)));
        assertThrows(IllegalArgumentException.class, () -> ir.pooledString(new PtrConst(world, false)));
        assertThrows(IndexOutOfBoundsException.class, () -> ir.pooledString(PtrConst.pooled(3)));
        assertThrows(IllegalArgumentException.class, () -> PtrConst.pooled(-1));
    }

    @Test
    void testFunctions() {
        SimpleIr ir = new SimpleIr();
        Function main = ir.addFunction(new Function(0, VarType.UNIT, "main"));
        Function sqrt = ir.addFunction(Function.nativeStub(1, 0x4000, VarType.DOUBLE, "sqrt"));

        assertSame(main, ir.getFunction(0));
        assertSame(sqrt, ir.getFunction(1));
        assertNull(ir.getFunction(2));
        assertSame(ir, main.getNullable(CommonExts.OWNING_PROGRAM));
        assertThrows(IllegalArgumentException.class,
                () -> ir.addFunction(new Function(1, VarType.UNIT, "clash")));
        assertEquals(2, ir.functions.size());

        Call call = new Call(1, Collections.singletonList(new DoubleConst(2.0)), Collections.emptyList());
        assertSame(sqrt, ir.getFunction(call.funId));

        ir.functions.remove(sqrt);
        assertNull(ir.getFunction(1));
        assertNull(sqrt.getNullable(CommonExts.OWNING_PROGRAM));
    }

    @Test
    void testCallFunIdRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new Call(Function.MAX_ID + 1, Collections.emptyList(), Collections.emptyList()));
        Call call = new Call(Function.MAX_ID, Collections.emptyList(), Arrays.asList(1L, 2L));
        assertEquals(Arrays.asList(1L, 2L), call.refParams);
    }

    @Test
    void testVarMeta() {
        SimpleIr ir = new SimpleIr();
        Function holder = ir.addFunction(new Function(0, VarType.UNIT, "holder"));
        VarMeta x = ir.addVarMeta(VarMeta.sourceVar(1, VarType.INT));
        VarMeta renamed = ir.addVarMeta(VarMeta.sourceVar(2, 1, VarType.INT));
        VarMeta tmp = ir.addVarMeta(VarMeta.temporary(3));
        VarMeta ref = ir.addVarMeta(VarMeta.reference(4, VarType.DOUBLE, holder, 16));

        assertEquals(VarMeta.Kind.SOURCE, x.getKind());
        assertEquals(1, renamed.originId);
        assertEquals(VarMeta.Kind.TEMPORARY, tmp.getKind());
        assertEquals(VarType.UNDEFINED, tmp.getType());
        assertEquals(VarMeta.Kind.REFERENCE, ref.getKind());
        assertFalse(ref.isSourceVar);
        assertSame(holder, ref.pointsTo);
        assertEquals(16, ref.offset);

        tmp.setType(VarType.PTR);
        assertEquals(VarType.PTR, ir.getVarMeta(3).getType());
        assertNull(ir.getVarMeta(5));
        assertEquals(Arrays.asList(x, renamed, tmp, ref), ir.getVarMeta());

        assertThrows(IllegalArgumentException.class, () -> ir.addVarMeta(VarMeta.temporary(1)));
        assertThrows(IllegalArgumentException.class,
                () -> VarMeta.reference(6, VarType.INT, null, VarMeta.MAX_OFFSET + 1));
        assertThrows(IllegalArgumentException.class, () -> VarMeta.reference(6, VarType.INT, null, -1));
        assertEquals(VarMeta.MAX_OFFSET, VarMeta.reference(6, VarType.INT, null, VarMeta.MAX_OFFSET).offset);

        assertEquals("$2: INT SOURCE from $1", renamed.toString());
        assertEquals("$4: DOUBLE REFERENCE -> holder+16", ref.toString());
    }

    @Test
    void testDisplay() {
        SimpleIr ir = new SimpleIr();
        int greeting = ir.intern("hi \"there\"\n");
        Function main = ir.addFunction(new Function(0, VarType.UNIT, new Block("entry"), "main"));
        ir.addFunction(Function.nativeStub(1, 0xff, VarType.UNIT, "puts"));
        ir.addVarMeta(VarMeta.temporary(1));
        main.getEntry().addStatement(new Assignment(1, PtrConst.pooled(greeting)));
        main.getEntry().addStatement(new Assignment(2, new Call(1,
                Collections.singletonList(new Variable(1)),
                Collections.singletonList(3L))));
        main.getEntry().addStatement(new Print(new ReadRef(3)));
        main.getEntry().addStatement(new Return(null));

        assertEquals("pool[0] = \"hi \\\"there\\\"\\n\"\n"
                + "var $1: UNDEFINED TEMPORARY\n"
                + "fn main#0() -> UNIT {\n"
                + "entry:\n"
                + "  $1 = \"hi \\\"there\\\"\\n\"\n"
                + "  $2 = call 1($1, &$3)\n"
                + "  print *$3\n"
                + "  return\n"
                + "}\n"
                + "native fn puts#1() -> UNIT @0xff\n", ir.toString());
        assertEquals("pool[0]", PtrConst.pooled(greeting).toString());
    }

    @Test
    void testRelease() {
        SimpleIr ir = new SimpleIr();
        Function main = ir.addFunction(new Function(0, VarType.UNIT, "main"));
        Block exit = main.newBlock("exit");
        main.getEntry().link(exit);
        ir.release();

        assertTrue(ir.functions.isEmpty());
        assertNull(ir.getFunction(0));
        assertNull(main.getNullable(CommonExts.OWNING_PROGRAM));
        assertTrue(exit.getPredecessors().isEmpty());
    }
}
