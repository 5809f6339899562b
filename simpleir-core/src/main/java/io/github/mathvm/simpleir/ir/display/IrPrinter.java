package io.github.mathvm.simpleir.ir.display;

import io.github.mathvm.simpleir.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;

/**
 * Renders IR as text, for debugging and tests.
 * <p>
 * Variables print as {@code $id}, references as {@code *$id}, and jumps name their
 * target blocks. If a program is given, pooled strings print as their quoted
 * contents, otherwise as {@code pool[idx]}.
 */
public class IrPrinter implements IrVoidVisitor {
    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private final @Nullable SimpleIr program;

    public IrPrinter(@Nullable SimpleIr program) {
        this.program = program;
    }

    /**
     * Render a single node, which may be a whole block or function.
     *
     * @param element The node.
     * @return The text.
     */
    public static String print(IrElement element) {
        IrPrinter printer = new IrPrinter(null);
        element.accept(printer);
        return printer.toString();
    }

    /**
     * Render a whole program: its string pool, variables, then functions.
     *
     * @param program The program.
     * @return The text.
     */
    public static String print(SimpleIr program) {
        IrPrinter printer = new IrPrinter(program);
        StringBuilder sb = printer.sb;
        int i = 0;
        for (String s : program.getPool()) {
            sb.append("pool[").append(i++).append("] = ");
            quote(sb, s);
            sb.append('\n');
        }
        for (VarMeta meta : program.getVarMeta()) {
            sb.append("var ").append(meta).append('\n');
        }
        for (Function function : program.functions) {
            function.accept(printer);
            sb.append('\n');
        }
        return printer.toString();
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
    }

    private void var(long id) {
        sb.append('$').append(id);
    }

    private void list(Iterable<? extends IrElement> elements) {
        Iterator<? extends IrElement> it = elements.iterator();
        while (it.hasNext()) {
            it.next().accept(this);
            if (it.hasNext()) sb.append(", ");
        }
    }

    @Override
    public void visit(BinOp binOp) {
        binOp.left.accept(this);
        sb.append(' ').append(binOp.op.mnemonic).append(' ');
        binOp.right.accept(this);
    }

    @Override
    public void visit(UnOp unOp) {
        sb.append(unOp.op.mnemonic);
        if (unOp.op.isCast()) sb.append(' ');
        unOp.operand.accept(this);
    }

    @Override
    public void visit(Variable variable) {
        var(variable.id);
    }

    @Override
    public void visit(Return ret) {
        sb.append("return");
        if (ret.atom != null) {
            sb.append(' ');
            ret.atom.accept(this);
        }
    }

    @Override
    public void visit(Phi phi) {
        phi.var.accept(this);
        sb.append(" = phi(");
        list(phi.getVars());
        sb.append(')');
    }

    @Override
    public void visit(IntConst intConst) {
        sb.append(intConst.value);
    }

    @Override
    public void visit(DoubleConst doubleConst) {
        sb.append(doubleConst.value);
    }

    @Override
    public void visit(PtrConst ptrConst) {
        if (!ptrConst.isPooledString) {
            sb.append("0x").append(Long.toHexString(ptrConst.value));
        } else if (program != null
                && ptrConst.value >= 0
                && ptrConst.value < program.getPool().size()) {
            quote(sb, program.pooledString(ptrConst));
        } else {
            sb.append("pool[").append(Long.toUnsignedString(ptrConst.value)).append(']');
        }
    }

    @Override
    public void visit(Block block) {
        sb.append(block.name).append(':');
        if (!block.getPredecessors().isEmpty()) {
            sb.append(" ; preds:");
            for (Block pred : block.getPredecessors()) {
                sb.append(' ').append(pred.name);
            }
        }
        sb.append('\n');
        for (Statement statement : block.getContents()) {
            sb.append(INDENT);
            statement.accept(this);
            sb.append('\n');
        }
        Jump transition = block.getTransition();
        if (transition != null) {
            sb.append(INDENT);
            transition.accept(this);
            sb.append('\n');
        }
    }

    @Override
    public void visit(Assignment assignment) {
        assignment.var.accept(this);
        sb.append(" = ");
        assignment.value.accept(this);
    }

    @Override
    public void visit(Call call) {
        sb.append("call ").append(call.funId).append('(');
        list(call.params);
        for (int i = 0; i < call.refParams.size(); i++) {
            sb.append(i == 0 && call.params.isEmpty() ? "&" : ", &");
            var(call.refParams.get(i));
        }
        sb.append(')');
    }

    @Override
    public void visit(Print print) {
        sb.append("print ");
        print.atom.accept(this);
    }

    @Override
    public void visit(Function function) {
        if (function.isNative()) {
            sb.append("native ");
        }
        sb.append("fn ").append(function.name).append('#').append(function.id).append('(');
        for (int i = 0; i < function.arguments(); i++) {
            if (i != 0) sb.append(", ");
            if (i >= function.parametersIds.size()) sb.append('&');
            var(function.argument(i));
        }
        sb.append(") -> ").append(function.getReturnType());
        if (function.isNative()) {
            sb.append(" @0x").append(Long.toHexString(function.getNativeAddress()));
            return;
        }
        sb.append(" {\n");
        if (!function.memoryCells.isEmpty()) {
            sb.append(INDENT).append("cells:");
            for (Long cell : function.memoryCells) {
                sb.append(' ');
                var(cell);
            }
            sb.append('\n');
        }
        for (Block block : function.reachableBlocks()) {
            block.accept(this);
        }
        sb.append("}");
    }

    @Override
    public void visit(JumpAlways jumpAlways) {
        sb.append("jump ").append(jumpAlways.destination.name);
    }

    @Override
    public void visit(JumpCond jumpCond) {
        sb.append("if ");
        jumpCond.condition.accept(this);
        sb.append(" then ").append(jumpCond.yes.name).append(" else ").append(jumpCond.no.name);
    }

    @Override
    public void visit(WriteRef writeRef) {
        sb.append('*');
        var(writeRef.refId);
        sb.append(" = ");
        writeRef.atom.accept(this);
    }

    @Override
    public void visit(ReadRef readRef) {
        sb.append('*');
        var(readRef.refId);
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
