package io.github.mathvm.simpleir.passes.meta;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ir.Block;
import io.github.mathvm.simpleir.ir.Function;
import io.github.mathvm.simpleir.ir.Jump;
import io.github.mathvm.simpleir.ir.Statement;
import io.github.mathvm.simpleir.passes.InPlaceIRPass;
import io.github.mathvm.simpleir.util.GraphWalker;

import java.util.Collections;
import java.util.List;

/**
 * Computes {@link CommonExts#STATEMENT_NUM} for every statement and transition
 * in the reachable blocks of a function.
 * <p>
 * Blocks are numbered in reverse post-order, so along any path without back edges
 * numbers increase; within a block statements are numbered in order, then the
 * transition. Live ranges for register allocation are intervals of these numbers.
 * The total is attached to the function as {@link CommonExts#STATEMENT_COUNT}.
 */
public class NumberStatements implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final NumberStatements INSTANCE = new NumberStatements();

    @Override
    public void runInPlace(Function function) {
        List<Block> order = GraphWalker.blockWalker(function).postOrder().toList();
        Collections.reverse(order);
        int num = 0;
        for (Block block : order) {
            for (Statement statement : block.getContents()) {
                statement.attachExt(CommonExts.STATEMENT_NUM, num++);
            }
            Jump transition = block.getTransition();
            if (transition != null) {
                transition.attachExt(CommonExts.STATEMENT_NUM, num++);
            }
        }
        function.attachExt(CommonExts.STATEMENT_COUNT, num);
    }

    @Override
    public String toString() {
        return "NumberStatements";
    }
}
