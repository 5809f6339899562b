package io.github.mathvm.simpleir.passes.misc;

import io.github.mathvm.simpleir.ir.Block;
import io.github.mathvm.simpleir.ir.Function;
import io.github.mathvm.simpleir.ir.SimpleIr;
import io.github.mathvm.simpleir.passes.InPlaceIRPass;

/**
 * Lifts passes over smaller parts of the IR into passes over bigger parts.
 */
public class ForPass {
    /**
     * Lift a function pass to run over every non-native function of a program.
     *
     * @param pass The function pass.
     * @return The program pass.
     */
    public static InPlaceIRPass<SimpleIr> liftFunctions(InPlaceIRPass<Function> pass) {
        return new InPlaceIRPass<SimpleIr>() {
            @Override
            public void runInPlace(SimpleIr program) {
                for (Function function : program.functions) {
                    if (function.isNative()) continue;
                    pass.runInPlace(function);
                }
            }

            @Override
            public String toString() {
                return "for functions: " + pass;
            }
        };
    }

    /**
     * Lift a block pass to run over every reachable block of a function.
     * <p>
     * The reachable blocks are collected before the pass runs, so blocks the
     * pass links in are not visited.
     *
     * @param pass The block pass.
     * @return The function pass.
     */
    public static InPlaceIRPass<Function> liftBlocks(InPlaceIRPass<Block> pass) {
        return new InPlaceIRPass<Function>() {
            @Override
            public void runInPlace(Function function) {
                for (Block block : function.reachableBlocks()) {
                    pass.runInPlace(block);
                }
            }

            @Override
            public String toString() {
                return "for blocks: " + pass;
            }
        };
    }
}
