package io.github.mathvm.simpleir.util;

import io.github.mathvm.simpleir.ir.Block;
import io.github.mathvm.simpleir.ir.Function;

import java.util.*;

/**
 * Depth-first traversal of a graph from a root, visiting each node once.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    final T root;
    final F<T, ? extends List<T>> getChildren;

    public GraphWalker(T root, F<T, ? extends List<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Walk the blocks reachable from {@code root}, following transitions.
     *
     * @param root The first block.
     * @return The walker.
     */
    public static GraphWalker<Block> blockWalker(Block root) {
        return new GraphWalker<>(root, Block::getSuccessors);
    }

    public static GraphWalker<Block> blockWalker(Function func) {
        return blockWalker(func.getEntry());
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Nodes before their children; the first child's subtree comes first.
     *
     * @return The order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Nodes after all the children they discovered. Reversed, this is
     * a reverse post-order, where each block comes before its successors
     * except along back edges.
     *
     * @return The order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            while (!stack.isEmpty() && seen.contains(stack.peek())) {
                stack.pop();
            }
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (!hasNext()) throw new NoSuchElementException();
            T top = stack.pop();
            seen.add(top);
            List<T> children = getChildren.apply(top);
            for (ListIterator<T> li = children.listIterator(children.size()); li.hasPrevious(); ) {
                T child = li.previous();
                if (!seen.contains(child)) {
                    stack.push(child);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        private class Frame {
            final T node;
            final Iterator<T> children;

            Frame(T node) {
                this.node = node;
                this.children = getChildren.apply(node).iterator();
            }
        }

        {
            seen.add(root);
            stack.push(new Frame(root));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Frame top = stack.peek();
                if (top.children.hasNext()) {
                    T child = top.children.next();
                    if (seen.add(child)) {
                        stack.push(new Frame(child));
                    }
                } else {
                    stack.pop();
                    return top.node;
                }
            }
        }
    }
}
