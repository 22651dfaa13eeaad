package org.dxworks.vbframe.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tree traversal helpers over structural children (trivia is not visited).
 */
public final class IrWalker {

    private IrWalker() {
        // utility class
    }

    /**
     * All nodes of the tree in pre-order, i.e. source order for this IR.
     */
    public static List<IrNode> preorder(IrNode root) {
        List<IrNode> out = new ArrayList<>();
        Deque<IrNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            IrNode node = stack.pop();
            out.add(node);
            List<IrNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    public static <T extends IrNode> List<T> collect(IrNode root, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (IrNode node : preorder(root)) {
            if (type.isInstance(node)) {
                out.add(type.cast(node));
            }
        }
        return out;
    }
}
