package fk.treestats.common.tree;

import com.google.common.base.Preconditions;
import fk.treestats.common.collections.Stack;

/**
 * Builds a new tree out of an existing one, bottom up, while {@link TreeTraverser} walks the source in post order.
 * <p>
 * Built children are collected on a stack of {@link Frame}s, one frame per parent whose children are being visited.
 * A frame is pushed the first time a child of a new parent shows up. When the last sibling has been visited the frame
 * is not popped right away: the next visited node is that parent, and only then is the frame popped and handed to
 * {@link #newNode} so the parent can be built with its children.
 * <p>
 * Implementations are single use per {@link #build} call and hold no state between calls.
 *
 * @param <T> source node type
 * @param <R> built node type
 */
public abstract class TreeBuilder<T extends TreeNode<T>, R> {

    /**
     * @return the built root, or null if the root itself was not retained
     */
    public R build(T root) {
        Preconditions.checkNotNull(root, "root is required");

        Run run = new Run();
        TreeTraverser.traversePost(root, run);

        Preconditions.checkState(run.frames.size() == 1, "unbalanced frames after traversal: %s", run.frames.size());
        Frame<T, R> rootFrame = run.frames.top();
        return rootFrame.getChildren().isEmpty() ? null : rootFrame.getChildren().get(0);
    }

    /**
     * Creates the built counterpart of {@code node}.
     *
     * @param node     source node
     * @param parent   source parent, null for the root
     * @param children frame holding the already built children of {@code node}; empty for leaves
     */
    protected abstract R newNode(T node, T parent, Frame<T, R> children);

    /**
     * Whether the built node for {@code node} gets attached to its parent. Rejected nodes are recorded in the parent's
     * frame as eliminated.
     */
    protected boolean retain(T node, T parent) {
        return true;
    }

    private class Run implements TreeTraverser.Visitor<T> {

        private final Stack<Frame<T, R>> frames = new Stack<>();
        private boolean pop = false;

        @Override
        public boolean visit(T node, T parent, boolean last) {
            Frame<T, R> completed;
            if(pop) {
                // post order: this node is the parent of the frame on top
                pop = false;
                completed = frames.pop();
                Preconditions.checkState(completed.getParent() == node, "frame popped for a node that is not its parent");
            }
            else {
                completed = new Frame<>(node);
            }

            R built = newNode(node, parent, completed);

            if(frames.isEmpty() || frames.top().getParent() != parent) {
                frames.push(new Frame<>(parent));
            }

            Frame<T, R> frame = frames.top();
            if(retain(node, parent)) {
                frame.add(built);
            }
            else {
                frame.eliminate(node);
            }

            if(last) {
                pop = true;
            }
            return true;
        }
    }
}
