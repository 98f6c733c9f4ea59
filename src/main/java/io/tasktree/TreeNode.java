package io.tasktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 任务层级树中的节点。
 *
 * <p>协作式调度器用它记录逻辑任务之间的父子关系：
 * 向下传播停止/终止请求，并在子树完成后把已结束的中间节点从树中折叠掉（{@link #consume()}）。
 *
 * <p>所有权约束：
 * {@code parent} 是非拥有的回指引用，节点不会让父节点保持存活；
 * 父节点对子节点的持有只体现在其 {@link ChildList} 的成员关系上。
 * 子节点集合按需创建，由节点独占。
 *
 * <p>临时（transient）子节点不参与“是否完成”的判断：
 * 只剩临时子节点时，节点即视为 {@link #isFinished() finished}。
 *
 * <p>具体任务类型通过 {@link NodeBehavior} 注入 stop / stopped / backtrace 语义，
 * 而不是继承本类。
 *
 * <p>示例：
 * <pre>{@code
 * TreeNode root = TreeNode.create();
 * TreeNode worker = TreeNode.create(root);
 * TreeNode monitor = TreeNode.builder().withParent(root).withTransient(true).build();
 * root.stop();       // 只停止 worker
 * root.terminate();  // worker 和 monitor 都会收到终止
 * }</pre>
 *
 * <p>非线程安全：树的修改和遍历必须在同一执行上下文中完成。
 */
public final class TreeNode implements Linkable<TreeNode> {

    private static final Logger log = LoggerFactory.getLogger(TreeNode.class);

    private final Link<TreeNode> link;
    private final boolean transientNode;
    private final NodeBehavior behavior;

    private TreeNode parent;
    private ChildList children;
    private String annotation;
    private String objectName;

    private TreeNode(TreeNode parent, String annotation, boolean transientNode, NodeBehavior behavior) {
        this.link = new Link<TreeNode>();
        this.annotation = annotation;
        this.transientNode = transientNode;
        this.behavior = behavior;

        if (parent != null) {
            parent.addChild(this);
        }
    }

    /**
     * 创建独立的根节点。
     */
    public static TreeNode create() {
        return new TreeNode(null, null, false, NodeBehavior.DEFAULT);
    }

    /**
     * 创建节点并挂到 {@code parent} 下；{@code parent} 为 null 时等同于 {@link #create()}。
     */
    public static TreeNode create(TreeNode parent) {
        return new TreeNode(parent, null, false, NodeBehavior.DEFAULT);
    }

    /**
     * 以流式配置方式创建节点。
     *
     * <pre>{@code
     * TreeNode task = TreeNode.builder()
     *     .withParent(root)
     *     .withAnnotation("load-user")
     *     .withBehavior(taskBehavior)
     *     .build();
     * }</pre>
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Link<TreeNode> link() {
        return link;
    }

    /**
     * 沿父链向上找到最顶层祖先。
     */
    public TreeNode root() {
        TreeNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * 父节点；未挂载时为 null。
     */
    public TreeNode parent() {
        return parent;
    }

    /**
     * 子节点集合；从未有过子节点或已被 consume 时为 null。
     */
    public ChildList children() {
        return children;
    }

    public String annotation() {
        return annotation;
    }

    public NodeBehavior behavior() {
        return behavior;
    }

    /**
     * 是否存在至少一个直接子节点。
     */
    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public boolean isTransient() {
        return transientNode;
    }

    /**
     * 没有未完成的非临时子节点时返回 true，与临时子节点数量无关。
     */
    public boolean isFinished() {
        return children == null || children.isFinished();
    }

    /**
     * 设置诊断注解。
     */
    public void annotate(String annotation) {
        this.annotation = annotation;
    }

    /**
     * 在 {@code body} 执行期间临时替换注解，任何退出路径（包括异常）都会恢复原值。
     */
    public void annotate(String annotation, Runnable body) {
        Objects.requireNonNull(body, "body");
        String previous = installAnnotation(annotation);
        try {
            body.run();
        } finally {
            restoreAnnotation(previous);
        }
    }

    /**
     * {@link #annotate(String, Runnable)} 的有返回值版本，异常原样传播。
     */
    public <T> T annotate(String annotation, Callable<T> body) throws Exception {
        Objects.requireNonNull(body, "body");
        String previous = installAnnotation(annotation);
        try {
            return body.call();
        } finally {
            restoreAnnotation(previous);
        }
    }

    /**
     * 修改父节点。
     *
     * <p>与当前父节点相同时不做任何事；否则先从原父节点摘除，再挂到新父节点
     * （按需创建其子节点集合）。传入 null 只摘除不重新挂载。
     *
     * @throws HierarchyException 新父节点是自身或自身的后代
     */
    public TreeNode setParent(TreeNode parent) {
        if (this.parent == parent) {
            return this;
        }
        if (parent != null) {
            ensureNotAncestorOf(parent);
        }

        if (this.parent != null) {
            this.parent.deleteChild(this);
        }

        if (parent != null) {
            parent.addChild(this);
        }

        return this;
    }

    /**
     * 回收已完成的节点。
     *
     * <p>节点有父节点且 {@link #isFinished()} 时：从父节点摘除；
     * 自身剩余子节点中已完成的直接丢弃，未完成的提升到原父节点下；
     * 然后丢弃自身子节点集合，并继续对原父节点执行同样的判断，
     * 使一整条已完成的祖先链一次折叠。其余情况为空操作。
     */
    public void consume() {
        TreeNode node = this;
        TreeNode parent = node.parent;

        while (parent != null && node.isFinished()) {
            parent.deleteChild(node);

            ChildList own = node.children;
            if (own != null) {
                for (TreeNode child : own) {
                    node.deleteChild(child);
                    if (!child.isFinished()) {
                        parent.addChild(child);
                        log.debug("Promoted {} to {}", child, parent);
                    }
                }
                node.children = null;
            }

            log.debug("Consumed {} from {}", node, parent);
            node = parent;
            parent = node.parent;
        }
    }

    /**
     * 从自身开始做深度优先先序遍历，{@code depth} 为相对自身的层级。
     *
     * <p>使用显式栈，不依赖调用栈深度；访问者可以修改树结构，
     * 遵循 {@link IntrusiveList} 的遍历容忍语义。
     */
    public void traverse(NodeVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor");
        visitor.visit(this, 0);

        Deque<Iterator<TreeNode>> stack = new ArrayDeque<Iterator<TreeNode>>();
        pushChildren(stack, this);

        while (!stack.isEmpty()) {
            Iterator<TreeNode> cursor = stack.peek();
            if (!cursor.hasNext()) {
                stack.pop();
                continue;
            }
            TreeNode child = cursor.next();
            visitor.visit(child, stack.size());
            pushChildren(stack, child);
        }
    }

    /**
     * 立即终止整棵子树。
     *
     * <p>先对自身执行 {@code stop(false)}，再对每个直接子节点（包括临时子节点）递归终止，
     * 即使中间节点的 stop 是空操作或被延后，整棵子树也都会收到终止信号。
     */
    public void terminate() {
        traverse(new NodeVisitor() {
            @Override
            public void visit(TreeNode node, int depth) {
                log.trace("Terminating {} at depth {}", node, depth);
                node.stop(false);
            }
        });
    }

    /**
     * 等同于 {@code stop(false)}。
     */
    public void stop() {
        stop(false);
    }

    /**
     * 请求停止本节点，实际语义由 {@link NodeBehavior#stop(TreeNode, boolean)} 决定；
     * 默认只停止非临时子节点。
     *
     * @param later 是否允许延后到之后某个时间点再停止
     */
    public void stop(boolean later) {
        behavior.stop(this, later);
    }

    /**
     * 对每个非临时直接子节点调用 {@link #stop(boolean)}，临时子节点保持不变。
     */
    public void stopChildren(boolean later) {
        ChildList current = children;
        if (current == null) {
            return;
        }
        for (TreeNode child : current) {
            if (!child.isTransient()) {
                child.stop(later);
            }
        }
    }

    /**
     * 默认定义为“没有子节点集合”，具体任务类型通过 {@link NodeBehavior} 覆盖。
     */
    public boolean isStopped() {
        return behavior.isStopped(this);
    }

    /**
     * 完整的调用栈信息；不可用时为 null。
     */
    public List<String> backtrace() {
        return backtrace(0, Integer.MAX_VALUE);
    }

    /**
     * 从 {@code from} 开始最多 {@code length} 帧；不可用时为 null。
     */
    public List<String> backtrace(int from, int length) {
        if (from < 0) {
            throw new IllegalArgumentException("from must be >= 0");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        return behavior.backtrace(this, from, length);
    }

    /**
     * 稳定的节点标识（类型 + 身份哈希，临时节点带 {@code transient} 标记），
     * 后接注解；没有注解时接调用栈第一行。
     */
    public String description() {
        if (objectName == null) {
            objectName = behavior.typeName()
                + ":0x" + String.format("%08x", System.identityHashCode(this))
                + (transientNode ? " transient" : "");
        }

        if (annotation != null) {
            return objectName + " " + annotation;
        }
        List<String> frames = backtrace(0, 1);
        if (frames != null && !frames.isEmpty()) {
            return objectName + " " + frames.get(0);
        }
        return objectName;
    }

    /**
     * 把以本节点为根的层级逐行输出到 {@code out}，包含调用栈。
     */
    public void printHierarchy(Appendable out) {
        printHierarchy(out, true);
    }

    public void printHierarchy(Appendable out, boolean withBacktrace) {
        HierarchyPrinter.create().withBacktrace(withBacktrace).print(this, out);
    }

    @Override
    public String toString() {
        return "<" + description() + ">";
    }

    private void addChild(TreeNode child) {
        if (children == null) {
            children = new ChildList();
        }
        children.insert(child);
        child.parent = this;
    }

    private void deleteChild(TreeNode child) {
        children.delete(child);
        child.parent = null;
    }

    private void ensureNotAncestorOf(TreeNode candidate) {
        for (TreeNode node = candidate; node != null; node = node.parent) {
            if (node == this) {
                throw new HierarchyException("Cannot attach " + this + " under itself or one of its descendants");
            }
        }
    }

    private String installAnnotation(String annotation) {
        String previous = this.annotation;
        this.annotation = annotation;
        return previous;
    }

    private void restoreAnnotation(String previous) {
        this.annotation = previous;
    }

    private static void pushChildren(Deque<Iterator<TreeNode>> stack, TreeNode node) {
        ChildList current = node.children;
        if (current != null) {
            stack.push(current.iterator());
        }
    }

    /**
     * {@link TreeNode} 的构造参数；{@code transient} 和 behavior 在节点生命周期内不可变。
     */
    public static final class Builder {

        private TreeNode parent;
        private String annotation;
        private boolean transientNode;
        private NodeBehavior behavior = NodeBehavior.DEFAULT;

        private Builder() {
        }

        public Builder withParent(TreeNode parent) {
            this.parent = parent;
            return this;
        }

        public Builder withAnnotation(String annotation) {
            this.annotation = annotation;
            return this;
        }

        public Builder withTransient(boolean transientNode) {
            this.transientNode = transientNode;
            return this;
        }

        public Builder withBehavior(NodeBehavior behavior) {
            this.behavior = Objects.requireNonNull(behavior, "behavior");
            return this;
        }

        public TreeNode build() {
            return new TreeNode(parent, annotation, transientNode, behavior);
        }
    }
}
