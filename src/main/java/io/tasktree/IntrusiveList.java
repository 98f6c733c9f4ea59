package io.tasktree;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 侵入式双向链表：链接指针保存在成员对象自身的 {@link Link} 上。
 *
 * <p>插入（尾部追加）与按身份删除都是 O(1)，不分配包装节点。
 * 每个成员同一时刻只能属于一个链表，{@link Link#owner()} 用于 O(1) 校验。
 * 修改操作仅对本包开放：{@link TreeNode} 的子节点集合必须与其 parent 回指同步维护，
 * 包外只能读取和遍历。
 *
 * <p>遍历语义：
 * 游标从链表头开始，每次产出一个成员后，只有当该成员仍是游标当前位置的直接后继时，
 * 游标才前移到它；判断发生在请求下一个成员（{@link Cursor#next()}）时。
 * 因此遍历体内可以删除当前成员或任意尚未访问的成员，既不会跳过未访问成员，也不会重复访问。
 *
 * <p>示例：
 * <pre>{@code
 * for (TreeNode child : node.children()) {
 *     if (child.isFinished()) {
 *         child.setParent(null);
 *     }
 * }
 * }</pre>
 *
 * <p>非线程安全，只能在单一执行上下文中修改和遍历。
 */
public class IntrusiveList<T extends Linkable<T>> implements Iterable<T> {

    private T first;
    private T last;
    private int size;

    /**
     * 追加到链表尾部。
     *
     * @throws ListMembershipException 成员已经属于某个链表
     */
    IntrusiveList<T> insert(T item) {
        Objects.requireNonNull(item, "item");
        Link<T> link = item.link();
        if (link.owner() != null) {
            throw new ListMembershipException("Item already belongs to a list: " + item);
        }

        if (first == null) {
            first = item;
            last = item;
            link.prev(null);
            link.next(null);
        } else {
            last.link().next(item);
            link.prev(last);
            link.next(null);
            last = item;
        }

        link.owner(this);
        size++;
        return this;
    }

    /**
     * 从任意位置（唯一/首/尾/中间）摘除成员，并清空其链接槽。
     *
     * @throws ListMembershipException 成员不属于当前链表
     */
    IntrusiveList<T> delete(T item) {
        Objects.requireNonNull(item, "item");
        Link<T> link = item.link();
        if (link.owner() != this) {
            throw new ListMembershipException("Item is not a member of this list: " + item);
        }

        T prev = link.prev();
        T next = link.next();

        if (prev == null) {
            first = next;
        } else {
            prev.link().next(next);
        }

        if (next == null) {
            last = prev;
        } else {
            next.link().prev(prev);
        }

        link.clear();
        size--;
        return this;
    }

    /**
     * 按身份做线性查找。
     */
    public boolean contains(T needle) {
        for (T item : this) {
            if (item == needle) {
                return true;
            }
        }
        return false;
    }

    public T first() {
        return first;
    }

    public T last() {
        return last;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return first == null;
    }

    /**
     * 每次调用都从当前首成员重新开始遍历。
     */
    @Override
    public Iterator<T> iterator() {
        return cursor();
    }

    public Cursor<T> cursor() {
        return new Cursor<T>(this);
    }

    /**
     * 容忍修改的前向游标。
     *
     * <p>{@code position == null} 表示链表头；{@code yielded} 是上一次产出的成员。
     * {@link #hasNext()} 只读，不移动游标；前移判断与取下一个成员都在 {@link #next()} 中进行。
     */
    public static final class Cursor<T extends Linkable<T>> implements Iterator<T> {

        private final IntrusiveList<T> list;
        private T position;
        private T yielded;

        private Cursor(IntrusiveList<T> list) {
            this.list = list;
        }

        @Override
        public boolean hasNext() {
            return upcoming() != null;
        }

        @Override
        public T next() {
            if (yielded != null && successor() == yielded) {
                position = yielded;
            }
            T node = successor();
            if (node == null) {
                throw new NoSuchElementException();
            }
            yielded = node;
            return node;
        }

        /**
         * 不支持通过游标删除；子节点应通过 {@link TreeNode#setParent(TreeNode)} 摘除，
         * 以保持 parent 回指一致。
         */
        @Override
        public void remove() {
            throw new UnsupportedOperationException("remove");
        }

        private T upcoming() {
            T candidate = successor();
            if (yielded != null && candidate == yielded) {
                return yielded.link().next();
            }
            return candidate;
        }

        private T successor() {
            return position == null ? list.first : position.link().next();
        }
    }
}
