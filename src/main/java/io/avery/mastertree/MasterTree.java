package io.avery.mastertree;

import java.util.*;

/**
 * A sequence with expected-logarithmic insertion, removal, split, merge, reversal, range products, and range lazy
 * updates. What a range product computes and what a lazy update does are defined by a {@link MasterManager}.
 *
 * <p>{@link #fork()} is O(1): the copy shares every node with this tree, and each later modification of either tree
 * copies only the nodes it writes to.
 *
 * <p>This class is not thread-safe. Reads flush pending lazy state into the nodes they visit, so even concurrent
 * reads of a tree, or of two trees that share nodes, need external synchronization.
 *
 * @param <T> the type of elements
 * @param <I> the type of per-subtree aggregate and pending lazy state
 * @param <P> the type of range products
 * @param <L> the type of lazy operators
 */
public class MasterTree<T, I, P, L> extends AbstractList<T> implements ForkJoinList<T>, RandomAccess {
    /* Implements a treap without priorities: balance points are picked by weighted coin flips, so that merge keeps
     * the left root with probability llen/(llen+rlen), and insert makes the new element the root with probability
     * 1/(len+1). Either way, every element is equally likely to be the root of its subtree, and expected depth is
     * logarithmic.
     *
     * Notable features of this variant:
     *  1. Nodes carry an explicit count of their holders (parent nodes or tree roots). A node is owned, and may be
     *     mutated in place, iff its count is 1. Otherwise, the writer copies the node (sharing the children, and
     *     bumping their counts) and releases its hold on the original. Holders that are dropped without notice (eg a
     *     forgotten fork) are never subtracted, which can only cause an unnecessary copy, never a missing one.
     *  2. Nodes do not store their subtree size. Each node stores the size of its left subtree (idx), and every
     *     operation threads the current subtree size down through the recursion.
     *  3. A node's info always describes its current logical content. Reversing a subtree applies the manager's
     *     reverse to the subtree root's info immediately, and only defers the swapping of children. Pending lazy
     *     operators live inside infos, and are pushed down by the manager's propagate.
     *  4. Flushing a node (setup) does not change what the node represents, so it is done in place even on nodes
     *     shared with other trees. Only the children it writes into are copied if they are shared.
     */

    private final MasterManager<T, I, P, L> manager;
    private final Flush flush = new Flush();
    private XorShift rng;
    private Node<T, I> root;
    private int size;

    /**
     * Creates an empty tree with the default seed.
     */
    public MasterTree(MasterManager<T, I, P, L> manager) {
        this(manager, XorShift.DEFAULT_SEED);
    }

    /**
     * Creates an empty tree whose balance decisions are drawn from a generator with the given seed.
     */
    public MasterTree(MasterManager<T, I, P, L> manager, long seed) {
        this.manager = Objects.requireNonNull(manager);
        this.rng = new XorShift(seed);
    }

    /**
     * Creates a tree holding the elements of the given collection, in iteration order.
     */
    public MasterTree(MasterManager<T, I, P, L> manager, Collection<? extends T> c) {
        this(manager);
        Object[] arr = c.toArray();
        root = build(arr, 0, arr.length);
        size = arr.length;
    }

    /**
     * Creates a tree holding the same elements as {@code toCopy}, sharing all of its nodes. Either tree copies a
     * shared node before writing to it.
     */
    protected MasterTree(MasterTree<T, I, P, L> toCopy) {
        manager = toCopy.manager;
        rng = toCopy.rng.copy();
        if ((root = toCopy.root) != null) {
            root.refs++;
        }
        size = toCopy.size;
    }

    private MasterTree(MasterManager<T, I, P, L> manager, XorShift rng, Node<T, I> root, int size) {
        this.manager = manager;
        this.rng = rng;
        this.root = root;
        this.size = size;
    }

    /**
     * Returns the manager that defines this tree's products and lazy operators.
     */
    public MasterManager<T, I, P, L> manager() {
        return manager;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public T get(int index) {
        Objects.checkIndex(index, size);
        int len = size;
        Node<T, I> node = setup(root, len);
        for (;;) {
            int idx = node.idx;
            if (index < idx) {
                len = idx;
                node = setup(node.left, len);
            }
            else if (index == idx) {
                return node.value;
            }
            else {
                index -= idx + 1;
                len -= idx + 1;
                node = setup(node.right, len);
            }
        }
    }

    @Override
    public T set(int index, T element) {
        Objects.checkIndex(index, size);
        Object[] old = new Object[1];
        root = setRec(root, size, index, element, old);
        @SuppressWarnings("unchecked")
        T oldValue = (T) old[0];
        return oldValue;
    }

    @Override
    public boolean add(T e) {
        add(size, e);
        return true;
    }

    @Override
    public void add(int index, T element) {
        rangeCheckForAdd(index);
        checkNewSize(size, 1);
        modCount++;
        root = insertRec(root, size, index, element);
        size++;
    }

    @Override
    public boolean addAll(Collection<? extends T> c) {
        return addAll(size, c);
    }

    @Override
    public boolean addAll(int index, Collection<? extends T> c) {
        rangeCheckForAdd(index);
        Object[] arr = c.toArray();
        if (arr.length == 0) {
            return false;
        }
        checkNewSize(size, arr.length);
        spliceIn(index, build(arr, 0, arr.length), arr.length);
        return true;
    }

    @Override
    public T remove(int index) {
        Objects.checkIndex(index, size);
        modCount++;
        Object[] removed = new Object[1];
        root = removeRec(root, size, index, removed);
        size--;
        @SuppressWarnings("unchecked")
        T old = (T) removed[0];
        return old;
    }

    @Override
    public void clear() {
        modCount++;
        root = null;
        size = 0;
    }

    @Override
    public MasterTree<T, I, P, L> fork() {
        return new MasterTree<>(this);
    }

    /**
     * Like {@link #join(int, Collection)}, but always appends. If {@code c} is a {@code MasterTree} with an equal
     * manager, it is forked and adjoined in expected O(log(n)) time.
     */
    @Override
    public boolean join(Collection<? extends T> c) {
        return join(size, c);
    }

    @Override
    public boolean join(int index, Collection<? extends T> c) {
        rangeCheckForAdd(index);
        MasterTree<T, I, P, L> other = compatibleTree(c);
        if (other == null) {
            return addAll(index, c);
        }
        int otherSize = other.size;
        if (otherSize == 0) {
            return false;
        }
        checkNewSize(size, otherSize);
        Node<T, I> otherRoot = other.root;
        otherRoot.refs++;
        spliceIn(index, otherRoot, otherSize);
        return true;
    }

    /**
     * Moves every element of {@code rhs} to the end of this tree, leaving {@code rhs} empty. Unlike
     * {@link #join(Collection)}, this does not share nodes between the two trees.
     *
     * @param rhs the tree whose elements to append
     * @return this tree
     * @throws IllegalArgumentException if {@code rhs} is this tree, or uses a different manager
     * @throws OutOfMemoryError if the combined size would exceed {@code Integer.MAX_VALUE}
     */
    public MasterTree<T, I, P, L> merge(MasterTree<T, I, P, L> rhs) {
        if (rhs == this) {
            throw new IllegalArgumentException("Cannot merge a tree into itself");
        }
        if (!manager.equals(rhs.manager)) {
            throw new IllegalArgumentException("Cannot merge trees with different managers");
        }
        checkNewSize(size, rhs.size);
        modCount++;
        rhs.modCount++;
        root = mergeRoots(root, size, rhs.root, rhs.size);
        size += rhs.size;
        rhs.root = null;
        rhs.size = 0;
        return this;
    }

    @Override
    public MasterTree<T, I, P, L> split(int index) {
        rangeCheckForAdd(index);
        modCount++;
        Node<T, I>[] nodes = newPair();
        splitRec(root, size, index, nodes);
        MasterTree<T, I, P, L> right = new MasterTree<>(manager, rng.fork(), nodes[1], size - index);
        root = nodes[0];
        size = index;
        return right;
    }

    /**
     * Reverses this tree in O(1). The children of each node are swapped the next time the node is visited.
     */
    @Override
    public void reverse() {
        if (root == null) {
            return;
        }
        modCount++;
        root = toggleReversed(root, size);
    }

    /**
     * Reverses the elements in {@code [fromIndex, toIndex)}.
     */
    public void reverse(int fromIndex, int toIndex) {
        Objects.checkFromToIndex(fromIndex, toIndex, size);
        if (toIndex - fromIndex < 2) {
            return;
        }
        modCount++;
        Node<T, I>[] nodes = newPair();
        splitRec(root, size, toIndex, nodes);
        Node<T, I> suffix = nodes[1];
        splitRec(nodes[0], toIndex, fromIndex, nodes);
        Node<T, I> middle = toggleReversed(nodes[1], toIndex - fromIndex);
        root = mergeRoots(mergeRoots(nodes[0], fromIndex, middle, toIndex - fromIndex), toIndex, suffix, size - toIndex);
    }

    /**
     * Returns the product of all elements, or the identity if this tree is empty.
     */
    public P prod() {
        return root == null ? manager.identity() : manager.infoToProd(root.info);
    }

    /**
     * Returns the product of the elements in {@code [fromIndex, toIndex)}, or the identity if the range is empty.
     *
     * @throws IndexOutOfBoundsException if {@code fromIndex < 0 || fromIndex > toIndex || toIndex > size()}
     */
    public P prod(int fromIndex, int toIndex) {
        Objects.checkFromToIndex(fromIndex, toIndex, size);
        if (fromIndex == toIndex) {
            return manager.identity();
        }
        Node<T, I> node = root;
        int len = size;
        for (;;) {
            if (fromIndex == 0 && toIndex == len) {
                return manager.infoToProd(node.info);
            }
            if (fromIndex == 0) {
                return prodPrefix(node, len, toIndex);
            }
            if (toIndex == len) {
                return prodSuffix(node, len, fromIndex);
            }
            setup(node, len);
            int idx = node.idx;
            if (toIndex <= idx) {
                node = node.left;
                len = idx;
            }
            else if (fromIndex > idx) {
                node = node.right;
                fromIndex -= idx + 1;
                toIndex -= idx + 1;
                len -= idx + 1;
            }
            else {
                // fromIndex <= idx < toIndex: the range straddles this node
                P leftProd = prodSuffix(node.left, idx, fromIndex);
                P rightProd = prodPrefix(node.right, len - 1 - idx, toIndex - 1 - idx);
                return manager.op(manager.op(leftProd, manager.valueToProd(node.value)), rightProd);
            }
        }
    }

    /**
     * Returns the product of the elements in {@code range}, or the identity if the range is empty.
     *
     * @throws IndexOutOfBoundsException if {@code range} does not lie within {@code [0, size()]}
     */
    public P prod(Range range) {
        int[] bounds = range.resolve(size);
        return prod(bounds[0], bounds[1]);
    }

    /**
     * Applies {@code lazy} to every element.
     */
    public void apply(L lazy) {
        apply(0, size, lazy);
    }

    /**
     * Applies {@code lazy} to every element in {@code [fromIndex, toIndex)}.
     *
     * @throws IndexOutOfBoundsException if {@code fromIndex < 0 || fromIndex > toIndex || toIndex > size()}
     */
    public void apply(int fromIndex, int toIndex, L lazy) {
        Objects.checkFromToIndex(fromIndex, toIndex, size);
        Objects.requireNonNull(lazy);
        if (fromIndex == toIndex) {
            return;
        }
        modCount++;
        root = applyRec(root, size, fromIndex, toIndex, lazy);
    }

    /**
     * Applies {@code lazy} to every element in {@code range}.
     *
     * @throws IndexOutOfBoundsException if {@code range} does not lie within {@code [0, size()]}
     */
    public void apply(Range range, L lazy) {
        int[] bounds = range.resolve(size);
        apply(bounds[0], bounds[1], lazy);
    }

    @Override
    public boolean equals(Object o) {
        // Overridden from AbstractList to iterate in-order instead of by index, and to short-circuit on size
        // mismatch when the class matches exactly.
        if (o == this) {
            return true;
        }
        if (!(o instanceof List<?> list)) {
            return false;
        }
        if (o.getClass() == MasterTree.class && list.size() != size) {
            return false;
        }
        Iterator<T> e1 = iterator();
        Iterator<?> e2 = list.iterator();
        while (e1.hasNext() && e2.hasNext()) {
            if (!Objects.equals(e1.next(), e2.next())) {
                return false;
            }
        }
        return !(e1.hasNext() || e2.hasNext());
    }

    @Override
    public Iterator<T> iterator() {
        return new Itr();
    }

    // ========== Structural operations ==========

    private Node<T, I> newNode(T value) {
        Node<T, I> node = new Node<>(value);
        node.info = manager.makeInfo(null, 0, value, null, 0);
        return node;
    }

    @SuppressWarnings("unchecked")
    private Node<T, I> build(Object[] arr, int from, int to) {
        if (from == to) {
            return null;
        }
        int mid = (from + to) >>> 1;
        Node<T, I> node = new Node<>((T) arr[mid]);
        node.left = build(arr, from, mid);
        node.right = build(arr, mid + 1, to);
        node.idx = mid - from;
        update(node, to - from);
        return node;
    }

    // Flushes pending lazy state and reversal from the node into its children. The node itself may be shared.
    private Node<T, I> setup(Node<T, I> node, int len) {
        assert node != null && node.idx < len;
        flush.node = node;
        flush.len = len;
        manager.propagate(flush);
        flush.node = null;
        if (node.reversed) {
            int leftLen = node.idx;
            int rightLen = len - 1 - leftLen;
            Node<T, I> oldLeft = node.left;
            Node<T, I> oldRight = node.right;
            node.left = oldRight == null ? null : toggleReversed(oldRight, rightLen);
            node.right = oldLeft == null ? null : toggleReversed(oldLeft, leftLen);
            node.idx = rightLen;
            node.reversed = false;
        }
        return node;
    }

    private void update(Node<T, I> node, int len) {
        int idx = node.idx;
        node.info = manager.makeInfo(
            node.left == null ? null : node.left.info, idx,
            node.value,
            node.right == null ? null : node.right.info, len - 1 - idx
        );
    }

    private Node<T, I> toggleReversed(Node<T, I> node, int len) {
        node = node.getEditable();
        node.reversed ^= true;
        node.info = manager.reverse(node.info, len);
        return node;
    }

    private Node<T, I> mergeRoots(Node<T, I> left, int leftLen, Node<T, I> right, int rightLen) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return mergeRec(left, leftLen, right, rightLen);
    }

    private Node<T, I> mergeRec(Node<T, I> left, int leftLen, Node<T, I> right, int rightLen) {
        int len = leftLen + rightLen;
        if (rng.choose(leftLen, rightLen)) {
            Node<T, I> node = setup(left.getEditable(), leftLen);
            int idx = node.idx;
            node.right = node.right == null ? right : mergeRec(node.right, leftLen - 1 - idx, right, rightLen);
            update(node, len);
            return node;
        }
        else {
            Node<T, I> node = setup(right.getEditable(), rightLen);
            int idx = node.idx;
            node.left = node.left == null ? left : mergeRec(left, leftLen, node.left, idx);
            node.idx = idx + leftLen;
            update(node, len);
            return node;
        }
    }

    // Splits the subtree into [0, index) and [index, len), stored in nodes[0] and nodes[1].
    private void splitRec(Node<T, I> node, int len, int index, Node<T, I>[] nodes) {
        if (node == null) {
            nodes[0] = nodes[1] = null;
            return;
        }
        if (index == 0) {
            nodes[0] = null;
            nodes[1] = node;
            return;
        }
        if (index == len) {
            nodes[0] = node;
            nodes[1] = null;
            return;
        }
        node = setup(node.getEditable(), len);
        int idx = node.idx;
        if (index > idx) {
            splitRec(node.right, len - 1 - idx, index - 1 - idx, nodes);
            node.right = nodes[0];
            update(node, index);
            nodes[0] = node;
        }
        else {
            splitRec(node.left, idx, index, nodes);
            node.left = nodes[1];
            node.idx = idx - index;
            update(node, len - index);
            nodes[1] = node;
        }
    }

    // Inserts a subtree of otherLen elements at index.
    private void spliceIn(int index, Node<T, I> other, int otherLen) {
        modCount++;
        Node<T, I>[] nodes = newPair();
        splitRec(root, size, index, nodes);
        Node<T, I> prefix = mergeRoots(nodes[0], index, other, otherLen);
        root = mergeRoots(prefix, index + otherLen, nodes[1], size - index);
        size += otherLen;
    }

    private Node<T, I> insertRec(Node<T, I> node, int len, int index, T value) {
        if (node == null) {
            return newNode(value);
        }
        if (rng.choose(len, 1)) {
            node = setup(node.getEditable(), len);
            int idx = node.idx;
            if (index > idx) {
                node.right = insertRec(node.right, len - 1 - idx, index - 1 - idx, value);
            }
            else {
                node.left = insertRec(node.left, idx, index, value);
                node.idx = idx + 1;
            }
            update(node, len + 1);
            return node;
        }
        Node<T, I>[] nodes = newPair();
        splitRec(node, len, index, nodes);
        Node<T, I> newRoot = new Node<>(value);
        newRoot.left = nodes[0];
        newRoot.right = nodes[1];
        newRoot.idx = index;
        update(newRoot, len + 1);
        return newRoot;
    }

    // Stores the removed value in removed[0]
    private Node<T, I> removeRec(Node<T, I> node, int len, int index, Object[] removed) {
        // Even the removed node is made editable, since its children are handed over to the caller.
        node = setup(node.getEditable(), len);
        int idx = node.idx;
        if (index < idx) {
            node.left = removeRec(node.left, idx, index, removed);
            node.idx = idx - 1;
            update(node, len - 1);
            return node;
        }
        if (index > idx) {
            node.right = removeRec(node.right, len - 1 - idx, index - 1 - idx, removed);
            update(node, len - 1);
            return node;
        }
        removed[0] = node.value;
        if (node.left == null) {
            return node.right;
        }
        if (node.right == null) {
            return node.left;
        }
        return mergeRec(node.left, idx, node.right, len - 1 - idx);
    }

    // Stores the replaced value in old[0]
    private Node<T, I> setRec(Node<T, I> node, int len, int index, T value, Object[] old) {
        Node<T, I> editable = node.getEditable();
        if (editable != node) {
            // Path-copied, which orphans the nodes held by any live iterator
            modCount++;
        }
        node = setup(editable, len);
        int idx = node.idx;
        if (index < idx) {
            node.left = setRec(node.left, idx, index, value, old);
        }
        else if (index == idx) {
            old[0] = node.value;
            node.value = value;
        }
        else {
            node.right = setRec(node.right, len - 1 - idx, index - 1 - idx, value, old);
        }
        update(node, len);
        return node;
    }

    // ========== Range operations ==========

    // Product over [0, index)
    private P prodPrefix(Node<T, I> node, int len, int index) {
        if (index == 0) {
            return manager.identity();
        }
        setup(node, len);
        if (index == len) {
            return manager.infoToProd(node.info);
        }
        P acc = manager.identity();
        for (;;) {
            int idx = node.idx;
            if (index < idx) {
                len = idx;
                node = setup(node.left, len);
            }
            else if (index == idx) {
                return manager.op(acc, manager.infoToProd(node.left.info));
            }
            else {
                if (node.left != null) {
                    acc = manager.op(acc, manager.infoToProd(node.left.info));
                }
                acc = manager.op(acc, manager.valueToProd(node.value));
                if (index == idx + 1) {
                    return acc;
                }
                index -= idx + 1;
                len -= idx + 1;
                node = setup(node.right, len);
            }
        }
    }

    // Product over [index, len)
    private P prodSuffix(Node<T, I> node, int len, int index) {
        if (index == len) {
            return manager.identity();
        }
        setup(node, len);
        if (index == 0) {
            return manager.infoToProd(node.info);
        }
        P acc = manager.identity();
        for (;;) {
            int idx = node.idx;
            if (index <= idx) {
                if (node.right != null) {
                    acc = manager.op(manager.infoToProd(node.right.info), acc);
                }
                acc = manager.op(manager.valueToProd(node.value), acc);
                if (index == idx) {
                    return acc;
                }
                len = idx;
                node = setup(node.left, len);
            }
            else if (index == idx + 1) {
                return manager.op(manager.infoToProd(node.right.info), acc);
            }
            else {
                index -= idx + 1;
                len -= idx + 1;
                node = setup(node.right, len);
            }
        }
    }

    private Node<T, I> applyWhole(Node<T, I> node, int len, L lazy) {
        node = node.getEditable();
        node.info = manager.applyInfo(node.info, len, lazy);
        return node;
    }

    // Applies to [0, index)
    private Node<T, I> applyPrefix(Node<T, I> node, int len, int index, L lazy) {
        if (index == 0) {
            return node;
        }
        if (index == len) {
            return applyWhole(node, len, lazy);
        }
        node = setup(node.getEditable(), len);
        int idx = node.idx;
        if (index <= idx) {
            node.left = applyPrefix(node.left, idx, index, lazy);
        }
        else {
            if (node.left != null) {
                node.left = applyWhole(node.left, idx, lazy);
            }
            node.value = manager.applyValue(node.value, lazy);
            node.right = applyPrefix(node.right, len - 1 - idx, index - 1 - idx, lazy);
        }
        update(node, len);
        return node;
    }

    // Applies to [index, len)
    private Node<T, I> applySuffix(Node<T, I> node, int len, int index, L lazy) {
        if (index == len) {
            return node;
        }
        if (index == 0) {
            return applyWhole(node, len, lazy);
        }
        node = setup(node.getEditable(), len);
        int idx = node.idx;
        if (index > idx) {
            node.right = applySuffix(node.right, len - 1 - idx, index - 1 - idx, lazy);
        }
        else {
            if (node.right != null) {
                node.right = applyWhole(node.right, len - 1 - idx, lazy);
            }
            node.value = manager.applyValue(node.value, lazy);
            node.left = applySuffix(node.left, idx, index, lazy);
        }
        update(node, len);
        return node;
    }

    // Applies to [fromIndex, toIndex), where fromIndex < toIndex
    private Node<T, I> applyRec(Node<T, I> node, int len, int fromIndex, int toIndex, L lazy) {
        if (fromIndex == 0) {
            return applyPrefix(node, len, toIndex, lazy);
        }
        if (toIndex == len) {
            return applySuffix(node, len, fromIndex, lazy);
        }
        node = setup(node.getEditable(), len);
        int idx = node.idx;
        if (toIndex <= idx) {
            node.left = applyRec(node.left, idx, fromIndex, toIndex, lazy);
        }
        else if (fromIndex > idx) {
            node.right = applyRec(node.right, len - 1 - idx, fromIndex - 1 - idx, toIndex - 1 - idx, lazy);
        }
        else {
            node.left = applySuffix(node.left, idx, fromIndex, lazy);
            node.value = manager.applyValue(node.value, lazy);
            node.right = applyPrefix(node.right, len - 1 - idx, toIndex - 1 - idx, lazy);
        }
        update(node, len);
        return node;
    }

    // ========== Diagnostics ==========

    // Verifies sizes and holder counts, returning the number of elements found. Does not flush.
    int checkInvariants() {
        int found = checkInvariantsRec(root);
        if (found != size) {
            throw new AssertionError("Size " + size + " but found " + found + " elements");
        }
        return found;
    }

    private static int checkInvariantsRec(Node<?, ?> node) {
        if (node == null) {
            return 0;
        }
        if (node.refs < 1) {
            throw new AssertionError("Node with " + node.refs + " holders is reachable");
        }
        int leftSize = checkInvariantsRec(node.left);
        if (leftSize != node.idx) {
            throw new AssertionError("idx " + node.idx + " but left subtree has " + leftSize + " elements");
        }
        return leftSize + 1 + checkInvariantsRec(node.right);
    }

    int height() {
        return heightRec(root);
    }

    private static int heightRec(Node<?, ?> node) {
        // Recursion depth is bounded by the height, which is expected-logarithmic
        return node == null ? 0 : 1 + Math.max(heightRec(node.left), heightRec(node.right));
    }

    // ========== Utils ==========

    @SuppressWarnings("unchecked")
    private MasterTree<T, I, P, L> compatibleTree(Collection<?> c) {
        if (c instanceof MasterTree<?, ?, ?, ?> tree && manager.equals(tree.manager)) {
            return (MasterTree<T, I, P, L>) tree;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static <T, I> Node<T, I>[] newPair() {
        return (Node<T, I>[]) new Node<?, ?>[2];
    }

    // Method used to prevent integer overflow when increasing size.
    private static void checkNewSize(int oldSize, int toAdd) {
        if (oldSize + toAdd < 0) {
            throw new OutOfMemoryError("Required size " + oldSize + " + " + toAdd + " is too large");
        }
    }

    private void rangeCheckForAdd(int index) {
        if (index > size || index < 0) {
            throw new IndexOutOfBoundsException(outOfBoundsMsg(index));
        }
    }

    private String outOfBoundsMsg(int index) {
        return "Index: " + index + ", Size: " + size;
    }

    // ========== Iteration ==========

    static class Frame<T, I> {
        final Node<T, I> node; final int len;
        Frame(Node<T, I> node, int len) { this.node = node; this.len = len; }
    }

    // In-order traversal. The stack holds the nodes whose value is yet to be returned, innermost on top.
    private class Itr implements Iterator<T> {
        final ArrayDeque<Frame<T, I>> stack = new ArrayDeque<>();
        int cursor;
        int lastRet = -1;
        int expectedModCount = modCount;

        Itr() {
            pushLeftSpine(root, size);
        }

        void pushLeftSpine(Node<T, I> node, int len) {
            while (node != null) {
                setup(node, len);
                stack.push(new Frame<>(node, len));
                len = node.idx;
                node = node.left;
            }
        }

        // Rebuilds the stack so that the element at index is on top
        void seek(int index) {
            stack.clear();
            Node<T, I> node = root;
            int len = size;
            while (node != null) {
                setup(node, len);
                int idx = node.idx;
                if (index <= idx) {
                    stack.push(new Frame<>(node, len));
                    len = idx;
                    node = node.left;
                }
                else {
                    index -= idx + 1;
                    len -= idx + 1;
                    node = node.right;
                }
            }
        }

        void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        @Override
        public boolean hasNext() {
            return cursor != size;
        }

        @Override
        public T next() {
            checkForComodification();
            Frame<T, I> frame = stack.poll();
            if (frame == null) {
                throw new NoSuchElementException();
            }
            Node<T, I> node = frame.node;
            pushLeftSpine(node.right, frame.len - 1 - node.idx);
            lastRet = cursor++;
            return node.value;
        }

        @Override
        public void remove() {
            if (lastRet < 0) {
                throw new IllegalStateException();
            }
            checkForComodification();
            MasterTree.this.remove(lastRet);
            cursor = lastRet;
            lastRet = -1;
            seek(cursor);
            expectedModCount = modCount;
        }
    }

    // ========== Nodes ==========

    private final class Flush implements MasterManager.Propagation<T, I> {
        Node<T, I> node;
        int len;

        @Override
        public I info() {
            return node.info;
        }

        @Override
        public void setInfo(I info) {
            node.info = info;
        }

        @Override
        public T value() {
            return node.value;
        }

        @Override
        public void setValue(T value) {
            node.value = value;
        }

        @Override
        public I leftInfo() {
            return node.left == null ? null : node.left.info;
        }

        @Override
        public int leftLength() {
            return node.idx;
        }

        @Override
        public void setLeftInfo(I info) {
            if (node.left == null) {
                throw new IllegalStateException("No left child");
            }
            (node.left = node.left.getEditable()).info = info;
        }

        @Override
        public I rightInfo() {
            return node.right == null ? null : node.right.info;
        }

        @Override
        public int rightLength() {
            return len - 1 - node.idx;
        }

        @Override
        public void setRightInfo(I info) {
            if (node.right == null) {
                throw new IllegalStateException("No right child");
            }
            (node.right = node.right.getEditable()).info = info;
        }
    }

    private static final class Node<T, I> {
        T value;
        I info;
        int idx; // size of left subtree
        boolean reversed; // children are yet to be swapped; info already describes the reversed order
        Node<T, I> left;
        Node<T, I> right;
        int refs = 1;

        Node(T value) {
            this.value = value;
        }

        private Node(Node<T, I> toCopy) {
            value = toCopy.value;
            info = toCopy.info;
            idx = toCopy.idx;
            reversed = toCopy.reversed;
            if ((left = toCopy.left) != null) {
                left.refs++;
            }
            if ((right = toCopy.right) != null) {
                right.refs++;
            }
        }

        boolean isOwned() {
            return refs == 1;
        }

        // Returns this node if owned, else a copy that the caller now holds instead of this node
        Node<T, I> getEditable() {
            if (isOwned()) {
                return this;
            }
            refs--;
            return new Node<>(this);
        }
    }
}
