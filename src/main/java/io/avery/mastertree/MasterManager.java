package io.avery.mastertree;

/**
 * The algebra that a {@link MasterTree} aggregates and updates with.
 *
 * <p>A tree stores values of type {@code T}. Each subtree carries an info of type {@code I}, which holds both an
 * aggregate of the subtree and any lazy operator not yet pushed to the subtree's children. Queries return a
 * product of type {@code P}, combined with the monoid {@link #op}/{@link #identity}. Updates are lazy operators of
 * type {@code L}.
 *
 * <p>Values and infos are shared between a tree and its forks, so implementations must never mutate a value or
 * info they were given. Every method that changes one returns a new instance instead.
 *
 * @param <T> the type of elements
 * @param <I> the type of per-subtree aggregate and pending lazy state
 * @param <P> the type of query results
 * @param <L> the type of lazy operators
 */
public interface MasterManager<T, I, P, L> {
    /**
     * Returns the info of the sequence formed by {@code left}, {@code value}, {@code right}, in that order, with no
     * pending lazy operator.
     *
     * @param left the info of the left part, or {@code null} if it is empty
     * @param leftLength the number of elements in the left part
     * @param value the middle element
     * @param right the info of the right part, or {@code null} if it is empty
     * @param rightLength the number of elements in the right part
     * @return the combined info
     */
    I makeInfo(I left, int leftLength, T value, I right, int rightLength);

    /**
     * Returns the info of the same sequence of {@code length} elements in reverse order. Applying this twice must
     * yield an info equivalent to the original.
     */
    I reverse(I info, int length);

    /**
     * Returns {@code info} with {@code lazy} applied to every one of its {@code length} elements. The result must
     * both reflect the update in its aggregate and remember it as pending for the subtree's children.
     */
    I applyInfo(I info, int length, L lazy);

    /**
     * Returns {@code value} with {@code lazy} applied.
     */
    T applyValue(T value, L lazy);

    /**
     * Pushes the pending lazy operator of {@code node.info()} into {@code node.value()} and into the info of each
     * present child.
     *
     * <p>Implementations must clear the pushed operator from the node's own info. A node is flushed every time it is
     * visited, so an operator left behind is applied again on the next visit.
     */
    void propagate(Propagation<T, I> node);

    P infoToProd(I info);

    P valueToProd(T value);

    /**
     * The identity of {@link #op}.
     */
    P identity();

    /**
     * An associative combination of a product with the product to its right. Need not be commutative.
     */
    P op(P left, P right);

    /**
     * A view of one node and its children, handed to {@link #propagate}. Children that are absent report a
     * {@code null} info and a length of zero.
     *
     * @param <T> the type of elements
     * @param <I> the type of per-subtree aggregate and pending lazy state
     */
    interface Propagation<T, I> {
        I info();

        void setInfo(I info);

        T value();

        void setValue(T value);

        I leftInfo();

        int leftLength();

        /**
         * @throws IllegalStateException if there is no left child
         */
        void setLeftInfo(I info);

        I rightInfo();

        int rightLength();

        /**
         * @throws IllegalStateException if there is no right child
         */
        void setRightInfo(I info);
    }
}
