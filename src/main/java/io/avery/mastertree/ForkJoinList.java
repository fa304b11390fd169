package io.avery.mastertree;

import java.util.Collection;
import java.util.List;

/**
 * A {@code List} that supports potentially sublinear copy ({@code fork}), bulk insertion/concatenation
 * ({@code join}), cutting ({@code split}) and reversal.
 *
 * @param <E> the type of elements in this list
 */
public interface ForkJoinList<E> extends List<E> {
    /**
     * Like {@link #addAll(Collection)}, but attempts to {@link #fork} its argument before appending if it is a
     * compatible {@code ForkJoinList}, and may use a sublinear algorithm to adjoin the resultant copy if possible.
     *
     * @param c collection containing elements to be added to this list
     * @return {@code true} if this list changed as a result of the call
     */
    boolean join(Collection<? extends E> c);

    /**
     * Like {@link #addAll(int, Collection)}, but attempts to {@link #fork} its argument before inserting if it is a
     * compatible {@code ForkJoinList}, and may use a sublinear algorithm to adjoin the resultant copy if possible.
     *
     * @param index index at which to insert the first element from the specified collection
     * @param c collection containing elements to be added to this list
     * @return {@code true} if this list changed as a result of the call
     */
    boolean join(int index, Collection<? extends E> c);

    /**
     * Returns a shallow copy of this {@code ForkJoinList} instance. (The elements themselves are not copied.)
     *
     * @implSpec Sublinear implementations will likely use structural sharing to avoid visiting each element when
     * copying. This must not impact the results of subsequent operations on this list, but may impact the performance
     * of subsequent modifications to this list.
     *
     * @return a copy of this list
     */
    ForkJoinList<E> fork();

    /**
     * Removes the elements at and after {@code index} from this list, and returns them as a new list. This list
     * retains the elements before {@code index}.
     *
     * @param index index of the first element moved to the returned list
     * @return a list holding the former suffix of this list
     * @throws IndexOutOfBoundsException if {@code index < 0 || index > size()}
     */
    ForkJoinList<E> split(int index);

    /**
     * Reverses the order of the elements in this list.
     */
    void reverse();
}
