package io.github.kirc.core.ext;

import java.util.*;

/**
 * A list view that notifies its owner of every element entering or leaving it.
 * <p>
 * Used by blocks and functions to keep ownership exts up to date.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    /**
     * Called before any structural change; may throw to forbid it.
     */
    protected void checkMutable() {
    }

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        checkMutable();
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public E set(int index, E element) {
        checkMutable();
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        checkMutable();
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        checkMutable();
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        checkMutable();
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        checkMutable();
        for (E e : c) {
            onAdded(e);
        }
        return viewed.addAll(index, c);
    }

    @Override
    public boolean removeAll(Collection<?> c) {
        checkMutable();
        Set<?> toRemove = c instanceof Set ? (Set<?>) c : new HashSet<>(c);
        boolean changed = false;
        Iterator<E> it = viewed.iterator();
        while (it.hasNext()) {
            E e = it.next();
            if (toRemove.contains(e)) {
                it.remove();
                onRemoved(e);
                changed = true;
            }
        }
        return changed;
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                checkMutable();
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                checkMutable();
                li.set(e);
                onRemoved(last);
                onAdded(e);
                last = e;
            }

            @Override
            public void add(E e) {
                checkMutable();
                onAdded(e);
                li.add(e);
            }
        };
    }
}
