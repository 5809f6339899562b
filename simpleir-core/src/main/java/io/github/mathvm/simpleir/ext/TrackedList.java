package io.github.mathvm.simpleir.ext;

import java.util.*;

/**
 * A list view that is told about every element entering and leaving it.
 * <p>
 * Used wherever a list owns its elements, so that ownership exts stay
 * in step with list membership.
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
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public E set(int index, E element) {
        E old = viewed.get(index);
        if (old == element) return old;
        onAdded(element);
        viewed.set(index, element);
        onRemoved(old);
        return old;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        // copy first, onRemoved may look at the list
        List<E> removed = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : removed) {
            onRemoved(e);
        }
    }

    /**
     * Add every element of {@code c}, or none: if {@link #onAdded} rejects one,
     * the elements accepted before it are handed back to {@link #onRemoved}.
     */
    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        List<E> added = new ArrayList<>(c.size());
        try {
            for (E e : c) {
                onAdded(e);
                added.add(e);
            }
        } catch (RuntimeException ex) {
            for (E e : added) {
                onRemoved(e);
            }
            throw ex;
        }
        return viewed.addAll(index, added);
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
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                if (e == last) return;
                onAdded(e);
                li.set(e);
                onRemoved(last);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }

    @Override
    public Iterator<E> iterator() {
        return listIterator();
    }
}
