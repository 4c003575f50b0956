package dev.larder.discovery;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-driven sequence of progress snapshots. Work happens on the consumer's thread, one step
 * per {@link #next()} call, so a slow consumer applies back-pressure and snapshots are strictly
 * ordered.
 *
 * @param <T> snapshot type
 */
public abstract class ProgressStream<T> implements Iterator<T> {

    private T buffered;
    private boolean finished;

    /**
     * Perform the next unit of work.
     *
     * @return the resulting snapshot, or null once the stream is exhausted
     */
    protected abstract T computeNext();

    @Override
    public final boolean hasNext() {
        if (buffered == null && !finished) {
            buffered = computeNext();
            if (buffered == null) {
                finished = true;
            }
        }
        return buffered != null;
    }

    @Override
    public final T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T result = buffered;
        buffered = null;
        return result;
    }

    /**
     * Lazy sequential view of the remaining snapshots.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Run to completion and collect every remaining snapshot.
     */
    public List<T> drain() {
        List<T> snapshots = new ArrayList<>();
        forEachRemaining(snapshots::add);
        return snapshots;
    }

    /**
     * Run to completion and return the terminal snapshot.
     *
     * @throws NoSuchElementException if the stream was already exhausted
     */
    public T last() {
        T last = null;
        while (hasNext()) {
            last = next();
        }
        if (last == null) {
            throw new NoSuchElementException("Stream already exhausted");
        }
        return last;
    }
}
