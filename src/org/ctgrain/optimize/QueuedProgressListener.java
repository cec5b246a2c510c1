package org.ctgrain.optimize;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands progress events to another thread through a bounded queue.
 *
 * <p>
 * The optimiser never waits on the consumer: when the queue is full the
 * oldest event is dropped to make room. Percentages only grow, so the newest
 * event carries the most useful state.
 * </p>
 */
public class QueuedProgressListener implements ProgressListener {

	public static final int DEFAULT_CAPACITY = 64;

	private final BlockingQueue<ProgressEvent> queue;
	private final AtomicLong dropped = new AtomicLong();

	public QueuedProgressListener() {
		this(DEFAULT_CAPACITY);
	}

	public QueuedProgressListener(final int capacity) {
		if (capacity < 1)
			throw new IllegalArgumentException("Queue capacity must be >= 1: " + capacity);
		this.queue = new ArrayBlockingQueue<ProgressEvent>(capacity);
	}

	@Override
	public void radiusCompleted(final ProgressEvent event) {
		while (!queue.offer(event)) {
			if (queue.poll() != null)
				dropped.incrementAndGet();
		}
	}

	/**
	 * @return next event, or null if none is waiting
	 */
	public ProgressEvent poll() {
		return queue.poll();
	}

	/**
	 * Wait up to <code>timeout</code> for the next event
	 *
	 * @return next event, or null on timeout
	 */
	public ProgressEvent poll(final long timeout, final TimeUnit unit) throws InterruptedException {
		return queue.poll(timeout, unit);
	}

	/**
	 * @return every waiting event, oldest first
	 */
	public List<ProgressEvent> drain() {
		final List<ProgressEvent> events = new ArrayList<ProgressEvent>();
		queue.drainTo(events);
		return events;
	}

	/**
	 * @return number of events discarded because the queue was full
	 */
	public long getDroppedCount() {
		return dropped.get();
	}
}
