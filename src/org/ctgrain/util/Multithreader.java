package org.ctgrain.util;

import java.util.concurrent.atomic.AtomicInteger;

import ij.Prefs;

/**
 * MultiThreading copyright 2007 Stephan Preibisch
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */

/**
 * Runs slice-wise stack work over the number of threads set in ImageJ's
 * preferences.
 *
 * <p>
 * Each worker pulls the next unprocessed index from a shared cursor, so slices
 * are handed out one at a time and workers that finish early pick up the
 * remainder. Worker failures are rethrown on the calling thread once every
 * worker has stopped.
 * </p>
 *
 * @author Stephan Preibisch
 * @author Michael Doube
 */
public class Multithreader {

	/**
	 * Work done for one index (usually a slice or a row) of a stack
	 */
	public interface IndexTask {
		void process(int index);
	}

	public static Thread[] newThreads(final int numThreads) {
		return new Thread[Math.max(1, numThreads)];
	}

	/**
	 * Call <code>task</code> once for every index in [0, <code>count</code>)
	 * using all available threads.
	 *
	 * @param count
	 *            number of indices
	 * @param task
	 *            work to do for each index; must only write to memory owned
	 *            by that index
	 */
	public static void forEachIndex(final int count, final IndexTask task) {
		forEachIndex(count, Prefs.getThreads(), task);
	}

	public static void forEachIndex(final int count, final int numThreads, final IndexTask task) {
		if (count <= 0)
			return;
		final AtomicInteger ai = new AtomicInteger(0);
		final Thread[] threads = newThreads(Math.min(numThreads, count));
		final Throwable[] failures = new Throwable[threads.length];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			final int t = ithread;
			threads[ithread] = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						for (int i = ai.getAndIncrement(); i < count; i = ai.getAndIncrement())
							task.process(i);
					} catch (final Throwable e) {
						failures[t] = e;
						// stop the other workers taking more work
						ai.set(count);
					}
				}
			});
		}
		startAndJoin(threads);
		for (final Throwable failure : failures) {
			if (failure instanceof RuntimeException)
				throw (RuntimeException) failure;
			if (failure instanceof Error)
				throw (Error) failure;
			if (failure != null)
				throw new RuntimeException(failure);
		}
	}

	public static void startAndJoin(final Thread[] threads) {
		for (int ithread = 0; ithread < threads.length; ++ithread) {
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}

		try {
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (final InterruptedException ie) {
			for (final Thread thread : threads)
				thread.interrupt();
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}
}
