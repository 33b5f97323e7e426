/*-
 * #%L
 * This file is part of CerviScan.
 * %%
 * Copyright (C) 2024 - 2025 CerviScan developers
 * %%
 * CerviScan is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * CerviScan is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with CerviScan.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package cerviscan.lib.common;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Create thread factories and pools with named threads, which makes it easier to identify
 * extraction workers in logs and thread dumps.
 *
 * @author CerviScan developers
 *
 */
public class ThreadTools {

	// Suppressed default constructor for non-instantiability
	private ThreadTools() {
		throw new AssertionError();
	}

	/**
	 * Create a named thread factory with a specified priority.
	 *
	 * @param prefix
	 * @param daemon
	 * @param priority
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new SimpleThreadFactory(prefix, daemon, priority);
	}

	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 *
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}

	/**
	 * Create a fixed-size pool of named daemon threads.
	 *
	 * @param prefix prefix for thread names
	 * @param nThreads number of threads; values &lt; 1 use the number of available processors
	 * @return
	 */
	public static ExecutorService createFixedThreadPool(String prefix, int nThreads) {
		if (nThreads < 1)
			nThreads = getParallelism();
		return Executors.newFixedThreadPool(nThreads, createThreadFactory(prefix, true));
	}

	/**
	 * Get the default number of threads for parallel processing.
	 * @return
	 */
	public static int getParallelism() {
		return Math.max(1, Runtime.getRuntime().availableProcessors());
	}


	static class SimpleThreadFactory implements ThreadFactory {

		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private String prefix;
		private boolean daemon;
		private int priority;

		SimpleThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}

		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(r, name);
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}

	}

}
