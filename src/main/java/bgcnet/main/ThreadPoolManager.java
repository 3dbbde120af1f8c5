/*******************************************************************************
 * BGCNet - Biosynthetic Gene Cluster Networks
 * Copyright 2024 BGCNet developers
 *
 * This file is part of BGCNet.
 *
 *     BGCNet is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BGCNet is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BGCNet.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bgcnet.main;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed size pool of worker threads with a bounded number of queued tasks
 * @author BGCNet developers
 *
 */
public class ThreadPoolManager {
	private static final int TIMEOUT_SECONDS = 30;
	private static final int SECONDS_PER_TASK = 1;

	private int maxTaskCount;
	private final int numThreads;
	private ThreadPoolExecutor pool;

	public ThreadPoolManager(int numberOfThreads, int maxTaskCount) {
		if(numberOfThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Value: "+numberOfThreads);
		this.pool = createPool(numberOfThreads);
		this.maxTaskCount = maxTaskCount;
		this.numThreads = numberOfThreads;
	}

	/**
	 * Adds task to the pool. If the queue limit is reached, the pool is relaunched
	 * after waiting for all queued tasks to finish.
	 * @param task task to add to the pool
	 * @throws InterruptedException if the relaunch process is interrupted
	 */
	public void queueTask(Runnable task) throws InterruptedException {
		int taskCount = pool.getQueue().size();
		if(taskCount >= maxTaskCount) {
			relaunchPool();
		}
		pool.execute(task);
	}

	/**
	 * Shuts down the pool and waits for all queued tasks to finish.
	 * @throws InterruptedException if the wait is interrupted or if the tasks do not finish before the timeout
	 */
	public void terminatePool() throws InterruptedException  {
		pool.shutdown();
		pool.awaitTermination(Math.max(TIMEOUT_SECONDS, (long)maxTaskCount*SECONDS_PER_TASK), TimeUnit.SECONDS);
		if(!pool.isTerminated()) {
			throw new InterruptedException("The ThreadPoolExecutor did not finish the queued tasks after an await termination call");
		}
	}

	private void relaunchPool() throws InterruptedException {
		this.terminatePool();
		pool = createPool(numThreads);
	}

	private static ThreadPoolExecutor createPool(int numThreads) {
		return new ThreadPoolExecutor(numThreads, numThreads, TIMEOUT_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<Runnable>());
	}
}
