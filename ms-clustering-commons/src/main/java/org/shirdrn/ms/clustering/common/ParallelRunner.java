package org.shirdrn.ms.clustering.common;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Runs one independent task per input on a fixed-size worker pool, and gathers the results
 * in submission order regardless of which worker finishes first.
 * <p>
 * Tasks must not share mutable state: anything a task writes has to be owned by that task.
 * The first failed task (in submission order) aborts the whole batch, remaining tasks are
 * cancelled and the failure is raised as a {@link ClusteringException}.
 *
 * @param <I> task input type
 * @param <R> task result type
 * @author yanjun
 */
public abstract class ParallelRunner<I, R> {

	private static final Log LOG = LogFactory.getLog(ParallelRunner.class);
	private final String poolName;
	protected final ExecutorService executorService;
	
	public ParallelRunner(String poolName, int parallism) {
		Preconditions.checkArgument(parallism > 0, "Required: parallism > 0!");
		this.poolName = poolName;
		executorService = Executors.newFixedThreadPool(parallism, new NamedThreadFactory(poolName));
		LOG.info("Config: poolName=" + poolName + ", parallism=" + parallism);
	}
	
	/**
	 * Compute the result for a single input. Invoked concurrently from worker threads.
	 */
	protected abstract R compute(I input) throws Exception;
	
	public List<R> run(List<I> inputs) {
		Preconditions.checkState(!executorService.isShutdown(), "Runner already shut down: " + poolName);
		final List<Future<R>> futures = Lists.newArrayListWithCapacity(inputs.size());
		for(final I input : inputs) {
			futures.add(executorService.submit(new Callable<R>() {
				@Override
				public R call() throws Exception {
					return compute(input);
				}
			}));
		}
		LOG.info("Tasks submitted: pool=" + poolName + ", taskCount=" + futures.size());
		
		// join in submission order
		ImmutableList.Builder<R> results = ImmutableList.builder();
		for(int i=0; i<futures.size(); i++) {
			try {
				results.add(futures.get(i).get());
			} catch (ExecutionException e) {
				cancelAll(futures);
				throw new ClusteringException("Task failed: pool=" + poolName + ", input=" + inputs.get(i), e.getCause());
			} catch (InterruptedException e) {
				cancelAll(futures);
				Thread.currentThread().interrupt();
				throw new ClusteringException("Interrupted while waiting for tasks: pool=" + poolName, e);
			}
		}
		return results.build();
	}
	
	private void cancelAll(List<Future<R>> futures) {
		int cancelled = 0;
		for(Future<R> future : futures) {
			if(future.cancel(true)) {
				cancelled++;
			}
		}
		LOG.warn("Batch aborted: pool=" + poolName + ", cancelledTasks=" + cancelled);
	}
	
	public void shutdown() {
		LOG.info("Shutdown executor service: " + poolName);
		executorService.shutdownNow();
	}
}
