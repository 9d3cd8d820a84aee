package org.shirdrn.ms.clustering.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates daemon threads named <code>poolName-N</code>, so worker threads are easy to
 * spot in logs and thread dumps.
 */
public class NamedThreadFactory implements ThreadFactory {

	private final String poolName;
	private final AtomicInteger threadNumber = new AtomicInteger(0);
	
	public NamedThreadFactory(String poolName) {
		super();
		this.poolName = poolName;
	}
	
	@Override
	public Thread newThread(Runnable r) {
		Thread t = new Thread(r, poolName + "-" + threadNumber.incrementAndGet());
		t.setDaemon(true);
		return t;
	}

}
