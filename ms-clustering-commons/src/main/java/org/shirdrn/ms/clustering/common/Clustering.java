package org.shirdrn.ms.clustering.common;

import java.io.File;
import java.util.Collection;

/**
 * A clustering algorithm over points of type <code>P</code>.
 * Typical usage: {@link #initialize(Collection)}, then {@link #clustering()}, then read
 * {@link #getClusteringResult()}.
 *
 * @param <P> point type
 */
public interface Clustering<P> {

	/**
	 * Collect the points to cluster.
	 * @param points points to cluster, or <code>null</code> to read the files set by {@link #setInputFiles(File...)}
	 */
	void initialize(Collection<P> points);
	
	void clustering();
	
	void setInputFiles(File... files);
	
	/**
	 * Number of clusters found by the last {@link #clustering()} call.
	 */
	int getClusteredCount();
	
	ClusteringResult<P> getClusteringResult();
}
