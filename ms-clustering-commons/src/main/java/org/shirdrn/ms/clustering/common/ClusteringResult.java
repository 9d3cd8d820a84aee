package org.shirdrn.ms.clustering.common;

import java.util.Map;
import java.util.Set;

/**
 * Cluster membership produced by a {@link Clustering} run, keyed by cluster id.
 */
public interface ClusteringResult<P> {

	void setClusteredPoints(Map<Integer, Set<ClusterPoint<P>>> clusteredPoints);
	
	Map<Integer, Set<ClusterPoint<P>>> getClusteredPoints();
	
	int getClusterCount();
	
	/**
	 * Members of a cluster, empty for an unknown cluster id.
	 */
	Set<ClusterPoint<P>> getClusterPoints(int clusterId);
	
	/**
	 * Id of the cluster holding the given point.
	 * @return cluster id, or <code>-1</code> if the point was not clustered
	 */
	int findClusterId(P point);
}
