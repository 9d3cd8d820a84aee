package org.shirdrn.ms.clustering.common;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

public class GenericClusteringResult<P> implements ClusteringResult<P> {

	protected Map<Integer, Set<ClusterPoint<P>>> clusteredPoints = Collections.emptyMap();

	@Override
	public Map<Integer, Set<ClusterPoint<P>>> getClusteredPoints() {
		return clusteredPoints;
	}

	@Override
	public void setClusteredPoints(Map<Integer, Set<ClusterPoint<P>>> clusteredPoints) {
		this.clusteredPoints = Preconditions.checkNotNull(clusteredPoints, "clusteredPoints");
	}
	
	@Override
	public int getClusterCount() {
		return clusteredPoints.size();
	}
	
	@Override
	public Set<ClusterPoint<P>> getClusterPoints(int clusterId) {
		Set<ClusterPoint<P>> set = clusteredPoints.get(clusterId);
		return set == null ? Collections.<ClusterPoint<P>>emptySet() : Collections.unmodifiableSet(set);
	}
	
	@Override
	public int findClusterId(P point) {
		for(Set<ClusterPoint<P>> set : clusteredPoints.values()) {
			for(ClusterPoint<P> cp : set) {
				if(cp.getPoint().equals(point)) {
					return cp.getClusterId();
				}
			}
		}
		return -1;
	}
}
