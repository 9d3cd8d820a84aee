package org.shirdrn.ms.clustering.common;

import java.io.File;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

public abstract class AbstractClustering<P> implements Clustering<P> {

	protected File[] inputFiles;
	protected final int parallism;
	protected final ClusteringResult<P> clusteringResult;
	// TreeMap<clusterId, points belonging to this cluster>
	protected final Map<Integer, Set<ClusterPoint<P>>> clusteredPoints = Maps.newTreeMap();
	
	public AbstractClustering(int parallism) {
		super();
		Preconditions.checkArgument(parallism > 0, "Required: parallism > 0!");
		this.parallism = parallism;
		this.clusteringResult = new GenericClusteringResult<P>();
		clusteringResult.setClusteredPoints(clusteredPoints);
	}
	
	@Override
	public int getClusteredCount() {
		return clusteringResult.getClusterCount();
	}
	
	@Override
	public void setInputFiles(File... inputFiles) {
		this.inputFiles = inputFiles;		
	}
	
	@Override
	public ClusteringResult<P> getClusteringResult() {
		return clusteringResult;
	}

}
