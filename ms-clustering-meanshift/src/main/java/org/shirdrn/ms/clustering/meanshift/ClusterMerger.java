package org.shirdrn.ms.clustering.meanshift;

import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.ms.clustering.common.Point;
import org.shirdrn.ms.clustering.common.utils.MetricUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Greedy first-fit merge of converged centroids.
 * <p>
 * Points are visited in input order. A point is absorbed by the first existing seed whose
 * centroid is closer than the merge tolerance, the seed's centroid stays as it is. A point
 * no seed absorbs becomes a new seed. The result depends on input order.
 *
 * @author yanjun
 */
public class ClusterMerger {

	private static final Log LOG = LogFactory.getLog(ClusterMerger.class);
	private final double mergeTolerance;
	
	public ClusterMerger(double mergeTolerance) {
		Preconditions.checkArgument(mergeTolerance > 0, "Required: mergeTolerance > 0!");
		this.mergeTolerance = mergeTolerance;
	}
	
	public List<Cluster> merge(List<Point> convergedPoints) {
		final List<Seed> seeds = Lists.newArrayList();
		for(Point p : convergedPoints) {
			double[] centroid = p.getCentroid();
			Seed absorbedBy = null;
			for(Seed seed : seeds) {
				if(MetricUtils.euclideanDistance(seed.centroid, centroid) < mergeTolerance) {
					absorbedBy = seed;
					break;
				}
			}
			if(absorbedBy != null) {
				absorbedBy.memberPointIds.add(p.getId());
				LOG.debug("Absorbed: point=" + p.getId() + ", seed=" + absorbedBy.pointId);
			} else {
				seeds.add(new Seed(p.getId(), centroid));
				LOG.debug("New seed: point=" + p.getId());
			}
		}
		
		ImmutableList.Builder<Cluster> clusters = ImmutableList.builder();
		int id = 0;
		for(Seed seed : seeds) {
			clusters.add(new Cluster(id++, seed.pointId, seed.centroid, seed.memberPointIds));
		}
		LOG.info("Merged centroids: input=" + convergedPoints.size() + ", clusters=" + seeds.size() + 
				", mergeTolerance=" + mergeTolerance);
		return clusters.build();
	}
	
	private static final class Seed {
		
		private final int pointId;
		private final double[] centroid;
		private final List<Integer> memberPointIds = Lists.newArrayList();
		
		Seed(int pointId, double[] centroid) {
			this.pointId = pointId;
			this.centroid = centroid;
			memberPointIds.add(pointId);
		}
	}
}
