package org.shirdrn.ms.clustering.meanshift;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A cluster represented by the converged centroid of its seed point.
 */
public class Cluster {

	private final int id;
	private final int seedPointId;
	private final double[] centroid;
	private final ImmutableList<Integer> memberPointIds;
	
	public Cluster(int id, int seedPointId, double[] centroid, List<Integer> memberPointIds) {
		super();
		this.id = id;
		this.seedPointId = seedPointId;
		this.centroid = centroid.clone();
		this.memberPointIds = ImmutableList.copyOf(memberPointIds);
	}

	public int getId() {
		return id;
	}

	public int getSeedPointId() {
		return seedPointId;
	}

	public double[] getCentroid() {
		return centroid.clone();
	}

	/**
	 * Seed first, then absorbed points in merge order.
	 */
	public ImmutableList<Integer> getMemberPointIds() {
		return memberPointIds;
	}
	
	public int size() {
		return memberPointIds.size();
	}
	
	@Override
	public String toString() {
		return "Cluster[id=" + id + ", seed=" + seedPointId + ", size=" + memberPointIds.size() + 
				", centroid=" + Arrays.toString(centroid) + "]";
	}
}
