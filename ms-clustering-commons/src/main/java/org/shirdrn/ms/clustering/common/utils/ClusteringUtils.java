package org.shirdrn.ms.clustering.common.utils;

import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.shirdrn.ms.clustering.common.ClusterPoint;
import org.shirdrn.ms.clustering.common.Point;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;

public class ClusteringUtils {

	/**
	 * Render one line per cluster: <code>clusterId,size,dominantLabel</code>.
	 * Labels are carried for reporting only.
	 */
	public static String formatClusterSummary(Map<Integer, Set<ClusterPoint<Point>>> clusterPoints) {
		StringBuilder sb = new StringBuilder();
		Iterator<Entry<Integer, Set<ClusterPoint<Point>>>> iter = clusterPoints.entrySet().iterator();
		while(iter.hasNext()) {
			Entry<Integer, Set<ClusterPoint<Point>>> entry = iter.next();
			sb.append(entry.getKey()).append(',')
				.append(entry.getValue().size()).append(',')
				.append(dominantLabel(entry.getValue()))
				.append(System.lineSeparator());
		}
		return sb.toString();
	}
	
	/**
	 * Most frequent label among cluster members, the smallest label wins a tie.
	 */
	public static int dominantLabel(Set<ClusterPoint<Point>> members) {
		Multiset<Integer> labels = HashMultiset.create();
		for(ClusterPoint<Point> cp : members) {
			labels.add(cp.getPoint().getLabel());
		}
		int label = -1;
		int count = 0;
		for(Multiset.Entry<Integer> e : Multisets.copyHighestCountFirst(labels).entrySet()) {
			if(e.getCount() < count) {
				break;
			}
			if(e.getCount() > count || e.getElement() < label) {
				label = e.getElement();
				count = e.getCount();
			}
		}
		return label;
	}
}
