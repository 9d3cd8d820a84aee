package org.shirdrn.ms.clustering.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

public class GenericClusteringResultTest {

	@Test
	public void lookupsByClusterAndPoint() {
		Point p0 = new Point(0, 1, new double[] {0, 0});
		Point p1 = new Point(1, 1, new double[] {1, 1});
		Point p2 = new Point(2, 2, new double[] {50, 50});
		Map<Integer, Set<ClusterPoint<Point>>> clusters = Maps.newTreeMap();
		Set<ClusterPoint<Point>> first = Sets.newLinkedHashSet();
		first.add(new GenericClusterPoint(p0, 0));
		first.add(new GenericClusterPoint(p1, 0));
		clusters.put(0, first);
		Set<ClusterPoint<Point>> second = Sets.newLinkedHashSet();
		second.add(new GenericClusterPoint(p2, 1));
		clusters.put(1, second);
		
		GenericClusteringResult<Point> result = new GenericClusteringResult<Point>();
		assertThat(result.getClusterCount()).isZero();
		result.setClusteredPoints(clusters);
		
		assertThat(result.getClusterCount()).isEqualTo(2);
		assertThat(result.getClusterPoints(0)).hasSize(2);
		assertThat(result.getClusterPoints(7)).isEmpty();
		assertThat(result.findClusterId(p2)).isEqualTo(1);
		assertThat(result.findClusterId(new Point(9, 0, new double[] {3, 3}))).isEqualTo(-1);
	}
}
