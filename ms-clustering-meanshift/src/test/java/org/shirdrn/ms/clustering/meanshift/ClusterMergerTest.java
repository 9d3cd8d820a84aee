package org.shirdrn.ms.clustering.meanshift;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.shirdrn.ms.clustering.common.Point;

public class ClusterMergerTest {

	private static Point converged(int id, double x) {
		Point p = new Point(id, 0, new double[] {id, 0});
		p.setCentroid(new double[] {x, 0});
		return p;
	}
	
	@Test
	public void firstFitAbsorbsWithoutMovingSeed() {
		List<Point> points = Arrays.asList(converged(0, 0), converged(1, 15), converged(2, 8));
		
		List<Cluster> clusters = new ClusterMerger(10).merge(points);
		
		assertThat(clusters).hasSize(2);
		// point 2 is nearer to seed 1 but seed 0 is found first
		assertThat(clusters.get(0).getMemberPointIds()).containsExactly(0, 2);
		assertThat(clusters.get(0).getCentroid()).containsExactly(0, 0);
		assertThat(clusters.get(0).getId()).isZero();
		assertThat(clusters.get(1).getSeedPointId()).isEqualTo(1);
		assertThat(clusters.get(1).getMemberPointIds()).containsExactly(1);
	}
	
	@Test
	public void resultDependsOnInputOrder() {
		ClusterMerger merger = new ClusterMerger(10);
		
		assertThat(merger.merge(Arrays.asList(converged(0, 0), converged(1, 8), converged(2, 16)))).hasSize(2);
		assertThat(merger.merge(Arrays.asList(converged(1, 8), converged(0, 0), converged(2, 16)))).hasSize(1);
	}
	
	@Test
	public void toleranceIsExclusive() {
		List<Cluster> clusters = new ClusterMerger(10).merge(Arrays.asList(converged(0, 0), converged(1, 10)));
		assertThat(clusters).hasSize(2);
	}
	
	@Test
	public void mergeIsRepeatable() {
		List<Point> points = Arrays.asList(converged(0, 0), converged(1, 40), converged(2, 5), 
				converged(3, 33), converged(4, 90));
		ClusterMerger merger = new ClusterMerger(30);
		
		assertThat(merger.merge(points)).hasSize(merger.merge(points).size());
		assertThat(merger.merge(points)).hasSize(3);
	}
	
	@Test
	public void emptyInput() {
		assertThat(new ClusterMerger(30).merge(Arrays.<Point>asList())).isEmpty();
	}
}
