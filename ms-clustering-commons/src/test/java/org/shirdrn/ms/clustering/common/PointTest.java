package org.shirdrn.ms.clustering.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class PointTest {

	@Test
	public void centroidStartsAsCopyOfCoordinates() {
		double[] values = {1, 2, 3};
		Point p = new Point(0, 7, values);
		values[0] = 100;
		
		assertThat(p.getCoordinates()).containsExactly(1, 2, 3);
		assertThat(p.getCentroid()).containsExactly(1, 2, 3);
		
		p.setCentroid(new double[] {4, 5, 6});
		assertThat(p.getCentroid()).containsExactly(4, 5, 6);
		assertThat(p.getCoordinates()).containsExactly(1, 2, 3);
	}
	
	@Test
	public void copyOwnsItsCentroid() {
		Point p = new Point(3, 1, new double[] {1, 1});
		Point copy = p.copy();
		copy.setCentroid(new double[] {9, 9});
		
		assertThat(copy.getId()).isEqualTo(3);
		assertThat(copy.getLabel()).isEqualTo(1);
		assertThat(copy).isEqualTo(p);
		assertThat(p.getCentroid()).containsExactly(1, 1);
	}
	
	@Test
	public void rejectsCentroidOfOtherDimension() {
		Point p = new Point(0, 0, new double[] {1, 1});
		assertThatThrownBy(() -> p.setCentroid(new double[] {1, 1, 1}))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Dimension mismatch");
	}
}
