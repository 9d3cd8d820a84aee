package org.shirdrn.ms.clustering.common.utils;

import org.shirdrn.ms.clustering.common.Point;

import com.google.common.base.Preconditions;

public class MetricUtils {

	/**
	 * Euclidean distance between two vectors of the same dimension.
	 * @throws IllegalArgumentException if the dimensions differ
	 */
	public static double euclideanDistance(double[] p1, double[] p2) {
		Preconditions.checkArgument(p1.length == p2.length, 
				"Dimension mismatch: %s != %s", p1.length, p2.length);
		double sum = 0.0;
		for (int i = 0; i < p1.length; i++) {
			double diff = p1[i] - p2[i];
			sum += diff * diff;
		}
		return Math.sqrt(sum);
	}
	
	/**
	 * Euclidean distance between a vector and the original coordinates of a point.
	 */
	public static double euclideanDistance(double[] vector, Point point) {
		Preconditions.checkArgument(vector.length == point.getDimension(), 
				"Dimension mismatch: %s != %s", vector.length, point.getDimension());
		double sum = 0.0;
		for (int i = 0; i < vector.length; i++) {
			double diff = vector[i] - point.getCoordinate(i);
			sum += diff * diff;
		}
		return Math.sqrt(sum);
	}
	
}
