package org.shirdrn.ms.clustering.meanshift;

import org.shirdrn.ms.clustering.common.Point;

/**
 * Outcome of shifting a single point until it stabilized.
 */
public class Convergence {

	public enum Status {
		/** Centroid moved less than the convergence tolerance. */
		CONVERGED,
		/** No neighbour within bandwidth, centroid kept from the last iteration. */
		ISOLATED,
		/** Iteration cap hit, centroid is the last computed estimate. */
		MAX_ITERATIONS_REACHED
	}
	
	private final Point point;
	private final int iterations;
	private final Status status;
	
	public Convergence(Point point, int iterations, Status status) {
		super();
		this.point = point;
		this.iterations = iterations;
		this.status = status;
	}

	public Point getPoint() {
		return point;
	}

	/**
	 * Number of neighbour scans performed.
	 */
	public int getIterations() {
		return iterations;
	}

	public Status getStatus() {
		return status;
	}
	
	@Override
	public String toString() {
		return "Convergence[pointId=" + point.getId() + ", status=" + status + ", iterations=" + iterations + "]";
	}
}
