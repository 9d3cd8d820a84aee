package org.shirdrn.ms.clustering.common;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * A labeled point in D-dimensional space. The original <code>coordinates</code> never change
 * after construction, while <code>centroid</code> is the working position moved by a clustering
 * algorithm. A point's centroid starts as a copy of its coordinates.
 *
 * @author yanjun
 */
public class Point {

	private final int id;
	private final int label;
	private final double[] coordinates;
	private double[] centroid;

	public Point(int id, int label, double[] coordinates) {
		super();
		Preconditions.checkArgument(coordinates != null && coordinates.length > 0, "Required: coordinates.length > 0!");
		this.id = id;
		this.label = label;
		this.coordinates = coordinates.clone();
		this.centroid = coordinates.clone();
	}
	
	private Point(Point other) {
		this.id = other.id;
		this.label = other.label;
		// coordinates are never written, so sharing the array is safe
		this.coordinates = other.coordinates;
		this.centroid = other.centroid.clone();
	}

	public int getId() {
		return id;
	}

	public int getLabel() {
		return label;
	}
	
	public int getDimension() {
		return coordinates.length;
	}

	/**
	 * Returns a copy of the original coordinates.
	 */
	public double[] getCoordinates() {
		return coordinates.clone();
	}
	
	public double getCoordinate(int index) {
		return coordinates[index];
	}

	/**
	 * Returns a copy of the current centroid.
	 */
	public double[] getCentroid() {
		return centroid.clone();
	}

	public void setCentroid(double[] centroid) {
		Preconditions.checkArgument(centroid.length == coordinates.length, 
				"Dimension mismatch: centroid=" + centroid.length + ", coordinates=" + coordinates.length);
		this.centroid = centroid.clone();
	}
	
	/**
	 * Create a copy owning its own centroid, suitable for mutation by a single task.
	 */
	public Point copy() {
		return new Point(this);
	}

	@Override
	public int hashCode() {
		return 31 * id + Arrays.hashCode(coordinates);
	}

	@Override
	public boolean equals(Object obj) {
		if(this == obj) {
			return true;
		}
		if(!(obj instanceof Point)) {
			return false;
		}
		Point other = (Point) obj;
		return this.id == other.id && Arrays.equals(this.coordinates, other.coordinates);
	}

	@Override
	public String toString() {
		return "Point[id=" + id + ", label=" + label + ", dimension=" + coordinates.length + "]";
	}

}
