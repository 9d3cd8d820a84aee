package org.shirdrn.ms.clustering.common;


public class GenericClusterPoint implements ClusterPoint<Point> {

	private int clusterId;
	private final Point point;
	
	public GenericClusterPoint(Point point, int clusterId) {
		this.point = point;
		this.clusterId = clusterId;
	}
	
	@Override
	public Point getPoint() {
		return point;
	}

	@Override
	public int getClusterId() {
		return clusterId;
	}

	@Override
	public void setClusterId(int clusterId) {
		this.clusterId = clusterId;
	}
	
	@Override
	public int hashCode() {
		return point.hashCode();
	}
	
	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof GenericClusterPoint)) {
			return false;
		}
		GenericClusterPoint other = (GenericClusterPoint) obj;
		return point.equals(other.point);
	}
	
	@Override
	public String toString() {
		return point.getId() + "=>" + clusterId;
	}

}
