package org.shirdrn.ms.clustering.common;

public interface ClusterPoint<P> {

	P getPoint();
	
	int getClusterId();
	
	void setClusterId(int clusterId);
}
