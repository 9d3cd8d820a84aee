package org.shirdrn.ms.clustering.meanshift;

import com.google.common.base.Preconditions;

/**
 * Gaussian kernel with a fixed bandwidth <code>h</code>:
 * <pre>
 * K(d) = 1 / (h * sqrt(2 * PI)) * exp(-0.5 * (d / h)^2)
 * </pre>
 *
 * @author yanjun
 */
public class GaussianKernel {

	private final double bandwidth;
	private final double normalizer;
	
	public GaussianKernel(double bandwidth) {
		Preconditions.checkArgument(bandwidth > 0, "Required: bandwidth > 0!");
		this.bandwidth = bandwidth;
		this.normalizer = 1.0 / (bandwidth * Math.sqrt(2 * Math.PI));
	}
	
	public double weight(double distance) {
		double u = distance / bandwidth;
		return normalizer * Math.exp(-0.5 * u * u);
	}
	
	public double getBandwidth() {
		return bandwidth;
	}
	
	@Override
	public String toString() {
		return "GaussianKernel[bandwidth=" + bandwidth + "]";
	}
}
