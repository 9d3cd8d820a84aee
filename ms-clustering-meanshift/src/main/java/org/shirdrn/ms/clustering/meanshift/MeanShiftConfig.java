package org.shirdrn.ms.clustering.meanshift;

import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Immutable parameters of a mean-shift clustering run.
 *
 * @author yanjun
 */
public final class MeanShiftConfig {

	public static final String BANDWIDTH = "meanshift.bandwidth";
	public static final String CONVERGENCE_TOLERANCE = "meanshift.convergence.tolerance";
	public static final String MERGE_TOLERANCE = "meanshift.merge.tolerance";
	public static final String SUBSET_SIZE = "meanshift.subset.size";
	public static final String PARALLISM = "meanshift.parallism";
	public static final String MAX_ITERATIONS = "meanshift.max.iterations";
	
	private final double bandwidth;
	private final double convergenceTolerance;
	private final double mergeTolerance;
	private final int subsetSize;
	private final int parallism;
	private final int maxIterations;
	
	private MeanShiftConfig(Builder builder) {
		this.bandwidth = builder.bandwidth;
		this.convergenceTolerance = builder.convergenceTolerance;
		this.mergeTolerance = builder.mergeTolerance;
		this.subsetSize = builder.subsetSize;
		this.parallism = builder.parallism;
		this.maxIterations = builder.maxIterations;
	}
	
	public static MeanShiftConfig defaults() {
		return builder().build();
	}
	
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Build a config from properties. Missing keys keep their default values.
	 * @throws IllegalArgumentException if a value is not a number, or out of range
	 */
	public static MeanShiftConfig fromProperties(Properties props) {
		Builder builder = builder();
		String value = props.getProperty(BANDWIDTH);
		if(value != null) {
			builder.bandwidth(parseDouble(BANDWIDTH, value));
		}
		value = props.getProperty(CONVERGENCE_TOLERANCE);
		if(value != null) {
			builder.convergenceTolerance(parseDouble(CONVERGENCE_TOLERANCE, value));
		}
		value = props.getProperty(MERGE_TOLERANCE);
		if(value != null) {
			builder.mergeTolerance(parseDouble(MERGE_TOLERANCE, value));
		}
		value = props.getProperty(SUBSET_SIZE);
		if(value != null) {
			builder.subsetSize(parseInt(SUBSET_SIZE, value));
		}
		value = props.getProperty(PARALLISM);
		if(value != null) {
			builder.parallism(parseInt(PARALLISM, value));
		}
		value = props.getProperty(MAX_ITERATIONS);
		if(value != null) {
			builder.maxIterations(parseInt(MAX_ITERATIONS, value));
		}
		return builder.build();
	}
	
	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number: " + key + "=" + value, e);
		}
	}
	
	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer: " + key + "=" + value, e);
		}
	}

	public double getBandwidth() {
		return bandwidth;
	}

	public double getConvergenceTolerance() {
		return convergenceTolerance;
	}

	public double getMergeTolerance() {
		return mergeTolerance;
	}

	public int getSubsetSize() {
		return subsetSize;
	}

	public int getParallism() {
		return parallism;
	}

	public int getMaxIterations() {
		return maxIterations;
	}
	
	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("bandwidth", bandwidth)
				.add("convergenceTolerance", convergenceTolerance)
				.add("mergeTolerance", mergeTolerance)
				.add("subsetSize", subsetSize)
				.add("parallism", parallism)
				.add("maxIterations", maxIterations)
				.toString();
	}
	
	public static final class Builder {
		
		private double bandwidth = 1600;
		private double convergenceTolerance = 10;
		private double mergeTolerance = 30;
		private int subsetSize = 100;
		private int parallism = 8;
		private int maxIterations = 300;
		
		private Builder() {}
		
		public Builder bandwidth(double bandwidth) {
			this.bandwidth = bandwidth;
			return this;
		}
		
		public Builder convergenceTolerance(double convergenceTolerance) {
			this.convergenceTolerance = convergenceTolerance;
			return this;
		}
		
		public Builder mergeTolerance(double mergeTolerance) {
			this.mergeTolerance = mergeTolerance;
			return this;
		}
		
		public Builder subsetSize(int subsetSize) {
			this.subsetSize = subsetSize;
			return this;
		}
		
		public Builder parallism(int parallism) {
			this.parallism = parallism;
			return this;
		}
		
		public Builder maxIterations(int maxIterations) {
			this.maxIterations = maxIterations;
			return this;
		}
		
		public MeanShiftConfig build() {
			Preconditions.checkArgument(bandwidth > 0 && !Double.isInfinite(bandwidth), "Required: 0 < bandwidth < Infinity!");
			Preconditions.checkArgument(convergenceTolerance > 0 && !Double.isInfinite(convergenceTolerance), 
					"Required: 0 < convergenceTolerance < Infinity!");
			Preconditions.checkArgument(mergeTolerance > 0 && !Double.isInfinite(mergeTolerance), 
					"Required: 0 < mergeTolerance < Infinity!");
			Preconditions.checkArgument(subsetSize > 0, "Required: subsetSize > 0!");
			Preconditions.checkArgument(parallism > 0, "Required: parallism > 0!");
			Preconditions.checkArgument(maxIterations > 0, "Required: maxIterations > 0!");
			return new MeanShiftConfig(this);
		}
	}
}
