package org.shirdrn.ms.clustering.meanshift;

import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.ms.clustering.common.ClusteringException;
import org.shirdrn.ms.clustering.common.Point;
import org.shirdrn.ms.clustering.common.utils.MetricUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Moves one point's centroid towards the kernel-weighted mean of its neighbours until
 * the centroid stabilizes.
 * <p>
 * Each iteration uses the current centroid as the probe, and collects every other point
 * whose original coordinates lie within <code>bandwidth</code> of it. The new centroid is the
 * Gaussian-weighted mean of those coordinates, truncated towards zero to integer values.
 * The truncation matches the integer pixel domain of the input, but it biases every step
 * slightly and the bias can accumulate over iterations.
 * <p>
 * The loop ends when the centroid moves less than the convergence tolerance, when no
 * neighbour is left (isolated point), or when the iteration cap is reached.
 *
 * @author yanjun
 */
public class MeanShiftConverger {

	private static final Log LOG = LogFactory.getLog(MeanShiftConverger.class);
	private final GaussianKernel kernel;
	private final double convergenceTolerance;
	private final int maxIterations;
	
	public MeanShiftConverger(MeanShiftConfig config) {
		this(new GaussianKernel(config.getBandwidth()), config.getConvergenceTolerance(), config.getMaxIterations());
	}
	
	public MeanShiftConverger(GaussianKernel kernel, double convergenceTolerance, int maxIterations) {
		super();
		Preconditions.checkArgument(convergenceTolerance > 0, "Required: convergenceTolerance > 0!");
		Preconditions.checkArgument(maxIterations > 0, "Required: maxIterations > 0!");
		this.kernel = kernel;
		this.convergenceTolerance = convergenceTolerance;
		this.maxIterations = maxIterations;
	}
	
	/**
	 * Shift the centroid of <code>target</code> in place. Only the coordinates of
	 * <code>points</code> are read, their centroids are ignored.
	 * @param target point owned by the caller, its centroid is overwritten
	 * @param points all points, target included
	 * @throws ClusteringException if the calling thread is interrupted, the interrupt flag stays set
	 */
	public Convergence converge(Point target, List<Point> points) {
		final double bandwidth = kernel.getBandwidth();
		final int dimension = target.getDimension();
		final List<Point> neighbours = Lists.newArrayList();
		final List<Double> weights = Lists.newArrayList();
		
		int iterations = 0;
		while(iterations < maxIterations) {
			// stop once the batch owning this task has been cancelled
			if(Thread.currentThread().isInterrupted()) {
				throw new ClusteringException("Interrupted while converging: point=" + target.getId() + ", iterations=" + iterations);
			}
			++iterations;
			final double[] probe = target.getCentroid();
			
			// collect neighbours within bandwidth
			neighbours.clear();
			weights.clear();
			for(Point p : points) {
				if(p.getId() == target.getId()) {
					continue;
				}
				double distance = MetricUtils.euclideanDistance(probe, p);
				if(distance <= bandwidth) {
					neighbours.add(p);
					weights.add(kernel.weight(distance));
				}
			}
			
			if(neighbours.isEmpty()) {
				LOG.debug("Isolated: point=" + target.getId() + ", iterations=" + iterations);
				return new Convergence(target, iterations, Convergence.Status.ISOLATED);
			}
			
			// weighted mean of neighbour coordinates
			double[] numerator = new double[dimension];
			double denominator = 0.0;
			for (int i = 0; i < neighbours.size(); i++) {
				Point neighbour = neighbours.get(i);
				double weight = weights.get(i);
				denominator += weight;
				for (int j = 0; j < dimension; j++) {
					numerator[j] += weight * neighbour.getCoordinate(j);
				}
			}
			double[] shifted = new double[dimension];
			for (int j = 0; j < dimension; j++) {
				shifted[j] = (long) (numerator[j] / denominator);
			}
			
			target.setCentroid(shifted);
			double movement = MetricUtils.euclideanDistance(shifted, probe);
			LOG.debug("Shifted: point=" + target.getId() + ", iteration=" + iterations + 
					", neighbours=" + neighbours.size() + ", movement=" + movement);
			if(movement < convergenceTolerance) {
				return new Convergence(target, iterations, Convergence.Status.CONVERGED);
			}
		}
		
		LOG.warn("Iteration cap reached, keep last centroid: point=" + target.getId() + ", maxIterations=" + maxIterations);
		return new Convergence(target, iterations, Convergence.Status.MAX_ITERATIONS_REACHED);
	}
	
	public GaussianKernel getKernel() {
		return kernel;
	}
}
