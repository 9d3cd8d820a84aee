package org.shirdrn.ms.clustering.meanshift;

import java.util.List;

import org.shirdrn.ms.clustering.common.ParallelRunner;
import org.shirdrn.ms.clustering.common.Point;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Converges a batch of points concurrently. All tasks read the same immutable point list,
 * and each task shifts its own copy of the target point, so no task can observe another
 * task's centroid.
 *
 * @author yanjun
 */
public class MeanShiftRunner extends ParallelRunner<Integer, Convergence> {

	private final ImmutableList<Point> points;
	private final MeanShiftConverger converger;
	
	public MeanShiftRunner(List<Point> points, MeanShiftConverger converger, int parallism) {
		super("MEANSHIFT", parallism);
		this.points = ImmutableList.copyOf(points);
		this.converger = converger;
	}

	@Override
	protected Convergence compute(Integer index) {
		Preconditions.checkElementIndex(index, points.size(), "index");
		return converger.converge(points.get(index).copy(), points);
	}
	
	/**
	 * Converge the points at the given positions.
	 * @return results in the same order as <code>indices</code>
	 */
	public List<Convergence> converge(List<Integer> indices) {
		return run(indices);
	}

}
