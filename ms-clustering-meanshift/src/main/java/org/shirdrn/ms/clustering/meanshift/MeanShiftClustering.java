package org.shirdrn.ms.clustering.meanshift;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.ms.clustering.common.AbstractClustering;
import org.shirdrn.ms.clustering.common.ClusterPoint;
import org.shirdrn.ms.clustering.common.ClusteringException;
import org.shirdrn.ms.clustering.common.GenericClusterPoint;
import org.shirdrn.ms.clustering.common.Point;
import org.shirdrn.ms.clustering.common.utils.ClusteringUtils;
import org.shirdrn.ms.clustering.common.utils.FileUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;

/**
 * Mean-shift clustering: converges the first <code>subsetSize</code> points in parallel, then
 * merges converged centroids into clusters with a greedy first-fit pass.
 *
 * @author yanjun
 */
public class MeanShiftClustering extends AbstractClustering<Point> {

	private static final Log LOG = LogFactory.getLog(MeanShiftClustering.class);
	private static final String CONFIG_RESOURCE = "meanshift.properties";
	private final MeanShiftConfig config;
	private final List<Point> allPoints = Lists.newArrayList();
	private List<Convergence> convergences = ImmutableList.of();
	private List<Cluster> clusters = ImmutableList.of();
	
	public MeanShiftClustering(MeanShiftConfig config) {
		super(config.getParallism());
		this.config = config;
		LOG.info("Config: " + config);
	}
	
	@Override
	public void initialize(Collection<Point> points) {
		if(points == null) {
			// parse sample files
			Preconditions.checkState(inputFiles != null, "inputFiles == null");
			FileUtils.readPointsFromFiles(allPoints, inputFiles);
		} else {
			allPoints.addAll(points);
		}
		LOG.info("Total points: count=" + allPoints.size());
	}
	
	public void initialize() {
		initialize(null);
	}
	
	@Override
	public void clustering() {
		Preconditions.checkState(!allPoints.isEmpty(), "No points to cluster, call initialize() first!");
		
		// converge the first N points in load order
		int subsetSize = Math.min(config.getSubsetSize(), allPoints.size());
		List<Integer> indices = ImmutableList.copyOf(
				ContiguousSet.create(Range.closedOpen(0, subsetSize), DiscreteDomain.integers()));
		LOG.info("START converging: subsetSize=" + subsetSize + ", totalPoints=" + allPoints.size());
		
		MeanShiftRunner runner = new MeanShiftRunner(allPoints, new MeanShiftConverger(config), parallism);
		try {
			convergences = runner.converge(indices);
		} finally {
			runner.shutdown();
		}
		
		List<Point> convergedPoints = Lists.newArrayListWithCapacity(convergences.size());
		Map<Integer, Point> pointsById = Maps.newHashMap();
		int capped = 0;
		for(Convergence c : convergences) {
			convergedPoints.add(c.getPoint());
			pointsById.put(c.getPoint().getId(), c.getPoint());
			if(c.getStatus() == Convergence.Status.MAX_ITERATIONS_REACHED) {
				capped++;
			}
			LOG.debug("Converged: " + c);
		}
		LOG.info("FINISH converging: points=" + convergences.size() + ", iterationCapReached=" + capped);
		
		// merge converged centroids
		clusters = new ClusterMerger(config.getMergeTolerance()).merge(convergedPoints);
		clusteredPoints.clear();
		for(Cluster cluster : clusters) {
			Set<ClusterPoint<Point>> set = Sets.newLinkedHashSet();
			for(int pointId : cluster.getMemberPointIds()) {
				set.add(new GenericClusterPoint(pointsById.get(pointId), cluster.getId()));
			}
			clusteredPoints.put(cluster.getId(), set);
		}
		LOG.info("Finished clustering: clusterCount=" + clusters.size());
	}
	
	public List<Cluster> getClusters() {
		return clusters;
	}
	
	public List<Convergence> getConvergences() {
		return convergences;
	}
	
	public MeanShiftConfig getConfig() {
		return config;
	}
	
	/**
	 * Load <code>meanshift.properties</code> from the classpath, overridden by system properties.
	 */
	static MeanShiftConfig loadConfig() {
		Properties props = new Properties();
		try (InputStream in = MeanShiftClustering.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
			if(in != null) {
				props.load(in);
			}
		} catch (IOException e) {
			throw new ClusteringException("Fail to load config: " + CONFIG_RESOURCE, e);
		}
		for(String key : System.getProperties().stringPropertyNames()) {
			if(key.startsWith("meanshift.")) {
				props.setProperty(key, System.getProperty(key));
			}
		}
		return MeanShiftConfig.fromProperties(props);
	}
	
	public static void main(String[] args) {
		File input = new File(args.length > 0 ? args[0] : "mnist_test.csv");
		MeanShiftClustering c = new MeanShiftClustering(loadConfig());
		c.setInputFiles(input);
		c.initialize();
		c.clustering();
		
		LOG.info("Cluster summary (id,size,label):" + System.lineSeparator() + 
				ClusteringUtils.formatClusterSummary(c.getClusteringResult().getClusteredPoints()));
		System.out.println("Total number of clusters: " + c.getClusteredCount());
	}

}
