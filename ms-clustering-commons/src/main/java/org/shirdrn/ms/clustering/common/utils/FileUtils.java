package org.shirdrn.ms.clustering.common.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.ms.clustering.common.ClusteringException;
import org.shirdrn.ms.clustering.common.Point;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

public class FileUtils {

	private static final Log LOG = LogFactory.getLog(FileUtils.class);
	private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults();
	
	/**
	 * Read labeled points from files, and create {@link Point} objects. Every file starts with one
	 * header line, every following line is <code>label,v1,v2,...,vD</code> of integers. Identifiers 
	 * are assigned sequentially from 0 across all files, in file order.
	 * @param points collection receiving parsed points
	 * @param files input files
	 * @throws ClusteringException when a file cannot be read, a value is not an integer or
	 *         a line has a different dimension than the first one
	 */
	public static void readPointsFromFiles(final List<Point> points, File... files) {
		int dimension = points.isEmpty() ? -1 : points.get(0).getDimension();
		int id = points.size();
		for(File file : files) {
			int lineNumber = 0;
			try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
				String line;
				while((line = reader.readLine()) != null) {
					// skip header
					if(++lineNumber == 1 || line.trim().isEmpty()) {
						continue;
					}
					List<String> a = COMMA_SPLITTER.splitToList(line);
					if(a.size() < 2) {
						throw new ClusteringException("Expected label and coordinates: file=" + file + ", line=" + lineNumber);
					}
					double[] coordinates = new double[a.size() - 1];
					for (int i = 1; i < a.size(); i++) {
						coordinates[i - 1] = Integer.parseInt(a.get(i));
					}
					if(dimension < 0) {
						dimension = coordinates.length;
					} else if(dimension != coordinates.length) {
						throw new ClusteringException("Inconsistent dimension: expected=" + dimension + 
								", actual=" + coordinates.length + ", file=" + file + ", line=" + lineNumber);
					}
					points.add(new Point(id++, Integer.parseInt(a.get(0)), coordinates));
				}
			} catch (NumberFormatException e) {
				throw new ClusteringException("Non-numeric value: file=" + file + ", line=" + lineNumber, e);
			} catch (IOException e) {
				throw new ClusteringException("Fail to read file: " + file, e);
			}
			LOG.info("Points loaded: file=" + file + ", totalPoints=" + points.size());
		}
	}
	
	public static List<Point> readPointsFromFiles(File... files) {
		List<Point> points = Lists.newArrayList();
		readPointsFromFiles(points, files);
		return points;
	}
	
}
