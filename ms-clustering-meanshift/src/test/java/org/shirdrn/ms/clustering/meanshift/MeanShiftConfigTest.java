package org.shirdrn.ms.clustering.meanshift;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class MeanShiftConfigTest {

	@Test
	public void defaults() {
		MeanShiftConfig config = MeanShiftConfig.defaults();
		
		assertThat(config.getBandwidth()).isEqualTo(1600.0);
		assertThat(config.getConvergenceTolerance()).isEqualTo(10.0);
		assertThat(config.getMergeTolerance()).isEqualTo(30.0);
		assertThat(config.getSubsetSize()).isEqualTo(100);
		assertThat(config.getParallism()).isEqualTo(8);
		assertThat(config.getMaxIterations()).isEqualTo(300);
	}
	
	@Test
	public void fromPropertiesOverridesPresentKeys() {
		Properties props = new Properties();
		props.setProperty(MeanShiftConfig.BANDWIDTH, "800");
		props.setProperty(MeanShiftConfig.PARALLISM, " 2 ");
		
		MeanShiftConfig config = MeanShiftConfig.fromProperties(props);
		
		assertThat(config.getBandwidth()).isEqualTo(800.0);
		assertThat(config.getParallism()).isEqualTo(2);
		assertThat(config.getMergeTolerance()).isEqualTo(30.0);
	}
	
	@Test
	public void rejectsInvalidValues() {
		Properties props = new Properties();
		props.setProperty(MeanShiftConfig.SUBSET_SIZE, "many");
		assertThatThrownBy(() -> MeanShiftConfig.fromProperties(props))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining(MeanShiftConfig.SUBSET_SIZE);
		
		assertThatThrownBy(() -> MeanShiftConfig.builder().bandwidth(-1).build())
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> MeanShiftConfig.builder().maxIterations(0).build())
			.isInstanceOf(IllegalArgumentException.class);
	}
	
	@Test
	public void loadsClasspathConfigWithSystemOverrides() {
		System.setProperty(MeanShiftConfig.MERGE_TOLERANCE, "45");
		try {
			MeanShiftConfig config = MeanShiftClustering.loadConfig();
			assertThat(config.getBandwidth()).isEqualTo(1600.0);
			assertThat(config.getMergeTolerance()).isEqualTo(45.0);
		} finally {
			System.clearProperty(MeanShiftConfig.MERGE_TOLERANCE);
		}
	}
}
