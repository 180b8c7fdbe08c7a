package com.hydrowatch.detection.config;

import com.hydrowatch.detection.classify.AnomalyClassifier;
import com.hydrowatch.detection.contamination.ContaminationAnalyzer;
import com.hydrowatch.detection.engine.DetectionOrchestrator;
import com.hydrowatch.detection.leak.LeakAnalyzer;
import com.hydrowatch.detection.maintenance.MaintenanceEstimator;
import com.hydrowatch.detection.maintenance.RegressionForest;
import com.hydrowatch.detection.outlier.IsolationForest;
import com.hydrowatch.detection.outlier.OutlierModel;
import com.hydrowatch.detection.persistence.FileModelStore;
import com.hydrowatch.detection.persistence.InMemoryModelStore;
import com.hydrowatch.detection.persistence.ModelStore;
import com.hydrowatch.detection.quality.WaterQualityScorer;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the detection core; model settings come from {@code hydrowatch.models.*}. */
@Configuration
public class DetectionConfig {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  @Bean
  public ModelStore modelStore(@Value("${hydrowatch.models.persist:true}") boolean persist,
                               @Value("${hydrowatch.models.dir:./models}") String dir) {
    if (!persist) {
      log.info("Model persistence disabled, keeping models in memory");
      return new InMemoryModelStore();
    }
    log.info("Model files under {}", Path.of(dir).toAbsolutePath());
    return new FileModelStore(Path.of(dir));
  }

  @Bean
  public OutlierModel outlierModel(ModelStore store,
                                   @Value("${hydrowatch.models.outlier.trees:100}") int trees,
                                   @Value("${hydrowatch.models.outlier.max-samples:256}") int maxSamples,
                                   @Value("${hydrowatch.models.outlier.contamination:0.1}") double contamination,
                                   @Value("${hydrowatch.models.outlier.seed:42}") long seed) {
    return OutlierModel.loadOrBootstrap(
        new IsolationForest.Settings(trees, maxSamples, contamination, seed), store);
  }

  @Bean
  public MaintenanceEstimator maintenanceEstimator(ModelStore store,
                                                   @Value("${hydrowatch.models.maintenance.trees:100}") int trees,
                                                   @Value("${hydrowatch.models.maintenance.max-depth:10}") int maxDepth,
                                                   @Value("${hydrowatch.models.maintenance.min-samples-leaf:2}") int minSamplesLeaf,
                                                   @Value("${hydrowatch.models.maintenance.seed:42}") long seed) {
    return MaintenanceEstimator.loadOrBootstrap(
        new RegressionForest.Settings(trees, maxDepth, minSamplesLeaf, seed), store);
  }

  @Bean
  public AnomalyClassifier anomalyClassifier(OutlierModel outlierModel) {
    return new AnomalyClassifier(outlierModel);
  }

  @Bean
  public LeakAnalyzer leakAnalyzer() {
    return new LeakAnalyzer();
  }

  @Bean
  public ContaminationAnalyzer contaminationAnalyzer() {
    return new ContaminationAnalyzer();
  }

  @Bean
  public WaterQualityScorer waterQualityScorer() {
    return new WaterQualityScorer();
  }

  @Bean
  public DetectionOrchestrator detectionOrchestrator(OutlierModel outlierModel,
                                                     AnomalyClassifier classifier,
                                                     LeakAnalyzer leakAnalyzer,
                                                     ContaminationAnalyzer contaminationAnalyzer,
                                                     MaintenanceEstimator maintenanceEstimator,
                                                     WaterQualityScorer waterQualityScorer) {
    return new DetectionOrchestrator(outlierModel, classifier, leakAnalyzer,
        contaminationAnalyzer, maintenanceEstimator, waterQualityScorer);
  }
}
