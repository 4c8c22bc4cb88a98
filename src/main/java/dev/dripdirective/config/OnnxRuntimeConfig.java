package dev.dripdirective.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Initializes the ONNX Runtime environment with bounded threading before the embedding model bean
 * is created.
 *
 * <p>Runs as a {@link BeanFactoryPostProcessor} because {@code
 * BgeSmallEnV15QuantizedEmbeddingModel} calls {@code OrtEnvironment.getEnvironment()} in its static
 * initializer, and the environment is a process-wide singleton that cannot be reconfigured later.
 * Two intra-op threads keep query embedding from starving the similarity search executor.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final int INTRA_OP_THREADS = 2;
  static final int INTER_OP_THREADS = 1;

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(INTRA_OP_THREADS);
      threadingOptions.setGlobalInterOpNumThreads(INTER_OP_THREADS);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "drip-directive", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          INTRA_OP_THREADS,
          INTER_OP_THREADS);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
