package dev.candor.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Initializes the ONNX Runtime environment before the embedding model bean is created.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, and the bge-small model's static initializer creates it. Running as a {@link
 * BeanFactoryPostProcessor} guarantees these options win. Question deduplication embeds short texts
 * only, so the pools stay small: {@code candor.embedding.intra-op-threads} (default 2) and
 * {@code candor.embedding.inter-op-threads} (default 1), with thread spinning disabled.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 2;
  private int interOpThreads = 1;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads =
        environment.getProperty("candor.embedding.intra-op-threads", Integer.class, 2);
    interOpThreads =
        environment.getProperty("candor.embedding.inter-op-threads", Integer.class, 1);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "candor", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
