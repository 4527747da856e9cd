package kvstore.mongo;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs container-backed tests only when a Docker daemon answers. The daemon is checked
 * once per JVM; {@code -Dkvstore.containers.skip=true} skips without probing.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.DockerCondition.class)
@interface DockerAvailable {

  class DockerCondition implements ExecutionCondition {
    private static volatile ConditionEvaluationResult result;

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      if (Boolean.getBoolean("kvstore.containers.skip")) {
        return ConditionEvaluationResult.disabled("Container tests skipped by kvstore.containers.skip");
      }
      ConditionEvaluationResult cached = result;
      if (cached == null) {
        cached = checkDaemon();
        result = cached;
      }
      return cached;
    }

    private static ConditionEvaluationResult checkDaemon() {
      try {
        String version = DockerClientFactory.instance().getActiveApiVersion();
        return ConditionEvaluationResult.enabled("Docker API " + version);
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("No Docker daemon: " + t.getMessage());
      }
    }
  }
}
