package dev.resumetailor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ends the process with the run's exit status.
 * Kept as a bean so tests can replace it instead of killing the test runner.
 */
@Slf4j
@Component
public class ExitManager {
  public void exit(int status) {
    if (isTest()) {
      log.debug("Test runner detected, not exiting with status {}", status);
      return;
    }
    log.info("Tailoring finished, exiting with status {}", status);
    halt(status);
  }

  protected void halt(int status) {
    System.exit(status);
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
