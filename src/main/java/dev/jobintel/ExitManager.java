package dev.jobintel;

import org.springframework.stereotype.Component;

/**
 * Manages application exit.
 * Kept separate so tests can run the application without killing the test runner.
 */
@Component
public class ExitManager {
  public void exit(int status) {
    if (!isTest()) {
      System.exit(status);
    }
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
