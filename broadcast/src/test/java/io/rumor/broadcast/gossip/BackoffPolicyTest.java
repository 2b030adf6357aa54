package io.rumor.broadcast.gossip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.rumor.broadcast.BaseTest;
import io.rumor.broadcast.BroadcastConfig;
import org.junit.jupiter.api.Test;

public class BackoffPolicyTest extends BaseTest {

  @Test
  public void testGrowsExponentiallyUpToCap() {
    BackoffPolicy policy = new BackoffPolicy(100, 1000, 2.0);

    assertEquals(100, policy.delay(0));
    assertEquals(200, policy.delay(1));
    assertEquals(400, policy.delay(2));
    assertEquals(800, policy.delay(3));
    assertEquals(1000, policy.delay(4));
    assertEquals(1000, policy.delay(1000));
  }

  @Test
  public void testDelayNeverDecreases() {
    BackoffPolicy policy = BackoffPolicy.from(BroadcastConfig.defaultConfig());
    long previous = 0;
    for (int attempts = 0; attempts < 200; attempts++) {
      long delay = policy.delay(attempts);
      assertTrue(delay >= previous, "attempt " + attempts + ": " + delay + " < " + previous);
      assertTrue(delay <= BroadcastConfig.DEFAULT_RETRY_MAX_DELAY);
      previous = delay;
    }
  }

  @Test
  public void testMultiplierOfOneGivesConstantDelay() {
    BackoffPolicy policy = new BackoffPolicy(250, 1000, 1.0);

    assertEquals(250, policy.delay(0));
    assertEquals(250, policy.delay(10));
  }
}
