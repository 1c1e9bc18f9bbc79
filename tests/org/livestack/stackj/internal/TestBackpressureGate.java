package org.livestack.stackj.internal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionContext;
import org.livestack.stackj.main.SessionStatus;

public class TestBackpressureGate {

   private static final long POLL_MS = 20;

   private SessionContext context_;
   private BackpressureGate gate_;

   @Before
   public void setUp() {
      context_ = new SessionContext((NotificationHandler) null);
      context_.getSession().setStatus(SessionStatus.RUNNING);
      gate_ = new BackpressureGate(context_, null, null, POLL_MS);
   }

   private CountDownLatch waitInBackground(AtomicBoolean result) {
      CountDownLatch done = new CountDownLatch(1);
      new Thread(() -> {
         result.set(gate_.waitForDownstream());
         done.countDown();
      }, "gate waiter").start();
      return done;
   }

   @Test
   public void testIdleDownstreamPassesImmediately() {
      Assert.assertTrue(gate_.waitForDownstream());
   }

   @Test
   public void testBlocksWhileQueueNotEmpty() throws Exception {
      context_.getStackerQueue().push(new Image(1, 1, new float[1]));
      AtomicBoolean result = new AtomicBoolean(false);
      CountDownLatch done = waitInBackground(result);
      Assert.assertFalse(done.await(10 * POLL_MS, TimeUnit.MILLISECONDS));

      context_.getStackerQueue().pop();
      Assert.assertTrue(done.await(2, TimeUnit.SECONDS));
      Assert.assertTrue(result.get());
   }

   @Test
   public void testBlocksWhileWorkerReportedBusy() throws Exception {
      context_.setBusy(SessionContext.PRE_PROCESS, true);
      AtomicBoolean result = new AtomicBoolean(false);
      CountDownLatch done = waitInBackground(result);
      Assert.assertFalse(done.await(10 * POLL_MS, TimeUnit.MILLISECONDS));

      context_.setBusy(SessionContext.PRE_PROCESS, false);
      Assert.assertTrue(done.await(2, TimeUnit.SECONDS));
      Assert.assertTrue(result.get());
   }

   @Test
   public void testStopReleasesWaiterWithinOnePoll() throws Exception {
      context_.getPreProcessQueue().push(new Image(1, 1, new float[1]));
      AtomicBoolean result = new AtomicBoolean(true);
      CountDownLatch done = waitInBackground(result);
      Assert.assertFalse(done.await(5 * POLL_MS, TimeUnit.MILLISECONDS));

      context_.getSession().setStatus(SessionStatus.STOPPED);
      Assert.assertTrue(done.await(5 * POLL_MS, TimeUnit.MILLISECONDS));
      Assert.assertFalse(result.get());
   }

   @Test
   public void testStoppedSessionIsNeverAdmitted() {
      context_.getSession().setStatus(SessionStatus.STOPPED);
      Assert.assertFalse(gate_.waitForDownstream());
   }

   @Test
   public void testImageInFlightIsNeverSeenAsIdle() throws Exception {
      CountDownLatch started = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      QueueWorker stacker = new QueueWorker("stacker", context_.getStackerQueue(), null) {
         @Override
         protected void processImage(Image image) {
            started.countDown();
            try {
               release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
               Thread.currentThread().interrupt();
            }
         }
      };
      BackpressureGate gate = new BackpressureGate(context_, null, stacker, POLL_MS);
      stacker.start();
      try {
         context_.getStackerQueue().push(new Image(1, 1, new float[1]));
         // from the push until the worker is done, downstream must never look idle
         while (started.getCount() > 0) {
            Assert.assertFalse(gate.isDownstreamIdle());
         }
         Assert.assertFalse(gate.isDownstreamIdle());
         release.countDown();
         long deadline = System.currentTimeMillis() + 2000;
         while (!gate.isDownstreamIdle() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
         }
         Assert.assertTrue(gate.isDownstreamIdle());
      } finally {
         release.countDown();
         stacker.join();
      }
   }
}
