package org.livestack.stackj.internal;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Assert;
import org.junit.Test;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionNotification;

public class TestSignalingQueue {

   private static Image frame(String origin) {
      Image image = new Image(2, 2, new float[4]);
      image.setOrigin(origin);
      return image;
   }

   @Test
   public void testEveryPushAndPopIsSignaled() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      NotificationRecorder recorder = new NotificationRecorder();
      handler.addListener(recorder);
      SignalingQueue queue = new SignalingQueue("test", handler);
      for (int i = 0; i < 5; i++) {
         queue.push(frame("f" + i));
      }
      for (int i = 0; i < 3; i++) {
         queue.pop();
      }
      handler.shutdown();

      List<SessionNotification> sizes = recorder.matching(SessionNotification.Queue.class,
            SessionNotification.Queue.SIZE_CHANGED);
      Assert.assertEquals(8, sizes.size());
      int[] expected = {1, 2, 3, 4, 5, 4, 3, 2};
      for (int i = 0; i < expected.length; i++) {
         Assert.assertEquals(expected[i], sizes.get(i).getValue());
         Assert.assertEquals("test", sizes.get(i).source_);
      }
      Assert.assertEquals(queue.size(), sizes.get(sizes.size() - 1).getValue());
   }

   @Test
   public void testFifoOrder() throws Exception {
      SignalingQueue queue = new SignalingQueue("test", null);
      queue.push(frame("a"));
      queue.push(frame("b"));
      queue.push(frame("c"));
      Assert.assertEquals("a", queue.pop().getOrigin());
      Assert.assertEquals("b", queue.pop().getOrigin());
      Assert.assertEquals("c", queue.pop().getOrigin());
      Assert.assertTrue(queue.isEmpty());
   }

   @Test
   public void testTimedPopReturnsNullWhenEmpty() throws Exception {
      SignalingQueue queue = new SignalingQueue("test", null);
      long start = System.currentTimeMillis();
      Assert.assertNull(queue.pop(50, TimeUnit.MILLISECONDS));
      Assert.assertTrue(System.currentTimeMillis() - start >= 40);
   }

   @Test
   public void testPopBlocksUntilPush() throws Exception {
      SignalingQueue queue = new SignalingQueue("test", null);
      AtomicReference<Image> popped = new AtomicReference<>();
      CountDownLatch done = new CountDownLatch(1);
      Thread consumer = new Thread(() -> {
         try {
            popped.set(queue.pop());
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
         }
         done.countDown();
      });
      consumer.start();
      Assert.assertFalse(done.await(100, TimeUnit.MILLISECONDS));
      queue.push(frame("late"));
      Assert.assertTrue(done.await(2, TimeUnit.SECONDS));
      Assert.assertEquals("late", popped.get().getOrigin());
   }

   @Test
   public void testPurgeEndsWithSizeZero() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      NotificationRecorder recorder = new NotificationRecorder();
      handler.addListener(recorder);
      SignalingQueue queue = new SignalingQueue("test", handler);
      queue.push(frame("a"));
      queue.push(frame("b"));
      queue.purge();
      handler.shutdown();

      Assert.assertEquals(0, queue.size());
      List<SessionNotification> sizes = recorder.matching(SessionNotification.Queue.class,
            SessionNotification.Queue.SIZE_CHANGED);
      Assert.assertEquals(3, sizes.size());
      Assert.assertEquals(0, sizes.get(2).getValue());
   }
}
