package org.livestack.stackj.internal;

import java.util.Arrays;
import java.util.List;
import org.junit.Assert;
import org.junit.Test;
import org.livestack.stackj.api.ImageStage;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionNotification;

public class TestPipeline {

   private static Image frame(String origin) {
      Image image = new Image(2, 2, new float[]{1, 2, 3, 4});
      image.setOrigin(origin);
      return image;
   }

   private static final ImageStage DOUBLE = image -> {
      float[] samples = image.getPlane(0);
      for (int i = 0; i < samples.length; i++) {
         samples[i] *= 2;
      }
      return image;
   };

   private static final ImageStage DROP_B = image -> "b".equals(image.getOrigin()) ? null : image;

   @Test
   public void testSuppressedFrameIsNotPublished() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      NotificationRecorder recorder = new NotificationRecorder();
      handler.addListener(recorder);
      SignalingQueue inbox = new SignalingQueue("in", handler);
      Pipeline pipeline = new Pipeline("pipeline", inbox, Arrays.asList(DOUBLE, DROP_B),
            handler);
      pipeline.start();
      inbox.push(frame("a"));
      inbox.push(frame("b"));
      inbox.push(frame("c"));

      SessionNotification first = recorder.nextResult(5000);
      SessionNotification second = recorder.nextResult(5000);
      Assert.assertNotNull(first);
      Assert.assertNotNull(second);
      Assert.assertEquals("a", first.getImage().getOrigin());
      Assert.assertEquals("c", second.getImage().getOrigin());
      Assert.assertEquals(2f, first.getImage().getSample(0, 0, 0), 0f);
      Assert.assertNull(recorder.nextResult(200));

      pipeline.join();
      handler.shutdown();
      Assert.assertEquals(3, recorder.matching(SessionNotification.Worker.class,
            SessionNotification.Worker.BUSY).size());
      Assert.assertEquals(3, recorder.matching(SessionNotification.Worker.class,
            SessionNotification.Worker.WAITING).size());
   }

   @Test
   public void testFailingStageDoesNotStopThePipeline() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      NotificationRecorder recorder = new NotificationRecorder();
      handler.addListener(recorder);
      SignalingQueue inbox = new SignalingQueue("in", handler);
      ImageStage failOnB = image -> {
         if ("b".equals(image.getOrigin())) {
            throw new IllegalStateException("broken frame");
         }
         return image;
      };
      Pipeline pipeline = new Pipeline("pipeline", inbox, Arrays.asList(failOnB), handler);
      pipeline.start();
      inbox.push(frame("b"));
      inbox.push(frame("c"));

      SessionNotification result = recorder.nextResult(5000);
      Assert.assertNotNull(result);
      Assert.assertEquals("c", result.getImage().getOrigin());
      pipeline.join();
      handler.shutdown();

      List<SessionNotification> errors = recorder.matching(SessionNotification.Worker.class,
            SessionNotification.Worker.ERROR);
      Assert.assertEquals(1, errors.size());
      Assert.assertEquals("broken frame", errors.get(0).getMessage());
      Assert.assertFalse(pipeline.isBusy());
   }

   @Test
   public void testStageAddedAtRuntimeAppliesToNextFrame() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      NotificationRecorder recorder = new NotificationRecorder();
      handler.addListener(recorder);
      SignalingQueue inbox = new SignalingQueue("in", handler);
      Pipeline pipeline = new Pipeline("pipeline", inbox, null, handler);
      pipeline.start();

      inbox.push(frame("a"));
      Assert.assertEquals(1f, recorder.nextResult(5000).getImage().getSample(0, 0, 0), 0f);
      pipeline.addStage(DOUBLE);
      inbox.push(frame("b"));
      Assert.assertEquals(2f, recorder.nextResult(5000).getImage().getSample(0, 0, 0), 0f);

      pipeline.join();
      handler.shutdown();
      Assert.assertFalse(pipeline.isRunning());
   }
}
