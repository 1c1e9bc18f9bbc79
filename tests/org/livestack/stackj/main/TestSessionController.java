package org.livestack.stackj.main;

import java.io.File;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import mmcorej.org.json.JSONObject;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.api.InputScanner;
import org.livestack.stackj.api.MessageHub;
import org.livestack.stackj.api.ScannerStartException;
import org.livestack.stackj.api.UnsupportedStackingModeException;
import org.livestack.stackj.internal.BackpressureGate;
import org.livestack.stackj.internal.NotificationHandler;
import org.livestack.stackj.util.LoggingMessageHub;

public class TestSessionController {

   @Rule
   public TemporaryFolder tmp = new TemporaryFolder();

   private SessionSettings settings_;
   private FakeScanner scanner_;
   private AtomicInteger scannersCreated_;
   private RecordingSaver saver_;
   private SessionController controller_;

   /**
    * Scanner whose frames are injected by the test
    */
   private static class FakeScanner implements InputScanner {
      volatile boolean failOnStart_ = false;
      volatile boolean started_ = false;
      volatile int stopCount_ = 0;
      volatile Consumer<Image> listener_;
      volatile BackpressureGate gate_;

      @Override
      public void start() throws ScannerStartException {
         if (failOnStart_) {
            throw new ScannerStartException("no camera");
         }
         started_ = true;
      }

      @Override
      public void stop() {
         started_ = false;
         stopCount_++;
      }

      @Override
      public void setImageListener(Consumer<Image> listener) {
         listener_ = listener;
      }

      @Override
      public void setBackpressureGate(BackpressureGate gate) {
         gate_ = gate;
      }

      @Override
      public void setMessageHub(MessageHub messageHub) {
      }

      void emit(Image image) {
         listener_.accept(image);
      }
   }

   private static class RecordingSaver implements ImageSaver {
      final List<String> destinations_ = new CopyOnWriteArrayList<>();
      volatile boolean finished_ = false;

      @Override
      public void initialize(JSONObject summaryMetadata) {
      }

      @Override
      public void finish() {
         finished_ = true;
      }

      @Override
      public boolean isFinished() {
         return finished_;
      }

      @Override
      public Object putImage(Image image) {
         destinations_.add(image.getDestination());
         return null;
      }

      @Override
      public boolean anythingSaved() {
         return !destinations_.isEmpty();
      }
   }

   private static void waitFor(BooleanSupplier condition, String what) throws Exception {
      long deadline = System.currentTimeMillis() + 10000;
      while (!condition.getAsBoolean()) {
         if (System.currentTimeMillis() > deadline) {
            Assert.fail("Timed out waiting for " + what);
         }
         Thread.sleep(10);
      }
   }

   private static Image noiseFrame(Random random) {
      float[] samples = new float[32 * 32];
      for (int i = 0; i < samples.length; i++) {
         samples[i] = 1000 + random.nextFloat() * 100;
      }
      return new Image(32, 32, samples);
   }

   @Before
   public void setUp() throws Exception {
      File scan = tmp.newFolder("scan");
      File work = tmp.newFolder("work");
      settings_ = new SessionSettings();
      settings_.setScanFolder(scan.getPath());
      settings_.setWorkFolder(work.getPath());
      settings_.setAlignBeforeStack(false);
      scanner_ = new FakeScanner();
      scannersCreated_ = new AtomicInteger();
      saver_ = new RecordingSaver();
      controller_ = new SessionController(settings_, new SessionContext(), saver_,
            new LoggingMessageHub(), s -> {
               scannersCreated_.incrementAndGet();
               return scanner_;
            });
   }

   @After
   public void tearDown() {
      controller_.shutdown();
   }

   @Test
   public void testMissingWorkFolderPreventsStart() {
      settings_.setWorkFolder(new File(tmp.getRoot(), "nowhere").getPath());
      try {
         controller_.startSession();
         Assert.fail("Session started without a work folder");
      } catch (CriticalFolderMissingException e) {
         Assert.assertTrue(e.getDetails().contains("nowhere"));
      } catch (SessionException e) {
         Assert.fail("Wrong exception " + e);
      }
      Assert.assertEquals(SessionStatus.STOPPED, controller_.getStatus());
      Assert.assertEquals(0, scannersCreated_.get());
   }

   @Test
   public void testScannerFailureLeavesSessionStopped() {
      scanner_.failOnStart_ = true;
      try {
         controller_.startSession();
         Assert.fail("Session started with a broken scanner");
      } catch (SessionException e) {
         Assert.assertEquals("Input scanner could not start", e.getTitle());
      }
      Assert.assertEquals(SessionStatus.STOPPED, controller_.getStatus());
      Assert.assertEquals(1, scanner_.stopCount_);
   }

   @Test
   public void testPauseResumeAndStop() throws Exception {
      controller_.startSession();
      Assert.assertEquals(SessionStatus.RUNNING, controller_.getStatus());
      Assert.assertTrue(scanner_.started_);
      Assert.assertNotNull(scanner_.gate_);

      controller_.pauseSession();
      Assert.assertEquals(SessionStatus.PAUSED, controller_.getStatus());
      Assert.assertFalse(scanner_.started_);

      controller_.startSession();
      Assert.assertEquals(SessionStatus.RUNNING, controller_.getStatus());
      Assert.assertTrue(scanner_.started_);
      Assert.assertEquals(1, scannersCreated_.get());

      controller_.stopSession();
      Assert.assertEquals(SessionStatus.STOPPED, controller_.getStatus());
      Assert.assertFalse(scanner_.started_);

      // illegal requests are ignored
      controller_.pauseSession();
      controller_.stopSession();
      Assert.assertEquals(SessionStatus.STOPPED, controller_.getStatus());

      controller_.startSession();
      Assert.assertEquals(2, scannersCreated_.get());
   }

   @Test
   public void testFramesFlowFromScannerToSaver() throws Exception {
      Random random = new Random(11);
      controller_.startSession();
      scanner_.emit(noiseFrame(random));
      waitFor(() -> controller_.getStackSize() == 1, "first frame stacked");
      scanner_.emit(noiseFrame(random));
      waitFor(() -> controller_.getStackSize() == 2, "second frame stacked");
      waitFor(() -> controller_.getContext().getStackSize() == 2, "stack size event");
      waitFor(() -> controller_.getPostProcessResult() != null, "processed image");
      waitFor(() -> !saver_.destinations_.isEmpty(), "saved image");

      Image processed = controller_.getPostProcessResult();
      Assert.assertEquals(SessionController.PROCESS_RESULT_ORIGIN, processed.getOrigin());
      Assert.assertEquals(32, processed.getWidth());
      String expected = new File(settings_.getWorkFolder(), "stack_image.tiff").getPath();
      Assert.assertEquals(expected, saver_.destinations_.get(0));
   }

   @Test
   public void testStopKeepsStackAndResetClearsIt() throws Exception {
      Random random = new Random(5);
      controller_.startSession();
      scanner_.emit(noiseFrame(random));
      waitFor(() -> controller_.getStackSize() == 1, "frame stacked");
      controller_.stopSession();
      Assert.assertEquals(1, controller_.getStackSize());
      Assert.assertTrue(controller_.getContext().getPreProcessQueue().isEmpty());

      controller_.resetStack();
      Assert.assertEquals(0, controller_.getStackSize());
      waitFor(() -> controller_.getContext().getStackSize() == 0, "stack size event");
   }

   @Test
   public void testApplyProcessingRerunsPostProcessing() throws Exception {
      controller_.applyProcessing();
      Assert.assertTrue(controller_.getContext().getPostProcessQueue().isEmpty());

      controller_.startSession();
      scanner_.emit(noiseFrame(new Random(2)));
      waitFor(() -> saver_.destinations_.size() == 1, "first save");
      waitFor(() -> !controller_.getContext().isBusy(SessionContext.POST_PROCESS)
            && controller_.getContext().getPostProcessQueue().isEmpty(), "post-process idle");

      controller_.getLevels().setLevels(0, 1.2f, 60000);
      controller_.applyProcessing();
      waitFor(() -> saver_.destinations_.size() == 2, "second save");
   }

   @Test
   public void testSaveEveryImageAddsTimestampedCopy() throws Exception {
      controller_.setSaveEveryImage(true);
      controller_.startSession();
      scanner_.emit(noiseFrame(new Random(9)));
      waitFor(() -> saver_.destinations_.size() == 2, "both saves");
      Assert.assertTrue(saver_.destinations_.get(1).matches(
            ".*stack_image-\\d{4}-\\d{2}-\\d{2}-\\d{2}-\\d{2}-\\d{2}-\\d{3}\\.tiff"));
   }

   @Test
   public void testUnknownStackingModeIsRejected() {
      try {
         controller_.setStackingMode("brightest");
         Assert.fail("Unknown stacking mode accepted");
      } catch (UnsupportedStackingModeException e) {
         Assert.assertEquals("mean", controller_.getStackingMode());
      }
   }

   @Test
   public void testShutdownFinishesSaver() {
      controller_.shutdown();
      Assert.assertTrue(saver_.isFinished());
   }

   @Test
   public void testShutdownSavesResultStillInNotificationQueue() throws Exception {
      NotificationHandler handler = new NotificationHandler();
      CountDownLatch resultPosted = new CountDownLatch(1);
      // registered before the controller, so it holds up delivery of the result
      handler.addListener(n -> {
         if (n.is(SessionNotification.Worker.class, SessionNotification.Worker.NEW_RESULT)
               && SessionContext.POST_PROCESS.equals(n.source_)) {
            resultPosted.countDown();
            try {
               Thread.sleep(300);
            } catch (InterruptedException e) {
               Thread.currentThread().interrupt();
            }
         }
      });
      SessionContext context = new SessionContext(handler);
      RecordingSaver saver = new RecordingSaver();
      SessionController controller = new SessionController(settings_, context, saver,
            new LoggingMessageHub(), s -> scanner_);

      context.getPostProcessQueue().push(new Image(4, 4, new float[16]));
      Assert.assertTrue(resultPosted.await(5, TimeUnit.SECONDS));
      controller.shutdown();

      Assert.assertTrue(saver.finished_);
      Assert.assertEquals(1, saver.destinations_.size());
      Assert.assertTrue(saver.destinations_.get(0).contains(SessionController.STACK_IMAGE_NAME));
   }
}
