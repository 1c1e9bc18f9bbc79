///////////////////////////////////////////////////////////////////////////////
// COPYRIGHT:    StackEngJ contributors, 2026
//
// LICENSE:      This file is distributed under the BSD license.
//               License text is included with the source distribution.
//
//               This file is distributed in the hope that it will be useful,
//               but WITHOUT ANY WARRANTY; without even the implied warranty
//               of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
//
//               IN NO EVENT SHALL THE COPYRIGHT OWNER OR
//               CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT,
//               INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES.
//
package org.livestack.stackj.main;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.api.ImageStage;
import org.livestack.stackj.api.InputScanner;
import org.livestack.stackj.api.MessageHub;
import org.livestack.stackj.api.ModelObserver;
import org.livestack.stackj.api.ScannerFactory;
import org.livestack.stackj.api.ScannerStartException;
import org.livestack.stackj.api.SessionAPI;
import org.livestack.stackj.api.SessionNotificationListener;
import org.livestack.stackj.internal.BackpressureGate;
import org.livestack.stackj.internal.NotificationHandler;
import org.livestack.stackj.internal.Pipeline;
import org.livestack.stackj.internal.SaverWorker;
import org.livestack.stackj.internal.Stacker;
import org.livestack.stackj.io.InputScanners;
import org.livestack.stackj.processing.AutoStretch;
import org.livestack.stackj.processing.ColorBalance;
import org.livestack.stackj.processing.ConvertForOutput;
import org.livestack.stackj.processing.Debayer;
import org.livestack.stackj.processing.HotPixelRemover;
import org.livestack.stackj.processing.Levels;
import org.livestack.stackj.processing.RemoveDark;
import org.livestack.stackj.processing.Standardize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the processing chain of a live stacking session and drives it:
 * input scanner, pre-process pipeline, stacker, post-process pipeline and saver.
 *
 * <p>The workers are created and started with the controller and live until
 * {@link #shutdown()}. Starting, pausing and stopping a session only controls the input
 * scanner. Results travel between workers through notifications, handled on the notification
 * thread.</p>
 */
public class SessionController implements SessionAPI {

   private static final Logger logger_ = LoggerFactory.getLogger(SessionController.class);

   public static final String STACK_IMAGE_NAME = "stack_image";
   public static final String FINAL_IMAGE_NAME = "stack_image_final";
   public static final String WEB_IMAGE_NAME = "web_image";
   public static final String WEB_IMAGE_FORMAT = "jpg";
   public static final String STACKING_RESULT_ORIGIN = "Stacking result";
   public static final String PROCESS_RESULT_ORIGIN = "Process result";

   private static final long SAVE_DRAIN_TIMEOUT_MS = 10000;

   private final SessionSettings settings_;
   private final SessionContext context_;
   private final ImageSaver saver_;
   private final MessageHub messageHub_;
   private final ScannerFactory scannerFactory_;
   private final List<ModelObserver> observers_ = new CopyOnWriteArrayList<>();

   private final RemoveDark removeDark_ = new RemoveDark();
   private final HotPixelRemover hotPixelRemover_ = new HotPixelRemover();
   private final Debayer debayer_ = new Debayer();
   private final Standardize standardize_ = new Standardize();
   private final ConvertForOutput convertForOutput_ = new ConvertForOutput();
   private final AutoStretch autoStretch_ = new AutoStretch();
   private final Levels levels_ = new Levels();
   private final ColorBalance colorBalance_ = new ColorBalance();

   private final Pipeline preProcessor_;
   private final Stacker stacker_;
   private final Pipeline postProcessor_;
   private final SaverWorker saverWorker_;
   private final BackpressureGate gate_;

   private InputScanner scanner_;
   private volatile Image lastStackResult_;
   private boolean shutdown_ = false;

   public SessionController(SessionSettings settings, ImageSaver saver, MessageHub messageHub) {
      this(settings, new SessionContext(), saver, messageHub, new InputScanners());
   }

   public SessionController(SessionSettings settings, SessionContext context, ImageSaver saver,
                            MessageHub messageHub, ScannerFactory scannerFactory) {
      settings_ = settings;
      context_ = context;
      saver_ = saver;
      messageHub_ = messageHub;
      scannerFactory_ = scannerFactory;
      NotificationHandler notificationHandler = context.getNotificationHandler();

      if (settings.getDarkPath() != null) {
         removeDark_.loadDark(settings.getDarkPath());
      }
      List<ImageStage> preStages = Arrays.asList(removeDark_, hotPixelRemover_, debayer_,
            standardize_);
      preProcessor_ = new Pipeline(SessionContext.PRE_PROCESS, context.getPreProcessQueue(),
            preStages, notificationHandler);

      stacker_ = new Stacker(context.getStackerQueue(), notificationHandler);
      stacker_.setStackingMode(settings.getStackingMode());
      stacker_.setAlignBeforeStack(settings.isAlignBeforeStack());

      List<ImageStage> postStages = Arrays.asList(convertForOutput_);
      postProcessor_ = new Pipeline(SessionContext.POST_PROCESS,
            context.getPostProcessQueue(), postStages, notificationHandler);
      postProcessor_.addStage(autoStretch_);
      postProcessor_.addStage(levels_);
      postProcessor_.addStage(colorBalance_);

      saverWorker_ = new SaverWorker(context.getSaverQueue(), saver, notificationHandler);
      gate_ = new BackpressureGate(context, preProcessor_, stacker_);

      notificationHandler.addListener(this::handleNotification);
      saver_.initialize(settings.toJSON());

      preProcessor_.start();
      stacker_.start();
      postProcessor_.start();
      saverWorker_.start();
   }

   private void handleNotification(SessionNotification n) {
      if (n.is(SessionNotification.Worker.class, SessionNotification.Worker.NEW_RESULT)) {
         if (SessionContext.PRE_PROCESS.equals(n.source_)) {
            context_.getStackerQueue().push(n.getImage());
         } else if (SessionContext.STACKER.equals(n.source_)) {
            onStackResult(n.getImage());
         } else if (SessionContext.POST_PROCESS.equals(n.source_)) {
            onPostProcessResult(n.getImage());
         }
      } else if (n.is(SessionNotification.Worker.class, SessionNotification.Worker.BUSY)) {
         context_.setBusy(n.source_, true);
         notifyObservers(false);
      } else if (n.is(SessionNotification.Worker.class, SessionNotification.Worker.WAITING)) {
         context_.setBusy(n.source_, false);
         notifyObservers(false);
      } else if (n.is(SessionNotification.Worker.class, SessionNotification.Worker.ERROR)) {
         messageHub_.dispatchError("Error in {} : {}", n.source_, n.getMessage());
      } else if (n.is(SessionNotification.Stack.class, SessionNotification.Stack.SIZE_CHANGED)) {
         context_.setStackSize(n.getValue());
         notifyObservers(false);
      } else if (n.is(SessionNotification.Stack.class,
            SessionNotification.Stack.ALIGNMENT_FAILED)) {
         context_.setHasNewWarnings(true);
         messageHub_.dispatchWarning("Image could not be aligned : {}", n.getMessage());
      } else if (n.is(SessionNotification.Queue.class, SessionNotification.Queue.SIZE_CHANGED)
            || n.is(SessionNotification.Status.class,
            SessionNotification.Status.STATUS_CHANGED)) {
         notifyObservers(false);
      }
   }

   private void onStackResult(Image result) {
      result.setOrigin(STACKING_RESULT_ORIGIN);
      lastStackResult_ = result;
      // only the latest stack result is worth post-processing
      context_.getPostProcessQueue().purge();
      context_.getPostProcessQueue().push(result.copy());
   }

   private void onPostProcessResult(Image result) {
      result.setOrigin(PROCESS_RESULT_ORIGIN);
      context_.setPostProcessResult(result);
      notifyObservers(true);
      if (settings_.getWorkFolder() != null) {
         saveImage(result, settings_.getImageSaveFormat(), settings_.getWorkFolder(),
               STACK_IMAGE_NAME, false);
         if (settings_.isSaveEveryImage()) {
            saveImage(result, settings_.getImageSaveFormat(), settings_.getWorkFolder(),
                  STACK_IMAGE_NAME, true);
         }
      }
      if (settings_.getWebFolder() != null) {
         saveImage(result, WEB_IMAGE_FORMAT, settings_.getWebFolder(), WEB_IMAGE_NAME, false);
      }
   }

   private void notifyObservers(boolean imageOnly) {
      for (ModelObserver observer : observers_) {
         try {
            observer.updateDisplay(imageOnly);
         } catch (RuntimeException e) {
            logger_.error("Model observer failed", e);
         }
      }
   }

   @Override
   public synchronized void startSession() throws SessionException {
      Session session = context_.getSession();
      if (session.isRunning()) {
         logger_.debug("Start requested while session already running");
         return;
      }
      if (session.isStopped()) {
         messageHub_.dispatchInfo("Starting new session...");
         checkFolder("Work folder", settings_.getWorkFolder());
         if (SessionSettings.INPUT_FOLDER.equals(settings_.getInputSystem())) {
            checkFolder("Scan folder", settings_.getScanFolder());
         }
         try {
            scanner_ = scannerFactory_.createScanner(settings_);
         } catch (IllegalArgumentException e) {
            throw reportError(new SessionException("Input system not supported",
                  e.getMessage(), e));
         }
         scanner_.setBackpressureGate(gate_);
         scanner_.setImageListener(context_.getPreProcessQueue()::push);
         scanner_.setMessageHub(messageHub_);
         context_.setHasNewWarnings(false);
      } else {
         messageHub_.dispatchInfo("Restarting input scanner ...");
      }
      try {
         scanner_.start();
      } catch (ScannerStartException e) {
         scanner_.stop();
         throw reportError(new SessionException("Input scanner could not start",
               e.getMessage(), e));
      }
      messageHub_.dispatchInfo("Input scanner started");
      session.setStatus(SessionStatus.RUNNING);
      messageHub_.dispatchInfo("Session running in mode {} with alignment {}",
            stacker_.getStackingMode(), stacker_.isAlignBeforeStack());
   }

   private void checkFolder(String role, String folder) throws SessionException {
      if (folder == null || !Files.isDirectory(Paths.get(folder))) {
         throw reportError(new CriticalFolderMissingException(role + " is missing",
               role + " " + folder + " does not exist"));
      }
   }

   private SessionException reportError(SessionException e) {
      logger_.warn(e.getMessage());
      messageHub_.dispatchError("Session error. {} : {}", e.getTitle(), e.getDetails());
      return e;
   }

   @Override
   public synchronized void pauseSession() {
      Session session = context_.getSession();
      if (!session.isRunning()) {
         logger_.debug("Pause requested while session is {}", session.getStatus());
         return;
      }
      stopScanner();
      session.setStatus(SessionStatus.PAUSED);
      messageHub_.dispatchInfo("Session paused");
   }

   @Override
   public synchronized void stopSession() {
      Session session = context_.getSession();
      if (session.isStopped()) {
         logger_.debug("Stop requested while session already stopped");
         return;
      }
      // status first, so a scanner waiting on the gate lets go
      session.setStatus(SessionStatus.STOPPED);
      stopScanner();
      context_.getPreProcessQueue().purge();
      context_.getStackerQueue().purge();
      context_.getPostProcessQueue().purge();
      messageHub_.dispatchInfo("Session stopped");
   }

   private void stopScanner() {
      if (scanner_ != null) {
         scanner_.stop();
         messageHub_.dispatchInfo("Input scanner stopped");
      }
   }

   @Override
   public void resetStack() {
      stacker_.reset();
   }

   @Override
   public void applyProcessing() {
      Image last = lastStackResult_;
      if (last == null || stacker_.size() == 0) {
         return;
      }
      if (!context_.getPostProcessQueue().isEmpty()) {
         logger_.debug("Post-processing busy, not applying processing");
         return;
      }
      context_.getPostProcessQueue().push(last.copy());
   }

   /**
    * Queue a copy of an image for saving as folder/baseName[-timestamp].format
    *
    * @return the destination
    */
   public String saveImage(Image image, String format, String folder, String baseName,
                           boolean addTimestamp) {
      String fileName = baseName;
      if (addTimestamp) {
         fileName += "-" + new SimpleDateFormat("yyyy-MM-dd-HH-mm-ss-SSS").format(new Date());
      }
      String destination = Paths.get(folder, fileName + "." + format).toString();
      Image copy = image.copy();
      copy.setDestination(destination);
      context_.getSaverQueue().push(copy);
      return destination;
   }

   @Override
   public void saveFinalImage() {
      Image image = context_.getPostProcessResult();
      if (image == null || settings_.getWorkFolder() == null) {
         messageHub_.dispatchWarning("No processed image to save");
         return;
      }
      saveImage(image, settings_.getImageSaveFormat(), settings_.getWorkFolder(),
            FINAL_IMAGE_NAME, true);
   }

   @Override
   public synchronized void shutdown() {
      if (shutdown_) {
         return;
      }
      shutdown_ = true;
      stopSession();
      preProcessor_.join();
      stacker_.join();
      postProcessor_.join();
      try {
         // the last post-process result reaches the saver queue on the notification thread
         if (!context_.getNotificationHandler().flush(SAVE_DRAIN_TIMEOUT_MS,
               TimeUnit.MILLISECONDS)) {
            logger_.warn("Pending notifications not delivered before shutdown");
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
      }
      long deadline = System.currentTimeMillis() + SAVE_DRAIN_TIMEOUT_MS;
      while ((!context_.getSaverQueue().isEmpty() || saverWorker_.isBusy())
            && System.currentTimeMillis() < deadline) {
         try {
            Thread.sleep(10);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            break;
         }
      }
      saverWorker_.join();
      saver_.finish();
      context_.getNotificationHandler().shutdown();
      logger_.info("Session controller shut down");
   }

   @Override
   public SessionStatus getStatus() {
      return context_.getSession().getStatus();
   }

   @Override
   public int getStackSize() {
      return stacker_.size();
   }

   @Override
   public Image getPostProcessResult() {
      return context_.getPostProcessResult();
   }

   @Override
   public void setStackingMode(String mode) {
      stacker_.setStackingMode(mode);
      settings_.setStackingMode(mode);
   }

   @Override
   public String getStackingMode() {
      return stacker_.getStackingMode();
   }

   @Override
   public void setAlignBeforeStack(boolean align) {
      stacker_.setAlignBeforeStack(align);
      settings_.setAlignBeforeStack(align);
   }

   @Override
   public boolean isAlignBeforeStack() {
      return stacker_.isAlignBeforeStack();
   }

   @Override
   public void setSaveEveryImage(boolean save) {
      settings_.setSaveEveryImage(save);
   }

   @Override
   public boolean isSaveEveryImage() {
      return settings_.isSaveEveryImage();
   }

   @Override
   public void addSessionNotificationListener(SessionNotificationListener listener) {
      context_.getNotificationHandler().addListener(listener);
   }

   @Override
   public void addModelObserver(ModelObserver observer) {
      observers_.add(observer);
   }

   @Override
   public void removeModelObserver(ModelObserver observer) {
      observers_.remove(observer);
   }

   public SessionContext getContext() {
      return context_;
   }

   public Stacker getStacker() {
      return stacker_;
   }

   public RemoveDark getRemoveDark() {
      return removeDark_;
   }

   public HotPixelRemover getHotPixelRemover() {
      return hotPixelRemover_;
   }

   public AutoStretch getAutoStretch() {
      return autoStretch_;
   }

   public Levels getLevels() {
      return levels_;
   }

   public ColorBalance getColorBalance() {
      return colorBalance_;
   }
}
