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
package org.livestack.stackj.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the threading of a worker that pulls images from one signaling queue and
 * processes them one at a time on its own thread.
 *
 * <p>Every image is bracketed by a busy and a waiting notification. A processing failure is
 * logged and reported as a worker error, then the worker moves on to the next image.</p>
 */
public abstract class QueueWorker {

   private static final Logger logger_ = LoggerFactory.getLogger(QueueWorker.class);

   static final long POLL_INTERVAL_MS = 100;

   private final String name_;
   protected final SignalingQueue inbox_;
   protected final NotificationHandler notificationHandler_;
   private final ExecutorService executor_;
   private final AtomicBoolean running_ = new AtomicBoolean(false);
   private volatile boolean busy_ = false;

   protected QueueWorker(String name, SignalingQueue inbox,
                         NotificationHandler notificationHandler) {
      name_ = name;
      inbox_ = inbox;
      notificationHandler_ = notificationHandler;
      executor_ = Executors.newSingleThreadExecutor(r -> new Thread(r, name + " thread"));
   }

   /**
    * Do the work for one image. Results are handed on with {@link #publishResult(Image)}.
    */
   protected abstract void processImage(Image image);

   public String getName() {
      return name_;
   }

   public SignalingQueue getInbox() {
      return inbox_;
   }

   public boolean isBusy() {
      return busy_;
   }

   /**
    * @return true when the inbox is empty and no image is being processed, read atomically
    * with respect to the worker taking its next image
    */
   public boolean isIdle() {
      synchronized (inbox_) {
         return inbox_.isEmpty() && !busy_;
      }
   }

   public boolean isRunning() {
      return running_.get();
   }

   public void start() {
      if (!running_.compareAndSet(false, true)) {
         return;
      }
      logger_.debug("Starting {}", name_);
      executor_.submit(this::run);
   }

   /**
    * Ask the worker to exit once the current image is done. Returns immediately.
    */
   public void stop() {
      running_.set(false);
   }

   /**
    * Stop and wait for the worker thread to exit
    */
   public void join() {
      stop();
      executor_.shutdown();
      try {
         if (!executor_.awaitTermination(30, TimeUnit.SECONDS)) {
            logger_.warn("{} did not stop in time", name_);
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
      }
   }

   protected void publishResult(Image result) {
      post(SessionNotification.createNewResultNotification(name_, result));
   }

   protected void post(SessionNotification notification) {
      if (notificationHandler_ != null) {
         notificationHandler_.postNotification(notification);
      }
   }

   private void run() {
      while (running_.get()) {
         Image image;
         try {
            // taking the image and turning busy on happen under the inbox lock, so an
            // observer holding that lock never sees an empty queue and an idle worker
            // while an image is in flight
            synchronized (inbox_) {
               image = inbox_.pop(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
               if (image != null) {
                  busy_ = true;
               }
            }
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            break;
         }
         if (image == null) {
            continue;
         }
         post(SessionNotification.createBusyNotification(name_));
         try {
            processImage(image);
         } catch (RuntimeException e) {
            logger_.error(name_ + " failed to process " + image, e);
            post(SessionNotification.createWorkerErrorNotification(name_,
                  e.getMessage() == null ? e.toString() : e.getMessage()));
         } finally {
            busy_ = false;
            post(SessionNotification.createWaitingNotification(name_));
         }
      }
      running_.set(false);
      logger_.debug("{} stopped", name_);
   }
}
