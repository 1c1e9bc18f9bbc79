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
package org.livestack.stackj.io;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import mmcorej.CMMCore;
import mmcorej.TaggedImage;
import org.livestack.stackj.api.InputScanner;
import org.livestack.stackj.api.MessageHub;
import org.livestack.stackj.api.ScannerStartException;
import org.livestack.stackj.internal.BackpressureGate;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.StackEngMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds frames from a Micro-Manager camera. The camera runs a continuous sequence
 * acquisition; each time downstream is ready the newest frame in the circular buffer is
 * taken and the older ones are discarded.
 */
public class CameraScanner implements InputScanner {

   private static final Logger logger_ = LoggerFactory.getLogger(CameraScanner.class);

   private static final long IDLE_WAIT_MS = 5;

   private final CMMCore core_;
   private final String cameraDevice_;
   private final double intervalMs_;
   private volatile Consumer<Image> listener_;
   private volatile BackpressureGate gate_;
   private volatile MessageHub messageHub_;
   private volatile boolean running_ = false;
   private ExecutorService executor_;

   /**
    * @param cameraDevice camera to use, or null for the core's current camera
    */
   public CameraScanner(CMMCore core, String cameraDevice, double intervalMs) {
      core_ = core;
      cameraDevice_ = cameraDevice;
      intervalMs_ = intervalMs;
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
      messageHub_ = messageHub;
   }

   @Override
   public synchronized void start() throws ScannerStartException {
      if (running_) {
         return;
      }
      if (core_ == null) {
         throw new ScannerStartException("No Micro-Manager core available");
      }
      try {
         if (cameraDevice_ != null && !cameraDevice_.isEmpty()) {
            core_.setCameraDevice(cameraDevice_);
         }
         core_.clearCircularBuffer();
         core_.startContinuousSequenceAcquisition(intervalMs_);
      } catch (Exception e) {
         throw new ScannerStartException("Could not start camera " + cameraName(), e);
      }
      running_ = true;
      executor_ = Executors.newSingleThreadExecutor(r -> new Thread(r, "Camera scanner thread"));
      executor_.submit(this::run);
      logger_.info("Camera {} started", cameraName());
   }

   @Override
   public synchronized void stop() {
      if (executor_ == null) {
         return;
      }
      running_ = false;
      executor_.shutdownNow();
      try {
         if (!executor_.awaitTermination(10, TimeUnit.SECONDS)) {
            logger_.warn("Camera scanner thread did not stop in time");
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
      }
      executor_ = null;
      try {
         core_.stopSequenceAcquisition();
      } catch (Exception e) {
         logger_.error("Error stopping camera sequence", e);
      }
      logger_.info("Camera {} stopped", cameraName());
   }

   private void run() {
      while (running_) {
         BackpressureGate gate = gate_;
         try {
            if (gate != null && !gate.waitForDownstream()) {
               Thread.sleep(BackpressureGate.DEFAULT_POLL_INTERVAL_MS);
               continue;
            }
            if (core_.getRemainingImageCount() == 0) {
               Thread.sleep(IDLE_WAIT_MS);
               continue;
            }
            TaggedImage ti = core_.getLastTaggedImage();
            core_.clearCircularBuffer();
            Image image = Image.fromTaggedImage(ti);
            image.setOrigin("CAMERA : " + (StackEngMetadata.hasCamera(ti.tags)
                  ? StackEngMetadata.getCamera(ti.tags) : cameraName()));
            Consumer<Image> listener = listener_;
            if (listener != null) {
               listener.accept(image);
            }
         } catch (InterruptedException e) {
            return;
         } catch (Exception e) {
            logger_.warn("Could not read frame from camera " + cameraName(), e);
            if (messageHub_ != null) {
               messageHub_.dispatchError("Error reading from camera {} : {}", cameraName(),
                     e.getMessage());
            }
            try {
               Thread.sleep(intervalMs_ > 0 ? (long) intervalMs_ : 100);
            } catch (InterruptedException ie) {
               return;
            }
         }
      }
   }

   private String cameraName() {
      if (cameraDevice_ != null && !cameraDevice_.isEmpty()) {
         return cameraDevice_;
      }
      return core_ == null ? "" : core_.getCameraDevice();
   }
}
