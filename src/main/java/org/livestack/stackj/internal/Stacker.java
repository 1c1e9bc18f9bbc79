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

import org.livestack.stackj.api.Aligner;
import org.livestack.stackj.api.AlignmentException;
import org.livestack.stackj.internal.stack.FrameCombiner;
import org.livestack.stackj.internal.stack.MeanCombiner;
import org.livestack.stackj.internal.stack.PhaseCorrelationAligner;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionContext;
import org.livestack.stackj.main.SessionNotification;
import org.livestack.stackj.main.StackEngMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds incoming frames into the stack accumulator, optionally aligning each one onto the
 * current combined image first, and publishes a copy of the combined image after every fold.
 *
 * <p>Folds, resets and mode changes are serialized on one lock. A frame that cannot be
 * aligned is still stacked; a frame whose geometry differs from the stack is rejected.</p>
 */
public class Stacker extends QueueWorker {

   private static final Logger logger_ = LoggerFactory.getLogger(Stacker.class);

   private final Object accumulatorLock_ = new Object();
   private Image result_;
   private int size_ = 0;
   private FrameCombiner combiner_ = new MeanCombiner();
   private Aligner aligner_ = new PhaseCorrelationAligner();
   private volatile boolean alignBeforeStack_ = true;

   public Stacker(SignalingQueue inbox, NotificationHandler notificationHandler) {
      super(SessionContext.STACKER, inbox, notificationHandler);
   }

   /**
    * Takes effect from the next frame
    *
    * @throws org.livestack.stackj.api.UnsupportedStackingModeException for unknown modes
    */
   public void setStackingMode(String mode) {
      FrameCombiner next = FrameCombiner.forName(mode);
      synchronized (accumulatorLock_) {
         combiner_.reset();
         combiner_ = next;
      }
      logger_.debug("Stacking mode set to {}", mode);
   }

   public String getStackingMode() {
      synchronized (accumulatorLock_) {
         return combiner_.getName();
      }
   }

   public void setAligner(Aligner aligner) {
      synchronized (accumulatorLock_) {
         aligner_ = aligner;
      }
   }

   public void setAlignBeforeStack(boolean align) {
      alignBeforeStack_ = align;
   }

   public boolean isAlignBeforeStack() {
      return alignBeforeStack_;
   }

   public int size() {
      synchronized (accumulatorLock_) {
         return size_;
      }
   }

   /**
    * @return a copy of the combined image, or null if nothing is stacked
    */
   public Image getResult() {
      synchronized (accumulatorLock_) {
         return result_ == null ? null : result_.copy();
      }
   }

   /**
    * Discard the combined image. Does nothing when the stack is already empty.
    */
   public void reset() {
      synchronized (accumulatorLock_) {
         if (size_ == 0 && result_ == null) {
            return;
         }
         result_ = null;
         size_ = 0;
         combiner_.reset();
         post(SessionNotification.createStackSizeChangedNotification(getName(), 0));
      }
      logger_.info("Stack reset");
   }

   @Override
   protected void processImage(Image frame) {
      Image snapshot;
      int size;
      synchronized (accumulatorLock_) {
         Image toFold = frame;
         if (result_ != null) {
            if (!result_.hasSameGeometry(frame)) {
               logger_.warn("Rejected {}: does not match stack geometry {}", frame, result_);
               post(SessionNotification.createWorkerErrorNotification(getName(),
                     "Frame " + frame.getWidth() + "x" + frame.getHeight() + "x"
                     + frame.getPlaneCount() + " does not match stack "
                     + result_.getWidth() + "x" + result_.getHeight() + "x"
                     + result_.getPlaneCount()));
               return;
            }
            if (alignBeforeStack_) {
               try {
                  toFold = aligner_.align(result_, frame);
               } catch (AlignmentException e) {
                  logger_.warn("Could not align {}, stacking it unaligned: {}", frame,
                        e.getMessage());
                  post(SessionNotification.createAlignmentFailedNotification(getName(),
                        e.getMessage()));
               }
            }
         }
         result_ = combiner_.fold(result_, toFold, size_);
         size_++;
         StackEngMetadata.setStackSize(result_.getTags(), size_);
         snapshot = result_.copy();
         size = size_;
      }
      post(SessionNotification.createStackSizeChangedNotification(getName(), size));
      publishResult(snapshot);
   }
}
