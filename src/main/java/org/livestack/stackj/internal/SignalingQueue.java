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

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionNotification;

/**
 * FIFO of images that posts a size changed notification every time its occupancy changes.
 * Notifications are posted while holding the queue lock, so listeners see sizes in the
 * order they happened.
 */
public class SignalingQueue {

   private final String name_;
   private final NotificationHandler notificationHandler_;
   private final ArrayDeque<Image> images_ = new ArrayDeque<>();

   public SignalingQueue(String name, NotificationHandler notificationHandler) {
      name_ = name;
      notificationHandler_ = notificationHandler;
   }

   public String getName() {
      return name_;
   }

   public synchronized void push(Image image) {
      if (image == null) {
         throw new NullPointerException("Can't queue a null image");
      }
      images_.addLast(image);
      signalSize();
      notifyAll();
   }

   /**
    * Blocks until an image is available
    */
   public synchronized Image pop() throws InterruptedException {
      while (images_.isEmpty()) {
         wait();
      }
      Image image = images_.removeFirst();
      signalSize();
      return image;
   }

   /**
    * @return the oldest image, or null if none arrived before the timeout
    */
   public synchronized Image pop(long timeout, TimeUnit unit) throws InterruptedException {
      long deadline = System.nanoTime() + unit.toNanos(timeout);
      while (images_.isEmpty()) {
         long remaining = deadline - System.nanoTime();
         if (remaining <= 0) {
            return null;
         }
         TimeUnit.NANOSECONDS.timedWait(this, remaining);
      }
      Image image = images_.removeFirst();
      signalSize();
      return image;
   }

   public synchronized int size() {
      return images_.size();
   }

   public synchronized boolean isEmpty() {
      return images_.isEmpty();
   }

   /**
    * Drop every queued image. Always posts a final size of 0.
    */
   public synchronized void purge() {
      images_.clear();
      signalSize();
   }

   private void signalSize() {
      if (notificationHandler_ != null) {
         notificationHandler_.postNotification(
               SessionNotification.createQueueSizeChangedNotification(name_, images_.size()));
      }
   }

   @Override
   public String toString() {
      return name_ + " queue";
   }
}
