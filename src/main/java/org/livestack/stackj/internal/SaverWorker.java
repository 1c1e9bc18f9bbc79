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

import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.main.SessionContext;
import org.livestack.stackj.main.SessionNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands images from the save queue to the image saver, one at a time
 */
public class SaverWorker extends QueueWorker {

   private static final Logger logger_ = LoggerFactory.getLogger(SaverWorker.class);

   private final ImageSaver saver_;

   public SaverWorker(SignalingQueue inbox, ImageSaver saver,
                      NotificationHandler notificationHandler) {
      super(SessionContext.SAVER, inbox, notificationHandler);
      saver_ = saver;
   }

   @Override
   protected void processImage(Image image) {
      String destination = image.getDestination();
      if (destination == null) {
         throw new IllegalArgumentException("Image queued for saving has no destination");
      }
      saver_.putImage(image);
      logger_.debug("Saved {}", destination);
      post(SessionNotification.createImageSavedNotification(getName(), destination));
   }
}
