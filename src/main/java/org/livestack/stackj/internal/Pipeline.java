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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.livestack.stackj.api.ImageStage;
import org.livestack.stackj.main.Image;

/**
 * Runs an ordered list of stages over each image from its inbox, and publishes the output
 * of the last stage as a new result.
 */
public class Pipeline extends QueueWorker {

   private final List<ImageStage> stages_ = new CopyOnWriteArrayList<>();

   public Pipeline(String name, SignalingQueue inbox, List<ImageStage> stages,
                   NotificationHandler notificationHandler) {
      super(name, inbox, notificationHandler);
      if (stages != null) {
         stages_.addAll(stages);
      }
   }

   /**
    * Append a stage. Takes effect from the next image.
    */
   public void addStage(ImageStage stage) {
      stages_.add(stage);
   }

   public List<ImageStage> getStages() {
      return stages_;
   }

   @Override
   protected void processImage(Image image) {
      Image current = image;
      for (ImageStage stage : stages_) {
         current = stage.process(current);
         if (current == null) {
            // stage dropped the frame
            return;
         }
      }
      publishResult(current);
   }
}
