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
package org.livestack.stackj.processing;

import org.livestack.stackj.api.ImageStage;
import org.livestack.stackj.main.Image;

/**
 * Shared on/off switch of the processing stages. An inactive stage hands its input back
 * unchanged.
 */
public abstract class ImageStageBase implements ImageStage {

   private volatile boolean active_;

   protected ImageStageBase(boolean active) {
      active_ = active;
   }

   protected abstract Image processImage(Image image);

   @Override
   public Image process(Image image) {
      if (!active_) {
         return image;
      }
      return processImage(image);
   }

   public boolean isActive() {
      return active_;
   }

   public void setActive(boolean active) {
      active_ = active;
   }
}
