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

import org.livestack.stackj.main.Image;

/**
 * Per channel multipliers on RGB images. Mono images pass through.
 */
public class ColorBalance extends ImageStageBase {

   private volatile float red_ = 1f;
   private volatile float green_ = 1f;
   private volatile float blue_ = 1f;

   public ColorBalance() {
      super(true);
   }

   public void setMultipliers(float red, float green, float blue) {
      red_ = red;
      green_ = green;
      blue_ = blue;
   }

   public float[] getMultipliers() {
      return new float[]{red_, green_, blue_};
   }

   @Override
   protected Image processImage(Image image) {
      if (!image.isColor()) {
         return image;
      }
      float[] multipliers = getMultipliers();
      for (int p = 0; p < 3; p++) {
         if (multipliers[p] == 1f) {
            continue;
         }
         float[] samples = image.getPlane(p);
         for (int i = 0; i < samples.length; i++) {
            samples[i] *= multipliers[p];
         }
      }
      return image;
   }
}
