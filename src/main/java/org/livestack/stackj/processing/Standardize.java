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
 * Replaces NaN and negative samples with 0
 */
public class Standardize extends ImageStageBase {

   public Standardize() {
      super(true);
   }

   @Override
   protected Image processImage(Image image) {
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] samples = image.getPlane(p);
         for (int i = 0; i < samples.length; i++) {
            if (Float.isNaN(samples[i]) || samples[i] < 0) {
               samples[i] = 0f;
            }
         }
      }
      return image;
   }
}
