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
 * Clips samples to the 16 bit output range
 */
public class ConvertForOutput extends ImageStageBase {

   public static final float MAX_OUTPUT = 65535f;

   public ConvertForOutput() {
      super(true);
   }

   @Override
   protected Image processImage(Image image) {
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] samples = image.getPlane(p);
         for (int i = 0; i < samples.length; i++) {
            float v = samples[i];
            if (Float.isNaN(v) || v < 0) {
               samples[i] = 0f;
            } else if (v > MAX_OUTPUT) {
               samples[i] = MAX_OUTPUT;
            }
         }
      }
      return image;
   }
}
