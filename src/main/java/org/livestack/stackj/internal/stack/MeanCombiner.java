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
package org.livestack.stackj.internal.stack;

import org.livestack.stackj.main.Image;

/**
 * Incremental running average, acc += (x - acc) / n
 */
public class MeanCombiner implements FrameCombiner {

   @Override
   public String getName() {
      return MEAN;
   }

   @Override
   public Image fold(Image combined, Image frame, int count) {
      if (combined == null) {
         return frame;
      }
      float n = count + 1;
      for (int p = 0; p < combined.getPlaneCount(); p++) {
         float[] acc = combined.getPlane(p);
         float[] samples = frame.getPlane(p);
         for (int i = 0; i < acc.length; i++) {
            acc[i] += (samples[i] - acc[i]) / n;
         }
      }
      return combined;
   }

   @Override
   public void reset() {
   }
}
