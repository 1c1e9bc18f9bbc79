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

public class SumCombiner implements FrameCombiner {

   @Override
   public String getName() {
      return SUM;
   }

   @Override
   public Image fold(Image combined, Image frame, int count) {
      if (combined == null) {
         return frame;
      }
      for (int p = 0; p < combined.getPlaneCount(); p++) {
         float[] acc = combined.getPlane(p);
         float[] samples = frame.getPlane(p);
         for (int i = 0; i < acc.length; i++) {
            acc[i] += samples[i];
         }
      }
      return combined;
   }

   @Override
   public void reset() {
   }
}
