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

import org.livestack.stackj.api.UnsupportedStackingModeException;
import org.livestack.stackj.main.Image;

/**
 * Strategy that folds one frame into the combined image of a stack. Implementations may
 * keep state across folds, which {@link #reset()} discards. Only ever called by one thread
 * at a time.
 */
public interface FrameCombiner {

   public static final String MEAN = "mean";
   public static final String SUM = "sum";
   public static final String MEDIAN = "median";
   public static final String SIGMA_CLIP = "sigma-clip";

   /**
    * @param mode one of mean, sum, median, sigma-clip
    * @throws UnsupportedStackingModeException for anything else
    */
   public static FrameCombiner forName(String mode) {
      if (mode == null) {
         throw new UnsupportedStackingModeException(null);
      }
      switch (mode) {
         case MEAN:
            return new MeanCombiner();
         case SUM:
            return new SumCombiner();
         case MEDIAN:
            return new MedianCombiner();
         case SIGMA_CLIP:
            return new SigmaClipCombiner();
         default:
            throw new UnsupportedStackingModeException(mode);
      }
   }

   public String getName();

   /**
    * @param combined the current combined image, or null before the first frame
    * @param frame the frame to add, owned by the combiner from now on
    * @param count number of frames already in the combined image
    * @return the new combined image. May be {@code combined} modified in place.
    */
   public Image fold(Image combined, Image frame, int count);

   /**
    * Forget any state kept between folds
    */
   public void reset();

}
