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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;
import org.livestack.stackj.main.Image;

/**
 * Per sample median of the most recent frames. Memory use is bounded by the window size.
 */
public class MedianCombiner implements FrameCombiner {

   public static final int DEFAULT_WINDOW = 5;

   private final int windowSize_;
   private final ArrayDeque<float[][]> window_ = new ArrayDeque<>();

   public MedianCombiner() {
      this(DEFAULT_WINDOW);
   }

   public MedianCombiner(int windowSize) {
      if (windowSize < 1) {
         throw new IllegalArgumentException("Median window must hold at least one frame");
      }
      windowSize_ = windowSize;
   }

   @Override
   public String getName() {
      return MEDIAN;
   }

   public int getWindowSize() {
      return windowSize_;
   }

   @Override
   public Image fold(Image combined, Image frame, int count) {
      if (window_.isEmpty() && combined != null) {
         // switched to median mid stack
         window_.addLast(planesOf(combined.copy()));
      }
      window_.addLast(planesOf(frame));
      while (window_.size() > windowSize_) {
         window_.removeFirst();
      }

      int planeCount = frame.getPlaneCount();
      int numSamples = frame.getWidth() * frame.getHeight();
      float[][] median = new float[planeCount][numSamples];
      float[] values = new float[window_.size()];
      for (int p = 0; p < planeCount; p++) {
         for (int i = 0; i < numSamples; i++) {
            Iterator<float[][]> it = window_.iterator();
            for (int k = 0; k < values.length; k++) {
               values[k] = it.next()[p][i];
            }
            median[p][i] = median(values);
         }
      }
      return (combined == null ? frame : combined).withPlanes(median);
   }

   @Override
   public void reset() {
      window_.clear();
   }

   static float median(float[] values) {
      float[] sorted = values.clone();
      Arrays.sort(sorted);
      int mid = sorted.length / 2;
      if (sorted.length % 2 == 1) {
         return sorted[mid];
      }
      return (sorted[mid - 1] + sorted[mid]) / 2f;
   }

   private static float[][] planesOf(Image image) {
      float[][] planes = new float[image.getPlaneCount()][];
      for (int p = 0; p < planes.length; p++) {
         planes[p] = image.getPlane(p);
      }
      return planes;
   }
}
