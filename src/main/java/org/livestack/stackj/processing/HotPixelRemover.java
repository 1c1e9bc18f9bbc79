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

import java.util.Arrays;
import org.livestack.stackj.main.Image;

/**
 * Replaces isolated hot samples by the median of their neighbours. On raw color filter data
 * only same-color neighbours two pixels away are considered.
 */
public class HotPixelRemover extends ImageStageBase {

   public static final float DEFAULT_RATIO = 2f;

   private volatile float ratio_ = DEFAULT_RATIO;

   public HotPixelRemover() {
      super(true);
   }

   public float getRatio() {
      return ratio_;
   }

   public void setRatio(float ratio) {
      ratio_ = ratio;
   }

   @Override
   protected Image processImage(Image image) {
      int step = image.needsDebayering() ? 2 : 1;
      int width = image.getWidth();
      int height = image.getHeight();
      float ratio = ratio_;
      float[] neighbours = new float[8];
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] src = image.getPlane(p).clone();
         float[] dst = image.getPlane(p);
         for (int y = step; y < height - step; y++) {
            for (int x = step; x < width - step; x++) {
               int n = 0;
               float max = -Float.MAX_VALUE;
               for (int dy = -step; dy <= step; dy += step) {
                  for (int dx = -step; dx <= step; dx += step) {
                     if (dx == 0 && dy == 0) {
                        continue;
                     }
                     float v = src[(y + dy) * width + x + dx];
                     neighbours[n++] = v;
                     max = Math.max(max, v);
                  }
               }
               float v = src[y * width + x];
               if (v > ratio * max && v > 0) {
                  Arrays.sort(neighbours);
                  dst[y * width + x] = (neighbours[3] + neighbours[4]) / 2f;
               }
            }
         }
      }
      return image;
   }
}
