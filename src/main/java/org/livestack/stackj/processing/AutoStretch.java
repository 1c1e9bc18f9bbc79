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
 * Non linear arcsinh stretch bringing faint signal up while keeping bright stars from
 * saturating. The black point is the median sample of the image.
 */
public class AutoStretch extends ImageStageBase {

   public static final float DEFAULT_STRENGTH = 0.1f;
   private static final int MAX_MEDIAN_SAMPLES = 100000;

   private volatile float strength_ = DEFAULT_STRENGTH;

   public AutoStretch() {
      super(true);
   }

   public float getStrength() {
      return strength_;
   }

   /**
    * @param strength in (0, 1], higher lifts faint signal more
    */
   public void setStrength(float strength) {
      if (!(strength > 0 && strength <= 1)) {
         throw new IllegalArgumentException("Stretch strength must be in (0, 1]: " + strength);
      }
      strength_ = strength;
   }

   @Override
   protected Image processImage(Image image) {
      float black = medianSample(image);
      float max = -Float.MAX_VALUE;
      for (int p = 0; p < image.getPlaneCount(); p++) {
         for (float v : image.getPlane(p)) {
            max = Math.max(max, v);
         }
      }
      float range = max - black;
      if (!(range > 0)) {
         return image;
      }
      double factor = 1000.0 * strength_;
      double norm = asinh(factor);
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] samples = image.getPlane(p);
         for (int i = 0; i < samples.length; i++) {
            double n = Math.max(0, samples[i] - black) / range;
            samples[i] = (float) (asinh(n * factor) / norm * ConvertForOutput.MAX_OUTPUT);
         }
      }
      return image;
   }

   static double asinh(double x) {
      return Math.log(x + Math.sqrt(x * x + 1));
   }

   private static float medianSample(Image image) {
      int total = image.getPlaneCount() * image.getWidth() * image.getHeight();
      int step = Math.max(1, total / MAX_MEDIAN_SAMPLES);
      float[] picked = new float[(total + step - 1) / step];
      int n = 0;
      int numPixels = image.getWidth() * image.getHeight();
      for (int k = 0; k < total && n < picked.length; k += step) {
         picked[n++] = image.getPlane(k / numPixels)[k % numPixels];
      }
      float[] values = Arrays.copyOf(picked, n);
      Arrays.sort(values);
      return values[n / 2];
   }
}
