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

import java.util.Arrays;
import org.livestack.stackj.main.Image;

/**
 * Running mean with per sample outlier rejection. Mean and variance are tracked with
 * Welford's method; once a sample has two accepted values, a new value further than kappa
 * standard deviations from the mean is ignored. Every sample keeps its own accepted count.
 */
public class SigmaClipCombiner implements FrameCombiner {

   public static final double DEFAULT_KAPPA = 2.5;

   private final double kappa_;
   private float[][] mean_;
   private float[][] m2_;
   private int[][] counts_;

   public SigmaClipCombiner() {
      this(DEFAULT_KAPPA);
   }

   public SigmaClipCombiner(double kappa) {
      if (kappa <= 0) {
         throw new IllegalArgumentException("kappa must be positive");
      }
      kappa_ = kappa;
   }

   @Override
   public String getName() {
      return SIGMA_CLIP;
   }

   public double getKappa() {
      return kappa_;
   }

   @Override
   public Image fold(Image combined, Image frame, int count) {
      if (mean_ == null) {
         if (combined == null) {
            seed(frame, 1);
            return frame.withPlanes(mean_);
         }
         seed(combined, count);
      }
      for (int p = 0; p < mean_.length; p++) {
         float[] mean = mean_[p];
         float[] m2 = m2_[p];
         int[] n = counts_[p];
         float[] samples = frame.getPlane(p);
         for (int i = 0; i < mean.length; i++) {
            float x = samples[i];
            if (n[i] >= 2) {
               double std = Math.sqrt(m2[i] / n[i]);
               if (std > 0 && Math.abs(x - mean[i]) > kappa_ * std) {
                  continue;
               }
            }
            n[i]++;
            float delta = x - mean[i];
            mean[i] += delta / n[i];
            m2[i] += delta * (x - mean[i]);
         }
      }
      return (combined == null ? frame : combined).withPlanes(mean_);
   }

   @Override
   public void reset() {
      mean_ = null;
      m2_ = null;
      counts_ = null;
   }

   /**
    * Number of accepted values for one sample
    */
   public int getAcceptedCount(int plane, int index) {
      return counts_ == null ? 0 : counts_[plane][index];
   }

   private void seed(Image image, int count) {
      int planeCount = image.getPlaneCount();
      int numSamples = image.getWidth() * image.getHeight();
      mean_ = new float[planeCount][];
      m2_ = new float[planeCount][numSamples];
      counts_ = new int[planeCount][numSamples];
      for (int p = 0; p < planeCount; p++) {
         mean_[p] = image.getPlane(p).clone();
         Arrays.fill(counts_[p], Math.max(1, count));
      }
   }
}
