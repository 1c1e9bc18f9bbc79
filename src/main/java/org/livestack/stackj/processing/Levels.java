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
 * Maps [black, white] onto the full output range with a midtone gamma. Samples outside the
 * interval are clipped.
 */
public class Levels extends ImageStageBase {

   private volatile float black_ = 0f;
   private volatile float white_ = ConvertForOutput.MAX_OUTPUT;
   private volatile float midtones_ = 1f;

   public Levels() {
      super(true);
   }

   public void setLevels(float black, float midtones, float white) {
      if (white <= black) {
         throw new IllegalArgumentException("White point must be above black point");
      }
      if (midtones <= 0) {
         throw new IllegalArgumentException("Midtones must be positive");
      }
      black_ = black;
      midtones_ = midtones;
      white_ = white;
   }

   public float getBlack() {
      return black_;
   }

   public float getMidtones() {
      return midtones_;
   }

   public float getWhite() {
      return white_;
   }

   @Override
   protected Image processImage(Image image) {
      float black = black_;
      float white = white_;
      double exponent = 1.0 / midtones_;
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] samples = image.getPlane(p);
         for (int i = 0; i < samples.length; i++) {
            double n = (samples[i] - black) / (white - black);
            n = Math.max(0, Math.min(1, n));
            samples[i] = (float) (Math.pow(n, exponent) * ConvertForOutput.MAX_OUTPUT);
         }
      }
      return image;
   }
}
