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

import ij.process.FHT;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.livestack.stackj.api.Aligner;
import org.livestack.stackj.api.AlignmentException;
import org.livestack.stackj.main.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translation-only registration by phase correlation. A centered square window of the
 * luminance of both images is correlated with ImageJ's Hartley transform; the position of the
 * correlation peak gives the shift, refined to sub pixel precision with a parabola fit. The
 * frame is then resampled with bilinear interpolation.
 */
public class PhaseCorrelationAligner implements Aligner {

   private static final Logger logger_ = LoggerFactory.getLogger(PhaseCorrelationAligner.class);

   public static final int MIN_WINDOW = 16;
   public static final int MAX_WINDOW = 1024;
   public static final double DEFAULT_MIN_PEAK_SIGMA = 5.0;
   public static final double DEFAULT_MAX_SHIFT_FRACTION = 0.25;

   private final double minPeakSigma_;
   private final double maxShiftFraction_;

   public PhaseCorrelationAligner() {
      this(DEFAULT_MIN_PEAK_SIGMA, DEFAULT_MAX_SHIFT_FRACTION);
   }

   /**
    * @param minPeakSigma how many standard deviations the correlation peak must stand above
    *                     the mean of the correlation surface
    * @param maxShiftFraction largest accepted shift, as a fraction of the window size
    */
   public PhaseCorrelationAligner(double minPeakSigma, double maxShiftFraction) {
      minPeakSigma_ = minPeakSigma;
      maxShiftFraction_ = maxShiftFraction;
   }

   @Override
   public Image align(Image reference, Image frame) throws AlignmentException {
      double[] shift = measureShift(reference, frame);
      if (shift[0] == 0 && shift[1] == 0) {
         return frame;
      }
      float[][] planes = new float[frame.getPlaneCount()][];
      for (int p = 0; p < planes.length; p++) {
         FloatProcessor fp = new FloatProcessor(frame.getWidth(), frame.getHeight(),
               frame.getPlane(p).clone());
         fp.setInterpolationMethod(ImageProcessor.BILINEAR);
         fp.setBackgroundValue(0);
         fp.translate(shift[0], shift[1]);
         planes[p] = (float[]) fp.getPixels();
      }
      logger_.debug("Frame shifted by {}, {}", shift[0], shift[1]);
      return frame.withPlanes(planes);
   }

   /**
    * @return {dx, dy}, the translation that moves the frame onto the reference. Positive
    * values move the frame right and down.
    */
   public double[] measureShift(Image reference, Image frame) throws AlignmentException {
      if (!reference.hasSameGeometry(frame)) {
         throw new AlignmentException("Frame geometry " + frame.getWidth() + "x"
               + frame.getHeight() + " does not match stack " + reference.getWidth() + "x"
               + reference.getHeight());
      }
      int size = windowSize(Math.min(reference.getWidth(), reference.getHeight()));
      if (size < MIN_WINDOW) {
         throw new AlignmentException("Image too small to align");
      }
      int x0 = (reference.getWidth() - size) / 2;
      int y0 = (reference.getHeight() - size) / 2;

      FHT refFht = new FHT(new FloatProcessor(size, size, window(reference, x0, y0, size)));
      FHT frameFht = new FHT(new FloatProcessor(size, size, window(frame, x0, y0, size)));
      refFht.transform();
      frameFht.transform();
      FHT correlation = refFht.conjugateMultiply(frameFht);
      correlation.inverseTransform();
      correlation.swapQuadrants();
      float[] c = (float[]) correlation.getPixels();

      int peak = 0;
      double sum = 0;
      double sumSq = 0;
      for (int i = 0; i < c.length; i++) {
         if (c[i] > c[peak]) {
            peak = i;
         }
         sum += c[i];
         sumSq += (double) c[i] * c[i];
      }
      double mean = sum / c.length;
      double std = Math.sqrt(Math.max(0, sumSq / c.length - mean * mean));
      if (std == 0 || c[peak] - mean < minPeakSigma_ * std) {
         throw new AlignmentException("No clear correlation peak");
      }

      int px = peak % size;
      int py = peak / size;
      double dx = px - size / 2 + subPixel(c[py * size + wrap(px - 1, size)], c[peak],
            c[py * size + wrap(px + 1, size)]);
      double dy = py - size / 2 + subPixel(c[wrap(py - 1, size) * size + px], c[peak],
            c[wrap(py + 1, size) * size + px]);
      double maxShift = maxShiftFraction_ * size;
      if (Math.abs(dx) > maxShift || Math.abs(dy) > maxShift) {
         throw new AlignmentException("Shift of " + Math.round(dx) + ", " + Math.round(dy)
               + " pixels is too large");
      }
      return new double[]{dx, dy};
   }

   /**
    * Largest power of 2 not above the given dimension, capped at {@link #MAX_WINDOW}
    */
   static int windowSize(int dimension) {
      int size = 1;
      while (size * 2 <= dimension && size * 2 <= MAX_WINDOW) {
         size *= 2;
      }
      return size;
   }

   /**
    * Mean subtracted, Hann windowed luminance of a square region
    */
   private static float[] window(Image image, int x0, int y0, int size)
         throws AlignmentException {
      float[] lum = new float[size * size];
      int planes = image.getPlaneCount();
      double sum = 0;
      for (int y = 0; y < size; y++) {
         for (int x = 0; x < size; x++) {
            float v = 0;
            for (int p = 0; p < planes; p++) {
               v += image.getSample(p, x0 + x, y0 + y);
            }
            v /= planes;
            lum[y * size + x] = v;
            sum += v;
         }
      }
      float mean = (float) (sum / lum.length);
      double var = 0;
      for (int i = 0; i < lum.length; i++) {
         lum[i] -= mean;
         var += lum[i] * lum[i];
      }
      if (Math.sqrt(var / lum.length) < 1e-6) {
         throw new AlignmentException("Flat image, nothing to align on");
      }
      double[] hann = new double[size];
      for (int i = 0; i < size; i++) {
         hann[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / (size - 1));
      }
      for (int y = 0; y < size; y++) {
         for (int x = 0; x < size; x++) {
            lum[y * size + x] *= (float) (hann[x] * hann[y]);
         }
      }
      return lum;
   }

   private static double subPixel(float left, float center, float right) {
      double denom = left - 2.0 * center + right;
      if (denom >= 0) {
         return 0;
      }
      double offset = 0.5 * (left - right) / denom;
      return Math.max(-0.5, Math.min(0.5, offset));
   }

   private static int wrap(int i, int size) {
      return (i + size) % size;
   }
}
