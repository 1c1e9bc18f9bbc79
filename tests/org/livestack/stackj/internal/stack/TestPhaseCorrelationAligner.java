package org.livestack.stackj.internal.stack;

import java.util.Arrays;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;
import org.livestack.stackj.api.AlignmentException;
import org.livestack.stackj.main.Image;

public class TestPhaseCorrelationAligner {

   private static final int SIZE = 64;

   /**
    * Synthetic star field, shifted by dx, dy. One bright star sits at 32, 32 before shifting.
    */
   private static Image starField(double dx, double dy) {
      Random random = new Random(42);
      double[][] stars = new double[16][];
      stars[0] = new double[]{32, 32, 10000};
      for (int s = 1; s < stars.length; s++) {
         stars[s] = new double[]{12 + random.nextInt(40), 12 + random.nextInt(40),
               500 + random.nextInt(2500)};
      }
      float[] samples = new float[SIZE * SIZE];
      for (int y = 0; y < SIZE; y++) {
         for (int x = 0; x < SIZE; x++) {
            double v = 100;
            for (double[] star : stars) {
               double rx = x - (star[0] + dx);
               double ry = y - (star[1] + dy);
               v += star[2] * Math.exp(-(rx * rx + ry * ry) / (2 * 1.2 * 1.2));
            }
            samples[y * SIZE + x] = (float) v;
         }
      }
      return new Image(SIZE, SIZE, samples);
   }

   private static int brightestIndex(Image image) {
      float[] samples = image.getPlane(0);
      int best = 0;
      for (int i = 1; i < samples.length; i++) {
         if (samples[i] > samples[best]) {
            best = i;
         }
      }
      return best;
   }

   @Test
   public void testRecoversKnownShift() throws Exception {
      PhaseCorrelationAligner aligner = new PhaseCorrelationAligner();
      double[] shift = aligner.measureShift(starField(0, 0), starField(3, -2));
      Assert.assertEquals(-3, shift[0], 0.5);
      Assert.assertEquals(2, shift[1], 0.5);
   }

   @Test
   public void testAlignedFrameMatchesReference() throws Exception {
      Image reference = starField(0, 0);
      Image aligned = new PhaseCorrelationAligner().align(reference, starField(3, -2));
      Assert.assertEquals(brightestIndex(reference), brightestIndex(aligned));
      Assert.assertEquals(SIZE, aligned.getWidth());
      Assert.assertEquals(SIZE, aligned.getHeight());
   }

   @Test
   public void testIdenticalFramesNeedNoShift() throws Exception {
      double[] shift = new PhaseCorrelationAligner().measureShift(starField(0, 0),
            starField(0, 0));
      Assert.assertEquals(0, shift[0], 0.1);
      Assert.assertEquals(0, shift[1], 0.1);
   }

   @Test(expected = AlignmentException.class)
   public void testFlatFrameCannotBeAligned() throws Exception {
      float[] flat = new float[SIZE * SIZE];
      Arrays.fill(flat, 7f);
      new PhaseCorrelationAligner().align(starField(0, 0), new Image(SIZE, SIZE, flat));
   }

   @Test(expected = AlignmentException.class)
   public void testGeometryMismatchCannotBeAligned() throws Exception {
      new PhaseCorrelationAligner().align(starField(0, 0), new Image(8, 8, new float[64]));
   }

   @Test(expected = AlignmentException.class)
   public void testTinyImagesCannotBeAligned() throws Exception {
      Image small = new Image(8, 8, new float[64]);
      new PhaseCorrelationAligner().align(small, small.copy());
   }

   @Test
   public void testWindowSize() {
      Assert.assertEquals(64, PhaseCorrelationAligner.windowSize(100));
      Assert.assertEquals(128, PhaseCorrelationAligner.windowSize(128));
      Assert.assertEquals(1024, PhaseCorrelationAligner.windowSize(4000));
   }
}
