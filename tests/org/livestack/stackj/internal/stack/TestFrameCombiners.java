package org.livestack.stackj.internal.stack;

import org.junit.Assert;
import org.junit.Test;
import org.livestack.stackj.api.UnsupportedStackingModeException;
import org.livestack.stackj.main.Image;

public class TestFrameCombiners {

   private static Image pixel(float value) {
      return new Image(1, 1, new float[]{value});
   }

   private static Image foldAll(FrameCombiner combiner, float... values) {
      Image combined = null;
      for (int i = 0; i < values.length; i++) {
         combined = combiner.fold(combined, pixel(values[i]), i);
      }
      return combined;
   }

   @Test
   public void testRegistryKnowsAllModes() {
      Assert.assertTrue(FrameCombiner.forName("mean") instanceof MeanCombiner);
      Assert.assertTrue(FrameCombiner.forName("sum") instanceof SumCombiner);
      Assert.assertTrue(FrameCombiner.forName("median") instanceof MedianCombiner);
      Assert.assertTrue(FrameCombiner.forName("sigma-clip") instanceof SigmaClipCombiner);
   }

   @Test(expected = UnsupportedStackingModeException.class)
   public void testUnknownModeIsRejected() {
      FrameCombiner.forName("max");
   }

   @Test
   public void testSum() {
      Image combined = foldAll(new SumCombiner(), 1, 2, 3.5f);
      Assert.assertEquals(6.5f, combined.getSample(0, 0, 0), 0f);
   }

   @Test
   public void testMedianIgnoresOutlier() {
      Image combined = foldAll(new MedianCombiner(), 1, 100, 3);
      Assert.assertEquals(3f, combined.getSample(0, 0, 0), 0f);
   }

   @Test
   public void testMedianOnlyUsesRecentFrames() {
      Image combined = foldAll(new MedianCombiner(5), 1, 2, 3, 4, 5, 6, 7);
      // window holds 3..7
      Assert.assertEquals(5f, combined.getSample(0, 0, 0), 0f);
   }

   @Test
   public void testMedianOfEvenWindowIsMidpoint() {
      Image combined = foldAll(new MedianCombiner(), 2, 4);
      Assert.assertEquals(3f, combined.getSample(0, 0, 0), 0f);
   }

   @Test
   public void testMedianSeedsFromExistingStack() {
      MedianCombiner median = new MedianCombiner();
      Image combined = median.fold(pixel(10), pixel(20), 4);
      combined = median.fold(combined, pixel(30), 5);
      Assert.assertEquals(20f, combined.getSample(0, 0, 0), 0f);
   }

   @Test
   public void testSigmaClipRejectsOutlierFromThirdFrame() {
      SigmaClipCombiner clip = new SigmaClipCombiner();
      Image combined = foldAll(clip, 10, 12, 1000);
      Assert.assertEquals(11f, combined.getSample(0, 0, 0), 1e-4f);
      Assert.assertEquals(2, clip.getAcceptedCount(0, 0));

      combined = clip.fold(combined, pixel(11), 3);
      Assert.assertEquals(11f, combined.getSample(0, 0, 0), 1e-4f);
      Assert.assertEquals(3, clip.getAcceptedCount(0, 0));
   }

   @Test
   public void testSigmaClipKeepsEverythingWithoutSpread() {
      SigmaClipCombiner clip = new SigmaClipCombiner();
      Image combined = foldAll(clip, 10, 10, 40);
      Assert.assertEquals(20f, combined.getSample(0, 0, 0), 1e-4f);
   }

   @Test
   public void testResetForgetsState() {
      MedianCombiner median = new MedianCombiner();
      foldAll(median, 100, 100, 100);
      median.reset();
      Image combined = foldAll(median, 1, 2, 3);
      Assert.assertEquals(2f, combined.getSample(0, 0, 0), 0f);
   }
}
