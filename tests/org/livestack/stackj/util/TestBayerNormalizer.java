package org.livestack.stackj.util;

import org.junit.Assert;
import org.junit.Test;

public class TestBayerNormalizer {

   @Test
   public void testDecoderIndicesAreMappedThroughDescription() throws Exception {
      Assert.assertEquals("RGGB", BayerNormalizer.normalize(new int[]{0, 1, 3, 2}, "RGBG"));
      Assert.assertEquals("BGGR", BayerNormalizer.normalize(new int[]{2, 1, 3, 0}, "RGBG"));
      Assert.assertEquals("GRBG", BayerNormalizer.normalize(new int[]{1, 0, 2, 1}, "RGBG"));
   }

   @Test(expected = MalformedBayerMetadataException.class)
   public void testLengthMismatchIsRejected() throws Exception {
      BayerNormalizer.normalize(new int[]{0, 1, 3}, "RGBG");
   }

   @Test(expected = MalformedBayerMetadataException.class)
   public void testIndexOutOfRangeIsRejected() throws Exception {
      BayerNormalizer.normalize(new int[]{0, 1, 4, 2}, "RGBG");
   }

   @Test(expected = MalformedBayerMetadataException.class)
   public void testNonSquareGridIsRejected() throws Exception {
      BayerNormalizer.normalize(new int[]{0, 1, 2, 3, 4, 5}, "RGBGRG");
   }

   @Test(expected = MalformedBayerMetadataException.class)
   public void testMissingDescriptionIsRejected() throws Exception {
      BayerNormalizer.normalize(new int[]{0, 1, 3, 2}, null);
   }

   @Test
   public void testPatternValidation() {
      Assert.assertTrue(BayerNormalizer.isValidPattern("RGGB"));
      Assert.assertTrue(BayerNormalizer.isValidPattern("GBRG"));
      Assert.assertFalse(BayerNormalizer.isValidPattern("RGGG"));
      Assert.assertFalse(BayerNormalizer.isValidPattern("RGB"));
      Assert.assertFalse(BayerNormalizer.isValidPattern("RGXB"));
      Assert.assertFalse(BayerNormalizer.isValidPattern(null));
   }
}
