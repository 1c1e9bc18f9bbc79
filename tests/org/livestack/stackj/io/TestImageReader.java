package org.livestack.stackj.io;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ShortProcessor;
import java.io.File;
import java.nio.file.Path;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.util.MalformedBayerMetadataException;

public class TestImageReader {

   @Rule
   public TemporaryFolder tmp = new TemporaryFolder();

   static Path writeTiff(File folder, String name, short[] pixels, int width, int height) {
      File file = new File(folder, name);
      ImagePlus imp = new ImagePlus(name, new ShortProcessor(width, height, pixels, null));
      Assert.assertTrue(new FileSaver(imp).saveAsTiff(file.getPath()));
      return file.toPath();
   }

   @Test
   public void testIgnoredNames() {
      Assert.assertTrue(ImageReader.isIgnored(".hidden.fits"));
      Assert.assertTrue(ImageReader.isIgnored("~lock.tif"));
      Assert.assertTrue(ImageReader.isIgnored("tmp_upload.cr2"));
      Assert.assertFalse(ImageReader.isIgnored("light_001.fits"));
   }

   @Test
   public void testReadsSixteenBitTiff() throws Exception {
      Path file = writeTiff(tmp.getRoot(), "light.tif", new short[]{0, 1000, (short) 40000, 7},
            2, 2);
      Image image = new ImageReader().read(file);
      Assert.assertEquals(2, image.getWidth());
      Assert.assertEquals(2, image.getHeight());
      Assert.assertEquals(1, image.getPlaneCount());
      Assert.assertEquals(1000f, image.getSample(0, 1, 0), 0f);
      Assert.assertEquals(40000f, image.getSample(0, 0, 1), 0f);
      Assert.assertEquals("", image.getBayerPattern());
      Assert.assertEquals("FILE : " + file, image.getOrigin());
   }

   @Test
   public void testRawFilesUseDecoderPattern() throws Exception {
      RawDecoder decoder = path -> new RawFrame(new float[]{1, 2, 3, 4}, 2, 2,
            new int[]{0, 1, 3, 2}, "RGBG");
      Image image = new ImageReader(decoder).read(tmp.newFile("light.cr2").toPath());
      Assert.assertEquals("RGGB", image.getBayerPattern());
      Assert.assertTrue(image.needsDebayering());
      Assert.assertEquals(3f, image.getSample(0, 0, 1), 0f);
   }

   @Test(expected = MalformedBayerMetadataException.class)
   public void testInconsistentRawPatternIsRejected() throws Exception {
      RawDecoder decoder = path -> new RawFrame(new float[]{1, 2, 3, 4}, 2, 2,
            new int[]{0, 1, 3}, "RGBG");
      new ImageReader(decoder).read(tmp.newFile("light.nef").toPath());
   }

   @Test(expected = ImageReadException.class)
   public void testRawWithoutDecoderIsUnsupported() throws Exception {
      new ImageReader().read(tmp.newFile("light.cr2").toPath());
   }

   @Test
   public void testBayerPatternFromFitsHeader() {
      Assert.assertEquals("RGGB", ImageReader.bayerPatternFromHeader(
            "SIMPLE  =                    T\nBAYERPAT= 'RGGB    '           / pattern\n"));
      Assert.assertEquals("GBRG", ImageReader.bayerPatternFromHeader("BAYERPAT= 'gbrg'"));
      Assert.assertNull(ImageReader.bayerPatternFromHeader("BAYERPAT= 'XXXX'"));
      Assert.assertNull(ImageReader.bayerPatternFromHeader("EXPTIME = 30.0"));
      Assert.assertNull(ImageReader.bayerPatternFromHeader(null));
   }
}
