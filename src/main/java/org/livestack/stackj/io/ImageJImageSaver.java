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
package org.livestack.stackj.io;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import mmcorej.org.json.JSONObject;
import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.main.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes images with ImageJ's FileSaver. The format follows the destination extension:
 * 16 bit TIFF, 8 bit PNG or JPEG, 32 bit float FITS. Color images become 3 slice stacks in
 * TIFF and FITS.
 */
public class ImageJImageSaver implements ImageSaver {

   private static final Logger logger_ = LoggerFactory.getLogger(ImageJImageSaver.class);

   private static final float MAX_16BIT = 65535f;

   private volatile boolean finished_ = false;
   private volatile boolean somethingSaved_ = false;

   @Override
   public void initialize(JSONObject summaryMetadata) {
      finished_ = false;
   }

   @Override
   public void finish() {
      finished_ = true;
   }

   @Override
   public boolean isFinished() {
      return finished_;
   }

   @Override
   public boolean anythingSaved() {
      return somethingSaved_;
   }

   @Override
   public Object putImage(Image image) {
      Path destination = Paths.get(image.getDestination());
      try {
         if (destination.getParent() != null) {
            Files.createDirectories(destination.getParent());
         }
      } catch (IOException e) {
         throw new RuntimeException("Could not create folder for " + destination, e);
      }
      String name = destination.getFileName().toString();
      String ext = name.substring(name.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
      String path = destination.toString();
      boolean ok;
      switch (ext) {
         case "tif":
         case "tiff":
            ok = image.isColor() ? new FileSaver(toShortStack(image)).saveAsTiffStack(path)
                  : new FileSaver(new ImagePlus(name, toShort(image, 0))).saveAsTiff(path);
            break;
         case "png":
            ok = new FileSaver(toEightBit(image, name)).saveAsPng(path);
            break;
         case "jpg":
         case "jpeg":
            ok = new FileSaver(toEightBit(image, name)).saveAsJpeg(path);
            break;
         case "fit":
         case "fits":
         case "fts":
            ok = new FileSaver(toFloat(image, name)).saveAsFits(path);
            break;
         default:
            throw new IllegalArgumentException("Unsupported image format: " + ext);
      }
      if (!ok) {
         throw new RuntimeException("ImageJ could not save " + path);
      }
      somethingSaved_ = true;
      logger_.debug("Wrote {}", path);
      return path;
   }

   private static ShortProcessor toShort(Image image, int plane) {
      float[] samples = image.getPlane(plane);
      short[] pixels = new short[samples.length];
      for (int i = 0; i < samples.length; i++) {
         pixels[i] = (short) Math.round(clip(samples[i], MAX_16BIT));
      }
      return new ShortProcessor(image.getWidth(), image.getHeight(), pixels, null);
   }

   private static ImagePlus toShortStack(Image image) {
      ImageStack stack = new ImageStack(image.getWidth(), image.getHeight());
      String[] labels = {"red", "green", "blue"};
      for (int p = 0; p < image.getPlaneCount(); p++) {
         stack.addSlice(labels[p], toShort(image, p));
      }
      return new ImagePlus("stack", stack);
   }

   private static ImagePlus toEightBit(Image image, String title) {
      int numPixels = image.getWidth() * image.getHeight();
      byte[][] planes = new byte[image.getPlaneCount()][numPixels];
      for (int p = 0; p < planes.length; p++) {
         float[] samples = image.getPlane(p);
         for (int i = 0; i < numPixels; i++) {
            planes[p][i] = (byte) Math.round(clip(samples[i], MAX_16BIT) / 257f);
         }
      }
      ImageProcessor ip;
      if (image.isColor()) {
         ColorProcessor cp = new ColorProcessor(image.getWidth(), image.getHeight());
         cp.setRGB(planes[0], planes[1], planes[2]);
         ip = cp;
      } else {
         ip = new ByteProcessor(image.getWidth(), image.getHeight(), planes[0]);
      }
      return new ImagePlus(title, ip);
   }

   private static ImagePlus toFloat(Image image, String title) {
      if (!image.isColor()) {
         return new ImagePlus(title, new FloatProcessor(image.getWidth(), image.getHeight(),
               image.getPlane(0).clone()));
      }
      ImageStack stack = new ImageStack(image.getWidth(), image.getHeight());
      for (int p = 0; p < image.getPlaneCount(); p++) {
         stack.addSlice(new FloatProcessor(image.getWidth(), image.getHeight(),
               image.getPlane(p).clone()));
      }
      return new ImagePlus(title, stack);
   }

   private static float clip(float v, float max) {
      if (Float.isNaN(v) || v < 0) {
         return 0f;
      }
      return Math.min(v, max);
   }
}
