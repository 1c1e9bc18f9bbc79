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
import ij.io.Opener;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.livestack.stackj.main.Image;
import org.livestack.stackj.util.BayerNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads image files into canonical images. FITS and TIFF go through ImageJ, everything
 * else is treated as camera raw and needs a {@link RawDecoder}.
 */
public class ImageReader {

   private static final Logger logger_ = LoggerFactory.getLogger(ImageReader.class);

   private static final Pattern BAYERPAT = Pattern.compile("BAYERPAT\\s*=\\s*'\\s*([^'\\s]*)\\s*'");

   private final RawDecoder rawDecoder_;

   public ImageReader() {
      this(null);
   }

   /**
    * @param rawDecoder decoder for camera raw files, or null if they are not supported
    */
   public ImageReader(RawDecoder rawDecoder) {
      rawDecoder_ = rawDecoder;
   }

   /**
    * Hidden, temporary and editor backup files are never read
    */
   public static boolean isIgnored(String fileName) {
      return fileName.startsWith(".") || fileName.startsWith("~") || fileName.startsWith("tmp");
   }

   public static boolean isFits(String fileName) {
      String ext = extension(fileName);
      return ext.equals("fits") || ext.equals("fit") || ext.equals("fts");
   }

   public static boolean isTiff(String fileName) {
      String ext = extension(fileName);
      return ext.equals("tif") || ext.equals("tiff");
   }

   public Image read(Path file) throws ImageReadException {
      String name = file.getFileName().toString();
      Image image;
      if (isFits(name) || isTiff(name)) {
         try {
            image = readWithImageJ(file, isFits(name));
         } catch (RuntimeException e) {
            throw new ImageReadException("Corrupt image file " + file + ": " + e, e);
         }
      } else {
         image = readRaw(file);
      }
      image.setOrigin("FILE : " + file);
      logger_.debug("Read {}", image);
      return image;
   }

   private Image readWithImageJ(Path file, boolean fits) throws ImageReadException {
      ImagePlus imp = new Opener().openImage(file.toString());
      if (imp == null) {
         throw new ImageReadException("ImageJ could not open " + file);
      }
      int width = imp.getWidth();
      int height = imp.getHeight();
      float[][] planes;
      if (imp.getProcessor() instanceof ColorProcessor) {
         byte[][] rgb = new byte[3][width * height];
         ((ColorProcessor) imp.getProcessor()).getRGB(rgb[0], rgb[1], rgb[2]);
         planes = new float[3][width * height];
         for (int c = 0; c < 3; c++) {
            for (int i = 0; i < rgb[c].length; i++) {
               planes[c][i] = rgb[c][i] & 0xff;
            }
         }
      } else if (imp.getStackSize() == 3) {
         ImageStack stack = imp.getStack();
         planes = new float[3][];
         for (int c = 0; c < 3; c++) {
            planes[c] = toSamples(stack.getProcessor(c + 1), fits);
         }
      } else {
         planes = new float[][]{toSamples(imp.getProcessor(), fits)};
      }
      Image image = new Image(width, height, planes, null);
      if (fits && planes.length == 1) {
         String pattern = bayerPatternFromHeader(imp.getInfoProperty());
         if (pattern != null) {
            image.setBayerPattern(pattern);
         }
      }
      return image;
   }

   private Image readRaw(Path file) throws ImageReadException {
      if (rawDecoder_ == null) {
         throw new ImageReadException("Unsupported file format: " + file.getFileName());
      }
      RawFrame raw;
      try {
         raw = rawDecoder_.decode(file);
      } catch (IOException | RuntimeException e) {
         throw new ImageReadException("Could not decode raw file " + file, e);
      }
      if (raw == null) {
         throw new ImageReadException("Raw decoder returned no frame for " + file);
      }
      String pattern = BayerNormalizer.normalize(raw.rawPattern_, raw.colorDescription_);
      Image image;
      try {
         image = new Image(raw.width_, raw.height_, raw.samples_);
      } catch (RuntimeException e) {
         throw new ImageReadException("Bad raw frame geometry in " + file + ": "
               + e.getMessage(), e);
      }
      image.setBayerPattern(pattern);
      return image;
   }

   /**
    * @return the BAYERPAT value of a FITS header, or null if absent or not a usable pattern
    */
   static String bayerPatternFromHeader(String header) {
      if (header == null) {
         return null;
      }
      Matcher m = BAYERPAT.matcher(header);
      if (!m.find()) {
         return null;
      }
      String pattern = m.group(1).toUpperCase(Locale.ROOT);
      if (!BayerNormalizer.isValidPattern(pattern)) {
         logger_.warn("Ignoring invalid BAYERPAT header value {}", pattern);
         return null;
      }
      return pattern;
   }

   private static float[] toSamples(ImageProcessor ip, boolean fits) {
      ImageProcessor fp = ip.convertToFloat();
      if (fp == ip) {
         fp = ip.duplicate();
      }
      if (fits) {
         // ImageJ shows FITS bottom-up, the filter pattern refers to storage order
         fp.flipVertical();
      }
      return (float[]) fp.getPixels();
   }

   private static String extension(String fileName) {
      int dot = fileName.lastIndexOf('.');
      return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
   }
}
