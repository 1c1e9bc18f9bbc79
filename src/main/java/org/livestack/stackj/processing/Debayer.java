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
 * Bilinear demosaicing of raw color filter data. Each output sample is the mean of the
 * samples of that color in the 3x3 neighbourhood. Images without a bayer pattern pass
 * through.
 */
public class Debayer extends ImageStageBase {

   public Debayer() {
      super(true);
   }

   @Override
   protected Image processImage(Image image) {
      if (!image.needsDebayering()) {
         return image;
      }
      String pattern = image.getBayerPattern();
      int width = image.getWidth();
      int height = image.getHeight();
      float[] raw = image.getPlane(0);
      float[][] rgb = new float[3][width * height];
      for (int y = 0; y < height; y++) {
         for (int x = 0; x < width; x++) {
            float[] sums = new float[3];
            int[] counts = new int[3];
            for (int yy = Math.max(0, y - 1); yy <= Math.min(height - 1, y + 1); yy++) {
               for (int xx = Math.max(0, x - 1); xx <= Math.min(width - 1, x + 1); xx++) {
                  int c = colorAt(pattern, xx, yy);
                  sums[c] += raw[yy * width + xx];
                  counts[c]++;
               }
            }
            int own = colorAt(pattern, x, y);
            for (int c = 0; c < 3; c++) {
               if (c == own) {
                  rgb[c][y * width + x] = raw[y * width + x];
               } else {
                  rgb[c][y * width + x] = counts[c] == 0 ? 0f : sums[c] / counts[c];
               }
            }
         }
      }
      Image color = image.withPlanes(rgb);
      color.setBayerPattern("");
      return color;
   }

   /**
    * @return 0, 1 or 2 for the red, green or blue filter over pixel x, y
    */
   static int colorAt(String pattern, int x, int y) {
      switch (pattern.charAt((y % 2) * 2 + x % 2)) {
         case 'R':
            return 0;
         case 'G':
            return 1;
         case 'B':
            return 2;
         default:
            throw new IllegalArgumentException("Unsupported bayer pattern " + pattern);
      }
   }
}
