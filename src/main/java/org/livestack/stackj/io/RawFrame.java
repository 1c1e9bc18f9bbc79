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

/**
 * Undemosaiced sensor data as returned by a {@link RawDecoder}, with the decoder's own
 * description of the color filter grid
 */
public class RawFrame {

   public final float[] samples_;
   public final int width_;
   public final int height_;
   public final int[] rawPattern_;
   public final String colorDescription_;

   /**
    * @param samples row-major sensor values
    * @param rawPattern 2x2 grid of indices into colorDescription, row-major
    * @param colorDescription one color letter per index, e.g. RGBG
    */
   public RawFrame(float[] samples, int width, int height, int[] rawPattern,
                   String colorDescription) {
      samples_ = samples;
      width_ = width;
      height_ = height;
      rawPattern_ = rawPattern;
      colorDescription_ = colorDescription;
   }
}
