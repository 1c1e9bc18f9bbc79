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
package org.livestack.stackj.util;

/**
 * Turns the Bayer description reported by raw decoders into a standard pattern string.
 *
 * <p>Decoders describe the sensor as a 2x2 grid of color indices, read row by row, plus a
 * color description string. Entry i of the pattern is the color the index at grid position i
 * points to: indices [0, 1, 3, 2] with description "RGBG" give "RGGB".</p>
 */
public class BayerNormalizer {

   private static final int GRID_CELLS = 4;

   private BayerNormalizer() {
   }

   /**
    * @param indices color indices of the 2x2 grid, row-major
    * @param description color letter for each index
    * @return the 4 letter pattern
    * @throws MalformedBayerMetadataException if indices and description disagree
    */
   public static String normalize(int[] indices, String description)
         throws MalformedBayerMetadataException {
      if (indices == null || description == null) {
         throw new MalformedBayerMetadataException("Missing bayer indices or color description");
      }
      if (indices.length != description.length()) {
         throw new MalformedBayerMetadataException("Bayer grid has " + indices.length
               + " cells but color description \"" + description + "\" has "
               + description.length());
      }
      if (indices.length != GRID_CELLS) {
         throw new MalformedBayerMetadataException("Bayer grid must be 2x2, got "
               + indices.length + " cells");
      }
      StringBuilder pattern = new StringBuilder(GRID_CELLS);
      for (int index : indices) {
         if (index < 0 || index >= indices.length) {
            throw new MalformedBayerMetadataException("Bayer color index " + index
                  + " out of range");
         }
         pattern.append(description.charAt(index));
      }
      return pattern.toString();
   }

   /**
    * A usable pattern has 4 letters from R, G and B, with each color present at least once
    */
   public static boolean isValidPattern(String pattern) {
      if (pattern == null || pattern.length() != GRID_CELLS) {
         return false;
      }
      boolean r = false;
      boolean g = false;
      boolean b = false;
      for (char c : pattern.toCharArray()) {
         switch (c) {
            case 'R':
               r = true;
               break;
            case 'G':
               g = true;
               break;
            case 'B':
               b = true;
               break;
            default:
               return false;
         }
      }
      return r && g && b;
   }
}
