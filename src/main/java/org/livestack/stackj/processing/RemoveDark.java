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

import ij.ImagePlus;
import ij.io.Opener;
import org.livestack.stackj.main.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts a master dark frame, clipping at 0. Active only while a dark is loaded.
 */
public class RemoveDark extends ImageStageBase {

   private static final Logger logger_ = LoggerFactory.getLogger(RemoveDark.class);

   private volatile Image dark_;

   public RemoveDark() {
      super(false);
   }

   /**
    * Load the master dark from any file ImageJ can open. A null or empty path unloads it.
    *
    * @return true if a dark is now loaded
    */
   public boolean loadDark(String path) {
      if (path == null || path.isEmpty()) {
         setDark(null);
         return false;
      }
      ImagePlus imp = new Opener().openImage(path);
      if (imp == null) {
         logger_.warn("Could not open master dark {}", path);
         setDark(null);
         return false;
      }
      float[] samples = (float[]) imp.getProcessor().convertToFloat().getPixels();
      setDark(new Image(imp.getWidth(), imp.getHeight(), samples.clone()));
      logger_.info("Loaded master dark {}", path);
      return true;
   }

   public void setDark(Image dark) {
      dark_ = dark;
      setActive(dark != null);
   }

   @Override
   protected Image processImage(Image image) {
      Image dark = dark_;
      if (dark == null) {
         return image;
      }
      if (dark.getWidth() != image.getWidth() || dark.getHeight() != image.getHeight()) {
         logger_.warn("Master dark {}x{} does not match {}, dark not removed",
               dark.getWidth(), dark.getHeight(), image);
         return image;
      }
      for (int p = 0; p < image.getPlaneCount(); p++) {
         float[] samples = image.getPlane(p);
         float[] darkSamples = dark.getPlane(Math.min(p, dark.getPlaneCount() - 1));
         for (int i = 0; i < samples.length; i++) {
            samples[i] = Math.max(0f, samples[i] - darkSamples[i]);
         }
      }
      return image;
   }
}
