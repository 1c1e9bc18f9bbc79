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
package org.livestack.stackj.example;

import mmcorej.org.json.JSONObject;
import org.livestack.stackj.api.ImageSaver;
import org.livestack.stackj.main.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a minimal implementation of an ImageSaver meant for demonstration purposes only.
 * It acts as a black hole, immediately discarding every image it receives forever.
 * In practice, savers should instead do something useful (e.g. write to disk or publish)
 * with the images they receive
 */
public class BlackHoleImageSaver implements ImageSaver {

   private static final Logger logger_ = LoggerFactory.getLogger(BlackHoleImageSaver.class);

   private volatile boolean finished_ = false;
   private volatile boolean somethingSaved_ = false;
   private volatile int count_ = 0;

   @Override
   public void initialize(JSONObject summaryMetadata) {

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
   public synchronized Object putImage(Image image) {
      somethingSaved_ = true;
      count_++;
      logger_.debug("throwing away {} forever", image.getDestination());
      return null;
   }

   @Override
   public boolean anythingSaved() {
      return somethingSaved_;
   }

   public int getCount() {
      return count_;
   }
}
