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
package org.livestack.stackj.api;

import mmcorej.org.json.JSONObject;
import org.livestack.stackj.main.Image;

/**
 * Where finished images are sent for persistence. Images always arrive with their
 * destination set, in the form folder/filename.extension
 */
public interface ImageSaver {

   /**
    * Called once when the session controller is created
    *
    * @param summaryMetadata the session settings
    */
   public void initialize(JSONObject summaryMetadata);

   /**
    * Called when no more images will be saved. Block until all relevant resources are freed.
    */
   public void finish();

   /**
    * Is this saver and all associated resources complete (e.g. all data written to disk)
    */
   public boolean isFinished();

   /**
    * Persist an image. Do not return until the image is written.
    *
    * @param image image with {@link Image#getDestination()} set
    * @return an optional object describing where the image ended up
    */
   public Object putImage(Image image);

   /**
    * Has putImage been called yet?
    */
   public boolean anythingSaved();

}
