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

import org.livestack.stackj.main.Image;

/**
 * One per-frame transformation inside a processing pipeline. Stages are run in order on
 * the pipeline's own thread and must not keep state that depends on previous frames.
 */
public interface ImageStage {

   /**
    * @param image the frame, owned by the stage for the duration of the call
    * @return the transformed frame (which may be the same instance), or null to drop the
    * frame from the pipeline
    */
   public Image process(Image image);

}
