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
 * Registers a frame onto the geometry of a reference image
 */
public interface Aligner {

   /**
    * @param reference image whose geometry the frame is aligned to. Must not be modified.
    * @param frame the frame to align
    * @return the resampled frame
    * @throws AlignmentException if no reliable transform could be found
    */
   public Image align(Image reference, Image frame) throws AlignmentException;

}
