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

/**
 * A frame could not be registered onto the stack. Recoverable: the frame is stacked
 * unaligned.
 */
public class AlignmentException extends Exception {

   public AlignmentException(String message) {
      super(message);
   }
}
