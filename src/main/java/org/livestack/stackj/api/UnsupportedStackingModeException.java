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
 * Thrown when configuring a stacking mode name nobody knows about
 */
public class UnsupportedStackingModeException extends IllegalArgumentException {

   private final String mode_;

   public UnsupportedStackingModeException(String mode) {
      super("Unsupported stacking mode: " + mode);
      mode_ = mode;
   }

   public String getMode() {
      return mode_;
   }
}
