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
package org.livestack.stackj.main;

/**
 * A session could not change state. Carries a short title and a longer explanation for
 * display.
 */
public class SessionException extends Exception {

   private final String title_;
   private final String details_;

   public SessionException(String title, String details) {
      super(title + " : " + details);
      title_ = title;
      details_ = details;
   }

   public SessionException(String title, String details, Throwable cause) {
      super(title + " : " + details, cause);
      title_ = title;
      details_ = details;
   }

   public String getTitle() {
      return title_;
   }

   public String getDetails() {
      return details_;
   }
}
