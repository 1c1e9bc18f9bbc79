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

import org.livestack.stackj.api.MessageHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Message hub that writes everything to the log
 */
public class LoggingMessageHub implements MessageHub {

   private static final Logger logger_ = LoggerFactory.getLogger(LoggingMessageHub.class);

   @Override
   public void dispatchInfo(String key, Object... args) {
      logger_.info(key, args);
   }

   @Override
   public void dispatchWarning(String key, Object... args) {
      logger_.warn(key, args);
   }

   @Override
   public void dispatchError(String key, Object... args) {
      logger_.error(key, args);
   }
}
