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

import java.util.function.Consumer;
import org.livestack.stackj.internal.BackpressureGate;
import org.livestack.stackj.main.Image;

/**
 * Source of new frames. Implementations read images on their own thread, wait on the
 * backpressure gate before handing each one over, and report unreadable input without
 * stopping.
 */
public interface InputScanner {

   /**
    * Start looking for new images
    *
    * @throws ScannerStartException if the source cannot be started
    */
   public void start() throws ScannerStartException;

   /**
    * Stop looking for new images. Blocks until the scanner thread has exited.
    */
   public void stop();

   public void setImageListener(Consumer<Image> listener);

   public void setBackpressureGate(BackpressureGate gate);

   /**
    * Where read failures and other non fatal problems are reported
    */
   public void setMessageHub(MessageHub messageHub);

}
