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
import org.livestack.stackj.main.SessionException;
import org.livestack.stackj.main.SessionStatus;

/**
 * General interface for live stacking sessions
 */
public interface SessionAPI {

   /**
    * Start ingesting images, or resume a paused session. The current stack is kept; call
    * {@link #resetStack()} first to start from scratch.
    *
    * @throws SessionException if a required folder is missing or the input cannot start.
    * The session status is unchanged in that case.
    */
   public void startSession() throws SessionException;

   /**
    * Stop ingesting new images. Images already queued are still processed.
    */
   public void pauseSession();

   /**
    * Stop ingesting and drop every image still waiting in the processing queues
    */
   public void stopSession();

   /**
    * Discard the accumulated stack
    */
   public void resetStack();

   /**
    * Run post-processing again on the latest stack result, e.g. after a stage setting
    * changed. Ignored while the stack is empty or post-processing is still busy.
    */
   public void applyProcessing();

   /**
    * Save the latest processed image as the session's final image
    */
   public void saveFinalImage();

   /**
    * Stop the session if needed, then all workers. The controller can't be used afterwards.
    */
   public void shutdown();

   public SessionStatus getStatus();

   public int getStackSize();

   /**
    * @return the latest post-processed image, or null
    */
   public Image getPostProcessResult();

   public void setStackingMode(String mode);

   public String getStackingMode();

   public void setAlignBeforeStack(boolean align);

   public boolean isAlignBeforeStack();

   public void setSaveEveryImage(boolean save);

   public boolean isSaveEveryImage();

   /**
    * Add a SessionNotificationListener to receive asynchronous notifications about the session
    */
   public void addSessionNotificationListener(SessionNotificationListener listener);

   public void addModelObserver(ModelObserver observer);

   public void removeModelObserver(ModelObserver observer);

}
