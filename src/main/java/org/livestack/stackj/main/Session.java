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

import org.livestack.stackj.internal.NotificationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the session status and enforces the legal transitions:
 * stopped to running, running to paused or stopped, paused to running or stopped.
 */
public class Session {

   private static final Logger logger_ = LoggerFactory.getLogger(Session.class);

   private final NotificationHandler notificationHandler_;
   private volatile SessionStatus status_ = SessionStatus.STOPPED;

   public Session(NotificationHandler notificationHandler) {
      notificationHandler_ = notificationHandler;
   }

   public SessionStatus getStatus() {
      return status_;
   }

   public boolean isStopped() {
      return status_ == SessionStatus.STOPPED;
   }

   public boolean isRunning() {
      return status_ == SessionStatus.RUNNING;
   }

   public boolean isPaused() {
      return status_ == SessionStatus.PAUSED;
   }

   /**
    * Move to a new status. Requesting the current status does nothing.
    *
    * @return true if the status changed
    * @throws IllegalStateException if the transition is not allowed
    */
   public synchronized boolean setStatus(SessionStatus next) {
      if (next == status_) {
         return false;
      }
      if (!status_.canTransitionTo(next)) {
         throw new IllegalStateException("Illegal session transition: " + status_ + " -> " + next);
      }
      logger_.debug("Session status {} -> {}", status_, next);
      status_ = next;
      if (notificationHandler_ != null) {
         notificationHandler_.postNotification(
               SessionNotification.createStatusChangedNotification(next));
      }
      return true;
   }
}
