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
package org.livestack.stackj.internal;

import org.livestack.stackj.main.SessionContext;

/**
 * Holds an input source back until downstream has caught up: both the pre-process and the
 * stacker queues are empty and neither worker is busy. Admits one frame at a time into the
 * pipeline. Releases as soon as the session is stopped.
 */
public class BackpressureGate {

   public static final long DEFAULT_POLL_INTERVAL_MS = 100;

   private final SessionContext context_;
   private final QueueWorker preProcessor_;
   private final QueueWorker stacker_;
   private final long pollIntervalMs_;

   public BackpressureGate(SessionContext context, QueueWorker preProcessor,
                           QueueWorker stacker) {
      this(context, preProcessor, stacker, DEFAULT_POLL_INTERVAL_MS);
   }

   public BackpressureGate(SessionContext context, QueueWorker preProcessor,
                           QueueWorker stacker, long pollIntervalMs) {
      context_ = context;
      preProcessor_ = preProcessor;
      stacker_ = stacker;
      pollIntervalMs_ = pollIntervalMs;
   }

   /**
    * Block until downstream is idle
    *
    * @return true when downstream is idle, false if the session was stopped or the thread
    * interrupted while waiting
    */
   public boolean waitForDownstream() {
      while (true) {
         if (context_.getSession().isStopped()) {
            return false;
         }
         if (isDownstreamIdle()) {
            return true;
         }
         try {
            Thread.sleep(pollIntervalMs_);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
         }
      }
   }

   public boolean isDownstreamIdle() {
      return isIdle(preProcessor_, context_.getPreProcessQueue(), SessionContext.PRE_PROCESS)
            && isIdle(stacker_, context_.getStackerQueue(), SessionContext.STACKER);
   }

   private boolean isIdle(QueueWorker worker, SignalingQueue queue, String name) {
      if (context_.isBusy(name)) {
         return false;
      }
      if (worker != null && worker.getInbox() == queue) {
         return worker.isIdle();
      }
      return queue.isEmpty() && (worker == null || !worker.isBusy());
   }
}
