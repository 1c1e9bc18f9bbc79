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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.livestack.stackj.internal.NotificationHandler;
import org.livestack.stackj.internal.SignalingQueue;

/**
 * Runtime state shared by one session controller and its workers: the queues, the
 * session status, worker busy flags as seen through notifications, the current stack size
 * and the latest processed image. One instance per controller.
 */
public class SessionContext {

   public static final String PRE_PROCESS = "pre-process";
   public static final String STACKER = "stacker";
   public static final String POST_PROCESS = "post-process";
   public static final String SAVER = "saver";

   private final NotificationHandler notificationHandler_;
   private final Session session_;
   private final SignalingQueue preProcessQueue_;
   private final SignalingQueue stackerQueue_;
   private final SignalingQueue postProcessQueue_;
   private final SignalingQueue saverQueue_;
   private final Map<String, Boolean> busy_ = new ConcurrentHashMap<>();
   private volatile int stackSize_ = 0;
   private volatile Image postProcessResult_;
   private volatile boolean hasNewWarnings_ = false;

   public SessionContext() {
      this(new NotificationHandler());
   }

   public SessionContext(NotificationHandler notificationHandler) {
      notificationHandler_ = notificationHandler;
      session_ = new Session(notificationHandler);
      preProcessQueue_ = new SignalingQueue(PRE_PROCESS, notificationHandler);
      stackerQueue_ = new SignalingQueue(STACKER, notificationHandler);
      postProcessQueue_ = new SignalingQueue(POST_PROCESS, notificationHandler);
      saverQueue_ = new SignalingQueue(SAVER, notificationHandler);
   }

   public NotificationHandler getNotificationHandler() {
      return notificationHandler_;
   }

   public Session getSession() {
      return session_;
   }

   public SignalingQueue getPreProcessQueue() {
      return preProcessQueue_;
   }

   public SignalingQueue getStackerQueue() {
      return stackerQueue_;
   }

   public SignalingQueue getPostProcessQueue() {
      return postProcessQueue_;
   }

   public SignalingQueue getSaverQueue() {
      return saverQueue_;
   }

   public void setBusy(String workerName, boolean busy) {
      busy_.put(workerName, busy);
   }

   /**
    * Busy as last reported by the worker's notifications
    */
   public boolean isBusy(String workerName) {
      return busy_.getOrDefault(workerName, false);
   }

   public int getStackSize() {
      return stackSize_;
   }

   public void setStackSize(int stackSize) {
      stackSize_ = stackSize;
   }

   public Image getPostProcessResult() {
      return postProcessResult_;
   }

   public void setPostProcessResult(Image result) {
      postProcessResult_ = result;
   }

   public boolean hasNewWarnings() {
      return hasNewWarnings_;
   }

   public void setHasNewWarnings(boolean hasNewWarnings) {
      hasNewWarnings_ = hasNewWarnings;
   }
}
