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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import org.livestack.stackj.api.SessionNotificationListener;
import org.livestack.stackj.main.SessionNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class that handles asynchronous notifications from the queues, workers and session.
 * Runs a dedicated thread that stores notifications and dispatches them to listeners, in
 * the order they were posted.
 */
public class NotificationHandler {

   private static final Logger logger_ = LoggerFactory.getLogger(NotificationHandler.class);

   private static final SessionNotification SHUTDOWN = new SessionNotification(
         SessionNotification.Status.class, "notification handler", "shutdown");

   private final ExecutorService executor_ = Executors.newSingleThreadExecutor(r ->
         new Thread(r, "Session Notification Thread"));
   private final LinkedBlockingDeque<SessionNotification> notificationQueue_ =
         new LinkedBlockingDeque<>();
   private final List<SessionNotificationListener> listeners_ = new CopyOnWriteArrayList<>();
   private final Map<SessionNotification, CountDownLatch> flushMarkers_ =
         new ConcurrentHashMap<>();

   public NotificationHandler() {
      executor_.submit(() -> {
         while (true) {
            SessionNotification n;
            try {
               n = notificationQueue_.takeFirst();
            } catch (InterruptedException e) {
               logger_.warn("Notification thread interrupted, {} notifications dropped",
                     notificationQueue_.size());
               Thread.currentThread().interrupt();
               break;
            }
            if (n == SHUTDOWN) {
               break;
            }
            CountDownLatch flushed = flushMarkers_.remove(n);
            if (flushed != null) {
               flushed.countDown();
               continue;
            }
            for (SessionNotificationListener l : listeners_) {
               try {
                  l.postNotification(n);
               } catch (RuntimeException e) {
                  logger_.error("Notification listener failed on " + n, e);
               }
            }
         }
      });
   }

   public void postNotification(SessionNotification notification) {
      notificationQueue_.add(notification);
      if (notificationQueue_.size() > 500) {
         logger_.warn("Session notification queue size: {}", notificationQueue_.size());
      }
   }

   public void addListener(SessionNotificationListener listener) {
      listeners_.add(listener);
   }

   public void removeListener(SessionNotificationListener listener) {
      listeners_.remove(listener);
   }

   /**
    * Block until every notification posted before this call has been delivered
    *
    * @return false if that did not happen within the timeout
    */
   public boolean flush(long timeout, TimeUnit unit) throws InterruptedException {
      SessionNotification marker = new SessionNotification(
            SessionNotification.Status.class, "notification handler", "flush");
      CountDownLatch flushed = new CountDownLatch(1);
      flushMarkers_.put(marker, flushed);
      notificationQueue_.add(marker);
      if (flushed.await(timeout, unit)) {
         return true;
      }
      flushMarkers_.remove(marker);
      return false;
   }

   /**
    * Deliver everything already posted, then stop the notification thread
    */
   public void shutdown() {
      notificationQueue_.add(SHUTDOWN);
      executor_.shutdown();
      try {
         if (!executor_.awaitTermination(5, TimeUnit.SECONDS)) {
            logger_.warn("Notification thread did not finish in time");
            executor_.shutdownNow();
         }
      } catch (InterruptedException e) {
         executor_.shutdownNow();
         Thread.currentThread().interrupt();
      }
   }
}
