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

import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;

/**
 * Typed message posted by queues, workers and the session. Delivered asynchronously by
 * the {@link org.livestack.stackj.internal.NotificationHandler}.
 */
public class SessionNotification {

   public class Status {
      public static final String STATUS_CHANGED = "status_changed";
   }

   public class Queue {
      public static final String SIZE_CHANGED = "size_changed";
   }

   public class Worker {
      public static final String BUSY = "busy";
      public static final String WAITING = "waiting";
      public static final String NEW_RESULT = "new_result";
      public static final String ERROR = "error";
   }

   public class Stack {
      public static final String SIZE_CHANGED = "stack_size_changed";
      public static final String ALIGNMENT_FAILED = "alignment_failed";
   }

   public class Saver {
      public static final String IMAGE_SAVED = "image_saved";
   }

   public static String notificationTypeToString(Class type) {
      if (type.equals(Status.class)) {
         return "session";
      } else if (type.equals(Queue.class)) {
         return "queue";
      } else if (type.equals(Worker.class)) {
         return "worker";
      } else if (type.equals(Stack.class)) {
         return "stack";
      } else if (type.equals(Saver.class)) {
         return "saver";
      } else {
         throw new RuntimeException("Unknown notification type");
      }
   }

   final public String type_;
   final public String source_;
   final public String phase_;
   final int value_;
   final String message_;
   final Image image_;

   public SessionNotification(Class type, String source, String phase) {
      this(type, source, phase, 0, null, null);
   }

   private SessionNotification(Class type, String source, String phase, int value,
                               String message, Image image) {
      type_ = notificationTypeToString(type);
      source_ = source;
      phase_ = phase;
      value_ = value;
      message_ = message;
      image_ = image;
   }

   public static SessionNotification createStatusChangedNotification(SessionStatus status) {
      return new SessionNotification(Status.class, "session", Status.STATUS_CHANGED,
            status.ordinal(), status.toString(), null);
   }

   public static SessionNotification createQueueSizeChangedNotification(String queueName,
                                                                        int size) {
      return new SessionNotification(Queue.class, queueName, Queue.SIZE_CHANGED, size, null,
            null);
   }

   public static SessionNotification createBusyNotification(String workerName) {
      return new SessionNotification(Worker.class, workerName, Worker.BUSY);
   }

   public static SessionNotification createWaitingNotification(String workerName) {
      return new SessionNotification(Worker.class, workerName, Worker.WAITING);
   }

   public static SessionNotification createNewResultNotification(String workerName,
                                                                 Image result) {
      return new SessionNotification(Worker.class, workerName, Worker.NEW_RESULT, 0, null,
            result);
   }

   public static SessionNotification createWorkerErrorNotification(String workerName,
                                                                   String message) {
      return new SessionNotification(Worker.class, workerName, Worker.ERROR, 0, message, null);
   }

   public static SessionNotification createStackSizeChangedNotification(String stackerName,
                                                                        int size) {
      return new SessionNotification(Stack.class, stackerName, Stack.SIZE_CHANGED, size, null,
            null);
   }

   public static SessionNotification createAlignmentFailedNotification(String stackerName,
                                                                      String message) {
      return new SessionNotification(Stack.class, stackerName, Stack.ALIGNMENT_FAILED, 0,
            message, null);
   }

   public static SessionNotification createImageSavedNotification(String saverName,
                                                                 String destination) {
      return new SessionNotification(Saver.class, saverName, Saver.IMAGE_SAVED, 0,
            destination, null);
   }

   /**
    * Queue size, stack size or status ordinal, depending on the notification
    */
   public int getValue() {
      return value_;
   }

   public String getMessage() {
      return message_;
   }

   /**
    * The published result for new result notifications, null otherwise
    */
   public Image getImage() {
      return image_;
   }

   public boolean is(Class type, String phase) {
      return type_.equals(notificationTypeToString(type)) && phase_.equals(phase);
   }

   public JSONObject toJSON() throws JSONException {
      JSONObject message = new JSONObject();
      message.put("type", type_);
      message.put("phase", phase_);
      if (source_ != null) {
         message.put("source", source_);
      }
      message.put("value", value_);
      if (message_ != null) {
         message.put("message", message_);
      }
      return message;
   }

   @Override
   public String toString() {
      return type_ + "/" + phase_ + " from " + source_
            + (phase_.equals(Worker.NEW_RESULT) ? "" : " (" + value_ + ")");
   }
}
